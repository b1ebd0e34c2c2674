package com.deploybot.orchestrator.model;

import jakarta.persistence.*;

/**
 * A per-project setting stored in the database that wins over the value
 * from application.yml. Applied by ProjectCatalog.reload().
 *
 * DB table: config_overrides  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "config_overrides",
       uniqueConstraints = @UniqueConstraint(columnNames = {"project", "config_key"}))
public class ConfigOverride {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String project;

    @Column(name = "config_key", nullable = false)
    private String key;

    @Column(name = "config_value", columnDefinition = "TEXT")
    private String value;

    protected ConfigOverride() {}   // required by JPA

    public ConfigOverride(String project, String key, String value) {
        this.project = project;
        this.key     = key;
        this.value   = value;
    }

    public Long   getId()      { return id; }
    public String getProject() { return project; }
    public String getKey()     { return key; }
    public String getValue()   { return value; }
}
