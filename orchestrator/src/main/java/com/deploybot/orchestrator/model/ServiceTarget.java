package com.deploybot.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.util.Objects;

/**
 * One (service, commit hash) pair of a workflow.
 * Keeping both values in one element makes index alignment structural.
 */
@Embeddable
public class ServiceTarget {

    @Column(name = "service", nullable = false)
    private String service;

    @Column(name = "commit_hash", nullable = false)
    private String commitHash;

    protected ServiceTarget() {}   // required by JPA

    public ServiceTarget(String service, String commitHash) {
        this.service    = service;
        this.commitHash = commitHash;
    }

    public String getService()    { return service; }
    public String getCommitHash() { return commitHash; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ServiceTarget other)) return false;
        return Objects.equals(service, other.service) && Objects.equals(commitHash, other.commitHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, commitHash);
    }

    @Override
    public String toString() {
        return service + "@" + commitHash;
    }
}
