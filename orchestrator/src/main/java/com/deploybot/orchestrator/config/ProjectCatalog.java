package com.deploybot.orchestrator.config;

import com.deploybot.orchestrator.model.ActorRole;
import com.deploybot.orchestrator.model.BackendKind;
import com.deploybot.orchestrator.model.BuildStatus;
import com.deploybot.orchestrator.model.ConfigOverride;
import com.deploybot.orchestrator.repository.ConfigOverrideRepository;
import com.deploybot.orchestrator.service.ApproverDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of all project settings, passed explicitly to the
 * components that need them.
 *
 * The snapshot starts from {@code deploybot.projects} and {@link #reload()}
 * overlays the rows of config_overrides. Supported override keys:
 * <pre>
 *   jenkins.enabled, sso.enabled                         true|false
 *   jenkins.max-concurrent-builds, sso.max-concurrent-builds   int
 *   approvers, ops                                       comma separated
 *   ops-notify-on                                        comma separated BuildStatus names
 *   announce-submissions                                 true|false
 * </pre>
 * A project that only exists in the table is created from scratch.
 */
@Component
public class ProjectCatalog implements ApproverDirectory {

    private static final Logger log = LoggerFactory.getLogger(ProjectCatalog.class);

    private final Map<String, ProjectSettings> base;
    private final ConfigOverrideRepository     overrides;

    private volatile Map<String, ProjectSettings> snapshot;

    public ProjectCatalog(DeployProperties properties, ConfigOverrideRepository overrides) {
        this.overrides = overrides;
        this.base = properties.projects().entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> e.getValue().withName(e.getKey())));
        this.snapshot = base;
    }

    public Optional<ProjectSettings> find(String project) {
        return Optional.ofNullable(snapshot.get(project));
    }

    /** Settings of a project, or a project with nothing enabled when it is unknown. */
    public ProjectSettings get(String project) {
        ProjectSettings settings = snapshot.get(project);
        if (settings == null) {
            log.warn("Project '{}' is not configured; treating it as having no backends", project);
            return new ProjectSettings(project, null, null, null, true, null, null, null);
        }
        return settings;
    }

    public BackendSettings backend(String project, BackendKind kind) {
        return get(project).backend(kind);
    }

    public Set<String> projectNames() {
        return new TreeSet<>(snapshot.keySet());
    }

    /**
     * Rebuild the snapshot from the configuration file plus the store overrides.
     * Readers keep seeing the previous snapshot until the new one is complete.
     */
    public synchronized Set<String> reload() {
        Map<String, ProjectSettings> next = new HashMap<>(base);
        for (ConfigOverride o : overrides.findAllByOrderByProjectAscKeyAsc()) {
            ProjectSettings current = next.getOrDefault(o.getProject(),
                    new ProjectSettings(o.getProject(), null, null, null, true, null, null, null));
            next.put(o.getProject(), apply(current, o));
        }
        snapshot = Map.copyOf(next);
        log.info("Project catalog reloaded: {}", projectNames());
        return projectNames();
    }

    @Override
    public boolean isAuthorized(String project, String actor, ActorRole role) {
        if (actor == null || actor.isBlank()) return false;
        ProjectSettings settings = snapshot.get(project);
        if (settings == null) return false;
        Set<String> members = role == ActorRole.APPROVER ? settings.approvers() : settings.ops();
        String normalized = normalizeUser(actor);
        return members.stream().map(ProjectCatalog::normalizeUser).anyMatch(normalized::equals);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ProjectSettings apply(ProjectSettings p, ConfigOverride o) {
        String value = o.getValue() == null ? "" : o.getValue().trim();
        try {
            return switch (o.getKey()) {
                case "jenkins.enabled" ->
                        p.withBackend(BackendKind.JENKINS, p.jenkins().withEnabled(Boolean.parseBoolean(value)));
                case "sso.enabled" ->
                        p.withBackend(BackendKind.SSO, p.sso().withEnabled(Boolean.parseBoolean(value)));
                case "jenkins.max-concurrent-builds" ->
                        p.withBackend(BackendKind.JENKINS, p.jenkins().withMaxConcurrentBuilds(Integer.parseInt(value)));
                case "sso.max-concurrent-builds" ->
                        p.withBackend(BackendKind.SSO, p.sso().withMaxConcurrentBuilds(Integer.parseInt(value)));
                case "approvers" -> p.withApprovers(splitList(value));
                case "ops" -> p.withOps(splitList(value));
                case "ops-notify-on" -> p.withOpsNotifyOn(splitList(value).stream()
                        .map(s -> BuildStatus.valueOf(s.toUpperCase(Locale.ROOT)))
                        .collect(Collectors.toSet()));
                case "announce-submissions" -> p.withAnnounceSubmissions(Boolean.parseBoolean(value));
                default -> {
                    log.warn("Ignoring unknown config override '{}' for project {}", o.getKey(), o.getProject());
                    yield p;
                }
            };
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring invalid config override {}={} for project {}: {}",
                    o.getKey(), o.getValue(), o.getProject(), e.getMessage());
            return p;
        }
    }

    private static Set<String> splitList(String value) {
        return Arrays.stream(value.split("[,\\s]+"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Chat usernames are compared without a leading '@' and case-insensitively. */
    static String normalizeUser(String user) {
        String u = user.trim();
        if (u.startsWith("@")) u = u.substring(1);
        return u.toLowerCase(Locale.ROOT);
    }
}
