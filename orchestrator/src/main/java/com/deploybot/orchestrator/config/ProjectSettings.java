package com.deploybot.orchestrator.config;

import com.deploybot.orchestrator.model.BackendKind;
import com.deploybot.orchestrator.model.BuildStatus;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Everything the engine needs to know about one project.
 *
 * Bound from {@code deploybot.projects.<name>} and then overlaid with the
 * store overrides by ProjectCatalog. Instances are immutable; a reload
 * produces new ones.
 */
public record ProjectSettings(
        String          name,
        Set<String>     approvers,
        Set<String>     ops,
        Set<BuildStatus> opsNotifyOn,
        @DefaultValue("true") boolean announceSubmissions,
        ProxySettings   proxy,
        BackendSettings jenkins,
        BackendSettings sso
) {
    private static final Set<BuildStatus> DEFAULT_OPS_NOTIFY_ON =
            EnumSet.of(BuildStatus.FAILURE, BuildStatus.ABORTED);

    public ProjectSettings {
        approvers   = approvers == null ? Set.of() : Set.copyOf(approvers);
        ops         = ops == null ? Set.of() : Set.copyOf(ops);
        opsNotifyOn = opsNotifyOn == null || opsNotifyOn.isEmpty()
                ? DEFAULT_OPS_NOTIFY_ON : Set.copyOf(opsNotifyOn);
        proxy       = proxy == null ? ProxySettings.NONE : proxy;
        jenkins     = jenkins == null ? BackendSettings.DISABLED : jenkins;
        sso         = sso == null ? BackendSettings.DISABLED : sso;
    }

    public BackendSettings backend(BackendKind kind) {
        return switch (kind) {
            case JENKINS -> jenkins;
            case SSO     -> sso;
        };
    }

    /** Enabled backends in dispatch order: SSO first, then Jenkins. */
    public List<BackendKind> enabledBackends() {
        List<BackendKind> kinds = new ArrayList<>();
        for (BackendKind kind : BackendKind.values()) {
            if (backend(kind).enabled()) kinds.add(kind);
        }
        return kinds;
    }

    public boolean mentionsOpsOn(BuildStatus status) {
        return opsNotifyOn.contains(status);
    }

    public ProjectSettings withName(String value) {
        return new ProjectSettings(value, approvers, ops, opsNotifyOn, announceSubmissions, proxy, jenkins, sso);
    }

    public ProjectSettings withApprovers(Set<String> value) {
        return new ProjectSettings(name, value, ops, opsNotifyOn, announceSubmissions, proxy, jenkins, sso);
    }

    public ProjectSettings withOps(Set<String> value) {
        return new ProjectSettings(name, approvers, value, opsNotifyOn, announceSubmissions, proxy, jenkins, sso);
    }

    public ProjectSettings withOpsNotifyOn(Set<BuildStatus> value) {
        return new ProjectSettings(name, approvers, ops, value, announceSubmissions, proxy, jenkins, sso);
    }

    public ProjectSettings withAnnounceSubmissions(boolean value) {
        return new ProjectSettings(name, approvers, ops, opsNotifyOn, value, proxy, jenkins, sso);
    }

    public ProjectSettings withBackend(BackendKind kind, BackendSettings value) {
        return switch (kind) {
            case JENKINS -> new ProjectSettings(name, approvers, ops, opsNotifyOn, announceSubmissions, proxy, value, sso);
            case SSO     -> new ProjectSettings(name, approvers, ops, opsNotifyOn, announceSubmissions, proxy, jenkins, value);
        };
    }
}
