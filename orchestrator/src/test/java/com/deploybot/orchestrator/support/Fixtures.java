package com.deploybot.orchestrator.support;

import com.deploybot.orchestrator.config.BackendSettings;
import com.deploybot.orchestrator.config.DeployProperties;
import com.deploybot.orchestrator.config.ProjectCatalog;
import com.deploybot.orchestrator.config.ProjectSettings;
import com.deploybot.orchestrator.model.ApprovalState;
import com.deploybot.orchestrator.model.ServiceTarget;
import com.deploybot.orchestrator.model.WorkflowRequest;
import com.deploybot.orchestrator.repository.ConfigOverrideRepository;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Shared builders for tests. */
public final class Fixtures {

    public static final String PROJECT = "shop";

    private Fixtures() {}

    public static BackendSettings backend(String baseUrl, int maxConcurrentBuilds) {
        return new BackendSettings(true, baseUrl, "deploybot", "token", "auth-token", "Bearer sso",
                "10572", maxConcurrentBuilds, Map.of("UAT", "uat"));
    }

    public static ProjectSettings project(BackendSettings jenkins, BackendSettings sso) {
        return new ProjectSettings(PROJECT, Set.of("alice", "bob"), Set.of("carol"), null, true, null, jenkins, sso);
    }

    /** Millisecond timings so asynchronous tests finish quickly. */
    public static DeployProperties properties(ProjectSettings... projects) {
        return properties(new DeployProperties.Monitor(Duration.ofMillis(20), 50, Duration.ofMinutes(1),
                3, Duration.ofMillis(5), 2), projects);
    }

    public static DeployProperties properties(DeployProperties.Monitor monitor, ProjectSettings... projects) {
        Map<String, ProjectSettings> byName = new HashMap<>();
        for (ProjectSettings p : projects) byName.put(p.name(), p);
        return new DeployProperties(
                monitor,
                new DeployProperties.Dispatch(4, Duration.ofMillis(10), Duration.ofSeconds(2), Duration.ofMillis(10)),
                null, null, null, byName);
    }

    public static ProjectCatalog catalog(DeployProperties properties) {
        // An unstubbed mock answers with an empty override list.
        return new ProjectCatalog(properties, Mockito.mock(ConfigOverrideRepository.class));
    }

    public static WorkflowRequest workflow(String... services) {
        List<ServiceTarget> targets = new ArrayList<>();
        for (int i = 0; i < services.length; i++) {
            targets.add(new ServiceTarget(services[i], "hash" + i));
        }
        return new WorkflowRequest(PROJECT, "UAT", "release/1.4", targets, "Fix checkout totals",
                "1001", "dave", "-100200", "77");
    }

    /** A workflow already approved by alice, as the dispatcher expects it. */
    public static WorkflowRequest approved(InMemoryWorkflowStore store, String... services) {
        WorkflowRequest wf = store.createWorkflow(workflow(services));
        store.compareAndSetApproval(wf.getId(), ApprovalState.PENDING_APPROVAL, ApprovalState.APPROVED,
                "alice", Instant.now());
        return wf;
    }
}
