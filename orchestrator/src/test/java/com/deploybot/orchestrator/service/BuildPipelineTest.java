package com.deploybot.orchestrator.service;

import com.deploybot.orchestrator.backend.BackendClient;
import com.deploybot.orchestrator.backend.BackendRegistry;
import com.deploybot.orchestrator.backend.BuildObservation;
import com.deploybot.orchestrator.backend.BuildRequest;
import com.deploybot.orchestrator.config.BackendSettings;
import com.deploybot.orchestrator.config.DeployProperties;
import com.deploybot.orchestrator.config.ProjectCatalog;
import com.deploybot.orchestrator.model.ApprovalAction;
import com.deploybot.orchestrator.model.BackendKind;
import com.deploybot.orchestrator.model.BuildStatus;
import com.deploybot.orchestrator.model.CompositeState;
import com.deploybot.orchestrator.model.WorkflowRequest;
import com.deploybot.orchestrator.monitor.AdmissionGate;
import com.deploybot.orchestrator.monitor.BuildMonitor;
import com.deploybot.orchestrator.notify.BuildNotifier;
import com.deploybot.orchestrator.support.Fixtures;
import com.deploybot.orchestrator.support.InMemoryWorkflowStore;
import com.deploybot.orchestrator.sync.DecisionSyncClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static com.deploybot.orchestrator.support.Fixtures.PROJECT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Approval through dispatch, monitoring and completion with every component
 * real except the backend client, the notifier and the sync client.
 */
@ExtendWith(MockitoExtension.class)
class BuildPipelineTest {

    @Mock BackendClient      jenkins;
    @Mock BuildNotifier      notifier;
    @Mock DecisionSyncClient sync;

    InMemoryWorkflowStore    store;
    ExecutorService          executor;
    ScheduledExecutorService scheduler;
    AdmissionGate            gate;
    ApprovalService          approvals;

    @BeforeEach
    void setUp() {
        store     = new InMemoryWorkflowStore();
        executor  = Executors.newFixedThreadPool(4);
        scheduler = Executors.newScheduledThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        scheduler.shutdownNow();
    }

    private void wire(int maxConcurrentBuilds) {
        when(jenkins.kind()).thenReturn(BackendKind.JENKINS);
        DeployProperties properties = Fixtures.properties(
                Fixtures.project(Fixtures.backend("http://jenkins", maxConcurrentBuilds), BackendSettings.DISABLED));
        ProjectCatalog catalog = Fixtures.catalog(properties);
        SimpleMeterRegistry metrics = new SimpleMeterRegistry();
        BackendRegistry registry = new BackendRegistry(List.of(jenkins));
        CompletionService completion = new CompletionService(store, notifier);
        gate = new AdmissionGate(catalog);
        BuildMonitor monitor = new BuildMonitor(store, registry, catalog, completion, scheduler, properties, metrics);
        DispatchService dispatcher = new DispatchService(store, catalog, registry, gate, monitor, completion,
                notifier, executor, properties, metrics);
        approvals = new ApprovalService(store, catalog, dispatcher, notifier, sync, executor, metrics);
    }

    @Test
    void ceilingOfOne_buildsRunOneAfterAnother() {
        wire(1);
        WorkflowRequest wf = store.createWorkflow(Fixtures.workflow("api", "web", "worker"));

        AtomicInteger maxInFlightAtSubmit = new AtomicInteger();
        AtomicInteger maxUnfinishedAtSubmit = new AtomicInteger();
        when(jenkins.submit(any(), any())).thenAnswer(inv -> {
            BuildRequest request = inv.getArgument(0);
            maxInFlightAtSubmit.accumulateAndGet(gate.inFlight(PROJECT, BackendKind.JENKINS), Math::max);
            long unfinished = store.findSubmissions(wf.getId()).stream()
                    .filter(s -> !s.getStatus().isTerminal())
                    .count();
            maxUnfinishedAtSubmit.accumulateAndGet((int) unfinished, Math::max);
            return "uat/" + request.service() + "#1";
        });
        Map<String, AtomicInteger> polls = new ConcurrentHashMap<>();
        when(jenkins.pollStatus(any(), any())).thenAnswer(inv -> {
            int n = polls.computeIfAbsent(inv.getArgument(0), k -> new AtomicInteger()).incrementAndGet();
            return BuildObservation.of(n < 3 ? BuildStatus.RUNNING : BuildStatus.SUCCESS);
        });

        approvals.decide(wf.getId(), ApprovalAction.APPROVE, "alice");

        await().atMost(Duration.ofSeconds(10))
                .until(() -> store.findWorkflow(wf.getId()).orElseThrow().getCompositeState() == CompositeState.COMPLETED);
        assertThat(maxInFlightAtSubmit.get()).isEqualTo(1);
        assertThat(maxUnfinishedAtSubmit.get()).isZero();
        assertThat(store.findSubmissions(wf.getId()))
                .hasSize(3)
                .allMatch(s -> s.getStatus() == BuildStatus.SUCCESS);
        assertThat(gate.inFlight(PROJECT, BackendKind.JENKINS)).isZero();
        verify(notifier, times(1)).completed(any(), eq(CompositeState.COMPLETED), anyList());
    }

    @Test
    void ceilingOfOne_holdsAcrossTwoWorkflowsApprovedTogether() {
        wire(1);
        WorkflowRequest first = store.createWorkflow(Fixtures.workflow("api", "web"));
        WorkflowRequest second = store.createWorkflow(Fixtures.workflow("api", "worker"));

        AtomicInteger maxInFlightAtSubmit = new AtomicInteger();
        AtomicInteger maxUnfinishedAtSubmit = new AtomicInteger();
        when(jenkins.submit(any(), any())).thenAnswer(inv -> {
            BuildRequest request = inv.getArgument(0);
            maxInFlightAtSubmit.accumulateAndGet(gate.inFlight(PROJECT, BackendKind.JENKINS), Math::max);
            long unfinished = List.of(first, second).stream()
                    .flatMap(wf -> store.findSubmissions(wf.getId()).stream())
                    .filter(s -> !s.getStatus().isTerminal())
                    .count();
            maxUnfinishedAtSubmit.accumulateAndGet((int) unfinished, Math::max);
            return "uat/" + request.workflowId() + "/" + request.service() + "#1";
        });
        Map<String, AtomicInteger> polls = new ConcurrentHashMap<>();
        when(jenkins.pollStatus(any(), any())).thenAnswer(inv -> {
            int n = polls.computeIfAbsent(inv.getArgument(0), k -> new AtomicInteger()).incrementAndGet();
            return BuildObservation.of(n < 2 ? BuildStatus.RUNNING : BuildStatus.SUCCESS);
        });

        approvals.decide(first.getId(), ApprovalAction.APPROVE, "alice");
        approvals.decide(second.getId(), ApprovalAction.APPROVE, "bob");

        await().atMost(Duration.ofSeconds(10)).until(() ->
                store.findWorkflow(first.getId()).orElseThrow().getCompositeState() == CompositeState.COMPLETED
                        && store.findWorkflow(second.getId()).orElseThrow().getCompositeState() == CompositeState.COMPLETED);
        assertThat(maxInFlightAtSubmit.get()).isEqualTo(1);
        assertThat(maxUnfinishedAtSubmit.get()).isZero();
        verify(jenkins, times(4)).submit(any(), any());
        assertThat(gate.inFlight(PROJECT, BackendKind.JENKINS)).isZero();
        verify(notifier, times(2)).completed(any(), eq(CompositeState.COMPLETED), anyList());
    }

    @Test
    void noCeiling_allBuildsSubmittedAtOnce() {
        wire(0);
        WorkflowRequest wf = store.createWorkflow(Fixtures.workflow("api", "web", "worker"));
        when(jenkins.submit(any(), any())).thenAnswer(inv ->
                "uat/" + inv.<BuildRequest>getArgument(0).service() + "#1");
        when(jenkins.pollStatus(any(), any())).thenReturn(BuildObservation.of(BuildStatus.RUNNING));

        approvals.decide(wf.getId(), ApprovalAction.APPROVE, "alice");

        await().atMost(Duration.ofSeconds(5))
                .until(() -> gate.inFlight(PROJECT, BackendKind.JENKINS) == 3);
        await().atMost(Duration.ofSeconds(5))
                .until(() -> store.findWorkflow(wf.getId()).orElseThrow().getCompositeState() == CompositeState.MONITORING);
        verify(notifier, never()).completed(any(), any(), any());
    }
}
