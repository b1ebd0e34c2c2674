package com.deploybot.orchestrator.monitor;

import com.deploybot.orchestrator.config.BackendSettings;
import com.deploybot.orchestrator.config.ProjectCatalog;
import com.deploybot.orchestrator.model.BackendKind;
import com.deploybot.orchestrator.model.ConfigOverride;
import com.deploybot.orchestrator.repository.ConfigOverrideRepository;
import com.deploybot.orchestrator.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.deploybot.orchestrator.support.Fixtures.PROJECT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AdmissionGateTest {

    private static ProjectCatalog catalog(int jenkinsCeiling, ConfigOverrideRepository overrides) {
        return new ProjectCatalog(
                Fixtures.properties(Fixtures.project(Fixtures.backend("http://jenkins", jenkinsCeiling),
                        BackendSettings.DISABLED)),
                overrides);
    }

    private static AdmissionGate gate(int jenkinsCeiling) {
        return new AdmissionGate(catalog(jenkinsCeiling, mock(ConfigOverrideRepository.class)));
    }

    // ------------------------------------------------------------------
    // Ceiling
    // ------------------------------------------------------------------

    @Test
    void admit_belowCeiling_completesImmediately() {
        AdmissionGate gate = gate(2);

        assertThat(gate.admit(PROJECT, BackendKind.JENKINS)).isDone();
        assertThat(gate.admit(PROJECT, BackendKind.JENKINS)).isDone();
        assertThat(gate.inFlight(PROJECT, BackendKind.JENKINS)).isEqualTo(2);
    }

    @Test
    void admit_atCeiling_waitsUntilRelease() {
        AdmissionGate gate = gate(1);
        AdmissionGate.Permit first = gate.admit(PROJECT, BackendKind.JENKINS).join();

        CompletableFuture<AdmissionGate.Permit> second = gate.admit(PROJECT, BackendKind.JENKINS);
        assertThat(second).isNotDone();
        assertThat(gate.waiting(PROJECT, BackendKind.JENKINS)).isEqualTo(1);

        first.release();

        assertThat(second).isDone();
        assertThat(gate.inFlight(PROJECT, BackendKind.JENKINS)).isEqualTo(1);
        assertThat(gate.waiting(PROJECT, BackendKind.JENKINS)).isZero();
    }

    @Test
    void waiters_areServedInArrivalOrder() {
        AdmissionGate gate = gate(1);
        AdmissionGate.Permit holder = gate.admit(PROJECT, BackendKind.JENKINS).join();
        CompletableFuture<AdmissionGate.Permit> a = gate.admit(PROJECT, BackendKind.JENKINS);
        CompletableFuture<AdmissionGate.Permit> b = gate.admit(PROJECT, BackendKind.JENKINS);

        holder.release();
        assertThat(a).isDone();
        assertThat(b).isNotDone();

        a.join().release();
        assertThat(b).isDone();
    }

    @Test
    void zeroCeiling_isUnbounded() {
        AdmissionGate gate = gate(0);

        for (int i = 0; i < 20; i++) {
            assertThat(gate.admit(PROJECT, BackendKind.JENKINS)).isDone();
        }
        assertThat(gate.inFlight(PROJECT, BackendKind.JENKINS)).isEqualTo(20);
    }

    @Test
    void lanes_areIndependentPerBackend() {
        AdmissionGate gate = gate(1);
        gate.admit(PROJECT, BackendKind.JENKINS).join();

        // SSO is disabled here, so its lane has no ceiling.
        assertThat(gate.admit(PROJECT, BackendKind.SSO)).isDone();
        assertThat(gate.admit(PROJECT, BackendKind.JENKINS)).isNotDone();
    }

    // ------------------------------------------------------------------
    // Permits
    // ------------------------------------------------------------------

    @Test
    void release_twice_freesOneSlot() {
        AdmissionGate gate = gate(2);
        AdmissionGate.Permit p = gate.admit(PROJECT, BackendKind.JENKINS).join();
        gate.admit(PROJECT, BackendKind.JENKINS).join();

        p.release();
        p.release();

        assertThat(p.isReleased()).isTrue();
        assertThat(gate.inFlight(PROJECT, BackendKind.JENKINS)).isEqualTo(1);
    }

    @Test
    void occupy_ignoresCeiling_andBlocksNewAdmissions() {
        AdmissionGate gate = gate(1);
        gate.occupy(PROJECT, BackendKind.JENKINS);
        AdmissionGate.Permit extra = gate.occupy(PROJECT, BackendKind.JENKINS);

        assertThat(gate.inFlight(PROJECT, BackendKind.JENKINS)).isEqualTo(2);
        CompletableFuture<AdmissionGate.Permit> next = gate.admit(PROJECT, BackendKind.JENKINS);
        assertThat(next).isNotDone();

        extra.release();
        assertThat(next).isNotDone();
    }

    @Test
    void cancelledWaiter_doesNotLeakItsSlot() {
        AdmissionGate gate = gate(1);
        AdmissionGate.Permit holder = gate.admit(PROJECT, BackendKind.JENKINS).join();
        CompletableFuture<AdmissionGate.Permit> cancelled = gate.admit(PROJECT, BackendKind.JENKINS);
        cancelled.cancel(false);

        holder.release();

        assertThat(gate.inFlight(PROJECT, BackendKind.JENKINS)).isZero();
        assertThat(gate.admit(PROJECT, BackendKind.JENKINS)).isDone();
    }

    @Test
    void raisedCeiling_takesEffectAtNextAdmit() {
        ConfigOverrideRepository overrides = mock(ConfigOverrideRepository.class);
        ProjectCatalog catalog = catalog(1, overrides);
        AdmissionGate gate = new AdmissionGate(catalog);

        gate.admit(PROJECT, BackendKind.JENKINS).join();
        CompletableFuture<AdmissionGate.Permit> waiting = gate.admit(PROJECT, BackendKind.JENKINS);
        assertThat(waiting).isNotDone();

        when(overrides.findAllByOrderByProjectAscKeyAsc()).thenReturn(List.of(
                new ConfigOverride(PROJECT, "jenkins.max-concurrent-builds", "2")));
        catalog.reload();

        CompletableFuture<AdmissionGate.Permit> third = gate.admit(PROJECT, BackendKind.JENKINS);
        assertThat(waiting).isDone();
        assertThat(third).isNotDone();
    }
}
