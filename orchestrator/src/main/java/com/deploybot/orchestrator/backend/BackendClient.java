package com.deploybot.orchestrator.backend;

import com.deploybot.orchestrator.config.ProjectSettings;
import com.deploybot.orchestrator.model.BackendKind;

/**
 * Stateless request/response wrapper around one external build system.
 *
 * Implementations are Spring beans collected by {@link BackendRegistry};
 * the dispatcher and the monitor never branch on the backend kind.
 * Both methods block on network I/O and are called from worker threads.
 */
public interface BackendClient {

    BackendKind kind();

    /**
     * Start a build.
     *
     * @return the backend's build reference, stored verbatim and handed back to {@link #pollStatus}
     * @throws BackendException TRANSIENT on connection trouble, REJECTED when the backend refuses
     */
    String submit(BuildRequest request, ProjectSettings project);

    /**
     * Current status of a build started by {@link #submit}.
     *
     * @throws BackendException on any failure; the monitor treats every poll failure as transient
     */
    BuildObservation pollStatus(String buildReference, ProjectSettings project);
}
