package com.deploybot.orchestrator.model;

/**
 * External build / deployment systems a workflow can be dispatched to.
 * Each kind has exactly one BackendClient implementation.
 */
public enum BackendKind {
    SSO("SSO"),
    JENKINS("Jenkins");

    private final String displayName;

    BackendKind(String displayName) {
        this.displayName = displayName;
    }

    /** Name used in chat messages. */
    public String displayName() {
        return displayName;
    }
}
