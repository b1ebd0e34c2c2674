package com.deploybot.orchestrator.service;

/**
 * A decision that cannot be taken. Thrown synchronously by
 * {@link ApprovalService#decide}; nothing has been changed when it is thrown.
 */
public class ApprovalException extends RuntimeException {

    public enum Kind { WORKFLOW_NOT_FOUND, UNAUTHORIZED_ACTOR, ALREADY_DECIDED }

    private final Kind kind;

    public ApprovalException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
