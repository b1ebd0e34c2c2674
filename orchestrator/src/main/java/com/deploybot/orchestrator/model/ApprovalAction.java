package com.deploybot.orchestrator.model;

/** What an approver asks for when pressing a decision button. */
public enum ApprovalAction {
    APPROVE(ApprovalState.APPROVED),
    REJECT(ApprovalState.REJECTED);

    private final ApprovalState target;

    ApprovalAction(ApprovalState target) {
        this.target = target;
    }

    public ApprovalState targetState() {
        return target;
    }
}
