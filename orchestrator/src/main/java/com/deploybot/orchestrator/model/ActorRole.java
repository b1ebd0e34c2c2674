package com.deploybot.orchestrator.model;

/** Membership roles checked before a decision is honored. */
public enum ActorRole {
    APPROVER,
    OPS
}
