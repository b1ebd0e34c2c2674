package com.deploybot.orchestrator.service;

import com.deploybot.orchestrator.model.ActorRole;

/**
 * Answers whether an identity may act on a project's workflows in a role.
 */
public interface ApproverDirectory {

    boolean isAuthorized(String project, String actor, ActorRole role);
}
