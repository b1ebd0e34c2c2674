package com.deploybot.orchestrator.notify;

import com.deploybot.orchestrator.config.ProjectCatalog;
import com.deploybot.orchestrator.config.ProjectSettings;
import com.deploybot.orchestrator.model.ApprovalAction;
import com.deploybot.orchestrator.model.BuildSubmission;
import com.deploybot.orchestrator.model.CompositeState;
import com.deploybot.orchestrator.model.WorkflowRequest;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns workflow events into chat messages in the workflow's origin chat.
 *
 * Ops members are mentioned when a submission could not be submitted, or
 * when a build ends in one of the project's {@code ops-notify-on} statuses.
 * Delivery failures are logged and counted; no method here throws.
 */
@Component
public class BuildNotifier {

    private static final Logger log = LoggerFactory.getLogger(BuildNotifier.class);

    private final ChatGateway    chat;
    private final ProjectCatalog catalog;
    private final MeterRegistry  metrics;

    public BuildNotifier(ChatGateway chat, ProjectCatalog catalog, MeterRegistry metrics) {
        this.chat    = chat;
        this.catalog = catalog;
        this.metrics = metrics;
    }

    // ------------------------------------------------------------------
    // Events
    // ------------------------------------------------------------------

    /** Edit the approval request in place; post a fresh message if there is none to edit. */
    public void decisionRecorded(WorkflowRequest wf, ApprovalAction action, String actor) {
        String text = MessageTemplates.decisionRecorded(wf, action, actor);
        if (wf.getApprovalMessageId() == null || wf.getApprovalMessageId().isBlank()) {
            send(wf, text, List.of(), "decision");
            return;
        }
        deliver(wf, "decision", () -> chat.updateMessage(wf.getOriginChatId(), wf.getApprovalMessageId(), text));
    }

    public void rejected(WorkflowRequest wf, String actor) {
        send(wf, MessageTemplates.rejected(wf, actor), List.of(), "rejection");
    }

    public void submissionResult(WorkflowRequest wf, List<BuildSubmission> submissions) {
        ProjectSettings project = catalog.get(wf.getProject());
        boolean anyFailed = submissions.stream().anyMatch(BuildSubmission::isSubmissionError);
        if (!project.announceSubmissions() && !anyFailed) {
            log.debug("Submission announcements disabled for {}", wf.getProject());
            return;
        }
        send(wf, MessageTemplates.submissionResult(wf, submissions, project.announceSubmissions()),
                anyFailed ? ops(project) : List.of(), "submission");
    }

    public void dispatchFailed(WorkflowRequest wf, List<BuildSubmission> submissions) {
        send(wf, MessageTemplates.dispatchFailed(wf, submissions), ops(catalog.get(wf.getProject())), "dispatch-failed");
    }

    public void noBackend(WorkflowRequest wf) {
        send(wf, MessageTemplates.noBackend(wf), List.of(), "no-backend");
    }

    public void completed(WorkflowRequest wf, CompositeState state, List<BuildSubmission> submissions) {
        ProjectSettings project = catalog.get(wf.getProject());
        boolean mentionOps = submissions.stream()
                .anyMatch(s -> s.isSubmissionError() || project.mentionsOpsOn(s.getStatus()));
        send(wf, MessageTemplates.completion(wf, state, submissions),
                mentionOps ? ops(project) : List.of(), "completion");
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void send(WorkflowRequest wf, String text, Collection<String> mentions, String event) {
        deliver(wf, event, () -> chat.sendMessage(wf.getOriginChatId(), text, mentions));
    }

    private void deliver(WorkflowRequest wf, String event, Runnable delivery) {
        if (wf.getOriginChatId() == null || wf.getOriginChatId().isBlank()) {
            log.warn("Workflow {} has no origin chat; dropping {} notification", wf.getId(), event);
            count("skipped");
            return;
        }
        try {
            delivery.run();
            count("delivered");
            log.debug("Sent {} notification for workflow {}", event, wf.getId());
        } catch (NotifyDeliveryException e) {
            count("failed");
            log.warn("Could not deliver {} notification for workflow {}: {}", event, wf.getId(), e.getMessage());
        } catch (RuntimeException e) {
            count("failed");
            log.error("Unexpected error delivering {} notification for workflow {}", event, wf.getId(), e);
        }
    }

    private static Set<String> ops(ProjectSettings project) {
        return new TreeSet<>(project.ops());
    }

    private void count(String outcome) {
        metrics.counter("deploybot.notify.deliveries", "outcome", outcome).increment();
    }
}
