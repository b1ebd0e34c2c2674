package com.deploybot.orchestrator.notify;

import com.deploybot.orchestrator.model.ApprovalAction;
import com.deploybot.orchestrator.model.BackendKind;
import com.deploybot.orchestrator.model.BuildStatus;
import com.deploybot.orchestrator.model.BuildSubmission;
import com.deploybot.orchestrator.model.CompositeState;
import com.deploybot.orchestrator.model.ServiceTarget;
import com.deploybot.orchestrator.model.WorkflowRequest;

import org.springframework.web.util.HtmlUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static org.springframework.web.util.HtmlUtils.htmlEscape;

/**
 * Chat message texts (Telegram HTML).
 *
 * Every method is a pure function of its arguments: the same workflow and
 * submissions always render the same text. Submissions are listed in
 * backend order, then service order.
 */
public final class MessageTemplates {

    private MessageTemplates() {}

    // ------------------------------------------------------------------
    // Decision
    // ------------------------------------------------------------------

    /** Replaces the approval request once someone decided it. */
    public static String decisionRecorded(WorkflowRequest wf, ApprovalAction action, String actor) {
        StringBuilder sb = new StringBuilder(summary(wf));
        sb.append('\n')
          .append(action == ApprovalAction.APPROVE ? "Approved" : "Rejected")
          .append(" by ").append(htmlEscape(actor));
        return sb.toString();
    }

    public static String rejected(WorkflowRequest wf, String actor) {
        return "Workflow <b>" + htmlEscape(wf.getId()) + "</b> (" + htmlEscape(wf.getProject()) + " / "
                + htmlEscape(wf.getEnvironment()) + ") was rejected by " + htmlEscape(actor) + ".";
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    /**
     * Result of the dispatch phase when at least one submission was accepted.
     *
     * @param listAccepted false to mention only the failed pairs
     */
    public static String submissionResult(WorkflowRequest wf, List<BuildSubmission> submissions, boolean listAccepted) {
        StringBuilder sb = new StringBuilder(header(wf)).append(": builds submitted.");

        if (listAccepted) {
            Map<BackendKind, List<String>> accepted = new TreeMap<>();
            for (BuildSubmission s : sorted(submissions)) {
                if (!s.isSubmissionError()) {
                    accepted.computeIfAbsent(s.getBackend(), k -> new ArrayList<>()).add(s.getService());
                }
            }
            accepted.forEach((kind, services) -> sb.append('\n')
                    .append(kind.displayName()).append(": ")
                    .append(services.stream().map(HtmlUtils::htmlEscape)
                            .collect(Collectors.joining(", "))));
        }

        List<BuildSubmission> failed = sorted(submissions).stream().filter(BuildSubmission::isSubmissionError).toList();
        if (!failed.isEmpty()) {
            sb.append("\nFailed to submit:");
            failed.forEach(s -> sb.append('\n').append(failureLine(s)));
        }
        return sb.toString();
    }

    public static String dispatchFailed(WorkflowRequest wf, List<BuildSubmission> submissions) {
        StringBuilder sb = new StringBuilder(header(wf)).append(": every build submission failed.");
        sorted(submissions).forEach(s -> sb.append('\n').append(failureLine(s)));
        return sb.toString();
    }

    public static String noBackend(WorkflowRequest wf) {
        return header(wf) + ": approved, but project " + htmlEscape(wf.getProject())
                + " has no build backend enabled. Nothing was deployed.";
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    public static String completion(WorkflowRequest wf, CompositeState state, List<BuildSubmission> submissions) {
        String verdict = switch (state) {
            case COMPLETED        -> "deployed successfully";
            case PARTIALLY_FAILED -> "partially failed";
            case FAILED           -> "failed";
            default               -> state.name().toLowerCase(Locale.ROOT);
        };
        StringBuilder sb = new StringBuilder(header(wf)).append(' ').append(verdict).append('.');
        for (BuildSubmission s : sorted(submissions)) {
            sb.append('\n').append(statusLine(s));
        }
        return sb.toString();
    }

    /** Wording of a terminal status in the per-service breakdown. */
    public static String statusWording(BuildSubmission s) {
        if (s.isSubmissionError()) {
            return "submission failed";
        }
        BuildStatus status = s.getStatus();
        return switch (status) {
            case SUCCESS  -> "deployed successfully";
            case FAILURE  -> "build failed";
            case ABORTED  -> s.isTimedOut() ? "build aborted (monitor timed out)" : "build aborted";
            case UNSTABLE -> "build unstable";
            default       -> status.name().toLowerCase(Locale.ROOT);
        };
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String header(WorkflowRequest wf) {
        return "Workflow <b>" + htmlEscape(wf.getId()) + "</b> (" + htmlEscape(wf.getProject())
                + " / " + htmlEscape(wf.getEnvironment()) + ")";
    }

    private static String summary(WorkflowRequest wf) {
        StringBuilder sb = new StringBuilder();
        sb.append("<b>Deployment request ").append(htmlEscape(wf.getId())).append("</b>\n");
        sb.append("Project: ").append(htmlEscape(wf.getProject())).append('\n');
        sb.append("Environment: ").append(htmlEscape(wf.getEnvironment())).append('\n');
        if (wf.getBranch() != null && !wf.getBranch().isBlank()) {
            sb.append("Branch: ").append(htmlEscape(wf.getBranch())).append('\n');
        }
        sb.append("Services:\n");
        for (ServiceTarget t : wf.getTargets()) {
            sb.append("  ").append(htmlEscape(t.getService()))
              .append(" <code>").append(htmlEscape(t.getCommitHash())).append("</code>\n");
        }
        if (wf.getReleaseNotes() != null && !wf.getReleaseNotes().isBlank()) {
            sb.append("Notes: ").append(htmlEscape(wf.getReleaseNotes())).append('\n');
        }
        if (wf.getRequesterName() != null) {
            sb.append("Requested by ").append(htmlEscape(wf.getRequesterName())).append('\n');
        }
        return sb.toString();
    }

    private static String failureLine(BuildSubmission s) {
        return "  " + s.getBackend().displayName() + " / " + htmlEscape(s.getService()) + ": "
                + htmlEscape(s.getFailureReason() == null ? "unknown error" : s.getFailureReason());
    }

    private static String statusLine(BuildSubmission s) {
        StringBuilder sb = new StringBuilder("  ")
                .append(s.getBackend().displayName()).append(" / ").append(htmlEscape(s.getService()))
                .append(": ").append(statusWording(s));
        if (s.getFinishedAt() != null && s.getSubmittedAt() != null && !s.isSubmissionError()) {
            sb.append(" (").append(formatDuration(Duration.between(s.getSubmittedAt(), s.getFinishedAt()))).append(')');
        }
        if (s.getDetailUrl() != null && !s.getDetailUrl().isBlank()) {
            sb.append(" <a href=\"").append(htmlEscape(s.getDetailUrl())).append("\">details</a>");
        }
        return sb.toString();
    }

    static String formatDuration(Duration d) {
        long seconds = Math.max(0, d.getSeconds());
        long minutes = seconds / 60;
        return minutes > 0 ? minutes + "m " + (seconds % 60) + "s" : seconds + "s";
    }

    private static List<BuildSubmission> sorted(List<BuildSubmission> submissions) {
        return submissions.stream()
                .sorted(Comparator.comparing(BuildSubmission::getBackend)
                        .thenComparing(BuildSubmission::getService))
                .toList();
    }
}
