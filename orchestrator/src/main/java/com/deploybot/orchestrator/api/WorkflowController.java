package com.deploybot.orchestrator.api;

import com.deploybot.orchestrator.api.dto.ApprovalMessageRequest;
import com.deploybot.orchestrator.api.dto.CreateWorkflowRequest;
import com.deploybot.orchestrator.api.dto.DecisionRequest;
import com.deploybot.orchestrator.api.dto.DecisionResponse;
import com.deploybot.orchestrator.api.dto.StatusEventResponse;
import com.deploybot.orchestrator.api.dto.SubmissionResponse;
import com.deploybot.orchestrator.api.dto.WorkflowResponse;
import com.deploybot.orchestrator.model.ApprovalAction;
import com.deploybot.orchestrator.model.WorkflowRequest;
import com.deploybot.orchestrator.service.ApprovalException;
import com.deploybot.orchestrator.service.ApprovalService;
import com.deploybot.orchestrator.service.WorkflowNotFoundException;
import com.deploybot.orchestrator.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * REST API the chat front end talks to.
 *
 * POST /workflows                                — create a request (PENDING_APPROVAL)
 * GET  /workflows/{id}                           — current state
 * PUT  /workflows/{id}/approval-message          — attach the approval prompt message id
 * POST /workflows/{id}/decision                  — approve or reject (200 / 403 / 404 / 409)
 * GET  /workflows/{id}/submissions               — per-backend, per-service builds
 * GET  /workflows/{id}/submissions/{sid}/history — status changes of one build
 */
@RestController
@RequestMapping("/workflows")
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private final WorkflowService workflowService;
    private final ApprovalService approvalService;

    public WorkflowController(WorkflowService workflowService, ApprovalService approvalService) {
        this.workflowService = workflowService;
        this.approvalService = approvalService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/workflows \
     *     -H "Content-Type: application/json" \
     *     -d '{"project":"shop","environment":"UAT","services":["api"],"hashes":["a1b2c3"],
     *          "requesterId":"42","originChatId":"-100123"}'
     */
    @PostMapping
    public ResponseEntity<WorkflowResponse> create(@RequestBody CreateWorkflowRequest req) {
        WorkflowRequest wf = workflowService.create(req.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkflowResponse.from(wf));
    }

    @GetMapping("/{id}")
    public WorkflowResponse get(@PathVariable String id) {
        return WorkflowResponse.from(workflowService.get(id));
    }

    /** 204 when attached, 409 when a message id was already set. */
    @PutMapping("/{id}/approval-message")
    public ResponseEntity<Void> attachApprovalMessage(@PathVariable String id,
                                                      @RequestBody ApprovalMessageRequest req) {
        if (!workflowService.attachApprovalMessage(id, req.messageId())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Approval message already attached to " + id);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/decision")
    public DecisionResponse decide(@PathVariable String id, @RequestBody DecisionRequest req) {
        return DecisionResponse.from(approvalService.decide(id, parseAction(req.action()), req.actor()));
    }

    @GetMapping("/{id}/submissions")
    public List<SubmissionResponse> submissions(@PathVariable String id) {
        return workflowService.submissions(id).stream()
                .map(SubmissionResponse::from)
                .toList();
    }

    @GetMapping("/{id}/submissions/{submissionId}/history")
    public List<StatusEventResponse> history(@PathVariable String id, @PathVariable UUID submissionId) {
        return workflowService.history(id, submissionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Submission " + submissionId + " not found in workflow " + id))
                .stream()
                .map(StatusEventResponse::from)
                .toList();
    }

    // ------------------------------------------------------------------
    // Error mapping
    // ------------------------------------------------------------------

    @ExceptionHandler(ApprovalException.class)
    public ResponseEntity<Map<String, String>> onApprovalError(ApprovalException e) {
        HttpStatus status = switch (e.getKind()) {
            case WORKFLOW_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UNAUTHORIZED_ACTOR -> HttpStatus.FORBIDDEN;
            case ALREADY_DECIDED    -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status).body(Map.of("error", e.getKind().name(), "message", e.getMessage()));
    }

    @ExceptionHandler(WorkflowNotFoundException.class)
    public ResponseEntity<Map<String, String>> onNotFound(WorkflowNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "WORKFLOW_NOT_FOUND", "message", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> onInvalid(IllegalArgumentException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", "INVALID_REQUEST", "message", e.getMessage()));
    }

    private static ApprovalAction parseAction(String action) {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action is required");
        }
        try {
            return ApprovalAction.valueOf(action.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action '" + action + "'; expected approve or reject");
        }
    }
}
