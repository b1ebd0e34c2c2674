package com.deploybot.orchestrator.backend.sso;

import com.deploybot.orchestrator.backend.BuildRequest;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the release order the SSO dcAutoReleaseProcess flow expects.
 *
 * One order carries one application (service) so every submission maps to
 * exactly one process instance. The {@code detail} form is returned as a
 * list here; SsoClient serializes it to the JSON string the API wants.
 */
public final class SsoOrderFormatter {

    static final String PROCESS_TYPE = "dcAutoReleaseProcess";

    private static final DateTimeFormatter RELEASE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private SsoOrderFormatter() {}

    public static Map<String, Object> format(BuildRequest request, String jobId, String userId, LocalDateTime now) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("check_commitID", nullToEmpty(request.commitHash()));
        parameters.put("action_type",    "gray");
        parameters.put("gitBranch",      nullToEmpty(request.branch()));
        parameters.put("canRollback",    "unsupported");
        parameters.put("rollback_ver",   "");

        Map<String, Object> application = new LinkedHashMap<>();
        application.put("project_name", request.project());
        application.put("env",          request.environment());
        application.put("job_id",       jobId);
        application.put("name",         request.service());
        application.put("parameters",   parameters);

        List<Object> form = List.of(
                Map.of("status", "Request details"),
                field("projectName",   "Project",         request.project()),
                field("releaseType",   "Release type",    "Regular release"),
                field("environment",   "Environment",     request.environment()),
                field("releaseTime",   "Release time",    RELEASE_TIME.format(now)),
                field("codeBranch",    "Branch",          nullToEmpty(request.branch())),
                field("onlineVersion", "Version",         nullToEmpty(request.commitHash())),
                field("updateContent", "Release notes",   nullToEmpty(request.releaseNotes())),
                field("sqlUpdate",     "SQL update",      false),
                field("configUpdate",  "Config update",   false),
                field("sourceRemark",  "Remark",          "Workflow " + request.workflowId()),
                applicationField(application),
                field("approver",      "Approver",        nullToEmpty(request.approver())));

        Map<String, Object> order = new LinkedHashMap<>();
        order.put("detail",         List.of(form));
        order.put("draftId",        "");
        order.put("endType",        "0");
        order.put("processStatus",  "0");
        order.put("publishVersion", "0");
        order.put("title",          request.project() + " " + request.environment() + " release: " + request.service());
        order.put("type",           PROCESS_TYPE);
        order.put("userId",         nullToEmpty(userId));
        return order;
    }

    private static Map<String, Object> field(String id, String name, Object value) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("id", id);
        f.put("name", name);
        f.put("value", value);
        return f;
    }

    private static Map<String, Object> applicationField(Map<String, Object> application) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("id", "application");
        f.put("name", "Applications");
        f.put("children", List.of(List.of(application)));
        f.put("account_data", List.of(application));
        f.put("job_status", true);
        return f;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
