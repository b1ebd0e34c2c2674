package com.deploybot.orchestrator.config;

import java.util.Locale;
import java.util.Map;

/**
 * Connection and admission settings of one backend for one project.
 *
 * Jenkins uses username + apiToken and jobPrefixes (environment → job folder).
 * SSO uses authToken + authorization and userId.
 */
public record BackendSettings(
        boolean enabled,
        String  baseUrl,
        String  username,
        String  apiToken,
        String  authToken,
        String  authorization,
        String  userId,
        int     maxConcurrentBuilds,
        Map<String, String> jobPrefixes
) {
    public static final BackendSettings DISABLED =
            new BackendSettings(false, null, null, null, null, null, null, 0, Map.of());

    public BackendSettings {
        jobPrefixes = jobPrefixes == null ? Map.of() : Map.copyOf(jobPrefixes);
        if (baseUrl != null && baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
    }

    /** Jenkins folder for an environment; defaults to the lower-cased environment name. */
    public String jobPrefix(String environment) {
        for (Map.Entry<String, String> e : jobPrefixes.entrySet()) {
            if (e.getKey().equalsIgnoreCase(environment)) {
                return e.getValue();
            }
        }
        return environment.toLowerCase(Locale.ROOT);
    }

    /** Zero or less means no ceiling. */
    public boolean hasCeiling() {
        return maxConcurrentBuilds > 0;
    }

    public BackendSettings withEnabled(boolean value) {
        return new BackendSettings(value, baseUrl, username, apiToken, authToken, authorization,
                userId, maxConcurrentBuilds, jobPrefixes);
    }

    public BackendSettings withMaxConcurrentBuilds(int value) {
        return new BackendSettings(enabled, baseUrl, username, apiToken, authToken, authorization,
                userId, value, jobPrefixes);
    }
}
