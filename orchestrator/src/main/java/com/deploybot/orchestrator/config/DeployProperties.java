package com.deploybot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Root of the {@code deploybot.*} configuration tree.
 *
 * Values here are the file/environment defaults. Per-project values can be
 * overridden from the config_overrides table (see ProjectCatalog).
 */
@ConfigurationProperties(prefix = "deploybot")
public record DeployProperties(
        Monitor   monitor,
        Dispatch  dispatch,
        Retention retention,
        Chat      chat,
        Sync      sync,
        Map<String, ProjectSettings> projects
) {
    public DeployProperties {
        monitor   = monitor == null ? new Monitor(null, 0, null, 0, null, 0) : monitor;
        dispatch  = dispatch == null ? new Dispatch(0, null, null, null) : dispatch;
        retention = retention == null ? new Retention(0) : retention;
        chat      = chat == null ? new Chat(null, null, null) : chat;
        sync      = sync == null ? new Sync(null, null, null, null) : sync;
        projects  = projects == null ? Map.of() : Map.copyOf(projects);
    }

    /**
     * Build monitor settings.
     *
     * @param pollInterval      wait between two poll cycles of one submission
     * @param maxPolls          poll cycles before MonitorTimeout
     * @param maxDuration       wall-clock budget before MonitorTimeout
     * @param pollRetryAttempts attempts per cycle on transient errors
     * @param pollRetryBackoff  first retry delay, doubled per attempt
     */
    public record Monitor(
            Duration pollInterval,
            int      maxPolls,
            Duration maxDuration,
            int      pollRetryAttempts,
            Duration pollRetryBackoff,
            int      threads
    ) {
        public Monitor {
            if (pollInterval == null)     pollInterval = Duration.ofSeconds(30);
            if (maxPolls <= 0)            maxPolls = 120;
            if (maxDuration == null)      maxDuration = Duration.ofHours(1);
            if (pollRetryAttempts <= 0)   pollRetryAttempts = 3;
            if (pollRetryBackoff == null) pollRetryBackoff = Duration.ofSeconds(1);
            if (threads <= 0)             threads = 4;
        }
    }

    /**
     * @param submitRetryBackoff delay before the single retry of a connection error
     * @param queueWaitTimeout   how long a Jenkins queue item may take to get a build number
     * @param queuePollInterval  queue item polling period
     */
    public record Dispatch(
            int      threads,
            Duration submitRetryBackoff,
            Duration queueWaitTimeout,
            Duration queuePollInterval
    ) {
        public Dispatch {
            if (threads <= 0)               threads = 8;
            if (submitRetryBackoff == null) submitRetryBackoff = Duration.ofSeconds(2);
            if (queueWaitTimeout == null)   queueWaitTimeout = Duration.ofSeconds(60);
            if (queuePollInterval == null)  queuePollInterval = Duration.ofSeconds(2);
        }
    }

    public record Retention(int days) {
        public Retention {
            if (days <= 0) days = 60;
        }

        public Duration window() {
            return Duration.ofDays(days);
        }
    }

    public record Chat(String telegramBaseUrl, String botToken, ProxySettings proxy) {
        public Chat {
            if (telegramBaseUrl == null || telegramBaseUrl.isBlank()) telegramBaseUrl = "https://api.telegram.org";
            if (proxy == null) proxy = ProxySettings.NONE;
        }
    }

    /** External API the decision is pushed to; disabled when baseUrl is blank. */
    public record Sync(String baseUrl, String endpoint, String token, Duration timeout) {
        public Sync {
            if (endpoint == null || endpoint.isBlank()) endpoint = "/workflows/sync";
            if (timeout == null) timeout = Duration.ofSeconds(30);
        }

        public boolean enabled() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }
}
