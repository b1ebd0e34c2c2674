package com.deploybot.orchestrator.store;

import com.deploybot.orchestrator.config.DeployProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Deletes workflows (with their submissions and history) once they are
 * older than {@code deploybot.retention.days}.
 */
@Component
@EnableScheduling
public class RetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final WorkflowStore store;
    private final Duration      window;

    public RetentionSweeper(WorkflowStore store, DeployProperties properties) {
        this.store  = store;
        this.window = properties.retention().window();
    }

    @Scheduled(cron = "${deploybot.retention.cron:0 30 3 * * *}")
    public void scheduledSweep() {
        try {
            sweep(Instant.now());
        } catch (RuntimeException e) {
            log.error("Retention sweep failed", e);
        }
    }

    /** @return number of workflows deleted */
    public int sweep(Instant now) {
        Instant cutoff = now.minus(window);
        List<String> expired = store.listExpired(cutoff);
        for (String workflowId : expired) {
            store.delete(workflowId);
        }
        if (!expired.isEmpty()) {
            log.info("Retention: deleted {} workflows created before {}", expired.size(), cutoff);
        }
        return expired.size();
    }
}
