package com.deploybot.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Thread pools of the engine.
 *
 * dispatchExecutor runs backend submissions and post-decision work; nothing
 * on it waits for an admission slot (admission is a future).
 * monitorScheduler runs one poll at a time per submission; waiting between
 * polls is a scheduled delay, not a sleeping thread.
 */
@Configuration
@EnableConfigurationProperties(DeployProperties.class)
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService dispatchExecutor(DeployProperties properties) {
        return Executors.newFixedThreadPool(properties.dispatch().threads(),
                new CustomizableThreadFactory("dispatch-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService monitorScheduler(DeployProperties properties) {
        return Executors.newScheduledThreadPool(properties.monitor().threads(),
                new CustomizableThreadFactory("build-monitor-"));
    }
}
