package com.taskdeck.app.dispatch;

import com.taskdeck.common.config.TaskdeckConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * In-process periodic trigger, registered on Spring's scheduler with the
 * configured poll interval.
 */
@Slf4j
@Component
public class PollingTrigger implements SchedulingConfigurer {

    private final DispatchService dispatchService;
    private final TaskdeckConfig.SchedulerConfig scheduler;

    public PollingTrigger(DispatchService dispatchService, TaskdeckConfig config) {
        this.dispatchService = dispatchService;
        this.scheduler = config.getScheduler();
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        if (!scheduler.isPollingEnabled()) {
            log.info("Periodic polling disabled, waiting for /api/cron/dispatcher calls");
            return;
        }
        Duration interval = Duration.ofSeconds(Math.max(1, scheduler.getPollIntervalSeconds()));
        registrar.addFixedDelayTask(this::tick, interval);
        log.info("Polling for due jobs every {}s", interval.toSeconds());
    }

    void tick() {
        try {
            dispatchService.runCycle("timer");
        } catch (RuntimeException e) {
            // next tick retries
            log.error("Scheduled poll cycle failed: {}", e.getMessage(), e);
        }
    }
}
