package com.shortlink.jobs.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the job scheduler once the application is ready and stops it on shutdown.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobSchedulerLifecycle {

    private final JobScheduler jobScheduler;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        jobScheduler.startScheduler();
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        if (jobScheduler.isStarted()) {
            log.info("Gracefully shutting down job scheduler");
            jobScheduler.stopScheduler();
        }
    }
}
