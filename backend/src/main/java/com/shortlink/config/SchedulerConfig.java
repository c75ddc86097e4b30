package com.shortlink.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Timer pool for background jobs (URL expiration, password reset cleanup, health check).
 * Four threads so a job blocked in a retry wait never holds up another job's timer.
 */
@Configuration
public class SchedulerConfig {

    public static final String JOB_SCHEDULER_POOL = "job-scheduler-pool";

    @Bean(name = JOB_SCHEDULER_POOL)
    public ThreadPoolTaskScheduler jobSchedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(4);
        s.setThreadNamePrefix("job-scheduler-");
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(30);
        s.initialize();
        return s;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
