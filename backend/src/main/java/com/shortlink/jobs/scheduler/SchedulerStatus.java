package com.shortlink.jobs.scheduler;

import com.shortlink.jobs.JobName;
import com.shortlink.jobs.JobStatusSnapshot;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time view of the scheduler. nextExecutions is empty while the scheduler is stopped.
 */
public record SchedulerStatus(
        boolean started,
        Map<JobName, JobStatusSnapshot> jobs,
        Map<JobName, Instant> nextExecutions,
        ScheduleConfig configuration
) {

    public SchedulerStatus {
        jobs = Map.copyOf(jobs);
        nextExecutions = Map.copyOf(nextExecutions);
    }

    public JobStatusSnapshot job(JobName name) {
        return jobs.get(name);
    }
}
