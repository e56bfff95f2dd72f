package com.datacron.core.registry;

import com.datacron.core.cron.CronSchedule;
import com.datacron.core.model.CronJob;
import com.datacron.core.model.JobStatus;

/**
 * Mutable record behind one (tenant, jobId). Only touched under the registry lock.
 */
final class JobEntry {

    CronJob job;
    CronSchedule schedule;
    final JobStatus status = new JobStatus();

    /** bumped whenever the pending fire of this job becomes invalid */
    long generation;

    /** firing time of the newest outcome written into {@link #status} */
    long lastAppliedFireTime = Long.MIN_VALUE;

    JobEntry(CronJob job, CronSchedule schedule) {
        this.job = job;
        this.schedule = schedule;
    }

    FireHandle handle(String tenant) {
        if (!job.isActive() || status.getNextRun() == null) {
            return null;
        }
        return new FireHandle(tenant, job.getId(), generation, status.getNextRun().getTime());
    }
}
