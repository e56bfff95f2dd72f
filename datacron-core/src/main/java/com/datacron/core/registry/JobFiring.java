package com.datacron.core.registry;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Date;

/**
 * One claimed execution of a job: the URL to call, the nominal firing time the outcome is
 * recorded under, and the handle of the following occurrence (null when the job could not
 * be rescheduled).
 */
@Getter
public final class JobFiring {

    private final String tenant;
    private final String jobId;
    private final String url;
    private final Date fireTime;
    private final FireHandle next;

    /** the registry entry the outcome belongs to; a removed or reloaded job gets a new one */
    @Getter(AccessLevel.NONE)
    final JobEntry entry;

    JobFiring(JobEntry entry, String tenant, String jobId, String url, Date fireTime, FireHandle next) {
        this.entry = entry;
        this.tenant = tenant;
        this.jobId = jobId;
        this.url = url;
        this.fireTime = fireTime;
        this.next = next;
    }

    public String getJobKey() {
        return tenant + "/" + jobId;
    }

    @Override
    public String toString() {
        return "JobFiring{" + getJobKey() + " @ " + fireTime.getTime() + "}";
    }
}
