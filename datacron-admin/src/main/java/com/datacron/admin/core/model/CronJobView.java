package com.datacron.admin.core.model;

import com.datacron.core.model.CronJob;
import com.datacron.core.model.JobStatus;
import lombok.Data;

/**
 * A job together with its execution state, as returned for a single job.
 */
@Data
public class CronJobView {

    private String id;
    private String cron;
    private String url;
    private boolean active;
    private JobStatus status;

    public CronJobView(CronJob job, JobStatus status) {
        this.id = job.getId();
        this.cron = job.getCron();
        this.url = job.getUrl();
        this.active = job.isActive();
        this.status = status;
    }
}
