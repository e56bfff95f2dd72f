package com.datacron.core.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * <h1>A scheduled HTTP call, as persisted and as exchanged with the API</h1>
 *
 * {@code cron} always holds the canonical six-field form once the job went through
 * validation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CronJob {

    private String id;      // unique within its tenant
    private String cron;    // cron expression
    private String url;     // target of the GET request
    private boolean active; // whether the job is scheduled

    public CronJob copy() {
        return new CronJob(id, cron, url, active);
    }
}
