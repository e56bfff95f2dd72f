package com.datacron.admin.service;

import com.datacron.admin.core.model.CronJobView;
import com.datacron.core.cron.CronException;
import com.datacron.core.model.CronJob;
import com.datacron.core.model.JobStatus;

import java.util.List;
import java.util.Map;

/**
 * Jobs of one tenant. Unknown jobs raise a 404 {@code DataCronException}, incomplete
 * jobs a 400 one; invalid cron expressions surface as {@link CronException}.
 */
public interface CronJobService {

    List<CronJob> list(String user);

    CronJobView load(String user, String id);

    /**
     * Inserts or replaces the job with the id carried in {@code job}.
     *
     * @return the stored job, with its canonical cron expression
     */
    CronJob add(String user, CronJob job) throws CronException;

    /**
     * Replaces the job {@code id}; the id inside {@code job} is ignored.
     */
    CronJob update(String user, String id, CronJob job) throws CronException;

    /**
     * Replaces every job of the tenant.
     */
    List<CronJob> replaceAll(String user, List<CronJob> jobs) throws CronException;

    void remove(String user, String id);

    Map<String, Object> setActive(String user, String id, boolean active) throws CronException;

    Map<String, Object> setAllActive(String user, boolean active);

    Map<String, JobStatus> status(String user);
}
