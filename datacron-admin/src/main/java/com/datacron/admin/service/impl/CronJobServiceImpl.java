package com.datacron.admin.service.impl;

import com.datacron.admin.core.conf.DataCronAdminConfig;
import com.datacron.admin.core.exception.DataCronException;
import com.datacron.admin.core.model.CronJobView;
import com.datacron.admin.service.CronJobService;
import com.datacron.core.cron.CronException;
import com.datacron.core.model.CronJob;
import com.datacron.core.model.JobStatus;
import com.datacron.core.registry.JobRegistry;
import com.datacron.core.thread.JobScheduleHelper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * <h1>Job operations of the tenant API</h1>
 *
 * Every change goes through the {@link JobScheduleHelper}, which keeps the registry and the
 * pending fires in step; reads go to the {@link JobRegistry} directly.
 */
@Slf4j
@Service
public class CronJobServiceImpl implements CronJobService {

    @Resource
    private DataCronAdminConfig dataCronAdminConfig;

    private JobRegistry jobRegistry() {
        return dataCronAdminConfig.getDataCronScheduler().getJobRegistry();
    }

    private JobScheduleHelper jobScheduleHelper() {
        return dataCronAdminConfig.getDataCronScheduler().getJobScheduleHelper();
    }

    @Override
    public List<CronJob> list(String user) {
        return jobRegistry().list(user);
    }

    @Override
    public CronJobView load(String user, String id) {
        CronJob job = jobRegistry().get(user, id);
        if (job == null) {
            throw DataCronException.notFound("Job not found: " + id);
        }
        return new CronJobView(job, jobRegistry().status(user, id));
    }

    @Override
    public CronJob add(String user, CronJob job) throws CronException {
        if (job == null) {
            throw DataCronException.badRequest("Invalid request body");
        }
        if (job.getId() == null || job.getId().trim().length() == 0) {
            throw DataCronException.badRequest("Job ID is required");
        }
        validate(job);

        jobScheduleHelper().addJob(user, job);
        log.info(">>>>>>>>>>> datacron, job {}/{} saved, cron [{}], active {}", user, job.getId(), job.getCron(), job.isActive());
        return jobRegistry().get(user, job.getId());
    }

    @Override
    public CronJob update(String user, String id, CronJob job) throws CronException {
        if (job == null) {
            throw DataCronException.badRequest("Invalid request body");
        }
        CronJob target = job.copy();
        target.setId(id);
        return add(user, target);
    }

    @Override
    public List<CronJob> replaceAll(String user, List<CronJob> jobs) throws CronException {
        if (jobs == null) {
            throw DataCronException.badRequest("Invalid request body");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (CronJob job : jobs) {
            if (job == null || job.getId() == null || job.getId().trim().length() == 0) {
                throw DataCronException.badRequest("Job ID is required");
            }
            if (!ids.add(job.getId())) {
                throw DataCronException.badRequest("Duplicate job ID: " + job.getId());
            }
            validate(job);
        }

        jobScheduleHelper().replaceJobs(user, jobs);
        log.info(">>>>>>>>>>> datacron, jobs of user {} replaced, {} jobs", user, jobs.size());
        return jobRegistry().list(user);
    }

    @Override
    public void remove(String user, String id) {
        if (!jobScheduleHelper().removeJob(user, id)) {
            throw DataCronException.notFound("Job not found: " + id);
        }
        log.info(">>>>>>>>>>> datacron, job {}/{} removed", user, id);
    }

    @Override
    public Map<String, Object> setActive(String user, String id, boolean active) throws CronException {
        if (!jobScheduleHelper().setActive(user, id, active)) {
            throw DataCronException.notFound("Job not found: " + id);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", id);
        result.put("action", active ? "activated" : "deactivated");
        result.put("active", active);
        return result;
    }

    @Override
    public Map<String, Object> setAllActive(String user, boolean active) {
        int total = jobRegistry().list(user).size();
        int changed = jobScheduleHelper().setAllActive(user, active);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("user", user);
        result.put("action", active ? "activated" : "deactivated");
        result.put("count", total);
        result.put("changed", changed);
        return result;
    }

    @Override
    public Map<String, JobStatus> status(String user) {
        Map<String, JobStatus> statusMap = jobRegistry().allStatus(user);
        return statusMap != null ? statusMap : new LinkedHashMap<>();
    }

    private static void validate(CronJob job) {
        if (job.getCron() == null || job.getCron().trim().length() == 0) {
            throw DataCronException.badRequest("Cron expression is required");
        }
        if (job.getUrl() == null || job.getUrl().trim().length() == 0) {
            throw DataCronException.badRequest("URL is required");
        }
    }
}
