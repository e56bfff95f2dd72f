package com.datacron.admin.core.scheduler;

import com.datacron.admin.core.model.TenantConfig;
import com.datacron.admin.core.store.ConfigFileStore;
import com.datacron.admin.core.store.TenantDataStore;
import com.datacron.admin.core.thread.ConfigAutoSaveHelper;
import com.datacron.core.biz.client.JobCallBizClient;
import com.datacron.core.cron.CronException;
import com.datacron.core.cron.CronExpressionParser;
import com.datacron.core.model.CronJob;
import com.datacron.core.registry.JobRegistry;
import com.datacron.core.thread.JobScheduleHelper;
import com.datacron.core.thread.JobTriggerPoolHelper;
import com.datacron.core.trigger.JobTrigger;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <h1>Lifecycle of the service's components</h1>
 *
 * {@link #init()} loads the configuration file (a missing file means an empty service),
 * starts the trigger pools, the trigger engine and the auto-save thread;
 * {@link #destroy()} stops the auto-save thread, writes pending changes and stops the
 * engine and the pools.
 */
@Slf4j
public class DataCronScheduler {

    private final ConfigFileStore configFileStore;
    private final ZoneId zone;
    private final int triggerTimeout;
    private final int triggerPoolFastMax;
    private final int triggerPoolSlowMax;
    private final int autoSaveInterval;

    @Getter
    private final JobRegistry jobRegistry = new JobRegistry();
    @Getter
    private final TenantDataStore tenantDataStore = new TenantDataStore();
    private JobTriggerPoolHelper jobTriggerPoolHelper;
    @Getter
    private JobScheduleHelper jobScheduleHelper;
    private ConfigAutoSaveHelper configAutoSaveHelper;

    /** versions of registry and data store last written to (or read from) the file */
    private long savedJobVersion = -1;
    private long savedDataVersion = -1;

    public DataCronScheduler(ConfigFileStore configFileStore, ZoneId zone, int triggerTimeout,
                             int triggerPoolFastMax, int triggerPoolSlowMax, int autoSaveInterval) {
        this.configFileStore = configFileStore;
        this.zone = zone;
        this.triggerTimeout = triggerTimeout;
        this.triggerPoolFastMax = triggerPoolFastMax;
        this.triggerPoolSlowMax = triggerPoolSlowMax;
        this.autoSaveInterval = autoSaveInterval;
    }

    public void init() throws Exception {
        JobTrigger jobTrigger = new JobTrigger(jobRegistry, new JobCallBizClient(triggerTimeout));
        jobTriggerPoolHelper = new JobTriggerPoolHelper(jobTrigger, triggerPoolFastMax, triggerPoolSlowMax);
        jobScheduleHelper = new JobScheduleHelper(jobRegistry, jobTriggerPoolHelper, zone, Clock.system(zone));

        if (configFileStore.exists()) {
            Map<String, TenantConfig> config = configFileStore.load();
            apply(config, false);
            markSaved();
            log.info(">>>>>>>>>>> datacron, configuration loaded from {}", configFileStore.getPath());
        } else {
            log.info(">>>>>>>>>>> datacron, no configuration at {}, starting empty", configFileStore.getPath());
        }

        jobTriggerPoolHelper.start();
        jobScheduleHelper.start();

        configAutoSaveHelper = new ConfigAutoSaveHelper(this, autoSaveInterval);
        configAutoSaveHelper.start();

        log.info(">>>>>>>>> init datacron admin success.");
    }

    public void destroy() throws Exception {
        configAutoSaveHelper.toStop();
        try {
            save();
        } catch (IOException e) {
            log.error(">>>>>>>>>>> datacron, configuration save on shutdown failed:{}", e.getMessage(), e);
        }
        jobScheduleHelper.toStop();
        jobTriggerPoolHelper.stop();
    }


    // ---------------------- configuration ----------------------

    /**
     * Writes the configuration file when jobs or data changed since the last write.
     *
     * @return whether the file was written
     */
    public synchronized boolean save() throws IOException {
        long jobVersion = jobRegistry.getVersion();
        long dataVersion = tenantDataStore.getVersion();
        if (jobVersion == savedJobVersion && dataVersion == savedDataVersion) {
            return false;
        }

        configFileStore.save(snapshot());
        savedJobVersion = jobVersion;
        savedDataVersion = dataVersion;
        return true;
    }

    /**
     * The whole configuration as it would be written to the file.
     */
    public Map<String, TenantConfig> snapshot() {
        Map<String, TenantConfig> config = new LinkedHashMap<>();
        for (Map.Entry<String, List<CronJob>> item : jobRegistry.snapshot().entrySet()) {
            config.put(item.getKey(), new TenantConfig(item.getValue(), tenantDataStore.snapshot(item.getKey())));
        }
        return config;
    }

    /**
     * Re-reads the configuration file and replaces every tenant, job and data value with
     * its content. Jobs whose cron expression does not parse are skipped.
     */
    public synchronized void reload() throws IOException {
        Map<String, TenantConfig> config = configFileStore.load();
        apply(config, true);
        markSaved();
        log.info(">>>>>>>>>>> datacron, configuration reloaded from {}", configFileStore.getPath());
    }

    /**
     * Replaces the whole configuration. Every job is validated first; nothing changes when
     * one of them is invalid.
     */
    public synchronized void replaceConfig(Map<String, TenantConfig> config) throws CronException {
        for (Map.Entry<String, TenantConfig> item : config.entrySet()) {
            if (item.getValue() == null || item.getValue().getCron() == null) {
                continue;
            }
            for (CronJob job : item.getValue().getCron()) {
                if (job == null || job.getId() == null || job.getId().trim().isEmpty()) {
                    throw new IllegalArgumentException("job id is required (user " + item.getKey() + ")");
                }
                CronExpressionParser.parse(job.getCron());
            }
        }
        apply(config, true);
        log.info(">>>>>>>>>>> datacron, configuration replaced, {} users", config.size());
    }

    private void apply(Map<String, TenantConfig> config, boolean running) {
        Map<String, List<CronJob>> jobs = new LinkedHashMap<>();
        Map<String, Map<String, Object>> data = new LinkedHashMap<>();
        for (Map.Entry<String, TenantConfig> item : config.entrySet()) {
            TenantConfig tenantConfig = item.getValue();
            List<CronJob> tenantJobs = new ArrayList<>();
            if (tenantConfig != null && tenantConfig.getCron() != null) {
                for (CronJob job : tenantConfig.getCron()) {
                    if (job != null) {
                        tenantJobs.add(job);
                    }
                }
            }
            jobs.put(item.getKey(), tenantJobs);
            data.put(item.getKey(), tenantConfig != null ? tenantConfig.getData() : null);
        }

        if (running) {
            jobScheduleHelper.reload(jobs);
        } else {
            jobScheduleHelper.load(jobs);
        }
        tenantDataStore.replace(data);
    }

    private void markSaved() {
        savedJobVersion = jobRegistry.getVersion();
        savedDataVersion = tenantDataStore.getVersion();
    }
}
