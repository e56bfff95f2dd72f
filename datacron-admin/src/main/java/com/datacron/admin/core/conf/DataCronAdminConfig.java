package com.datacron.admin.core.conf;

import com.datacron.admin.core.scheduler.DataCronScheduler;
import com.datacron.admin.core.store.ConfigFileStore;
import com.datacron.core.biz.client.JobCallBizClient;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Entry point of the service side: once the properties are injected the scheduler is
 * created and started, and it is stopped again (after a final save) when the context
 * closes.
 */
@Slf4j
@Component
public class DataCronAdminConfig implements InitializingBean, DisposableBean {

    @Getter
    private static DataCronAdminConfig adminConfig = null;

    @Getter
    private DataCronScheduler dataCronScheduler;

    @Override
    public void afterPropertiesSet() throws Exception {
        adminConfig = this;

        dataCronScheduler = new DataCronScheduler(
                new ConfigFileStore(Paths.get(configFilePath)),
                getZone(),
                getTriggerTimeout(),
                getTriggerPoolFastMax(),
                getTriggerPoolSlowMax(),
                getAutoSaveInterval());
        dataCronScheduler.init();
    }

    @Override
    public void destroy() throws Exception {
        dataCronScheduler.destroy();
    }

    // conf
    @Getter
    @Value("${datacron.super-admin-key}")
    private String superAdminKey;
    @Getter
    @Value("${datacron.config-file-path}")
    private String configFilePath;
    /** seconds between two checks for unsaved changes */
    @Value("${datacron.auto-save-interval}")
    private int autoSaveInterval;
    /** seconds, connect and read timeout of each job call */
    @Value("${datacron.trigger.timeout}")
    private int triggerTimeout;
    @Value("${datacron.triggerpool.fast.max}")
    private int triggerPoolFastMax;
    @Value("${datacron.triggerpool.slow.max}")
    private int triggerPoolSlowMax;
    @Value("${datacron.timezone:}")
    private String timezone;

    public int getAutoSaveInterval() {
        if (autoSaveInterval < 1) {
            return 1;
        }
        return autoSaveInterval;
    }

    public int getTriggerTimeout() {
        if (triggerTimeout <= 0) {
            return JobCallBizClient.DEFAULT_TIMEOUT;
        }
        return triggerTimeout;
    }

    public int getTriggerPoolFastMax() {
        if (triggerPoolFastMax < 200) {
            return 200;
        }
        return triggerPoolFastMax;
    }

    public int getTriggerPoolSlowMax() {
        if (triggerPoolSlowMax < 100) {
            return 100;
        }
        return triggerPoolSlowMax;
    }

    /**
     * Zone cron expressions are evaluated in; the system default when unset or unknown.
     */
    public ZoneId getZone() {
        if (timezone == null || timezone.trim().isEmpty()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.warn(">>>>>>>>>>> datacron, unknown timezone '{}', using {}", timezone, ZoneId.systemDefault());
            return ZoneId.systemDefault();
        }
    }
}
