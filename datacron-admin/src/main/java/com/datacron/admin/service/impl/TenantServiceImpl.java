package com.datacron.admin.service.impl;

import com.datacron.admin.core.conf.DataCronAdminConfig;
import com.datacron.admin.core.exception.DataCronException;
import com.datacron.admin.core.model.TenantConfig;
import com.datacron.admin.core.scheduler.DataCronScheduler;
import com.datacron.admin.service.TenantService;
import com.datacron.core.cron.CronException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Tenant lifecycle and whole-configuration operations.
 */
@Slf4j
@Service
public class TenantServiceImpl implements TenantService {

    @Resource
    private DataCronAdminConfig dataCronAdminConfig;

    private DataCronScheduler scheduler() {
        return dataCronAdminConfig.getDataCronScheduler();
    }

    @Override
    public boolean exists(String user) {
        return user != null && scheduler().getJobRegistry().hasTenant(user);
    }

    @Override
    public List<String> listUsers() {
        return scheduler().getJobRegistry().listTenants();
    }

    @Override
    public boolean createUser(String user) {
        if (user == null || user.trim().length() == 0) {
            throw DataCronException.badRequest("User ID is required");
        }
        boolean created = scheduler().getJobScheduleHelper().addTenant(user);
        scheduler().getTenantDataStore().addTenant(user);
        if (created) {
            log.info(">>>>>>>>>>> datacron, user {} created", user);
        }
        return created;
    }

    @Override
    public void deleteUser(String user) {
        if (!scheduler().getJobScheduleHelper().removeTenant(user)) {
            throw DataCronException.notFound("User not found: " + user);
        }
        scheduler().getTenantDataStore().removeTenant(user);
        log.info(">>>>>>>>>>> datacron, user {} deleted", user);
    }

    @Override
    public Map<String, TenantConfig> getConfig() {
        return scheduler().snapshot();
    }

    @Override
    public void replaceConfig(Map<String, TenantConfig> config) throws CronException {
        if (config == null) {
            throw DataCronException.badRequest("Invalid JSON");
        }
        try {
            scheduler().replaceConfig(config);
        } catch (IllegalArgumentException e) {
            throw DataCronException.badRequest(e.getMessage());
        }
    }

    @Override
    public String reload() {
        String path = dataCronAdminConfig.getConfigFilePath();
        try {
            scheduler().reload();
        } catch (IOException e) {
            throw new DataCronException(HttpStatus.INTERNAL_SERVER_ERROR,
                    "Failed to load configuration: " + e.getMessage(), e);
        }
        return path;
    }
}
