package com.datacron.admin.service;

import com.datacron.admin.core.model.TenantConfig;
import com.datacron.core.cron.CronException;

import java.util.List;
import java.util.Map;

/**
 * Tenants and the configuration as a whole; the super admin's operations.
 */
public interface TenantService {

    boolean exists(String user);

    List<String> listUsers();

    /**
     * @return false when the tenant already existed
     */
    boolean createUser(String user);

    void deleteUser(String user);

    Map<String, TenantConfig> getConfig();

    void replaceConfig(Map<String, TenantConfig> config) throws CronException;

    /**
     * @return the configuration file the service was reloaded from
     */
    String reload();
}
