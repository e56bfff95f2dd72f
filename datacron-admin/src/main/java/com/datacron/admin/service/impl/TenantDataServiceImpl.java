package com.datacron.admin.service.impl;

import com.datacron.admin.core.conf.DataCronAdminConfig;
import com.datacron.admin.core.exception.DataCronException;
import com.datacron.admin.core.store.TenantDataStore;
import com.datacron.admin.service.TenantDataService;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;
import java.util.ArrayList;
import java.util.List;

@Service
public class TenantDataServiceImpl implements TenantDataService {

    @Resource
    private DataCronAdminConfig dataCronAdminConfig;

    private TenantDataStore tenantDataStore() {
        return dataCronAdminConfig.getDataCronScheduler().getTenantDataStore();
    }

    @Override
    public List<String> keys(String user) {
        List<String> keys = tenantDataStore().keys(user);
        return keys != null ? keys : new ArrayList<>();
    }

    @Override
    public Object get(String user, String key) {
        Object value = tenantDataStore().get(user, key);
        if (value == null) {
            throw DataCronException.notFound("Data not found: " + key);
        }
        return value;
    }

    @Override
    public void put(String user, String key, Object value) {
        if (value == null) {
            throw DataCronException.badRequest("Invalid request body");
        }
        tenantDataStore().put(user, key, value);
    }

    @Override
    public void delete(String user, String key) {
        if (!tenantDataStore().remove(user, key)) {
            throw DataCronException.notFound("Data not found: " + key);
        }
    }
}
