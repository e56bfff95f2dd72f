package com.datacron.admin.service;

import java.util.List;

/**
 * Key/value data of one tenant.
 */
public interface TenantDataService {

    List<String> keys(String user);

    Object get(String user, String key);

    void put(String user, String key, Object value);

    void delete(String user, String key);
}
