package com.datacron.admin.core.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Free-form key/value data of each tenant. Values are whatever JSON the tenant stored
 * (maps, lists, strings, numbers, booleans); null is not a value.
 */
public class TenantDataStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Map<String, Object>> tenants = new LinkedHashMap<>();

    /** bumped on every change that has to reach the configuration file */
    private final AtomicLong version = new AtomicLong();

    public void addTenant(String tenant) {
        lock.writeLock().lock();
        try {
            if (!tenants.containsKey(tenant)) {
                tenants.put(tenant, new LinkedHashMap<>());
                version.incrementAndGet();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void removeTenant(String tenant) {
        lock.writeLock().lock();
        try {
            if (tenants.remove(tenant) != null) {
                version.incrementAndGet();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the keys in insertion order, null for an unknown tenant
     */
    public List<String> keys(String tenant) {
        lock.readLock().lock();
        try {
            Map<String, Object> data = tenants.get(tenant);
            return data != null ? new ArrayList<>(data.keySet()) : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the value, null when the tenant or the key does not exist
     */
    public Object get(String tenant, String key) {
        lock.readLock().lock();
        try {
            Map<String, Object> data = tenants.get(tenant);
            return data != null ? data.get(key) : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stores the value, creating the tenant's data area on demand.
     */
    public void put(String tenant, String key, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("null is not a storable value");
        }
        lock.writeLock().lock();
        try {
            tenants.computeIfAbsent(tenant, k -> new LinkedHashMap<>()).put(key, value);
            version.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean remove(String tenant, String key) {
        lock.writeLock().lock();
        try {
            Map<String, Object> data = tenants.get(tenant);
            if (data == null || !data.containsKey(key)) {
                return false;
            }
            data.remove(key);
            version.incrementAndGet();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Shallow copy of one tenant's data, empty for an unknown tenant.
     */
    public Map<String, Object> snapshot(String tenant) {
        lock.readLock().lock();
        try {
            Map<String, Object> data = tenants.get(tenant);
            return data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the data of every tenant at once; null values are dropped.
     */
    public void replace(Map<String, Map<String, Object>> data) {
        lock.writeLock().lock();
        try {
            tenants.clear();
            for (Map.Entry<String, Map<String, Object>> item : data.entrySet()) {
                Map<String, Object> values = new LinkedHashMap<>();
                if (item.getValue() != null) {
                    for (Map.Entry<String, Object> value : item.getValue().entrySet()) {
                        if (value.getValue() != null) {
                            values.put(value.getKey(), value.getValue());
                        }
                    }
                }
                tenants.put(item.getKey(), values);
            }
            version.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long getVersion() {
        return version.get();
    }
}
