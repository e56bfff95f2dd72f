package com.datacron.core.registry;

import com.datacron.core.cron.CronSchedule;
import com.datacron.core.cron.UnsatisfiableScheduleException;
import com.datacron.core.model.CronJob;
import com.datacron.core.model.JobStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * <h1>Owner of every job and status record, keyed by tenant and then job id</h1>
 *
 * All state sits in one map guarded by a read/write lock; each public operation takes the
 * lock once, so readers never see a half-applied change. Jobs and statuses leave the
 * registry as copies only.
 *
 * Besides the plain data operations the registry keeps, per job, the derived scheduling
 * state the trigger engine relies on: the {@code nextRun} of an active job and a
 * generation counter. Every change that invalidates a pending fire (deactivation, removal,
 * replacement, reload) bumps the generation, and {@link #claim} refuses handles carrying
 * an older one.
 */
@Slf4j
public class JobRegistry {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** tenant -> jobId -> entry, both levels in insertion order */
    private final Map<String, Map<String, JobEntry>> tenants = new LinkedHashMap<>();

    /** bumped on every change that has to reach the configuration file */
    private final AtomicLong version = new AtomicLong();


    // ---------------------- tenant ----------------------

    public boolean addTenant(String tenant) {
        lock.writeLock().lock();
        try {
            if (tenants.containsKey(tenant)) {
                return false;
            }
            tenants.put(tenant, new LinkedHashMap<>());
            version.incrementAndGet();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops the tenant together with all of its jobs in one step.
     */
    public boolean removeTenant(String tenant) {
        lock.writeLock().lock();
        try {
            Map<String, JobEntry> jobs = tenants.remove(tenant);
            if (jobs == null) {
                return false;
            }
            for (JobEntry entry : jobs.values()) {
                entry.generation++;
            }
            version.incrementAndGet();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean hasTenant(String tenant) {
        lock.readLock().lock();
        try {
            return tenants.containsKey(tenant);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> listTenants() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(tenants.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }


    // ---------------------- job ----------------------

    /**
     * Inserts the job, or replaces schedule, url and active flag of an existing one while
     * keeping its run history. The tenant is created on demand.
     *
     * @param schedule the already validated schedule of {@code job}; its canonical string
     *                 replaces {@code job.cron}
     * @param resolver first fire time of the job when it is active
     * @throws UnsatisfiableScheduleException when an active job has no next occurrence; the
     *                                        job is stored anyway, but inactive
     */
    public UpsertResult upsert(String tenant, CronJob job, CronSchedule schedule, NextRunResolver resolver)
            throws UnsatisfiableScheduleException {
        CronJob stored = job.copy();
        stored.setCron(schedule.getExpression());

        UnsatisfiableScheduleException unsatisfiable = null;
        UpsertResult result;

        lock.writeLock().lock();
        try {
            Date nextRun = null;
            if (stored.isActive()) {
                try {
                    nextRun = resolver.resolve(schedule);
                } catch (UnsatisfiableScheduleException e) {
                    unsatisfiable = e;
                    stored.setActive(false);
                }
            }

            Map<String, JobEntry> jobs = tenants.computeIfAbsent(tenant, k -> new LinkedHashMap<>());
            JobEntry entry = jobs.get(stored.getId());
            if (entry == null) {
                entry = new JobEntry(stored, schedule);
                jobs.put(stored.getId(), entry);
                result = UpsertResult.INSERTED;
            } else {
                result = entry.job.isActive() ? UpsertResult.REPLACED_ACTIVE : UpsertResult.REPLACED_INACTIVE;
                entry.job = stored;
                entry.schedule = schedule;
            }
            entry.generation++;
            entry.status.setNextRun(nextRun);
            version.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }

        if (unsatisfiable != null) {
            throw unsatisfiable;
        }
        return result;
    }

    public boolean remove(String tenant, String jobId) {
        lock.writeLock().lock();
        try {
            Map<String, JobEntry> jobs = tenants.get(tenant);
            JobEntry entry = jobs != null ? jobs.remove(jobId) : null;
            if (entry == null) {
                return false;
            }
            entry.generation++;
            version.incrementAndGet();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Flips the active flag. Asking for the state the job is already in changes nothing
     * and still reports success.
     *
     * @return false only when the job does not exist
     * @throws UnsatisfiableScheduleException when activating a job without next occurrence;
     *                                        the job stays inactive
     */
    public boolean setActive(String tenant, String jobId, boolean active, NextRunResolver resolver)
            throws UnsatisfiableScheduleException {
        lock.writeLock().lock();
        try {
            JobEntry entry = find(tenant, jobId);
            if (entry == null) {
                return false;
            }
            if (entry.job.isActive() != active) {
                apply(entry, active, resolver);
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Bulk variant of {@link #setActive}. Jobs whose schedule never fires are left
     * inactive and logged.
     *
     * @return number of jobs whose flag changed
     */
    public int setAllActive(String tenant, boolean active, NextRunResolver resolver) {
        lock.writeLock().lock();
        try {
            Map<String, JobEntry> jobs = tenants.get(tenant);
            if (jobs == null) {
                return 0;
            }
            int count = 0;
            for (JobEntry entry : jobs.values()) {
                if (entry.job.isActive() == active) {
                    continue;
                }
                try {
                    apply(entry, active, resolver);
                    count++;
                } catch (UnsatisfiableScheduleException e) {
                    log.warn(">>>>>>>>>>> datacron, job {}/{} not activated: {}", tenant, entry.job.getId(), e.getMessage());
                }
            }
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void apply(JobEntry entry, boolean active, NextRunResolver resolver) throws UnsatisfiableScheduleException {
        Date nextRun = active ? resolver.resolve(entry.schedule) : null;
        entry.job.setActive(active);
        entry.status.setNextRun(nextRun);
        entry.generation++;
        version.incrementAndGet();
    }

    public CronJob get(String tenant, String jobId) {
        lock.readLock().lock();
        try {
            JobEntry entry = find(tenant, jobId);
            return entry != null ? entry.job.copy() : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<CronJob> list(String tenant) {
        lock.readLock().lock();
        try {
            Map<String, JobEntry> jobs = tenants.get(tenant);
            if (jobs == null) {
                return Collections.emptyList();
            }
            List<CronJob> list = new ArrayList<>(jobs.size());
            for (JobEntry entry : jobs.values()) {
                list.add(entry.job.copy());
            }
            return list;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Every tenant with a copy of its jobs, empty tenants included.
     */
    public Map<String, List<CronJob>> snapshot() {
        lock.readLock().lock();
        try {
            Map<String, List<CronJob>> snapshot = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, JobEntry>> tenant : tenants.entrySet()) {
                List<CronJob> list = new ArrayList<>(tenant.getValue().size());
                for (JobEntry entry : tenant.getValue().values()) {
                    list.add(entry.job.copy());
                }
                snapshot.put(tenant.getKey(), list);
            }
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Forgets every tenant and job. In-flight executions of the old jobs can no longer
     * write their outcome.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            for (Map<String, JobEntry> jobs : tenants.values()) {
                for (JobEntry entry : jobs.values()) {
                    entry.generation++;
                }
            }
            tenants.clear();
            version.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long getVersion() {
        return version.get();
    }


    // ---------------------- status ----------------------

    public JobStatus status(String tenant, String jobId) {
        lock.readLock().lock();
        try {
            JobEntry entry = find(tenant, jobId);
            return entry != null ? entry.status.copy() : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copies of the status of every job of the tenant, keyed by job id; null for an
     * unknown tenant.
     */
    public Map<String, JobStatus> allStatus(String tenant) {
        lock.readLock().lock();
        try {
            Map<String, JobEntry> jobs = tenants.get(tenant);
            if (jobs == null) {
                return null;
            }
            Map<String, JobStatus> statusMap = new LinkedHashMap<>();
            for (Map.Entry<String, JobEntry> item : jobs.entrySet()) {
                statusMap.put(item.getKey(), item.getValue().status.copy());
            }
            return statusMap;
        } finally {
            lock.readLock().unlock();
        }
    }


    // ---------------------- trigger engine ----------------------

    /**
     * The pending fire of one job, null when the job is unknown or inactive.
     */
    public FireHandle handleOf(String tenant, String jobId) {
        lock.readLock().lock();
        try {
            JobEntry entry = find(tenant, jobId);
            return entry != null ? entry.handle(tenant) : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<FireHandle> handlesOf(String tenant) {
        lock.readLock().lock();
        try {
            Map<String, JobEntry> jobs = tenants.get(tenant);
            if (jobs == null) {
                return Collections.emptyList();
            }
            List<FireHandle> handles = new ArrayList<>();
            for (JobEntry entry : jobs.values()) {
                FireHandle handle = entry.handle(tenant);
                if (handle != null) {
                    handles.add(handle);
                }
            }
            return handles;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isCurrent(FireHandle handle) {
        lock.readLock().lock();
        try {
            JobEntry entry = find(handle.getTenant(), handle.getJobId());
            return entry != null && handle.equals(entry.handle(handle.getTenant()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Turns a due handle into a firing, and moves the job's {@code nextRun} to the
     * occurrence after it in the same step.
     *
     * @param resolver next fire time, computed from the firing time of {@code handle}
     * @return null when the handle is stale (job removed, deactivated or replaced since)
     */
    public JobFiring claim(FireHandle handle, NextRunResolver resolver) {
        lock.writeLock().lock();
        try {
            JobEntry entry = find(handle.getTenant(), handle.getJobId());
            if (entry == null || !handle.equals(entry.handle(handle.getTenant()))) {
                return null;
            }

            FireHandle next = null;
            try {
                Date nextRun = resolver.resolve(entry.schedule);
                entry.status.setNextRun(nextRun);
                next = entry.handle(handle.getTenant());
            } catch (UnsatisfiableScheduleException e) {
                log.error(">>>>>>>>>>> datacron, job {}/{} has no further occurrence and is deactivated: {}",
                        handle.getTenant(), handle.getJobId(), e.getMessage());
                entry.job.setActive(false);
                entry.status.setNextRun(null);
                entry.generation++;
                version.incrementAndGet();
            }

            return new JobFiring(entry, handle.getTenant(), handle.getJobId(), entry.job.getUrl(),
                    new Date(handle.getFireTime()), next);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Writes the outcome of a firing into the job's status. Outcomes are applied in firing
     * time order: one that completes after a later firing already reported is dropped, as
     * is one whose job was removed in the meantime.
     *
     * @return whether the status was updated
     */
    public boolean recordOutcome(JobFiring firing, boolean success, String error) {
        lock.writeLock().lock();
        try {
            JobEntry entry = find(firing.getTenant(), firing.getJobId());
            if (entry != firing.entry) {
                return false;
            }
            long fireTime = firing.getFireTime().getTime();
            if (fireTime <= entry.lastAppliedFireTime) {
                return false;
            }
            entry.lastAppliedFireTime = fireTime;
            entry.status.setLastRun(firing.getFireTime());
            entry.status.setLastSuccess(success);
            entry.status.setLastError(success ? "" : error);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private JobEntry find(String tenant, String jobId) {
        Map<String, JobEntry> jobs = tenants.get(tenant);
        return jobs != null ? jobs.get(jobId) : null;
    }
}
