package com.datacron.core.thread;

import com.datacron.core.cron.CronException;
import com.datacron.core.cron.CronExpressionParser;
import com.datacron.core.cron.CronSchedule;
import com.datacron.core.cron.UnsatisfiableScheduleException;
import com.datacron.core.model.CronJob;
import com.datacron.core.registry.FireHandle;
import com.datacron.core.registry.JobFiring;
import com.datacron.core.registry.JobRegistry;
import com.datacron.core.registry.NextRunResolver;
import com.datacron.core.registry.UpsertResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <h1>The trigger engine</h1>
 *
 * One schedule thread waits for the earliest pending fire of all active jobs, claims every
 * job that is due, reschedules it from its firing time and hands the firings to the
 * {@link JobTriggerPoolHelper}. It never waits for a call to finish.
 *
 * Every structural change (add, replace, remove, activate, deactivate, tenant removal)
 * goes through this class: it updates the {@link JobRegistry}, replaces the job's entry in
 * the pending queue and signals the schedule thread, all under one monitor, so the thread
 * always re-evaluates its wait target after a change. The registry's generation check is
 * the second line: a handle the queue still held for a job changed in the meantime is
 * refused by {@link JobRegistry#claim}.
 *
 * Lock order: this monitor first, then the registry lock.
 */
@Slf4j
public class JobScheduleHelper {

    private final JobRegistry jobRegistry;
    private final JobTriggerPoolHelper triggerPoolHelper;
    @Getter
    private final ZoneId zone;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeup = lock.newCondition();

    /** pending fires of all active jobs, earliest first; guarded by {@link #lock} */
    private final PriorityQueue<FireHandle> pendingFires = new PriorityQueue<>(FireHandle.BY_FIRE_TIME);

    private Thread scheduleThread;
    private volatile boolean scheduleThreadToStop = false;

    public JobScheduleHelper(JobRegistry jobRegistry, JobTriggerPoolHelper triggerPoolHelper, ZoneId zone, Clock clock) {
        this.jobRegistry = jobRegistry;
        this.triggerPoolHelper = triggerPoolHelper;
        this.zone = zone;
        this.clock = clock;
    }


    // ---------------------- lifecycle ----------------------

    public void start() {
        lock.lock();
        try {
            if (scheduleThread != null && scheduleThread.isAlive()) {
                return;
            }
            scheduleThreadToStop = false;
            scheduleThread = new Thread(this::runSchedule);
            scheduleThread.setDaemon(true);
            scheduleThread.setName("datacron, JobScheduleHelper#scheduleThread");
            scheduleThread.start();
        } finally {
            lock.unlock();
        }
    }

    public void toStop() {
        scheduleThreadToStop = true;
        lock.lock();
        try {
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }

        Thread thread = scheduleThread;
        if (thread != null) {
            try {
                thread.join(1000);
                if (thread.isAlive()) {
                    thread.interrupt();
                    thread.join();
                }
            } catch (InterruptedException e) {
                log.error(e.getMessage(), e);
                Thread.currentThread().interrupt();
            }
        }
        log.info(">>>>>>>>>>> datacron, JobScheduleHelper stop");
    }

    public boolean isRunning() {
        Thread thread = scheduleThread;
        return thread != null && thread.isAlive() && !scheduleThreadToStop;
    }

    /**
     * Registers every tenant and job of {@code tenantJobs}. Active jobs get their first fire
     * relative to now; fires missed while the service was down are not replayed. Jobs
     * without an id, and jobs whose cron expression does not parse, are skipped.
     */
    public void load(Map<String, List<CronJob>> tenantJobs) {
        lock.lock();
        try {
            NextRunResolver fromNow = fromNow();
            int count = 0;
            for (Map.Entry<String, List<CronJob>> item : tenantJobs.entrySet()) {
                String tenant = item.getKey();
                jobRegistry.addTenant(tenant);
                if (item.getValue() == null) {
                    continue;
                }
                for (CronJob job : item.getValue()) {
                    if (job == null || job.getId() == null || job.getId().trim().isEmpty()) {
                        log.error(">>>>>>>>>>> datacron, job of user {} without id skipped", tenant);
                        continue;
                    }
                    try {
                        CronSchedule schedule = CronExpressionParser.parse(job.getCron());
                        jobRegistry.upsert(tenant, job, schedule, fromNow);
                        count++;
                    } catch (UnsatisfiableScheduleException e) {
                        count++;
                        log.error(">>>>>>>>>>> datacron, job {}/{} loaded inactive: {}", tenant, job.getId(), e.getMessage());
                    } catch (CronException e) {
                        log.error(">>>>>>>>>>> datacron, job {}/{} skipped: {}", tenant, job.getId(), e.getMessage());
                    }
                }
                pendingFires.addAll(jobRegistry.handlesOf(tenant));
            }
            wakeup.signalAll();
            log.info(">>>>>>>>>>> datacron, loaded {} jobs of {} users, {} scheduled", count, tenantJobs.size(), pendingFires.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the schedule thread, drops every pending fire and every registered job, loads
     * {@code tenantJobs} and starts a fresh schedule thread.
     */
    public void reload(Map<String, List<CronJob>> tenantJobs) {
        toStop();
        lock.lock();
        try {
            pendingFires.clear();
            jobRegistry.clear();
            load(tenantJobs);
        } finally {
            lock.unlock();
        }
        start();
    }


    // ---------------------- structural changes ----------------------

    /**
     * Validates the job's cron expression, then inserts or replaces the job. A replaced
     * job loses its pending fire; an active one gets a new fire from now on.
     *
     * @throws CronException when the expression is invalid (nothing is stored) or never
     *                       fires (the job is stored inactive)
     */
    public UpsertResult addJob(String tenant, CronJob job) throws CronException {
        requireId(job);
        CronSchedule schedule = CronExpressionParser.parse(job.getCron());

        lock.lock();
        try {
            try {
                return jobRegistry.upsert(tenant, job, schedule, fromNow());
            } finally {
                reschedule(tenant, job.getId());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the whole job list of a tenant. Every expression is validated, and every
     * active job checked for a next occurrence, before anything changes. Jobs that stay keep
     * their run history.
     */
    public void replaceJobs(String tenant, List<CronJob> jobs) throws CronException {
        Map<String, CronSchedule> schedules = new LinkedHashMap<>();
        Date now = new Date(clock.millis());
        for (CronJob job : jobs) {
            requireId(job);
            CronSchedule schedule = CronExpressionParser.parse(job.getCron());
            if (job.isActive()) {
                schedule.getNextValidTimeAfter(now, zone);
            }
            schedules.put(job.getId(), schedule);
        }

        lock.lock();
        try {
            Set<String> keep = new HashSet<>(schedules.keySet());
            for (CronJob existing : jobRegistry.list(tenant)) {
                if (!keep.contains(existing.getId())) {
                    jobRegistry.remove(tenant, existing.getId());
                }
            }
            jobRegistry.addTenant(tenant);
            NextRunResolver fromNow = fromNow();
            for (CronJob job : jobs) {
                try {
                    jobRegistry.upsert(tenant, job, schedules.get(job.getId()), fromNow);
                } catch (UnsatisfiableScheduleException e) {
                    log.error(">>>>>>>>>>> datacron, job {}/{} stored inactive: {}", tenant, job.getId(), e.getMessage());
                }
            }
            pendingFires.removeIf(handle -> handle.getTenant().equals(tenant));
            pendingFires.addAll(jobRegistry.handlesOf(tenant));
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean removeJob(String tenant, String jobId) {
        lock.lock();
        try {
            boolean removed = jobRegistry.remove(tenant, jobId);
            reschedule(tenant, jobId);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return false when the job does not exist
     * @throws UnsatisfiableScheduleException when activating a job that never fires
     */
    public boolean setActive(String tenant, String jobId, boolean active) throws UnsatisfiableScheduleException {
        lock.lock();
        try {
            try {
                return jobRegistry.setActive(tenant, jobId, active, fromNow());
            } finally {
                reschedule(tenant, jobId);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of jobs whose active flag changed
     */
    public int setAllActive(String tenant, boolean active) {
        lock.lock();
        try {
            int count = jobRegistry.setAllActive(tenant, active, fromNow());
            pendingFires.removeIf(handle -> handle.getTenant().equals(tenant));
            pendingFires.addAll(jobRegistry.handlesOf(tenant));
            wakeup.signalAll();
            return count;
        } finally {
            lock.unlock();
        }
    }

    public boolean addTenant(String tenant) {
        return jobRegistry.addTenant(tenant);
    }

    /**
     * Removes the tenant and, in the same step, every pending fire of its jobs.
     */
    public boolean removeTenant(String tenant) {
        lock.lock();
        try {
            boolean removed = jobRegistry.removeTenant(tenant);
            pendingFires.removeIf(handle -> handle.getTenant().equals(tenant));
            wakeup.signalAll();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pendingFires.size();
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount(String tenant) {
        lock.lock();
        try {
            int count = 0;
            for (FireHandle handle : pendingFires) {
                if (handle.getTenant().equals(tenant)) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    /** caller holds {@link #lock} */
    private void reschedule(String tenant, String jobId) {
        pendingFires.removeIf(handle -> handle.isFor(tenant, jobId));
        FireHandle handle = jobRegistry.handleOf(tenant, jobId);
        if (handle != null) {
            pendingFires.add(handle);
        }
        wakeup.signalAll();
    }

    private static void requireId(CronJob job) {
        if (job.getId() == null || job.getId().trim().isEmpty()) {
            throw new IllegalArgumentException("job id is required");
        }
    }

    private NextRunResolver fromNow() {
        final Date now = new Date(clock.millis());
        return schedule -> schedule.getNextValidTimeAfter(now, zone);
    }


    // ---------------------- schedule thread ----------------------

    private void runSchedule() {
        log.info(">>>>>>>>> init datacron scheduler success.");

        while (!scheduleThreadToStop) {
            List<JobFiring> firingList = new ArrayList<>();

            lock.lock();
            try {
                FireHandle head = pendingFires.peek();
                long nowTime = clock.millis();
                if (head == null) {
                    wakeup.await();
                    continue;
                }
                if (head.getFireTime() > nowTime) {
                    wakeup.await(head.getFireTime() - nowTime, TimeUnit.MILLISECONDS);
                    continue;
                }

                while (head != null && head.getFireTime() <= nowTime) {
                    pendingFires.poll();
                    // the next fire is computed from the firing time, so a late wakeup never shifts the schedule
                    final Date fireTime = new Date(head.getFireTime());
                    JobFiring firing = jobRegistry.claim(head, schedule -> schedule.getNextValidTimeAfter(fireTime, zone));
                    if (firing != null) {
                        firingList.add(firing);
                        if (firing.getNext() != null) {
                            pendingFires.add(firing.getNext());
                        }
                    } else {
                        log.debug(">>>>>>>>>>> datacron, stale fire dropped: {}", head);
                    }
                    head = pendingFires.peek();
                }
            } catch (InterruptedException e) {
                if (!scheduleThreadToStop) {
                    log.error(e.getMessage(), e);
                }
            } catch (Exception e) {
                if (!scheduleThreadToStop) {
                    log.error(">>>>>>>>>>> datacron, JobScheduleHelper#scheduleThread error:{}", e.getMessage(), e);
                }
            } finally {
                lock.unlock();
            }

            for (JobFiring firing : firingList) {
                try {
                    triggerPoolHelper.trigger(firing);
                    log.debug(">>>>>>>>>>> datacron, schedule push trigger : {}", firing);
                } catch (Exception e) {
                    log.error(">>>>>>>>>>> datacron, trigger of {} failed:{}", firing, e.getMessage(), e);
                }
            }
        }

        log.info(">>>>>>>>>>> datacron, JobScheduleHelper#scheduleThread stop");
    }
}
