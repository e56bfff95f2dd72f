package com.datacron.core.thread;

import com.datacron.core.registry.JobFiring;
import com.datacron.core.trigger.JobTrigger;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <h1>Runs job firings off the dispatch thread</h1>
 *
 * Two pools isolate slow targets from the others. Every firing starts in the fast pool;
 * a job whose calls took longer than {@link #SLOW_CALL_MS} more than
 * {@link #SLOW_CALL_LIMIT} times within the current minute is sent to the slow pool until
 * the counters reset at the next minute.
 */
@Slf4j
public class JobTriggerPoolHelper {

    public static final long SLOW_CALL_MS = 500;
    public static final int SLOW_CALL_LIMIT = 10;

    private final JobTrigger jobTrigger;
    private final int fastMax;
    private final int slowMax;

    private ThreadPoolExecutor fastTriggerPool = null;
    private ThreadPoolExecutor slowTriggerPool = null;

    /** minute of the current slow-call window */
    private volatile long minTim = System.currentTimeMillis() / 60000;

    /** job key -> slow calls within the current minute */
    private volatile ConcurrentMap<String, AtomicInteger> jobTimeoutCountMap = new ConcurrentHashMap<>();

    public JobTriggerPoolHelper(JobTrigger jobTrigger, int fastMax, int slowMax) {
        this.jobTrigger = jobTrigger;
        this.fastMax = fastMax;
        this.slowMax = slowMax;
    }

    public void start() {
        fastTriggerPool = new ThreadPoolExecutor(
                Math.min(10, fastMax),
                fastMax,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000),
                r -> new Thread(r, "datacron, JobTriggerPoolHelper-fastTriggerPool-" + r.hashCode())
        );
        slowTriggerPool = new ThreadPoolExecutor(
                Math.min(10, slowMax),
                slowMax,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(2000),
                r -> new Thread(r, "datacron, JobTriggerPoolHelper-slowTriggerPool-" + r.hashCode())
        );
    }

    public void stop() {
        if (fastTriggerPool != null) {
            fastTriggerPool.shutdownNow();
        }
        if (slowTriggerPool != null) {
            slowTriggerPool.shutdownNow();
        }
        log.info(">>>>>>>>> datacron trigger thread pool shutdown success.");
    }

    /**
     * Hands the firing to one of the pools. Does not block and does not throw: a firing
     * the pools cannot take is recorded as failed.
     */
    public void trigger(final JobFiring firing) {
        final String jobKey = firing.getJobKey();

        ThreadPoolExecutor triggerPool_ = fastTriggerPool;
        AtomicInteger jobTimeoutCount = jobTimeoutCountMap.get(jobKey);
        if (jobTimeoutCount != null && jobTimeoutCount.get() > SLOW_CALL_LIMIT) {
            triggerPool_ = slowTriggerPool;
        }

        try {
            triggerPool_.execute(() -> {
                long start = System.currentTimeMillis();
                try {
                    jobTrigger.trigger(firing);
                } catch (Exception e) {
                    log.error(e.getMessage(), e);
                } finally {
                    long minTim_now = System.currentTimeMillis() / 60000;
                    if (minTim != minTim_now) {
                        minTim = minTim_now;
                        jobTimeoutCountMap.clear();
                    }

                    long cost = System.currentTimeMillis() - start;
                    if (cost > SLOW_CALL_MS) {
                        AtomicInteger timeoutCount = jobTimeoutCountMap.putIfAbsent(jobKey, new AtomicInteger(1));
                        if (timeoutCount != null) {
                            timeoutCount.incrementAndGet();
                        }
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            jobTrigger.fail(firing, "trigger pool exhausted, firing dropped");
        }
    }
}
