package com.datacron.core.thread;

import com.datacron.core.biz.JobCallBiz;
import com.datacron.core.biz.client.JobCallBizClient;
import com.datacron.core.cron.FieldOutOfRangeException;
import com.datacron.core.cron.MalformedExpressionException;
import com.datacron.core.cron.UnsatisfiableScheduleException;
import com.datacron.core.model.CronJob;
import com.datacron.core.model.JobStatus;
import com.datacron.core.model.ReturnT;
import com.datacron.core.registry.JobRegistry;
import com.datacron.core.registry.UpsertResult;
import com.datacron.core.trigger.JobTrigger;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobScheduleHelperTest {

    private final JobRegistry registry = new JobRegistry();
    private final ConcurrentLinkedQueue<String> calls = new ConcurrentLinkedQueue<>();

    private JobTriggerPoolHelper poolHelper;
    private JobScheduleHelper scheduleHelper;
    private HttpServer server;

    private void start(JobCallBiz jobCallBiz) {
        poolHelper = new JobTriggerPoolHelper(new JobTrigger(registry, jobCallBiz), 10, 10);
        poolHelper.start();
        scheduleHelper = new JobScheduleHelper(registry, poolHelper, ZoneOffset.UTC, Clock.systemUTC());
        scheduleHelper.start();
    }

    private void startRecording() {
        start(url -> {
            calls.add(url);
            return ReturnT.SUCCESS;
        });
    }

    @AfterEach
    void tearDown() {
        if (scheduleHelper != null) {
            scheduleHelper.toStop();
        }
        if (poolHelper != null) {
            poolHelper.stop();
        }
        if (server != null) {
            server.stop(0);
        }
    }

    private static boolean await(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return condition.getAsBoolean();
    }

    private static CronJob job(String id, String cron, boolean active) {
        return new CronJob(id, cron, "http://target/" + id, active);
    }

    @Test
    void activeJobFiresAndIsRescheduledFromItsFiringTime() throws Exception {
        startRecording();

        scheduleHelper.addJob("alice", job("tick", "* * * * * *", true));

        assertThat(await(() -> registry.status("alice", "tick").getLastRun() != null, 3000)).isTrue();
        JobStatus status = registry.status("alice", "tick");
        assertThat(status.isLastSuccess()).isTrue();
        assertThat(status.getLastRun().getTime() % 1000).isZero();
        assertThat(status.getNextRun()).isAfter(status.getLastRun());
        assertThat(calls).contains("http://target/tick");
        assertThat(scheduleHelper.isRunning()).isTrue();
    }

    @Test
    void inactiveJobNeverFires() throws Exception {
        startRecording();

        scheduleHelper.addJob("alice", job("idle", "* * * * * *", false));
        Thread.sleep(1500);

        assertThat(calls).isEmpty();
        assertThat(scheduleHelper.pendingCount("alice")).isZero();
        assertThat(registry.status("alice", "idle").getNextRun()).isNull();
    }

    @Test
    void deactivationCancelsThePendingFire() throws Exception {
        startRecording();
        scheduleHelper.addJob("alice", job("tick", "* * * * * *", true));
        assertThat(await(() -> calls.contains("http://target/tick"), 3000)).isTrue();

        scheduleHelper.setActive("alice", "tick", false);
        Thread.sleep(200);
        calls.clear();
        Thread.sleep(2000);

        assertThat(calls).isEmpty();
        assertThat(scheduleHelper.pendingCount()).isZero();
        assertThat(registry.status("alice", "tick").getNextRun()).isNull();
    }

    @Test
    void removalCancelsThePendingFire() throws Exception {
        startRecording();
        scheduleHelper.addJob("alice", job("tick", "* * * * * *", true));

        assertThat(scheduleHelper.removeJob("alice", "tick")).isTrue();
        assertThat(scheduleHelper.removeJob("alice", "tick")).isFalse();
        calls.clear();
        Thread.sleep(1500);

        assertThat(calls).isEmpty();
        assertThat(scheduleHelper.pendingCount()).isZero();
    }

    @Test
    void replacingAScheduleTakesEffectImmediately() throws Exception {
        startRecording();
        scheduleHelper.addJob("alice", job("j", "0 0 0 1 1 *", true));
        long farAway = registry.status("alice", "j").getNextRun().getTime();

        assertThat(scheduleHelper.addJob("alice", job("j", "* * * * * *", true))).isEqualTo(UpsertResult.REPLACED_ACTIVE);

        assertThat(registry.status("alice", "j").getNextRun().getTime()).isLessThan(farAway);
        assertThat(await(() -> calls.contains("http://target/j"), 3000)).isTrue();
        assertThat(scheduleHelper.pendingCount("alice")).isEqualTo(1);
    }

    @Test
    void invalidCronIsRejectedAndNothingIsStored() {
        startRecording();

        assertThatThrownBy(() -> scheduleHelper.addJob("alice", job("bad", "61 * * * * *", true)))
                .isInstanceOf(FieldOutOfRangeException.class);
        assertThatThrownBy(() -> scheduleHelper.addJob("alice", job("bad", "* * *", true)))
                .isInstanceOf(MalformedExpressionException.class);
        assertThatThrownBy(() -> scheduleHelper.addJob("alice", job("", "* * * * *", true)))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(registry.get("alice", "bad")).isNull();
    }

    @Test
    void unsatisfiableActivationLeavesTheJobInactive() throws Exception {
        startRecording();

        assertThatThrownBy(() -> scheduleHelper.addJob("alice", job("feb31", "0 0 0 31 2 *", true)))
                .isInstanceOf(UnsatisfiableScheduleException.class);
        assertThat(registry.get("alice", "feb31").isActive()).isFalse();
        assertThatThrownBy(() -> scheduleHelper.setActive("alice", "feb31", true))
                .isInstanceOf(UnsatisfiableScheduleException.class);
        assertThat(scheduleHelper.pendingCount()).isZero();
    }

    @Test
    void bulkDeactivationEmptiesTheTenantsQueue() throws Exception {
        startRecording();
        for (int i = 0; i < 10; i++) {
            scheduleHelper.addJob("alice", job("job" + i, "0 0 * * * *", true));
        }
        scheduleHelper.addJob("bob", job("other", "0 0 * * * *", true));
        assertThat(scheduleHelper.pendingCount("alice")).isEqualTo(10);

        assertThat(scheduleHelper.setAllActive("alice", false)).isEqualTo(10);

        assertThat(scheduleHelper.pendingCount("alice")).isZero();
        assertThat(scheduleHelper.pendingCount("bob")).isEqualTo(1);
        Map<String, JobStatus> statusMap = registry.allStatus("alice");
        assertThat(statusMap).hasSize(10);
        assertThat(statusMap.values()).allSatisfy(status -> assertThat(status.getNextRun()).isNull());

        assertThat(scheduleHelper.setAllActive("alice", true)).isEqualTo(10);
        assertThat(scheduleHelper.pendingCount("alice")).isEqualTo(10);
    }

    @Test
    void removingATenantDropsItsFires() throws Exception {
        startRecording();
        scheduleHelper.addJob("alice", job("a", "* * * * * *", true));
        scheduleHelper.addJob("bob", job("b", "0 0 * * * *", true));

        assertThat(scheduleHelper.removeTenant("alice")).isTrue();

        assertThat(scheduleHelper.pendingCount()).isEqualTo(1);
        assertThat(registry.hasTenant("alice")).isFalse();
    }

    @Test
    void replaceJobsValidatesEverythingFirst() throws Exception {
        startRecording();
        scheduleHelper.addJob("alice", job("keep", "0 0 * * * *", true));
        scheduleHelper.addJob("drop", job("x", "0 0 * * * *", true));

        List<CronJob> bad = Arrays.asList(job("a", "0 0 * * * *", true), job("b", "nope", true));
        assertThatThrownBy(() -> scheduleHelper.replaceJobs("alice", bad)).isInstanceOf(MalformedExpressionException.class);
        assertThat(registry.list("alice")).extracting(CronJob::getId).containsExactly("keep");

        scheduleHelper.replaceJobs("alice", Arrays.asList(job("a", "0 0 * * * *", true), job("b", "0 0 * * * *", false)));

        assertThat(registry.list("alice")).extracting(CronJob::getId).containsExactly("a", "b");
        assertThat(scheduleHelper.pendingCount("alice")).isEqualTo(1);
        assertThat(scheduleHelper.pendingCount()).isEqualTo(2);
    }

    @Test
    void slowCallDoesNotDelayOtherJobs() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        start(url -> {
            if (url.endsWith("/hang")) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            calls.add(url);
            return ReturnT.SUCCESS;
        });

        scheduleHelper.addJob("alice", job("hang", "* * * * * *", true));
        scheduleHelper.addJob("alice", job("quick", "* * * * * *", true));

        try {
            assertThat(await(() -> Collections.frequency(new ArrayList<>(calls), "http://target/quick") >= 2, 4000)).isTrue();
            assertThat(calls).doesNotContain("http://target/hang");
        } finally {
            release.countDown();
        }
    }

    @Test
    void throwingTargetDoesNotStopTheEngine() throws Exception {
        start(url -> {
            calls.add(url);
            throw new IllegalStateException("boom");
        });

        scheduleHelper.addJob("alice", job("bad", "* * * * * *", true));

        assertThat(await(() -> calls.size() >= 2, 4000)).isTrue();
        assertThat(registry.status("alice", "bad").getLastError()).contains("boom");
        assertThat(scheduleHelper.isRunning()).isTrue();
    }

    @Test
    void loadSkipsInvalidJobsAndSchedulesActiveOnes() throws Exception {
        startRecording();
        Map<String, List<CronJob>> config = new LinkedHashMap<>();
        config.put("alice", Arrays.asList(job("a", "0 0 * * * *", true), job("broken", "99 * * * * *", true),
                job("off", "0 0 * * * *", false), job(null, "0 0 * * * *", true), job("  ", "0 0 * * * *", true),
                null));
        config.put("empty", null);

        scheduleHelper.load(config);

        assertThat(registry.listTenants()).containsExactly("alice", "empty");
        assertThat(registry.list("alice")).extracting(CronJob::getId).containsExactly("a", "off");
        assertThat(scheduleHelper.pendingCount()).isEqualTo(1);

        // later changes in the same tenant still reschedule normally
        scheduleHelper.addJob("alice", job("b", "0 0 * * * *", true));
        assertThat(scheduleHelper.pendingCount("alice")).isEqualTo(2);
    }

    @Test
    void reloadReplacesEverything() throws Exception {
        startRecording();
        scheduleHelper.addJob("alice", job("old", "* * * * * *", true));

        scheduleHelper.reload(Collections.singletonMap("bob", Collections.singletonList(job("new", "* * * * * *", true))));

        assertThat(registry.hasTenant("alice")).isFalse();
        assertThat(scheduleHelper.isRunning()).isTrue();
        calls.clear();
        assertThat(await(() -> calls.contains("http://target/new"), 3000)).isTrue();
        assertThat(calls).doesNotContain("http://target/old");
    }

    @Test
    void everyFiveSecondsOverHttp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hook", exchange -> {
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.start();
        start(new JobCallBizClient(5));

        scheduleHelper.addJob("alice", new CronJob("hook", "*/5 * * * * *",
                "http://127.0.0.1:" + server.getAddress().getPort() + "/hook", true));

        assertThat(await(() -> registry.status("alice", "hook").getLastRun() != null, 7000)).isTrue();
        JobStatus status = registry.status("alice", "hook");
        assertThat(status.isLastSuccess()).isTrue();
        assertThat(status.getLastError()).isEmpty();
        assertThat(status.getNextRun().getTime() - status.getLastRun().getTime()).isEqualTo(5000);
    }

    @Test
    void timedOutCallIsAFailureAndTheJobStaysScheduled() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.setExecutor(Executors.newCachedThreadPool());
        server.start();
        start(new JobCallBizClient(1));

        scheduleHelper.addJob("alice", new CronJob("slow", "* * * * * *",
                "http://127.0.0.1:" + server.getAddress().getPort() + "/slow", true));

        assertThat(await(() -> registry.status("alice", "slow").getLastRun() != null, 5000)).isTrue();
        JobStatus status = registry.status("alice", "slow");
        assertThat(status.isLastSuccess()).isFalse();
        assertThat(status.getLastError()).isNotEmpty();
        assertThat(status.getNextRun()).isAfter(status.getLastRun());
        assertThat(scheduleHelper.pendingCount("alice")).isEqualTo(1);
    }
}
