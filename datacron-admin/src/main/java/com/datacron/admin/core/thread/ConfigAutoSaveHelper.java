package com.datacron.admin.core.thread;

import com.datacron.admin.core.scheduler.DataCronScheduler;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

/**
 * Writes unsaved changes to the configuration file at a fixed interval.
 */
@Slf4j
public class ConfigAutoSaveHelper {

    private final DataCronScheduler dataCronScheduler;
    private final int interval; // seconds

    private Thread autoSaveThread;
    private volatile boolean toStop = false;

    public ConfigAutoSaveHelper(DataCronScheduler dataCronScheduler, int interval) {
        this.dataCronScheduler = dataCronScheduler;
        this.interval = interval;
    }

    public void start() {
        autoSaveThread = new Thread(() -> {
            while (!toStop) {
                try {
                    TimeUnit.SECONDS.sleep(interval);
                } catch (InterruptedException e) {
                    if (!toStop) {
                        log.error(e.getMessage(), e);
                    }
                    break;
                }

                try {
                    if (dataCronScheduler.save()) {
                        log.info(">>>>>>>>>>> datacron, configuration auto-saved");
                    }
                } catch (Exception e) {
                    if (!toStop) {
                        log.error(">>>>>>>>>>> datacron, configuration auto-save error:{}", e.getMessage(), e);
                    }
                }
            }
            log.info(">>>>>>>>>>> datacron, ConfigAutoSaveHelper stop");
        });
        autoSaveThread.setDaemon(true);
        autoSaveThread.setName("datacron, admin ConfigAutoSaveHelper");
        autoSaveThread.start();
    }

    public void toStop() {
        toStop = true;
        if (autoSaveThread == null) {
            return;
        }
        autoSaveThread.interrupt();
        try {
            autoSaveThread.join();
        } catch (InterruptedException e) {
            log.error(e.getMessage(), e);
            Thread.currentThread().interrupt();
        }
    }
}
