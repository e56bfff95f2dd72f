package com.datacron.core.registry;

import com.datacron.core.cron.CronSchedule;
import com.datacron.core.cron.UnsatisfiableScheduleException;

import java.util.Date;

/**
 * Computes the fire time a job gets when it becomes (or stays) scheduled. The registry
 * calls it while holding its write lock, so it must be a pure computation.
 */
@FunctionalInterface
public interface NextRunResolver {

    Date resolve(CronSchedule schedule) throws UnsatisfiableScheduleException;
}
