package com.datacron.core.cron;

/**
 * The expression parsed fine but no instant within the search horizon matches it,
 * e.g. {@code 0 0 0 31 2 *}.
 */
public class UnsatisfiableScheduleException extends CronException {

    private static final long serialVersionUID = 42L;

    public UnsatisfiableScheduleException(String message, String expression) {
        super(message, expression);
    }
}
