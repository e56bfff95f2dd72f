package com.datacron.core.cron;

/**
 * The expression does not have the shape of a cron expression, e.g. a wrong field count.
 */
public class MalformedExpressionException extends CronException {

    private static final long serialVersionUID = 42L;

    public MalformedExpressionException(String message, String expression) {
        super(message, expression);
    }
}
