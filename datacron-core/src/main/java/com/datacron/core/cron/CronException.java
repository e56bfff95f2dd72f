package com.datacron.core.cron;

import lombok.Getter;

/**
 * Base type of every error raised while parsing or evaluating a cron expression.
 */
public class CronException extends Exception {

    private static final long serialVersionUID = 42L;

    @Getter
    private final String expression;

    public CronException(String message, String expression) {
        super(message);
        this.expression = expression;
    }
}
