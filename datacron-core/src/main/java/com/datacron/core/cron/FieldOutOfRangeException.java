package com.datacron.core.cron;

import lombok.Getter;

/**
 * One field of the expression holds a token outside the field's domain, or a token that
 * is not a number at all.
 */
@Getter
public class FieldOutOfRangeException extends CronException {

    private static final long serialVersionUID = 42L;

    /** index of the offending field in the six-field layout, 0 = second */
    private final int fieldIndex;
    private final CronField field;
    private final String token;

    public FieldOutOfRangeException(String expression, CronField field, String token) {
        super("invalid value '" + token + "' for field " + field.ordinal() + " (" + field.getTitle()
                + ", allowed " + field.getMin() + "-" + field.getMax() + ")", expression);
        this.fieldIndex = field.ordinal();
        this.field = field;
        this.token = token;
    }
}
