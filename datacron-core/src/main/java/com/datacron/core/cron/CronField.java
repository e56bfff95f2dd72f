package com.datacron.core.cron;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The six fields of a cron expression, in the order they appear in the
 * canonical form, together with their value domains.
 */
@Getter
@AllArgsConstructor
public enum CronField {

    SECOND("second", 0, 59),
    MINUTE("minute", 0, 59),
    HOUR("hour", 0, 23),
    DAY_OF_MONTH("day-of-month", 1, 31),
    MONTH("month", 1, 12),
    /** 0 is Sunday */
    DAY_OF_WEEK("day-of-week", 0, 6);

    private final String title;
    private final int min;
    private final int max;

    public boolean isDayField() {
        return this == DAY_OF_MONTH || this == DAY_OF_WEEK;
    }
}
