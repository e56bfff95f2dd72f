package com.datacron.core.cron;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.ZoneId;
import java.util.BitSet;
import java.util.Date;

/**
 * <h1>A parsed, validated cron expression</h1>
 *
 * Holds one value set per {@link CronField}. Two schedules are equal when they match the
 * same instants, no matter how the source text was spelled, so {@code "*&#47;30 * * * *"}
 * and {@code "0 0,30 * * * *"} compare equal while keeping their own canonical strings.
 * Instances are immutable and can be shared between threads.
 */
@EqualsAndHashCode(of = {"fields", "dayOfMonthRestricted", "dayOfWeekRestricted"})
public final class CronSchedule {

    /** canonical six-field form: single spaces, asterisk runs collapsed */
    @Getter
    private final String expression;

    private final BitSet[] fields;

    @Getter
    private final boolean dayOfMonthRestricted;
    @Getter
    private final boolean dayOfWeekRestricted;

    CronSchedule(String expression, BitSet[] fields, boolean dayOfMonthRestricted, boolean dayOfWeekRestricted) {
        this.expression = expression;
        this.fields = fields;
        this.dayOfMonthRestricted = dayOfMonthRestricted;
        this.dayOfWeekRestricted = dayOfWeekRestricted;
    }

    public boolean matches(CronField field, int value) {
        return fields[field.ordinal()].get(value);
    }

    /**
     * Day-of-month and day-of-week are OR-ed when both are restricted; otherwise the
     * restricted one decides (an unrestricted field has every bit set).
     */
    public boolean matchesDay(int dayOfMonth, int dayOfWeek) {
        boolean domMatch = matches(CronField.DAY_OF_MONTH, dayOfMonth);
        boolean dowMatch = matches(CronField.DAY_OF_WEEK, dayOfWeek);
        if (dayOfMonthRestricted && dayOfWeekRestricted) {
            return domMatch || dowMatch;
        }
        return domMatch && dowMatch;
    }

    /**
     * The earliest instant strictly after {@code after} that matches this schedule.
     */
    public Date getNextValidTimeAfter(Date after, ZoneId zone) throws UnsatisfiableScheduleException {
        return NextOccurrence.next(this, after, zone);
    }

    @Override
    public String toString() {
        return expression;
    }
}
