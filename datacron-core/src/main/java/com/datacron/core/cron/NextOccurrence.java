package com.datacron.core.cron;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.Date;

/**
 * <h1>Computes the next instant matching a {@link CronSchedule}</h1>
 *
 * The search starts one second after the reference instant and walks forward in local
 * time of the given zone: a mismatch on a field skips to the start of the next unit of
 * that field (month, day, hour, minute, second), the calendar arithmetic of
 * {@link LocalDateTime} taking care of month lengths and leap years.
 *
 * A local time inside a gap (clocks moved forward) fires shifted by the length of the
 * gap. Local times that exist twice (clocks moved back) fire in both passes: the walk
 * maps local times with the earlier offset, and the repeated hour of an overlap next to
 * the reference is searched again with the later offset.
 *
 * Two limits stop the search for schedules that never fire: a horizon in years past the
 * reference instant and a cap on loop iterations.
 */
public final class NextOccurrence {

    /** long enough for a Feb 29 schedule across a century year that is not a leap year */
    public static final int SEARCH_HORIZON_YEARS = 10;

    private static final int MAX_ITERATIONS = 1_000_000;

    private NextOccurrence() {
    }

    public static Date next(CronSchedule schedule, Date after, ZoneId zone) throws UnsatisfiableScheduleException {
        Instant reference = after.toInstant();
        LocalDateTime start = LocalDateTime.ofInstant(reference, zone)
                .truncatedTo(ChronoUnit.SECONDS)
                .plusSeconds(1);
        LocalDateTime limit = start.withDayOfYear(1).truncatedTo(ChronoUnit.DAYS)
                .plusYears(SEARCH_HORIZON_YEARS + 1);

        Instant next = null;
        LocalDateTime time = start;
        while (next == null) {
            time = search(schedule, time, limit);
            if (time == null) {
                break;
            }
            Instant candidate = time.atZone(zone).toInstant();
            if (candidate.isAfter(reference)) {
                next = candidate;
            } else {
                // second pass of an overlap, handled below
                time = time.plusSeconds(1);
            }
        }

        ZoneRules rules = zone.getRules();
        Instant repeated = laterPass(schedule, rules.previousTransition(reference.plusSeconds(1)), reference);
        if (repeated == null) {
            repeated = laterPass(schedule, rules.nextTransition(reference), reference);
        }
        if (repeated != null && (next == null || repeated.isBefore(next))) {
            next = repeated;
        }

        if (next == null) {
            throw new UnsatisfiableScheduleException("no time within " + SEARCH_HORIZON_YEARS
                    + " years after " + reference + " matches the cron expression", schedule.getExpression());
        }
        return Date.from(next);
    }

    /**
     * First match after {@code reference} among the local times an overlap repeats, read
     * with the offset in force after the transition.
     */
    private static Instant laterPass(CronSchedule schedule, ZoneOffsetTransition transition, Instant reference) {
        if (transition == null || !transition.isOverlap()) {
            return null;
        }
        Instant end = transition.getInstant().plus(transition.getDuration());
        if (!end.isAfter(reference)) {
            return null;
        }

        LocalDateTime start = transition.getDateTimeAfter();
        if (!reference.isBefore(transition.getInstant())) {
            start = LocalDateTime.ofInstant(reference, transition.getOffsetAfter())
                    .truncatedTo(ChronoUnit.SECONDS)
                    .plusSeconds(1);
        }
        LocalDateTime time = search(schedule, start, transition.getDateTimeBefore());
        return time != null ? time.toInstant(transition.getOffsetAfter()) : null;
    }

    /**
     * Earliest local time at or after {@code time} and before {@code limit} that matches,
     * or null.
     */
    private static LocalDateTime search(CronSchedule schedule, LocalDateTime time, LocalDateTime limit) {
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            if (!time.isBefore(limit)) {
                return null;
            }

            if (!schedule.matches(CronField.MONTH, time.getMonthValue())) {
                time = time.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1).plusMonths(1);
                continue;
            }
            // java.time counts Monday as 1 and Sunday as 7, cron counts Sunday as 0
            int dayOfWeek = time.getDayOfWeek().getValue() % 7;
            if (!schedule.matchesDay(time.getDayOfMonth(), dayOfWeek)) {
                time = time.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (!schedule.matches(CronField.HOUR, time.getHour())) {
                time = time.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!schedule.matches(CronField.MINUTE, time.getMinute())) {
                time = time.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
                continue;
            }
            if (!schedule.matches(CronField.SECOND, time.getSecond())) {
                time = time.plusSeconds(1);
                continue;
            }
            return time;
        }
        return null;
    }
}
