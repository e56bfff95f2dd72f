package com.datacron.core.cron;

import java.util.Arrays;
import java.util.BitSet;
import java.util.regex.Pattern;

/**
 * <h1>Parses textual cron expressions into {@link CronSchedule}s</h1>
 *
 * Accepted syntax, per field: {@code *}, a number, a list {@code a,b,c}, a range
 * {@code a-b}, and the step forms {@code *&#47;n}, {@code a-b/n} and {@code a/n}
 * (the last one meaning {@code a-max/n}). {@code ?} stands for {@code *} in the two day
 * fields. Five-field expressions get an implicit second field of {@code 0}.
 *
 * Runs of asterisks ({@code **}) are collapsed to a single {@code *} before anything
 * else; older stored configurations still carry them.
 *
 * Stateless and safe to call from any number of threads.
 */
public final class CronExpressionParser {

    private static final Pattern ASTERISKS = Pattern.compile("\\*{2,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private CronExpressionParser() {
    }

    public static CronSchedule parse(String text) throws CronException {
        if (text == null || text.trim().isEmpty()) {
            throw new MalformedExpressionException("cron expression is empty", text);
        }

        String collapsed = ASTERISKS.matcher(text.trim()).replaceAll("*");
        String[] parts = WHITESPACE.split(collapsed);
        if (parts.length == 5) {
            String[] withSeconds = new String[6];
            withSeconds[0] = "0";
            System.arraycopy(parts, 0, withSeconds, 1, 5);
            parts = withSeconds;
        } else if (parts.length != 6) {
            throw new MalformedExpressionException("expected 5 or 6 fields, found " + parts.length
                    + ": " + Arrays.toString(parts), text);
        }

        CronField[] cronFields = CronField.values();
        BitSet[] fields = new BitSet[cronFields.length];
        boolean[] unrestricted = new boolean[cronFields.length];
        for (int i = 0; i < cronFields.length; i++) {
            fields[i] = new BitSet(cronFields[i].getMax() + 1);
            unrestricted[i] = parseField(text, parts[i], cronFields[i], fields[i]);
        }

        return new CronSchedule(String.join(" ", parts), fields,
                !unrestricted[CronField.DAY_OF_MONTH.ordinal()],
                !unrestricted[CronField.DAY_OF_WEEK.ordinal()]);
    }

    /**
     * Returns the canonical form of {@code text}, the string callers should persist.
     */
    public static String normalize(String text) throws CronException {
        return parse(text).getExpression();
    }

    public static boolean isValidExpression(String text) {
        try {
            parse(text);
            return true;
        } catch (CronException e) {
            return false;
        }
    }

    /**
     * Fills {@code bits} with the values of one field; returns true when the field is
     * unrestricted ({@code *}, {@code ?} or {@code *&#47;1}).
     */
    private static boolean parseField(String text, String token, CronField field, BitSet bits)
            throws FieldOutOfRangeException {
        boolean unrestricted = false;
        // split with limit -1 so "1,,2" and "1," surface as empty elements
        for (String element : token.split(",", -1)) {
            if (parseElement(text, element, field, bits)) {
                unrestricted = true;
            }
        }
        return unrestricted;
    }

    private static boolean parseElement(String text, String element, CronField field, BitSet bits)
            throws FieldOutOfRangeException {
        String rangePart = element;
        int step = 1;
        boolean hasStep = false;

        int slash = element.indexOf('/');
        if (slash >= 0) {
            rangePart = element.substring(0, slash);
            step = parseNumber(text, element.substring(slash + 1), field, element);
            if (step < 1) {
                throw new FieldOutOfRangeException(text, field, element);
            }
            hasStep = true;
        }

        int start;
        int end;
        boolean star = false;
        if ("*".equals(rangePart) || ("?".equals(rangePart) && field.isDayField())) {
            start = field.getMin();
            end = field.getMax();
            star = step == 1;
        } else {
            int dash = rangePart.indexOf('-');
            if (dash >= 0) {
                start = parseNumber(text, rangePart.substring(0, dash), field, element);
                end = parseNumber(text, rangePart.substring(dash + 1), field, element);
            } else {
                start = parseNumber(text, rangePart, field, element);
                end = hasStep ? field.getMax() : start;
            }
        }

        if (start < field.getMin() || end > field.getMax() || start > end) {
            throw new FieldOutOfRangeException(text, field, element);
        }

        for (int value = start; value <= end; value += step) {
            bits.set(value);
        }
        return star;
    }

    private static int parseNumber(String text, String number, CronField field, String element)
            throws FieldOutOfRangeException {
        if (number.isEmpty() || number.length() > 9) {
            throw new FieldOutOfRangeException(text, field, element);
        }
        for (int i = 0; i < number.length(); i++) {
            char c = number.charAt(i);
            if (c < '0' || c > '9') {
                throw new FieldOutOfRangeException(text, field, element);
            }
        }
        return Integer.parseInt(number);
    }
}
