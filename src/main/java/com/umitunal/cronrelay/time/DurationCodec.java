package com.umitunal.cronrelay.time;

import com.umitunal.cronrelay.exception.DurationException;
import com.umitunal.cronrelay.exception.FormatException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses relative durations written as {@code [Nh][Nm][Ns]}.
 *
 * Each component is optional but at least one is required, in that order.
 * Hours range over 0-8760, minutes and seconds over 0-59, and the total must be positive.
 */
public final class DurationCodec {

    public static final String FORMAT = "[Xh][Ym][Zs]";

    public static final long MAX_HOURS = 8760;

    private static final Pattern DURATION = Pattern.compile("^(?:(\\d+)h)?(?:(\\d+)m)?(?:(\\d+)s)?$");

    private DurationCodec() {
    }

    /**
     * Parse a duration string to milliseconds.
     *
     * @throws FormatException on empty input, unknown notation or an out-of-range component
     * @throws DurationException when every component is zero
     */
    public static long parseDuration(String text) {
        if (text == null || text.isBlank()) {
            throw new FormatException(text, FORMAT,
                    "Invalid duration: expected non-empty string, received: \"" + text + "\"");
        }

        String trimmed = text.trim();
        Matcher matcher = DURATION.matcher(trimmed);
        if (!matcher.matches()) {
            throw new FormatException(text, FORMAT, String.format(
                    "Invalid duration format: \"%s\". Expected format: %s where X, Y, Z are numbers. "
                            + "Examples: \"2h\", \"3m\", \"4s\", \"2h3m4s\"", text, FORMAT));
        }

        String hoursText = matcher.group(1);
        String minutesText = matcher.group(2);
        String secondsText = matcher.group(3);

        if (hoursText == null && minutesText == null && secondsText == null) {
            throw new FormatException(text, FORMAT, String.format(
                    "Invalid duration: \"%s\". At least one time unit (h, m, or s) must be specified", text));
        }

        long hours = component(text, "hours", hoursText, MAX_HOURS);
        long minutes = component(text, "minutes", minutesText, 59);
        long seconds = component(text, "seconds", secondsText, 59);

        long totalMs = (hours * 3600 + minutes * 60 + seconds) * 1000;
        if (totalMs == 0) {
            throw new DurationException(text, FORMAT,
                    "Duration cannot be zero. Please specify a positive duration.");
        }
        return totalMs;
    }

    /**
     * Absolute time {@code durationText} after {@code nowMillis}.
     */
    public static long futureFromDuration(String durationText, long nowMillis) {
        return nowMillis + parseDuration(durationText);
    }

    /**
     * Render milliseconds in {@code [Nh][Nm][Ns]} notation, truncating to whole seconds.
     * Zero renders as {@code "0s"}.
     *
     * @throws DurationException if the value is negative
     */
    public static String formatDuration(long millis) {
        if (millis < 0) {
            throw new DurationException(Long.toString(millis), FORMAT,
                    "Duration must be positive, received: " + millis + "ms");
        }

        long totalSeconds = millis / 1000;
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;

        StringBuilder sb = new StringBuilder();
        if (hours > 0) sb.append(hours).append('h');
        if (minutes > 0) sb.append(minutes).append('m');
        if (seconds > 0) sb.append(seconds).append('s');

        return sb.length() == 0 ? "0s" : sb.toString();
    }

    /**
     * Shape check only; ranges are not validated.
     */
    public static boolean isDurationFormat(String value) {
        if (value == null) {
            return false;
        }
        Matcher matcher = DURATION.matcher(value.trim());
        return matcher.matches()
                && (matcher.group(1) != null || matcher.group(2) != null || matcher.group(3) != null);
    }

    private static long component(String text, String unit, String digits, long max) {
        if (digits == null) {
            return 0;
        }
        // More than 9 significant digits is out of range and would overflow the multiplication
        String significant = digits.replaceFirst("^0+(?=\\d)", "");
        if (significant.length() > 9) {
            throw new FormatException(text, FORMAT,
                    String.format("Invalid %s: %s. Must be between 0 and %d", unit, digits, max));
        }
        long value = Long.parseLong(significant);
        if (value > max) {
            throw new FormatException(text, FORMAT,
                    String.format("Invalid %s: %d. Must be between 0 and %d", unit, value, max));
        }
        return value;
    }
}
