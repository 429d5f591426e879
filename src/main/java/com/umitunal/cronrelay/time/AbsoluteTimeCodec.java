package com.umitunal.cronrelay.time;

import com.umitunal.cronrelay.exception.FormatException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.regex.Pattern;

/**
 * Converts between wall-clock timestamps written as {@code yyyyMMddHHmmss}
 * and epoch milliseconds.
 *
 * The text form is always exactly 14 digits, zero-padded, and is interpreted
 * in a time zone (the system default unless one is given). Parsing validates
 * that the decoded calendar fields describe a real local time in that zone,
 * so inputs such as month 13, February 30, or a time skipped by a daylight
 * saving transition are rejected instead of rolling over.
 */
public final class AbsoluteTimeCodec {

    public static final String FORMAT = "yyyyMMddHHmmss";

    private static final Pattern FOURTEEN_DIGITS = Pattern.compile("^\\d{14}$");

    private AbsoluteTimeCodec() {
    }

    public static long parseAbsolute(String text) {
        return parseAbsolute(text, ZoneId.systemDefault());
    }

    /**
     * Parse {@code yyyyMMddHHmmss} text into epoch milliseconds.
     *
     * @param text the 14 digit timestamp
     * @param zone zone the wall-clock fields are expressed in
     * @return milliseconds since epoch
     * @throws FormatException if the text is not 14 digits or is not a valid local time
     */
    public static long parseAbsolute(String text, ZoneId zone) {
        if (!isAbsoluteFormat(text)) {
            throw new FormatException(text, FORMAT, String.format(
                    "Invalid datetime format. Expected \"%s\" (14 digits), received: \"%s\"", FORMAT, text));
        }

        int year = Integer.parseInt(text.substring(0, 4));
        int month = Integer.parseInt(text.substring(4, 6));
        int day = Integer.parseInt(text.substring(6, 8));
        int hour = Integer.parseInt(text.substring(8, 10));
        int minute = Integer.parseInt(text.substring(10, 12));
        int second = Integer.parseInt(text.substring(12, 14));

        LocalDateTime local;
        try {
            local = LocalDateTime.of(year, month, day, hour, minute, second);
        } catch (DateTimeException e) {
            throw new FormatException(text, FORMAT, String.format(
                    "Invalid date: %s. The date components do not represent a valid calendar date/time (%s)",
                    text, e.getMessage()));
        }

        ZonedDateTime zoned = local.atZone(zone);
        if (!zoned.toLocalDateTime().equals(local)) {
            throw new FormatException(text, FORMAT, String.format(
                    "Invalid date: %s. The local time does not exist in zone %s", text, zone));
        }

        return zoned.toInstant().toEpochMilli();
    }

    public static String formatAbsolute(long epochMillis) {
        return formatAbsolute(epochMillis, ZoneId.systemDefault());
    }

    /**
     * Format epoch milliseconds as {@code yyyyMMddHHmmss} in the given zone.
     * Sub-second precision is dropped.
     *
     * @throws FormatException if the year cannot be written with four digits
     */
    public static String formatAbsolute(long epochMillis, ZoneId zone) {
        ZonedDateTime zoned = Instant.ofEpochMilli(epochMillis).atZone(zone);
        int year = zoned.getYear();
        if (year < 0 || year > 9999) {
            throw new FormatException(Long.toString(epochMillis), FORMAT,
                    "Year " + year + " cannot be represented in " + FORMAT);
        }
        return String.format("%04d%02d%02d%02d%02d%02d",
                year,
                zoned.getMonthValue(),
                zoned.getDayOfMonth(),
                zoned.getHour(),
                zoned.getMinute(),
                zoned.getSecond());
    }

    /**
     * Shape check only: true when the value is exactly 14 digits.
     */
    public static boolean isAbsoluteFormat(String value) {
        return value != null && FOURTEEN_DIGITS.matcher(value).matches();
    }
}
