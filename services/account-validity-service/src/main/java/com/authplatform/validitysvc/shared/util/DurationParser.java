package com.authplatform.validitysvc.shared.util;

import com.authplatform.validitysvc.shared.exception.InvalidFormatException;

import java.util.Map;

/**
 * Parses configuration durations into milliseconds.
 * <p>
 * Numbers are taken as milliseconds. Strings may end with one of
 * {@code s, m, h, d, w, y}; a bare numeral is milliseconds. A year is 365 days.
 */
public final class DurationParser {

    private static final long SECOND = 1000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;
    private static final long WEEK = 7 * DAY;
    private static final long YEAR = 365 * DAY;

    private static final Map<Character, Long> SIZES = Map.of(
            's', SECOND,
            'm', MINUTE,
            'h', HOUR,
            'd', DAY,
            'w', WEEK,
            'y', YEAR
    );

    private DurationParser() {
    }

    public static long parse(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value == null) {
            throw new InvalidFormatException("null");
        }
        return parse(value.toString());
    }

    public static long parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidFormatException(String.valueOf(value));
        }
        String trimmed = value.trim();
        long size = 1;
        char suffix = trimmed.charAt(trimmed.length() - 1);
        Long unit = SIZES.get(suffix);
        String numeral = trimmed;
        if (unit != null) {
            size = unit;
            numeral = trimmed.substring(0, trimmed.length() - 1);
        }
        try {
            return Math.multiplyExact(Long.parseLong(numeral), size);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidFormatException(value, e);
        }
    }
}
