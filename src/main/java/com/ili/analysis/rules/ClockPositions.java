package com.ili.analysis.rules;

import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Clock-position parsing and circular arithmetic.
 * Convention: 12:00 (top of pipe) is 0 degrees, increasing clockwise; 3:00 = 90, 6:00 = 180, 9:00 = 270.
 */
public final class ClockPositions {

    private static final Pattern HOUR_MINUTE = Pattern.compile("^(\\d{1,2}):(\\d{2})(?::(\\d{2}))?$");
    private static final double DEGREES_PER_HOUR = 30.0;

    private ClockPositions() {
        // Utility class
    }

    /**
     * Converts a clock reading to degrees.
     * Accepts "H:MM", "H:MM:SS", a decimal hour string, a {@link Number} of hours or a {@link LocalTime}.
     *
     * @return degrees in [0, 360), or {@code null} when the value is absent or unparseable
     */
    public static Double toDegrees(Object clockValue) {
        if (clockValue == null) {
            return null;
        }
        double hours;
        if (clockValue instanceof LocalTime time) {
            hours = time.getHour() + time.getMinute() / 60.0;
        } else if (clockValue instanceof Number number) {
            hours = number.doubleValue();
        } else if (clockValue instanceof String text) {
            Double parsed = parseHours(text.trim());
            if (parsed == null) {
                return null;
            }
            hours = parsed;
        } else {
            return null;
        }
        if (Double.isNaN(hours) || Double.isInfinite(hours)) {
            return null;
        }
        double wrapped = hours % 12.0;
        if (wrapped < 0) {
            wrapped += 12.0;
        }
        return wrapped * DEGREES_PER_HOUR;
    }

    /**
     * Shorter-arc angular difference between two clock positions, in [0, 180].
     *
     * @return the difference, or {@code null} if either side is absent
     */
    public static Double angularDistance(Double degA, Double degB) {
        if (degA == null || degB == null) {
            return null;
        }
        double diff = Math.abs(degA - degB) % 360.0;
        return Math.min(diff, 360.0 - diff);
    }

    private static Double parseHours(String text) {
        if (text.isEmpty()) {
            return null;
        }
        Matcher m = HOUR_MINUTE.matcher(text);
        if (m.matches()) {
            return Integer.parseInt(m.group(1)) + Integer.parseInt(m.group(2)) / 60.0;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
