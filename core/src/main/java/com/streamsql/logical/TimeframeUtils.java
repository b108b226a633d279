package com.streamsql.logical;

import java.util.Locale;

/**
 * Compact timeframe tokens such as {@code 1m}, {@code 5m}, {@code 1h}, {@code 1d},
 * {@code 1wk} and {@code 1mo}.
 *
 * <p>Durations are approximate for calendar units: a week is 7 days and a month
 * is 30 days. A blank token sorts after every other token.
 */
public final class TimeframeUtils {

    private TimeframeUtils() {
        // Utility class
    }

    /**
     * Decomposed timeframe token.
     *
     * @param value the numeric part
     * @param unit the unit suffix ({@code s}, {@code m}, {@code h}, {@code d}, {@code wk}, {@code mo})
     */
    public record Timeframe(int value, String unit) {
    }

    /**
     * Builds a token from a value and a unit name.
     *
     * @param value the value; non-positive values become 1
     * @param unitName {@code minutes}, {@code hours}, {@code days} or {@code months}
     * @return the compact token, or the bare value for an unknown unit
     */
    public static String normalize(int value, String unitName) {
        int v = value <= 0 ? 1 : value;
        String unit = unitName == null ? "" : unitName.trim().toLowerCase(Locale.ROOT);
        switch (unit) {
            case "minutes":
                return v + "m";
            case "hours":
                return v + "h";
            case "days":
                return v + "d";
            case "months":
                return v + "mo";
            default:
                return Integer.toString(v);
        }
    }

    /**
     * Converts a token to seconds.
     *
     * @param timeframe the token
     * @return the seconds, {@link Long#MAX_VALUE} for a blank token, 0 for an unparsable value
     */
    public static long toSeconds(String timeframe) {
        if (timeframe == null || timeframe.isBlank()) {
            return Long.MAX_VALUE;
        }
        String tf = timeframe.trim();
        String lower = tf.toLowerCase(Locale.ROOT);
        if (lower.endsWith("mo")) {
            return parseIntSafe(tf.substring(0, tf.length() - 2)) * 30L * 24 * 3600;
        }
        if (lower.endsWith("wk")) {
            return parseIntSafe(tf.substring(0, tf.length() - 2)) * 7L * 24 * 3600;
        }
        char unit = Character.toLowerCase(tf.charAt(tf.length() - 1));
        long value = parseIntSafe(tf.substring(0, tf.length() - 1));
        switch (unit) {
            case 'm':
                return value * 60;
            case 'h':
                return value * 3600;
            case 'd':
                return value * 86400;
            default:
                return value;
        }
    }

    public static long toMinutes(String timeframe) {
        long seconds = toSeconds(timeframe);
        return seconds == Long.MAX_VALUE ? Long.MAX_VALUE : seconds / 60;
    }

    public static int compare(String a, String b) {
        return Long.compare(toSeconds(a), toSeconds(b));
    }

    /**
     * Splits a token into value and unit.
     *
     * @param timeframe the token
     * @return the parts; {@code (1, "m")} for a blank token
     */
    public static Timeframe decompose(String timeframe) {
        if (timeframe == null || timeframe.isBlank()) {
            return new Timeframe(1, "m");
        }
        String tf = timeframe.trim();
        String lower = tf.toLowerCase(Locale.ROOT);
        if (lower.endsWith("mo")) {
            return new Timeframe(parseIntSafe(tf.substring(0, tf.length() - 2)), "mo");
        }
        if (lower.endsWith("wk")) {
            return new Timeframe(parseIntSafe(tf.substring(0, tf.length() - 2)), "wk");
        }
        int value = parseIntSafe(tf.substring(0, tf.length() - 1));
        return new Timeframe(value <= 0 ? 1 : value, tf.substring(tf.length() - 1));
    }

    private static int parseIntSafe(String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
