package com.sitecrawler.common.infra;

/**
 * Duration formatting for log lines and notification bodies.
 */
public final class FormatDuration {

    private FormatDuration() {
    }

    /**
     * Format milliseconds as whole seconds, rounded, e.g. {@code "42s"}.
     */
    public static String formatRoundedSeconds(long ms) {
        if (ms < 0)
            ms = 0;
        return Math.round(ms / 1000.0) + "s";
    }

    /**
     * Format duration in milliseconds. Shows "Xms" for <1s, otherwise seconds
     * with up to two decimals and trailing zeros trimmed.
     *
     * @return formatted string like "450ms" or "2.5s"
     */
    public static String formatMs(long ms) {
        if (ms < 0)
            ms = 0;
        if (ms < 1000) {
            return ms + "ms";
        }
        String formatted = String.format(java.util.Locale.ROOT, "%.2f", ms / 1000.0);
        formatted = formatted.replaceAll("0+$", "").replaceAll("\\.$", "");
        return formatted + "s";
    }
}
