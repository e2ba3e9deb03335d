package org.carball.dbbench.output;

import java.util.Locale;

public final class Formats {

    private static final String[] MEMORY_UNITS = {"B", "KB", "MB", "GB"};

    private Formats() {
        // Utility class - prevent instantiation
    }

    /**
     * Milliseconds as {@code 12.34ms}, or {@code 1.23s} from one second up.
     */
    public static String time(double ms) {
        if (ms >= 1000) {
            return String.format(Locale.ROOT, "%.2fs", ms / 1000);
        }
        return String.format(Locale.ROOT, "%.2fms", ms);
    }

    /**
     * Seconds as {@code 1.23s}, or in milliseconds below one second.
     */
    public static String seconds(double seconds) {
        if (seconds < 1) {
            return round(seconds * 1000) + "ms";
        }
        return round(seconds) + "s";
    }

    public static String memory(double bytes) {
        int unit = 0;
        double value = Math.max(0, bytes);
        while (value >= 1024 && unit < MEMORY_UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, MEMORY_UNITS[unit]);
    }

    public static String percent(double value) {
        return String.format(Locale.ROOT, "%+.1f%%", value);
    }

    private static String round(double value) {
        double rounded = Math.round(value * 100.0) / 100.0;
        if (rounded == Math.rint(rounded)) {
            return String.valueOf((long) rounded);
        }
        return String.valueOf(rounded);
    }
}
