package io.shiplog.util;

import java.util.Locale;

public final class ByteSizes {
    public static final long KB = 1024L;
    public static final long MB = KB * 1024L;
    public static final long GB = MB * 1024L;
    public static final long TB = GB * 1024L;

    private ByteSizes() {
    }

    public static String format(long bytes) {
        if (bytes < MB) {
            return String.format(Locale.ROOT, "%.2f KB", bytes / (double) KB);
        }
        if (bytes < GB) {
            return String.format(Locale.ROOT, "%.2f MB", bytes / (double) MB);
        }
        if (bytes < TB) {
            return String.format(Locale.ROOT, "%.2f GB", bytes / (double) GB);
        }
        return String.format(Locale.ROOT, "%.2f TB", bytes / (double) TB);
    }
}
