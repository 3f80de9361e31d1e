package dev.tokenbench;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public class BenchUtils {
    /** Run ids and default record names use this local-time stamp. */
    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    public static String timestamp(LocalDateTime time) {
        return TIMESTAMP_FORMAT.format(time);
    }

    /** Token count with thousands separators, e.g. {@code 12,345}. */
    public static String formatTokens(long tokens) {
        return String.format(Locale.US, "%,d", tokens);
    }

    /**
     * Savings as the table shows them: {@code -7%} for 6.7 at zero decimals, {@code -6.7%} at one,
     * {@code 0%} for a tie.
     */
    public static String formatSavings(double percent, int decimals) {
        if (percent == 0.0) {
            return "0%";
        }
        return "-" + formatPercent(percent, decimals) + "%";
    }

    /** Plain number rounded to {@code decimals}, without the sign or percent symbol. */
    public static String formatPercent(double percent, int decimals) {
        return String.format(Locale.US, "%." + decimals + "f", percent);
    }

    /** {@code text} cut to at most {@code max} characters, ending in {@code ...} when cut. */
    public static String truncate(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        if (max <= 3) {
            return text.substring(0, max);
        }
        return text.substring(0, max - 3) + "...";
    }
}
