package dev.tokenbench;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

public class BenchUtilsTest {

    @Test
    void timestampIsSortableLocalTime() {
        assertEquals("20250309_140502", BenchUtils.timestamp(LocalDateTime.of(2025, 3, 9, 14, 5, 2)));
    }

    @Test
    void formatsTokensWithSeparators() {
        assertEquals("0", BenchUtils.formatTokens(0));
        assertEquals("1,234,567", BenchUtils.formatTokens(1_234_567));
    }

    @Test
    void formatsSavings() {
        assertEquals("0%", BenchUtils.formatSavings(0.0, 0));
        assertEquals("-7%", BenchUtils.formatSavings(100.0 / 15.0, 0));
        assertEquals("-6.7%", BenchUtils.formatSavings(100.0 / 15.0, 1));
        assertEquals("6.7", BenchUtils.formatPercent(100.0 / 15.0, 1));
    }

    @Test
    void truncatesWithEllipsis() {
        assertEquals("short", BenchUtils.truncate("short", 20));
        assertEquals("abcdefg...", BenchUtils.truncate("abcdefghijklmnop", 10));
        assertEquals("ab", BenchUtils.truncate("abcdef", 2));
        assertNull(BenchUtils.truncate(null, 5));
    }
}
