// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void keepsShortHex() {
        String input = "value 0x" + "00".repeat(32);
        assertEquals(input, LogSanitizer.sanitize(input));
    }

    @Test
    void abbreviatesLongHexRuns() {
        String hex = "0x" + "1234567890abcdef".repeat(8);
        String sanitized = LogSanitizer.sanitize("metadata " + hex + " end");

        assertEquals("metadata 0x1234567890abcdef…(64 bytes)…1234567890abcdef end", sanitized);
    }

    @Test
    void truncatesVeryLongMessages() {
        String sanitized = LogSanitizer.sanitize("x".repeat(5000));

        assertEquals(2000, sanitized.length());
        assertTrue(sanitized.endsWith("...(truncated)"));
    }

    @Test
    void handlesNull() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }
}
