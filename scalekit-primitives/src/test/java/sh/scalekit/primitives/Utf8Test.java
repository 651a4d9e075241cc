// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.primitives;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

class Utf8Test {

    @Test
    void testByteLengthMatchesEncoder() {
        for (String s : new String[] {"", "abc", "中文", "héllo", "😀 ok"}) {
            assertEquals(s.getBytes(StandardCharsets.UTF_8).length, Utf8.byteLength(s), s);
        }
    }

    @Test
    void testStrictDecode() {
        assertEquals("foo", Utf8.decode(new byte[] {0x66, 0x6f, 0x6f}));
        assertThrows(IllegalArgumentException.class, () -> Utf8.decode(new byte[] {(byte) 0xC3}));
    }

    @Test
    void testPrintable() {
        assertTrue(Utf8.isPrintable("foo bar\n".getBytes(StandardCharsets.UTF_8)));
        assertFalse(Utf8.isPrintable(new byte[] {0x00, 0x01}));
        assertFalse(Utf8.isPrintable(new byte[] {(byte) 0xFF}));
    }
}
