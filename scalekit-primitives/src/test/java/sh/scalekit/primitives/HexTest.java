// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HexTest {
    @Test
    @DisplayName("Encoding empty and single bytes")
    void testEncodeBasic() {
        assertEquals("0x", Hex.encode(new byte[] {}));
        assertEquals("0x00", Hex.encode(new byte[] {0x00}));
        assertEquals("0xff", Hex.encode(new byte[] {(byte) 0xFF}));
    }

    @Test
    void testEncodeRangeAndNoPrefix() {
        byte[] bytes = new byte[] {0x01, 0x23, (byte) 0xAB, (byte) 0xCD};
        assertEquals("0x23ab", Hex.encode(bytes, 1, 2));
        assertEquals("0123abcd", Hex.encodeNoPrefix(bytes));
        assertThrows(IllegalArgumentException.class, () -> Hex.encode(bytes, 3, 2));
    }

    @Test
    void testDecodeCaseInsensitivity() {
        byte[] expected = new byte[] {0x0A, (byte) 0xBC, (byte) 0xDE, (byte) 0xF0};
        assertArrayEquals(expected, Hex.decode("0x0AbCdEf0"));
        assertArrayEquals(expected, Hex.decode("0X0aBcDeF0"));
        assertArrayEquals(expected, Hex.decode("0aBcDeF0"));
    }

    @Test
    void testDecodeInvalidInputs() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0x1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xz1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.cleanPrefix(null));
    }

    @Test
    @DisplayName("isHex requires the prefix and an even number of digits")
    void testIsHex() {
        assertTrue(Hex.isHex("0x"));
        assertTrue(Hex.isHex("0x12ab"));
        assertTrue(Hex.isHex("0XABCD"));
        assertFalse(Hex.isHex("12ab"));
        assertFalse(Hex.isHex("0x123"));
        assertFalse(Hex.isHex("0xzz"));
        assertFalse(Hex.isHex("foo"));
        assertFalse(Hex.isHex(null));
    }

    @Test
    void testHasPrefixAndClean() {
        assertTrue(Hex.hasPrefix("0Xff"));
        assertFalse(Hex.hasPrefix(""));
        assertEquals("1234", Hex.cleanPrefix("0x1234"));
        assertEquals("1234", Hex.cleanPrefix("1234"));
    }
}
