// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.primitives;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CompactTest {

    @Test
    @DisplayName("Known vectors for every size class")
    void testKnownVectors() {
        assertEquals("0x00", Hex.encode(Compact.encode(0)));
        assertEquals("0x04", Hex.encode(Compact.encode(1)));
        assertEquals("0xfc", Hex.encode(Compact.encode(63)));
        assertEquals("0x0101", Hex.encode(Compact.encode(64)));
        assertEquals("0x1501", Hex.encode(Compact.encode(69)));
        assertEquals("0xfdff", Hex.encode(Compact.encode(16383)));
        assertEquals("0x02000100", Hex.encode(Compact.encode(16384)));
        assertEquals("0xfeffffff", Hex.encode(Compact.encode((1L << 30) - 1)));
        assertEquals("0x0300000040", Hex.encode(Compact.encode(1L << 30)));
        assertEquals("0x03ffffffff", Hex.encode(Compact.encode(0xFFFFFFFFL)));
        assertEquals("0x070000000001", Hex.encode(Compact.encode(1L << 32)));
    }

    @Test
    @DisplayName("Encoding always picks the smallest class")
    void testCanonicalLength() {
        long[] boundaries = {0, 63, 64, 16383, 16384, (1L << 30) - 1, 1L << 30, 1L << 40, Long.MAX_VALUE};
        int[] lengths = {1, 1, 2, 2, 4, 4, 5, 7, 9};
        for (int i = 0; i < boundaries.length; i++) {
            byte[] encoded = Compact.encode(boundaries[i]);
            assertEquals(lengths[i], encoded.length, "length for " + boundaries[i]);
            assertEquals(lengths[i], Compact.encodedLength(boundaries[i]));
            assertEquals(BigInteger.valueOf(boundaries[i]), Compact.decode(ScaleReader.of(encoded)));
        }
    }

    @Test
    @DisplayName("Non-canonical encodings still decode")
    void testNonCanonicalDecode() {
        // 1 in the two byte class: (1 << 2) | 0b01
        assertEquals(BigInteger.ONE, Compact.decode(ScaleReader.of(new byte[] {0x05, 0x00})));
        // 1 in the four byte class
        assertEquals(BigInteger.ONE, Compact.decode(ScaleReader.of(new byte[] {0x06, 0x00, 0x00, 0x00})));
        // 1 in big-integer mode with four payload bytes
        assertEquals(BigInteger.ONE, Compact.decode(ScaleReader.of(new byte[] {0x03, 0x01, 0x00, 0x00, 0x00})));
    }

    @Test
    void testLargeValue() {
        BigInteger max128 = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);
        byte[] encoded = Compact.encode(max128);
        assertEquals(17, encoded.length);
        assertEquals((byte) (((16 - 4) << 2) | 0b11), encoded[0]);
        assertEquals(max128, Compact.decode(ScaleReader.of(encoded)));
    }

    @Test
    void testRejectsNegativeAndTruncated() {
        assertThrows(IllegalArgumentException.class, () -> Compact.encode(-1));
        assertThrows(IllegalArgumentException.class, () -> Compact.decode(ScaleReader.of(new byte[] {0x01})));
        assertThrows(IllegalArgumentException.class, () -> Compact.decode(ScaleReader.of(new byte[0])));
    }

    @Test
    void testDecodeLengthRejectsHugeCounts() {
        byte[] encoded = Compact.encode(1L << 40);
        assertThrows(IllegalArgumentException.class, () -> Compact.decodeLength(ScaleReader.of(encoded)));
    }
}
