// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.primitives;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

class ScaleReaderTest {

    @Test
    void testReadsLittleEndianValues() {
        ScaleReader reader = ScaleReader.of(Hex.decode("0x2a000000ffff"));
        assertEquals(42L, reader.readU32());
        assertEquals(BigInteger.valueOf(-1), reader.readLittleEndian(2, true));
        assertFalse(reader.hasRemaining());
    }

    @Test
    void testReturnsCopies() {
        byte[] source = {1, 2, 3};
        byte[] read = ScaleReader.of(source).readBytes(3);
        read[0] = 9;
        assertEquals(1, source[0]);
    }

    @Test
    void testShortBufferReportsOffset() {
        ScaleReader reader = ScaleReader.of(new byte[] {1, 2});
        reader.readUnsignedByte();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> reader.readBytes(4));
        assertTrue(e.getMessage().contains("offset 1"), e.getMessage());
    }

    @Test
    void testSubRange() {
        ScaleReader reader = ScaleReader.of(new byte[] {0, 7, 8, 0}, 1, 2);
        assertEquals(2, reader.remaining());
        assertEquals(7, reader.readUnsignedByte());
        assertArrayEquals(new byte[] {8}, reader.readRemaining());
    }
}
