// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.scalekit.core.error.CodecConstructionException;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.Hex;

class BytesTest {

    private final TypeRegistry registry = new TypeRegistry();

    @Test
    void testPrintableContentRendersAsText() {
        Bytes bytes = registry.createType("Bytes", new byte[] {0x0c, 0x66, 0x6f, 0x6f}, Bytes.class);

        assertEquals("foo", bytes.toString());
        assertEquals("0x666f6f", bytes.toHex());
        assertEquals("\"0x666f6f\"", bytes.toJson().toString());
        assertEquals(3, bytes.length());
    }

    @Test
    void testBinaryContentRendersAsHex() {
        Bytes bytes = registry.createType("Bytes", "0x00ff", Bytes.class);

        assertEquals("0x00ff", bytes.toString());
        assertEquals("0x0800ff", Hex.encode(bytes.encode()));
    }

    @Test
    void testVecU8ResolvesToBytes() {
        assertInstanceOf(BytesType.class, registry.resolve("Vec<u8>"));
        assertEquals("0x080102", Hex.encode(registry.createType("Vec<u8>", List.of(1, 2)).encode()));
    }

    @Test
    void testListInputRange() {
        assertThrows(CodecConstructionException.class, () -> registry.createType("Bytes", List.of(1, 256)));
    }

    @Test
    void testRoundTripThroughJson() {
        Bytes bytes = registry.createType("Bytes", "0xdeadbeef", Bytes.class);

        assertEquals(bytes, registry.createType("Bytes", bytes.toJson()));
        assertEquals(bytes, registry.createType("Bytes", bytes.encode()));
    }
}
