// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.scalekit.core.error.CodecConstructionException;
import sh.scalekit.core.error.ScaleDecodingException;
import sh.scalekit.core.registry.TypeRegistry;

class RawTest {

    private final TypeRegistry registry = new TypeRegistry();

    @Test
    void testFixedLengthHashes() {
        Raw hash = registry.createType("H256", "0x" + "11".repeat(32), Raw.class);

        assertEquals(32, hash.byteLength());
        assertEquals("H256", hash.rawTypeName());
        assertFalse(hash.isEmpty());
        assertTrue(registry.createType("H160", null).isEmpty());
        assertEquals(64, registry.createType("H512", null).byteLength());
    }

    @Test
    void testHexMustMatchLength() {
        assertThrows(CodecConstructionException.class, () -> registry.createType("H256", "0x1122"));
        assertThrows(ScaleDecodingException.class, () -> registry.createType("H160", new byte[19]));
    }

    @Test
    void testFixedByteArrayResolvesToRaw() {
        RawType type = assertInstanceOf(RawType.class, registry.resolve("[u8; 4]"));

        assertEquals(4, type.length());
        assertEquals("[u8;4]", type.name());
        assertEquals("0x01020304", registry.createType("[u8;4]", "0x01020304").toHex());
    }

    @Test
    void testUnboundedConsumesRemaining() {
        Raw raw = registry.createType("Raw", new byte[] {1, 2, 3}, Raw.class);

        assertEquals(3, raw.length());
        assertEquals("0x010203", raw.toJson().asText());
    }
}
