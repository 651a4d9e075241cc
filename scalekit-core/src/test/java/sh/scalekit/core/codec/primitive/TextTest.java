// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import sh.scalekit.core.error.CodecConstructionException;
import sh.scalekit.core.error.ScaleDecodingException;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.Hex;

class TextTest {

    private final TypeRegistry registry = new TypeRegistry();

    @Test
    @DisplayName("Byte length counts UTF-8 bytes, length counts characters")
    void testMultiByteLengths() {
        Text text = registry.createType("Text", "中文", Text.class);

        assertEquals(7, text.byteLength());
        assertEquals(7, text.encode().length);
        assertEquals(2, text.length());
    }

    @Test
    void testToHexIsContentWithoutPrefix() {
        Text text = registry.createType("Text", "foo", Text.class);

        assertEquals("0x666f6f", text.toHex());
        assertEquals("0x0c666f6f", Hex.encode(text.encode()));
    }

    @Test
    void testInputs() {
        assertEquals("foo", registry.createType("Text", "0x666f6f").toString());
        assertEquals("foo", registry.createType("Text", new byte[] {0x0c, 0x66, 0x6f, 0x6f}).toString());
        assertEquals("foo", registry.createType("Text", registry.createType("Bytes", "0x666f6f")).toString());
        assertEquals("42", registry.createType("Text", 42).toString());
        assertEquals("", registry.createType("Text", null).toString());
    }

    @Test
    @DisplayName("Aliases resolve to the same text type")
    void testAliases() {
        for (String alias : new String[] {"String", "Str", "str", "Type"}) {
            assertInstanceOf(TextType.class, registry.resolve(alias));
        }
    }

    @Test
    void testHexLookingStringRoundTripsThroughJson() {
        Text text = ((TextType) registry.resolve("Text")).of("0x12");

        assertEquals("0x30783132", text.toJson().asText());
        assertEquals(text, registry.createType("Text", text.toJson()));
    }

    @Test
    void testEqOnlyMatchesText() {
        Text text = registry.createType("Text", "foo", Text.class);

        assertTrue(text.eq("foo"));
        assertTrue(text.eq(registry.createType("Text", "foo")));
        assertFalse(text.eq(registry.createType("Bytes", "0x666f6f")));
        assertFalse(text.eq(3));
    }

    @Test
    void testInvalidUtf8() {
        assertThrows(ScaleDecodingException.class, () -> registry.createType("Text", new byte[] {0x04, (byte) 0xff}));
        assertThrows(CodecConstructionException.class, () -> registry.createType("Text", "0xff"));
    }
}
