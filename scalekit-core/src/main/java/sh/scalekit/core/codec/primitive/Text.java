// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import sh.scalekit.core.codec.AbstractCodec;
import sh.scalekit.core.codec.Json;
import sh.scalekit.primitives.Compact;
import sh.scalekit.primitives.Hex;
import sh.scalekit.primitives.ScaleWriter;
import sh.scalekit.primitives.Utf8;

/**
 * A UTF-8 string.
 *
 * <p>{@link #byteLength()} counts encoded bytes including the length prefix while
 * {@link #length()} counts characters: {@code "中文"} has length 2 and byte length 7.
 */
public final class Text extends AbstractCodec {

    private final TextType type;
    private final String value;

    Text(final TextType type, final String value) {
        this.type = type;
        this.value = value;
    }

    @Override
    public TextType type() {
        return type;
    }

    public String value() {
        return value;
    }

    /**
     * Returns the number of Unicode code points.
     */
    public int length() {
        return value.codePointCount(0, value.length());
    }

    @Override
    public void encodeTo(final ScaleWriter writer) {
        final byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
        writer.writeCompact(utf8.length).writeBytes(utf8);
    }

    @Override
    public int byteLength() {
        final int contentLength = Utf8.byteLength(value);
        return Compact.encodedLength(contentLength) + contentLength;
    }

    @Override
    public boolean isEmpty() {
        return value.isEmpty();
    }

    /**
     * Matches other text only: a {@link Text} or any {@link CharSequence} with the same content.
     */
    @Override
    public boolean eq(final @Nullable Object other) {
        if (other instanceof Text t) {
            return value.equals(t.value);
        }
        if (other instanceof CharSequence s) {
            return value.contentEquals(s);
        }
        return false;
    }

    @Override
    public JsonNode toHuman(final boolean extended) {
        return Json.NODES.textNode(value);
    }

    /**
     * Returns the string, or the hex of its UTF-8 bytes when the string is itself hex,
     * so that {@code create(toJson())} never misreads it.
     */
    @Override
    public JsonNode toJson() {
        return Json.NODES.textNode(Hex.isHex(value) ? toHex() : value);
    }

    /**
     * Returns the hex of the UTF-8 content without the length prefix.
     */
    @Override
    public String toHex() {
        return Hex.encode(value.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return value;
    }
}
