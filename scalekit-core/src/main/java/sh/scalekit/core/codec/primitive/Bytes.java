// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import com.fasterxml.jackson.databind.JsonNode;

import sh.scalekit.core.codec.AbstractCodec;
import sh.scalekit.core.codec.Json;
import sh.scalekit.primitives.Compact;
import sh.scalekit.primitives.Hex;
import sh.scalekit.primitives.ScaleWriter;
import sh.scalekit.primitives.Utf8;

/**
 * Length-prefixed byte content.
 *
 * <p>{@link #toString()} shows printable UTF-8 content as text and anything else as
 * hex; {@link #toJson()} and {@link #toHex()} are always the hex of the content.
 */
public final class Bytes extends AbstractCodec {

    private final BytesType type;
    private final byte[] content;

    Bytes(final BytesType type, final byte[] content) {
        this.type = type;
        this.content = content;
    }

    @Override
    public BytesType type() {
        return type;
    }

    public byte[] bytes() {
        return content.clone();
    }

    public int length() {
        return content.length;
    }

    @Override
    public void encodeTo(final ScaleWriter writer) {
        writer.writeCompact(content.length).writeBytes(content);
    }

    @Override
    public int byteLength() {
        return Compact.encodedLength(content.length) + content.length;
    }

    @Override
    public boolean isEmpty() {
        return content.length == 0;
    }

    @Override
    public JsonNode toHuman(final boolean extended) {
        return Json.NODES.textNode(toString());
    }

    @Override
    public JsonNode toJson() {
        return Json.NODES.textNode(toHex());
    }

    @Override
    public String toHex() {
        return Hex.encode(content);
    }

    @Override
    public String toString() {
        return content.length > 0 && Utf8.isPrintable(content) ? Utf8.decode(content) : toHex();
    }
}
