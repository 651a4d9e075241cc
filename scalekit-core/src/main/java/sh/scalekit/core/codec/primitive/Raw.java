// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import com.fasterxml.jackson.databind.JsonNode;

import sh.scalekit.core.codec.AbstractCodec;
import sh.scalekit.core.codec.Json;
import sh.scalekit.primitives.Hex;
import sh.scalekit.primitives.ScaleWriter;
import sh.scalekit.primitives.Utf8;

/**
 * Raw byte content without a length prefix.
 */
public final class Raw extends AbstractCodec {

    private final RawType type;
    private final byte[] content;

    Raw(final RawType type, final byte[] content) {
        this.type = type;
        this.content = content;
    }

    @Override
    public RawType type() {
        return type;
    }

    /**
     * Returns a copy of the content.
     */
    public byte[] bytes() {
        return content.clone();
    }

    public int length() {
        return content.length;
    }

    @Override
    public void encodeTo(final ScaleWriter writer) {
        writer.writeBytes(content);
    }

    @Override
    public byte[] encode() {
        return content.clone();
    }

    @Override
    public int byteLength() {
        return content.length;
    }

    /**
     * Empty when there is no content or every byte is zero.
     */
    @Override
    public boolean isEmpty() {
        for (byte b : content) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public JsonNode toHuman(final boolean extended) {
        if (content.length > 0 && Utf8.isPrintable(content)) {
            return Json.NODES.textNode(Utf8.decode(content));
        }
        return Json.NODES.textNode(toHex());
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
        return toHex();
    }
}
