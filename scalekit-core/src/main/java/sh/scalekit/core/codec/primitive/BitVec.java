// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import sh.scalekit.core.codec.AbstractCodec;
import sh.scalekit.core.codec.Json;
import sh.scalekit.primitives.Compact;
import sh.scalekit.primitives.Hex;
import sh.scalekit.primitives.ScaleWriter;

/**
 * A bit sequence. {@link #toJson()} is the content hex when the bit count is a
 * multiple of eight and the list of bits otherwise.
 */
public final class BitVec extends AbstractCodec {

    private final BitVecType type;
    private final int bitLength;
    private final byte[] content;

    BitVec(final BitVecType type, final int bitLength, final byte[] content) {
        this.type = type;
        this.bitLength = bitLength;
        this.content = content;
    }

    @Override
    public BitVecType type() {
        return type;
    }

    public int bitLength() {
        return bitLength;
    }

    public boolean get(final int index) {
        if (index < 0 || index >= bitLength) {
            throw new IndexOutOfBoundsException("bit " + index + " of " + bitLength);
        }
        return (content[index / 8] & (1 << (index % 8))) != 0;
    }

    public List<Boolean> bits() {
        final List<Boolean> bits = new ArrayList<>(bitLength);
        for (int i = 0; i < bitLength; i++) {
            bits.add(get(i));
        }
        return bits;
    }

    public byte[] bytes() {
        return content.clone();
    }

    @Override
    public void encodeTo(final ScaleWriter writer) {
        writer.writeCompact(bitLength).writeBytes(content);
    }

    @Override
    public int byteLength() {
        return Compact.encodedLength(bitLength) + content.length;
    }

    @Override
    public boolean isEmpty() {
        return bitLength == 0;
    }

    /**
     * Renders each byte as eight binary digits, most significant first, e.g. {@code 0b00000101_00000001}.
     */
    @Override
    public JsonNode toHuman(final boolean extended) {
        final StringBuilder sb = new StringBuilder("0b");
        for (int i = 0; i < content.length; i++) {
            if (i > 0) {
                sb.append('_');
            }
            final String digits = Integer.toBinaryString(content[i] & 0xFF);
            sb.append("0".repeat(8 - digits.length())).append(digits);
        }
        return Json.NODES.textNode(sb.toString());
    }

    @Override
    public JsonNode toJson() {
        if (bitLength % 8 == 0) {
            return Json.NODES.textNode(Hex.encode(content));
        }
        final ArrayNode array = Json.NODES.arrayNode();
        for (int i = 0; i < bitLength; i++) {
            array.add(get(i));
        }
        return array;
    }
}
