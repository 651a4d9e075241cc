// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import java.math.BigInteger;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import sh.scalekit.core.codec.AbstractCodec;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.Json;
import sh.scalekit.primitives.Compact;
import sh.scalekit.primitives.ScaleWriter;

/**
 * A compact-encoded unsigned integer. Projects exactly like its inner integer.
 */
public final class CompactInt extends AbstractCodec {

    private final CompactType type;
    private final BigInteger value;

    CompactInt(final CompactType type, final BigInteger value) {
        this.type = type;
        this.value = value;
    }

    @Override
    public CompactType type() {
        return type;
    }

    public BigInteger value() {
        return value;
    }

    public long longValueExact() {
        return value.longValueExact();
    }

    @Override
    public void encodeTo(final ScaleWriter writer) {
        writer.writeCompact(value);
    }

    @Override
    public int byteLength() {
        return Compact.encodedLength(value);
    }

    @Override
    public boolean isEmpty() {
        return value.signum() == 0;
    }

    @Override
    public boolean eq(final @Nullable Object other) {
        if (other instanceof CompactInt c) {
            return value.equals(c.value);
        }
        if (other instanceof Int i) {
            return value.equals(i.value());
        }
        if (other instanceof Codec) {
            return super.eq(other);
        }
        final BigInteger parsed = other == null ? null : Ints.parse(other);
        return parsed != null ? value.equals(parsed) : super.eq(other);
    }

    @Override
    public JsonNode toHuman(final boolean extended) {
        return Json.NODES.textNode(Ints.grouped(value));
    }

    @Override
    public JsonNode toJson() {
        if (type.inner().bitLength() > 128 || value.bitLength() > 52) {
            return Json.NODES.textNode(toHex());
        }
        return Json.NODES.numberNode(value.longValue());
    }

    /**
     * Returns the big-endian hex of the value padded to the inner integer width.
     */
    @Override
    public String toHex() {
        return Ints.toBigEndianHex(value, type.inner().byteLength());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
