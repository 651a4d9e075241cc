// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import java.math.BigInteger;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import sh.scalekit.core.codec.AbstractCodec;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.Json;
import sh.scalekit.primitives.ScaleWriter;

/**
 * A fixed-width integer value.
 *
 * <p>{@link #toJson()} is a JSON number while the value is exactly representable as a
 * double (52 bits) and the type is at most 128 bits wide; otherwise it is the
 * big-endian padded hex from {@link #toHex()}.
 */
public final class Int extends AbstractCodec {

    private static final int JSON_SAFE_BITS = 52;

    private final IntType type;
    private final BigInteger value;

    Int(final IntType type, final BigInteger value) {
        this.type = type;
        this.value = value;
    }

    @Override
    public IntType type() {
        return type;
    }

    public BigInteger value() {
        return value;
    }

    public long longValueExact() {
        return value.longValueExact();
    }

    public int intValueExact() {
        return value.intValueExact();
    }

    @Override
    public void encodeTo(final ScaleWriter writer) {
        writer.writeLittleEndian(value, type.byteLength());
    }

    @Override
    public int byteLength() {
        return type.byteLength();
    }

    @Override
    public boolean isEmpty() {
        return value.signum() == 0;
    }

    @Override
    public boolean eq(final @Nullable Object other) {
        if (other instanceof Int i) {
            return value.equals(i.value);
        }
        if (other instanceof CompactInt c) {
            return value.equals(c.value());
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
        if (type.bitLength() > 128 || value.bitLength() > JSON_SAFE_BITS) {
            return Json.NODES.textNode(toHex());
        }
        return Json.NODES.numberNode(value.longValue());
    }

    /**
     * Returns the big-endian two's complement hex, padded to the type width.
     */
    @Override
    public String toHex() {
        return Ints.toBigEndianHex(value, type.byteLength());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
