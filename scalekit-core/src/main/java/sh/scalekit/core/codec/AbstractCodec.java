// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec;

import java.util.Arrays;

import org.jspecify.annotations.Nullable;

import sh.scalekit.core.error.ScaleException;
import sh.scalekit.primitives.ScaleWriter;

/**
 * Base class providing encoding, structural equality and string conversion in
 * terms of {@link #encodeTo(ScaleWriter)}.
 *
 * <p>Two codecs are {@link #equals(Object) equal} when they share a type name and
 * encode to the same bytes.
 */
public abstract class AbstractCodec implements Codec {

    @Override
    public byte[] encode() {
        final ScaleWriter writer = new ScaleWriter();
        encodeTo(writer);
        return writer.toByteArray();
    }

    @Override
    public int byteLength() {
        return encode().length;
    }

    @Override
    public boolean eq(final @Nullable Object other) {
        if (other instanceof Codec codec) {
            return Arrays.equals(encode(), codec.encode());
        }
        try {
            return Arrays.equals(encode(), type().create(other).encode());
        } catch (ScaleException e) {
            // a value that cannot be shaped into this type is not equal to it
            return false;
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Codec other)) {
            return false;
        }
        return rawTypeName().equals(other.rawTypeName()) && Arrays.equals(encode(), other.encode());
    }

    @Override
    public int hashCode() {
        return 31 * rawTypeName().hashCode() + Arrays.hashCode(encode());
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
