// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.Hex;
import sh.scalekit.primitives.ScaleWriter;

/**
 * The capability set every SCALE value implements.
 *
 * <p>
 * A codec is an immutable decoded value bound to the {@link CodecType} that
 * produced it. Re-encoding always reproduces bytes that decode to an equal value:
 * <pre>{@code
 * Codec value = registry.createType("Vec<u32>", List.of(1, 2, 3));
 * Codec again = value.type().create(value.encode());
 * assert value.equals(again);
 * assert value.byteLength() == value.encode().length;
 * }</pre>
 *
 * <p>
 * {@link #toJson()} is the machine-readable projection and always re-creates an
 * equal value through {@link CodecType#create(Object)}; {@link #toHuman()} is a
 * lossy display form.
 *
 * @see CodecType
 * @since 0.1.0
 */
public interface Codec {

    /**
     * Returns the resolved type that constructed this value.
     */
    CodecType<?> type();

    /**
     * Returns the registry the value's type was resolved against.
     */
    default TypeRegistry registry() {
        return type().registry();
    }

    /**
     * Appends the SCALE encoding of this value to {@code writer}.
     */
    void encodeTo(ScaleWriter writer);

    /**
     * Returns the SCALE encoding of this value.
     */
    byte[] encode();

    /**
     * Returns the number of bytes {@link #encode()} produces.
     */
    int byteLength();

    /**
     * Returns {@code true} iff the value equals its type's default value.
     */
    boolean isEmpty();

    /**
     * Structural comparison against another codec or a plain value of a compatible
     * shape, e.g. a text value compares equal to a {@link String}.
     *
     * @param other the value to compare with
     * @return whether both represent the same value
     */
    boolean eq(@Nullable Object other);

    default JsonNode toHuman() {
        return toHuman(false);
    }

    /**
     * Display-oriented projection. Not guaranteed to round-trip.
     *
     * @param extended whether to include additional detail where a type has any
     */
    JsonNode toHuman(boolean extended);

    /**
     * Machine-oriented projection that {@link CodecType#create(Object)} accepts back.
     */
    JsonNode toJson();

    /**
     * Returns the canonical descriptor of this value's type, e.g. {@code Vec<u32>}.
     */
    default String rawTypeName() {
        return type().name();
    }

    /**
     * Returns the {@code 0x}-prefixed hex of the encoding. Integers, text and byte
     * content types return the hex of their natural value instead.
     */
    default String toHex() {
        return Hex.encode(encode());
    }
}
