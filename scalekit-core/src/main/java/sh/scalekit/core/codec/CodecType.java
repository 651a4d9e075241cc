// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec;

import org.jspecify.annotations.Nullable;

import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.ScaleReader;

/**
 * A resolved codec constructor: everything needed to build values of one type.
 *
 * <p>
 * Instances are produced by {@link TypeRegistry#resolve(String)} and hold their
 * child types already resolved, so decoding never looks a descriptor up by name.
 *
 * @param <T> the value class this type constructs
 * @since 0.1.0
 */
public interface CodecType<T extends Codec> {

    /**
     * Returns the canonical descriptor of this type, e.g. {@code Option<u32>} or
     * {@code {"a":"u32","b":"Text"}}.
     */
    String name();

    /**
     * Returns the registry this type was resolved against.
     */
    TypeRegistry registry();

    /**
     * Decodes one value from the reader, consuming exactly its bytes.
     *
     * @param reader the source
     * @return the decoded value
     * @throws sh.scalekit.core.error.ScaleDecodingException if the bytes are malformed
     */
    T decode(ScaleReader reader);

    /**
     * Decodes a value that must span the whole array.
     *
     * @throws sh.scalekit.core.error.ScaleDecodingException if bytes are malformed or left over
     */
    T decodeExact(byte[] bytes);

    /**
     * Builds a value from any supported input: SCALE bytes, a {@code 0x} hex string,
     * a plain Java or Jackson value, another codec, or {@code null} for the default.
     *
     * <p>Byte input is decoded as a prefix: bytes after the value are ignored.
     *
     * @param input the input
     * @return the constructed value
     * @throws sh.scalekit.core.error.CodecConstructionException if the input does not fit the type
     */
    default T create(@Nullable Object input) {
        return create(input, false);
    }

    /**
     * Like {@link #create(Object)}. When {@code strict} is set, {@code byte[]} input
     * must be consumed completely, as with {@link #decodeExact(byte[])}.
     *
     * @throws sh.scalekit.core.error.ScaleDecodingException if strict and bytes are left over
     */
    T create(@Nullable Object input, boolean strict);
}
