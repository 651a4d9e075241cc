// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import sh.scalekit.core.error.CodecConstructionException;
import sh.scalekit.core.error.ScaleDecodingException;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.Hex;
import sh.scalekit.primitives.ScaleReader;

/**
 * Base class implementing the uniform input handling of {@link CodecType#create(Object)}.
 *
 * <p>Dispatch order:
 * <ol>
 * <li>{@link JsonNode} inputs are converted to plain Java values first</li>
 * <li>{@code null} yields {@link #defaultValue()}</li>
 * <li>{@code byte[]} is decoded with {@link #decodePrefix(byte[])}, or with
 * {@link #decodeExact(byte[])} when strict</li>
 * <li>a codec of this very type is returned as is; other codecs go to {@link #fromCodec(Codec)}</li>
 * <li>{@code 0x} hex strings go to {@link #fromHex(String)}</li>
 * <li>everything else goes to {@link #fromValue(Object)}</li>
 * </ol>
 *
 * <p>Primitive readers signal short buffers with {@link IllegalArgumentException};
 * {@link #decode(ScaleReader)} turns those into {@link ScaleDecodingException}s
 * naming this type.
 *
 * @param <T> the value class
 */
public abstract class AbstractCodecType<T extends Codec> implements CodecType<T> {

    protected final TypeRegistry registry;
    private final String name;
    private final Class<T> codecClass;

    protected AbstractCodecType(final TypeRegistry registry, final String name, final Class<T> codecClass) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.name = Objects.requireNonNull(name, "name");
        this.codecClass = Objects.requireNonNull(codecClass, "codecClass");
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final TypeRegistry registry() {
        return registry;
    }

    @Override
    public final T decode(final ScaleReader reader) {
        try {
            return decodeValue(reader);
        } catch (IllegalArgumentException e) {
            throw new ScaleDecodingException(name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public T decodeExact(final byte[] bytes) {
        final ScaleReader reader = ScaleReader.of(bytes);
        final T value = decode(reader);
        if (reader.hasRemaining()) {
            throw ScaleDecodingException.at(reader.position(),
                    name + ": " + reader.remaining() + " trailing byte(s) after value");
        }
        return value;
    }

    /**
     * Decodes one value from the start of {@code bytes}, ignoring anything after it.
     */
    public final T decodePrefix(final byte[] bytes) {
        return decode(ScaleReader.of(bytes));
    }

    @Override
    public final T create(final @Nullable Object input, final boolean strict) {
        final Object value = input instanceof JsonNode node ? Json.toPlain(node) : input;
        if (value == null) {
            return defaultValue();
        }
        if (value instanceof byte[] bytes) {
            return strict ? decodeExact(bytes) : decodePrefix(bytes);
        }
        if (value instanceof Codec codec) {
            if (codecClass.isInstance(codec) && codec.rawTypeName().equals(name)) {
                return codecClass.cast(codec);
            }
            return fromCodec(codec);
        }
        if (value instanceof String s && Hex.isHex(s)) {
            return fromHex(s);
        }
        return fromValue(value);
    }

    protected abstract T decodeValue(ScaleReader reader);

    /**
     * Builds a value from a plain Java input (map, list, number, string, boolean).
     */
    protected abstract T fromValue(Object value);

    protected abstract T defaultValue();

    /**
     * Builds a value from hex. Defaults to decoding the hex as SCALE bytes, ignoring
     * anything after the value.
     */
    protected T fromHex(final String hex) {
        return decodePrefix(Hex.decode(hex));
    }

    /**
     * Builds a value from a codec of another type. Defaults to re-decoding its
     * encoding, which succeeds for types with a compatible wire shape.
     */
    protected T fromCodec(final Codec codec) {
        try {
            return decodeExact(codec.encode());
        } catch (ScaleDecodingException e) {
            throw new CodecConstructionException(
                    name + ": cannot construct from " + codec.rawTypeName() + " (" + e.getMessage() + ")", e);
        }
    }

    protected final CodecConstructionException incompatible(final Object value) {
        return new CodecConstructionException(
                name + ": cannot construct from " + value.getClass().getSimpleName() + " " + abbreviate(value));
    }

    protected final CodecConstructionException invalid(final String reason) {
        return new CodecConstructionException(name + ": " + reason);
    }

    private static String abbreviate(final Object value) {
        final String text = String.valueOf(value);
        return text.length() > 80 ? text.substring(0, 77) + "..." : text;
    }

    @Override
    public String toString() {
        return name;
    }
}
