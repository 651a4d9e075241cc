// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.List;
import java.util.Objects;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.CodecType;
import sh.scalekit.core.codec.primitive.Bool;
import sh.scalekit.core.codec.primitive.BoolType;
import sh.scalekit.core.codec.primitive.NullType;
import sh.scalekit.core.error.ScaleDecodingException;
import sh.scalekit.core.registry.LazyCodecType;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.ScaleReader;

/**
 * {@code Option<T>}: a presence byte ({@code 0} none, {@code 1} some) followed by
 * the payload when present.
 *
 * <p>{@code Option<bool>} folds the payload into the presence byte: {@code 0} none,
 * {@code 1} some(true), {@code 2} some(false).
 *
 * <p>When the payload type can itself project to JSON {@code null} (a nested option or
 * the unit type), {@code Some} projects to a one-element array {@code [payload]} and
 * that form is accepted back.
 */
public final class OptionType extends AbstractCodecType<Option> {

    private final CodecType<?> inner;
    private final boolean boolMode;
    private final Option none = new Option(this, null);

    public OptionType(final TypeRegistry registry, final String name, final CodecType<?> inner) {
        super(registry, name, Option.class);
        this.inner = Objects.requireNonNull(inner, "inner");
        this.boolMode = inner instanceof BoolType;
    }

    public CodecType<?> inner() {
        return inner;
    }

    boolean isBoolMode() {
        return boolMode;
    }

    boolean wrapsJson() {
        final CodecType<?> target = LazyCodecType.unwrap(inner);
        return target instanceof OptionType || target instanceof NullType;
    }

    public Option none() {
        return none;
    }

    public Option some(final Object value) {
        return new Option(this, Contexts.create(inner, value, () -> "Option"));
    }

    @Override
    protected Option decodeValue(final ScaleReader reader) {
        final int offset = reader.position();
        final int flag = reader.readUnsignedByte();
        if (boolMode) {
            if (flag > 2) {
                throw ScaleDecodingException.at(offset, name() + ": invalid presence byte " + flag);
            }
            return flag == 0 ? none : new Option(this, ((BoolType) inner).of(flag == 1));
        }
        if (flag == 0) {
            return none;
        }
        if (flag != 1) {
            throw ScaleDecodingException.at(offset, name() + ": invalid presence byte " + flag);
        }
        return new Option(this, Contexts.decode(inner, reader, () -> "Option"));
    }

    @Override
    protected Option fromValue(final Object value) {
        if (wrapsJson()) {
            final List<?> list = Contexts.asList(value);
            if (list != null && list.size() == 1) {
                return some(list.get(0));
            }
        }
        return some(value);
    }

    @Override
    protected Option fromCodec(final Codec codec) {
        if (codec instanceof Option other) {
            return other.isNone() ? none : some(other.unwrap());
        }
        return some(codec);
    }

    @Override
    protected Option defaultValue() {
        return none;
    }

    static boolean isTrue(final Codec value) {
        return value instanceof Bool b && b.value();
    }
}
