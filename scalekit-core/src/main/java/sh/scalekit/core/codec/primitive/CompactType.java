// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import java.math.BigInteger;
import java.util.Objects;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.error.ScaleDecodingException;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.Compact;
import sh.scalekit.primitives.ScaleReader;

/**
 * {@code Compact<T>} over an unsigned integer type.
 *
 * <p>Encoding is always canonical; decoding accepts any size class but rejects
 * values wider than the inner integer.
 */
public final class CompactType extends AbstractCodecType<CompactInt> {

    private final IntType inner;

    public CompactType(final TypeRegistry registry, final String name, final IntType inner) {
        super(registry, name, CompactInt.class);
        this.inner = Objects.requireNonNull(inner, "inner");
        if (inner.isSigned()) {
            throw new IllegalArgumentException("Compact encoding requires an unsigned integer, got " + inner.name());
        }
    }

    public IntType inner() {
        return inner;
    }

    public CompactInt of(final BigInteger value) {
        if (!Ints.fits(value, inner.bitLength(), false)) {
            throw invalid("value " + value + " out of range for " + inner.name());
        }
        return new CompactInt(this, value);
    }

    public CompactInt of(final long value) {
        return of(BigInteger.valueOf(value));
    }

    @Override
    protected CompactInt decodeValue(final ScaleReader reader) {
        final int offset = reader.position();
        final BigInteger value = Compact.decode(reader);
        if (!Ints.fits(value, inner.bitLength(), false)) {
            throw ScaleDecodingException.at(offset, name() + ": value " + value + " exceeds " + inner.name());
        }
        return new CompactInt(this, value);
    }

    @Override
    protected CompactInt fromValue(final Object value) {
        final BigInteger parsed = Ints.parse(value);
        if (parsed == null) {
            throw incompatible(value);
        }
        return of(parsed);
    }

    @Override
    protected CompactInt fromHex(final String hex) {
        return of(Ints.fromBigEndianHex(hex, inner.byteLength(), false));
    }

    @Override
    protected CompactInt fromCodec(final Codec codec) {
        if (codec instanceof Int other) {
            return of(other.value());
        }
        if (codec instanceof CompactInt compact) {
            return of(compact.value());
        }
        return super.fromCodec(codec);
    }

    @Override
    protected CompactInt defaultValue() {
        return new CompactInt(this, BigInteger.ZERO);
    }
}
