// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import java.math.BigInteger;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.ScaleReader;

/**
 * Fixed-width little-endian integer type ({@code u8} to {@code u256}, {@code i8} to
 * {@code i256}, and {@code char}).
 *
 * <p>Values outside the type's range are rejected at construction.
 */
public final class IntType extends AbstractCodecType<Int> {

    private final int bitLength;
    private final boolean signed;

    public IntType(final TypeRegistry registry, final int bitLength, final boolean signed) {
        this(registry, (signed ? "i" : "u") + bitLength, bitLength, signed);
    }

    public IntType(final TypeRegistry registry, final String name, final int bitLength, final boolean signed) {
        super(registry, name, Int.class);
        if (bitLength <= 0 || bitLength % 8 != 0) {
            throw new IllegalArgumentException("Integer width must be a positive multiple of 8, got " + bitLength);
        }
        this.bitLength = bitLength;
        this.signed = signed;
    }

    public int bitLength() {
        return bitLength;
    }

    public int byteLength() {
        return bitLength / 8;
    }

    public boolean isSigned() {
        return signed;
    }

    /**
     * Creates a value after checking that it fits this type.
     *
     * @throws sh.scalekit.core.error.CodecConstructionException if out of range
     */
    public Int of(final BigInteger value) {
        if (!Ints.fits(value, bitLength, signed)) {
            throw invalid("value " + value + " out of range");
        }
        return new Int(this, value);
    }

    public Int of(final long value) {
        return of(BigInteger.valueOf(value));
    }

    @Override
    protected Int decodeValue(final ScaleReader reader) {
        return new Int(this, reader.readLittleEndian(byteLength(), signed));
    }

    @Override
    protected Int fromValue(final Object value) {
        if (value instanceof Boolean b) {
            return of(b ? BigInteger.ONE : BigInteger.ZERO);
        }
        final BigInteger parsed = Ints.parse(value);
        if (parsed == null) {
            throw incompatible(value);
        }
        return of(parsed);
    }

    @Override
    protected Int fromHex(final String hex) {
        return of(Ints.fromBigEndianHex(hex, byteLength(), signed));
    }

    @Override
    protected Int fromCodec(final Codec codec) {
        if (codec instanceof Int other) {
            return of(other.value());
        }
        if (codec instanceof CompactInt compact) {
            return of(compact.value());
        }
        return super.fromCodec(codec);
    }

    @Override
    protected Int defaultValue() {
        return new Int(this, BigInteger.ZERO);
    }
}
