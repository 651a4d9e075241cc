// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.primitives;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Encoding and decoding of SCALE compact (variable width) unsigned integers.
 *
 * <p>The two low bits of the first byte select the size class:
 * <ul>
 * <li>{@code 0b00} - single byte, values {@code [0, 2^6)}</li>
 * <li>{@code 0b01} - two bytes, values {@code [2^6, 2^14)}</li>
 * <li>{@code 0b10} - four bytes, values {@code [2^14, 2^30)}</li>
 * <li>{@code 0b11} - big-integer mode: the upper six bits hold {@code n - 4}
 * followed by {@code n} little-endian bytes, {@code 4 <= n <= 67}</li>
 * </ul>
 *
 * <p>{@link #encode(BigInteger)} always emits the smallest class. Decoding accepts
 * any valid class, canonical or not.
 */
public final class Compact {

    /** Largest value of the single-byte class, exclusive. */
    private static final BigInteger SINGLE_BYTE_LIMIT = BigInteger.ONE.shiftLeft(6);
    private static final BigInteger TWO_BYTE_LIMIT = BigInteger.ONE.shiftLeft(14);
    private static final BigInteger FOUR_BYTE_LIMIT = BigInteger.ONE.shiftLeft(30);

    /** Big-integer mode carries at most 67 payload bytes (6-bit header + 4). */
    private static final int MAX_BIG_BYTES = 67;
    private static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(MAX_BIG_BYTES * 8).subtract(BigInteger.ONE);

    private Compact() {
        // Utility class
    }

    /**
     * Encodes {@code value} in its canonical (smallest) size class.
     *
     * @param value a non-negative integer below {@code 2^536}
     * @return the encoded bytes
     * @throws IllegalArgumentException if the value is negative or too large
     */
    public static byte[] encode(final BigInteger value) {
        validate(value);
        if (value.compareTo(SINGLE_BYTE_LIMIT) < 0) {
            return new byte[] {(byte) (value.intValue() << 2)};
        }
        if (value.compareTo(TWO_BYTE_LIMIT) < 0) {
            final int v = (value.intValue() << 2) | 0b01;
            return new byte[] {(byte) v, (byte) (v >>> 8)};
        }
        if (value.compareTo(FOUR_BYTE_LIMIT) < 0) {
            final long v = (value.longValue() << 2) | 0b10;
            return new byte[] {(byte) v, (byte) (v >>> 8), (byte) (v >>> 16), (byte) (v >>> 24)};
        }
        final int payload = Math.max(4, (value.bitLength() + 7) / 8);
        final byte[] out = new byte[1 + payload];
        out[0] = (byte) (((payload - 4) << 2) | 0b11);
        final byte[] bigEndian = value.toByteArray();
        for (int i = 0; i < payload; i++) {
            final int src = bigEndian.length - 1 - i;
            out[1 + i] = src >= 0 ? bigEndian[src] : 0;
        }
        return out;
    }

    /**
     * Encodes a non-negative {@code long}.
     */
    public static byte[] encode(final long value) {
        return encode(BigInteger.valueOf(value));
    }

    /**
     * Returns the number of bytes {@link #encode(BigInteger)} produces for {@code value}.
     */
    public static int encodedLength(final BigInteger value) {
        validate(value);
        if (value.compareTo(SINGLE_BYTE_LIMIT) < 0) {
            return 1;
        }
        if (value.compareTo(TWO_BYTE_LIMIT) < 0) {
            return 2;
        }
        if (value.compareTo(FOUR_BYTE_LIMIT) < 0) {
            return 4;
        }
        return 1 + Math.max(4, (value.bitLength() + 7) / 8);
    }

    public static int encodedLength(final long value) {
        return encodedLength(BigInteger.valueOf(value));
    }

    /**
     * Decodes one compact value from the reader.
     *
     * @param reader the source positioned at the first byte of the compact
     * @return the decoded value
     * @throws IllegalArgumentException if the reader runs out of bytes
     */
    public static BigInteger decode(final ScaleReader reader) {
        Objects.requireNonNull(reader, "reader cannot be null");
        final int first = reader.peekUnsignedByte();
        switch (first & 0b11) {
            case 0b00:
                reader.readUnsignedByte();
                return BigInteger.valueOf(first >>> 2);
            case 0b01:
                return reader.readLittleEndian(2, false).shiftRight(2);
            case 0b10:
                return reader.readLittleEndian(4, false).shiftRight(2);
            default:
                reader.readUnsignedByte();
                return reader.readLittleEndian((first >>> 2) + 4, false);
        }
    }

    /**
     * Decodes a compact that is used as a length or element count.
     *
     * @throws IllegalArgumentException if the value does not fit an {@code int}
     */
    public static int decodeLength(final ScaleReader reader) {
        final int offset = reader.position();
        final BigInteger value = decode(reader);
        if (value.bitLength() > 31) {
            throw new IllegalArgumentException("compact length " + value + " at offset " + offset + " exceeds int range");
        }
        return value.intValue();
    }

    private static void validate(final BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("compact value cannot be negative: " + value);
        }
        if (value.compareTo(MAX_VALUE) > 0) {
            throw new IllegalArgumentException("compact value exceeds 2^536 - 1: " + value);
        }
    }
}
