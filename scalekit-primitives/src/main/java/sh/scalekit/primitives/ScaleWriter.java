// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.primitives;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * Growable output buffer for SCALE encoding.
 *
 * <p>Composite values encode by asking each child to append itself to the same
 * writer, so a struct of N fields costs one final array copy instead of N
 * intermediate concatenations.
 */
public final class ScaleWriter {

    private static final int DEFAULT_CAPACITY = 64;

    private byte[] buffer;
    private int size;

    public ScaleWriter() {
        this(DEFAULT_CAPACITY);
    }

    public ScaleWriter(final int initialCapacity) {
        this.buffer = new byte[Math.max(initialCapacity, 8)];
    }

    public ScaleWriter writeByte(final int value) {
        ensureCapacity(1);
        buffer[size++] = (byte) value;
        return this;
    }

    public ScaleWriter writeBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        ensureCapacity(bytes.length);
        System.arraycopy(bytes, 0, buffer, size, bytes.length);
        size += bytes.length;
        return this;
    }

    /**
     * Writes {@code value} as a fixed-width little-endian two's complement integer.
     *
     * @param value      the value, which must fit the width
     * @param byteLength width in bytes
     * @return this writer
     * @throws IllegalArgumentException if the value does not fit
     */
    public ScaleWriter writeLittleEndian(final BigInteger value, final int byteLength) {
        final int bits = byteLength * 8;
        final boolean fits = value.signum() < 0 ? value.bitLength() < bits : value.bitLength() <= bits;
        if (!fits) {
            throw new IllegalArgumentException("value " + value + " does not fit in " + byteLength + " byte(s)");
        }
        final byte[] twos = value.toByteArray();
        final byte fill = value.signum() < 0 ? (byte) 0xFF : 0;
        ensureCapacity(byteLength);
        for (int i = 0; i < byteLength; i++) {
            final int src = twos.length - 1 - i;
            buffer[size + i] = src >= 0 ? twos[src] : fill;
        }
        size += byteLength;
        return this;
    }

    /**
     * Writes {@code value} using the canonical compact encoding.
     */
    public ScaleWriter writeCompact(final BigInteger value) {
        return writeBytes(Compact.encode(value));
    }

    public ScaleWriter writeCompact(final long value) {
        return writeCompact(BigInteger.valueOf(value));
    }

    public int size() {
        return size;
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, size);
    }

    private void ensureCapacity(final int extra) {
        final int required = size + extra;
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
    }
}
