// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.primitives;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * Forward-only cursor over a SCALE encoded byte array.
 *
 * <p>The reader never copies the backing array; every method that hands bytes
 * out returns a fresh copy so decoded values do not alias the caller's buffer.
 * Reads past the end throw {@link IllegalArgumentException} carrying the offset
 * at which the read started.
 */
public final class ScaleReader {

    private final byte[] data;
    private final int limit;
    private int position;

    private ScaleReader(final byte[] data, final int offset, final int limit) {
        this.data = data;
        this.position = offset;
        this.limit = limit;
    }

    /**
     * Creates a reader over the whole array.
     *
     * @param data the encoded bytes
     * @return a reader positioned at offset 0
     */
    public static ScaleReader of(final byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        return new ScaleReader(data, 0, data.length);
    }

    /**
     * Creates a reader over {@code data[offset, offset + length)}.
     */
    public static ScaleReader of(final byte[] data, final int offset, final int length) {
        Objects.requireNonNull(data, "data cannot be null");
        if (offset < 0 || length < 0 || offset + length > data.length) {
            throw new IllegalArgumentException(
                    "range out of bounds: offset=" + offset + ", length=" + length + ", data.length=" + data.length);
        }
        return new ScaleReader(data, offset, offset + length);
    }

    public int position() {
        return position;
    }

    public int remaining() {
        return limit - position;
    }

    public boolean hasRemaining() {
        return position < limit;
    }

    /**
     * Reads one byte as an unsigned value in {@code [0, 255]}.
     */
    public int readUnsignedByte() {
        require(1);
        return data[position++] & 0xFF;
    }

    /**
     * Returns the next byte without consuming it.
     */
    public int peekUnsignedByte() {
        require(1);
        return data[position] & 0xFF;
    }

    /**
     * Reads exactly {@code length} bytes.
     *
     * @param length number of bytes to read
     * @return a copy of the bytes
     */
    public byte[] readBytes(final int length) {
        if (length < 0) {
            throw new IllegalArgumentException("negative length " + length + " at offset " + position);
        }
        require(length);
        final byte[] out = Arrays.copyOfRange(data, position, position + length);
        position += length;
        return out;
    }

    /**
     * Reads every byte left in the reader.
     */
    public byte[] readRemaining() {
        return readBytes(remaining());
    }

    /**
     * Reads a fixed-width little-endian integer.
     *
     * @param byteLength width in bytes
     * @param signed     whether to interpret the value as two's complement
     * @return the decoded value
     */
    public BigInteger readLittleEndian(final int byteLength, final boolean signed) {
        require(byteLength);
        final byte[] bigEndian = new byte[byteLength];
        for (int i = 0; i < byteLength; i++) {
            bigEndian[i] = data[position + byteLength - 1 - i];
        }
        position += byteLength;
        return signed ? new BigInteger(bigEndian) : new BigInteger(1, bigEndian);
    }

    /**
     * Reads a little-endian unsigned 32-bit value into a {@code long}.
     */
    public long readU32() {
        require(4);
        final long value = (data[position] & 0xFFL)
                | (data[position + 1] & 0xFFL) << 8
                | (data[position + 2] & 0xFFL) << 16
                | (data[position + 3] & 0xFFL) << 24;
        position += 4;
        return value;
    }

    private void require(final int length) {
        if (limit - position < length) {
            throw new IllegalArgumentException("need " + length + " byte(s) at offset " + position
                    + " but only " + (limit - position) + " remain");
        }
    }
}
