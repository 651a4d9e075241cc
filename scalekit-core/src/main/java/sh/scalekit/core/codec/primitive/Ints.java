// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

import sh.scalekit.primitives.Hex;

/**
 * Numeric conversions shared by fixed-width and compact integers.
 */
final class Ints {

    private static final Pattern DECIMAL = Pattern.compile("-?[0-9]+");

    private Ints() {
        // Utility class
    }

    /**
     * Converts a plain value to an integer, or returns {@code null} when the value has
     * no integral reading.
     */
    static @Nullable BigInteger parse(final Object value) {
        if (value instanceof BigInteger big) {
            return big;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigInteger.valueOf(((Number) value).longValue());
        }
        if (value instanceof BigDecimal decimal) {
            return integral(decimal);
        }
        if (value instanceof Double || value instanceof Float) {
            final double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? integral(BigDecimal.valueOf(d)) : null;
        }
        if (value instanceof Character c) {
            return BigInteger.valueOf(c);
        }
        if (value instanceof String s) {
            final String trimmed = s.trim().replace("_", "");
            return DECIMAL.matcher(trimmed).matches() ? new BigInteger(trimmed) : null;
        }
        return null;
    }

    /**
     * Reads {@code 0x} hex as a big-endian number. A signed type given exactly its own
     * width is read as two's complement.
     */
    static BigInteger fromBigEndianHex(final String hex, final int byteLength, final boolean signed) {
        final byte[] bytes = Hex.decode(hex);
        if (bytes.length == 0) {
            return BigInteger.ZERO;
        }
        return signed && bytes.length == byteLength ? new BigInteger(bytes) : new BigInteger(1, bytes);
    }

    /**
     * Formats {@code value} as big-endian two's complement hex padded to {@code byteLength}.
     */
    static String toBigEndianHex(final BigInteger value, final int byteLength) {
        final byte[] twos = value.toByteArray();
        final byte fill = value.signum() < 0 ? (byte) 0xFF : 0;
        final byte[] out = new byte[byteLength];
        for (int i = 0; i < byteLength; i++) {
            final int src = twos.length - 1 - i;
            out[byteLength - 1 - i] = src >= 0 ? twos[src] : fill;
        }
        return Hex.encode(out);
    }

    static String grouped(final BigInteger value) {
        return String.format(Locale.ROOT, "%,d", value);
    }

    static boolean fits(final BigInteger value, final int bitLength, final boolean signed) {
        if (signed) {
            return value.bitLength() < bitLength;
        }
        return value.signum() >= 0 && value.bitLength() <= bitLength;
    }

    private static @Nullable BigInteger integral(final BigDecimal decimal) {
        try {
            return decimal.toBigIntegerExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }
}
