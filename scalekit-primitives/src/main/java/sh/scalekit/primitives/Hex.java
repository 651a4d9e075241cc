// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.primitives;

import java.util.Arrays;

/**
 * Utility methods for hex encoding/decoding with optional {@code 0x} prefixes.
 *
 * <p>SCALE values are exchanged as {@code 0x}-prefixed lowercase hex on every
 * JSON boundary, so encoding always emits the prefix while decoding accepts
 * input with or without it.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Convert a hex string (with or without {@code 0x}) into a byte array.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  characters, or contains invalid hex
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }

        final int start = hasPrefix(hexString) ? 2 : 0;
        final int hexLength = hexString.length() - start;

        if (hexLength == 0) {
            return new byte[0];
        }

        if ((hexLength & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }

        final int len = hexLength / 2;
        final byte[] result = new byte[len];

        for (int i = 0; i < len; i++) {
            final int high = toNibble(hexString.charAt(start + i * 2), hexString);
            final int low = toNibble(hexString.charAt(start + i * 2 + 1), hexString);
            result[i] = (byte) ((high << 4) | low);
        }

        return result;
    }

    /**
     * Convert a byte array into a lowercase hex string with a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string with {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        return encode(bytes, 0, bytes.length);
    }

    /**
     * Convert a sub-range of a byte array into a lowercase hex string with a {@code 0x} prefix.
     *
     * @param bytes  the source byte array
     * @param offset the starting offset in the byte array
     * @param length the number of bytes to encode
     * @return hex string with {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null},
     *                                  or if offset/length are out of bounds
     */
    public static String encode(final byte[] bytes, final int offset, final int length) {
        validateSubarray(bytes, offset, length);

        final char[] chars = new char[2 + length * 2];
        chars[0] = '0';
        chars[1] = 'x';
        for (int i = 0; i < length; i++) {
            final int v = bytes[offset + i] & 0xFF;
            chars[2 + i * 2] = HEX_CHARS[v >>> 4];
            chars[2 + i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Convert a byte array into a lowercase hex string without a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string without {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }

        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Remove a {@code 0x} prefix from the given string if present.
     *
     * @param hexString the string to clean
     * @return the string without a {@code 0x} prefix
     * @throws IllegalArgumentException if {@code hexString} is {@code null}
     */
    public static String cleanPrefix(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        return hasPrefix(hexString) ? hexString.substring(2) : hexString;
    }

    /**
     * Returns {@code true} if the provided string starts with {@code 0x}
     * (case-insensitive).
     *
     * @param hexString the string to check
     * @return {@code true} when the prefix is present
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    /**
     * Returns {@code true} if the value is a {@code 0x}-prefixed string with an even
     * number of valid hex digits. {@code "0x"} on its own counts as empty hex.
     *
     * @param value the value to test
     * @return whether {@link #decode(String)} would accept it as prefixed hex
     */
    public static boolean isHex(final CharSequence value) {
        if (value == null || value.length() < 2 || (value.length() & 1) == 1) {
            return false;
        }
        if (value.charAt(0) != '0' || (value.charAt(1) != 'x' && value.charAt(1) != 'X')) {
            return false;
        }
        for (int i = 2; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
                return false;
            }
        }
        return true;
    }

    private static int toNibble(final char c, final String originalInput) {
        if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
            throw new IllegalArgumentException("invalid hex character in: " + originalInput);
        }
        return NIBBLE_LOOKUP[c];
    }

    private static void validateSubarray(final byte[] bytes, final int offset, final int length) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        if (offset < 0 || length < 0 || offset + length > bytes.length) {
            throw new IllegalArgumentException(
                    "range out of bounds: offset=" + offset + ", length=" + length + ", bytes.length=" + bytes.length);
        }
    }
}
