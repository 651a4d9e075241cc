// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.primitives;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * UTF-8 helpers used by text codecs.
 */
public final class Utf8 {

    private Utf8() {
        // Utility class
    }

    /**
     * Computes UTF-8 byte length without allocating a byte array.
     *
     * <p>This is cheaper than {@code value.getBytes(UTF_8).length}, which
     * allocates a new array on every call.
     *
     * @param s the string to measure
     * @return number of bytes in its UTF-8 form
     */
    public static int byteLength(final String s) {
        int len = 0;
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c < 0x80) {
                len += 1;
            } else if (c < 0x800) {
                len += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
                len += 4;
                i++; // Skip low surrogate
            } else if (Character.isSurrogate(c)) {
                len += 1; // unpaired surrogates encode as '?'
            } else {
                len += 3;
            }
        }
        return len;
    }

    /**
     * Strictly decodes UTF-8.
     *
     * @param bytes the encoded text
     * @return the decoded string
     * @throws IllegalArgumentException if the bytes are not well-formed UTF-8
     */
    public static String decode(final byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("invalid UTF-8 sequence: " + Hex.encode(bytes), e);
        }
    }

    /**
     * Returns {@code true} when the bytes are valid UTF-8 consisting only of printable
     * characters (tabs and line breaks allowed).
     */
    public static boolean isPrintable(final byte[] bytes) {
        final String text;
        try {
            text = decode(bytes);
        } catch (IllegalArgumentException e) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t') {
                return false;
            }
        }
        return true;
    }
}
