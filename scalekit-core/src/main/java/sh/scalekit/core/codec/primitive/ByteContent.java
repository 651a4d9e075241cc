// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Extracts raw content bytes from the inputs byte-like types accept.
 */
final class ByteContent {

    private ByteContent() {
        // Utility class
    }

    /**
     * Returns the content of a byte-like codec or plain value, or {@code null} if the
     * value is not byte-like. Lists must hold integers in {@code [0, 255]}.
     */
    static byte @Nullable [] of(final Object value) {
        if (value instanceof Raw raw) {
            return raw.bytes();
        }
        if (value instanceof Bytes bytes) {
            return bytes.bytes();
        }
        if (value instanceof Text text) {
            return text.value().getBytes(StandardCharsets.UTF_8);
        }
        if (value instanceof String s) {
            return s.getBytes(StandardCharsets.UTF_8);
        }
        if (value instanceof List<?> list) {
            final byte[] out = new byte[list.size()];
            for (int i = 0; i < out.length; i++) {
                if (!(list.get(i) instanceof Number n) || n.longValue() < 0 || n.longValue() > 0xFF) {
                    return null;
                }
                out[i] = (byte) n.intValue();
            }
            return out;
        }
        return null;
    }
}
