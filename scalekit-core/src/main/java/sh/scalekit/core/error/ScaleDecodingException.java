// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.error;

/**
 * Thrown when SCALE bytes cannot be decoded: the buffer is too short, a
 * discriminant or presence byte is invalid, trailing bytes remain, or a metadata
 * envelope carries an unknown magic or version.
 *
 * @since 0.1.0
 */
public final class ScaleDecodingException extends ScaleException {

    public ScaleDecodingException(final String message) {
        super(message);
    }

    public ScaleDecodingException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates an exception that names the byte offset at which decoding failed.
     */
    public static ScaleDecodingException at(final int offset, final String message) {
        return new ScaleDecodingException(message + " (at offset " + offset + ")");
    }

    @Override
    public ScaleDecodingException withContext(final String context) {
        return new ScaleDecodingException(prefixed(context, getMessage()), this);
    }
}
