// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.error;

/**
 * Thrown when an input value is structurally incompatible with a resolved type:
 * wrong arity, unknown enum variant, out-of-range integer, duplicate map key or a
 * fixed-length mismatch.
 *
 * @since 0.1.0
 */
public final class CodecConstructionException extends ScaleException {

    public CodecConstructionException(final String message) {
        super(message);
    }

    public CodecConstructionException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public CodecConstructionException withContext(final String context) {
        return new CodecConstructionException(prefixed(context, getMessage()), this);
    }
}
