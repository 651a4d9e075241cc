// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.error;

/**
 * Base runtime exception for all scalekit failures.
 *
 * <p>
 * This sealed class forms the root of the exception hierarchy, so every codec,
 * registry or metadata error can be caught with a single catch clause while the
 * concrete kind stays visible to pattern matching.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * ScaleException
 * ├── {@link CodecConstructionException} - input incompatible with a resolved type
 * ├── {@link ScaleDecodingException} - malformed bytes or metadata envelope
 * └── {@link TypeRegistryException} - unknown types, alias cycles, dangling lookups
 * </pre>
 *
 * <p>
 * Composite codecs re-throw child failures through {@link #withContext(String)},
 * so a deeply nested error reads as a path:
 * <pre>{@code
 * Struct: failed on 'balances' -> Vec[3] -> u128: value -1 out of range
 * }</pre>
 *
 * @since 0.1.0
 */
public abstract sealed class ScaleException extends RuntimeException
        permits CodecConstructionException,
        ScaleDecodingException,
        TypeRegistryException {

    protected ScaleException(final String message) {
        super(message);
    }

    protected ScaleException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns an exception of the same kind whose message is prefixed with
     * {@code context}. The original exception becomes the cause.
     *
     * @param context the parent's description, e.g. {@code "Struct: failed on 'owner'"}
     * @return the wrapped exception
     */
    public abstract ScaleException withContext(String context);

    static String prefixed(final String context, final String message) {
        return context + " -> " + message;
    }
}
