// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for registry and metadata tracing.
 *
 * <p>Messages use {@link String#formatted(Object...)} placeholders and always
 * pass through {@link LogSanitizer} so multi-kilobyte hex blobs never reach the
 * log verbatim.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.scalekit.debug");

    private DebugLogger() {
    }

    public static void logRegistry(final String message, final Object... args) {
        if (!ScaleDebug.isRegistryLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logMetadata(final String message, final Object... args) {
        if (!ScaleDebug.isMetadataLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!ScaleDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
