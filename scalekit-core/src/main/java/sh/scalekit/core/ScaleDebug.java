// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core;

/**
 * Global toggle for verbose debug logging across scalekit modules.
 *
 * <p>Two channels exist: registry resolution and metadata ingestion. Both are off
 * by default. The flags are volatile; a brief inconsistency between them while
 * they are being flipped has no correctness impact.
 */
public final class ScaleDebug {

    private static volatile boolean registryLogging = false;
    private static volatile boolean metadataLogging = false;

    private ScaleDebug() {
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either channel is enabled
     */
    public static boolean isEnabled() {
        return registryLogging || metadataLogging;
    }

    public static void setEnabled(final boolean enabled) {
        registryLogging = enabled;
        metadataLogging = enabled;
    }

    public static void setRegistryLogging(final boolean enabled) {
        registryLogging = enabled;
    }

    public static boolean isRegistryLoggingEnabled() {
        return registryLogging;
    }

    public static void setMetadataLogging(final boolean enabled) {
        metadataLogging = enabled;
    }

    public static boolean isMetadataLoggingEnabled() {
        return metadataLogging;
    }
}
