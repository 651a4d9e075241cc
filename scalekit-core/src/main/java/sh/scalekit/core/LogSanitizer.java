// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility that shortens debug log payloads.
 *
 * <p>
 * Performs two operations:
 * <ul>
 * <li>Abbreviates long {@code 0x} hex runs (encoded values, metadata blobs)</li>
 * <li>Truncates excessively long logs to prevent memory issues</li>
 * </ul>
 */
public final class LogSanitizer {

    /**
     * Maximum length for sanitized log output. Logs exceeding this will be truncated.
     */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Hex runs longer than this many digits are abbreviated. */
    private static final int MAX_HEX_DIGITS = 64;

    /** Number of leading and trailing digits kept when a hex run is abbreviated. */
    private static final int HEX_KEEP = 16;

    private static final Pattern HEX_RUN = Pattern.compile("0x[0-9a-fA-F]{" + (MAX_HEX_DIGITS + 1) + ",}");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("0x")) {
            final Matcher matcher = HEX_RUN.matcher(sanitized);
            final StringBuilder out = new StringBuilder();
            while (matcher.find()) {
                final String run = matcher.group();
                final int digits = run.length() - 2;
                final String abbreviated = run.substring(0, 2 + HEX_KEEP)
                        + "…(" + (digits / 2) + " bytes)…"
                        + run.substring(run.length() - HEX_KEEP);
                matcher.appendReplacement(out, Matcher.quoteReplacement(abbreviated));
            }
            matcher.appendTail(out);
            sanitized = out.toString();
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
