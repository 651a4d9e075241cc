// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata;

import java.util.regex.Pattern;

/**
 * Cleans the textual type names of legacy metadata into registry descriptors.
 *
 * <pre>{@code
 * T::Balance                              -> Balance
 * <T as Trait<I>>::Balance                -> Balance
 * Vec<<T as frame_system::Config>::Hash>  -> Vec<Hash>
 * &'static [u8]                           -> Bytes
 * BalanceOf<T>                            -> BalanceOf
 * }</pre>
 */
final class HistoricNames {

    private static final Pattern TRAIT_QUALIFIER =
            Pattern.compile("<\\s*T\\s+as\\s+[A-Za-z0-9_:]+(<[A-Za-z0-9_,\\s]*>)?\\s*>::");
    private static final Pattern GENERIC_PREFIX = Pattern.compile("(?<![A-Za-z0-9_])[TI]::");
    private static final Pattern STATIC_BYTES = Pattern.compile("&\\s*('static\\s*)?\\[\\s*u8\\s*]");
    private static final Pattern STATIC_STR = Pattern.compile("&\\s*('static\\s*)?str");
    private static final Pattern GENERIC_PARAM = Pattern.compile("<\\s*(T|I|T\\s*,\\s*I)\\s*>");

    private HistoricNames() {
        // Utility class
    }

    static String sanitize(final String typeName) {
        String name = TRAIT_QUALIFIER.matcher(typeName).replaceAll("");
        name = GENERIC_PREFIX.matcher(name).replaceAll("");
        name = STATIC_BYTES.matcher(name).replaceAll("Bytes");
        name = STATIC_STR.matcher(name).replaceAll("Text");
        name = GENERIC_PARAM.matcher(name).replaceAll("");
        return name.trim();
    }
}
