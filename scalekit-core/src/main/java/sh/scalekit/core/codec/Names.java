// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Identifier case conversions used for JSON keys and derived type names.
 */
public final class Names {

    private Names() {
        // Utility class
    }

    /**
     * Converts {@code snake_case}, {@code kebab-case} or {@code PascalCase} to {@code camelCase}.
     * An all-uppercase word is lowered entirely, so {@code CheckNonce} becomes
     * {@code checkNonce} and {@code ID} becomes {@code id}.
     */
    public static String camelCase(final String value) {
        final List<String> words = words(value);
        final StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < words.size(); i++) {
            final String word = words.get(i);
            if (i == 0) {
                sb.append(lowerFirst(word));
            } else {
                sb.append(Character.toUpperCase(word.charAt(0))).append(word, 1, word.length());
            }
        }
        return sb.toString();
    }

    /**
     * Converts to {@code PascalCase}: {@code pallet_balances} becomes {@code PalletBalances}.
     */
    public static String pascalCase(final String value) {
        final StringBuilder sb = new StringBuilder(value.length());
        for (String word : words(value)) {
            sb.append(Character.toUpperCase(word.charAt(0))).append(word, 1, word.length());
        }
        return sb.toString();
    }

    private static String lowerFirst(final String word) {
        if (word.equals(word.toUpperCase(Locale.ROOT))) {
            return word.toLowerCase(Locale.ROOT);
        }
        return Character.toLowerCase(word.charAt(0)) + word.substring(1);
    }

    private static List<String> words(final String value) {
        final List<String> words = new ArrayList<>();
        for (String part : value.split("[_\\-\\s]+")) {
            if (!part.isEmpty()) {
                words.add(part);
            }
        }
        return words;
    }
}
