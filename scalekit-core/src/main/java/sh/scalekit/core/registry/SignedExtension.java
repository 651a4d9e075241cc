// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.registry;

import java.util.Objects;

/**
 * A transaction extension: the data it adds to the signed payload ({@code extra})
 * and the implicit data it contributes to the signature only ({@code additional}).
 *
 * @param identifier the runtime identifier, e.g. {@code CheckNonce}
 * @param extra      the definition of the extra data, {@code Null} when none
 * @param additional the definition of the additional signed data, {@code Null} when none
 */
public record SignedExtension(String identifier, TypeDef extra, TypeDef additional) {

    public SignedExtension {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(extra, "extra");
        Objects.requireNonNull(additional, "additional");
    }

    /**
     * Creates an extension from descriptor strings.
     */
    public static SignedExtension of(final String identifier, final String extra, final String additional) {
        return new SignedExtension(identifier, TypeDefParser.parse(extra), TypeDefParser.parse(additional));
    }

    /**
     * Creates an extension that contributes nothing.
     */
    public static SignedExtension noop(final String identifier) {
        return new SignedExtension(identifier, TypeDefs.NULL, TypeDefs.NULL);
    }
}
