// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata.model;

import java.util.Objects;

/**
 * A signed extension as declared by the runtime.
 *
 * @param identifier       the extension identifier, e.g. {@code CheckNonce}
 * @param type             type id of the extra data carried in the extrinsic
 * @param additionalSigned type id of the additional data included only in the signed payload
 */
public record SignedExtensionMetadata(String identifier, int type, int additionalSigned) {

    public SignedExtensionMetadata {
        Objects.requireNonNull(identifier, "identifier");
    }
}
