// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata.model;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Extrinsic format information.
 *
 * @param type             type id of the extrinsic, {@code null} for legacy metadata
 * @param version          the extrinsic format version
 * @param signedExtensions the signed extensions in payload order
 */
public record ExtrinsicMetadata(@Nullable Integer type, int version, List<SignedExtensionMetadata> signedExtensions) {

    public ExtrinsicMetadata {
        signedExtensions = List.copyOf(signedExtensions);
    }
}
