// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * Decoded runtime metadata, normalized across versions.
 *
 * <p>Legacy (v13) metadata is expressed with the same portable graph as v14: its
 * textual types become {@link TypeDefinition.Historic} nodes with synthetic ids.
 *
 * @param version     the metadata version the blob carried
 * @param lookup      the portable type graph
 * @param pallets     pallet descriptor tables in declaration order
 * @param extrinsic   extrinsic format information
 * @param runtimeType type id of the runtime, {@code null} when not recorded
 * @since 0.1.0
 */
public record Metadata(
        int version,
        PortableTypeGraph lookup,
        List<PalletMetadata> pallets,
        ExtrinsicMetadata extrinsic,
        @Nullable Integer runtimeType) {

    public Metadata {
        Objects.requireNonNull(lookup, "lookup");
        pallets = List.copyOf(pallets);
        Objects.requireNonNull(extrinsic, "extrinsic");
    }

    public Optional<PalletMetadata> pallet(final String name) {
        return pallets.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public Optional<PalletMetadata> pallet(final int index) {
        return pallets.stream().filter(p -> p.index() == index).findFirst();
    }
}
