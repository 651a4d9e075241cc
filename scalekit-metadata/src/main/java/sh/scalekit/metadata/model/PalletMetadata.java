// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * Descriptor table of one pallet. Type ids are kept exactly as decoded.
 *
 * @param name          the pallet name
 * @param index         the pallet index used in call and event encoding
 * @param storagePrefix the storage prefix, {@code null} when the pallet has no storage
 * @param storage       storage items
 * @param calls         type id of the call enum, if any
 * @param events        type id of the event enum, if any
 * @param errors        type id of the error enum, if any
 * @param constants     constants
 */
public record PalletMetadata(
        String name,
        int index,
        @Nullable String storagePrefix,
        List<StorageEntryMetadata> storage,
        @Nullable Integer calls,
        @Nullable Integer events,
        @Nullable Integer errors,
        List<ConstantMetadata> constants) {

    public PalletMetadata {
        Objects.requireNonNull(name, "name");
        storage = List.copyOf(storage);
        constants = List.copyOf(constants);
    }

    public Optional<StorageEntryMetadata> storageEntry(final String entryName) {
        return storage.stream().filter(e -> e.name().equals(entryName)).findFirst();
    }

    public Optional<ConstantMetadata> constant(final String constantName) {
        return constants.stream().filter(c -> c.name().equals(constantName)).findFirst();
    }
}
