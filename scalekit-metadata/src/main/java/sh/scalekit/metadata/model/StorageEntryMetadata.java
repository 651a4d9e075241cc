// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata.model;

import java.util.List;
import java.util.Objects;

import sh.scalekit.primitives.Hex;

/**
 * A storage item of a pallet.
 *
 * @param name     the item name
 * @param modifier whether a missing value reads as {@code None} or as the fallback
 * @param type     plain value or keyed map
 * @param fallback the SCALE-encoded default value
 * @param docs     documentation lines
 */
public record StorageEntryMetadata(String name, Modifier modifier, StorageEntryType type, byte[] fallback,
        List<String> docs) {

    public enum Modifier {
        OPTIONAL,
        DEFAULT
    }

    /**
     * The key and value layout of a storage item.
     */
    public sealed interface StorageEntryType {

        /** The value type id. */
        int value();
    }

    /** A single value without keys. */
    public record PlainType(int value) implements StorageEntryType {
    }

    /**
     * A map. Multi-key maps carry one hasher per key and a tuple key type.
     *
     * @param hashers one hasher per key component
     * @param key     the key type id
     * @param value   the value type id
     */
    public record MapType(List<StorageHasher> hashers, int key, int value) implements StorageEntryType {
        public MapType {
            hashers = List.copyOf(hashers);
        }
    }

    public StorageEntryMetadata {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(modifier, "modifier");
        Objects.requireNonNull(type, "type");
        fallback = fallback.clone();
        docs = List.copyOf(docs);
    }

    @Override
    public byte[] fallback() {
        return fallback.clone();
    }

    @Override
    public String toString() {
        return "StorageEntryMetadata[name=" + name + ", modifier=" + modifier + ", type=" + type
                + ", fallback=" + Hex.encode(fallback) + "]";
    }
}
