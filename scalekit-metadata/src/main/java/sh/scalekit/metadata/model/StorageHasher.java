// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata.model;

/**
 * Key hashers of storage maps, in wire order.
 */
public enum StorageHasher {
    BLAKE2_128("Blake2_128", false),
    BLAKE2_256("Blake2_256", false),
    BLAKE2_128_CONCAT("Blake2_128Concat", true),
    TWOX_128("Twox128", false),
    TWOX_256("Twox256", false),
    TWOX_64_CONCAT("Twox64Concat", true),
    IDENTITY("Identity", true);

    private final String variantName;
    private final boolean concat;

    StorageHasher(final String variantName, final boolean concat) {
        this.variantName = variantName;
        this.concat = concat;
    }

    public String variantName() {
        return variantName;
    }

    /**
     * Returns whether the hashed key is followed by the raw key, so keys can be
     * recovered from storage.
     */
    public boolean isConcat() {
        return concat;
    }

    /**
     * @throws IllegalArgumentException if {@code variantName} is not a known hasher
     */
    public static StorageHasher fromVariant(final String variantName) {
        for (StorageHasher hasher : values()) {
            if (hasher.variantName.equals(variantName)) {
                return hasher;
            }
        }
        throw new IllegalArgumentException("Unknown storage hasher '" + variantName + "'");
    }
}
