// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata;

/**
 * Configuration for registering metadata types into a registry.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * MetadataConfig config = MetadataConfig.builder()
 *         .nodeFailurePolicy(NodeFailurePolicy.FAIL)
 *         .registerPathNames(false)
 *         .build();
 *
 * MetadataLoader.load(registry, metadataHex, config);
 * }</pre>
 *
 * @param nodeFailurePolicy what to do with type nodes that fail to resolve
 *                          (default {@link NodeFailurePolicy#WARN_AND_SKIP})
 * @param registerPathNames whether to also register each uniquely named node under
 *                          its PascalCase path, e.g. {@code PalletBalancesAccountData}
 *                          (default {@code true})
 * @param signedExtensions  whether to install the metadata's signed extensions in
 *                          the registry (default {@code true})
 * @since 0.1.0
 */
public record MetadataConfig(
        NodeFailurePolicy nodeFailurePolicy,
        boolean registerPathNames,
        boolean signedExtensions) {

    public MetadataConfig {
        if (nodeFailurePolicy == null) {
            nodeFailurePolicy = NodeFailurePolicy.WARN_AND_SKIP;
        }
    }

    /**
     * Creates a configuration with all defaults.
     */
    public static MetadataConfig withDefaults() {
        return new MetadataConfig(null, true, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link MetadataConfig}.
     */
    public static final class Builder {
        private NodeFailurePolicy nodeFailurePolicy = null;
        private boolean registerPathNames = true;
        private boolean signedExtensions = true;

        private Builder() {
        }

        public Builder nodeFailurePolicy(NodeFailurePolicy policy) {
            this.nodeFailurePolicy = policy;
            return this;
        }

        public Builder registerPathNames(boolean registerPathNames) {
            this.registerPathNames = registerPathNames;
            return this;
        }

        public Builder signedExtensions(boolean signedExtensions) {
            this.signedExtensions = signedExtensions;
            return this;
        }

        public MetadataConfig build() {
            return new MetadataConfig(nodeFailurePolicy, registerPathNames, signedExtensions);
        }
    }
}
