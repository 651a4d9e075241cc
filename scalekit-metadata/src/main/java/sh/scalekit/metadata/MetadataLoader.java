// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata;

import java.util.Objects;

import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.metadata.model.Metadata;

/**
 * Decodes runtime metadata and registers its types in one step.
 *
 * <pre>{@code
 * TypeRegistry registry = new TypeRegistry();
 * LoadResult result = MetadataLoader.load(registry, metadataHex);
 * Codec info = registry.createType("PalletBalancesAccountData", storageBytes);
 * }</pre>
 */
public final class MetadataLoader {

    private MetadataLoader() {
        // Utility class
    }

    /**
     * Decoded metadata together with the registration outcome.
     */
    public record LoadResult(Metadata metadata, RegistrationReport report) {
        public LoadResult {
            Objects.requireNonNull(metadata, "metadata");
            Objects.requireNonNull(report, "report");
        }
    }

    public static LoadResult load(final TypeRegistry registry, final String hex) {
        return load(registry, hex, MetadataConfig.withDefaults());
    }

    public static LoadResult load(final TypeRegistry registry, final String hex, final MetadataConfig config) {
        Objects.requireNonNull(hex, "hex cannot be null");
        return register(registry, MetadataDecoder.decode(hex), config);
    }

    public static LoadResult load(final TypeRegistry registry, final byte[] bytes) {
        return load(registry, bytes, MetadataConfig.withDefaults());
    }

    /**
     * Decodes {@code bytes} and registers the resulting type graph into {@code registry}.
     *
     * @throws sh.scalekit.core.error.ScaleDecodingException if the metadata cannot be decoded
     * @throws sh.scalekit.core.error.TypeRegistryException  if registration fails under
     *                                                       {@link NodeFailurePolicy#FAIL}
     */
    public static LoadResult load(final TypeRegistry registry, final byte[] bytes, final MetadataConfig config) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return register(registry, MetadataDecoder.decode(bytes), config);
    }

    private static LoadResult register(final TypeRegistry registry, final Metadata metadata,
            final MetadataConfig config) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        return new LoadResult(metadata, PortableTypeRegistrar.register(registry, metadata, config));
    }
}
