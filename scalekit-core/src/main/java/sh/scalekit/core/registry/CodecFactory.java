// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.registry;

import sh.scalekit.core.codec.CodecType;

/**
 * Extension point for codec types that cannot be expressed as a {@link TypeDef}.
 *
 * <p>A factory is invoked at most once per registry cache generation; the resulting
 * type is cached under the registered name.
 * <pre>{@code
 * registry.register("AccountId", r -> new RawType(r, "AccountId", 32));
 * }</pre>
 */
@FunctionalInterface
public interface CodecFactory {

    /**
     * Builds the codec type for the given registry.
     *
     * @param registry the registry resolving the type
     * @return the codec type
     */
    CodecType<?> create(TypeRegistry registry);
}
