// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.registry;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.CodecType;
import sh.scalekit.core.error.TypeRegistryException;
import sh.scalekit.primitives.ScaleReader;

/**
 * Placeholder handed out while a named type is still being resolved, so that a
 * type can refer to itself through a composite ({@code Node { next: Option<Node> }}).
 *
 * <p>Bound exactly once when resolution of the named type completes; every operation
 * delegates to the bound target.
 */
public final class LazyCodecType implements CodecType<Codec> {

    private final String name;
    private final TypeRegistry registry;
    private volatile @Nullable CodecType<?> target;

    LazyCodecType(final String name, final TypeRegistry registry) {
        this.name = name;
        this.registry = registry;
    }

    void bind(final CodecType<?> resolved) {
        Objects.requireNonNull(resolved, "resolved");
        if (target != null) {
            throw new IllegalStateException("Placeholder for '" + name + "' is already bound");
        }
        target = resolved;
    }

    public boolean isBound() {
        return target != null;
    }

    /**
     * Returns the bound type.
     *
     * @throws TypeRegistryException if resolution of the type never completed
     */
    public CodecType<?> target() {
        final CodecType<?> resolved = target;
        if (resolved == null) {
            throw new TypeRegistryException("Recursive type '" + name + "' used before its resolution completed");
        }
        return resolved;
    }

    /**
     * Follows placeholders to the concrete type.
     */
    public static CodecType<?> unwrap(final CodecType<?> type) {
        CodecType<?> current = type;
        while (current instanceof LazyCodecType lazy) {
            current = lazy.target();
        }
        return current;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public TypeRegistry registry() {
        return registry;
    }

    @Override
    public Codec decode(final ScaleReader reader) {
        return target().decode(reader);
    }

    @Override
    public Codec decodeExact(final byte[] bytes) {
        return target().decodeExact(bytes);
    }

    @Override
    public Codec create(final @Nullable Object input, final boolean strict) {
        return target().create(input, strict);
    }

    @Override
    public String toString() {
        return name;
    }
}
