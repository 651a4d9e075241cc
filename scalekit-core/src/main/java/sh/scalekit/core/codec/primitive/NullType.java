// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.ScaleReader;

/**
 * The unit type ({@code Null}, {@code ()}): zero bytes on the wire. Every plain input
 * maps to the single value.
 */
public final class NullType extends AbstractCodecType<Null> {

    private final Null value = new Null(this);

    public NullType(final TypeRegistry registry) {
        super(registry, "Null", Null.class);
    }

    public Null value() {
        return value;
    }

    @Override
    protected Null decodeValue(final ScaleReader reader) {
        return value;
    }

    @Override
    protected Null fromValue(final Object ignored) {
        return value;
    }

    @Override
    protected Null defaultValue() {
        return value;
    }
}
