// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.List;

import org.jspecify.annotations.Nullable;

import sh.scalekit.core.codec.Codec;

/**
 * A set of distinct values in encounter order.
 */
public final class BTreeSet extends AbstractSequence {

    private final SetType type;

    BTreeSet(final SetType type, final List<Codec> elements) {
        super(elements, true);
        this.type = type;
    }

    @Override
    public SetType type() {
        return type;
    }

    /**
     * Returns whether an element equal to {@code value}, after conversion to the
     * element type, is present.
     */
    public boolean contains(final @Nullable Object value) {
        final Codec probe = type.element().create(value);
        return elements().contains(probe);
    }

    @Override
    public boolean isEmpty() {
        return elements().isEmpty();
    }
}
