// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.List;

import sh.scalekit.core.codec.Codec;

/**
 * A {@code Vec<T>} value.
 */
public final class Vec extends AbstractSequence {

    private final VecType type;

    Vec(final VecType type, final List<Codec> elements) {
        super(elements, true);
        this.type = type;
    }

    @Override
    public VecType type() {
        return type;
    }

    @Override
    public boolean isEmpty() {
        return elements().isEmpty();
    }
}
