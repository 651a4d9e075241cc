// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.List;

import sh.scalekit.core.codec.Codec;

public final class VecFixed extends AbstractSequence {

    private final VecFixedType type;

    VecFixed(final VecFixedType type, final List<Codec> elements) {
        super(elements, false);
        this.type = type;
    }

    @Override
    public VecFixedType type() {
        return type;
    }

    @Override
    public boolean isEmpty() {
        return elements().stream().allMatch(Codec::isEmpty);
    }
}
