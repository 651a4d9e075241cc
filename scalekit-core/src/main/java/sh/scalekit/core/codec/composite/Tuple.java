// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.List;

import sh.scalekit.core.codec.Codec;

public final class Tuple extends AbstractSequence {

    private final TupleType type;

    Tuple(final TupleType type, final List<Codec> elements) {
        super(elements, false);
        this.type = type;
    }

    @Override
    public TupleType type() {
        return type;
    }

    @Override
    public boolean isEmpty() {
        return elements().stream().allMatch(Codec::isEmpty);
    }
}
