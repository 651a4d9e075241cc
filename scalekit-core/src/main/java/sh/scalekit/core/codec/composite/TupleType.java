// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.ArrayList;
import java.util.List;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.CodecType;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.ScaleReader;

/**
 * Fixed-arity heterogeneous tuple, encoded without a prefix.
 *
 * <p>A single-element tuple also accepts its element directly instead of a list.
 */
public final class TupleType extends AbstractCodecType<Tuple> {

    private final List<CodecType<?>> types;

    public TupleType(final TypeRegistry registry, final String name, final List<CodecType<?>> types) {
        super(registry, name, Tuple.class);
        this.types = List.copyOf(types);
    }

    public List<CodecType<?>> types() {
        return types;
    }

    @Override
    protected Tuple decodeValue(final ScaleReader reader) {
        final List<Codec> elements = new ArrayList<>(types.size());
        for (int i = 0; i < types.size(); i++) {
            final int index = i;
            elements.add(Contexts.decode(types.get(i), reader, () -> "Tuple[" + index + "]"));
        }
        return new Tuple(this, elements);
    }

    @Override
    protected Tuple fromValue(final Object value) {
        List<?> list = Contexts.asList(value);
        if (list == null && types.size() == 1) {
            list = List.of(value);
        }
        if (list == null) {
            throw incompatible(value);
        }
        if (list.size() != types.size()) {
            throw invalid("expected " + types.size() + " value(s), got " + list.size());
        }
        final List<Codec> elements = new ArrayList<>(types.size());
        for (int i = 0; i < types.size(); i++) {
            final int index = i;
            elements.add(Contexts.create(types.get(i), list.get(i), () -> "Tuple[" + index + "]"));
        }
        return new Tuple(this, elements);
    }

    @Override
    protected Tuple fromCodec(final Codec codec) {
        if (codec instanceof Sequence sequence) {
            return fromValue(sequence.elements());
        }
        return super.fromCodec(codec);
    }

    @Override
    protected Tuple defaultValue() {
        final List<Codec> elements = new ArrayList<>(types.size());
        for (int i = 0; i < types.size(); i++) {
            final int index = i;
            elements.add(Contexts.create(types.get(i), null, () -> "Tuple[" + index + "]"));
        }
        return new Tuple(this, elements);
    }
}
