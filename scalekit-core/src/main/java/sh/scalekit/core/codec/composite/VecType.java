// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.CodecType;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.Compact;
import sh.scalekit.primitives.ScaleReader;

/**
 * {@code Vec<T>}: a compact element count followed by the elements.
 */
public final class VecType extends AbstractCodecType<Vec> {

    private final CodecType<?> element;

    public VecType(final TypeRegistry registry, final String name, final CodecType<?> element) {
        super(registry, name, Vec.class);
        this.element = Objects.requireNonNull(element, "element");
    }

    public CodecType<?> element() {
        return element;
    }

    @Override
    protected Vec decodeValue(final ScaleReader reader) {
        final int count = Compact.decodeLength(reader);
        final List<Codec> elements = new ArrayList<>(Math.min(count, reader.remaining()));
        for (int i = 0; i < count; i++) {
            final int index = i;
            elements.add(Contexts.decode(element, reader, () -> "Vec[" + index + "]"));
        }
        return new Vec(this, elements);
    }

    @Override
    protected Vec fromValue(final Object value) {
        final List<?> list = Contexts.asList(value);
        if (list == null) {
            throw incompatible(value);
        }
        final List<Codec> elements = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            final int index = i;
            elements.add(Contexts.create(element, list.get(i), () -> "Vec[" + index + "]"));
        }
        return new Vec(this, elements);
    }

    @Override
    protected Vec fromCodec(final Codec codec) {
        if (codec instanceof Sequence sequence) {
            return fromValue(sequence.elements());
        }
        return super.fromCodec(codec);
    }

    @Override
    protected Vec defaultValue() {
        return new Vec(this, List.of());
    }
}
