// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.CodecType;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.ScaleReader;

/**
 * {@code [T; N]}: exactly {@code N} elements without a count prefix.
 */
public final class VecFixedType extends AbstractCodecType<VecFixed> {

    private final CodecType<?> element;
    private final int length;

    public VecFixedType(final TypeRegistry registry, final String name, final CodecType<?> element, final int length) {
        super(registry, name, VecFixed.class);
        this.element = Objects.requireNonNull(element, "element");
        if (length < 0) {
            throw new IllegalArgumentException("Negative array length " + length);
        }
        this.length = length;
    }

    public CodecType<?> element() {
        return element;
    }

    public int length() {
        return length;
    }

    @Override
    protected VecFixed decodeValue(final ScaleReader reader) {
        final List<Codec> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            final int index = i;
            elements.add(Contexts.decode(element, reader, () -> "Array[" + index + "]"));
        }
        return new VecFixed(this, elements);
    }

    @Override
    protected VecFixed fromValue(final Object value) {
        final List<?> list = Contexts.asList(value);
        if (list == null) {
            throw incompatible(value);
        }
        if (list.size() != length) {
            throw invalid("expected " + length + " element(s), got " + list.size());
        }
        final List<Codec> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            final int index = i;
            elements.add(Contexts.create(element, list.get(i), () -> "Array[" + index + "]"));
        }
        return new VecFixed(this, elements);
    }

    @Override
    protected VecFixed fromCodec(final Codec codec) {
        if (codec instanceof Sequence sequence) {
            return fromValue(sequence.elements());
        }
        return super.fromCodec(codec);
    }

    @Override
    protected VecFixed defaultValue() {
        final List<Codec> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            final int index = i;
            elements.add(Contexts.create(element, null, () -> "Array[" + index + "]"));
        }
        return new VecFixed(this, elements);
    }
}
