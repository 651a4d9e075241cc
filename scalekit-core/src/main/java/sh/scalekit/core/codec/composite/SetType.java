// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.CodecType;
import sh.scalekit.core.error.ScaleDecodingException;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.Compact;
import sh.scalekit.primitives.ScaleReader;

/**
 * {@code BTreeSet<T>}: a compact count followed by distinct elements.
 *
 * <p>Elements keep encounter order. Two elements are duplicates when they encode to
 * the same bytes; duplicates fail both construction and decoding.
 */
public final class SetType extends AbstractCodecType<BTreeSet> {

    private final CodecType<?> element;

    public SetType(final TypeRegistry registry, final String name, final CodecType<?> element) {
        super(registry, name, BTreeSet.class);
        this.element = Objects.requireNonNull(element, "element");
    }

    public CodecType<?> element() {
        return element;
    }

    @Override
    protected BTreeSet decodeValue(final ScaleReader reader) {
        final int count = Compact.decodeLength(reader);
        final List<Codec> elements = new ArrayList<>(Math.min(count, reader.remaining()));
        final Set<Codec> seen = new HashSet<>();
        for (int i = 0; i < count; i++) {
            final int index = i;
            final int offset = reader.position();
            final Codec value = Contexts.decode(element, reader, () -> "BTreeSet[" + index + "]");
            if (!seen.add(value)) {
                throw ScaleDecodingException.at(offset, name() + ": duplicate element " + value);
            }
            elements.add(value);
        }
        return new BTreeSet(this, elements);
    }

    @Override
    protected BTreeSet fromValue(final Object value) {
        final List<?> list = Contexts.asList(value);
        if (list == null) {
            throw incompatible(value);
        }
        final List<Codec> elements = new ArrayList<>(list.size());
        final Set<Codec> seen = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            final int index = i;
            final Codec item = Contexts.create(element, list.get(i), () -> "BTreeSet[" + index + "]");
            if (!seen.add(item)) {
                throw invalid("duplicate element " + item);
            }
            elements.add(item);
        }
        return new BTreeSet(this, elements);
    }

    @Override
    protected BTreeSet fromCodec(final Codec codec) {
        if (codec instanceof Sequence sequence) {
            return fromValue(sequence.elements());
        }
        return super.fromCodec(codec);
    }

    @Override
    protected BTreeSet defaultValue() {
        return new BTreeSet(this, List.of());
    }
}
