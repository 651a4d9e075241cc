// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.CodecType;
import sh.scalekit.core.error.ScaleDecodingException;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.Compact;
import sh.scalekit.primitives.ScaleReader;

/**
 * {@code BTreeMap<K, V>} and {@code HashMap<K, V>}: a compact count followed by
 * key-value pairs.
 *
 * <p>Entries keep encounter order; duplicate keys fail construction and decoding.
 * Accepted plain inputs are a {@link Map} (JSON object keys are converted through
 * the key type) or a list of {@code [key, value]} pairs.
 */
public final class MapType extends AbstractCodecType<BTreeMap> {

    private final CodecType<?> keyType;
    private final CodecType<?> valueType;

    public MapType(final TypeRegistry registry, final String name, final CodecType<?> keyType,
            final CodecType<?> valueType) {
        super(registry, name, BTreeMap.class);
        this.keyType = Objects.requireNonNull(keyType, "keyType");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
    }

    public CodecType<?> keyType() {
        return keyType;
    }

    public CodecType<?> valueType() {
        return valueType;
    }

    @Override
    protected BTreeMap decodeValue(final ScaleReader reader) {
        final int count = Compact.decodeLength(reader);
        final Map<Codec, Codec> entries = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            final int index = i;
            final int offset = reader.position();
            final Codec key = Contexts.decode(keyType, reader, () -> "BTreeMap[" + index + "].key");
            final Codec value = Contexts.decode(valueType, reader, () -> "BTreeMap[" + index + "].value");
            if (entries.putIfAbsent(key, value) != null) {
                throw ScaleDecodingException.at(offset, name() + ": duplicate key " + key);
            }
        }
        return new BTreeMap(this, entries);
    }

    @Override
    protected BTreeMap fromValue(final Object value) {
        final Map<Codec, Codec> entries = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            int index = 0;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                put(entries, index++, entry.getKey(), entry.getValue());
            }
            return new BTreeMap(this, entries);
        }
        final List<?> pairs = Contexts.asList(value);
        if (pairs == null) {
            throw incompatible(value);
        }
        for (int i = 0; i < pairs.size(); i++) {
            final List<?> pair = Contexts.asList(pairs.get(i));
            if (pair == null || pair.size() != 2) {
                throw invalid("entry " + i + " is not a [key, value] pair");
            }
            put(entries, i, pair.get(0), pair.get(1));
        }
        return new BTreeMap(this, entries);
    }

    @Override
    protected BTreeMap defaultValue() {
        return new BTreeMap(this, new LinkedHashMap<>());
    }

    private void put(final Map<Codec, Codec> entries, final int index, final Object rawKey, final Object rawValue) {
        final Codec key = Contexts.create(keyType, rawKey, () -> "BTreeMap[" + index + "].key");
        final Codec value = Contexts.create(valueType, rawValue, () -> "BTreeMap[" + index + "].value");
        if (entries.putIfAbsent(key, value) != null) {
            throw invalid("duplicate key " + key);
        }
    }
}
