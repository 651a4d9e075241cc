// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.CodecType;
import sh.scalekit.core.codec.Names;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.ScaleReader;

/**
 * Ordered named fields encoded back to back in declaration order.
 *
 * <p>Map inputs are matched per field by JSON key, then field name, then any input
 * key whose camel-cased form equals the field name. Missing fields take their
 * type's default. List inputs must match the field count exactly.
 */
public final class StructType extends AbstractCodecType<Struct> {

    /**
     * One struct field.
     *
     * @param name    the field name
     * @param jsonKey the key used in JSON projections, usually equal to {@code name}
     * @param type    the resolved field type
     */
    public record Field(String name, String jsonKey, CodecType<?> type) {

        public Field {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(jsonKey, "jsonKey");
            Objects.requireNonNull(type, "type");
        }

        public Field(final String name, final CodecType<?> type) {
            this(name, name, type);
        }
    }

    private final List<Field> fields;

    public StructType(final TypeRegistry registry, final String name, final List<Field> fields) {
        super(registry, name, Struct.class);
        this.fields = List.copyOf(fields);
    }

    public List<Field> fields() {
        return fields;
    }

    List<String> fieldNames() {
        return fields.stream().map(Field::name).toList();
    }

    @Override
    protected Struct decodeValue(final ScaleReader reader) {
        final Map<String, Codec> values = new LinkedHashMap<>();
        for (Field field : fields) {
            values.put(field.name(), Contexts.decode(field.type(), reader, () -> context(field)));
        }
        return new Struct(this, values);
    }

    @Override
    protected Struct fromValue(final Object value) {
        final Map<String, Codec> values = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> input) {
            for (Field field : fields) {
                values.put(field.name(), Contexts.create(field.type(), lookup(input, field), () -> context(field)));
            }
            return new Struct(this, values);
        }
        final List<?> list = Contexts.asList(value);
        if (list == null) {
            throw incompatible(value);
        }
        if (list.size() != fields.size()) {
            throw invalid("expected " + fields.size() + " value(s), got " + list.size());
        }
        for (int i = 0; i < fields.size(); i++) {
            final Field field = fields.get(i);
            values.put(field.name(), Contexts.create(field.type(), list.get(i), () -> context(field)));
        }
        return new Struct(this, values);
    }

    /**
     * Rebuilds a struct with the same field names field by field, so children of a
     * matching type are reused as is. Other codecs are re-decoded from their encoding.
     */
    @Override
    protected Struct fromCodec(final Codec codec) {
        if (codec instanceof Struct other && other.fieldNames().equals(fieldNames())) {
            final Map<String, Codec> values = new LinkedHashMap<>();
            for (Field field : fields) {
                values.put(field.name(), Contexts.create(field.type(), other.get(field.name()), () -> context(field)));
            }
            return new Struct(this, values);
        }
        return super.fromCodec(codec);
    }

    @Override
    protected Struct defaultValue() {
        final Map<String, Codec> values = new LinkedHashMap<>();
        for (Field field : fields) {
            values.put(field.name(), Contexts.create(field.type(), null, () -> context(field)));
        }
        return new Struct(this, values);
    }

    private static Object lookup(final Map<?, ?> input, final Field field) {
        if (input.containsKey(field.jsonKey())) {
            return input.get(field.jsonKey());
        }
        if (input.containsKey(field.name())) {
            return input.get(field.name());
        }
        for (Map.Entry<?, ?> entry : input.entrySet()) {
            if (entry.getKey() instanceof String key && Names.camelCase(key).equals(field.name())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String context(final Field field) {
        return "Struct: failed on '" + field.name() + "'";
    }
}
