// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

import sh.scalekit.core.codec.AbstractCodec;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.Json;
import sh.scalekit.primitives.ScaleWriter;

/**
 * An ordered set of named field values.
 *
 * <p>The struct owns its field container and exposes it read-only; it is not itself
 * a {@link Map}.
 */
public final class Struct extends AbstractCodec {

    private final StructType type;
    private final Map<String, Codec> values;

    Struct(final StructType type, final Map<String, Codec> values) {
        this.type = type;
        this.values = Collections.unmodifiableMap(values);
    }

    @Override
    public StructType type() {
        return type;
    }

    /**
     * Returns the field value, or {@code null} if there is no such field.
     */
    public @Nullable Codec get(final String field) {
        return values.get(field);
    }

    /**
     * Returns the field value cast to {@code codecClass}.
     *
     * @throws IllegalArgumentException if the field is missing or of another class
     */
    public <T extends Codec> T getAs(final String field, final Class<T> codecClass) {
        final Codec value = values.get(field);
        if (value == null) {
            throw new IllegalArgumentException("No field '" + field + "' in " + type.name());
        }
        if (!codecClass.isInstance(value)) {
            throw new IllegalArgumentException("Field '" + field + "' is " + value.getClass().getSimpleName()
                    + ", not " + codecClass.getSimpleName());
        }
        return codecClass.cast(value);
    }

    public Codec getAt(final int index) {
        return new ArrayList<>(values.values()).get(index);
    }

    public List<String> fieldNames() {
        return List.copyOf(values.keySet());
    }

    public int size() {
        return values.size();
    }

    /**
     * Returns the read-only field map in declaration order.
     */
    public Map<String, Codec> values() {
        return values;
    }

    @Override
    public void encodeTo(final ScaleWriter writer) {
        for (Codec value : values.values()) {
            value.encodeTo(writer);
        }
    }

    @Override
    public int byteLength() {
        int length = 0;
        for (Codec value : values.values()) {
            length += value.byteLength();
        }
        return length;
    }

    @Override
    public boolean isEmpty() {
        for (Codec value : values.values()) {
            if (!value.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public JsonNode toHuman(final boolean extended) {
        final ObjectNode node = Json.NODES.objectNode();
        values.forEach((name, value) -> node.set(name, value.toHuman(extended)));
        return node;
    }

    @Override
    public JsonNode toJson() {
        final ObjectNode node = Json.NODES.objectNode();
        for (StructType.Field field : type.fields()) {
            node.set(field.jsonKey(), values.get(field.name()).toJson());
        }
        return node;
    }
}
