// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.Collections;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

import sh.scalekit.core.codec.AbstractCodec;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.Json;
import sh.scalekit.primitives.Compact;
import sh.scalekit.primitives.ScaleWriter;

/**
 * An ordered map of codec keys to codec values.
 *
 * <p>The JSON form is an object when every key projects to a JSON scalar and an
 * array of {@code [key, value]} pairs otherwise.
 */
public final class BTreeMap extends AbstractCodec {

    private final MapType type;
    private final Map<Codec, Codec> entries;

    BTreeMap(final MapType type, final Map<Codec, Codec> entries) {
        this.type = type;
        this.entries = Collections.unmodifiableMap(entries);
    }

    @Override
    public MapType type() {
        return type;
    }

    public Map<Codec, Codec> entries() {
        return entries;
    }

    /**
     * Looks a value up by key, converting {@code key} to the key type first.
     */
    public @Nullable Codec get(final @Nullable Object key) {
        return entries.get(type.keyType().create(key));
    }

    public int size() {
        return entries.size();
    }

    @Override
    public void encodeTo(final ScaleWriter writer) {
        writer.writeCompact(entries.size());
        entries.forEach((key, value) -> {
            key.encodeTo(writer);
            value.encodeTo(writer);
        });
    }

    @Override
    public int byteLength() {
        int length = Compact.encodedLength(entries.size());
        for (Map.Entry<Codec, Codec> entry : entries.entrySet()) {
            length += entry.getKey().byteLength() + entry.getValue().byteLength();
        }
        return length;
    }

    @Override
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public JsonNode toHuman(final boolean extended) {
        return project(true, extended);
    }

    @Override
    public JsonNode toJson() {
        return project(false, false);
    }

    private JsonNode project(final boolean human, final boolean extended) {
        boolean scalarKeys = true;
        for (Codec key : entries.keySet()) {
            final JsonNode json = key.toJson();
            if (!json.isValueNode() || json.isNull()) {
                scalarKeys = false;
                break;
            }
        }
        if (scalarKeys) {
            final ObjectNode node = Json.NODES.objectNode();
            entries.forEach((key, value) -> node.set(
                    (human ? key.toHuman(extended) : key.toJson()).asText(),
                    human ? value.toHuman(extended) : value.toJson()));
            return node;
        }
        final ArrayNode pairs = Json.NODES.arrayNode();
        entries.forEach((key, value) -> pairs.addArray()
                .add(human ? key.toHuman(extended) : key.toJson())
                .add(human ? value.toHuman(extended) : value.toJson()));
        return pairs;
    }
}
