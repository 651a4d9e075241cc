// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import sh.scalekit.core.codec.AbstractCodec;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.Json;
import sh.scalekit.primitives.Compact;
import sh.scalekit.primitives.ScaleWriter;

/**
 * Shared encoding and projection for element lists, with or without a compact
 * count prefix.
 */
abstract class AbstractSequence extends AbstractCodec implements Sequence {

    private final List<Codec> elements;
    private final boolean prefixed;

    AbstractSequence(final List<Codec> elements, final boolean prefixed) {
        this.elements = List.copyOf(elements);
        this.prefixed = prefixed;
    }

    @Override
    public final List<Codec> elements() {
        return elements;
    }

    @Override
    public void encodeTo(final ScaleWriter writer) {
        if (prefixed) {
            writer.writeCompact(elements.size());
        }
        for (Codec element : elements) {
            element.encodeTo(writer);
        }
    }

    @Override
    public int byteLength() {
        int length = prefixed ? Compact.encodedLength(elements.size()) : 0;
        for (Codec element : elements) {
            length += element.byteLength();
        }
        return length;
    }

    @Override
    public JsonNode toHuman(final boolean extended) {
        final ArrayNode array = Json.NODES.arrayNode();
        elements.forEach(element -> array.add(element.toHuman(extended)));
        return array;
    }

    @Override
    public JsonNode toJson() {
        final ArrayNode array = Json.NODES.arrayNode();
        elements.forEach(element -> array.add(element.toJson()));
        return array;
    }
}
