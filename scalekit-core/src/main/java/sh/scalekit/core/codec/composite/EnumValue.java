// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.scalekit.core.codec.AbstractCodec;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.Json;
import sh.scalekit.core.codec.Names;
import sh.scalekit.primitives.ScaleWriter;

/**
 * A value of an {@link EnumType}: the selected variant and its payload.
 *
 * <p>JSON form is the bare variant name for enums without payloads and
 * {@code {"camelName": payload}} otherwise.
 */
public final class EnumValue extends AbstractCodec {

    private final EnumType type;
    private final EnumType.Variant variant;
    private final Codec value;

    EnumValue(final EnumType type, final EnumType.Variant variant, final Codec value) {
        this.type = type;
        this.variant = variant;
        this.value = value;
    }

    @Override
    public EnumType type() {
        return type;
    }

    public int index() {
        return variant.index();
    }

    public String variantName() {
        return variant.name();
    }

    public boolean isVariant(final String name) {
        return variant.name().equals(name);
    }

    /**
     * Returns the payload, a {@code Null} codec for payload-less variants.
     */
    public Codec value() {
        return value;
    }

    public <T extends Codec> T valueAs(final Class<T> codecClass) {
        if (!codecClass.isInstance(value)) {
            throw new IllegalArgumentException(variant.name() + " payload is " + value.getClass().getSimpleName()
                    + ", not " + codecClass.getSimpleName());
        }
        return codecClass.cast(value);
    }

    @Override
    public void encodeTo(final ScaleWriter writer) {
        writer.writeByte(variant.index());
        value.encodeTo(writer);
    }

    @Override
    public int byteLength() {
        return 1 + value.byteLength();
    }

    @Override
    public boolean isEmpty() {
        return variant.equals(type.variants().get(0)) && value.isEmpty();
    }

    @Override
    public JsonNode toHuman(final boolean extended) {
        if (type.isBasic()) {
            return Json.NODES.textNode(variant.name());
        }
        final ObjectNode node = Json.NODES.objectNode();
        node.set(variant.name(), value.toHuman(extended));
        return node;
    }

    @Override
    public JsonNode toJson() {
        if (type.isBasic()) {
            return Json.NODES.textNode(variant.name());
        }
        final ObjectNode node = Json.NODES.objectNode();
        node.set(Names.camelCase(variant.name()), value.toJson());
        return node;
    }
}
