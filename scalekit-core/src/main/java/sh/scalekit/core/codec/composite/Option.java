// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.NoSuchElementException;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import sh.scalekit.core.codec.AbstractCodec;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.Json;
import sh.scalekit.primitives.ScaleWriter;

/**
 * An optional value. {@code None} projects to JSON {@code null}; see {@link OptionType}
 * for the projection of {@code Some} around a nullable payload.
 */
public final class Option extends AbstractCodec {

    private final OptionType type;
    private final @Nullable Codec value;

    Option(final OptionType type, final @Nullable Codec value) {
        this.type = type;
        this.value = value;
    }

    @Override
    public OptionType type() {
        return type;
    }

    public boolean isSome() {
        return value != null;
    }

    public boolean isNone() {
        return value == null;
    }

    /**
     * Returns the contained value.
     *
     * @throws NoSuchElementException if this is {@code None}
     */
    public Codec unwrap() {
        if (value == null) {
            throw new NoSuchElementException(type.name() + " is None");
        }
        return value;
    }

    public Codec unwrapOr(final Codec fallback) {
        return value != null ? value : fallback;
    }

    public Optional<Codec> value() {
        return Optional.ofNullable(value);
    }

    @Override
    public void encodeTo(final ScaleWriter writer) {
        if (value == null) {
            writer.writeByte(0);
        } else if (type.isBoolMode()) {
            writer.writeByte(OptionType.isTrue(value) ? 1 : 2);
        } else {
            writer.writeByte(1);
            value.encodeTo(writer);
        }
    }

    @Override
    public int byteLength() {
        if (value == null || type.isBoolMode()) {
            return 1;
        }
        return 1 + value.byteLength();
    }

    @Override
    public boolean isEmpty() {
        return value == null;
    }

    @Override
    public JsonNode toHuman(final boolean extended) {
        return value == null ? Json.NODES.nullNode() : value.toHuman(extended);
    }

    @Override
    public JsonNode toJson() {
        if (value == null) {
            return Json.NODES.nullNode();
        }
        final JsonNode json = value.toJson();
        return type.wrapsJson() ? Json.NODES.arrayNode().add(json) : json;
    }
}
