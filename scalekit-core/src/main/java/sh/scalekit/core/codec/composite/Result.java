// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import com.fasterxml.jackson.databind.JsonNode;

import sh.scalekit.core.codec.AbstractCodec;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.primitives.ScaleWriter;

/**
 * A {@code Result} value, either {@code Ok(value)} or {@code Err(error)}.
 */
public final class Result extends AbstractCodec {

    private final ResultType type;
    private final EnumValue value;

    Result(final ResultType type, final EnumValue value) {
        this.type = type;
        this.value = value;
    }

    @Override
    public ResultType type() {
        return type;
    }

    public boolean isOk() {
        return value.index() == 0;
    }

    public boolean isErr() {
        return value.index() == 1;
    }

    /**
     * Returns the {@code Ok} payload.
     *
     * @throws IllegalStateException if this is an error
     */
    public Codec ok() {
        if (!isOk()) {
            throw new IllegalStateException("Result is Err: " + value.value());
        }
        return value.value();
    }

    /**
     * Returns the {@code Err} payload.
     *
     * @throws IllegalStateException if this is a success
     */
    public Codec err() {
        if (!isErr()) {
            throw new IllegalStateException("Result is Ok: " + value.value());
        }
        return value.value();
    }

    EnumValue asEnum() {
        return value;
    }

    @Override
    public void encodeTo(final ScaleWriter writer) {
        value.encodeTo(writer);
    }

    @Override
    public int byteLength() {
        return value.byteLength();
    }

    @Override
    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public JsonNode toHuman(final boolean extended) {
        return value.toHuman(extended);
    }

    @Override
    public JsonNode toJson() {
        return value.toJson();
    }
}
