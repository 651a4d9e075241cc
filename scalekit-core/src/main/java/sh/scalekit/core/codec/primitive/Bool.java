// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import sh.scalekit.core.codec.AbstractCodec;
import sh.scalekit.core.codec.Json;
import sh.scalekit.primitives.ScaleWriter;

public final class Bool extends AbstractCodec {

    private final BoolType type;
    private final boolean value;

    Bool(final BoolType type, final boolean value) {
        this.type = type;
        this.value = value;
    }

    @Override
    public BoolType type() {
        return type;
    }

    public boolean value() {
        return value;
    }

    @Override
    public void encodeTo(final ScaleWriter writer) {
        writer.writeByte(value ? 1 : 0);
    }

    @Override
    public int byteLength() {
        return 1;
    }

    @Override
    public boolean isEmpty() {
        return !value;
    }

    @Override
    public boolean eq(final @Nullable Object other) {
        if (other instanceof Boolean b) {
            return value == b;
        }
        if (other instanceof Bool b) {
            return value == b.value;
        }
        return super.eq(other);
    }

    @Override
    public JsonNode toHuman(final boolean extended) {
        return toJson();
    }

    @Override
    public JsonNode toJson() {
        return Json.NODES.booleanNode(value);
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
