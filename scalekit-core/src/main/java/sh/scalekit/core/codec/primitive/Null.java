// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import sh.scalekit.core.codec.AbstractCodec;
import sh.scalekit.core.codec.Json;
import sh.scalekit.primitives.ScaleWriter;

public final class Null extends AbstractCodec {

    private static final byte[] EMPTY = new byte[0];

    private final NullType type;

    Null(final NullType type) {
        this.type = type;
    }

    @Override
    public NullType type() {
        return type;
    }

    @Override
    public void encodeTo(final ScaleWriter writer) {
        // zero bytes
    }

    @Override
    public byte[] encode() {
        return EMPTY;
    }

    @Override
    public int byteLength() {
        return 0;
    }

    @Override
    public boolean isEmpty() {
        return true;
    }

    @Override
    public boolean eq(final @Nullable Object other) {
        return other == null || other instanceof Null;
    }

    @Override
    public JsonNode toHuman(final boolean extended) {
        return Json.NODES.nullNode();
    }

    @Override
    public JsonNode toJson() {
        return Json.NODES.nullNode();
    }
}
