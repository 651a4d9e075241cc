// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata.model;

import java.util.List;
import java.util.Objects;

import sh.scalekit.primitives.Hex;

/**
 * A pallet constant with its SCALE-encoded value.
 */
public record ConstantMetadata(String name, int type, byte[] value, List<String> docs) {

    public ConstantMetadata {
        Objects.requireNonNull(name, "name");
        value = value.clone();
        docs = List.copyOf(docs);
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    @Override
    public String toString() {
        return "ConstantMetadata[name=" + name + ", type=" + type + ", value=" + Hex.encode(value) + "]";
    }
}
