// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata;

import java.util.ArrayList;
import java.util.List;

import org.jspecify.annotations.Nullable;

import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.composite.EnumValue;
import sh.scalekit.core.codec.composite.Option;
import sh.scalekit.core.codec.composite.Sequence;
import sh.scalekit.core.codec.composite.Struct;
import sh.scalekit.core.codec.primitive.Bytes;
import sh.scalekit.core.codec.primitive.CompactInt;
import sh.scalekit.core.codec.primitive.Int;
import sh.scalekit.core.codec.primitive.Text;

/**
 * Typed field access on decoded metadata structs.
 */
final class Structs {

    private Structs() {
        // Utility class
    }

    static String text(final Struct struct, final String field) {
        return struct.getAs(field, Text.class).value();
    }

    static @Nullable String optionalText(final Struct struct, final String field) {
        final Codec value = optional(struct, field);
        return value == null ? null : ((Text) value).value();
    }

    static List<String> texts(final Struct struct, final String field) {
        final List<String> out = new ArrayList<>();
        for (Codec element : sequence(struct, field)) {
            out.add(((Text) element).value());
        }
        return out;
    }

    /**
     * Reads a type id, which is compact encoded.
     */
    static int id(final Struct struct, final String field) {
        return id(struct.get(field));
    }

    static int id(final @Nullable Codec value) {
        if (value instanceof CompactInt compact) {
            return compact.value().intValueExact();
        }
        throw new IllegalArgumentException("Expected a compact type id, got " + value);
    }

    static @Nullable Integer optionalId(final Struct struct, final String field) {
        final Codec value = optional(struct, field);
        return value == null ? null : id(value);
    }

    static List<Integer> ids(final Sequence sequence) {
        final List<Integer> out = new ArrayList<>(sequence.size());
        for (Codec element : sequence) {
            out.add(id(element));
        }
        return out;
    }

    static int integer(final Struct struct, final String field) {
        return struct.getAs(field, Int.class).intValueExact();
    }

    static byte[] bytes(final Struct struct, final String field) {
        return struct.getAs(field, Bytes.class).bytes();
    }

    static EnumValue enumValue(final Struct struct, final String field) {
        return struct.getAs(field, EnumValue.class);
    }

    static Sequence sequence(final Struct struct, final String field) {
        return struct.getAs(field, Sequence.class);
    }

    static List<Struct> structs(final Struct struct, final String field) {
        return structs(sequence(struct, field));
    }

    static List<Struct> structs(final Sequence sequence) {
        final List<Struct> out = new ArrayList<>(sequence.size());
        for (Codec element : sequence) {
            out.add((Struct) element);
        }
        return out;
    }

    static @Nullable Codec optional(final Struct struct, final String field) {
        return struct.getAs(field, Option.class).value().orElse(null);
    }
}
