// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata.model;

import java.util.List;
import java.util.Objects;

/**
 * The shape of a portable type. Child types are referenced by id.
 *
 * @since 0.1.0
 */
public sealed interface TypeDefinition {

    /** Named or unnamed fields encoded back to back. */
    record Composite(List<Field> fields) implements TypeDefinition {
        public Composite {
            fields = List.copyOf(fields);
        }
    }

    /** A tagged union. */
    record Variant(List<VariantDefinition> variants) implements TypeDefinition {
        public Variant {
            variants = List.copyOf(variants);
        }
    }

    /** A length-prefixed sequence. */
    record Sequence(int type) implements TypeDefinition {
    }

    /** A fixed-length array. */
    record Array(int length, int type) implements TypeDefinition {
    }

    record Tuple(List<Integer> types) implements TypeDefinition {
        public Tuple {
            types = List.copyOf(types);
        }
    }

    record Primitive(PrimitiveKind kind) implements TypeDefinition {
        public Primitive {
            Objects.requireNonNull(kind, "kind");
        }
    }

    /** A compact-encoded wrapper around an unsigned integer type. */
    record Compact(int type) implements TypeDefinition {
    }

    record BitSequence(int bitStoreType, int bitOrderType) implements TypeDefinition {
    }

    /**
     * A type known only by its textual name, as carried by legacy metadata.
     */
    record Historic(String typeName) implements TypeDefinition {
        public Historic {
            Objects.requireNonNull(typeName, "typeName");
        }
    }
}
