// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata.model;

/**
 * Primitive kinds of the portable type system, in wire order.
 */
public enum PrimitiveKind {
    BOOL("bool"),
    CHAR("char"),
    STR("Text"),
    U8("u8"),
    U16("u16"),
    U32("u32"),
    U64("u64"),
    U128("u128"),
    U256("u256"),
    I8("i8"),
    I16("i16"),
    I32("i32"),
    I64("i64"),
    I128("i128"),
    I256("i256");

    private final String typeName;

    PrimitiveKind(final String typeName) {
        this.typeName = typeName;
    }

    /**
     * Returns the built-in registry name this primitive maps to.
     */
    public String typeName() {
        return typeName;
    }

    /**
     * Looks a kind up by its metadata variant name ({@code Bool}, {@code U128}, ...).
     *
     * @throws IllegalArgumentException if the name is not a primitive
     */
    public static PrimitiveKind fromVariant(final String variant) {
        for (PrimitiveKind kind : values()) {
            if (kind.name().equalsIgnoreCase(variant)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown primitive '" + variant + "'");
    }
}
