// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.error.ScaleDecodingException;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.ScaleReader;

/**
 * One-byte boolean: {@code 0x00} false, {@code 0x01} true.
 */
public final class BoolType extends AbstractCodecType<Bool> {

    private final Bool falseValue = new Bool(this, false);
    private final Bool trueValue = new Bool(this, true);

    public BoolType(final TypeRegistry registry) {
        super(registry, "bool", Bool.class);
    }

    public Bool of(final boolean value) {
        return value ? trueValue : falseValue;
    }

    @Override
    protected Bool decodeValue(final ScaleReader reader) {
        final int offset = reader.position();
        final int b = reader.readUnsignedByte();
        if (b > 1) {
            throw ScaleDecodingException.at(offset, "bool: invalid byte 0x" + Integer.toHexString(b));
        }
        return of(b == 1);
    }

    @Override
    protected Bool fromValue(final Object value) {
        if (value instanceof Boolean b) {
            return of(b);
        }
        if (value instanceof Number n) {
            final long l = n.longValue();
            if (l == 0 || l == 1) {
                return of(l == 1);
            }
        }
        if (value instanceof String s) {
            if ("true".equalsIgnoreCase(s)) {
                return trueValue;
            }
            if ("false".equalsIgnoreCase(s)) {
                return falseValue;
            }
        }
        throw incompatible(value);
    }

    @Override
    protected Bool defaultValue() {
        return falseValue;
    }
}
