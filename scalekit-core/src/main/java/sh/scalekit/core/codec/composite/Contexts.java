// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.CodecType;
import sh.scalekit.core.error.ScaleException;
import sh.scalekit.primitives.ScaleReader;

/**
 * Child decoding and construction with error path context.
 */
final class Contexts {

    private Contexts() {
        // Utility class
    }

    static Codec decode(final CodecType<?> type, final ScaleReader reader, final Supplier<String> context) {
        try {
            return type.decode(reader);
        } catch (ScaleException e) {
            throw e.withContext(context.get());
        }
    }

    static Codec create(final CodecType<?> type, final @Nullable Object input, final Supplier<String> context) {
        try {
            return type.create(input);
        } catch (ScaleException e) {
            throw e.withContext(context.get());
        }
    }

    /**
     * Views list-like inputs ({@link Collection}, {@code Object[]}) as a list, or
     * returns {@code null}.
     */
    static @Nullable List<?> asList(final Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return null;
    }
}
