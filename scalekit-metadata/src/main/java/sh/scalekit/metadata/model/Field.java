// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata.model;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A field of a composite type or enum variant.
 *
 * @param name     the field name, {@code null} for tuple-like fields
 * @param type     the portable type id of the field
 * @param typeName the type name as written in the source, if recorded
 * @param docs     documentation lines
 */
public record Field(@Nullable String name, int type, @Nullable String typeName, List<String> docs) {

    public Field {
        docs = List.copyOf(Objects.requireNonNull(docs, "docs"));
    }

    public Field(final @Nullable String name, final int type) {
        this(name, type, null, List.of());
    }

    public boolean isNamed() {
        return name != null;
    }
}
