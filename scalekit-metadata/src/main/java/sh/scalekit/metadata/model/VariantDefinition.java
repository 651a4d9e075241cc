// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata.model;

import java.util.List;
import java.util.Objects;

/**
 * One variant of an enum type.
 *
 * @param name   the variant name
 * @param fields the payload fields, empty for payload-less variants
 * @param index  the discriminant
 * @param docs   documentation lines
 */
public record VariantDefinition(String name, List<Field> fields, int index, List<String> docs) {

    public VariantDefinition {
        Objects.requireNonNull(name, "name");
        fields = List.copyOf(fields);
        docs = List.copyOf(docs);
    }
}
