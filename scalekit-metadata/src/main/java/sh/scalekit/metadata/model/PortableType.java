// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata.model;

import java.util.List;
import java.util.Objects;

/**
 * One node of the portable type graph.
 *
 * @param id         the type id other nodes refer to
 * @param path       the source path, e.g. {@code [pallet_balances, AccountData]}; empty for
 *                   anonymous types
 * @param params     generic parameters
 * @param definition the type's shape
 * @param docs       documentation lines
 */
public record PortableType(int id, List<String> path, List<TypeParameter> params, TypeDefinition definition,
        List<String> docs) {

    public PortableType {
        path = List.copyOf(path);
        params = List.copyOf(params);
        Objects.requireNonNull(definition, "definition");
        docs = List.copyOf(docs);
    }

    public PortableType(final int id, final TypeDefinition definition) {
        this(id, List.of(), List.of(), definition, List.of());
    }

    /**
     * Returns the {@code ::}-joined path, or an empty string for anonymous types.
     */
    public String pathName() {
        return String.join("::", path);
    }

    /**
     * Returns the last path segment, or an empty string for anonymous types.
     */
    public String simpleName() {
        return path.isEmpty() ? "" : path.get(path.size() - 1);
    }
}
