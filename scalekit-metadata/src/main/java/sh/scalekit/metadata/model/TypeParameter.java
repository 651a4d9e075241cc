// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A generic parameter of a portable type, e.g. {@code T} of {@code Option<T>}.
 *
 * @param name the parameter name
 * @param type the concrete type id, {@code null} when the parameter is erased
 */
public record TypeParameter(String name, @Nullable Integer type) {

    public TypeParameter {
        Objects.requireNonNull(name, "name");
    }
}
