// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.error;

import java.util.List;

/**
 * Thrown when a type descriptor cannot be resolved against a registry.
 *
 * <p>Overwriting a registration is never an error; unknown names, malformed
 * descriptors, alias cycles and dangling metadata type ids are, and each is
 * scoped to the descriptor being resolved.
 *
 * @since 0.1.0
 */
public final class TypeRegistryException extends ScaleException {

    public TypeRegistryException(final String message) {
        super(message);
    }

    public TypeRegistryException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public static TypeRegistryException unknownType(final String name) {
        return new TypeRegistryException("Unknown type '" + name + "'");
    }

    public static TypeRegistryException aliasCycle(final List<String> chain) {
        return new TypeRegistryException("Alias cycle detected: " + String.join(" -> ", chain));
    }

    public static TypeRegistryException invalidDescriptor(final String descriptor, final String reason) {
        return new TypeRegistryException("Invalid type descriptor '" + descriptor + "': " + reason);
    }

    @Override
    public TypeRegistryException withContext(final String context) {
        return new TypeRegistryException(prefixed(context, getMessage()), this);
    }
}
