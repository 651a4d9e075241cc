// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import sh.scalekit.core.error.TypeRegistryException;

/**
 * The portable type graph of a metadata blob, keyed by type id.
 *
 * <p>Ids may be sparse and in any order, and nodes may refer to each other
 * cyclically. The graph keeps the order in which nodes were decoded.
 */
public final class PortableTypeGraph {

    private final Map<Integer, PortableType> types;

    public PortableTypeGraph(final Collection<PortableType> types) {
        final Map<Integer, PortableType> byId = new LinkedHashMap<>();
        for (PortableType type : types) {
            if (byId.putIfAbsent(type.id(), type) != null) {
                throw new IllegalArgumentException("Duplicate portable type id " + type.id());
            }
        }
        this.types = Collections.unmodifiableMap(byId);
    }

    public Optional<PortableType> get(final int id) {
        return Optional.ofNullable(types.get(id));
    }

    /**
     * Returns the node with the given id.
     *
     * @throws TypeRegistryException if no node has that id
     */
    public PortableType require(final int id) {
        final PortableType type = types.get(id);
        if (type == null) {
            throw new TypeRegistryException("Dangling portable type id " + id);
        }
        return type;
    }

    public Set<Integer> ids() {
        return types.keySet();
    }

    public Collection<PortableType> types() {
        return types.values();
    }

    public int size() {
        return types.size();
    }

    @Override
    public String toString() {
        return "PortableTypeGraph[" + types.size() + " type(s)]";
    }
}
