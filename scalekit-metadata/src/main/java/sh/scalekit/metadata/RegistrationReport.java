// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of registering a metadata type graph.
 *
 * @param registered   ids of the nodes registered as {@code Lookup<id>}, in graph order
 * @param failures     failure message by node id, for nodes that were skipped
 * @param derivedNames path-derived names registered as aliases, mapped to their node id
 */
public record RegistrationReport(List<Integer> registered, Map<Integer, String> failures,
        Map<String, Integer> derivedNames) {

    public RegistrationReport {
        registered = List.copyOf(registered);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        derivedNames = Collections.unmodifiableMap(new LinkedHashMap<>(derivedNames));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
