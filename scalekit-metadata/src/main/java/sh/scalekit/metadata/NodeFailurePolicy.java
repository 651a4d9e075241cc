// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata;

/**
 * What {@link PortableTypeRegistrar} does when a metadata type node cannot be
 * converted or resolved.
 */
public enum NodeFailurePolicy {

    /**
     * Log a warning per failed node and register everything else. Nodes that depend
     * on a failed node fail as well.
     */
    WARN_AND_SKIP,

    /**
     * Throw on the first failed resolution pass; the target registry is left
     * untouched.
     */
    FAIL
}
