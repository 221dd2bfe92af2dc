// file: runtime/src/main/java/io/threadtree/runtime/BuildResult.java
package io.threadtree.runtime;

import io.threadtree.core.Node;
import io.threadtree.core.WorkerTreeException;

import java.util.List;

/**
 * Outcome of one tree construction.
 *
 * @param root      root of the built tree, or null if the root itself could not be built
 * @param maxDepth  requested depth
 * @param nodeCount nodes that are linked and running
 * @param failures  branch failures in the order they happened; empty for a complete build
 */
public record BuildResult(
        Node root,
        int maxDepth,
        int nodeCount,
        List<WorkerTreeException> failures
) {
    public BuildResult {
        failures = List.copyOf(failures);
    }

    /** Node count of a full binary tree of the given depth: 2^(d+1) - 1. */
    public static int fullTreeSize(int maxDepth) {
        return (1 << (maxDepth + 1)) - 1;
    }

    public boolean complete() {
        return root != null && failures.isEmpty();
    }

    public boolean hasTree() {
        return root != null;
    }
}
