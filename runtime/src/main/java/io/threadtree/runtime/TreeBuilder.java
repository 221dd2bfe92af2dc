// file: runtime/src/main/java/io/threadtree/runtime/TreeBuilder.java
package io.threadtree.runtime;

import io.threadtree.core.LineSink;
import io.threadtree.core.Node;
import io.threadtree.core.NodeAllocationException;
import io.threadtree.core.NodeStore;
import io.threadtree.core.WorkerTreeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a binary tree of running workers, depth first.
 * <p>
 * For each parent, children are created strictly one at a time:
 *  createNode -> spawn (blocks until RUNNING) -> log -> recurse.
 * So the creation log is a stable pre-order and, when build() returns, every
 * node in the tree is running.
 * <p>
 * Failure policy: an allocation or spawn failure aborts only the branch being
 * built. A node that was allocated but never spawned is freed on the spot, the
 * failure is recorded and construction moves on to the next sibling.
 */
public final class TreeBuilder {
    private static final Logger log = Logger.getLogger(TreeBuilder.class.getName());

    private final NodeStore store;
    private final WorkerManager workers;
    private final LineSink sink;

    public TreeBuilder(NodeStore store, WorkerManager workers, LineSink sink) {
        this.store = Objects.requireNonNull(store, "store");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public BuildResult build(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got: " + maxDepth);
        }

        List<WorkerTreeException> failures = new ArrayList<>();
        Node root = startNode(null, 0, 0, failures);
        if (root == null) {
            return new BuildResult(null, maxDepth, 0, failures);
        }

        int count = 1 + build(root, 1, maxDepth, failures);
        if (!failures.isEmpty()) {
            log.log(Level.WARNING, "tree of depth {0} built partially: {1} nodes, {2} failed branches",
                    new Object[]{maxDepth, count, failures.size()});
        }
        return new BuildResult(root, maxDepth, count, failures);
    }

    /**
     * @return number of nodes added below parent
     */
    private int build(Node parent, int level, int maxDepth, List<WorkerTreeException> failures) {
        if (level > maxDepth) {
            return 0;
        }
        int added = 0;
        for (int index = 0; index < Node.MAX_CHILDREN; index++) {
            Node child = startNode(parent, level, index, failures);
            if (child != null) {
                added += 1 + build(child, level + 1, maxDepth, failures);
            }
        }
        return added;
    }

    /**
     * Allocate, spawn and log a single node.
     *
     * @return the running node, or null if this branch failed
     */
    private Node startNode(Node parent, int level, int index, List<WorkerTreeException> failures) {
        Node node;
        try {
            node = store.createNode(parent, level, index);
        } catch (NodeAllocationException e) {
            log.log(Level.WARNING, "allocation failed for " + Node.nameFor(level, index), e);
            failures.add(e);
            return null;
        }

        WorkerHandle handle;
        try {
            handle = workers.spawn(node);
        } catch (WorkerTreeException e) {
            log.log(Level.WARNING, "spawn failed for " + node.name(), e);
            store.detachAndFree(node);
            failures.add(e);
            return null;
        }

        sink.line(creationLine(handle.workerId(), parent, level));
        return node;
    }

    static String creationLine(long id, Node parent, int level) {
        String parentId = parent == null ? "none" : String.valueOf(parent.id());
        return "Created thread: PID=%d, Parent PID=%s, Level=%d".formatted(id, parentId, level);
    }
}
