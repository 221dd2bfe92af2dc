// file: core/src/main/java/io/threadtree/core/NodeStore.java
package io.threadtree.core;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the node objects of one tree and their parent/child links.
 * <p>
 * Responsibilities:
 *  - Allocate nodes against a fixed node budget (the "allocator").
 *  - Link a new node into its parent atomically, under the parent's monitor.
 *  - Detach and release nodes once their worker has exited.
 * <p>
 * Precondition violations (freeing a live node, freeing a node that still has
 * children, double free) throw IllegalStateException. Callers must not catch
 * these: they indicate a broken teardown order, not a runtime condition.
 */
public final class NodeStore {

    private final int capacity;
    private final AtomicInteger allocated = new AtomicInteger();
    private final Set<Node> live = ConcurrentHashMap.newKeySet();

    /**
     * @param capacity maximum number of nodes that may be alive at once
     */
    public NodeStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Allocate a node in BUILDING state and, for non-root nodes, append it to
     * {@code parent.children}.
     *
     * @param parent parent node, or null to allocate a root
     * @param level  depth from root; must equal parent.level + 1 (0 for a root)
     * @param index  sibling index, 0 or 1
     * @throws NodeAllocationException if the node budget is exhausted or the JVM is out of memory;
     *                                 nothing is linked in that case
     */
    public Node createNode(Node parent, int level, int index) {
        if (index < 0 || index >= Node.MAX_CHILDREN) {
            throw new IllegalArgumentException("index must be 0 or 1, got: " + index);
        }
        if (parent == null && level != 0) {
            throw new IllegalArgumentException("root must have level 0, got: " + level);
        }
        if (parent != null && level != parent.level() + 1) {
            throw new IllegalArgumentException(
                    "level %d does not follow parent %s at level %d".formatted(level, parent.name(), parent.level())
            );
        }

        reserve(level, index);
        Node node;
        try {
            node = new Node(parent, level, index);
        } catch (OutOfMemoryError oom) {
            allocated.decrementAndGet();
            throw new NodeAllocationException("out of memory allocating " + Node.nameFor(level, index), oom);
        }

        if (parent != null) {
            try {
                parent.attachChild(node);
            } catch (RuntimeException e) {
                allocated.decrementAndGet();
                throw e;
            }
        }
        live.add(node);
        return node;
    }

    /**
     * Remove the node from its parent's children (no-op for the root) and release it.
     * <p>
     * Precondition: the node is STOPPED (or BUILDING, i.e. its worker was never
     * started), has no children and has not been freed already.
     */
    public void detachAndFree(Node node) {
        Objects.requireNonNull(node, "node");
        NodeState state = node.state();
        if (state != NodeState.STOPPED && state != NodeState.BUILDING) {
            throw new IllegalStateException("cannot free " + node.name() + " in state " + state);
        }
        if (node.hasChildren()) {
            throw new IllegalStateException("cannot free " + node.name() + " while it still has children");
        }
        if (!live.remove(node)) {
            throw new IllegalStateException("node " + node.name() + " is not owned by this store or already freed");
        }

        Node parent = node.parent();
        if (parent != null) {
            parent.detachChild(node);
        }
        node.markFreed();
        allocated.decrementAndGet();
    }

    /** Number of allocated, not yet freed nodes. */
    public int liveCount() {
        return live.size();
    }

    public int capacity() {
        return capacity;
    }

    /** Read-only view of live nodes, unordered. */
    public Set<Node> liveNodes() {
        return Collections.unmodifiableSet(live);
    }

    private void reserve(int level, int index) {
        while (true) {
            int current = allocated.get();
            if (current >= capacity) {
                throw new NodeAllocationException(
                        "node budget of %d exhausted allocating %s".formatted(capacity, Node.nameFor(level, index))
                );
            }
            if (allocated.compareAndSet(current, current + 1)) {
                return;
            }
        }
    }
}
