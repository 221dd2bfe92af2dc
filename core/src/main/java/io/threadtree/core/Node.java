// file: core/src/main/java/io/threadtree/core/Node.java
package io.threadtree.core;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One position in the worker tree.
 * <p>
 * Structure:
 *  - name, level and sibling index are fixed at allocation time.
 *  - parent is a non-owning back reference (null for the root).
 *  - children are owned, ordered by index and capped at {@link #MAX_CHILDREN}.
 * <p>
 * Concurrency:
 *  - children are only mutated by NodeStore while holding this node's monitor;
 *    readers get a copy.
 *  - state moves forward only, via compare-and-set.
 *  - id is written by the worker thread before it moves the node to RUNNING,
 *    so any thread that observes RUNNING also observes the id.
 */
public final class Node {

    /** Binary branching factor. */
    public static final int MAX_CHILDREN = 2;

    private final String name;
    private final int level;
    private final int index;
    private final Node parent;
    private final List<Node> children = new ArrayList<>(MAX_CHILDREN);
    private final AtomicReference<NodeState> state = new AtomicReference<>(NodeState.BUILDING);

    private volatile Long id;
    private volatile boolean freed;

    Node(Node parent, int level, int index) {
        this.parent = parent;
        this.level = level;
        this.index = index;
        this.name = nameFor(level, index);
    }

    /**
     * Positional name: "root" for level 0, otherwise thread_&lt;level&gt;_&lt;index&gt;.
     */
    public static String nameFor(int level, int index) {
        return level == 0 ? "root" : "thread_" + level + "_" + index;
    }

    public String name() {
        return name;
    }

    public int level() {
        return level;
    }

    public int index() {
        return index;
    }

    /** Parent node, or null for the root. */
    public Node parent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** Snapshot of the children in index order. */
    public List<Node> children() {
        synchronized (this) {
            return List.copyOf(children);
        }
    }

    public NodeState state() {
        return state.get();
    }

    /**
     * Scheduler-assigned id, or null when the node is not RUNNING / STOP_REQUESTED.
     */
    public Long id() {
        return state.get().hasId() ? id : null;
    }

    public boolean isFreed() {
        return freed;
    }

    // ---------- lifecycle transitions ----------

    /**
     * Publish the worker id and move BUILDING -> RUNNING.
     * Called from the worker thread as its readiness handshake.
     */
    public void markRunning(long workerId) {
        this.id = workerId;
        transition(NodeState.BUILDING, NodeState.RUNNING);
    }

    /**
     * Move RUNNING -> STOP_REQUESTED.
     *
     * @return true if this call made the transition, false if a stop was already requested or done
     */
    public boolean markStopRequested() {
        if (state.compareAndSet(NodeState.RUNNING, NodeState.STOP_REQUESTED)) {
            return true;
        }
        NodeState current = state.get();
        if (current == NodeState.STOP_REQUESTED || current == NodeState.STOPPED) {
            return false;
        }
        throw illegalTransition(current, NodeState.STOP_REQUESTED);
    }

    /** Move STOP_REQUESTED -> STOPPED. Called by the worker on its way out. */
    public void markStopped() {
        transition(NodeState.STOP_REQUESTED, NodeState.STOPPED);
        this.id = null;
    }

    private void transition(NodeState from, NodeState to) {
        if (!state.compareAndSet(from, to)) {
            throw illegalTransition(state.get(), to);
        }
    }

    private IllegalStateException illegalTransition(NodeState current, NodeState target) {
        return new IllegalStateException(
                "node %s cannot move from %s to %s".formatted(name, current, target)
        );
    }

    // ---------- structural links (NodeStore only) ----------

    void attachChild(Node child) {
        synchronized (this) {
            if (freed) {
                throw new IllegalStateException("parent " + name + " is already freed");
            }
            if (children.size() >= MAX_CHILDREN) {
                throw new IllegalStateException("node " + name + " already has " + MAX_CHILDREN + " children");
            }
            for (Node c : children) {
                if (c.index == child.index) {
                    throw new IllegalStateException(
                            "node %s already has a child at index %d".formatted(name, child.index)
                    );
                }
            }
            children.add(child);
            children.sort((a, b) -> Integer.compare(a.index, b.index));
        }
    }

    void detachChild(Node child) {
        synchronized (this) {
            if (!children.remove(child)) {
                throw new IllegalStateException(
                        "node %s is not a child of %s".formatted(child.name, name)
                );
            }
        }
    }

    boolean hasChildren() {
        synchronized (this) {
            return !children.isEmpty();
        }
    }

    void markFreed() {
        this.freed = true;
    }

    @Override
    public String toString() {
        return name + "(" + (id() == null ? state() : id()) + ")";
    }
}
