// file: core/src/main/java/io/threadtree/core/NodeState.java
package io.threadtree.core;

/**
 * Lifecycle of a tree position.
 * <p>
 * Legal transitions are strictly forward:
 *  BUILDING -> RUNNING -> STOP_REQUESTED -> STOPPED.
 */
public enum NodeState {
    /** Allocated and linked, worker not yet reporting readiness. */
    BUILDING,
    /** Worker is alive and has published its id. */
    RUNNING,
    /** Stop signal delivered, worker not yet exited. */
    STOP_REQUESTED,
    /** Worker has exited. */
    STOPPED;

    /** True while the node carries a scheduler-assigned id. */
    public boolean hasId() {
        return this == RUNNING || this == STOP_REQUESTED;
    }
}
