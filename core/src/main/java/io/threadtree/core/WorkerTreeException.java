// file: core/src/main/java/io/threadtree/core/WorkerTreeException.java
package io.threadtree.core;

/**
 * Base type for recoverable failures while building or tearing down a worker tree.
 * <p>
 * Precondition violations are not reported through this hierarchy; they surface
 * as IllegalStateException / IllegalArgumentException and are never retried.
 */
public class WorkerTreeException extends RuntimeException {

    private final transient Node node;

    public WorkerTreeException(Node node, String message) {
        super(message);
        this.node = node;
    }

    public WorkerTreeException(Node node, String message, Throwable cause) {
        super(message, cause);
        this.node = node;
    }

    /** Node the failure relates to, or null when it happened before allocation. */
    public Node node() {
        return node;
    }
}
