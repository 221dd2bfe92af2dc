// file: core/src/main/java/io/threadtree/core/WorkerSpawnException.java
package io.threadtree.core;

/**
 * The scheduler refused to create or start the worker bound to a node,
 * or the worker never reported readiness.
 */
public final class WorkerSpawnException extends WorkerTreeException {

    public WorkerSpawnException(Node node, String message) {
        super(node, message);
    }

    public WorkerSpawnException(Node node, String message, Throwable cause) {
        super(node, message, cause);
    }
}
