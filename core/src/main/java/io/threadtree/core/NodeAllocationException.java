// file: core/src/main/java/io/threadtree/core/NodeAllocationException.java
package io.threadtree.core;

/**
 * Raised when the node allocator is exhausted: either the configured node budget
 * is used up or the JVM could not allocate the node object.
 */
public final class NodeAllocationException extends WorkerTreeException {

    public NodeAllocationException(String message) {
        super(null, message);
    }

    public NodeAllocationException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
