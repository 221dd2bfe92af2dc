// file: runtime/src/main/java/io/threadtree/runtime/WorkerHandle.java
package io.threadtree.runtime;

import io.threadtree.core.Node;

/**
 * Result of a successful spawn: the node and the id its worker published.
 */
public record WorkerHandle(Node node, long workerId, String threadName) {
}
