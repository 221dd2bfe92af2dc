// file: core/src/main/java/io/threadtree/core/WorkerJoinTimeoutException.java
package io.threadtree.core;

import java.time.Duration;

/**
 * A worker did not exit within the bounded join wait.
 */
public final class WorkerJoinTimeoutException extends WorkerTreeException {

    private final Duration waited;

    public WorkerJoinTimeoutException(Node node, Duration waited) {
        super(node, "worker %s did not exit within %d ms".formatted(node.name(), waited.toMillis()));
        this.waited = waited;
    }

    public Duration waited() {
        return waited;
    }
}
