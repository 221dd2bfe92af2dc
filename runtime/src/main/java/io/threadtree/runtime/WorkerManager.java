// file: runtime/src/main/java/io/threadtree/runtime/WorkerManager.java
package io.threadtree.runtime;

import io.threadtree.core.Node;

/**
 * Starts and stops the concurrent worker bound to a node.
 *
 * ThreadWorkerManager runs one platform thread per node; tests substitute
 * instrumented fakes to observe ordering.
 *
 * All methods are synchronous except requestStop.
 */
public interface WorkerManager {

    /**
     * Start the worker for a BUILDING node and block until it has published its id
     * and moved the node to RUNNING.
     *
     * @throws io.threadtree.core.WorkerSpawnException if the worker could not be started;
     *         the node is left in BUILDING and is not tracked
     */
    WorkerHandle spawn(Node node);

    /**
     * Mark the node STOP_REQUESTED and signal its worker. Does not wait.
     * Repeated calls are no-ops.
     */
    void requestStop(Node node);

    /**
     * Block until the worker bound to the node has exited.
     * Returns immediately if it already exited or was never spawned.
     *
     * @throws io.threadtree.core.WorkerJoinTimeoutException if the worker is still alive after the bounded wait
     */
    void join(Node node);

    /** Number of workers started and not yet joined. */
    int runningCount();
}
