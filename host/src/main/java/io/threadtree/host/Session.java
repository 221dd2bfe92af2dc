// file: host/src/main/java/io/threadtree/host/Session.java
package io.threadtree.host;

import io.threadtree.core.Node;
import io.threadtree.core.NodeStore;
import io.threadtree.runtime.ShutdownCoordinator;
import io.threadtree.runtime.ShutdownReport;
import io.threadtree.runtime.WorkerManager;

/**
 * Everything one running tree owns: its root, the depth it was built with,
 * the node store and the worker manager. Created by start, consumed by stop.
 */
public final class Session {

    private final int maxDepth;
    private final Node root;
    private final NodeStore store;
    private final WorkerManager workers;

    Session(int maxDepth, Node root, NodeStore store, WorkerManager workers) {
        this.maxDepth = maxDepth;
        this.root = root;
        this.store = store;
        this.workers = workers;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public Node root() {
        return root;
    }

    public int liveNodes() {
        return store.liveCount();
    }

    public int runningWorkers() {
        return workers.runningCount();
    }

    ShutdownReport shutdown() {
        return new ShutdownCoordinator(store, workers).shutdown(root);
    }
}
