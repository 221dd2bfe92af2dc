// file: runtime/src/main/java/io/threadtree/runtime/ShutdownCoordinator.java
package io.threadtree.runtime;

import io.threadtree.core.Node;
import io.threadtree.core.NodeState;
import io.threadtree.core.NodeStore;
import io.threadtree.core.WorkerJoinTimeoutException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stops every worker and reclaims every node, bottom up.
 * <p>
 * Post-order: a node's children are fully torn down before the node itself is
 * stopped, joined and freed. BUILDING nodes have no worker and are freed directly.
 * <p>
 * A join timeout is recorded and teardown carries on with the remaining
 * subtrees. The node that timed out stays allocated, and so do its ancestors:
 * they cannot be stopped while a child may still be running.
 */
public final class ShutdownCoordinator {
    private static final Logger log = Logger.getLogger(ShutdownCoordinator.class.getName());

    private final NodeStore store;
    private final WorkerManager workers;

    public ShutdownCoordinator(NodeStore store, WorkerManager workers) {
        this.store = Objects.requireNonNull(store, "store");
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    public ShutdownReport shutdown(Node root) {
        if (root == null) {
            return ShutdownReport.empty();
        }
        var run = new Teardown();
        run.teardown(root);

        var report = new ShutdownReport(run.freed, run.timeouts, run.stranded);
        if (report.clean()) {
            log.log(Level.INFO, "tree torn down: {0} nodes freed", report.freed());
        } else {
            log.log(Level.WARNING, "tree torn down with {0} timeouts; {1} nodes freed, {2} stranded",
                    new Object[]{report.timeouts().size(), report.freed(), report.stranded().size()});
        }
        return report;
    }

    private final class Teardown {
        int freed;
        final List<WorkerJoinTimeoutException> timeouts = new ArrayList<>();
        final List<Node> stranded = new ArrayList<>();

        /**
         * @return true if the node was reclaimed
         */
        boolean teardown(Node node) {
            if (node.isFreed()) {
                return true;
            }

            boolean childrenFreed = true;
            for (Node child : node.children()) {
                childrenFreed &= teardown(child);
            }
            if (!childrenFreed) {
                stranded.add(node);
                return false;
            }

            if (node.state() != NodeState.BUILDING) {
                workers.requestStop(node);
                try {
                    workers.join(node);
                } catch (WorkerJoinTimeoutException e) {
                    log.log(Level.WARNING, e.getMessage());
                    timeouts.add(e);
                    stranded.add(node);
                    return false;
                }
            }

            store.detachAndFree(node);
            freed++;
            return true;
        }
    }
}
