// file: host/src/main/java/io/threadtree/host/StartResult.java
package io.threadtree.host;

import io.threadtree.core.Node;
import io.threadtree.core.WorkerTreeException;
import io.threadtree.runtime.BuildResult;

import java.util.List;

/**
 * Outcome of {@link WorkerTreeHost#start(int)}.
 * <p>
 * PARTIAL carries the tree that was built plus the branch failures; the tree is
 * held by the host and torn down normally on stop().
 */
public record StartResult(
        Status status,
        int maxDepth,
        Node root,
        int nodeCount,
        List<WorkerTreeException> failures
) {
    public enum Status {
        COMPLETE,
        PARTIAL,
        FAILED
    }

    public StartResult {
        failures = List.copyOf(failures);
    }

    static StartResult of(BuildResult built) {
        Status status;
        if (!built.hasTree()) {
            status = Status.FAILED;
        } else if (built.complete()) {
            status = Status.COMPLETE;
        } else {
            status = Status.PARTIAL;
        }
        return new StartResult(status, built.maxDepth(), built.root(), built.nodeCount(), built.failures());
    }

    public boolean succeeded() {
        return status == Status.COMPLETE;
    }
}
