// file: runtime/src/main/java/io/threadtree/runtime/ShutdownReport.java
package io.threadtree.runtime;

import io.threadtree.core.Node;
import io.threadtree.core.WorkerJoinTimeoutException;

import java.util.List;

/**
 * Outcome of a teardown.
 *
 * @param freed    nodes reclaimed
 * @param timeouts workers that did not exit in time
 * @param stranded nodes left allocated: timed-out nodes and their ancestors
 */
public record ShutdownReport(
        int freed,
        List<WorkerJoinTimeoutException> timeouts,
        List<Node> stranded
) {
    public ShutdownReport {
        timeouts = List.copyOf(timeouts);
        stranded = List.copyOf(stranded);
    }

    public static ShutdownReport empty() {
        return new ShutdownReport(0, List.of(), List.of());
    }

    /** True when every node was reclaimed. */
    public boolean clean() {
        return timeouts.isEmpty() && stranded.isEmpty();
    }
}
