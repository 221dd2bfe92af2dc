// file: host/src/main/java/io/threadtree/host/WorkerTreeHost.java
package io.threadtree.host;

import io.threadtree.core.LineSink;
import io.threadtree.core.NodeStore;
import io.threadtree.core.TreePrinter;
import io.threadtree.core.WorkerTreeException;
import io.threadtree.runtime.BuildResult;
import io.threadtree.runtime.ShutdownReport;
import io.threadtree.runtime.ThreadWorkerManager;
import io.threadtree.runtime.TreeBuilder;
import io.threadtree.runtime.WorkerManager;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Start/stop entry points for the host environment.
 * <p>
 * Responsibilities:
 *  - start(depth): build the tree, print it once construction is done, keep it as the session.
 *  - stop(): tear the session down and release it.
 * <p>
 * At most one session is held at a time. Both methods are synchronized so a stop
 * issued from a shutdown hook cannot interleave with a start in progress.
 */
public final class WorkerTreeHost {
    private static final Logger log = Logger.getLogger(WorkerTreeHost.class.getName());

    private final HostConfig config;
    private final LineSink sink;
    private final Supplier<WorkerManager> workerManagers;

    private Session session;

    public WorkerTreeHost(HostConfig config) {
        this(config, LineSink.logging(log));
    }

    public WorkerTreeHost(HostConfig config, LineSink sink) {
        this(config, sink, () -> new ThreadWorkerManager(
                Duration.ofMillis(config.readyTimeoutMillis()),
                Duration.ofMillis(config.joinTimeoutMillis())
        ));
    }

    /**
     * @param workerManagers creates the worker manager of each new session
     */
    public WorkerTreeHost(HostConfig config, LineSink sink, Supplier<WorkerManager> workerManagers) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.workerManagers = Objects.requireNonNull(workerManagers, "workerManagers");
    }

    /** Start with the configured depth. */
    public StartResult start() {
        return start(config.maxDepth());
    }

    /**
     * Build and print a tree of the given depth.
     *
     * @throws IllegalStateException    if a session is already running
     * @throws IllegalArgumentException if the depth is negative or above the configured limit
     */
    public synchronized StartResult start(int maxDepth) {
        if (session != null) {
            throw new IllegalStateException("a tree of depth " + session.maxDepth() + " is already running");
        }
        if (maxDepth < 0 || maxDepth > config.depthLimit()) {
            throw new IllegalArgumentException(
                    "maxDepth must be in [0, %d], got: %d".formatted(config.depthLimit(), maxDepth)
            );
        }

        NodeStore store = new NodeStore(config.maxNodes());
        WorkerManager workers = workerManagers.get();
        BuildResult built = new TreeBuilder(store, workers, sink).build(maxDepth);
        StartResult result = StartResult.of(built);

        if (!built.hasTree()) {
            log.log(Level.WARNING, "start failed: no tree of depth {0} could be built", maxDepth);
            return result;
        }

        TreePrinter.print(built.root(), sink);
        session = new Session(maxDepth, built.root(), store, workers);

        if (result.succeeded()) {
            log.log(Level.INFO, "started tree of depth {0} with {1} workers",
                    new Object[]{maxDepth, result.nodeCount()});
        } else {
            for (WorkerTreeException failure : result.failures()) {
                log.log(Level.WARNING, "branch failed: {0}", failure.getMessage());
            }
        }
        return result;
    }

    /**
     * Tear down the current session. Without a session (never started, or already
     * stopped) this is a no-op that returns an empty report.
     */
    public synchronized ShutdownReport stop() {
        if (session == null) {
            return ShutdownReport.empty();
        }
        Session current = session;
        session = null;
        return current.shutdown();
    }

    /** Current session, or null if none is running. */
    public synchronized Session session() {
        return session;
    }
}
