// file: runtime/src/main/java/io/threadtree/runtime/ThreadWorkerManager.java
package io.threadtree.runtime;

import io.threadtree.core.Node;
import io.threadtree.core.NodeState;
import io.threadtree.core.WorkerJoinTimeoutException;
import io.threadtree.core.WorkerSpawnException;
import io.threadtree.core.WorkerTreeException;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * WorkerManager backed by one platform thread per node.
 * <p>
 * Threads come from an injected ThreadFactory (daemon threads by default) and
 * are renamed after their node. Spawn blocks on the worker's readiness future
 * for at most readyTimeout; join waits at most joinTimeout.
 */
public final class ThreadWorkerManager implements WorkerManager {
    private static final Logger log = Logger.getLogger(ThreadWorkerManager.class.getName());

    private record Running(NodeWorker worker, Thread thread) {}

    private final ThreadFactory threadFactory;
    private final Duration readyTimeout;
    private final Duration joinTimeout;
    private final Map<Node, Running> workers = new ConcurrentHashMap<>();

    public ThreadWorkerManager(Duration readyTimeout, Duration joinTimeout) {
        this(daemonThreads(), readyTimeout, joinTimeout);
    }

    /**
     * @param threadFactory source of worker threads; returning null means the scheduler refused
     * @param readyTimeout  bound on the readiness handshake
     * @param joinTimeout   bound on waiting for a worker to exit
     */
    public ThreadWorkerManager(ThreadFactory threadFactory, Duration readyTimeout, Duration joinTimeout) {
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
        this.readyTimeout = requirePositive(readyTimeout, "readyTimeout");
        this.joinTimeout = requirePositive(joinTimeout, "joinTimeout");
    }

    public static ThreadFactory daemonThreads() {
        return r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public WorkerHandle spawn(Node node) {
        Objects.requireNonNull(node, "node");
        if (node.state() != NodeState.BUILDING) {
            throw new IllegalStateException("cannot spawn " + node.name() + " in state " + node.state());
        }

        NodeWorker worker = new NodeWorker(node);
        Thread thread;
        try {
            thread = threadFactory.newThread(worker);
        } catch (RuntimeException | OutOfMemoryError e) {
            throw new WorkerSpawnException(node, "thread factory failed for " + node.name(), e);
        }
        if (thread == null) {
            throw new WorkerSpawnException(node, "scheduler refused to create a worker for " + node.name());
        }
        thread.setName("tree-" + node.name());

        try {
            thread.start();
        } catch (OutOfMemoryError | IllegalThreadStateException e) {
            throw new WorkerSpawnException(node, "could not start worker for " + node.name(), e);
        }

        long id;
        try {
            id = worker.awaitReady(readyTimeout.toMillis());
        } catch (TimeoutException e) {
            abandon(node, worker, thread);
            throw new WorkerSpawnException(
                    node,
                    "worker for %s did not report readiness within %d ms".formatted(node.name(), readyTimeout.toMillis()),
                    e
            );
        } catch (ExecutionException e) {
            abandon(node, worker, thread);
            throw new WorkerSpawnException(node, "worker for " + node.name() + " failed during startup", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(node, worker, thread);
            throw new WorkerSpawnException(node, "interrupted while spawning " + node.name(), e);
        }

        workers.put(node, new Running(worker, thread));
        log.log(Level.FINE, "spawned {0} as {1}", new Object[]{node.name(), id});
        return new WorkerHandle(node, id, thread.getName());
    }

    @Override
    public void requestStop(Node node) {
        Objects.requireNonNull(node, "node");
        Running running = workers.get(node);
        if (running == null) {
            // never spawned, or already joined
            return;
        }
        node.markStopRequested();
        running.worker().signalStop();
    }

    @Override
    public void join(Node node) {
        Objects.requireNonNull(node, "node");
        Running running = workers.get(node);
        if (running == null) {
            return;
        }
        try {
            running.thread().join(joinTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerTreeException(node, "interrupted while joining " + node.name(), e);
        }
        if (running.thread().isAlive()) {
            throw new WorkerJoinTimeoutException(node, joinTimeout);
        }
        workers.remove(node);
    }

    @Override
    public int runningCount() {
        return workers.size();
    }

    /** Wake a worker without stopping it. */
    void nudge(Node node) {
        Running running = workers.get(node);
        if (running != null) {
            running.worker().nudge();
        }
    }

    /**
     * Tear down a worker whose spawn is being reported as failed. The node ends
     * up BUILDING (worker never got going) or STOPPED; both are freeable.
     */
    private void abandon(Node node, NodeWorker worker, Thread thread) {
        worker.signalStop();
        try {
            thread.join(joinTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.log(Level.WARNING, "abandoned worker for {0} is still alive", node.name());
        }
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + d);
        }
        return d;
    }
}
