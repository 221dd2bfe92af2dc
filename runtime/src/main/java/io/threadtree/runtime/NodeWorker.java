// file: runtime/src/main/java/io/threadtree/runtime/NodeWorker.java
package io.threadtree.runtime;

import io.threadtree.core.Node;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Body of the thread bound to one node.
 * <p>
 * Protocol:
 *  1) publish the thread id into the node and move it to RUNNING,
 *  2) complete the readiness future (the spawner is blocked on it),
 *  3) idle on a condition until the stop flag is set; spurious wakes re-check and keep idling,
 *  4) move the node to STOPPED and return.
 * <p>
 * An interrupt of the worker thread is treated as a stop signal.
 */
final class NodeWorker implements Runnable {
    private static final Logger log = Logger.getLogger(NodeWorker.class.getName());

    private final Node node;
    private final CompletableFuture<Long> ready = new CompletableFuture<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeup = lock.newCondition();

    /** Guarded by lock. */
    private boolean stopRequested;

    NodeWorker(Node node) {
        this.node = node;
    }

    @Override
    public void run() {
        if (!publishReadiness()) {
            return;
        }

        boolean interrupted = idleUntilStopped();

        // No-op when the manager already requested the stop.
        node.markStopRequested();
        node.markStopped();
        log.log(Level.FINE, "worker {0} exited", node.name());

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Wait for the worker to publish its id.
     */
    long awaitReady(long timeoutMillis) throws InterruptedException, ExecutionException, TimeoutException {
        return ready.get(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    /** Set the stop flag and wake the worker. Safe to call more than once. */
    void signalStop() {
        lock.lock();
        try {
            stopRequested = true;
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wake the worker without asking it to stop. It must re-check and keep idling.
     */
    void nudge() {
        lock.lock();
        try {
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return false if the spawner gave up before the worker got going
     */
    private boolean publishReadiness() {
        long id = Thread.currentThread().getId();
        lock.lock();
        try {
            if (stopRequested) {
                ready.cancel(false);
                return false;
            }
            node.markRunning(id);
        } catch (RuntimeException e) {
            ready.completeExceptionally(e);
            return false;
        } finally {
            lock.unlock();
        }
        ready.complete(id);
        return true;
    }

    private boolean idleUntilStopped() {
        boolean interrupted = false;
        lock.lock();
        try {
            while (!stopRequested) {
                try {
                    wakeup.await();
                } catch (InterruptedException e) {
                    stopRequested = true;
                    interrupted = true;
                }
            }
        } finally {
            lock.unlock();
        }
        return interrupted;
    }
}
