// file: host/src/test/java/io/threadtree/host/WorkerTreeHostTest.java
package io.threadtree.host;

import io.threadtree.core.Node;
import io.threadtree.core.NodeState;
import io.threadtree.core.WorkerSpawnException;
import io.threadtree.runtime.ShutdownReport;
import io.threadtree.runtime.ThreadWorkerManager;
import io.threadtree.runtime.WorkerHandle;
import io.threadtree.runtime.WorkerManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class WorkerTreeHostTest {

    private final List<String> lines = new ArrayList<>();
    private final HostConfig config = HostConfig.defaults();
    private WorkerTreeHost host = new WorkerTreeHost(config, lines::add);

    @AfterEach
    void tearDown() {
        host.stop();
    }

    private List<String> treeLines() {
        return lines.stream()
                .filter(l -> !l.startsWith("Created thread:"))
                .map(l -> l.replaceAll("\\(\\d+\\)", "(id)"))
                .toList();
    }

    private static Predicate<Node> pathIs(int... indices) {
        return n -> {
            Node cur = n;
            for (int i = indices.length - 1; i >= 0; i--) {
                if (cur == null || cur.isRoot() || cur.index() != indices[i]) {
                    return false;
                }
                cur = cur.parent();
            }
            return cur != null && cur.isRoot();
        };
    }

    @Test
    void start_depth_two_prints_construction_then_hierarchy() {
        StartResult result = host.start(2);

        assertTrue(result.succeeded());
        assertEquals(7, result.nodeCount());
        assertEquals(14, lines.size(), "seven creation lines then seven tree lines");
        for (int i = 0; i < 7; i++) {
            assertTrue(lines.get(i).startsWith("Created thread: PID="), lines.get(i));
        }
        assertTrue(lines.get(0).endsWith("Parent PID=none, Level=0"));
        assertEquals(List.of(
                "root(id)",
                "├── thread_1_0(id)",
                "│   ├── thread_2_0(id)",
                "│   └── thread_2_1(id)",
                "└── thread_1_1(id)",
                "    ├── thread_2_0(id)",
                "    └── thread_2_1(id)"
        ), treeLines());
        assertEquals("root(" + result.root().id() + ")", lines.get(7));
    }

    @Test
    void depth_zero_prints_a_single_tree_line() {
        StartResult result = host.start(0);

        assertTrue(result.succeeded());
        assertEquals(1, result.nodeCount());
        assertEquals(List.of("root(id)"), treeLines());
    }

    @Test
    void stop_reclaims_every_node_and_is_idempotent() {
        StartResult result = host.start(2);
        Node root = result.root();

        ShutdownReport report = host.stop();

        assertTrue(report.clean());
        assertEquals(7, report.freed());
        assertTrue(root.isFreed());
        assertEquals(NodeState.STOPPED, root.state());
        assertNull(host.session());

        ShutdownReport again = host.stop();
        assertTrue(again.clean());
        assertEquals(0, again.freed());
    }

    @Test
    void stop_without_start_is_a_no_op() {
        ShutdownReport report = host.stop();

        assertTrue(report.clean());
        assertEquals(0, report.freed());
    }

    @Test
    void only_one_session_at_a_time() {
        host.start(1);

        assertThrows(IllegalStateException.class, () -> host.start(1));

        host.stop();
        StartResult second = host.start(1);
        assertTrue(second.succeeded());
        assertEquals(3, host.session().runningWorkers());
        assertEquals(3, host.session().liveNodes());
    }

    @Test
    void depth_outside_configured_range_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> host.start(-1));
        assertThrows(IllegalArgumentException.class, () -> host.start(config.depthLimit() + 1));
        assertNull(host.session());
    }

    @Test
    void spawn_failure_on_second_root_child_yields_partial_tree_that_stops_cleanly() {
        host = new WorkerTreeHost(config, lines::add,
                () -> new FailingWorkerManager(newThreadManager(), pathIs(1)));

        StartResult result = host.start(2);

        assertEquals(StartResult.Status.PARTIAL, result.status());
        assertEquals(3, result.nodeCount());
        assertEquals(1, result.failures().size());
        assertInstanceOf(WorkerSpawnException.class, result.failures().get(0));
        assertEquals(List.of(
                "root(id)",
                "└── thread_1_0(id)",
                "    ├── thread_2_0(id)",
                "    └── thread_2_1(id)"
        ), treeLines());

        ShutdownReport report = host.stop();
        assertTrue(report.clean());
        assertEquals(3, report.freed());
    }

    @Test
    void root_spawn_failure_fails_start_without_holding_a_session() {
        host = new WorkerTreeHost(config, lines::add,
                () -> new FailingWorkerManager(newThreadManager(), Node::isRoot));

        StartResult result = host.start(2);

        assertEquals(StartResult.Status.FAILED, result.status());
        assertNull(result.root());
        assertNull(host.session());
        assertTrue(lines.isEmpty());
        assertTrue(host.stop().clean());
    }

    @Test
    void default_start_uses_configured_depth() {
        host = new WorkerTreeHost(config.withMaxDepth(1), lines::add);

        StartResult result = host.start();

        assertEquals(1, result.maxDepth());
        assertEquals(3, result.nodeCount());
    }

    private ThreadWorkerManager newThreadManager() {
        return new ThreadWorkerManager(
                Duration.ofMillis(config.readyTimeoutMillis()),
                Duration.ofMillis(config.joinTimeoutMillis())
        );
    }

    /**
     * Refuses to spawn nodes matching a predicate, otherwise delegates.
     */
    private static final class FailingWorkerManager implements WorkerManager {
        private final WorkerManager delegate;
        private final Predicate<Node> refuse;

        FailingWorkerManager(WorkerManager delegate, Predicate<Node> refuse) {
            this.delegate = delegate;
            this.refuse = refuse;
        }

        @Override
        public WorkerHandle spawn(Node node) {
            if (refuse.test(node)) {
                throw new WorkerSpawnException(node, "resource limit reached for " + node.name());
            }
            return delegate.spawn(node);
        }

        @Override
        public void requestStop(Node node) {
            delegate.requestStop(node);
        }

        @Override
        public void join(Node node) {
            delegate.join(node);
        }

        @Override
        public int runningCount() {
            return delegate.runningCount();
        }
    }
}
