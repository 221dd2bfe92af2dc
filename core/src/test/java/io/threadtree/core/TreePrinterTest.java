// file: core/src/test/java/io/threadtree/core/TreePrinterTest.java
package io.threadtree.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreePrinterTest {

    /**
     * Builds the depth-2 tree with the ids handed out in construction order,
     * the same order the builder uses.
     */
    private static Node depthTwoTree() {
        var store = new NodeStore(7);
        Node root = store.createNode(null, 0, 0);
        root.markRunning(1234);

        Node a = store.createNode(root, 1, 0);
        a.markRunning(1235);
        store.createNode(a, 2, 0).markRunning(1237);
        store.createNode(a, 2, 1).markRunning(1238);

        Node b = store.createNode(root, 1, 1);
        b.markRunning(1236);
        store.createNode(b, 2, 0).markRunning(1239);
        store.createNode(b, 2, 1).markRunning(1240);
        return root;
    }

    @Test
    void renders_depth_two_tree_as_indented_hierarchy() {
        List<String> lines = TreePrinter.render(depthTwoTree());

        assertEquals(List.of(
                "root(1234)",
                "├── thread_1_0(1235)",
                "│   ├── thread_2_0(1237)",
                "│   └── thread_2_1(1238)",
                "└── thread_1_1(1236)",
                "    ├── thread_2_0(1239)",
                "    └── thread_2_1(1240)"
        ), lines);
    }

    @Test
    void single_root_renders_one_line() {
        Node root = new NodeStore(1).createNode(null, 0, 0);
        root.markRunning(99);

        assertEquals(List.of("root(99)"), TreePrinter.render(root));
    }

    @Test
    void rendering_is_idempotent() {
        Node root = depthTwoTree();

        assertEquals(TreePrinter.render(root), TreePrinter.render(root));
        assertEquals(7, TreePrinter.render(root).size());
    }

    @Test
    void lone_child_is_rendered_as_last_branch() {
        var store = new NodeStore(2);
        Node root = store.createNode(null, 0, 0);
        root.markRunning(1);
        store.createNode(root, 1, 0).markRunning(2);

        assertEquals(List.of("root(1)", "└── thread_1_0(2)"), TreePrinter.render(root));
    }

    @Test
    void print_writes_every_line_to_the_sink() {
        List<String> sink = new ArrayList<>();
        TreePrinter.print(depthTwoTree(), sink::add);

        assertEquals(7, sink.size());
        assertEquals("root(1234)", sink.get(0));
    }
}
