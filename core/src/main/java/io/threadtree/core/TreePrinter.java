// file: core/src/main/java/io/threadtree/core/TreePrinter.java
package io.threadtree.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a tree as an indented hierarchy, one line per node:
 * <pre>
 * root(1234)
 * ├── thread_1_0(1235)
 * │   ├── thread_2_0(1237)
 * │   └── thread_2_1(1238)
 * └── thread_1_1(1236)
 *     ├── thread_2_0(1239)
 *     └── thread_2_1(1240)
 * </pre>
 * Traversal is pre-order, children in index order. Rendering reads a snapshot
 * of each children list and never mutates the tree, so repeated calls on an
 * unchanged tree give identical output.
 */
public final class TreePrinter {

    static final String BRANCH = "├── ";
    static final String LAST_BRANCH = "└── ";
    static final String PIPE = "│   ";
    static final String BLANK = "    ";

    private TreePrinter() {
        // utility
    }

    public static List<String> render(Node root) {
        Objects.requireNonNull(root, "root");
        List<String> out = new ArrayList<>();
        out.add(label(root));
        renderChildren(root, "", out);
        return out;
    }

    public static void print(Node root, LineSink sink) {
        Objects.requireNonNull(sink, "sink");
        for (String line : render(root)) {
            sink.line(line);
        }
    }

    private static void renderChildren(Node node, String prefix, List<String> out) {
        List<Node> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            boolean last = i == children.size() - 1;
            out.add(prefix + (last ? LAST_BRANCH : BRANCH) + label(child));
            renderChildren(child, prefix + (last ? BLANK : PIPE), out);
        }
    }

    static String label(Node node) {
        Long id = node.id();
        return node.name() + "(" + (id == null ? "?" : id) + ")";
    }
}
