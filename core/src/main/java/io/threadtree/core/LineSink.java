// file: core/src/main/java/io/threadtree/core/LineSink.java
package io.threadtree.core;

import java.io.PrintStream;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Destination for the human-readable lines the tree emits
 * (construction events and the rendered hierarchy).
 */
@FunctionalInterface
public interface LineSink {

    void line(String line);

    /** Sink backed by a java.util.logging logger at INFO. */
    static LineSink logging(Logger logger) {
        Objects.requireNonNull(logger, "logger");
        return line -> logger.log(Level.INFO, line);
    }

    static LineSink printing(PrintStream out) {
        Objects.requireNonNull(out, "out");
        return out::println;
    }

    static LineSink discard() {
        return line -> {
        };
    }
}
