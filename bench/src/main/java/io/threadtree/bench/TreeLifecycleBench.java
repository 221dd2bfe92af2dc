// file: bench/src/main/java/io/threadtree/bench/TreeLifecycleBench.java
package io.threadtree.bench;

import io.threadtree.core.LineSink;
import io.threadtree.host.HostConfig;
import io.threadtree.host.StartResult;
import io.threadtree.host.WorkerTreeHost;
import io.threadtree.runtime.ShutdownReport;

import java.util.HashMap;
import java.util.Map;

/**
 * Measures how long it takes to build and tear down worker trees.
 *
 * Usage:
 *   java -cp bench.jar io.threadtree.bench.TreeLifecycleBench \
 *     --max-depth 8 \
 *     --repeats 5
 *
 * Output:
 *   - CSV to stdout, one row per run:
 *       depth,nodes,start_ms,stop_ms
 *   - Summary line per depth to stderr.
 */
public final class TreeLifecycleBench {

    private TreeLifecycleBench() {
    }

    public static void main(String[] args) {
        Map<String, String> cfg = parseArgs(args);

        int maxDepth = Integer.parseInt(cfg.getOrDefault("max-depth", "8"));
        int repeats = Integer.parseInt(cfg.getOrDefault("repeats", "5"));

        HostConfig hostConfig = new HostConfig(0, maxDepth, 1 << (maxDepth + 2), 10_000, 10_000, 0, null);
        WorkerTreeHost host = new WorkerTreeHost(hostConfig, LineSink.discard());

        System.out.println("depth,nodes,start_ms,stop_ms");
        for (int depth = 0; depth <= maxDepth; depth++) {
            double startTotal = 0;
            double stopTotal = 0;
            for (int run = 0; run < repeats; run++) {
                long t0 = System.nanoTime();
                StartResult started = host.start(depth);
                long t1 = System.nanoTime();
                ShutdownReport stopped = host.stop();
                long t2 = System.nanoTime();

                if (!started.succeeded() || !stopped.clean()) {
                    System.err.printf("depth=%d run=%d status=%s timeouts=%d%n",
                            depth, run, started.status(), stopped.timeouts().size());
                }

                double startMs = (t1 - t0) / 1_000_000.0;
                double stopMs = (t2 - t1) / 1_000_000.0;
                startTotal += startMs;
                stopTotal += stopMs;
                System.out.printf("%d,%d,%.3f,%.3f%n", depth, started.nodeCount(), startMs, stopMs);
            }
            System.err.printf("depth=%d avgStartMs=%.3f avgStopMs=%.3f%n",
                    depth, startTotal / repeats, stopTotal / repeats);
        }
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }
}
