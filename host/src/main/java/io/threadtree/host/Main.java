// file: host/src/main/java/io/threadtree/host/Main.java
package io.threadtree.host;

import io.threadtree.core.LineSink;
import io.threadtree.core.WorkerJoinTimeoutException;
import io.threadtree.core.WorkerTreeException;
import io.threadtree.runtime.ShutdownReport;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.LogManager;

/**
 * Command-line host.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and optional JSON file).
 *  - Start the tree, printing construction events and the hierarchy to stdout.
 *  - Keep it running for --run-seconds, or until the process is signalled.
 *  - Stop it from a shutdown hook so Ctrl-C still tears the tree down in order.
 */
public final class Main {

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws InterruptedException {
        if (HostConfig.isHelp(args)) {
            System.out.println(HostConfig.usage());
            return;
        }

        HostConfig cfg;
        try {
            cfg = HostConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("error: " + e.getMessage());
            System.err.println(HostConfig.usage());
            System.exit(1);
            return;
        }

        configureLogging();

        var host = new WorkerTreeHost(cfg, LineSink.printing(System.out));
        StartResult started = host.start();
        for (WorkerTreeException failure : started.failures()) {
            System.err.println("[start] " + failure.getMessage());
        }
        if (started.status() == StartResult.Status.FAILED) {
            System.exit(2);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> report(host.stop()), "tree-shutdown"));

        if (cfg.runSeconds() > 0) {
            TimeUnit.SECONDS.sleep(cfg.runSeconds());
            report(host.stop());
            System.exit(started.succeeded() ? 0 : 2);
        }

        // Run until signalled; the shutdown hook does the teardown.
        new CountDownLatch(1).await();
    }

    private static void report(ShutdownReport report) {
        if (report.freed() == 0 && report.clean()) {
            return;
        }
        System.out.printf("Stopped: freed=%d, timeouts=%d, stranded=%d%n",
                report.freed(), report.timeouts().size(), report.stranded().size());
        for (WorkerJoinTimeoutException timeout : report.timeouts()) {
            System.err.printf("[stop] %s still running after %d ms%n",
                    timeout.node().name(), timeout.waited().toMillis());
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("[logging] could not load logging.properties: " + e.getMessage());
        }
    }
}
