// file: host/src/main/java/io/threadtree/host/HostConfig.java
package io.threadtree.host;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Host configuration.
 *
 * Supports:
 *  - maxDepth:           depth of the tree built on start (root is level 0)
 *  - depthLimit:         largest depth start() accepts; one thread per node adds up quickly
 *  - maxNodes:           node budget of the allocator
 *  - readyTimeoutMillis: bound on a worker's readiness handshake
 *  - joinTimeoutMillis:  bound on waiting for a worker to exit during teardown
 *  - runSeconds:         how long Main keeps the tree up; 0 means until the process is signalled
 *  - configPath:         optional JSON file supplying the base values
 */
public record HostConfig(
        int maxDepth,
        int depthLimit,
        int maxNodes,
        long readyTimeoutMillis,
        long joinTimeoutMillis,
        long runSeconds,
        String configPath
) {

    public HostConfig {
        if (depthLimit < 0 || depthLimit > 20) throw new IllegalArgumentException("depthLimit must be in [0, 20], got: " + depthLimit);
        if (maxDepth < 0 || maxDepth > depthLimit) {
            throw new IllegalArgumentException("maxDepth must be in [0, %d], got: %d".formatted(depthLimit, maxDepth));
        }
        if (maxNodes <= 0) throw new IllegalArgumentException("maxNodes must be > 0");
        if (readyTimeoutMillis <= 0) throw new IllegalArgumentException("readyTimeoutMillis must be > 0");
        if (joinTimeoutMillis <= 0) throw new IllegalArgumentException("joinTimeoutMillis must be > 0");
        if (runSeconds < 0) throw new IllegalArgumentException("runSeconds must be >= 0");
    }

    public static HostConfig defaults() {
        return new HostConfig(2, 10, 4096, 5_000, 5_000, 0, null);
    }

    public HostConfig withMaxDepth(int depth) {
        return new HostConfig(depth, depthLimit, maxNodes, readyTimeoutMillis, joinTimeoutMillis, runSeconds, configPath);
    }

    /**
     * Load base values from a JSON file; fields missing from the file keep their defaults.
     */
    public static HostConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonHostConfig json = mapper.readValue(path.toFile(), JsonHostConfig.class);
            HostConfig d = defaults();
            return new HostConfig(
                    json.maxDepth != null ? json.maxDepth : d.maxDepth(),
                    json.depthLimit != null ? json.depthLimit : d.depthLimit(),
                    json.maxNodes != null ? json.maxNodes : d.maxNodes(),
                    json.readyTimeoutMillis != null ? json.readyTimeoutMillis : d.readyTimeoutMillis(),
                    json.joinTimeoutMillis != null ? json.joinTimeoutMillis : d.joinTimeoutMillis(),
                    json.runSeconds != null ? json.runSeconds : d.runSeconds(),
                    path.toString()
            );
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load HostConfig from " + path, e);
        }
    }

    /**
     * Small CLI parser. A --config file, if given, supplies the base values and the
     * other flags override it regardless of their order.
     *
     * Supported flags:
     *   --depth, -d <n>
     *   --depth-limit <n>
     *   --max-nodes <n>
     *   --ready-timeout-ms <ms>
     *   --join-timeout-ms <ms>
     *   --run-seconds <s>
     *   --config, -c <path>
     *
     * @throws IllegalArgumentException on unknown flags, missing or malformed values
     */
    public static HostConfig fromArgs(String[] args) {
        String configPath = null;
        for (int i = 0; i < args.length; i++) {
            if (args[i].equals("--config") || args[i].equals("-c")) {
                configPath = value(args, i);
            }
        }
        HostConfig base = configPath != null ? fromJsonFile(Path.of(configPath)) : defaults();

        int maxDepth = base.maxDepth();
        int depthLimit = base.depthLimit();
        int maxNodes = base.maxNodes();
        long readyTimeoutMillis = base.readyTimeoutMillis();
        long joinTimeoutMillis = base.joinTimeoutMillis();
        long runSeconds = base.runSeconds();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--depth", "-d" -> maxDepth = parseInt(args[i], value(args, i++));
                case "--depth-limit" -> depthLimit = parseInt(args[i], value(args, i++));
                case "--max-nodes" -> maxNodes = parseInt(args[i], value(args, i++));
                case "--ready-timeout-ms" -> readyTimeoutMillis = parseLong(args[i], value(args, i++));
                case "--join-timeout-ms" -> joinTimeoutMillis = parseLong(args[i], value(args, i++));
                case "--run-seconds" -> runSeconds = parseLong(args[i], value(args, i++));
                case "--config", "-c" -> i++;
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new HostConfig(maxDepth, depthLimit, maxNodes, readyTimeoutMillis, joinTimeoutMillis, runSeconds, configPath);
    }

    public static boolean isHelp(String[] args) {
        for (String a : args) {
            if (a.equals("--help") || a.equals("-h")) {
                return true;
            }
        }
        return false;
    }

    public static String usage() {
        return """
            Usage: thread-tree [options]

            Options:
              --depth,          -d   Depth of the tree, root is level 0 (default: 2)
              --depth-limit          Largest accepted depth (default: 10)
              --max-nodes            Node budget (default: 4096)
              --ready-timeout-ms     Worker readiness wait (default: 5000)
              --join-timeout-ms      Worker exit wait during teardown (default: 5000)
              --run-seconds          Stop after this many seconds, 0 = until signalled (default: 0)
              --config,         -c   Path to JSON config (optional)
              --help,           -h   Show this help message
            """;
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static int parseInt(String flag, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag + ": " + raw, e);
        }
    }

    private static long parseLong(String flag, String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag + ": " + raw, e);
        }
    }
}
