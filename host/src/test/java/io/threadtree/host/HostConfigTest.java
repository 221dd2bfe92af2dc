// file: host/src/test/java/io/threadtree/host/HostConfigTest.java
package io.threadtree.host;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class HostConfigTest {

    @TempDir
    Path tmp;

    @Test
    void no_args_gives_defaults() {
        HostConfig cfg = HostConfig.fromArgs(new String[0]);

        assertEquals(HostConfig.defaults(), cfg);
        assertEquals(2, cfg.maxDepth());
        assertEquals(0, cfg.runSeconds());
    }

    @Test
    void cli_flags_override_defaults() {
        HostConfig cfg = HostConfig.fromArgs(new String[]{
                "-d", "3", "--max-nodes", "100", "--join-timeout-ms", "250",
                "--ready-timeout-ms", "750", "--run-seconds", "4"
        });

        assertEquals(3, cfg.maxDepth());
        assertEquals(100, cfg.maxNodes());
        assertEquals(250, cfg.joinTimeoutMillis());
        assertEquals(750, cfg.readyTimeoutMillis());
        assertEquals(4, cfg.runSeconds());
        assertNull(cfg.configPath());
    }

    @Test
    void loads_json_and_lets_cli_override_it() throws Exception {
        String json = """
                {
                  "maxDepth": 4,
                  "maxNodes": 64,
                  "joinTimeoutMillis": 1500
                }
                """;
        Path cfgPath = tmp.resolve("tree.json");
        Files.writeString(cfgPath, json);

        HostConfig fromFile = HostConfig.fromJsonFile(cfgPath);
        assertEquals(4, fromFile.maxDepth());
        assertEquals(64, fromFile.maxNodes());
        assertEquals(1500, fromFile.joinTimeoutMillis());
        assertEquals(5_000, fromFile.readyTimeoutMillis(), "absent fields keep defaults");

        HostConfig merged = HostConfig.fromArgs(new String[]{"--depth", "1", "--config", cfgPath.toString()});
        assertEquals(1, merged.maxDepth(), "CLI wins over the file");
        assertEquals(64, merged.maxNodes());
        assertEquals(cfgPath.toString(), merged.configPath());
    }

    @Test
    void malformed_input_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> HostConfig.fromArgs(new String[]{"--depth"}));
        assertThrows(IllegalArgumentException.class, () -> HostConfig.fromArgs(new String[]{"--depth", "two"}));
        assertThrows(IllegalArgumentException.class, () -> HostConfig.fromArgs(new String[]{"--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> HostConfig.fromArgs(new String[]{"--depth", "-1"}));
        assertThrows(IllegalArgumentException.class, () -> HostConfig.fromArgs(new String[]{"--depth", "11"}));
        assertThrows(IllegalArgumentException.class,
                () -> HostConfig.fromJsonFile(tmp.resolve("missing.json")));
    }

    @Test
    void help_flag_is_detected() {
        assertTrue(HostConfig.isHelp(new String[]{"-d", "2", "--help"}));
        assertFalse(HostConfig.isHelp(new String[]{"-d", "2"}));
        assertTrue(HostConfig.usage().contains("--depth"));
    }
}
