// file: engine/src/test/java/io/strata/engine/StrataConfigTest.java
package io.strata.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class StrataConfigTest {

    @TempDir
    Path tmp;

    @Test
    void loads_all_fields_from_json() throws Exception {
        String json = """
                {
                  "repositoryDir": "state/repo.git",
                  "journalDir": "/var/lib/strata/journal",
                  "journalRotateBytes": 4096,
                  "lockTimeoutMillis": 250,
                  "mergeParallelism": 3
                }
                """;
        Path cfgPath = tmp.resolve("strata.json");
        Files.writeString(cfgPath, json);

        StrataConfig cfg = StrataConfig.fromJsonFile(cfgPath);

        assertEquals(tmp.toAbsolutePath().resolve("state/repo.git"), cfg.repositoryDir());
        assertEquals(Path.of("/var/lib/strata/journal"), cfg.journalDir());
        assertEquals(4096, cfg.journalRotateBytes());
        assertEquals(Duration.ofMillis(250), cfg.lockTimeout());
        assertEquals(3, cfg.mergeParallelism());
    }

    @Test
    void absent_fields_take_defaults_next_to_the_file() throws Exception {
        Path cfgPath = tmp.resolve("strata.json");
        Files.writeString(cfgPath, "{\"mergeParallelism\": 1}");

        StrataConfig cfg = StrataConfig.fromJsonFile(cfgPath);

        assertEquals(tmp.toAbsolutePath().resolve("repo"), cfg.repositoryDir());
        assertEquals(tmp.toAbsolutePath().resolve("journal"), cfg.journalDir());
        assertEquals(StrataConfig.DEFAULT_JOURNAL_ROTATE_BYTES, cfg.journalRotateBytes());
        assertEquals(StrataConfig.DEFAULT_LOCK_TIMEOUT, cfg.lockTimeout());
        assertEquals(1, cfg.mergeParallelism());
    }

    @Test
    void unknown_field_or_bad_file_fails_with_context() throws Exception {
        Path typo = tmp.resolve("typo.json");
        Files.writeString(typo, "{\"lockTimeout\": 5}");

        var e = assertThrows(RuntimeException.class, () -> StrataConfig.fromJsonFile(typo));
        assertTrue(e.getMessage().contains("typo.json"));
        assertThrows(RuntimeException.class, () -> StrataConfig.fromJsonFile(tmp.resolve("missing.json")));
    }

    @Test
    void invalid_values_are_rejected() throws Exception {
        Path cfgPath = tmp.resolve("strata.json");
        Files.writeString(cfgPath, "{\"mergeParallelism\": 0}");

        assertThrows(IllegalArgumentException.class, () -> StrataConfig.fromJsonFile(cfgPath));
        assertThrows(IllegalArgumentException.class,
                () -> StrataConfig.defaults(tmp).withLockTimeout(Duration.ofMillis(-1)));
    }
}
