// file: engine/src/main/java/io/strata/engine/StrataConfig.java
package io.strata.engine;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.strata.engine.dto.JsonStrataConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings for {@link Strata#open(StrataConfig)}.
 *
 * Fields:
 *  - repositoryDir:      bare Git repository holding layer objects and references
 *  - journalDir:         directory for transaction journal segments
 *  - journalRotateBytes: size at which the journal starts a new segment
 *  - lockTimeout:        how long a commit waits for its reference locks
 *  - mergeParallelism:   worker threads for per-file merges; 1 merges on the caller's thread
 */
public record StrataConfig(
        Path repositoryDir,
        Path journalDir,
        long journalRotateBytes,
        Duration lockTimeout,
        int mergeParallelism
) {
    public static final long DEFAULT_JOURNAL_ROTATE_BYTES = 16L * 1024 * 1024;
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    public StrataConfig {
        Objects.requireNonNull(repositoryDir, "repositoryDir");
        Objects.requireNonNull(journalDir, "journalDir");
        Objects.requireNonNull(lockTimeout, "lockTimeout");
        if (journalRotateBytes <= 0) throw new IllegalArgumentException("journalRotateBytes must be > 0");
        if (lockTimeout.isNegative()) throw new IllegalArgumentException("lockTimeout must not be negative");
        if (mergeParallelism <= 0) throw new IllegalArgumentException("mergeParallelism must be > 0");
    }

    /** Defaults rooted at {@code dataDir}: {@code dataDir/repo} and {@code dataDir/journal}. */
    public static StrataConfig defaults(Path dataDir) {
        return new StrataConfig(
                dataDir.resolve("repo"),
                dataDir.resolve("journal"),
                DEFAULT_JOURNAL_ROTATE_BYTES,
                DEFAULT_LOCK_TIMEOUT,
                Runtime.getRuntime().availableProcessors());
    }

    /**
     * Load from JSON. Relative directories resolve against the file's own directory;
     * absent fields take the values of {@link #defaults(Path)} for that directory.
     */
    public static StrataConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        try {
            JsonStrataConfig cfg = mapper.readValue(path.toFile(), JsonStrataConfig.class);
            Path base = path.toAbsolutePath().getParent();
            StrataConfig d = defaults(base);
            return new StrataConfig(
                    cfg.repositoryDir != null ? base.resolve(cfg.repositoryDir) : d.repositoryDir(),
                    cfg.journalDir != null ? base.resolve(cfg.journalDir) : d.journalDir(),
                    cfg.journalRotateBytes != null ? cfg.journalRotateBytes : d.journalRotateBytes(),
                    cfg.lockTimeoutMillis != null ? Duration.ofMillis(cfg.lockTimeoutMillis) : d.lockTimeout(),
                    cfg.mergeParallelism != null ? cfg.mergeParallelism : d.mergeParallelism()
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load StrataConfig from " + path, e);
        }
    }

    public StrataConfig withLockTimeout(Duration timeout) {
        return new StrataConfig(repositoryDir, journalDir, journalRotateBytes, timeout, mergeParallelism);
    }

    public StrataConfig withMergeParallelism(int parallelism) {
        return new StrataConfig(repositoryDir, journalDir, journalRotateBytes, lockTimeout, parallelism);
    }
}
