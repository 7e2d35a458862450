// file: engine/src/main/java/io/strata/engine/dto/JsonStrataConfig.java
package io.strata.engine.dto;

/**
 * JSON shape of a strata configuration file. Absent fields keep their defaults.
 */
public class JsonStrataConfig {
    public String repositoryDir;
    public String journalDir;
    public Long journalRotateBytes;
    public Long lockTimeoutMillis;
    public Integer mergeParallelism;
}
