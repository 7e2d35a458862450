// file: engine/src/main/java/io/strata/engine/format/FormatAdapters.java
package io.strata.engine.format;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.dataformat.javaprop.JavaPropsMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of structured format adapters. JSON, YAML, TOML and properties go
 * through Jackson; INI through ini4j.
 * <p>
 * Every mapper reads floating-point numbers as exact decimals and keeps trailing
 * zeros, so {@code 30.0} and {@code 30} stay distinct through a merge.
 */
public final class FormatAdapters {
    private static final Map<FileFormat, FormatAdapter> ADAPTERS = new EnumMap<>(FileFormat.class);

    static {
        ObjectMapper json = exact(new ObjectMapper());
        ADAPTERS.put(FileFormat.JSON, new JacksonFormatAdapter(
                FileFormat.JSON, json, json.writerWithDefaultPrettyPrinter(), true, false, false, true));

        YAMLMapper yaml = exact(YAMLMapper.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .build());
        ADAPTERS.put(FileFormat.YAML, new JacksonFormatAdapter(
                FileFormat.YAML, yaml, yaml.writer(), true, false, true, true));

        TomlMapper toml = exact(new TomlMapper());
        ADAPTERS.put(FileFormat.TOML, new JacksonFormatAdapter(
                FileFormat.TOML, toml, toml.writer(), false, true, true, false));

        JavaPropsMapper props = exact(new JavaPropsMapper());
        ADAPTERS.put(FileFormat.PROPERTIES, new JacksonFormatAdapter(
                FileFormat.PROPERTIES, props, props.writer(), false, true, true, false));

        ADAPTERS.put(FileFormat.INI, new IniFormatAdapter());
    }

    private FormatAdapters() {
    }

    /** Adapter for {@code format}, or empty for {@link FileFormat#TEXT}. */
    public static Optional<FormatAdapter> forFormat(FileFormat format) {
        return Optional.ofNullable(ADAPTERS.get(format));
    }

    /**
     * @throws IllegalArgumentException for {@link FileFormat#TEXT}
     */
    public static FormatAdapter require(FileFormat format) {
        return forFormat(format).orElseThrow(() -> new IllegalArgumentException(format + " is not a structured format"));
    }

    private static <M extends ObjectMapper> M exact(M mapper) {
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        mapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
        mapper.configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
        mapper.setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
        return mapper;
    }
}
