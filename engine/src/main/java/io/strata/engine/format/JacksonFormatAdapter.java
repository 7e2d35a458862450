// file: engine/src/main/java/io/strata/engine/format/JacksonFormatAdapter.java
package io.strata.engine.format;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.strata.core.value.Value;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link FormatAdapter} backed by a Jackson mapper for the format's data format module.
 * <p>
 * Options:
 *  - allowsNull:  false for formats with no null literal (TOML, properties); serializing
 *                 a value that contains null is a {@link FormatException}.
 *  - objectRoot:  true for formats whose document must be a table/map at the root.
 *  - blankIsEmpty: true if an empty or whitespace-only document means "no keys".
 */
final class JacksonFormatAdapter implements FormatAdapter {
    private final FileFormat format;
    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final boolean allowsNull;
    private final boolean objectRoot;
    private final boolean blankIsEmpty;
    private final boolean trailingNewline;

    JacksonFormatAdapter(FileFormat format, ObjectMapper mapper, ObjectWriter writer,
                         boolean allowsNull, boolean objectRoot, boolean blankIsEmpty, boolean trailingNewline) {
        this.format = Objects.requireNonNull(format, "format");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.allowsNull = allowsNull;
        this.objectRoot = objectRoot;
        this.blankIsEmpty = blankIsEmpty;
        this.trailingNewline = trailingNewline;
    }

    @Override
    public FileFormat format() {
        return format;
    }

    @Override
    public Value parse(String path, byte[] content) {
        if (blankIsEmpty && new String(content, StandardCharsets.UTF_8).isBlank()) {
            return Value.ObjectValue.empty();
        }
        try (JsonParser parser = mapper.createParser(content)) {
            JsonNode tree = mapper.readTree(parser);
            if (tree == null || tree.isMissingNode()) {
                throw new FormatException(path, format, "document is empty");
            }
            // one document per file; a second value or YAML document is not silently dropped
            JsonToken trailing = parser.nextToken();
            if (trailing != null) {
                throw new FormatException(path, format, "unexpected content after the document, line "
                        + parser.currentLocation().getLineNr());
            }
            return JsonNodes.toValue(tree);
        } catch (JacksonException e) {
            throw new FormatException(path, format, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FormatException(path, format, e.getMessage(), e);
        }
    }

    @Override
    public byte[] serialize(String path, Value value) {
        if (!allowsNull && value.containsNull()) {
            throw new FormatException(path, format, format + " does not support null values");
        }
        if (objectRoot && !(value instanceof Value.ObjectValue)) {
            throw new FormatException(path, format, format + " documents must be a table at the root, got " + value.typeName());
        }
        try {
            byte[] out = writer.writeValueAsBytes(JsonNodes.toNode(value));
            if (trailingNewline && (out.length == 0 || out[out.length - 1] != '\n')) {
                byte[] withNewline = new byte[out.length + 1];
                System.arraycopy(out, 0, withNewline, 0, out.length);
                withNewline[out.length] = '\n';
                return withNewline;
            }
            return out;
        } catch (IOException e) {
            throw new FormatException(path, format, e.getMessage(), e);
        }
    }
}
