// file: engine/src/main/java/io/strata/engine/format/FormatAdapter.java
package io.strata.engine.format;

import io.strata.core.value.Value;

/**
 * Converts between one structured file format and {@link Value}.
 * <p>
 * Round trips are semantic, not byte-exact: comments and layout are lost.
 */
public interface FormatAdapter {

    FileFormat format();

    /**
     * @param path used in error messages only
     * @throws FormatException if {@code content} is not valid in this format
     */
    Value parse(String path, byte[] content);

    /**
     * @throws FormatException if {@code value} cannot be expressed in this format
     */
    byte[] serialize(String path, Value value);
}
