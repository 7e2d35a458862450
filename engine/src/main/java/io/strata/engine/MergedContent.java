// file: engine/src/main/java/io/strata/engine/MergedContent.java
package io.strata.engine;

import io.strata.core.value.Value;

import java.util.Objects;

/** Final content of a merged file: a structured value or plain text. */
public sealed interface MergedContent permits MergedContent.Structured, MergedContent.Text {

    record Structured(Value value) implements MergedContent {
        public Structured {
            Objects.requireNonNull(value, "value");
        }
    }

    record Text(String text) implements MergedContent {
        public Text {
            Objects.requireNonNull(text, "text");
        }
    }
}
