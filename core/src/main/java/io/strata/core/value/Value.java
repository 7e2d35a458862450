// file: core/src/main/java/io/strata/core/value/Value.java
package io.strata.core.value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Format-neutral tree that structured files are parsed into and serialized from.
 * <p>
 * Variants:
 *  - NullValue
 *  - BoolValue
 *  - NumberValue (exact decimal; 30 and 30.0 stay distinct)
 *  - StringValue
 *  - ArrayValue (ordered list)
 *  - ObjectValue (insertion-ordered map; order only matters for serialized output)
 * <p>
 * All variants are immutable. Trees built from other trees never alias mutable state.
 */
public sealed interface Value
        permits Value.NullValue, Value.BoolValue, Value.NumberValue,
                Value.StringValue, Value.ArrayValue, Value.ObjectValue {

    NullValue NULL = new NullValue();
    BoolValue TRUE = new BoolValue(true);
    BoolValue FALSE = new BoolValue(false);

    /** Short type name used in diagnostics ("null", "object", ...). */
    String typeName();

    default boolean isNull() { return this instanceof NullValue; }

    /** True if a null appears anywhere in this tree. */
    default boolean containsNull() {
        if (this instanceof NullValue) return true;
        if (this instanceof ArrayValue a) return a.elements().stream().anyMatch(Value::containsNull);
        if (this instanceof ObjectValue o) return o.members().values().stream().anyMatch(Value::containsNull);
        return false;
    }

    static Value of(String s) { return new StringValue(s); }

    static Value of(long n) { return new NumberValue(BigDecimal.valueOf(n)); }

    static Value of(BigDecimal n) { return new NumberValue(n); }

    static Value of(boolean b) { return b ? TRUE : FALSE; }

    static ArrayValue array(Value... elements) { return new ArrayValue(List.of(elements)); }

    static ObjectValue.Builder object() { return new ObjectValue.Builder(); }

    record NullValue() implements Value {
        @Override public String typeName() { return "null"; }
        @Override public String toString() { return "null"; }
    }

    record BoolValue(boolean value) implements Value {
        @Override public String typeName() { return "boolean"; }
        @Override public String toString() { return Boolean.toString(value); }
    }

    record NumberValue(BigDecimal value) implements Value {
        public NumberValue {
            Objects.requireNonNull(value, "value");
        }

        /** True when the number has no fractional part in its written form. */
        public boolean isIntegral() { return value.scale() <= 0; }

        @Override public String typeName() { return "number"; }
        @Override public String toString() { return value.toPlainString(); }
    }

    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override public String typeName() { return "string"; }
        @Override public String toString() { return '"' + value + '"'; }
    }

    record ArrayValue(List<Value> elements) implements Value {
        public ArrayValue {
            elements = List.copyOf(elements);
        }

        public int size() { return elements.size(); }

        public Value get(int index) { return elements.get(index); }

        @Override public String typeName() { return "array"; }
        @Override public String toString() { return elements.toString(); }
    }

    record ObjectValue(Map<String, Value> members) implements Value {
        public ObjectValue {
            var copy = new LinkedHashMap<String, Value>(members.size() * 2);
            members.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "key"), Objects.requireNonNull(v, "value")));
            members = Collections.unmodifiableMap(copy);
        }

        public static ObjectValue empty() { return new ObjectValue(Map.of()); }

        public Optional<Value> get(String key) { return Optional.ofNullable(members.get(key)); }

        public boolean has(String key) { return members.containsKey(key); }

        public int size() { return members.size(); }

        @Override public String typeName() { return "object"; }
        @Override public String toString() { return members.toString(); }

        /** Insertion-ordered builder. */
        public static final class Builder {
            private final LinkedHashMap<String, Value> members = new LinkedHashMap<>();

            public Builder put(String key, Value value) {
                members.put(key, value);
                return this;
            }

            public Builder put(String key, String value) { return put(key, Value.of(value)); }

            public Builder put(String key, long value) { return put(key, Value.of(value)); }

            public Builder put(String key, boolean value) { return put(key, Value.of(value)); }

            public ObjectValue build() { return new ObjectValue(members); }
        }
    }
}
