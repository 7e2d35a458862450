// file: engine/src/main/java/io/strata/engine/format/JsonNodes.java
package io.strata.engine.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.strata.core.value.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversion between Jackson's tree model and {@link Value}.
 * Numbers stay exact: integral nodes become scale-0 decimals, fractional nodes keep their scale.
 */
final class JsonNodes {
    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private JsonNodes() {
    }

    static Value toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Value.NULL;
        if (node.isObject()) {
            Map<String, Value> members = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                members.put(f.getKey(), toValue(f.getValue()));
            }
            return new Value.ObjectValue(members);
        }
        if (node.isArray()) {
            var elements = new ArrayList<Value>(node.size());
            for (JsonNode e : node) elements.add(toValue(e));
            return new Value.ArrayValue(elements);
        }
        if (node.isBoolean()) return Value.of(node.booleanValue());
        if (node.isNumber()) {
            BigDecimal n = node.isIntegralNumber() ? new BigDecimal(node.bigIntegerValue()) : node.decimalValue();
            return Value.of(n);
        }
        return Value.of(node.asText());
    }

    static JsonNode toNode(Value value) {
        if (value instanceof Value.NullValue) return NODES.nullNode();
        if (value instanceof Value.BoolValue b) return NODES.booleanNode(b.value());
        if (value instanceof Value.NumberValue n) {
            return n.isIntegral() ? NODES.numberNode(n.value().toBigInteger()) : NODES.numberNode(n.value());
        }
        if (value instanceof Value.StringValue s) return NODES.textNode(s.value());
        if (value instanceof Value.ArrayValue a) {
            ArrayNode array = NODES.arrayNode(a.size());
            for (Value e : a.elements()) array.add(toNode(e));
            return array;
        }
        Value.ObjectValue o = (Value.ObjectValue) value;
        ObjectNode object = NODES.objectNode();
        o.members().forEach((k, v) -> object.set(k, toNode(v)));
        return object;
    }
}
