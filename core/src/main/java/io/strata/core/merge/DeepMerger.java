// file: core/src/main/java/io/strata/core/merge/DeepMerger.java
package io.strata.core.merge;

import io.strata.core.value.Value;
import io.strata.core.value.Value.ArrayValue;
import io.strata.core.value.Value.NumberValue;
import io.strata.core.value.Value.ObjectValue;
import io.strata.core.value.Value.StringValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default deep merge, higher layer wins.
 * <p>
 * Rules:
 *  - higher is null as a whole: null replaces lower.
 *  - object + object: key-wise. A key whose higher value is null is removed;
 *    keys on one side only pass through; keys on both sides recurse.
 *  - array + array: if every element on both sides is an object carrying an
 *    identity ("id", else "name", string or number), elements are merged by
 *    identity. Matched elements recurse and keep the lower position, unmatched
 *    lower elements stay, unmatched higher elements are appended in order.
 *    Any other pair of arrays: higher replaces lower.
 *  - anything else: higher replaces lower.
 * <p>
 * Values taken from the higher side without a lower counterpart are materialized
 * (null members dropped, recursively), so re-applying the same higher layer is a no-op.
 */
public final class DeepMerger implements ValueMerger {

    private static final List<String> IDENTITY_FIELDS = List.of("id", "name");

    @Override
    public Value merge(Value lower, Value higher) {
        if (higher.isNull()) return Value.NULL;

        if (lower instanceof ObjectValue lo && higher instanceof ObjectValue hi) {
            return mergeObjects(lo, hi);
        }
        if (lower instanceof ArrayValue la && higher instanceof ArrayValue ha) {
            return mergeArrays(la, ha);
        }
        return materialize(higher);
    }

    private ObjectValue mergeObjects(ObjectValue lower, ObjectValue higher) {
        var out = new LinkedHashMap<String, Value>(lower.members());
        for (Map.Entry<String, Value> e : higher.members().entrySet()) {
            String key = e.getKey();
            Value hv = e.getValue();
            if (hv.isNull()) {
                // tombstone
                out.remove(key);
                continue;
            }
            Value lv = out.get(key);
            out.put(key, lv == null ? materialize(hv) : merge(lv, hv));
        }
        return new ObjectValue(out);
    }

    private Value mergeArrays(ArrayValue lower, ArrayValue higher) {
        Optional<Map<Object, Value>> lowerKeyed = keyed(lower);
        Optional<Map<Object, Value>> higherKeyed = keyed(higher);
        if (lowerKeyed.isEmpty() || higherKeyed.isEmpty()) {
            return materialize(higher);
        }

        Map<Object, Value> hiByKey = higherKeyed.get();
        var merged = new ArrayList<Value>(lower.size() + higher.size());
        for (Map.Entry<Object, Value> e : lowerKeyed.get().entrySet()) {
            Value hv = hiByKey.get(e.getKey());
            merged.add(hv == null ? e.getValue() : merge(e.getValue(), hv));
        }
        for (Map.Entry<Object, Value> e : hiByKey.entrySet()) {
            if (!lowerKeyed.get().containsKey(e.getKey())) {
                merged.add(materialize(e.getValue()));
            }
        }
        return new ArrayValue(merged);
    }

    /**
     * Index an array by element identity, preserving order. Empty if any element
     * is not an identifiable object or two elements share an identity.
     */
    private static Optional<Map<Object, Value>> keyed(ArrayValue array) {
        var byKey = new LinkedHashMap<Object, Value>(array.size() * 2);
        for (Value element : array.elements()) {
            if (!(element instanceof ObjectValue obj)) return Optional.empty();
            Optional<Object> identity = identityOf(obj);
            if (identity.isEmpty()) return Optional.empty();
            if (byKey.putIfAbsent(identity.get(), element) != null) return Optional.empty();
        }
        return Optional.of(byKey);
    }

    private static Optional<Object> identityOf(ObjectValue obj) {
        for (String field : IDENTITY_FIELDS) {
            Optional<Value> v = obj.get(field);
            if (v.isEmpty()) continue;
            // identity field present: it decides, even when unusable
            if (v.get() instanceof StringValue s) return Optional.of(new Identity(field, "s:" + s.value()));
            if (v.get() instanceof NumberValue n) return Optional.of(new Identity(field, "n:" + n.value().stripTrailingZeros().toPlainString()));
            return Optional.empty();
        }
        return Optional.empty();
    }

    /** Copy of {@code v} with null object members removed at every depth. */
    static Value materialize(Value v) {
        if (v instanceof ObjectValue obj) {
            var out = new LinkedHashMap<String, Value>(obj.size() * 2);
            obj.members().forEach((k, child) -> {
                if (!child.isNull()) out.put(k, materialize(child));
            });
            return new ObjectValue(out);
        }
        if (v instanceof ArrayValue arr && keyed(arr).isPresent()) {
            return new ArrayValue(arr.elements().stream().map(DeepMerger::materialize).toList());
        }
        return v;
    }

    private record Identity(String field, String value) {}
}
