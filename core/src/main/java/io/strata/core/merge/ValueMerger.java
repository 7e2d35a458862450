// file: core/src/main/java/io/strata/core/merge/ValueMerger.java
package io.strata.core.merge;

import io.strata.core.value.Value;

/**
 * Pure function that combines two structured values from layers of different
 * precedence. The higher layer wins.
 * <p>
 * Implementations never fail and never report conflicts: any two values
 * produce a merged value.
 */
public interface ValueMerger {

    /**
     * Merge {@code higher} on top of {@code lower}.
     *
     * @param lower  content accumulated from lower-precedence layers
     * @param higher content of the next higher-precedence layer
     * @return a fresh merged tree; neither input is modified
     */
    Value merge(Value lower, Value higher);
}
