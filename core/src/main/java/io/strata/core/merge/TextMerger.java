// file: core/src/main/java/io/strata/core/merge/TextMerger.java
package io.strata.core.merge;

/**
 * Three-way merge for unstructured text.
 */
public interface TextMerger {

    /**
     * Reconcile {@code ours} and {@code theirs}, which both derive from {@code base}.
     *
     * @param oursLabel   label written on the opening marker of each conflict
     * @param theirsLabel label written on the closing marker of each conflict
     */
    TextMergeResult merge(String base, String ours, String theirs, String oursLabel, String theirsLabel);

    default TextMergeResult merge(String base, String ours, String theirs) {
        return merge(base, ours, theirs, "ours", "theirs");
    }
}
