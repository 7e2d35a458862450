// file: core/src/main/java/io/strata/core/LayerCatalog.java
package io.strata.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves which layers take part in a merge for a given context.
 */
public final class LayerCatalog {

    private LayerCatalog() {
        // utility
    }

    /**
     * Filter the kind catalog to the kinds whose required identifiers are all present
     * in {@code context}, ascending by precedence. The derived workspace kind is never
     * included. An empty context yields only the global layer.
     */
    public static List<Layer> applicableLayers(ActiveContext context) {
        List<Layer> layers = new ArrayList<>();
        for (LayerKind kind : LayerKind.values()) {
            if (kind.isApplicable(context)) {
                layers.add(Layer.of(kind, context));
            }
        }
        return List.copyOf(layers);
    }
}
