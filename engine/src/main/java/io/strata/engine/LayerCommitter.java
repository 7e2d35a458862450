// file: engine/src/main/java/io/strata/engine/LayerCommitter.java
package io.strata.engine;

import io.strata.core.Layer;
import io.strata.core.LayerKind;
import io.strata.storage.ObjectStore;
import io.strata.storage.Oid;
import io.strata.storage.Trees;
import io.strata.storage.tx.CommitOutcome;
import io.strata.storage.tx.Transaction;
import io.strata.storage.tx.TransactionManager;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns staged entries into new layer trees and moves every affected layer
 * reference in a single transaction.
 * <p>
 * For each target layer:
 *  - read the tree its reference points at (an absent reference is an empty layer),
 *  - overlay written files and drop removed ones,
 *  - write the new blobs and trees,
 *  - queue a move from the tree that was read (or "must not exist") to the new tree.
 * A layer whose tree comes out unchanged is left out of the transaction.
 * <p>
 * A concurrent writer to the same layer between the read and the commit makes the
 * commit abort with a stale reference; nothing is applied and the caller may retry.
 */
public class LayerCommitter {
    private static final Logger log = Logger.getLogger(LayerCommitter.class.getName());

    private final ObjectStore store;
    private final TransactionManager transactions;

    public LayerCommitter(ObjectStore store, TransactionManager transactions) {
        this.store = store;
        this.transactions = transactions;
    }

    /**
     * @throws IllegalArgumentException if an entry targets the derived workspace layer, a path is
     *                                  staged twice for the same layer, or a path would be both a
     *                                  file and a directory
     */
    public CommitOutcome commit(List<StagedEntry> entries) {
        Map<Layer, Map<String, StagedEntry>> byLayer = new LinkedHashMap<>();
        for (StagedEntry entry : entries) {
            if (entry.target().kind() == LayerKind.WORKSPACE_ACTIVE) {
                throw new IllegalArgumentException("The workspace layer is derived and cannot be committed to: " + entry.path());
            }
            var forLayer = byLayer.computeIfAbsent(entry.target(), l -> new TreeMap<>());
            if (forLayer.putIfAbsent(entry.path(), entry) != null) {
                throw new IllegalArgumentException("Path staged twice for " + entry.target().label() + ": " + entry.path());
            }
        }

        Transaction tx = transactions.begin();
        Set<String> touched = new HashSet<>();
        for (var e : byLayer.entrySet()) {
            Layer layer = e.getKey();
            Optional<Oid> current = store.readRef(layer.refName());
            Map<String, Oid> files = new TreeMap<>(current.isPresent() ? Trees.readFlat(store, current.get()) : Map.of());
            for (StagedEntry staged : e.getValue().values()) {
                if (staged.isRemoval()) {
                    files.remove(staged.path());
                } else {
                    files.put(staged.path(), store.writeBlob(staged.content()));
                }
            }
            if (current.isEmpty() && files.isEmpty()) {
                log.log(Level.FINE, "Nothing to remove from absent layer " + layer.label());
                continue;
            }
            Oid next = Trees.writeFlat(store, files);
            if (current.isPresent() && current.get().equals(next)) {
                log.log(Level.FINE, "No change for layer " + layer.label());
                continue;
            }
            tx.add(layer.refName(), current.orElse(null), next);
            touched.add(layer.label());
        }

        CommitOutcome outcome = tx.commit();
        if (outcome.isCommitted()) {
            log.log(Level.INFO, "Committed " + entries.size() + " staged entr" + (entries.size() == 1 ? "y" : "ies")
                    + " to " + touched.size() + " layer(s) in " + outcome.txId());
        }
        return outcome;
    }
}
