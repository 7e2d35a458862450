// file: engine/src/main/java/io/strata/engine/WorkspaceApplier.java
package io.strata.engine;

import io.strata.core.Layer;
import io.strata.core.conflict.ConflictArtifact;
import io.strata.storage.ObjectStore;
import io.strata.storage.Oid;
import io.strata.storage.Trees;
import io.strata.storage.tx.TransactionManager;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Materializes a {@link MergeReport} into a directory and records the result as the
 * workspace layer.
 * <p>
 * Per file:
 *  - clean: written to its path via a temp file in the same directory, then moved
 *    over the target; a leftover conflict sidecar is deleted;
 *  - conflicted: the target is left untouched, the artifact text goes to
 *    {@code <path>.strata-conflict} and each layer that was not folded goes to
 *    {@code <path>.strata-conflict.<label>};
 *  - failed to parse: left untouched, and still tracked.
 * <p>
 * The workspace tree records every file this class wrote, sidecars included. On the
 * next apply, a recorded file that is not written again is deleted; when the path it
 * belongs to is no longer merged at all, the target is deleted with it.
 * <p>
 * The workspace reference is moved through a transaction expecting the tree read at
 * the start, so two concurrent applies cannot both record their result.
 */
public class WorkspaceApplier {
    private static final Logger log = Logger.getLogger(WorkspaceApplier.class.getName());

    private final ObjectStore store;
    private final TransactionManager transactions;

    public WorkspaceApplier(ObjectStore store, TransactionManager transactions) {
        this.store = store;
        this.transactions = transactions;
    }

    /**
     * @throws UncheckedIOException                              if the directory cannot be written
     * @throws io.strata.storage.tx.TransactionAbortedException if the workspace reference moved concurrently
     */
    public ApplyResult apply(MergeReport report, Path dir) {
        String ref = Layer.workspace().refName();
        Optional<Oid> previous = store.readRef(ref);
        SortedMap<String, Oid> tracked = previous.isPresent() ? Trees.readFlat(store, previous.get()) : new TreeMap<>();

        var written = new ArrayList<String>();
        var conflicted = new ArrayList<String>();
        var recorded = new TreeMap<String, Oid>();

        for (MergedFile file : report.files().values()) {
            Optional<ConflictArtifact> artifact = file.artifact();
            if (artifact.isPresent()) {
                String sidecar = ConflictArtifact.artifactPath(file.path());
                recorded.put(sidecar, write(dir, sidecar, artifact.get().text()));
                for (ConflictArtifact.PendingLayer pending : artifact.get().pending()) {
                    String pendingPath = ConflictArtifact.pendingPath(file.path(), pending.label());
                    recorded.put(pendingPath, write(dir, pendingPath, pending.content()));
                }
                conflicted.add(file.path());
                continue;
            }
            byte[] bytes = file.bytes();
            writeAtomically(resolve(dir, file.path()), bytes);
            deleteIfExists(resolve(dir, ConflictArtifact.artifactPath(file.path())));
            recorded.put(file.path(), store.writeBlob(bytes));
            written.add(file.path());
        }

        // files of paths that failed to parse stay as they are
        tracked.forEach((path, id) -> {
            if (report.errors().containsKey(ownerOf(path))) recorded.putIfAbsent(path, id);
        });

        var removed = new TreeSet<String>();
        for (String path : tracked.keySet()) {
            if (recorded.containsKey(path) || conflicted.contains(path)) continue;
            deleteIfExists(resolve(dir, path));
            String owner = ownerOf(path);
            if (!report.files().containsKey(owner) && !report.errors().containsKey(owner)) {
                deleteIfExists(resolve(dir, owner));
                deleteIfExists(resolve(dir, ConflictArtifact.artifactPath(owner)));
                removed.add(owner);
            }
        }

        Oid tree = Trees.writeFlat(store, recorded);
        if (previous.isEmpty() || !previous.get().equals(tree)) {
            transactions.begin().add(ref, previous.orElse(null), tree).commitOrThrow();
        }
        log.log(Level.INFO, "Applied workspace to " + dir + ": written=" + written.size()
                + ", conflicted=" + conflicted + ", removed=" + removed.size());
        return new ApplyResult(written, conflicted, List.copyOf(removed), tree);
    }

    /** The merged path a recorded file belongs to: itself, or the target of a sidecar. */
    private static String ownerOf(String recordedPath) {
        return ConflictArtifact.targetOf(recordedPath).orElse(recordedPath);
    }

    private Oid write(Path dir, String relative, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        writeAtomically(resolve(dir, relative), bytes);
        return store.writeBlob(bytes);
    }

    private static Path resolve(Path dir, String relative) {
        Path target = dir;
        for (String part : Trees.splitPath(relative)) {
            target = target.resolve(part);
        }
        return target;
    }

    private static void writeAtomically(Path target, byte[] bytes) {
        try {
            Path parent = target.getParent();
            Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
            try {
                Files.write(tmp, bytes);
                try {
                    Files.move(tmp, target, ATOMIC_MOVE, REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, target, REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }

    private static void deleteIfExists(Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                log.log(Level.FINE, "Deleted " + path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + path, e);
        }
    }
}
