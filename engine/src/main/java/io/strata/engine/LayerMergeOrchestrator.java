// file: engine/src/main/java/io/strata/engine/LayerMergeOrchestrator.java
package io.strata.engine;

import io.strata.core.ActiveContext;
import io.strata.core.Layer;
import io.strata.core.LayerCatalog;
import io.strata.core.conflict.ConflictArtifact;
import io.strata.core.merge.DeepMerger;
import io.strata.core.merge.TextMergeResult;
import io.strata.core.merge.TextMerger;
import io.strata.core.merge.ThreeWayTextMerger;
import io.strata.core.merge.ValueMerger;
import io.strata.core.value.Value;
import io.strata.engine.format.FileFormat;
import io.strata.engine.format.FormatAdapter;
import io.strata.engine.format.FormatAdapters;
import io.strata.engine.format.FormatException;
import io.strata.storage.ObjectStore;
import io.strata.storage.Oid;
import io.strata.storage.Trees;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes the effective file set for an {@link ActiveContext}.
 * <p>
 * Algorithm:
 *  1) Applicable layers in ascending precedence; a layer whose reference does not
 *     exist contributes nothing.
 *  2) Union of every file path in those layers' trees.
 *  3) Per path, fold the contributing layers lowest first:
 *      - one contributor: its bytes verbatim;
 *      - structured format: deep merge, higher wins;
 *      - text: three-way merge where step i uses the accumulator from before step i-1
 *        as base. The first conflict stops the fold; the layers not yet folded are
 *        kept in the conflict artifact.
 *  4) Parse failures are reported per path in {@link MergeReport#errors()}.
 * <p>
 * Read-only. Paths are folded in parallel when an executor is supplied; each fold
 * is sequential.
 */
public class LayerMergeOrchestrator {
    private static final Logger log = Logger.getLogger(LayerMergeOrchestrator.class.getName());

    private final ObjectStore store;
    private final ExecutorService executor;
    private final ValueMerger valueMerger = new DeepMerger();
    private final TextMerger textMerger = new ThreeWayTextMerger();

    /** Fold paths on the calling thread. */
    public LayerMergeOrchestrator(ObjectStore store) {
        this(store, null);
    }

    /**
     * @param executor pool for per-path folds, or null to fold on the calling thread;
     *                 not owned, the caller shuts it down
     */
    public LayerMergeOrchestrator(ObjectStore store, ExecutorService executor) {
        this.store = store;
        this.executor = executor;
    }

    /** One layer's copy of a path. */
    private record Contribution(Layer layer, Oid blob) {}

    /** Either a merged file or a format error for one path. */
    private record Folded(String path, MergedFile file, FormatException error) {}

    public MergeReport merge(ActiveContext context) {
        SortedMap<String, List<Contribution>> byPath = new TreeMap<>();
        for (Layer layer : LayerCatalog.applicableLayers(context)) {
            Optional<Oid> tree = store.readRef(layer.refName());
            if (tree.isEmpty()) {
                log.log(Level.FINE, "Layer " + layer + " has no reference; contributes nothing");
                continue;
            }
            for (Map.Entry<String, Oid> e : Trees.readFlat(store, tree.get()).entrySet()) {
                byPath.computeIfAbsent(e.getKey(), p -> new ArrayList<>()).add(new Contribution(layer, e.getValue()));
            }
        }

        List<Folded> folded = executor == null ? foldInline(byPath) : foldParallel(byPath);

        var files = new TreeMap<String, MergedFile>();
        var errors = new TreeMap<String, FormatException>();
        for (Folded f : folded) {
            if (f.error() != null) {
                log.log(Level.WARNING, "Skipping " + f.path() + ": " + f.error().getMessage());
                errors.put(f.path(), f.error());
            } else {
                files.put(f.path(), f.file());
            }
        }
        var report = new MergeReport(files, errors);
        log.log(Level.FINE, "Merged " + files.size() + " file(s) for " + context
                + "; conflicts=" + report.conflicted() + ", errors=" + errors.keySet());
        return report;
    }

    private List<Folded> foldInline(SortedMap<String, List<Contribution>> byPath) {
        var out = new ArrayList<Folded>(byPath.size());
        byPath.forEach((path, contributions) -> out.add(fold(path, contributions)));
        return out;
    }

    private List<Folded> foldParallel(SortedMap<String, List<Contribution>> byPath) {
        var futures = new ArrayList<Future<Folded>>(byPath.size());
        byPath.forEach((path, contributions) -> futures.add(executor.submit(() -> fold(path, contributions))));
        var out = new ArrayList<Folded>(futures.size());
        try {
            for (Future<Folded> f : futures) {
                out.add(f.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while merging layers", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new IllegalStateException("Layer merge failed", e.getCause());
        }
        return out;
    }

    private Folded fold(String path, List<Contribution> contributions) {
        FileFormat format = FileFormat.forPath(path);
        List<Layer> layers = contributions.stream().map(Contribution::layer).toList();
        try {
            MergedFile file = format.isStructured()
                    ? foldStructured(path, format, layers, contributions)
                    : foldText(path, layers, contributions);
            return new Folded(path, file, null);
        } catch (FormatException e) {
            return new Folded(path, null, e);
        }
    }

    private MergedFile foldStructured(String path, FileFormat format, List<Layer> layers, List<Contribution> contributions) {
        FormatAdapter adapter = FormatAdapters.require(format);
        byte[] first = store.readBlob(contributions.get(0).blob());
        Value acc = adapter.parse(path, first);
        if (contributions.size() == 1) {
            return new MergedFile(path, format, new MergedContent.Structured(acc), first, layers, null);
        }
        for (int i = 1; i < contributions.size(); i++) {
            Value next = adapter.parse(path, store.readBlob(contributions.get(i).blob()));
            acc = valueMerger.merge(acc, next);
        }
        return new MergedFile(path, format, new MergedContent.Structured(acc), adapter.serialize(path, acc), layers, null);
    }

    private MergedFile foldText(String path, List<Layer> layers, List<Contribution> contributions) {
        List<String> texts = new ArrayList<>(contributions.size());
        for (Contribution c : contributions) {
            texts.add(decode(path, store.readBlob(c.blob())));
        }
        if (texts.size() == 1) {
            return text(path, texts.get(0), layers, null);
        }

        String beforePrevious = texts.get(0);
        String acc = texts.get(0);
        for (int i = 1; i < texts.size(); i++) {
            TextMergeResult result = textMerger.merge(
                    beforePrevious, acc, texts.get(i), layers.get(i - 1).label(), layers.get(i).label());
            if (result.conflicted()) {
                var pending = new ArrayList<ConflictArtifact.PendingLayer>();
                for (int j = i + 1; j < texts.size(); j++) {
                    pending.add(new ConflictArtifact.PendingLayer(layers.get(j).label(), texts.get(j)));
                }
                var artifact = new ConflictArtifact(path, result.regions(), result.text(), pending);
                log.log(Level.FINE, "Conflict in " + path + " between " + layers.get(i - 1) + " and " + layers.get(i)
                        + (pending.isEmpty() ? "" : "; not folded: " + pending.size() + " layer(s)"));
                return text(path, result.text(), layers, artifact);
            }
            beforePrevious = acc;
            acc = result.text();
        }
        return text(path, acc, layers, null);
    }

    private static MergedFile text(String path, String text, List<Layer> layers, ConflictArtifact artifact) {
        return new MergedFile(path, FileFormat.TEXT, new MergedContent.Text(text),
                text.getBytes(StandardCharsets.UTF_8), layers, artifact);
    }

    private static String decode(String path, byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new FormatException(path, FileFormat.TEXT, "content is not valid UTF-8 text", e);
        }
    }
}
