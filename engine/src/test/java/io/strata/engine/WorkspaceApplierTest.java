// file: engine/src/test/java/io/strata/engine/WorkspaceApplierTest.java
package io.strata.engine;

import io.strata.core.ActiveContext;
import io.strata.core.Layer;
import io.strata.core.LayerKind;
import io.strata.core.conflict.ConflictArtifact;
import io.strata.storage.FileWal;
import io.strata.storage.InMemoryObjectStore;
import io.strata.storage.Trees;
import io.strata.storage.tx.RefLockTable;
import io.strata.storage.tx.TransactionJournal;
import io.strata.storage.tx.TransactionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceApplierTest {

    private static final ActiveContext CONTEXT = ActiveContext.of(null, null, "api");
    private static final Layer GLOBAL = Layer.global();
    private static final Layer PROJECT = new Layer(LayerKind.PROJECT_BASE, null, null, "api");

    @TempDir Path tmp;

    private final InMemoryObjectStore store = new InMemoryObjectStore();
    private TransactionJournal journal;
    private LayerCommitter committer;
    private LayerMergeOrchestrator orchestrator;
    private WorkspaceApplier applier;
    private Path workspace;

    @BeforeEach
    void setUp() {
        journal = new TransactionJournal(new FileWal(tmp.resolve("journal"), 1L << 20));
        var tm = new TransactionManager(store, journal, new RefLockTable(), Duration.ofSeconds(1));
        committer = new LayerCommitter(store, tm);
        orchestrator = new LayerMergeOrchestrator(store);
        applier = new WorkspaceApplier(store, tm);
        workspace = tmp.resolve("ws");
    }

    @AfterEach
    void tearDown() {
        journal.close();
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private void write(Layer layer, String path, String content) {
        assertTrue(committer.commit(List.of(StagedEntry.write(layer, path, utf8(content)))).isCommitted());
    }

    private ApplyResult apply() {
        return applier.apply(orchestrator.merge(CONTEXT), workspace);
    }

    @Test
    void clean_files_are_written_and_recorded_as_workspace_tree() throws Exception {
        write(GLOBAL, "config.json", "{\"timeout\":30,\"retries\":3}");
        write(PROJECT, "config.json", "{\"timeout\":5}");
        write(PROJECT, "docs/readme.md", "hello\n");

        ApplyResult result = apply();

        assertEquals(List.of("config.json", "docs/readme.md"), result.written());
        assertTrue(result.conflicted().isEmpty());
        assertEquals("hello\n", Files.readString(workspace.resolve("docs/readme.md")));
        assertTrue(Files.readString(workspace.resolve("config.json")).contains("\"retries\""));
        assertEquals(result.workspace(), store.readRef(Layer.workspace().refName()).orElseThrow());
        assertEquals(Set.of("config.json", "docs/readme.md"), Trees.readFlat(store, result.workspace()).keySet());
    }

    @Test
    void conflicted_file_goes_to_a_sidecar_and_target_is_untouched() throws Exception {
        write(GLOBAL, "notes.txt", "x\ny\nz");
        apply();
        write(PROJECT, "notes.txt", "x\nY1\nz");
        write(Layer.machineLocal(), "notes.txt", "x\nY2\nz");

        ApplyResult result = applier.apply(orchestrator.merge(CONTEXT.withMachineLocal(true)), workspace);

        assertEquals(List.of("notes.txt"), result.conflicted());
        assertEquals("x\ny\nz", Files.readString(workspace.resolve("notes.txt")));
        String sidecar = Files.readString(workspace.resolve("notes.txt" + ConflictArtifact.FILE_SUFFIX));
        assertTrue(sidecar.contains("<<<<<<< project-base/api"), sidecar);
        assertTrue(sidecar.contains(">>>>>>> machine-local"), sidecar);
        assertFalse(Trees.readFlat(store, result.workspace()).containsKey("notes.txt"));
        assertTrue(result.removed().isEmpty());
    }

    @Test
    void resolved_file_clears_its_stale_sidecar() throws Exception {
        write(GLOBAL, "notes.txt", "x\ny\nz");
        write(PROJECT, "notes.txt", "x\nY1\nz");
        write(Layer.machineLocal(), "notes.txt", "x\nY2\nz");
        applier.apply(orchestrator.merge(CONTEXT.withMachineLocal(true)), workspace);
        Path sidecar = workspace.resolve("notes.txt" + ConflictArtifact.FILE_SUFFIX);
        assertTrue(Files.exists(sidecar));

        ApplyResult result = apply();

        assertEquals(List.of("notes.txt"), result.written());
        assertEquals("x\nY1\nz", Files.readString(workspace.resolve("notes.txt")));
        assertFalse(Files.exists(sidecar));
    }

    @Test
    void files_no_longer_merged_are_removed() {
        write(GLOBAL, "a.txt", "a\n");
        write(GLOBAL, "b.txt", "b\n");
        apply();
        assertTrue(committer.commit(List.of(StagedEntry.remove(GLOBAL, "b.txt"))).isCommitted());

        ApplyResult result = apply();

        assertEquals(List.of("b.txt"), result.removed());
        assertTrue(Files.exists(workspace.resolve("a.txt")));
        assertFalse(Files.exists(workspace.resolve("b.txt")));
    }

    @Test
    void files_that_fail_to_parse_are_left_in_place() throws Exception {
        write(GLOBAL, "c.json", "{\"a\":1}");
        apply();
        write(PROJECT, "c.json", "{broken");

        ApplyResult result = apply();

        assertTrue(result.removed().isEmpty());
        assertTrue(result.written().isEmpty());
        assertTrue(Files.readString(workspace.resolve("c.json")).contains("\"a\":1"));
    }

    @Test
    void reapplying_the_same_merge_keeps_the_workspace_reference() {
        write(GLOBAL, "a.txt", "a\n");
        ApplyResult first = apply();

        ApplyResult second = apply();

        assertEquals(first.workspace(), second.workspace());
        assertEquals(first.workspace(), store.readRef(Layer.workspace().refName()).orElseThrow());
    }

    @Test
    void path_removed_while_conflicted_leaves_nothing_behind() {
        ActiveContext all = CONTEXT.withMachineLocal(true);
        write(GLOBAL, "n.txt", "x\ny\nz");
        applier.apply(orchestrator.merge(all), workspace);
        write(PROJECT, "n.txt", "x\nY1\nz");
        write(Layer.machineLocal(), "n.txt", "x\nY2\nz");
        assertEquals(List.of("n.txt"), applier.apply(orchestrator.merge(all), workspace).conflicted());
        Path sidecar = workspace.resolve("n.txt" + ConflictArtifact.FILE_SUFFIX);
        assertTrue(Files.exists(sidecar));

        assertTrue(committer.commit(List.of(
                StagedEntry.remove(GLOBAL, "n.txt"),
                StagedEntry.remove(PROJECT, "n.txt"),
                StagedEntry.remove(Layer.machineLocal(), "n.txt"))).isCommitted());
        ApplyResult result = applier.apply(orchestrator.merge(all), workspace);

        assertEquals(List.of("n.txt"), result.removed());
        assertFalse(Files.exists(workspace.resolve("n.txt")));
        assertFalse(Files.exists(sidecar));
        assertTrue(Trees.readFlat(store, result.workspace()).isEmpty());
    }

    @Test
    void layers_not_folded_are_written_next_to_the_sidecar() throws Exception {
        ActiveContext tool = ActiveContext.of("claude", null, "api");
        Layer toolBase = new Layer(LayerKind.TOOL_BASE, "claude", null, null);
        Layer toolProject = new Layer(LayerKind.TOOL_PROJECT, "claude", null, "api");
        write(GLOBAL, "n.txt", "x\ny\nz");
        write(toolBase, "n.txt", "x\nY1\nz");
        write(toolProject, "n.txt", "x\nY2\nz");
        write(PROJECT, "n.txt", "tail\n");

        ApplyResult result = applier.apply(orchestrator.merge(tool), workspace);

        Path pending = workspace.resolve(ConflictArtifact.pendingPath("n.txt", "project-base/api"));
        assertEquals("n.txt.strata-conflict.project-base.api", pending.getFileName().toString());
        assertEquals("tail\n", Files.readString(pending));
        assertEquals(Set.of("n.txt.strata-conflict", "n.txt.strata-conflict.project-base.api"),
                Trees.readFlat(store, result.workspace()).keySet());

        // once the conflict is gone the pending copy is cleaned up
        assertTrue(committer.commit(List.of(StagedEntry.write(toolProject, "n.txt", utf8("x\nY1\nz")))).isCommitted());
        applier.apply(orchestrator.merge(tool), workspace);

        assertFalse(Files.exists(pending));
        assertFalse(Files.exists(workspace.resolve("n.txt" + ConflictArtifact.FILE_SUFFIX)));
        assertEquals("tail\n", Files.readString(workspace.resolve("n.txt")));
    }
}
