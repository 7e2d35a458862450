// file: storage/src/main/java/io/strata/storage/JGitObjectStore.java
package io.strata.storage;

import org.eclipse.jgit.errors.IncorrectObjectTypeException;
import org.eclipse.jgit.errors.MissingObjectException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectInserter;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.lib.TreeFormatter;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.TreeWalk;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Object store backed by a bare Git repository.
 * <p>
 * Blobs and trees are ordinary Git objects. References live under {@code refs/} and
 * point directly at tree ids (there are no commits). Compare-and-swap uses JGit's
 * {@link RefUpdate} with an expected old id, which takes the ref's lock file.
 */
public class JGitObjectStore implements ObjectStore {
    private static final Logger log = Logger.getLogger(JGitObjectStore.class.getName());

    private final Repository repo;

    private JGitObjectStore(Repository repo) {
        this.repo = repo;
    }

    /** Open the bare repository at {@code gitDir}, creating it if it does not exist yet. */
    public static JGitObjectStore open(Path gitDir) {
        try {
            Repository repo = new FileRepositoryBuilder()
                    .setGitDir(gitDir.toFile())
                    .setBare()
                    .build();
            if (!repo.getObjectDatabase().exists()) {
                repo.create(true);
                log.log(Level.INFO, "Created object repository at " + gitDir);
            }
            return new JGitObjectStore(repo);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open object repository at " + gitDir, e);
        }
    }

    @Override
    public Oid writeBlob(byte[] content) {
        try (ObjectInserter ins = repo.newObjectInserter()) {
            ObjectId id = ins.insert(Constants.OBJ_BLOB, content);
            ins.flush();
            return Oid.of(id.name());
        } catch (IOException e) {
            throw new UncheckedIOException("Blob write failed", e);
        }
    }

    @Override
    public byte[] readBlob(Oid id) {
        try (ObjectReader reader = repo.newObjectReader()) {
            return reader.open(toObjectId(id), Constants.OBJ_BLOB).getBytes();
        } catch (MissingObjectException | IncorrectObjectTypeException e) {
            throw new ObjectMissingException(id, "No such blob", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Blob read failed: " + id, e);
        }
    }

    @Override
    public Oid writeTree(List<TreeEntry> entries) {
        var formatter = new TreeFormatter();
        for (TreeEntry e : InMemoryObjectStore.canonical(entries)) {
            FileMode mode = e.kind() == TreeEntry.Kind.TREE ? FileMode.TREE : FileMode.REGULAR_FILE;
            formatter.append(e.name(), mode, toObjectId(e.id()));
        }
        try (ObjectInserter ins = repo.newObjectInserter()) {
            ObjectId id = ins.insert(formatter);
            ins.flush();
            return Oid.of(id.name());
        } catch (IOException e) {
            throw new UncheckedIOException("Tree write failed", e);
        }
    }

    @Override
    public List<TreeEntry> readTree(Oid id) {
        var out = new ArrayList<TreeEntry>();
        try (TreeWalk walk = new TreeWalk(repo)) {
            walk.addTree(toObjectId(id));
            walk.setRecursive(false);
            while (walk.next()) {
                boolean isTree = (walk.getRawMode(0) & FileMode.TYPE_MASK) == FileMode.TYPE_TREE;
                Oid child = Oid.of(walk.getObjectId(0).name());
                out.add(isTree ? TreeEntry.tree(walk.getNameString(), child) : TreeEntry.blob(walk.getNameString(), child));
            }
        } catch (MissingObjectException | IncorrectObjectTypeException e) {
            throw new ObjectMissingException(id, "No such tree", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Tree read failed: " + id, e);
        }
        return out;
    }

    @Override
    public boolean contains(Oid id) {
        try {
            return repo.getObjectDatabase().has(toObjectId(id));
        } catch (IOException e) {
            throw new UncheckedIOException("Object lookup failed: " + id, e);
        }
    }

    @Override
    public Optional<Oid> readRef(String name) {
        try {
            Ref ref = repo.exactRef(name);
            if (ref == null || ref.getObjectId() == null) return Optional.empty();
            return Optional.of(Oid.of(ref.getObjectId().name()));
        } catch (IOException e) {
            throw new UncheckedIOException("Reference read failed: " + name, e);
        }
    }

    @Override
    public boolean compareAndSwapRef(String name, Oid expected, Oid newId) {
        if (!Repository.isValidRefName(name)) {
            throw new IllegalArgumentException("Invalid reference name: " + name);
        }
        try {
            if (newId == null && expected == null) {
                return repo.exactRef(name) == null;
            }
            RefUpdate update = repo.updateRef(name);
            update.setExpectedOldObjectId(expected == null ? ObjectId.zeroId() : toObjectId(expected));
            update.setForceUpdate(true);
            RefUpdate.Result result;
            if (newId == null) {
                result = update.delete();
            } else {
                update.setNewObjectId(toObjectId(newId));
                result = update.update();
            }
            switch (result) {
                case NEW, FORCED, FAST_FORWARD, NO_CHANGE:
                    return true;
                case LOCK_FAILURE, REJECTED:
                    log.log(Level.FINE, "Reference swap refused for " + name + ": " + result);
                    return false;
                default:
                    throw new IllegalStateException("Unexpected reference update result for " + name + ": " + result);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Reference update failed: " + name, e);
        }
    }

    @Override
    public Map<String, Oid> listRefs(String prefix) {
        var out = new TreeMap<String, Oid>();
        try {
            for (Ref ref : repo.getRefDatabase().getRefsByPrefix(prefix)) {
                if (ref.getObjectId() != null) {
                    out.put(ref.getName(), Oid.of(ref.getObjectId().name()));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Reference listing failed: " + prefix, e);
        }
        return out;
    }

    @Override
    public void close() {
        repo.close();
    }

    private static ObjectId toObjectId(Oid id) {
        return ObjectId.fromString(id.hex());
    }
}
