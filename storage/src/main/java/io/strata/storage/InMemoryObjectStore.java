// file: storage/src/main/java/io/strata/storage/InMemoryObjectStore.java
package io.strata.storage;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe, non-durable object store.
 * <p>
 * Ids are SHA-1 over the same type-tagged encoding Git uses ("blob N\0..." and
 * "tree N\0..."), so an object written here has the same id it would get in
 * {@link JGitObjectStore}.
 * <p>
 * Intended for tests and for callers that rebuild state on every start.
 */
public class InMemoryObjectStore implements ObjectStore {
    private static final HexFormat HEX = HexFormat.of();

    private final Map<Oid, byte[]> blobs = new ConcurrentHashMap<>();
    private final Map<Oid, List<TreeEntry>> trees = new ConcurrentHashMap<>();
    private final Map<String, Oid> refs = new ConcurrentHashMap<>();

    @Override
    public Oid writeBlob(byte[] content) {
        Oid id = hash("blob", content);
        blobs.putIfAbsent(id, content.clone());
        return id;
    }

    @Override
    public byte[] readBlob(Oid id) {
        byte[] b = blobs.get(id);
        if (b == null) throw new ObjectMissingException(id, "No such blob");
        return b.clone();
    }

    @Override
    public Oid writeTree(List<TreeEntry> entries) {
        List<TreeEntry> sorted = canonical(entries);
        var body = new ByteArrayOutputStream();
        for (TreeEntry e : sorted) {
            String mode = e.kind() == TreeEntry.Kind.TREE ? "40000" : "100644";
            body.writeBytes((mode + " " + e.name()).getBytes(StandardCharsets.UTF_8));
            body.write(0);
            body.writeBytes(HEX.parseHex(e.id().hex()));
        }
        Oid id = hash("tree", body.toByteArray());
        trees.putIfAbsent(id, sorted);
        return id;
    }

    @Override
    public List<TreeEntry> readTree(Oid id) {
        List<TreeEntry> t = trees.get(id);
        if (t == null) throw new ObjectMissingException(id, "No such tree");
        return t;
    }

    @Override
    public boolean contains(Oid id) {
        return blobs.containsKey(id) || trees.containsKey(id);
    }

    @Override
    public Optional<Oid> readRef(String name) {
        return Optional.ofNullable(refs.get(name));
    }

    @Override
    public boolean compareAndSwapRef(String name, Oid expected, Oid newId) {
        checkRefName(name);
        if (newId == null) {
            return expected == null ? !refs.containsKey(name) : refs.remove(name, expected);
        }
        if (expected == null) {
            return refs.putIfAbsent(name, newId) == null;
        }
        return refs.replace(name, expected, newId);
    }

    @Override
    public Map<String, Oid> listRefs(String prefix) {
        SortedMap<String, Oid> out = new TreeMap<>();
        refs.forEach((k, v) -> {
            if (k.startsWith(prefix)) out.put(k, v);
        });
        return out;
    }

    static List<TreeEntry> canonical(List<TreeEntry> entries) {
        var names = new HashSet<String>();
        for (TreeEntry e : entries) {
            if (!names.add(e.name())) {
                throw new IllegalArgumentException("Duplicate tree entry: " + e.name());
            }
        }
        var sorted = new ArrayList<>(entries);
        sorted.sort(TreeEntry.CANONICAL_ORDER);
        return List.copyOf(sorted);
    }

    static void checkRefName(String name) {
        if (name == null || !name.startsWith("refs/") || name.endsWith("/")
                || name.contains("//") || name.contains("..") || name.contains(" ")) {
            throw new IllegalArgumentException("Invalid reference name: " + name);
        }
    }

    private static Oid hash(String type, byte[] content) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            sha1.update((type + " " + content.length).getBytes(StandardCharsets.US_ASCII));
            sha1.update((byte) 0);
            sha1.update(content);
            return Oid.of(HEX.formatHex(sha1.digest()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 unavailable", e);
        }
    }
}
