// file: storage/src/main/java/io/strata/storage/Trees.java
package io.strata.storage;

import java.util.ArrayList;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Conversion between flat "a/b/c.json" path maps and nested tree objects.
 */
public final class Trees {

    private Trees() {
        // utility
    }

    /**
     * Write {@code files} (relative path to blob id) as nested trees and return the root id.
     * An empty map yields the empty tree.
     *
     * @throws IllegalArgumentException if a path is malformed or used both as file and directory
     */
    public static Oid writeFlat(ObjectStore store, Map<String, Oid> files) {
        var root = new Dir();
        for (var e : files.entrySet()) {
            String[] parts = splitPath(e.getKey());
            Dir dir = root;
            for (int i = 0; i < parts.length - 1; i++) {
                if (dir.files.containsKey(parts[i])) {
                    throw new IllegalArgumentException("Path is both file and directory: " + e.getKey());
                }
                dir = dir.dirs.computeIfAbsent(parts[i], k -> new Dir());
            }
            String leaf = parts[parts.length - 1];
            if (dir.dirs.containsKey(leaf)) {
                throw new IllegalArgumentException("Path is both file and directory: " + e.getKey());
            }
            dir.files.put(leaf, e.getValue());
        }
        return write(store, root);
    }

    /** Every blob reachable from {@code treeId}, keyed by its slash-separated path. */
    public static SortedMap<String, Oid> readFlat(ObjectStore store, Oid treeId) {
        var out = new TreeMap<String, Oid>();
        collect(store, treeId, "", out);
        return out;
    }

    /**
     * Split and validate a relative path.
     *
     * @throws IllegalArgumentException for absolute paths, empty segments, "." or ".."
     */
    public static String[] splitPath(String path) {
        if (path == null || path.isEmpty() || path.startsWith("/") || path.endsWith("/")) {
            throw new IllegalArgumentException("Invalid relative path: '" + path + "'");
        }
        String[] parts = path.split("/");
        for (String p : parts) {
            if (p.isEmpty() || p.equals(".") || p.equals("..")) {
                throw new IllegalArgumentException("Invalid relative path: '" + path + "'");
            }
        }
        return parts;
    }

    private static Oid write(ObjectStore store, Dir dir) {
        var entries = new ArrayList<TreeEntry>(dir.files.size() + dir.dirs.size());
        dir.files.forEach((name, id) -> entries.add(TreeEntry.blob(name, id)));
        dir.dirs.forEach((name, sub) -> entries.add(TreeEntry.tree(name, write(store, sub))));
        return store.writeTree(entries);
    }

    private static void collect(ObjectStore store, Oid treeId, String prefix, Map<String, Oid> out) {
        for (TreeEntry e : store.readTree(treeId)) {
            String path = prefix + e.name();
            if (e.kind() == TreeEntry.Kind.TREE) {
                collect(store, e.id(), path + "/", out);
            } else {
                out.put(path, e.id());
            }
        }
    }

    private static final class Dir {
        final TreeMap<String, Oid> files = new TreeMap<>();
        final TreeMap<String, Dir> dirs = new TreeMap<>();
    }
}
