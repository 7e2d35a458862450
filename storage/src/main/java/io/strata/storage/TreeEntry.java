// file: storage/src/main/java/io/strata/storage/TreeEntry.java
package io.strata.storage;

import java.util.Comparator;
import java.util.Objects;

/**
 * One named child of a tree object: either a file blob or a nested tree.
 */
public record TreeEntry(String name, Oid id, Kind kind) {

    public enum Kind { BLOB, TREE }

    /**
     * Canonical entry order: by name, with tree names compared as if
     * they ended in '/'. Both store implementations hash entries in this order.
     */
    public static final Comparator<TreeEntry> CANONICAL_ORDER = Comparator.comparing(TreeEntry::sortKey);

    public TreeEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        if (name.isEmpty() || name.equals(".") || name.equals("..") || name.indexOf('/') >= 0 || name.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Invalid tree entry name: '" + name + "'");
        }
    }

    public static TreeEntry blob(String name, Oid id) {
        return new TreeEntry(name, id, Kind.BLOB);
    }

    public static TreeEntry tree(String name, Oid id) {
        return new TreeEntry(name, id, Kind.TREE);
    }

    private String sortKey() {
        return kind == Kind.TREE ? name + "/" : name;
    }
}
