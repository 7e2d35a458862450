// file: storage/src/main/java/io/strata/storage/ObjectStore.java
package io.strata.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Content-addressed object storage plus a namespace of mutable named references.
 * <p>
 * Contract:
 *  - writeBlob()/writeTree() are idempotent: writing the same content twice yields the
 *    same id and is safe to retry.
 *  - Objects are immutable once written; reading an unknown id throws
 *    {@link ObjectMissingException}.
 *  - compareAndSwapRef() is atomic per reference. It never checks that the new id
 *    exists; callers that need that guarantee check {@link #contains(Oid)} first.
 */
public interface ObjectStore extends AutoCloseable {

    Oid writeBlob(byte[] content);

    byte[] readBlob(Oid id);

    /**
     * Write one tree level. Entry names must be unique; order of the input list
     * does not matter.
     */
    Oid writeTree(List<TreeEntry> entries);

    /** Direct children of a tree, in canonical order. */
    List<TreeEntry> readTree(Oid id);

    boolean contains(Oid id);

    Optional<Oid> readRef(String name);

    /**
     * Atomically move reference {@code name} from {@code expected} to {@code newId}.
     *
     * @param expected current value the reference must hold, or null if it must not exist
     * @param newId    value to set, or null to delete the reference
     * @return false if the reference did not hold {@code expected}
     */
    boolean compareAndSwapRef(String name, Oid expected, Oid newId);

    /** All references whose name starts with {@code prefix}, sorted by name. */
    Map<String, Oid> listRefs(String prefix);

    @Override
    default void close() {
    }
}
