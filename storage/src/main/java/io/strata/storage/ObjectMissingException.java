// file: storage/src/main/java/io/strata/storage/ObjectMissingException.java
package io.strata.storage;

/**
 * Thrown when an object id is read from a store that does not hold it,
 * or holds it with a different object type.
 */
public class ObjectMissingException extends RuntimeException {
    private final Oid id;

    public ObjectMissingException(Oid id, String message) {
        super(message + ": " + id);
        this.id = id;
    }

    public ObjectMissingException(Oid id, String message, Throwable cause) {
        super(message + ": " + id, cause);
        this.id = id;
    }

    public Oid id() {
        return id;
    }
}
