package eu.fbk.graphstore.datastore;

import java.io.IOException;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Signals the failure of a datastore operation.
 * <p>
 * Every failure occurring inside a {@link Datastore} or {@link Transaction}, whatever its origin
 * (storage engine, serialization, network), is reported to the caller as a
 * {@code DatastoreException} of one of the {@link Kind}s below. The backend-specific cause, if
 * any, is preserved as the exception cause. The kind does not depend on where the failure
 * occurred: a failure raised by a remote datastore is reported with the same kind it had on the
 * server.
 * </p>
 */
public class DatastoreException extends IOException {

    private static final long serialVersionUID = 1L;

    private final Kind kind;

    /**
     * Creates a new instance with the kind, message and optional cause specified.
     * 
     * @param kind
     *            the kind of failure, not null
     * @param message
     *            a message describing the failure
     * @param cause
     *            the optional cause of the failure
     */
    public DatastoreException(final Kind kind, final String message,
            @Nullable final Throwable cause) {
        super(message, cause);
        this.kind = Preconditions.checkNotNull(kind);
    }

    /**
     * Creates a new instance with the kind and message specified.
     * 
     * @param kind
     *            the kind of failure, not null
     * @param message
     *            a message describing the failure
     */
    public DatastoreException(final Kind kind, final String message) {
        this(kind, message, null);
    }

    public static DatastoreException serialization(final String message,
            @Nullable final Throwable cause) {
        return new DatastoreException(Kind.SERIALIZATION, message, cause);
    }

    public static DatastoreException storage(final String message,
            @Nullable final Throwable cause) {
        return new DatastoreException(Kind.STORAGE, message, cause);
    }

    public static DatastoreException uuidTaken(final Object id) {
        return new DatastoreException(Kind.UUID_TAKEN, "UUID already taken: " + id);
    }

    /**
     * Returns the kind of this failure.
     * 
     * @return the kind
     */
    public Kind getKind() {
        return this.kind;
    }

    /** The kinds of datastore failure. */
    public enum Kind {

        /** A request, response or stored value could not be encoded or decoded. */
        SERIALIZATION,

        /** The storage engine or the transport failed. */
        STORAGE,

        /** A vertex creation targeted an identifier already bound to a vertex. */
        UUID_TAKEN

    }

}
