package eu.fbk.graphstore.data;

import com.google.common.base.Preconditions;

/**
 * Signals that a value supplied to a value model factory is not acceptable.
 * <p>
 * This exception is thrown only when building values ({@link Type}, {@link Weight}) or deriving
 * identifiers from an {@link IdSpace}, and never by datastore operations: inputs are expected to
 * be validated before any storage call is attempted. The {@link Reason} attribute tells why the
 * value was rejected; the exception is always recoverable by rejecting the input.
 * </p>
 */
public class ValidationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Reason reason;

    /**
     * Creates a new instance with the reason and message specified.
     * 
     * @param reason
     *            the reason of the failure, not null
     * @param message
     *            a message describing the rejected value
     */
    public ValidationException(final Reason reason, final String message) {
        super(message);
        this.reason = Preconditions.checkNotNull(reason);
    }

    /**
     * Returns the reason why the value was rejected.
     * 
     * @return the reason
     */
    public Reason getReason() {
        return this.reason;
    }

    /** The reasons a value may be rejected for. */
    public enum Reason {

        /** The value is malformed or outside its domain. */
        INVALID_VALUE,

        /** The value exceeds the maximum length allowed. */
        VALUE_TOO_LONG,

        /** No identifier follows the given one in its identifier space. */
        CANNOT_INCREMENT_UUID

    }

}
