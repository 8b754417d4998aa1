package eu.fbk.graphstore.data;

import java.io.Serializable;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * A vertex or edge type.
 * <p>
 * Types are short identifiers classifying vertices and edges: they must be at most
 * {@link #MAX_LENGTH} characters long and can only contain letters, digits, dashes and
 * underscores. Instances are immutable and compared by value.
 * </p>
 */
public final class Type implements Comparable<Type>, Serializable {

    /** The maximum number of characters of a type. */
    public static final int MAX_LENGTH = 255;

    private static final long serialVersionUID = 1L;

    private static final Pattern VALIDATOR = Pattern.compile("^[a-zA-Z0-9-_]+$");

    private final String value;

    private Type(final String value) {
        this.value = value;
    }

    /**
     * Returns the {@code Type} for the string specified, after validating it.
     * 
     * @param value
     *            the type string
     * @return the corresponding {@code Type}
     * @throws ValidationException
     *             with reason {@code VALUE_TOO_LONG} if the string is longer than
     *             {@link #MAX_LENGTH}, or {@code INVALID_VALUE} if it is empty or contains
     *             characters other than letters, digits, dashes and underscores
     */
    public static Type valueOf(final String value) throws ValidationException {
        Preconditions.checkNotNull(value);
        if (value.length() > MAX_LENGTH) {
            throw new ValidationException(ValidationException.Reason.VALUE_TOO_LONG,
                    "Type is too long (" + value.length() + " characters)");
        }
        if (!VALIDATOR.matcher(value).matches()) {
            throw new ValidationException(ValidationException.Reason.INVALID_VALUE,
                    "Invalid type '" + value + "'");
        }
        return new Type(value);
    }

    /**
     * Returns the type string.
     * 
     * @return the type string
     */
    public String getValue() {
        return this.value;
    }

    @Override
    public int compareTo(final Type other) {
        return this.value.compareTo(other.value);
    }

    @Override
    public boolean equals(@Nullable final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Type)) {
            return false;
        }
        return this.value.equals(((Type) object).value);
    }

    @Override
    public int hashCode() {
        return this.value.hashCode();
    }

    @Override
    public String toString() {
        return this.value;
    }

}
