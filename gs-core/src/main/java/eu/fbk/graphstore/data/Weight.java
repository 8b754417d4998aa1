package eu.fbk.graphstore.data;

import java.io.Serializable;

import javax.annotation.Nullable;

/**
 * An edge weight, in the closed interval [-1.0, 1.0].
 */
public final class Weight implements Comparable<Weight>, Serializable {

    public static final float MIN_VALUE = -1.0f;

    public static final float MAX_VALUE = 1.0f;

    private static final long serialVersionUID = 1L;

    private final float value;

    private Weight(final float value) {
        this.value = value;
    }

    /**
     * Returns the {@code Weight} for the value specified.
     * 
     * @param value
     *            the weight, between -1.0 and 1.0 (inclusive)
     * @return the corresponding {@code Weight}
     * @throws ValidationException
     *             with reason {@code INVALID_VALUE} if the value is NaN or out of range
     */
    public static Weight valueOf(final float value) throws ValidationException {
        if (!(value >= MIN_VALUE && value <= MAX_VALUE)) {
            throw new ValidationException(ValidationException.Reason.INVALID_VALUE,
                    "Weight out of range: " + value);
        }
        return new Weight(value);
    }

    public float getValue() {
        return this.value;
    }

    @Override
    public int compareTo(final Weight other) {
        return Float.compare(this.value, other.value);
    }

    @Override
    public boolean equals(@Nullable final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Weight)) {
            return false;
        }
        return Float.floatToIntBits(this.value) == Float.floatToIntBits(((Weight) object).value);
    }

    @Override
    public int hashCode() {
        return Float.floatToIntBits(this.value);
    }

    @Override
    public String toString() {
        return Float.toString(this.value);
    }

}
