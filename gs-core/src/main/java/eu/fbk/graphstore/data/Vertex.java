package eu.fbk.graphstore.data;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A vertex.
 * <p>
 * Vertices represent the nouns of the datastore, e.g., a user or a movie. Every vertex has an
 * identifier and a {@link Type}. Two vertices are equal if they have the same identifier,
 * regardless of their type: the identifier is the identity of the vertex, while the type is
 * metadata attached to it.
 * </p>
 * 
 * @param <I>
 *            the identifier type
 */
public final class Vertex<I> {

    private final I id;

    private final Type type;

    /**
     * Creates a new vertex.
     * 
     * @param id
     *            the vertex identifier
     * @param type
     *            the vertex type
     */
    public Vertex(final I id, final Type type) {
        this.id = Preconditions.checkNotNull(id);
        this.type = Preconditions.checkNotNull(type);
    }

    public I getId() {
        return this.id;
    }

    public Type getType() {
        return this.type;
    }

    @Override
    public boolean equals(@Nullable final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Vertex)) {
            return false;
        }
        return this.id.equals(((Vertex<?>) object).id);
    }

    @Override
    public int hashCode() {
        return this.id.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("id", this.id).add("type", this.type)
                .toString();
    }

}
