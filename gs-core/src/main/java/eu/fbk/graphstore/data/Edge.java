package eu.fbk.graphstore.data;

import java.time.Instant;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * An edge.
 * <p>
 * Edges represent verbs or relationships, e.g., "liked" or "reviewed". Edges are typed, weighted
 * and directed, and carry the UTC instant of their last update. Two edges are equal if they have
 * the same {@link EdgeKey}: weight and update instant are payload and do not take part in
 * equality.
 * </p>
 * 
 * @param <I>
 *            the identifier type
 */
public final class Edge<I> {

    private final EdgeKey<I> key;

    private final Weight weight;

    private final Instant updated;

    private Edge(final EdgeKey<I> key, final Weight weight, final Instant updated) {
        this.key = Preconditions.checkNotNull(key);
        this.weight = Preconditions.checkNotNull(weight);
        this.updated = Preconditions.checkNotNull(updated);
    }

    /**
     * Creates a new edge with the key, weight and update instant specified.
     * 
     * @param key
     *            the edge key
     * @param weight
     *            the edge weight
     * @param updated
     *            the instant of the last update
     * @param <I>
     *            the identifier type
     * @return the created edge
     */
    public static <I> Edge<I> create(final EdgeKey<I> key, final Weight weight,
            final Instant updated) {
        return new Edge<I>(key, weight, updated);
    }

    /**
     * Creates a new edge between the vertices specified.
     * 
     * @param outboundId
     *            the identifier of the vertex the edge starts from
     * @param type
     *            the edge type
     * @param inboundId
     *            the identifier of the vertex the edge points to
     * @param weight
     *            the edge weight
     * @param updated
     *            the instant of the last update
     * @param <I>
     *            the identifier type
     * @return the created edge
     */
    public static <I> Edge<I> create(final I outboundId, final Type type, final I inboundId,
            final Weight weight, final Instant updated) {
        return new Edge<I>(new EdgeKey<I>(outboundId, type, inboundId), weight, updated);
    }

    /**
     * Creates a new edge stamped with the current instant.
     * 
     * @param outboundId
     *            the identifier of the vertex the edge starts from
     * @param type
     *            the edge type
     * @param inboundId
     *            the identifier of the vertex the edge points to
     * @param weight
     *            the edge weight
     * @param <I>
     *            the identifier type
     * @return the created edge
     */
    public static <I> Edge<I> createWithCurrentDatetime(final I outboundId, final Type type,
            final I inboundId, final Weight weight) {
        return create(outboundId, type, inboundId, weight, Instant.now());
    }

    public EdgeKey<I> getKey() {
        return this.key;
    }

    public I getOutboundId() {
        return this.key.getOutboundId();
    }

    public Type getType() {
        return this.key.getType();
    }

    public I getInboundId() {
        return this.key.getInboundId();
    }

    public Weight getWeight() {
        return this.weight;
    }

    public Instant getUpdated() {
        return this.updated;
    }

    @Override
    public boolean equals(@Nullable final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Edge)) {
            return false;
        }
        return this.key.equals(((Edge<?>) object).key);
    }

    @Override
    public int hashCode() {
        return this.key.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("key", this.key).add("weight", this.weight)
                .add("updated", this.updated).toString();
    }

}
