package eu.fbk.graphstore.data;

import java.util.Comparator;

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * The identity of an edge: the outbound vertex identifier, the edge type and the inbound vertex
 * identifier. At most one edge exists for each {@code EdgeKey}.
 * 
 * @param <I>
 *            the identifier type
 */
public final class EdgeKey<I> {

    private final I outboundId;

    private final Type type;

    private final I inboundId;

    /**
     * Creates a new edge key.
     * 
     * @param outboundId
     *            the identifier of the vertex the edge starts from
     * @param type
     *            the edge type
     * @param inboundId
     *            the identifier of the vertex the edge points to
     */
    public EdgeKey(final I outboundId, final Type type, final I inboundId) {
        this.outboundId = Preconditions.checkNotNull(outboundId);
        this.type = Preconditions.checkNotNull(type);
        this.inboundId = Preconditions.checkNotNull(inboundId);
    }

    public I getOutboundId() {
        return this.outboundId;
    }

    public Type getType() {
        return this.type;
    }

    public I getInboundId() {
        return this.inboundId;
    }

    /**
     * Returns the key of the edge with the same type going in the opposite direction.
     * 
     * @return the reversed key
     */
    public EdgeKey<I> reverse() {
        return new EdgeKey<I>(this.inboundId, this.type, this.outboundId);
    }

    /**
     * Returns a comparator ordering keys by outbound identifier, type and inbound identifier,
     * with identifiers compared according to the {@code IdSpace} specified. This is the order
     * of edges returned by datastore queries.
     * 
     * @param idSpace
     *            the identifier space
     * @param <I>
     *            the identifier type
     * @return the comparator
     */
    public static <I> Comparator<EdgeKey<I>> comparator(final IdSpace<I> idSpace) {
        Preconditions.checkNotNull(idSpace);
        return new Comparator<EdgeKey<I>>() {

            @Override
            public int compare(final EdgeKey<I> first, final EdgeKey<I> second) {
                int result = idSpace.compare(first.outboundId, second.outboundId);
                if (result == 0) {
                    result = first.type.compareTo(second.type);
                    if (result == 0) {
                        result = idSpace.compare(first.inboundId, second.inboundId);
                    }
                }
                return result;
            }

        };
    }

    @Override
    public boolean equals(@Nullable final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof EdgeKey)) {
            return false;
        }
        final EdgeKey<?> other = (EdgeKey<?>) object;
        return this.outboundId.equals(other.outboundId) && this.type.equals(other.type)
                && this.inboundId.equals(other.inboundId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.outboundId, this.type, this.inboundId);
    }

    @Override
    public String toString() {
        return "(" + this.outboundId + ")-[" + this.type + "]->(" + this.inboundId + ")";
    }

}
