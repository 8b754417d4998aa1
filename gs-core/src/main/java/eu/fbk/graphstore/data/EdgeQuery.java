package eu.fbk.graphstore.data;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A query selecting edges.
 * <p>
 * A {@link Kind#KEYS} query, built with {@link #keys(Iterable)}, selects the edges with the keys
 * listed. A {@link Kind#FILTER} query, built with {@link #builder()}, selects the edges
 * satisfying all the constraints set: outbound vertex, inbound vertex, type, weight range
 * and update instant range (bounds are inclusive), returning at most a given number of edges.
 * Matching edges are returned ordered by outbound identifier, type and inbound identifier.
 * </p>
 * 
 * @param <I>
 *            the identifier type
 */
public final class EdgeQuery<I> {

    private final Kind kind;

    private final List<EdgeKey<I>> keys;

    @Nullable
    private final I outboundId;

    @Nullable
    private final I inboundId;

    @Nullable
    private final Type type;

    @Nullable
    private final Weight minWeight;

    @Nullable
    private final Weight maxWeight;

    @Nullable
    private final Instant low;

    @Nullable
    private final Instant high;

    private final int limit;

    private EdgeQuery(final List<EdgeKey<I>> keys) {
        this.kind = Kind.KEYS;
        this.keys = keys;
        this.outboundId = null;
        this.inboundId = null;
        this.type = null;
        this.minWeight = null;
        this.maxWeight = null;
        this.low = null;
        this.high = null;
        this.limit = Integer.MAX_VALUE;
    }

    private EdgeQuery(final Builder<I> builder) {
        this.kind = Kind.FILTER;
        this.keys = ImmutableList.of();
        this.outboundId = builder.outboundId;
        this.inboundId = builder.inboundId;
        this.type = builder.type;
        this.minWeight = builder.minWeight;
        this.maxWeight = builder.maxWeight;
        this.low = builder.low;
        this.high = builder.high;
        this.limit = builder.limit;
    }

    /**
     * Returns a query selecting the edges with the keys specified.
     * 
     * @param keys
     *            the edge keys, possibly empty
     * @param <I>
     *            the identifier type
     * @return the query
     */
    public static <I> EdgeQuery<I> keys(final Iterable<? extends EdgeKey<I>> keys) {
        return new EdgeQuery<I>(ImmutableList.<EdgeKey<I>>copyOf(keys));
    }

    @SafeVarargs
    public static <I> EdgeQuery<I> keys(final EdgeKey<I>... keys) {
        return keys(Arrays.asList(keys));
    }

    /**
     * Returns a query selecting the edges leaving the vertex specified.
     * 
     * @param outboundId
     *            the outbound vertex identifier
     * @param <I>
     *            the identifier type
     * @return the query
     */
    public static <I> EdgeQuery<I> outbound(final I outboundId) {
        return EdgeQuery.<I>builder().outbound(outboundId).build();
    }

    /**
     * Returns a query selecting the edges pointing to the vertex specified.
     * 
     * @param inboundId
     *            the inbound vertex identifier
     * @param <I>
     *            the identifier type
     * @return the query
     */
    public static <I> EdgeQuery<I> inbound(final I inboundId) {
        return EdgeQuery.<I>builder().inbound(inboundId).build();
    }

    public static <I> Builder<I> builder() {
        return new Builder<I>();
    }

    public Kind getKind() {
        return this.kind;
    }

    public List<EdgeKey<I>> getKeys() {
        return this.keys;
    }

    @Nullable
    public I getOutboundId() {
        return this.outboundId;
    }

    @Nullable
    public I getInboundId() {
        return this.inboundId;
    }

    @Nullable
    public Type getType() {
        return this.type;
    }

    @Nullable
    public Weight getMinWeight() {
        return this.minWeight;
    }

    @Nullable
    public Weight getMaxWeight() {
        return this.maxWeight;
    }

    @Nullable
    public Instant getLow() {
        return this.low;
    }

    @Nullable
    public Instant getHigh() {
        return this.high;
    }

    public int getLimit() {
        return this.limit;
    }

    /**
     * Checks whether an edge satisfies the constraints of this query. For {@code KEYS} queries,
     * this means the edge key is one of the keys listed.
     * 
     * @param edge
     *            the edge to check
     * @return true if the edge matches
     */
    public boolean matches(final Edge<I> edge) {
        if (this.kind == Kind.KEYS) {
            return this.keys.contains(edge.getKey());
        }
        final float weight = edge.getWeight().getValue();
        return (this.outboundId == null || this.outboundId.equals(edge.getOutboundId()))
                && (this.inboundId == null || this.inboundId.equals(edge.getInboundId()))
                && (this.type == null || this.type.equals(edge.getType()))
                && (this.minWeight == null || weight >= this.minWeight.getValue())
                && (this.maxWeight == null || weight <= this.maxWeight.getValue())
                && (this.low == null || !edge.getUpdated().isBefore(this.low))
                && (this.high == null || !edge.getUpdated().isAfter(this.high));
    }

    @Override
    public String toString() {
        if (this.kind == Kind.KEYS) {
            return MoreObjects.toStringHelper(this).add("keys", this.keys).toString();
        }
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("outbound", this.outboundId).add("inbound", this.inboundId)
                .add("type", this.type).add("minWeight", this.minWeight)
                .add("maxWeight", this.maxWeight).add("low", this.low).add("high", this.high)
                .add("limit", this.limit).toString();
    }

    /** The kinds of edge query. */
    public enum Kind {

        KEYS,

        FILTER

    }

    public static final class Builder<I> {

        @Nullable
        private I outboundId;

        @Nullable
        private I inboundId;

        @Nullable
        private Type type;

        @Nullable
        private Weight minWeight;

        @Nullable
        private Weight maxWeight;

        @Nullable
        private Instant low;

        @Nullable
        private Instant high;

        private int limit = Integer.MAX_VALUE;

        Builder() {
        }

        public Builder<I> outbound(@Nullable final I outboundId) {
            this.outboundId = outboundId;
            return this;
        }

        public Builder<I> inbound(@Nullable final I inboundId) {
            this.inboundId = inboundId;
            return this;
        }

        public Builder<I> type(@Nullable final Type type) {
            this.type = type;
            return this;
        }

        public Builder<I> minWeight(@Nullable final Weight minWeight) {
            this.minWeight = minWeight;
            return this;
        }

        public Builder<I> maxWeight(@Nullable final Weight maxWeight) {
            this.maxWeight = maxWeight;
            return this;
        }

        /**
         * Restricts the query to edges updated at or after the instant specified.
         * 
         * @param low
         *            the lower bound, null for no bound
         * @return this builder, for call chaining
         */
        public Builder<I> low(@Nullable final Instant low) {
            this.low = low;
            return this;
        }

        /**
         * Restricts the query to edges updated at or before the instant specified.
         * 
         * @param high
         *            the upper bound, null for no bound
         * @return this builder, for call chaining
         */
        public Builder<I> high(@Nullable final Instant high) {
            this.high = high;
            return this;
        }

        public Builder<I> limit(final int limit) {
            Preconditions.checkArgument(limit >= 0, "Invalid limit %s", limit);
            this.limit = limit;
            return this;
        }

        public EdgeQuery<I> build() {
            return new EdgeQuery<I>(this);
        }

    }

}
