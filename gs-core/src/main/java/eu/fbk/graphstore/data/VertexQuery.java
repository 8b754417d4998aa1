package eu.fbk.graphstore.data;

import java.util.Arrays;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A query selecting vertices.
 * <p>
 * Two kinds of queries are supported:
 * </p>
 * <ul>
 * <li>{@link Kind#IDS} queries, built with {@link #ids(Iterable)}, select the vertices with the
 * identifiers listed; identifiers with no vertex are ignored;</li>
 * <li>{@link Kind#RANGE} queries, built with {@link #range(Object, Type, int)}, select the
 * vertices whose identifier follows an optional start identifier, optionally restricted to a
 * type, up to a maximum number of vertices.</li>
 * </ul>
 * <p>
 * In both cases matching vertices are returned in ascending identifier order.
 * </p>
 * 
 * @param <I>
 *            the identifier type
 */
public final class VertexQuery<I> {

    private final Kind kind;

    private final List<I> ids;

    @Nullable
    private final I after;

    @Nullable
    private final Type type;

    private final int limit;

    private VertexQuery(final Kind kind, final List<I> ids, @Nullable final I after,
            @Nullable final Type type, final int limit) {
        this.kind = kind;
        this.ids = ids;
        this.after = after;
        this.type = type;
        this.limit = limit;
    }

    /**
     * Returns a query selecting the vertices with the identifiers specified.
     * 
     * @param ids
     *            the identifiers, possibly empty
     * @param <I>
     *            the identifier type
     * @return the query
     */
    public static <I> VertexQuery<I> ids(final Iterable<? extends I> ids) {
        return new VertexQuery<I>(Kind.IDS, ImmutableList.<I>copyOf(ids), null, null,
                Integer.MAX_VALUE);
    }

    /**
     * Returns a query selecting the vertices with the identifiers specified.
     * 
     * @param ids
     *            the identifiers, possibly empty
     * @param <I>
     *            the identifier type
     * @return the query
     */
    @SafeVarargs
    public static <I> VertexQuery<I> ids(final I... ids) {
        return ids(Arrays.asList(ids));
    }

    /**
     * Returns a query selecting at most {@code limit} vertices of the type specified (if any),
     * whose identifier is strictly greater than {@code after} (if specified).
     * 
     * @param after
     *            the identifier matching vertices must follow, null to start from the first
     *            vertex
     * @param type
     *            the type of matching vertices, null to match any type
     * @param limit
     *            the maximum number of vertices to return, not negative
     * @param <I>
     *            the identifier type
     * @return the query
     */
    public static <I> VertexQuery<I> range(@Nullable final I after, @Nullable final Type type,
            final int limit) {
        Preconditions.checkArgument(limit >= 0, "Invalid limit %s", limit);
        return new VertexQuery<I>(Kind.RANGE, ImmutableList.<I>of(), after, type, limit);
    }

    /**
     * Returns a query selecting every vertex.
     * 
     * @param <I>
     *            the identifier type
     * @return the query
     */
    public static <I> VertexQuery<I> all() {
        return range(null, null, Integer.MAX_VALUE);
    }

    public Kind getKind() {
        return this.kind;
    }

    /**
     * Returns the identifiers selected by an {@code IDS} query.
     * 
     * @return the identifiers, empty for {@code RANGE} queries
     */
    public List<I> getIds() {
        return this.ids;
    }

    @Nullable
    public I getAfter() {
        return this.after;
    }

    @Nullable
    public Type getType() {
        return this.type;
    }

    public int getLimit() {
        return this.limit;
    }

    @Override
    public String toString() {
        if (this.kind == Kind.IDS) {
            return MoreObjects.toStringHelper(this).add("ids", this.ids).toString();
        }
        return MoreObjects.toStringHelper(this).omitNullValues().add("after", this.after)
                .add("type", this.type).add("limit", this.limit).toString();
    }

    /** The kinds of vertex query. */
    public enum Kind {

        IDS,

        RANGE

    }

}
