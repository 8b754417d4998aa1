package eu.fbk.graphstore.datastore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.graphstore.data.Direction;
import eu.fbk.graphstore.data.Edge;
import eu.fbk.graphstore.data.EdgeQuery;
import eu.fbk.graphstore.data.Type;
import eu.fbk.graphstore.data.Vertex;
import eu.fbk.graphstore.data.VertexQuery;

/**
 * A sequence of operations executed atomically in a single read-write transaction.
 * <p>
 * A {@code Batch} is built by listing operations in a {@link Builder} and is executed via
 * {@link #execute(Datastore)}: either every operation succeeds and the transaction is committed,
 * or the first failure rolls back the whole transaction and is propagated to the caller. The
 * returned list holds the result of each operation in order; operations with no result
 * (deletions) contribute a {@code null} element.
 * </p>
 * 
 * @param <I>
 *            the identifier type
 */
public final class Batch<I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(Batch.class);

    private final List<Operation<I>> operations;

    private Batch(final List<Operation<I>> operations) {
        this.operations = operations;
    }

    public static <I> Builder<I> builder() {
        return new Builder<I>();
    }

    public List<Operation<I>> getOperations() {
        return this.operations;
    }

    /**
     * Executes the batch on the datastore specified.
     * 
     * @param datastore
     *            the datastore, already initialized
     * @return the results of the operations, in the order they were added
     * @throws DatastoreException
     *             if an operation fails, in which case no change is applied
     */
    public List<Object> execute(final Datastore<I> datastore) throws DatastoreException {

        final List<Object> results = new ArrayList<Object>(this.operations.size());
        final Transaction<I> transaction = datastore.begin(false);
        try {
            for (final Operation<I> operation : this.operations) {
                results.add(operation.apply(transaction));
            }
        } catch (final Throwable ex) {
            LOGGER.debug("Batch failed after {} of {} operations, rolling back", results.size(),
                    this.operations.size());
            try {
                transaction.end(false);
            } catch (final Throwable ex2) {
                ex.addSuppressed(ex2);
            }
            Throwables.throwIfInstanceOf(ex, DatastoreException.class);
            Throwables.throwIfUnchecked(ex);
            throw new RuntimeException(ex);
        }
        transaction.end(true);
        return Collections.unmodifiableList(results);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("operations", this.operations).toString();
    }

    /**
     * A single operation of a {@code Batch}.
     * 
     * @param <I>
     *            the identifier type
     */
    public interface Operation<I> {

        @Nullable
        Object apply(Transaction<I> transaction) throws DatastoreException;

    }

    public static final class Builder<I> {

        private final ImmutableList.Builder<Operation<I>> operations;

        Builder() {
            this.operations = ImmutableList.builder();
        }

        public Builder<I> add(final Operation<I> operation) {
            this.operations.add(Preconditions.checkNotNull(operation));
            return this;
        }

        public Builder<I> createVertex(final Vertex<I> vertex) {
            Preconditions.checkNotNull(vertex);
            return add(new Operation<I>() {

                @Override
                public Object apply(final Transaction<I> transaction) throws DatastoreException {
                    return transaction.createVertex(vertex);
                }

                @Override
                public String toString() {
                    return "createVertex(" + vertex + ")";
                }

            });
        }

        public Builder<I> createVertexFromType(final Type type) {
            Preconditions.checkNotNull(type);
            return add(new Operation<I>() {

                @Override
                public Object apply(final Transaction<I> transaction) throws DatastoreException {
                    return transaction.createVertexFromType(type);
                }

                @Override
                public String toString() {
                    return "createVertexFromType(" + type + ")";
                }

            });
        }

        public Builder<I> getVertices(final VertexQuery<I> query) {
            Preconditions.checkNotNull(query);
            return add(new Operation<I>() {

                @Override
                public Object apply(final Transaction<I> transaction) throws DatastoreException {
                    return transaction.getVertices(query);
                }

                @Override
                public String toString() {
                    return "getVertices(" + query + ")";
                }

            });
        }

        public Builder<I> deleteVertices(final VertexQuery<I> query) {
            Preconditions.checkNotNull(query);
            return add(new Operation<I>() {

                @Override
                public Object apply(final Transaction<I> transaction) throws DatastoreException {
                    transaction.deleteVertices(query);
                    return null;
                }

                @Override
                public String toString() {
                    return "deleteVertices(" + query + ")";
                }

            });
        }

        public Builder<I> getVertexCount() {
            return add(new Operation<I>() {

                @Override
                public Object apply(final Transaction<I> transaction) throws DatastoreException {
                    return transaction.getVertexCount();
                }

                @Override
                public String toString() {
                    return "getVertexCount()";
                }

            });
        }

        public Builder<I> createEdge(final Edge<I> edge) {
            Preconditions.checkNotNull(edge);
            return add(new Operation<I>() {

                @Override
                public Object apply(final Transaction<I> transaction) throws DatastoreException {
                    return transaction.createEdge(edge);
                }

                @Override
                public String toString() {
                    return "createEdge(" + edge + ")";
                }

            });
        }

        public Builder<I> getEdges(final EdgeQuery<I> query) {
            Preconditions.checkNotNull(query);
            return add(new Operation<I>() {

                @Override
                public Object apply(final Transaction<I> transaction) throws DatastoreException {
                    return transaction.getEdges(query);
                }

                @Override
                public String toString() {
                    return "getEdges(" + query + ")";
                }

            });
        }

        public Builder<I> deleteEdges(final EdgeQuery<I> query) {
            Preconditions.checkNotNull(query);
            return add(new Operation<I>() {

                @Override
                public Object apply(final Transaction<I> transaction) throws DatastoreException {
                    transaction.deleteEdges(query);
                    return null;
                }

                @Override
                public String toString() {
                    return "deleteEdges(" + query + ")";
                }

            });
        }

        public Builder<I> getEdgeCount(final I id, @Nullable final Type type,
                final Direction direction) {
            Preconditions.checkNotNull(id);
            Preconditions.checkNotNull(direction);
            return add(new Operation<I>() {

                @Override
                public Object apply(final Transaction<I> transaction) throws DatastoreException {
                    return transaction.getEdgeCount(id, type, direction);
                }

                @Override
                public String toString() {
                    return "getEdgeCount(" + id + ", " + type + ", " + direction + ")";
                }

            });
        }

        public Batch<I> build() {
            return new Batch<I>(this.operations.build());
        }

    }

}
