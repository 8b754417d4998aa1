package eu.fbk.graphstore.datastore;

import java.io.IOException;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.graphstore.data.Direction;
import eu.fbk.graphstore.data.Edge;
import eu.fbk.graphstore.data.EdgeQuery;
import eu.fbk.graphstore.data.Type;
import eu.fbk.graphstore.data.Vertex;
import eu.fbk.graphstore.data.VertexQuery;

/**
 * A {@code Datastore} wrapper that logs calls to the operations of a wrapped {@code Datastore}
 * and their execution times.
 * <p>
 * This wrapper intercepts calls to an underlying {@code Datastore} and to the
 * {@code Transaction}s it creates, and logs request information and execution times via SLF4J
 * (level DEBUG, logger named after this class). The overhead introduced by this wrapper when
 * logging is disabled is negligible.
 * </p>
 * 
 * @param <I>
 *            the identifier type
 */
public final class LoggingDatastore<I> extends ForwardingDatastore<I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingDatastore.class);

    private final Datastore<I> delegate;

    /**
     * Creates a new instance for the wrapped {@code Datastore} specified.
     * 
     * @param delegate
     *            the wrapped {@code Datastore}
     */
    public LoggingDatastore(final Datastore<I> delegate) {
        this.delegate = Preconditions.checkNotNull(delegate);
        LOGGER.debug("{} configured", getClass().getSimpleName());
    }

    @Override
    protected Datastore<I> delegate() {
        return this.delegate;
    }

    @Override
    public void init() throws IOException {

        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.init();
            LOGGER.debug("{} - initialized in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.init();
        }
    }

    @Override
    public Transaction<I> begin(final boolean readOnly) throws DatastoreException,
            IllegalStateException {

        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final Transaction<I> transaction = new LoggingTransaction<I>(super.begin(readOnly));
            LOGGER.debug("{} - started in {} mode in {} ms", transaction, readOnly ? "read-only"
                    : "read-write", System.currentTimeMillis() - ts);
            return transaction;
        } else {
            return super.begin(readOnly);
        }
    }

    @Override
    public void close() {

        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.close();
            LOGGER.debug("{} - closed in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.close();
        }
    }

    private static final class LoggingTransaction<I> extends ForwardingTransaction<I> {

        private final Transaction<I> delegate;

        LoggingTransaction(final Transaction<I> delegate) {
            this.delegate = Preconditions.checkNotNull(delegate);
        }

        @Override
        protected Transaction<I> delegate() {
            return this.delegate;
        }

        @Override
        public boolean createVertex(final Vertex<I> vertex) throws DatastoreException,
                IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                final boolean result = super.createVertex(vertex);
                LOGGER.debug("{} - {} created in {} ms", this, vertex,
                        System.currentTimeMillis() - ts);
                return result;
            } else {
                return super.createVertex(vertex);
            }
        }

        @Override
        public I createVertexFromType(final Type type) throws DatastoreException,
                IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                final I id = super.createVertexFromType(type);
                LOGGER.debug("{} - vertex {} of type {} created in {} ms", this, id, type,
                        System.currentTimeMillis() - ts);
                return id;
            } else {
                return super.createVertexFromType(type);
            }
        }

        @Override
        public List<Vertex<I>> getVertices(final VertexQuery<I> query)
                throws DatastoreException, IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                final List<Vertex<I>> result = super.getVertices(query);
                LOGGER.debug("{} - {} vertices for {} obtained in {} ms", this, result.size(),
                        query, System.currentTimeMillis() - ts);
                return result;
            } else {
                return super.getVertices(query);
            }
        }

        @Override
        public void deleteVertices(final VertexQuery<I> query) throws DatastoreException,
                IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                super.deleteVertices(query);
                LOGGER.debug("{} - vertices for {} deleted in {} ms", this, query,
                        System.currentTimeMillis() - ts);
            } else {
                super.deleteVertices(query);
            }
        }

        @Override
        public long getVertexCount() throws DatastoreException, IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                final long result = super.getVertexCount();
                LOGGER.debug("{} - vertex count {} obtained in {} ms", this, result,
                        System.currentTimeMillis() - ts);
                return result;
            } else {
                return super.getVertexCount();
            }
        }

        @Override
        public boolean createEdge(final Edge<I> edge) throws DatastoreException,
                IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                final boolean result = super.createEdge(edge);
                LOGGER.debug("{} - {} {} in {} ms", this, edge, result ? "stored"
                        : "rejected (missing vertex)", System.currentTimeMillis() - ts);
                return result;
            } else {
                return super.createEdge(edge);
            }
        }

        @Override
        public List<Edge<I>> getEdges(final EdgeQuery<I> query) throws DatastoreException,
                IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                final List<Edge<I>> result = super.getEdges(query);
                LOGGER.debug("{} - {} edges for {} obtained in {} ms", this, result.size(),
                        query, System.currentTimeMillis() - ts);
                return result;
            } else {
                return super.getEdges(query);
            }
        }

        @Override
        public void deleteEdges(final EdgeQuery<I> query) throws DatastoreException,
                IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                super.deleteEdges(query);
                LOGGER.debug("{} - edges for {} deleted in {} ms", this, query,
                        System.currentTimeMillis() - ts);
            } else {
                super.deleteEdges(query);
            }
        }

        @Override
        public long getEdgeCount(final I id, @Nullable final Type type,
                final Direction direction) throws DatastoreException, IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                final long result = super.getEdgeCount(id, type, direction);
                LOGGER.debug("{} - {} edge count {} for {}{} obtained in {} ms", this,
                        direction.name().toLowerCase(), result, id, type == null ? "" : ", "
                                + type, System.currentTimeMillis() - ts);
                return result;
            } else {
                return super.getEdgeCount(id, type, direction);
            }
        }

        @Override
        public void end(final boolean commit) throws DatastoreException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                super.end(commit);
                LOGGER.debug("{} - {} done in {} ms", this, commit ? "commit" : "rollback",
                        System.currentTimeMillis() - ts);
            } else {
                super.end(commit);
            }
        }

    }

}
