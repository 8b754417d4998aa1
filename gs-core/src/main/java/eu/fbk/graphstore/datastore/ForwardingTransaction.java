package eu.fbk.graphstore.datastore;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ForwardingObject;

import eu.fbk.graphstore.data.Direction;
import eu.fbk.graphstore.data.Edge;
import eu.fbk.graphstore.data.EdgeQuery;
import eu.fbk.graphstore.data.Type;
import eu.fbk.graphstore.data.Vertex;
import eu.fbk.graphstore.data.VertexQuery;

/**
 * A {@code Transaction} forwarding all its method calls to another {@code Transaction}.
 * <p>
 * This class provides a starting point for implementing the decorator pattern on top of the
 * {@code Transaction} interface. Subclasses must implement method {@link #delegate()} and
 * override the methods of {@code Transaction} they want to decorate.
 * </p>
 * 
 * @param <I>
 *            the identifier type
 */
public abstract class ForwardingTransaction<I> extends ForwardingObject implements
        Transaction<I> {

    @Override
    protected abstract Transaction<I> delegate();

    @Override
    public boolean createVertex(final Vertex<I> vertex) throws DatastoreException,
            IllegalStateException {
        return delegate().createVertex(vertex);
    }

    @Override
    public I createVertexFromType(final Type type) throws DatastoreException,
            IllegalStateException {
        return delegate().createVertexFromType(type);
    }

    @Override
    public List<Vertex<I>> getVertices(final VertexQuery<I> query) throws DatastoreException,
            IllegalStateException {
        return delegate().getVertices(query);
    }

    @Override
    public void deleteVertices(final VertexQuery<I> query) throws DatastoreException,
            IllegalStateException {
        delegate().deleteVertices(query);
    }

    @Override
    public long getVertexCount() throws DatastoreException, IllegalStateException {
        return delegate().getVertexCount();
    }

    @Override
    public boolean createEdge(final Edge<I> edge) throws DatastoreException,
            IllegalStateException {
        return delegate().createEdge(edge);
    }

    @Override
    public List<Edge<I>> getEdges(final EdgeQuery<I> query) throws DatastoreException,
            IllegalStateException {
        return delegate().getEdges(query);
    }

    @Override
    public void deleteEdges(final EdgeQuery<I> query) throws DatastoreException,
            IllegalStateException {
        delegate().deleteEdges(query);
    }

    @Override
    public long getEdgeCount(final I id, @Nullable final Type type, final Direction direction)
            throws DatastoreException, IllegalStateException {
        return delegate().getEdgeCount(id, type, direction);
    }

    @Override
    public void end(final boolean commit) throws DatastoreException {
        delegate().end(commit);
    }

}
