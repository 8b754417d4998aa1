package eu.fbk.graphstore.datastore;

import java.util.List;

import javax.annotation.Nullable;

import eu.fbk.graphstore.data.Direction;
import eu.fbk.graphstore.data.Edge;
import eu.fbk.graphstore.data.EdgeQuery;
import eu.fbk.graphstore.data.Type;
import eu.fbk.graphstore.data.Vertex;
import eu.fbk.graphstore.data.VertexQuery;

/**
 * A {@code Datastore} transaction.
 * <p>
 * A {@code Transaction} is a unit of work over the contents of a {@link Datastore} that provides
 * atomicity (i.e., changes are either completely stored or discarded) and isolation (i.e., other
 * transactions do not see partial modifications of this transaction). It supports:
 * </p>
 * <ul>
 * <li>creation, retrieval, counting and deletion of vertices; deleting a vertex deletes all the
 * edges starting from or pointing to it;</li>
 * <li>creation (with upsert semantics), retrieval, counting and deletion of edges.</li>
 * </ul>
 * <p>
 * Values returned by a transaction are immutable and independent of the datastore state.
 * Modification methods are not available for read-only transactions (an
 * {@link IllegalStateException} is thrown in that case). Transactions are terminated via
 * {@link #end(boolean)}, whose parameter specifies whether changes should be committed; if an
 * operation fails, the caller is expected to end the transaction with a rollback. Method
 * {@code end()} always terminates the transaction: if it throws an exception, a rollback must be
 * assumed.
 * </p>
 * <p>
 * {@code Transaction} objects are not required to be thread safe.
 * </p>
 * 
 * @param <I>
 *            the identifier type
 */
public interface Transaction<I> {

    /**
     * Creates a vertex.
     * 
     * @param vertex
     *            the vertex to create
     * @return true on success
     * @throws DatastoreException
     *             with kind {@code UUID_TAKEN} if a vertex with the same identifier exists, or
     *             another kind if the operation fails
     * @throws IllegalStateException
     *             if the transaction has been ended, or is read-only
     */
    boolean createVertex(Vertex<I> vertex) throws DatastoreException, IllegalStateException;

    /**
     * Creates a vertex of the type specified with a generated identifier.
     * 
     * @param type
     *            the vertex type
     * @return the identifier of the created vertex
     * @throws DatastoreException
     *             with kind {@code UUID_TAKEN} if no free identifier could be generated, or
     *             another kind if the operation fails
     * @throws IllegalStateException
     *             if the transaction has been ended, or is read-only
     */
    I createVertexFromType(Type type) throws DatastoreException, IllegalStateException;

    /**
     * Returns the vertices matching the query specified, in ascending identifier order.
     * 
     * @param query
     *            the vertex query
     * @return the matching vertices, possibly empty
     * @throws DatastoreException
     *             if the operation fails
     * @throws IllegalStateException
     *             if the transaction has been ended
     */
    List<Vertex<I>> getVertices(VertexQuery<I> query) throws DatastoreException,
            IllegalStateException;

    /**
     * Deletes the vertices matching the query specified, together with the edges starting from
     * or pointing to them.
     * 
     * @param query
     *            the vertex query
     * @throws DatastoreException
     *             if the operation fails
     * @throws IllegalStateException
     *             if the transaction has been ended, or is read-only
     */
    void deleteVertices(VertexQuery<I> query) throws DatastoreException, IllegalStateException;

    /**
     * Counts the vertices in the datastore.
     * 
     * @return the number of vertices
     * @throws DatastoreException
     *             if the operation fails
     * @throws IllegalStateException
     *             if the transaction has been ended
     */
    long getVertexCount() throws DatastoreException, IllegalStateException;

    /**
     * Creates or updates an edge. If an edge with the same key exists, its weight is replaced
     * and its update instant is set to the later of the stored and supplied instants, so that
     * it never decreases.
     * 
     * @param edge
     *            the edge to create or update
     * @return true if the edge has been stored, false if either of its vertices does not exist
     * @throws DatastoreException
     *             if the operation fails
     * @throws IllegalStateException
     *             if the transaction has been ended, or is read-only
     */
    boolean createEdge(Edge<I> edge) throws DatastoreException, IllegalStateException;

    /**
     * Returns the edges matching the query specified, ordered by outbound identifier, type and
     * inbound identifier.
     * 
     * @param query
     *            the edge query
     * @return the matching edges, possibly empty
     * @throws DatastoreException
     *             if the operation fails
     * @throws IllegalStateException
     *             if the transaction has been ended
     */
    List<Edge<I>> getEdges(EdgeQuery<I> query) throws DatastoreException, IllegalStateException;

    /**
     * Deletes the edges matching the query specified.
     * 
     * @param query
     *            the edge query
     * @throws DatastoreException
     *             if the operation fails
     * @throws IllegalStateException
     *             if the transaction has been ended, or is read-only
     */
    void deleteEdges(EdgeQuery<I> query) throws DatastoreException, IllegalStateException;

    /**
     * Counts the edges attached to a vertex.
     * 
     * @param id
     *            the vertex identifier
     * @param type
     *            the type of edges to count, null to count edges of any type
     * @param direction
     *            whether to count edges leaving or pointing to the vertex
     * @return the number of edges
     * @throws DatastoreException
     *             if the operation fails
     * @throws IllegalStateException
     *             if the transaction has been ended
     */
    long getEdgeCount(I id, @Nullable Type type, Direction direction) throws DatastoreException,
            IllegalStateException;

    /**
     * Ends the transaction, either committing or rolling back its changes. If the commit fails,
     * a rollback is performed and a {@code DatastoreException} is thrown. Calling this method on
     * an ended transaction has no effect.
     * 
     * @param commit
     *            <tt>true</tt> if changes should be committed
     * @throws DatastoreException
     *             if the commit fails (a rollback is assumed)
     */
    void end(boolean commit) throws DatastoreException;

}
