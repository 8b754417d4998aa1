package eu.fbk.graphstore.datastore;

import eu.fbk.graphstore.data.IdSpace;
import eu.fbk.graphstore.runtime.Component;

/**
 * A storage component for vertices and edges.
 * <p>
 * A {@code Datastore} abstracts the access to a storage system for a graph of vertices connected
 * by typed, weighted, directed edges. Access occurs only in the scope of a {@link Transaction},
 * which can be either read-only or read/write, identifies a unit of work and provides atomicity
 * and isolation guarantees. Implementations (in memory, on a persistent key-value engine, or
 * proxies to a remote server) are interchangeable: for the same sequence of operations they
 * return the same vertices and edges and fail with the same {@link DatastoreException} kinds.
 * </p>
 * <p>
 * A {@code Datastore} obeys the general contract and lifecycle of {@link Component}. Unless
 * stated otherwise by an implementation, a {@code Datastore} is thread safe, while the
 * {@code Transaction}s it produces are not required to be so; a thread must end its transaction
 * before beginning another one on the same datastore.
 * </p>
 * 
 * @param <I>
 *            the identifier type
 */
public interface Datastore<I> extends Component {

    /**
     * Returns the identifier space of this datastore.
     * 
     * @return the identifier space
     */
    IdSpace<I> getIdSpace();

    /**
     * Begins a new read-only / read-write transaction. The transaction must be ended as soon as
     * possible, as it may prevent other transactions from proceeding.
     * 
     * @param readOnly
     *            <tt>true</tt> if the transaction is not allowed to modify the contents of the
     *            {@code Datastore}
     * @return the created transaction
     * @throws DatastoreException
     *             if the transaction cannot be started
     * @throws IllegalStateException
     *             if the {@code Datastore} is not initialized or has been closed
     */
    Transaction<I> begin(boolean readOnly) throws DatastoreException, IllegalStateException;

}
