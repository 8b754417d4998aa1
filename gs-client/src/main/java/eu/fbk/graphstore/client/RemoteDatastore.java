package eu.fbk.graphstore.client;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.List;

import javax.annotation.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.google.common.net.HostAndPort;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.graphstore.data.Direction;
import eu.fbk.graphstore.data.Edge;
import eu.fbk.graphstore.data.EdgeQuery;
import eu.fbk.graphstore.data.IdSpace;
import eu.fbk.graphstore.data.Type;
import eu.fbk.graphstore.data.Vertex;
import eu.fbk.graphstore.data.VertexQuery;
import eu.fbk.graphstore.datastore.Datastore;
import eu.fbk.graphstore.datastore.DatastoreException;
import eu.fbk.graphstore.datastore.Transaction;
import eu.fbk.graphstore.internal.Protocol;
import eu.fbk.graphstore.internal.Protocol.Command;
import eu.fbk.graphstore.internal.Util;

/**
 * A {@code Datastore} forwarding every operation to a remote GraphStore server.
 * <p>
 * Operations are sent as blocking request/response round trips over a single TCP connection,
 * opened by {@link #init()} and opened again on the next request after a transport failure.
 * Transport failures are reported as {@code STORAGE} errors and abort the open transaction,
 * which the server rolls back; responses that cannot be decoded are reported as
 * {@code SERIALIZATION} errors. No request is ever retried.
 * </p>
 * <p>
 * An instance supports at most one open transaction at a time, and is meant to be used by a
 * single thread; distinct threads should use distinct instances.
 * </p>
 *
 * @param <I>
 *            the identifier type
 */
public class RemoteDatastore<I> implements Datastore<I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteDatastore.class);

    private static final int CONNECT_TIMEOUT = 10000; // 10 sec

    private final HostAndPort address;

    private final IdSpace<I> idSpace;

    private final Protocol<I> protocol;

    @Nullable
    private Socket socket;

    @Nullable
    private DataInputStream in;

    @Nullable
    private DataOutputStream out;

    private int generation;

    @Nullable
    private RemoteTransaction transaction;

    private boolean initialized;

    private boolean closed;

    /**
     * Creates a new {@code RemoteDatastore} for the server and identifier space specified.
     *
     * @param address
     *            the server address, including the port
     * @param idSpace
     *            the identifier space, which must be the one of the server
     */
    public RemoteDatastore(final HostAndPort address, final IdSpace<I> idSpace) {
        Preconditions.checkArgument(address.hasPort(), "No port in server address %s", address);
        this.address = address;
        this.idSpace = Preconditions.checkNotNull(idSpace);
        this.protocol = new Protocol<I>(idSpace);
        this.generation = 0;
        this.initialized = false;
        this.closed = false;
    }

    /**
     * Returns the address of the server this datastore talks to.
     *
     * @return the server address
     */
    public HostAndPort getAddress() {
        return this.address;
    }

    @Override
    public IdSpace<I> getIdSpace() {
        return this.idSpace;
    }

    @Override
    public synchronized void init() throws IOException, IllegalStateException {
        Preconditions.checkState(!this.initialized && !this.closed);
        connect();
        this.initialized = true;
        LOGGER.info("{} initialized, server {}, {} identifiers", getClass().getSimpleName(),
                this.address, this.idSpace.getName());
    }

    @Override
    public synchronized Transaction<I> begin(final boolean readOnly) throws DatastoreException,
            IllegalStateException {
        Preconditions.checkState(this.initialized && !this.closed,
                "Datastore not initialized or closed");
        Preconditions.checkState(this.transaction == null,
                "Another transaction is open on this datastore");

        final ObjectNode request = Protocol.newRequest(Command.BEGIN);
        request.put(Protocol.READ_ONLY, readOnly);
        final JsonNode result = invoke(request);

        final String name = Protocol.getText(result, Protocol.ID_SPACE);
        if (!name.equals(this.idSpace.getName())) {
            disconnect(); // aborts the transaction just opened on the server
            throw DatastoreException.serialization("Server at " + this.address + " uses '"
                    + name + "' identifiers, expected '" + this.idSpace.getName() + "'", null);
        }
        this.transaction = new RemoteTransaction(readOnly, this.generation);
        return this.transaction;
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        if (this.transaction != null) {
            LOGGER.warn("Closing {} with an open transaction, which will be rolled back",
                    this);
            this.transaction = null;
        }
        disconnect();
        LOGGER.info("{} closed", getClass().getSimpleName());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.address + ")";
    }

    private void connect() throws DatastoreException {
        final Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(this.address.getHost(), this.address.getPort()),
                    CONNECT_TIMEOUT);
            this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
            this.out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
        } catch (final IOException ex) {
            Util.closeQuietly(socket);
            throw DatastoreException.storage("Cannot connect to " + this.address + ": "
                    + ex.getMessage(), ex);
        }
        this.socket = socket;
        LOGGER.debug("Connected to {}", this.address);
    }

    private void disconnect() {
        if (this.socket != null) {
            Util.closeQuietly(this.socket);
            this.socket = null;
            this.in = null;
            this.out = null;
            ++this.generation;
            LOGGER.debug("Disconnected from {}", this.address);
        }
    }

    private JsonNode invoke(final ObjectNode request) throws DatastoreException {

        if (this.socket == null) {
            connect();
        }

        final long ts = System.currentTimeMillis();
        final ObjectNode response;
        try {
            Protocol.writeFrame(this.out, request);
            response = Protocol.readFrame(this.in);
        } catch (final DatastoreException ex) {
            disconnect();
            throw ex;
        } catch (final IOException ex) {
            disconnect();
            throw DatastoreException.storage("Communication with " + this.address
                    + " failed: " + ex.getMessage(), ex);
        }
        if (response == null) {
            disconnect();
            throw DatastoreException.storage("Connection closed by " + this.address, null);
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{} {} in {} ms", this.address, request.get(Protocol.COMMAND)
                    .textValue(), System.currentTimeMillis() - ts);
        }

        try {
            return Protocol.getResult(response);
        } catch (final DatastoreException ex) {
            if (ex.getKind() == DatastoreException.Kind.SERIALIZATION) {
                disconnect(); // the server drops the connection after a protocol error
            }
            throw ex;
        }
    }

    private final class RemoteTransaction implements Transaction<I> {

        private final boolean readOnly;

        private final int generation;

        private boolean ended;

        RemoteTransaction(final boolean readOnly, final int generation) {
            this.readOnly = readOnly;
            this.generation = generation;
            this.ended = false;
        }

        private void checkReadable() {
            Preconditions.checkState(!this.ended, "Transaction already ended");
        }

        private void checkWritable() {
            Preconditions.checkState(!this.ended, "Transaction already ended");
            Preconditions.checkState(!this.readOnly, "Read-only transaction");
        }

        private JsonNode invoke(final ObjectNode request) throws DatastoreException {
            synchronized (RemoteDatastore.this) {
                if (this.generation != RemoteDatastore.this.generation) {
                    throw DatastoreException.storage("Connection to "
                            + RemoteDatastore.this.address + " lost, transaction aborted", null);
                }
                return RemoteDatastore.this.invoke(request);
            }
        }

        @Override
        public boolean createVertex(final Vertex<I> vertex) throws DatastoreException,
                IllegalStateException {
            checkWritable();
            final ObjectNode request = Protocol.newRequest(Command.CREATE_VERTEX);
            request.set(Protocol.VERTEX, RemoteDatastore.this.protocol.encodeVertex(vertex));
            return Protocol.decodeBoolean(invoke(request));
        }

        @Override
        public I createVertexFromType(final Type type) throws DatastoreException,
                IllegalStateException {
            checkWritable();
            final ObjectNode request = Protocol.newRequest(Command.CREATE_VERTEX_FROM_TYPE);
            request.set(Protocol.TYPE, Protocol.encodeType(type));
            return RemoteDatastore.this.protocol.decodeId(invoke(request));
        }

        @Override
        public List<Vertex<I>> getVertices(final VertexQuery<I> query)
                throws DatastoreException, IllegalStateException {
            checkReadable();
            final ObjectNode request = Protocol.newRequest(Command.GET_VERTICES);
            request.set(Protocol.QUERY, RemoteDatastore.this.protocol.encodeVertexQuery(query));
            return RemoteDatastore.this.protocol.decodeVertices(invoke(request));
        }

        @Override
        public void deleteVertices(final VertexQuery<I> query) throws DatastoreException,
                IllegalStateException {
            checkWritable();
            final ObjectNode request = Protocol.newRequest(Command.DELETE_VERTICES);
            request.set(Protocol.QUERY, RemoteDatastore.this.protocol.encodeVertexQuery(query));
            invoke(request);
        }

        @Override
        public long getVertexCount() throws DatastoreException, IllegalStateException {
            checkReadable();
            return Protocol.decodeLong(invoke(Protocol.newRequest(Command.GET_VERTEX_COUNT)));
        }

        @Override
        public boolean createEdge(final Edge<I> edge) throws DatastoreException,
                IllegalStateException {
            checkWritable();
            final ObjectNode request = Protocol.newRequest(Command.CREATE_EDGE);
            request.set(Protocol.EDGE, RemoteDatastore.this.protocol.encodeEdge(edge));
            return Protocol.decodeBoolean(invoke(request));
        }

        @Override
        public List<Edge<I>> getEdges(final EdgeQuery<I> query) throws DatastoreException,
                IllegalStateException {
            checkReadable();
            final ObjectNode request = Protocol.newRequest(Command.GET_EDGES);
            request.set(Protocol.QUERY, RemoteDatastore.this.protocol.encodeEdgeQuery(query));
            return RemoteDatastore.this.protocol.decodeEdges(invoke(request));
        }

        @Override
        public void deleteEdges(final EdgeQuery<I> query) throws DatastoreException,
                IllegalStateException {
            checkWritable();
            final ObjectNode request = Protocol.newRequest(Command.DELETE_EDGES);
            request.set(Protocol.QUERY, RemoteDatastore.this.protocol.encodeEdgeQuery(query));
            invoke(request);
        }

        @Override
        public long getEdgeCount(final I id, @Nullable final Type type,
                final Direction direction) throws DatastoreException, IllegalStateException {
            checkReadable();
            final ObjectNode request = Protocol.newRequest(Command.GET_EDGE_COUNT);
            request.set(Protocol.ID, RemoteDatastore.this.protocol.encodeId(id));
            if (type != null) {
                request.set(Protocol.TYPE, Protocol.encodeType(type));
            }
            request.set(Protocol.DIRECTION, Protocol.encodeDirection(direction));
            return Protocol.decodeLong(invoke(request));
        }

        @Override
        public void end(final boolean commit) throws DatastoreException {
            synchronized (RemoteDatastore.this) {
                if (this.ended) {
                    return;
                }
                this.ended = true;
                if (RemoteDatastore.this.transaction == this) {
                    RemoteDatastore.this.transaction = null;
                }
                if (this.generation != RemoteDatastore.this.generation) {
                    if (commit) {
                        throw DatastoreException.storage("Connection to "
                                + RemoteDatastore.this.address
                                + " lost, transaction rolled back", null);
                    }
                    return;
                }
                final ObjectNode request = Protocol.newRequest(Command.END);
                request.put(Protocol.COMMIT, commit);
                RemoteDatastore.this.invoke(request);
            }
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "@" + Integer.toHexString(hashCode());
        }

    }

}
