package eu.fbk.graphstore.server;

import javax.annotation.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.graphstore.data.Direction;
import eu.fbk.graphstore.data.Edge;
import eu.fbk.graphstore.data.EdgeQuery;
import eu.fbk.graphstore.data.Type;
import eu.fbk.graphstore.data.Vertex;
import eu.fbk.graphstore.data.VertexQuery;
import eu.fbk.graphstore.datastore.Datastore;
import eu.fbk.graphstore.datastore.DatastoreException;
import eu.fbk.graphstore.datastore.Transaction;
import eu.fbk.graphstore.internal.Protocol;

/**
 * The server side state of a client connection: decodes requests, dispatches them to the
 * datastore within the transaction opened by the client and encodes the responses.
 * <p>
 * Requests are fully decoded and checked against the connection state before the datastore is
 * invoked. Protocol misuse (unknown commands, missing or invalid fields, operations outside a
 * transaction, nested transactions, mutations in read-only transactions) is thrown as a
 * {@code SERIALIZATION} error and ends the connection. Errors reported by the datastore, stored
 * data that cannot be decoded included, are sent back to the client without closing the
 * connection. Unexpected runtime failures of the datastore are reported as {@code STORAGE}
 * errors.
 * </p>
 */
final class Connection<I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(Connection.class);

    private final Datastore<I> datastore;

    private final Protocol<I> protocol;

    @Nullable
    private Transaction<I> transaction;

    Connection(final Datastore<I> datastore) {
        this.datastore = datastore;
        this.protocol = new Protocol<I>(datastore.getIdSpace());
    }

    /**
     * Serves a request. Failures reported by the datastore are encoded in the returned response,
     * while protocol misuse is thrown, as the connection cannot be trusted anymore.
     *
     * @param request
     *            the request
     * @return the response, either a result or an error
     * @throws DatastoreException
     *             with kind {@code SERIALIZATION}, if the request is malformed or not allowed in
     *             the current connection state
     */
    ObjectNode handle(final ObjectNode request) throws DatastoreException {
        final Protocol.Command command = Protocol.getCommand(request);
        final Call call = decode(command, request);
        try {
            return Protocol.newResult(call.execute());
        } catch (final DatastoreException ex) {
            return Protocol.newError(ex);
        } catch (final RuntimeException ex) {
            if (ex instanceof IllegalStateException || ex instanceof IllegalArgumentException) {
                throw DatastoreException.serialization("Invalid " + command + " request: "
                        + ex.getMessage(), ex);
            }
            LOGGER.error("Unexpected failure serving " + command, ex);
            return Protocol.newError(DatastoreException.storage(command + " failed: " + ex, ex));
        }
    }

    boolean inTransaction() {
        return this.transaction != null;
    }

    void close() {
        if (this.transaction != null) {
            LOGGER.debug("Rolling back transaction left open by client");
            try {
                this.transaction.end(false);
            } catch (final Throwable ex) {
                LOGGER.error("Rollback failed", ex);
            } finally {
                this.transaction = null;
            }
        }
    }

    private Call decode(final Protocol.Command command, final ObjectNode request)
            throws DatastoreException {

        final JsonNodeFactory factory = JsonNodeFactory.instance;

        switch (command) {
        case BEGIN:
            if (this.transaction != null) {
                throw DatastoreException.serialization("Transaction already open", null);
            }
            final boolean readOnly = Protocol.getBoolean(request, Protocol.READ_ONLY);
            return new Call() {

                @Override
                JsonNode execute() throws DatastoreException {
                    Connection.this.transaction = Connection.this.datastore.begin(readOnly);
                    final ObjectNode result = factory.objectNode();
                    result.put(Protocol.ID_SPACE, Connection.this.datastore.getIdSpace()
                            .getName());
                    return result;
                }

            };

        case END:
            final boolean commit = Protocol.getBoolean(request, Protocol.COMMIT);
            final Transaction<I> ended = transaction();
            this.transaction = null;
            return new Call() {

                @Override
                JsonNode execute() throws DatastoreException {
                    ended.end(commit);
                    return null;
                }

            };

        case CREATE_VERTEX:
            final Vertex<I> vertex = this.protocol.decodeVertex(Protocol.getField(request,
                    Protocol.VERTEX));
            final Transaction<I> creator = transaction();
            return new Call() {

                @Override
                JsonNode execute() throws DatastoreException {
                    return factory.booleanNode(creator.createVertex(vertex));
                }

            };

        case CREATE_VERTEX_FROM_TYPE:
            final Type type = Protocol.decodeType(Protocol.getField(request, Protocol.TYPE));
            final Transaction<I> generator = transaction();
            return new Call() {

                @Override
                JsonNode execute() throws DatastoreException {
                    return Connection.this.protocol.encodeId(generator
                            .createVertexFromType(type));
                }

            };

        case GET_VERTICES:
            final VertexQuery<I> vertexQuery = this.protocol.decodeVertexQuery(Protocol.getField(
                    request, Protocol.QUERY));
            final Transaction<I> vertexReader = transaction();
            return new Call() {

                @Override
                JsonNode execute() throws DatastoreException {
                    return Connection.this.protocol.encodeVertices(vertexReader
                            .getVertices(vertexQuery));
                }

            };

        case DELETE_VERTICES:
            final VertexQuery<I> vertexDeletion = this.protocol.decodeVertexQuery(Protocol
                    .getField(request, Protocol.QUERY));
            final Transaction<I> vertexDeleter = transaction();
            return new Call() {

                @Override
                JsonNode execute() throws DatastoreException {
                    vertexDeleter.deleteVertices(vertexDeletion);
                    return null;
                }

            };

        case GET_VERTEX_COUNT:
            final Transaction<I> vertexCounter = transaction();
            return new Call() {

                @Override
                JsonNode execute() throws DatastoreException {
                    return factory.numberNode(vertexCounter.getVertexCount());
                }

            };

        case CREATE_EDGE:
            final Edge<I> edge = this.protocol.decodeEdge(Protocol.getField(request,
                    Protocol.EDGE));
            final Transaction<I> linker = transaction();
            return new Call() {

                @Override
                JsonNode execute() throws DatastoreException {
                    return factory.booleanNode(linker.createEdge(edge));
                }

            };

        case GET_EDGES:
            final EdgeQuery<I> edgeQuery = this.protocol.decodeEdgeQuery(Protocol.getField(
                    request, Protocol.QUERY));
            final Transaction<I> edgeReader = transaction();
            return new Call() {

                @Override
                JsonNode execute() throws DatastoreException {
                    return Connection.this.protocol.encodeEdges(edgeReader.getEdges(edgeQuery));
                }

            };

        case DELETE_EDGES:
            final EdgeQuery<I> edgeDeletion = this.protocol.decodeEdgeQuery(Protocol.getField(
                    request, Protocol.QUERY));
            final Transaction<I> edgeDeleter = transaction();
            return new Call() {

                @Override
                JsonNode execute() throws DatastoreException {
                    edgeDeleter.deleteEdges(edgeDeletion);
                    return null;
                }

            };

        case GET_EDGE_COUNT:
            final I id = this.protocol.decodeId(Protocol.getField(request, Protocol.ID));
            final JsonNode typeNode = request.get(Protocol.TYPE);
            final Type edgeType = typeNode == null || typeNode.isNull() ? null : Protocol
                    .decodeType(typeNode);
            final Direction direction = Protocol.decodeDirection(Protocol.getField(request,
                    Protocol.DIRECTION));
            final Transaction<I> edgeCounter = transaction();
            return new Call() {

                @Override
                JsonNode execute() throws DatastoreException {
                    return factory.numberNode(edgeCounter.getEdgeCount(id, edgeType,
                            direction));
                }

            };

        default:
            throw new Error("Unexpected command " + command);
        }
    }

    private Transaction<I> transaction() throws DatastoreException {
        if (this.transaction == null) {
            throw DatastoreException.serialization("No open transaction", null);
        }
        return this.transaction;
    }

    private abstract static class Call {

        @Nullable
        abstract JsonNode execute() throws DatastoreException;

    }

}
