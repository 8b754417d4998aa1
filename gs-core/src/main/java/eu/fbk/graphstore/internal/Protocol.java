package eu.fbk.graphstore.internal;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

import javax.annotation.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import eu.fbk.graphstore.data.Direction;
import eu.fbk.graphstore.data.Edge;
import eu.fbk.graphstore.data.EdgeKey;
import eu.fbk.graphstore.data.EdgeQuery;
import eu.fbk.graphstore.data.IdSpace;
import eu.fbk.graphstore.data.Type;
import eu.fbk.graphstore.data.ValidationException;
import eu.fbk.graphstore.data.Vertex;
import eu.fbk.graphstore.data.VertexQuery;
import eu.fbk.graphstore.data.Weight;
import eu.fbk.graphstore.datastore.DatastoreException;

/**
 * The client/server wire protocol.
 * <p>
 * Messages are JSON objects, each sent as a frame made of a 4-byte big-endian length followed by
 * the UTF-8 encoding of the object. A request has the form
 * <tt>{"command": "&lt;COMMAND&gt;", ...}</tt>, where the remaining fields depend on the
 * {@link Command}; a response has either the form <tt>{"result": ...}</tt> or the form
 * <tt>{"error": {"kind": "&lt;KIND&gt;", "message": "..."}}</tt>. Identifiers are encoded as
 * strings via {@link IdSpace#toText(Object)}, weights as numbers and instants as ISO-8601
 * strings with nanosecond precision.
 * </p>
 * <p>
 * Static methods deal with framing and with the envelope of messages; instance methods encode
 * and decode the values of the model, using the {@code IdSpace} the instance is bound to. Every
 * decoding failure is reported as a {@code DatastoreException} of kind {@code SERIALIZATION}.
 * </p>
 * 
 * @param <I>
 *            the identifier type
 */
public final class Protocol<I> {

    /** The maximum length in bytes of the JSON payload of a frame. */
    public static final int MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    public static final String COMMAND = "command";

    public static final String RESULT = "result";

    public static final String ERROR = "error";

    public static final String KIND = "kind";

    public static final String MESSAGE = "message";

    public static final String READ_ONLY = "readOnly";

    public static final String COMMIT = "commit";

    public static final String ID_SPACE = "idSpace";

    public static final String VERTEX = "vertex";

    public static final String EDGE = "edge";

    public static final String QUERY = "query";

    public static final String ID = "id";

    public static final String TYPE = "type";

    public static final String DIRECTION = "direction";

    private static final String OUTBOUND = "outbound";

    private static final String INBOUND = "inbound";

    private static final String WEIGHT = "weight";

    private static final String UPDATED = "updated";

    private static final String IDS = "ids";

    private static final String KEYS = "keys";

    private static final String AFTER = "after";

    private static final String LIMIT = "limit";

    private static final String MIN_WEIGHT = "minWeight";

    private static final String MAX_WEIGHT = "maxWeight";

    private static final String LOW = "low";

    private static final String HIGH = "high";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private final IdSpace<I> idSpace;

    public Protocol(final IdSpace<I> idSpace) {
        this.idSpace = Preconditions.checkNotNull(idSpace);
    }

    public IdSpace<I> getIdSpace() {
        return this.idSpace;
    }

    // FRAMING

    /**
     * Reads a message frame.
     * 
     * @param in
     *            the stream to read from
     * @return the decoded JSON object, or null if the stream ended before the frame started
     * @throws DatastoreException
     *             with kind {@code SERIALIZATION} if the frame is too long, truncated or does not
     *             contain a JSON object
     * @throws IOException
     *             on I/O failure
     */
    @Nullable
    public static ObjectNode readFrame(final DataInputStream in) throws IOException {
        final int length;
        try {
            length = in.readInt();
        } catch (final EOFException ex) {
            return null;
        }
        if (length < 0 || length > MAX_FRAME_LENGTH) {
            throw DatastoreException.serialization("Invalid frame length " + length
                    + " (max " + MAX_FRAME_LENGTH + ")", null);
        }
        final byte[] payload = new byte[length];
        try {
            in.readFully(payload);
        } catch (final EOFException ex) {
            throw DatastoreException.serialization("Truncated frame (expected " + length
                    + " bytes)", ex);
        }
        final JsonNode node;
        try {
            node = MAPPER.readTree(payload);
        } catch (final JsonProcessingException ex) {
            throw DatastoreException.serialization("Malformed JSON frame: "
                    + ex.getOriginalMessage(), ex);
        }
        if (node == null || !node.isObject()) {
            throw DatastoreException.serialization("Frame does not contain a JSON object", null);
        }
        return (ObjectNode) node;
    }

    /**
     * Writes a message frame and flushes the stream.
     * 
     * @param out
     *            the stream to write to
     * @param message
     *            the message to write
     * @throws IOException
     *             on I/O failure, or if the encoded message exceeds the maximum frame length
     */
    public static void writeFrame(final DataOutputStream out, final ObjectNode message)
            throws IOException {
        final byte[] payload = MAPPER.writeValueAsBytes(message);
        if (payload.length > MAX_FRAME_LENGTH) {
            throw DatastoreException.serialization("Message too long (" + payload.length
                    + " bytes, max " + MAX_FRAME_LENGTH + ")", null);
        }
        out.writeInt(payload.length);
        out.write(payload);
        out.flush();
    }

    // ENVELOPE

    public static ObjectNode newRequest(final Command command) {
        final ObjectNode request = FACTORY.objectNode();
        request.put(COMMAND, command.name());
        return request;
    }

    public static Command getCommand(final ObjectNode request) throws DatastoreException {
        final String name = getText(request, COMMAND);
        try {
            return Command.valueOf(name);
        } catch (final IllegalArgumentException ex) {
            throw DatastoreException.serialization("Unknown command '" + name + "'", null);
        }
    }

    public static ObjectNode newResult(@Nullable final JsonNode result) {
        final ObjectNode response = FACTORY.objectNode();
        response.set(RESULT, result == null ? FACTORY.nullNode() : result);
        return response;
    }

    public static ObjectNode newError(final DatastoreException ex) {
        final ObjectNode error = FACTORY.objectNode();
        error.put(KIND, ex.getKind().name());
        error.put(MESSAGE, ex.getMessage() == null ? "" : ex.getMessage());
        final ObjectNode response = FACTORY.objectNode();
        response.set(ERROR, error);
        return response;
    }

    /**
     * Returns the result carried by a response, or throws the error it carries.
     * 
     * @param response
     *            the response
     * @return the result, possibly a JSON null node
     * @throws DatastoreException
     *             the error carried by the response, or a {@code SERIALIZATION} error if the
     *             response is malformed
     */
    public static JsonNode getResult(final ObjectNode response) throws DatastoreException {
        final JsonNode error = response.get(ERROR);
        if (error != null && !error.isNull()) {
            final String kind = getText(error, KIND);
            final JsonNode message = error.get(MESSAGE);
            final String text = message == null || message.isNull() ? "" : message.asText();
            final DatastoreException.Kind errorKind;
            try {
                errorKind = DatastoreException.Kind.valueOf(kind);
            } catch (final IllegalArgumentException ex) {
                throw DatastoreException.serialization("Unknown error kind '" + kind
                        + "' for error: " + text, null);
            }
            throw new DatastoreException(errorKind, text);
        }
        final JsonNode result = response.get(RESULT);
        if (result == null) {
            throw DatastoreException.serialization("Response has neither result nor error",
                    null);
        }
        return result;
    }

    // FIELD ACCESS

    public static JsonNode getField(final JsonNode node, final String field)
            throws DatastoreException {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw DatastoreException.serialization("Missing field '" + field + "'", null);
        }
        return value;
    }

    public static String getText(final JsonNode node, final String field)
            throws DatastoreException {
        final JsonNode value = getField(node, field);
        if (!value.isTextual()) {
            throw DatastoreException.serialization("Field '" + field + "' is not a string",
                    null);
        }
        return value.textValue();
    }

    public static boolean getBoolean(final JsonNode node, final String field)
            throws DatastoreException {
        return decodeBoolean(getField(node, field));
    }

    public static boolean decodeBoolean(final JsonNode node) throws DatastoreException {
        if (!node.isBoolean()) {
            throw DatastoreException.serialization("Not a boolean: " + node, null);
        }
        return node.booleanValue();
    }

    public static long decodeLong(final JsonNode node) throws DatastoreException {
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw DatastoreException.serialization("Not a long: " + node, null);
        }
        return node.longValue();
    }

    private static int getInt(final JsonNode node, final String field)
            throws DatastoreException {
        final JsonNode value = getField(node, field);
        if (!value.isIntegralNumber() || !value.canConvertToInt() || value.intValue() < 0) {
            throw DatastoreException.serialization("Field '" + field
                    + "' is not a non-negative int", null);
        }
        return value.intValue();
    }

    private static ArrayNode getArray(final JsonNode node, final String field)
            throws DatastoreException {
        final JsonNode value = getField(node, field);
        if (!value.isArray()) {
            throw DatastoreException.serialization("Field '" + field + "' is not an array",
                    null);
        }
        return (ArrayNode) value;
    }

    private static boolean has(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        return value != null && !value.isNull();
    }

    // VALUES

    public JsonNode encodeId(final I id) {
        return FACTORY.textNode(this.idSpace.toText(id));
    }

    public I decodeId(final JsonNode node) throws DatastoreException {
        if (!node.isTextual()) {
            throw DatastoreException.serialization("Identifier is not a string: " + node, null);
        }
        try {
            return this.idSpace.fromText(node.textValue());
        } catch (final ValidationException ex) {
            throw DatastoreException.serialization(ex.getMessage(), ex);
        }
    }

    public static JsonNode encodeType(final Type type) {
        return FACTORY.textNode(type.getValue());
    }

    public static Type decodeType(final JsonNode node) throws DatastoreException {
        if (!node.isTextual()) {
            throw DatastoreException.serialization("Type is not a string: " + node, null);
        }
        try {
            return Type.valueOf(node.textValue());
        } catch (final ValidationException ex) {
            throw DatastoreException.serialization(ex.getMessage(), ex);
        }
    }

    public static JsonNode encodeWeight(final Weight weight) {
        return FACTORY.numberNode(weight.getValue());
    }

    public static Weight decodeWeight(final JsonNode node) throws DatastoreException {
        if (!node.isNumber()) {
            throw DatastoreException.serialization("Weight is not a number: " + node, null);
        }
        try {
            return Weight.valueOf(node.floatValue());
        } catch (final ValidationException ex) {
            throw DatastoreException.serialization(ex.getMessage(), ex);
        }
    }

    public static JsonNode encodeInstant(final Instant instant) {
        return FACTORY.textNode(instant.toString());
    }

    public static Instant decodeInstant(final JsonNode node) throws DatastoreException {
        if (!node.isTextual()) {
            throw DatastoreException.serialization("Instant is not a string: " + node, null);
        }
        try {
            return Instant.parse(node.textValue());
        } catch (final DateTimeParseException ex) {
            throw DatastoreException.serialization("Invalid instant '" + node.textValue()
                    + "'", ex);
        }
    }

    public static JsonNode encodeDirection(final Direction direction) {
        return FACTORY.textNode(direction.name());
    }

    public static Direction decodeDirection(final JsonNode node) throws DatastoreException {
        try {
            return Direction.valueOf(node.asText());
        } catch (final IllegalArgumentException ex) {
            throw DatastoreException.serialization("Invalid direction " + node, null);
        }
    }

    public JsonNode encodeVertex(final Vertex<I> vertex) {
        final ObjectNode node = FACTORY.objectNode();
        node.set(ID, encodeId(vertex.getId()));
        node.set(TYPE, encodeType(vertex.getType()));
        return node;
    }

    public Vertex<I> decodeVertex(final JsonNode node) throws DatastoreException {
        return new Vertex<I>(decodeId(getField(node, ID)), decodeType(getField(node, TYPE)));
    }

    public JsonNode encodeEdgeKey(final EdgeKey<I> key) {
        final ObjectNode node = FACTORY.objectNode();
        node.set(OUTBOUND, encodeId(key.getOutboundId()));
        node.set(TYPE, encodeType(key.getType()));
        node.set(INBOUND, encodeId(key.getInboundId()));
        return node;
    }

    public EdgeKey<I> decodeEdgeKey(final JsonNode node) throws DatastoreException {
        return new EdgeKey<I>(decodeId(getField(node, OUTBOUND)), decodeType(getField(node,
                TYPE)), decodeId(getField(node, INBOUND)));
    }

    public JsonNode encodeEdge(final Edge<I> edge) {
        final ObjectNode node = (ObjectNode) encodeEdgeKey(edge.getKey());
        node.set(WEIGHT, encodeWeight(edge.getWeight()));
        node.set(UPDATED, encodeInstant(edge.getUpdated()));
        return node;
    }

    public Edge<I> decodeEdge(final JsonNode node) throws DatastoreException {
        return Edge.create(decodeEdgeKey(node), decodeWeight(getField(node, WEIGHT)),
                decodeInstant(getField(node, UPDATED)));
    }

    public JsonNode encodeVertices(final Iterable<Vertex<I>> vertices) {
        final ArrayNode array = FACTORY.arrayNode();
        for (final Vertex<I> vertex : vertices) {
            array.add(encodeVertex(vertex));
        }
        return array;
    }

    public List<Vertex<I>> decodeVertices(final JsonNode node) throws DatastoreException {
        if (!node.isArray()) {
            throw DatastoreException.serialization("Not a vertex array: " + node, null);
        }
        final ImmutableList.Builder<Vertex<I>> builder = ImmutableList.builder();
        for (final JsonNode element : node) {
            builder.add(decodeVertex(element));
        }
        return builder.build();
    }

    public JsonNode encodeEdges(final Iterable<Edge<I>> edges) {
        final ArrayNode array = FACTORY.arrayNode();
        for (final Edge<I> edge : edges) {
            array.add(encodeEdge(edge));
        }
        return array;
    }

    public List<Edge<I>> decodeEdges(final JsonNode node) throws DatastoreException {
        if (!node.isArray()) {
            throw DatastoreException.serialization("Not an edge array: " + node, null);
        }
        final ImmutableList.Builder<Edge<I>> builder = ImmutableList.builder();
        for (final JsonNode element : node) {
            builder.add(decodeEdge(element));
        }
        return builder.build();
    }

    // QUERIES

    public JsonNode encodeVertexQuery(final VertexQuery<I> query) {
        final ObjectNode node = FACTORY.objectNode();
        node.put(KIND, query.getKind().name());
        if (query.getKind() == VertexQuery.Kind.IDS) {
            final ArrayNode ids = node.putArray(IDS);
            for (final I id : query.getIds()) {
                ids.add(encodeId(id));
            }
        } else {
            if (query.getAfter() != null) {
                node.set(AFTER, encodeId(query.getAfter()));
            }
            if (query.getType() != null) {
                node.set(TYPE, encodeType(query.getType()));
            }
            node.put(LIMIT, query.getLimit());
        }
        return node;
    }

    public VertexQuery<I> decodeVertexQuery(final JsonNode node) throws DatastoreException {
        final String kind = getText(node, KIND);
        if (VertexQuery.Kind.IDS.name().equals(kind)) {
            final ImmutableList.Builder<I> ids = ImmutableList.builder();
            for (final JsonNode id : getArray(node, IDS)) {
                ids.add(decodeId(id));
            }
            return VertexQuery.ids(ids.build());
        } else if (VertexQuery.Kind.RANGE.name().equals(kind)) {
            final I after = has(node, AFTER) ? decodeId(node.get(AFTER)) : null;
            final Type type = has(node, TYPE) ? decodeType(node.get(TYPE)) : null;
            return VertexQuery.range(after, type, getInt(node, LIMIT));
        }
        throw DatastoreException.serialization("Unknown vertex query kind '" + kind + "'", null);
    }

    public JsonNode encodeEdgeQuery(final EdgeQuery<I> query) {
        final ObjectNode node = FACTORY.objectNode();
        node.put(KIND, query.getKind().name());
        if (query.getKind() == EdgeQuery.Kind.KEYS) {
            final ArrayNode keys = node.putArray(KEYS);
            for (final EdgeKey<I> key : query.getKeys()) {
                keys.add(encodeEdgeKey(key));
            }
            return node;
        }
        if (query.getOutboundId() != null) {
            node.set(OUTBOUND, encodeId(query.getOutboundId()));
        }
        if (query.getInboundId() != null) {
            node.set(INBOUND, encodeId(query.getInboundId()));
        }
        if (query.getType() != null) {
            node.set(TYPE, encodeType(query.getType()));
        }
        if (query.getMinWeight() != null) {
            node.set(MIN_WEIGHT, encodeWeight(query.getMinWeight()));
        }
        if (query.getMaxWeight() != null) {
            node.set(MAX_WEIGHT, encodeWeight(query.getMaxWeight()));
        }
        if (query.getLow() != null) {
            node.set(LOW, encodeInstant(query.getLow()));
        }
        if (query.getHigh() != null) {
            node.set(HIGH, encodeInstant(query.getHigh()));
        }
        node.put(LIMIT, query.getLimit());
        return node;
    }

    public EdgeQuery<I> decodeEdgeQuery(final JsonNode node) throws DatastoreException {
        final String kind = getText(node, KIND);
        if (EdgeQuery.Kind.KEYS.name().equals(kind)) {
            final ImmutableList.Builder<EdgeKey<I>> keys = ImmutableList.builder();
            for (final JsonNode key : getArray(node, KEYS)) {
                keys.add(decodeEdgeKey(key));
            }
            return EdgeQuery.keys(keys.build());
        } else if (!EdgeQuery.Kind.FILTER.name().equals(kind)) {
            throw DatastoreException.serialization("Unknown edge query kind '" + kind + "'",
                    null);
        }
        final EdgeQuery.Builder<I> builder = EdgeQuery.builder();
        if (has(node, OUTBOUND)) {
            builder.outbound(decodeId(node.get(OUTBOUND)));
        }
        if (has(node, INBOUND)) {
            builder.inbound(decodeId(node.get(INBOUND)));
        }
        if (has(node, TYPE)) {
            builder.type(decodeType(node.get(TYPE)));
        }
        if (has(node, MIN_WEIGHT)) {
            builder.minWeight(decodeWeight(node.get(MIN_WEIGHT)));
        }
        if (has(node, MAX_WEIGHT)) {
            builder.maxWeight(decodeWeight(node.get(MAX_WEIGHT)));
        }
        if (has(node, LOW)) {
            builder.low(decodeInstant(node.get(LOW)));
        }
        if (has(node, HIGH)) {
            builder.high(decodeInstant(node.get(HIGH)));
        }
        return builder.limit(getInt(node, LIMIT)).build();
    }

    /** The commands a client can send. */
    public enum Command {

        BEGIN,

        END,

        CREATE_VERTEX,

        CREATE_VERTEX_FROM_TYPE,

        GET_VERTICES,

        DELETE_VERTICES,

        GET_VERTEX_COUNT,

        CREATE_EDGE,

        GET_EDGES,

        DELETE_EDGES,

        GET_EDGE_COUNT

    }

}
