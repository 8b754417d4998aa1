package eu.fbk.graphstore.internal;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.graphstore.data.Edge;
import eu.fbk.graphstore.data.EdgeKey;
import eu.fbk.graphstore.data.EdgeQuery;
import eu.fbk.graphstore.data.IdSpaces;
import eu.fbk.graphstore.data.Type;
import eu.fbk.graphstore.data.ValidationException;
import eu.fbk.graphstore.data.Vertex;
import eu.fbk.graphstore.data.VertexQuery;
import eu.fbk.graphstore.data.Weight;
import eu.fbk.graphstore.datastore.DatastoreException;

public class ProtocolTest {

    private final Protocol<UUID> protocol = new Protocol<UUID>(IdSpaces.UUID);

    @Test
    public void testFraming() throws IOException {
        final ObjectNode request = Protocol.newRequest(Protocol.Command.BEGIN);
        request.put(Protocol.READ_ONLY, true);

        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final DataOutputStream out = new DataOutputStream(bytes);
        Protocol.writeFrame(out, request);
        Protocol.writeFrame(out, Protocol.newResult(null));

        final DataInputStream in = new DataInputStream(new ByteArrayInputStream(
                bytes.toByteArray()));
        final ObjectNode first = Protocol.readFrame(in);
        Assert.assertEquals(Protocol.Command.BEGIN, Protocol.getCommand(first));
        Assert.assertTrue(Protocol.getBoolean(first, Protocol.READ_ONLY));
        Assert.assertTrue(Protocol.getResult(Protocol.readFrame(in)).isNull());
        Assert.assertNull(Protocol.readFrame(in));
    }

    @Test
    public void testOversizedFrame() throws IOException {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        new DataOutputStream(bytes).writeInt(Protocol.MAX_FRAME_LENGTH + 1);
        checkSerializationError(bytes.toByteArray());
    }

    @Test
    public void testMalformedFrames() throws IOException {
        checkSerializationError(frame("{\"command\": "));
        checkSerializationError(frame("[1, 2, 3]"));
        final byte[] truncated = frame("{\"command\": \"BEGIN\"}");
        checkSerializationError(java.util.Arrays.copyOf(truncated, truncated.length - 3));
    }

    @Test
    public void testUnknownCommand() throws IOException {
        final ObjectNode request = Protocol.readFrame(new DataInputStream(
                new ByteArrayInputStream(frame("{\"command\": \"DROP_ALL\"}"))));
        try {
            Protocol.getCommand(request);
            Assert.fail();
        } catch (final DatastoreException ex) {
            Assert.assertEquals(DatastoreException.Kind.SERIALIZATION, ex.getKind());
        }
    }

    @Test
    public void testErrorEnvelope() {
        final ObjectNode response = Protocol.newError(DatastoreException.uuidTaken("x"));
        try {
            Protocol.getResult(response);
            Assert.fail();
        } catch (final DatastoreException ex) {
            Assert.assertEquals(DatastoreException.Kind.UUID_TAKEN, ex.getKind());
            Assert.assertEquals("UUID already taken: x", ex.getMessage());
        }
    }

    @Test
    public void testValues() throws Exception {
        final UUID id1 = UUID.randomUUID();
        final UUID id2 = UUID.randomUUID();
        final Type type = Type.valueOf("reviewed");
        final Instant updated = Instant.parse("2023-11-14T22:13:20.123456789Z");
        final Edge<UUID> edge = Edge.create(id1, type, id2, Weight.valueOf(0.1f), updated);

        final Edge<UUID> decoded = this.protocol.decodeEdge(reparse(this.protocol
                .encodeEdge(edge)));
        Assert.assertEquals(edge.getKey(), decoded.getKey());
        Assert.assertEquals(edge.getWeight(), decoded.getWeight());
        Assert.assertEquals(updated, decoded.getUpdated());
        Assert.assertEquals(123456789, decoded.getUpdated().getNano());

        final Vertex<UUID> vertex = new Vertex<UUID>(id1, type);
        final List<Vertex<UUID>> vertices = this.protocol.decodeVertices(reparse(this.protocol
                .encodeVertices(ImmutableList.of(vertex))));
        Assert.assertEquals(1, vertices.size());
        Assert.assertEquals(id1, vertices.get(0).getId());
        Assert.assertEquals(type, vertices.get(0).getType());
    }

    @Test
    public void testQueries() throws Exception {
        final UUID id = UUID.randomUUID();
        final Type type = Type.valueOf("t");

        final VertexQuery<UUID> range = this.protocol.decodeVertexQuery(reparse(this.protocol
                .encodeVertexQuery(VertexQuery.range(id, type, 7))));
        Assert.assertEquals(VertexQuery.Kind.RANGE, range.getKind());
        Assert.assertEquals(id, range.getAfter());
        Assert.assertEquals(type, range.getType());
        Assert.assertEquals(7, range.getLimit());

        final VertexQuery<UUID> all = this.protocol.decodeVertexQuery(reparse(this.protocol
                .encodeVertexQuery(VertexQuery.<UUID>all())));
        Assert.assertNull(all.getAfter());
        Assert.assertNull(all.getType());
        Assert.assertEquals(Integer.MAX_VALUE, all.getLimit());

        final Instant low = Instant.parse("2020-01-01T00:00:00.000000001Z");
        final EdgeQuery<UUID> filter = this.protocol.decodeEdgeQuery(reparse(this.protocol
                .encodeEdgeQuery(EdgeQuery.<UUID>builder().inbound(id).type(type)
                        .minWeight(Weight.valueOf(-0.5f)).low(low).limit(3).build())));
        Assert.assertEquals(EdgeQuery.Kind.FILTER, filter.getKind());
        Assert.assertNull(filter.getOutboundId());
        Assert.assertEquals(id, filter.getInboundId());
        Assert.assertEquals(Weight.valueOf(-0.5f), filter.getMinWeight());
        Assert.assertNull(filter.getMaxWeight());
        Assert.assertEquals(low, filter.getLow());
        Assert.assertEquals(3, filter.getLimit());

        final EdgeKey<UUID> key = new EdgeKey<UUID>(id, type, id);
        final EdgeQuery<UUID> keys = this.protocol.decodeEdgeQuery(reparse(this.protocol
                .encodeEdgeQuery(EdgeQuery.keys(key))));
        Assert.assertEquals(ImmutableList.of(key), keys.getKeys());
    }

    @Test
    public void testInvalidValues() throws Exception {
        final JsonNode badType = reparse("{\"id\": \"" + UUID.randomUUID()
                + "\", \"type\": \"no spaces\"}");
        final JsonNode badId = reparse("{\"id\": \"42\", \"type\": \"t\"}");
        final JsonNode missing = reparse("{\"id\": \"" + UUID.randomUUID() + "\"}");
        for (final JsonNode node : new JsonNode[] { badType, badId, missing }) {
            try {
                this.protocol.decodeVertex(node);
                Assert.fail("Accepted " + node);
            } catch (final DatastoreException ex) {
                Assert.assertEquals(DatastoreException.Kind.SERIALIZATION, ex.getKind());
            }
        }
        try {
            Protocol.decodeWeight(reparse("1.5"));
            Assert.fail();
        } catch (final DatastoreException ex) {
            Assert.assertEquals(DatastoreException.Kind.SERIALIZATION, ex.getKind());
            Assert.assertTrue(ex.getCause() instanceof ValidationException);
        }
    }

    private static void checkSerializationError(final byte[] bytes) throws IOException {
        try {
            Protocol.readFrame(new DataInputStream(new ByteArrayInputStream(bytes)));
            Assert.fail();
        } catch (final DatastoreException ex) {
            Assert.assertEquals(DatastoreException.Kind.SERIALIZATION, ex.getKind());
        }
    }

    private static byte[] frame(final String json) throws IOException {
        final byte[] payload = json.getBytes(StandardCharsets.UTF_8);
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final DataOutputStream out = new DataOutputStream(bytes);
        out.writeInt(payload.length);
        out.write(payload);
        return bytes.toByteArray();
    }

    private static JsonNode reparse(final JsonNode node) throws IOException {
        return reparse(node.toString());
    }

    private static JsonNode reparse(final String json) throws IOException {
        final ObjectNode wrapper = Protocol.readFrame(new DataInputStream(
                new ByteArrayInputStream(frame("{\"value\": " + json + "}"))));
        return wrapper.get("value");
    }

}
