package eu.fbk.graphstore.datastore;

import java.time.Instant;
import java.util.UUID;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import eu.fbk.graphstore.data.Edge;
import eu.fbk.graphstore.data.EdgeKey;
import eu.fbk.graphstore.data.IdSpaces;
import eu.fbk.graphstore.data.Type;
import eu.fbk.graphstore.data.ValidationException;
import eu.fbk.graphstore.data.Weight;

public class RocksKeysTest {

    private RocksKeys<UUID> keys;

    private Type likes;

    private EdgeKey<UUID> key;

    @Before
    public void setUp() throws ValidationException {
        this.keys = new RocksKeys<UUID>(IdSpaces.UUID);
        this.likes = Type.valueOf("likes");
        this.key = new EdgeKey<UUID>(new UUID(1L, 2L), this.likes, new UUID(3L, 4L));
    }

    @Test
    public void testEdgeKeys() throws DatastoreException {
        Assert.assertEquals(this.key, this.keys.edgeKey(this.keys.edge(this.key)));
        Assert.assertEquals(this.key, this.keys.edgeKey(this.keys.inbound(this.key)));
        Assert.assertEquals(this.key, this.keys.edgeKey(this.keys.edgeType(this.key)));
    }

    @Test
    public void testPrefixes() {
        final byte[] edge = this.keys.edge(this.key);
        Assert.assertTrue(RocksKeys.hasPrefix(edge, this.keys.edgePrefix(this.key
                .getOutboundId(), null)));
        Assert.assertTrue(RocksKeys.hasPrefix(edge, this.keys.edgePrefix(this.key
                .getOutboundId(), this.likes)));
        Assert.assertFalse(RocksKeys.hasPrefix(edge, this.keys.edgePrefix(this.key
                .getInboundId(), null)));
        Assert.assertTrue(RocksKeys.hasPrefix(this.keys.inbound(this.key), this.keys
                .inboundPrefix(this.key.getInboundId(), this.likes)));
        Assert.assertTrue(RocksKeys.hasPrefix(this.keys.edgeType(this.key), this.keys
                .edgeTypePrefix(this.likes)));
        Assert.assertTrue(RocksKeys.hasPrefix(this.keys.vertexType(this.likes, this.key
                .getOutboundId()), this.keys.vertexType(this.likes, null)));
    }

    @Test
    public void testVertexKeys() throws DatastoreException {
        final UUID id = new UUID(5L, 6L);
        Assert.assertEquals(id, this.keys.vertexId(this.keys.vertex(id)));
        Assert.assertEquals(id, this.keys.vertexTypeId(this.keys.vertexType(this.likes, id)));
        Assert.assertEquals(this.likes, this.keys.decodeType(this.keys.encodeType(this.likes)));
    }

    @Test
    public void testEdgeValue() throws DatastoreException, ValidationException {
        final Edge<UUID> edge = Edge.create(this.key, Weight.valueOf(-0.75f),
                Instant.parse("1969-12-31T23:59:59.999999999Z"));
        final Edge<UUID> decoded = this.keys.decodeEdge(this.key, this.keys.encodeEdge(edge));
        Assert.assertEquals(edge.getWeight(), decoded.getWeight());
        Assert.assertEquals(edge.getUpdated(), decoded.getUpdated());
    }

    @Test
    public void testCorruptedValues() {
        try {
            this.keys.decodeEdge(this.key, new byte[3]);
            Assert.fail();
        } catch (final DatastoreException ex) {
            Assert.assertEquals(DatastoreException.Kind.SERIALIZATION, ex.getKind());
        }
        try {
            this.keys.edgeKey(new byte[] { RocksKeys.EDGE, 0, 0 });
            Assert.fail();
        } catch (final DatastoreException ex) {
            Assert.assertEquals(DatastoreException.Kind.SERIALIZATION, ex.getKind());
        }
        try {
            this.keys.decodeType(new byte[] { '?' });
            Assert.fail();
        } catch (final DatastoreException ex) {
            Assert.assertEquals(DatastoreException.Kind.SERIALIZATION, ex.getKind());
        }
    }

}
