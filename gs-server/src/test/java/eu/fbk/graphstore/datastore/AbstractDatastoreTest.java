package eu.fbk.graphstore.datastore;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import eu.fbk.graphstore.data.Direction;
import eu.fbk.graphstore.data.Edge;
import eu.fbk.graphstore.data.EdgeKey;
import eu.fbk.graphstore.data.EdgeQuery;
import eu.fbk.graphstore.data.IdSpace;
import eu.fbk.graphstore.data.IdSpaces;
import eu.fbk.graphstore.data.Type;
import eu.fbk.graphstore.data.ValidationException;
import eu.fbk.graphstore.data.Vertex;
import eu.fbk.graphstore.data.VertexQuery;
import eu.fbk.graphstore.data.Weight;

/**
 * Abstract class for defining datastore tests. Every {@code Datastore} implementation is
 * expected to pass these tests, which ensures that implementations are interchangeable.
 * 
 * @param <I>
 *            the identifier type
 */
public abstract class AbstractDatastoreTest<I> {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00.000000001Z");

    private static final Instant T1 = Instant.parse("2024-01-01T00:00:01.500000000Z");

    private static final Instant T2 = Instant.parse("2024-01-02T12:30:00.999999999Z");

    /** Datastore to be used. */
    private Datastore<I> datastore;

    protected Type person;

    protected Type movie;

    protected Type likes;

    protected Type reviewed;

    protected abstract Datastore<I> createDatastore() throws IOException;

    protected final Datastore<I> getDatastore() {
        return this.datastore;
    }

    @Before
    public void setUp() throws IOException, ValidationException {
        this.person = Type.valueOf("person");
        this.movie = Type.valueOf("movie");
        this.likes = Type.valueOf("likes");
        this.reviewed = Type.valueOf("reviewed");
        this.datastore = createDatastore();
        this.datastore.init();
    }

    @After
    public void tearDown() throws IOException {
        this.datastore.close();
    }

    /**
     * Returns the n-th identifier of the datastore identifier space; identifiers are ordered as
     * the numbers they are derived from.
     * 
     * @param n
     *            a non-negative number
     * @return the identifier
     */
    @SuppressWarnings("unchecked")
    protected final I id(final long n) {
        final IdSpace<I> space = this.datastore.getIdSpace();
        if (space == IdSpaces.UUID) {
            return (I) new UUID(0L, n);
        } else if (space == IdSpaces.LONG) {
            return (I) Long.valueOf(n);
        } else {
            return (I) Strings.padStart(Long.toString(n), 8, '0');
        }
    }

    protected final Weight weight(final float value) {
        try {
            return Weight.valueOf(value);
        } catch (final ValidationException ex) {
            throw new IllegalArgumentException(ex);
        }
    }

    private void createVertices(final Type type, final long... ns) throws IOException {
        final Transaction<I> tx = this.datastore.begin(false);
        try {
            for (final long n : ns) {
                Assert.assertTrue(tx.createVertex(new Vertex<I>(id(n), type)));
            }
            tx.end(true);
        } finally {
            tx.end(false);
        }
    }

    @SafeVarargs
    private final void createEdges(final Edge<I>... edges) throws IOException {
        final Transaction<I> tx = this.datastore.begin(false);
        try {
            for (final Edge<I> edge : edges) {
                Assert.assertTrue(tx.createEdge(edge));
            }
            tx.end(true);
        } finally {
            tx.end(false);
        }
    }

    private List<I> ids(final List<Vertex<I>> vertices) {
        final List<I> ids = new ArrayList<I>();
        for (final Vertex<I> vertex : vertices) {
            ids.add(vertex.getId());
        }
        return ids;
    }

    private List<EdgeKey<I>> keys(final List<Edge<I>> edges) {
        final List<EdgeKey<I>> keys = new ArrayList<EdgeKey<I>>();
        for (final Edge<I> edge : edges) {
            keys.add(edge.getKey());
        }
        return keys;
    }

    @Test
    public void testCreateAndGetVertex() throws IOException {
        createVertices(this.person, 1);
        final Transaction<I> tx = this.datastore.begin(true);
        try {
            final List<Vertex<I>> vertices = tx.getVertices(VertexQuery.ids(id(1)));
            Assert.assertEquals(1, vertices.size());
            Assert.assertEquals(id(1), vertices.get(0).getId());
            Assert.assertEquals(this.person, vertices.get(0).getType());
            Assert.assertTrue(tx.getVertices(VertexQuery.ids(id(2))).isEmpty());
            Assert.assertEquals(1L, tx.getVertexCount());
        } finally {
            tx.end(true);
        }
    }

    @Test
    public void testDuplicateVertex() throws IOException {
        createVertices(this.person, 5);
        final Transaction<I> tx = this.datastore.begin(false);
        try {
            tx.createVertex(new Vertex<I>(id(5), this.movie));
            Assert.fail();
        } catch (final DatastoreException ex) {
            Assert.assertEquals(DatastoreException.Kind.UUID_TAKEN, ex.getKind());
        } finally {
            tx.end(false);
        }
        final Transaction<I> check = this.datastore.begin(true);
        try {
            final List<Vertex<I>> vertices = check.getVertices(VertexQuery.<I>all());
            Assert.assertEquals(1, vertices.size());
            Assert.assertEquals(this.person, vertices.get(0).getType());
        } finally {
            check.end(true);
        }
    }

    @SuppressWarnings("unchecked")
    @Test
    public void testUnpairedSurrogateId() throws IOException {
        if (this.datastore.getIdSpace() != IdSpaces.STRING) {
            return;
        }
        final Transaction<I> tx = this.datastore.begin(false);
        try {
            tx.createVertex(new Vertex<I>((I) "a", this.person));
            tx.createVertex(new Vertex<I>((I) "a\uD83D", this.person));
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            // ok
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testCreateVertexFromType() throws IOException {
        final I id;
        final Transaction<I> tx = this.datastore.begin(false);
        try {
            id = tx.createVertexFromType(this.movie);
            Assert.assertNotNull(id);
            Assert.assertNotEquals(id, tx.createVertexFromType(this.movie));
            tx.end(true);
        } finally {
            tx.end(false);
        }
        final Transaction<I> check = this.datastore.begin(true);
        try {
            final List<Vertex<I>> vertices = check.getVertices(VertexQuery.ids(id));
            Assert.assertEquals(1, vertices.size());
            Assert.assertEquals(this.movie, vertices.get(0).getType());
            Assert.assertEquals(2L, check.getVertexCount());
        } finally {
            check.end(true);
        }
    }

    @Test
    public void testVertexQueries() throws IOException {
        createVertices(this.person, 8, 2, 6, 4, 10);
        createVertices(this.movie, 1, 3, 5, 7, 9);
        final Transaction<I> tx = this.datastore.begin(true);
        try {
            final List<I> all = ids(tx.getVertices(VertexQuery.<I>all()));
            Assert.assertEquals(10, all.size());
            for (int i = 0; i < 10; ++i) {
                Assert.assertEquals(id(i + 1), all.get(i));
            }
            Assert.assertEquals(ImmutableList.of(id(4), id(5), id(6), id(7)),
                    ids(tx.getVertices(VertexQuery.range(id(3), null, 4))));
            Assert.assertEquals(ImmutableList.of(id(4), id(6), id(8)),
                    ids(tx.getVertices(VertexQuery.range(id(3), this.person, 3))));
            Assert.assertEquals(ImmutableList.of(id(1), id(3)),
                    ids(tx.getVertices(VertexQuery.range(null, this.movie, 2))));
            Assert.assertTrue(tx.getVertices(VertexQuery.range(id(10), null, 5)).isEmpty());
            Assert.assertTrue(tx.getVertices(VertexQuery.<I>range(null, null, 0)).isEmpty());
            Assert.assertEquals(ImmutableList.of(id(2), id(9)),
                    ids(tx.getVertices(VertexQuery.ids(id(9), id(2), id(99), id(2)))));
            Assert.assertEquals(10L, tx.getVertexCount());
        } finally {
            tx.end(true);
        }
    }

    @Test
    public void testDeleteVertices() throws IOException {
        createVertices(this.person, 1, 2, 3, 4);
        final Transaction<I> tx = this.datastore.begin(false);
        try {
            tx.deleteVertices(VertexQuery.ids(id(2), id(42)));
            tx.deleteVertices(VertexQuery.range(id(3), null, 1));
            tx.end(true);
        } finally {
            tx.end(false);
        }
        final Transaction<I> check = this.datastore.begin(true);
        try {
            Assert.assertEquals(ImmutableList.of(id(1), id(3)),
                    ids(check.getVertices(VertexQuery.<I>all())));
        } finally {
            check.end(true);
        }
    }

    @Test
    public void testEdgeCascade() throws IOException {
        createVertices(this.person, 1, 2, 3);
        createEdges(Edge.create(id(1), this.likes, id(2), weight(1.0f), T0),
                Edge.create(id(3), this.likes, id(1), weight(0.5f), T0),
                Edge.create(id(2), this.likes, id(3), weight(0.5f), T0));

        Transaction<I> tx = this.datastore.begin(true);
        try {
            final List<Edge<I>> edges = tx.getEdges(EdgeQuery.outbound(id(1)));
            Assert.assertEquals(1, edges.size());
            Assert.assertEquals(new EdgeKey<I>(id(1), this.likes, id(2)), edges.get(0).getKey());
            Assert.assertEquals(weight(1.0f), edges.get(0).getWeight());
            Assert.assertEquals(T0, edges.get(0).getUpdated());
        } finally {
            tx.end(true);
        }

        tx = this.datastore.begin(false);
        try {
            tx.deleteVertices(VertexQuery.ids(id(1)));
            tx.end(true);
        } finally {
            tx.end(false);
        }

        tx = this.datastore.begin(true);
        try {
            Assert.assertTrue(tx.getEdges(EdgeQuery.outbound(id(1))).isEmpty());
            Assert.assertTrue(tx.getEdges(EdgeQuery.inbound(id(1))).isEmpty());
            Assert.assertEquals(0L, tx.getEdgeCount(id(2), null, Direction.INBOUND));
            Assert.assertEquals(0L, tx.getEdgeCount(id(3), null, Direction.OUTBOUND));
            Assert.assertEquals(ImmutableList.of(new EdgeKey<I>(id(2), this.likes, id(3))),
                    keys(tx.getEdges(EdgeQuery.<I>builder().build())));
        } finally {
            tx.end(true);
        }
    }

    @Test
    public void testEdgeWithMissingVertex() throws IOException {
        createVertices(this.person, 1);
        final Transaction<I> tx = this.datastore.begin(false);
        try {
            Assert.assertFalse(tx.createEdge(Edge.create(id(1), this.likes, id(2), weight(0.5f),
                    T0)));
            Assert.assertFalse(tx.createEdge(Edge.create(id(2), this.likes, id(1), weight(0.5f),
                    T0)));
            Assert.assertTrue(tx.getEdges(EdgeQuery.<I>builder().build()).isEmpty());
            tx.end(true);
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testEdgeUpsert() throws IOException {
        createVertices(this.person, 1, 2);
        createEdges(Edge.create(id(1), this.likes, id(2), weight(0.5f), T1));

        // an older timestamp replaces the weight but not the timestamp
        createEdges(Edge.create(id(1), this.likes, id(2), weight(-0.25f), T0));
        Transaction<I> tx = this.datastore.begin(true);
        try {
            final List<Edge<I>> edges = tx.getEdges(EdgeQuery.<I>builder().build());
            Assert.assertEquals(1, edges.size());
            Assert.assertEquals(weight(-0.25f), edges.get(0).getWeight());
            Assert.assertEquals(T1, edges.get(0).getUpdated());
        } finally {
            tx.end(true);
        }

        // a newer timestamp replaces both, and repeating it changes nothing
        createEdges(Edge.create(id(1), this.likes, id(2), weight(0.75f), T2));
        createEdges(Edge.create(id(1), this.likes, id(2), weight(0.75f), T2));
        tx = this.datastore.begin(true);
        try {
            final List<Edge<I>> edges = tx.getEdges(EdgeQuery.<I>builder().build());
            Assert.assertEquals(1, edges.size());
            Assert.assertEquals(weight(0.75f), edges.get(0).getWeight());
            Assert.assertEquals(T2, edges.get(0).getUpdated());
            Assert.assertEquals(1L, tx.getEdgeCount(id(1), this.likes, Direction.OUTBOUND));
        } finally {
            tx.end(true);
        }
    }

    @Test
    public void testEdgeQueries() throws IOException {
        createVertices(this.person, 1, 2, 3);
        createVertices(this.movie, 10, 11);
        createEdges(Edge.create(id(2), this.likes, id(10), weight(0.9f), T2),
                Edge.create(id(1), this.reviewed, id(10), weight(-0.5f), T1),
                Edge.create(id(1), this.likes, id(11), weight(0.1f), T0),
                Edge.create(id(1), this.likes, id(10), weight(0.5f), T1),
                Edge.create(id(3), this.likes, id(1), weight(1.0f), T2));

        final Transaction<I> tx = this.datastore.begin(true);
        try {
            final EdgeKey<I> k1l10 = new EdgeKey<I>(id(1), this.likes, id(10));
            final EdgeKey<I> k1l11 = new EdgeKey<I>(id(1), this.likes, id(11));
            final EdgeKey<I> k1r10 = new EdgeKey<I>(id(1), this.reviewed, id(10));
            final EdgeKey<I> k2l10 = new EdgeKey<I>(id(2), this.likes, id(10));
            final EdgeKey<I> k3l1 = new EdgeKey<I>(id(3), this.likes, id(1));

            Assert.assertEquals(ImmutableList.of(k1l10, k1l11, k1r10, k2l10, k3l1),
                    keys(tx.getEdges(EdgeQuery.<I>builder().build())));
            Assert.assertEquals(ImmutableList.of(k1l10, k1l11, k1r10),
                    keys(tx.getEdges(EdgeQuery.outbound(id(1)))));
            Assert.assertEquals(ImmutableList.of(k1l10, k1r10, k2l10),
                    keys(tx.getEdges(EdgeQuery.inbound(id(10)))));
            Assert.assertEquals(ImmutableList.of(k1l10, k2l10),
                    keys(tx.getEdges(EdgeQuery.<I>builder().inbound(id(10)).type(this.likes)
                            .build())));
            Assert.assertEquals(ImmutableList.of(k1l10, k1l11),
                    keys(tx.getEdges(EdgeQuery.<I>builder().outbound(id(1)).type(this.likes)
                            .build())));
            Assert.assertEquals(ImmutableList.of(k1l10, k1r10),
                    keys(tx.getEdges(EdgeQuery.<I>builder().outbound(id(1)).inbound(id(10))
                            .build())));
            Assert.assertEquals(ImmutableList.of(k1l10, k2l10, k3l1),
                    keys(tx.getEdges(EdgeQuery.<I>builder().minWeight(weight(0.5f)).build())));
            Assert.assertEquals(ImmutableList.of(k1l11, k1r10),
                    keys(tx.getEdges(EdgeQuery.<I>builder().maxWeight(weight(0.1f)).build())));
            Assert.assertEquals(ImmutableList.of(k1l10, k1r10),
                    keys(tx.getEdges(EdgeQuery.<I>builder().low(T1).high(T1).build())));
            Assert.assertEquals(ImmutableList.of(k1l10, k1r10, k2l10, k3l1),
                    keys(tx.getEdges(EdgeQuery.<I>builder().low(T0.plusNanos(1)).build())));
            Assert.assertEquals(ImmutableList.of(k1l10, k1l11),
                    keys(tx.getEdges(EdgeQuery.<I>builder().limit(2).build())));
            Assert.assertEquals(ImmutableList.of(k2l10),
                    keys(tx.getEdges(EdgeQuery.<I>builder().type(this.likes).inbound(id(10))
                            .limit(2).low(T2).build())));
            Assert.assertEquals(ImmutableList.of(k1l11, k3l1),
                    keys(tx.getEdges(EdgeQuery.keys(k3l1, new EdgeKey<I>(id(3), this.likes,
                            id(2)), k1l11))));

            Assert.assertEquals(3L, tx.getEdgeCount(id(1), null, Direction.OUTBOUND));
            Assert.assertEquals(2L, tx.getEdgeCount(id(1), this.likes, Direction.OUTBOUND));
            Assert.assertEquals(1L, tx.getEdgeCount(id(1), null, Direction.INBOUND));
            Assert.assertEquals(3L, tx.getEdgeCount(id(10), null, Direction.INBOUND));
            Assert.assertEquals(1L, tx.getEdgeCount(id(10), this.reviewed, Direction.INBOUND));
            Assert.assertEquals(0L, tx.getEdgeCount(id(10), null, Direction.OUTBOUND));
        } finally {
            tx.end(true);
        }
    }

    @Test
    public void testDeleteEdges() throws IOException {
        createVertices(this.person, 1, 2, 3);
        createEdges(Edge.create(id(1), this.likes, id(2), weight(0.5f), T0),
                Edge.create(id(1), this.reviewed, id(2), weight(0.5f), T0),
                Edge.create(id(1), this.likes, id(3), weight(-0.5f), T0),
                Edge.create(id(2), this.likes, id(3), weight(0.5f), T0));

        Transaction<I> tx = this.datastore.begin(false);
        try {
            tx.deleteEdges(EdgeQuery.keys(new EdgeKey<I>(id(1), this.reviewed, id(2))));
            tx.deleteEdges(EdgeQuery.<I>builder().outbound(id(1)).maxWeight(weight(0.0f))
                    .build());
            tx.end(true);
        } finally {
            tx.end(false);
        }

        tx = this.datastore.begin(true);
        try {
            Assert.assertEquals(ImmutableList.of(new EdgeKey<I>(id(1), this.likes, id(2)),
                    new EdgeKey<I>(id(2), this.likes, id(3))), keys(tx.getEdges(EdgeQuery
                    .<I>builder().build())));
            Assert.assertEquals(3L, tx.getVertexCount());
        } finally {
            tx.end(true);
        }
    }

    @Test
    public void testRollback() throws IOException {
        createVertices(this.person, 1, 2);
        createEdges(Edge.create(id(1), this.likes, id(2), weight(0.5f), T0));

        Transaction<I> tx = this.datastore.begin(false);
        try {
            tx.createVertex(new Vertex<I>(id(3), this.movie));
            tx.createEdge(Edge.create(id(2), this.likes, id(3), weight(0.5f), T1));
            tx.createEdge(Edge.create(id(1), this.likes, id(2), weight(-1.0f), T2));
            tx.deleteVertices(VertexQuery.ids(id(1)));
            Assert.assertEquals(2L, tx.getVertexCount());
        } finally {
            tx.end(false);
        }

        tx = this.datastore.begin(true);
        try {
            Assert.assertEquals(ImmutableList.of(id(1), id(2)),
                    ids(tx.getVertices(VertexQuery.<I>all())));
            final List<Edge<I>> edges = tx.getEdges(EdgeQuery.<I>builder().build());
            Assert.assertEquals(1, edges.size());
            Assert.assertEquals(weight(0.5f), edges.get(0).getWeight());
            Assert.assertEquals(T0, edges.get(0).getUpdated());
            Assert.assertEquals(1L, tx.getEdgeCount(id(2), this.likes, Direction.INBOUND));
        } finally {
            tx.end(true);
        }
    }

    @Test
    public void testReadOnly() throws IOException {
        createVertices(this.person, 1);
        final Transaction<I> tx = this.datastore.begin(true);
        try {
            try {
                tx.createVertex(new Vertex<I>(id(2), this.person));
                Assert.fail();
            } catch (final IllegalStateException ex) {
                // ok
            }
            try {
                tx.deleteVertices(VertexQuery.<I>all());
                Assert.fail();
            } catch (final IllegalStateException ex) {
                // ok
            }
            try {
                tx.createEdge(Edge.create(id(1), this.likes, id(1), weight(0.0f), T0));
                Assert.fail();
            } catch (final IllegalStateException ex) {
                // ok
            }
            Assert.assertEquals(1L, tx.getVertexCount());
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testEndedTransaction() throws IOException {
        final Transaction<I> tx = this.datastore.begin(false);
        tx.createVertex(new Vertex<I>(id(1), this.person));
        tx.end(true);
        tx.end(false); // no effect
        try {
            tx.getVertexCount();
            Assert.fail();
        } catch (final IllegalStateException ex) {
            // ok
        }
        final Transaction<I> check = this.datastore.begin(true);
        try {
            Assert.assertEquals(1L, check.getVertexCount());
        } finally {
            check.end(true);
        }
    }

    @Test
    public void testBatch() throws IOException {
        final List<Object> results = Batch.<I>builder()
                .createVertex(new Vertex<I>(id(1), this.person))
                .createVertex(new Vertex<I>(id(2), this.movie))
                .createEdge(Edge.create(id(1), this.likes, id(2), weight(1.0f), T0))
                .createEdge(Edge.create(id(1), this.likes, id(3), weight(1.0f), T0))
                .getEdgeCount(id(1), null, Direction.OUTBOUND).build()
                .execute(this.datastore);
        Assert.assertEquals(5, results.size());
        Assert.assertEquals(Boolean.TRUE, results.get(2));
        Assert.assertEquals(Boolean.FALSE, results.get(3));
        Assert.assertEquals(Long.valueOf(1L), results.get(4));

        try {
            Batch.<I>builder().createVertex(new Vertex<I>(id(3), this.person))
                    .deleteVertices(VertexQuery.ids(id(1)))
                    .createVertex(new Vertex<I>(id(2), this.person)).build()
                    .execute(this.datastore);
            Assert.fail();
        } catch (final DatastoreException ex) {
            Assert.assertEquals(DatastoreException.Kind.UUID_TAKEN, ex.getKind());
        }

        final Transaction<I> tx = this.datastore.begin(true);
        try {
            Assert.assertEquals(ImmutableList.of(id(1), id(2)),
                    ids(tx.getVertices(VertexQuery.<I>all())));
            Assert.assertEquals(1L, tx.getEdgeCount(id(2), this.likes, Direction.INBOUND));
        } finally {
            tx.end(true);
        }
    }

}
