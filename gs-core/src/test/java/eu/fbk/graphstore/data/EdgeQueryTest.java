package eu.fbk.graphstore.data;

import java.time.Instant;

import org.junit.Assert;
import org.junit.Test;

public class EdgeQueryTest {

    @Test
    public void testMatches() throws ValidationException {
        final Type likes = Type.valueOf("likes");
        final Instant ts = Instant.parse("2024-05-01T10:00:00.123456789Z");
        final Edge<Long> edge = Edge.create(1L, likes, 2L, Weight.valueOf(0.5f), ts);

        Assert.assertTrue(EdgeQuery.<Long>outbound(1L).matches(edge));
        Assert.assertFalse(EdgeQuery.<Long>outbound(2L).matches(edge));
        Assert.assertTrue(EdgeQuery.<Long>inbound(2L).matches(edge));
        Assert.assertTrue(EdgeQuery.<Long>builder().type(likes).minWeight(Weight.valueOf(0.5f))
                .maxWeight(Weight.valueOf(0.5f)).build().matches(edge));
        Assert.assertFalse(EdgeQuery.<Long>builder().minWeight(Weight.valueOf(0.6f)).build()
                .matches(edge));
        Assert.assertTrue(EdgeQuery.<Long>builder().low(ts).high(ts).build().matches(edge));
        Assert.assertFalse(EdgeQuery.<Long>builder().low(ts.plusNanos(1)).build()
                .matches(edge));
        Assert.assertFalse(EdgeQuery.<Long>builder().high(ts.minusNanos(1)).build()
                .matches(edge));
        Assert.assertTrue(EdgeQuery.keys(new EdgeKey<Long>(1L, likes, 2L)).matches(edge));
        Assert.assertFalse(EdgeQuery.keys(new EdgeKey<Long>(2L, likes, 1L)).matches(edge));
    }

    @Test
    public void testEdgeIdentity() throws ValidationException {
        final Type likes = Type.valueOf("likes");
        final Edge<Long> first = Edge.create(1L, likes, 2L, Weight.valueOf(0.5f),
                Instant.EPOCH);
        final Edge<Long> second = Edge.createWithCurrentDatetime(1L, likes, 2L,
                Weight.valueOf(-0.5f));
        Assert.assertEquals(first, second);
        Assert.assertEquals(first.hashCode(), second.hashCode());
        Assert.assertEquals(new EdgeKey<Long>(2L, likes, 1L), first.getKey().reverse());
        Assert.assertEquals(new Vertex<Long>(1L, likes), new Vertex<Long>(1L,
                Type.valueOf("other")));
    }

    @Test
    public void testKeyOrder() throws ValidationException {
        final Type a = Type.valueOf("a");
        final Type b = Type.valueOf("b");
        final java.util.Comparator<EdgeKey<Long>> comparator = EdgeKey.comparator(IdSpaces.LONG);
        Assert.assertTrue(comparator.compare(new EdgeKey<Long>(1L, b, 9L), new EdgeKey<Long>(2L,
                a, 0L)) < 0);
        Assert.assertTrue(comparator.compare(new EdgeKey<Long>(1L, a, 9L), new EdgeKey<Long>(1L,
                b, 0L)) < 0);
        Assert.assertTrue(comparator.compare(new EdgeKey<Long>(1L, a, -9L), new EdgeKey<Long>(
                1L, a, 0L)) < 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeLimit() {
        EdgeQuery.<Long>builder().limit(-1);
    }

}
