package eu.fbk.graphstore.data;

import org.junit.Assert;
import org.junit.Test;

public class WeightTest {

    @Test
    public void testBounds() throws ValidationException {
        Assert.assertEquals(-1.0f, Weight.valueOf(-1.0f).getValue(), 0.0f);
        Assert.assertEquals(0.0f, Weight.valueOf(0.0f).getValue(), 0.0f);
        Assert.assertEquals(1.0f, Weight.valueOf(1.0f).getValue(), 0.0f);
        Assert.assertEquals(Weight.valueOf(0.5f), Weight.valueOf(0.5f));
        Assert.assertNotEquals(Weight.valueOf(0.5f), Weight.valueOf(0.25f));
    }

    @Test
    public void testOutOfRange() {
        for (final float value : new float[] { 1.0001f, -1.0001f, 2.0f, Float.NaN,
                Float.POSITIVE_INFINITY, Float.NEGATIVE_INFINITY }) {
            try {
                Weight.valueOf(value);
                Assert.fail("Accepted " + value);
            } catch (final ValidationException ex) {
                Assert.assertEquals(ValidationException.Reason.INVALID_VALUE, ex.getReason());
            }
        }
    }

}
