package com.hydrology.dtss.time;

import org.junit.Test;

import static org.junit.Assert.*;

public class PointSeriesTest {
    private static final TimeAxis AXIS = new TimeAxis(0, 10, 3);

    @Test
    public void testAverageValueIsStairCase() {
        PointSeries s = new PointSeries(AXIS, new double[] { 1, 2, 3 }, PointInterpretation.POINT_AVERAGE_VALUE);
        assertEquals(1.0, s.valueAt(0), 0.0);
        assertEquals(1.0, s.valueAt(9), 0.0);
        assertEquals(3.0, s.valueAt(25), 0.0);
        assertTrue(Double.isNaN(s.valueAt(30)));
    }

    @Test
    public void testInstantValueIsLinearThenFlat() {
        PointSeries s = new PointSeries(AXIS, new double[] { 0, 10, 20 }, PointInterpretation.POINT_INSTANT_VALUE);
        assertEquals(5.0, s.valueAt(5), 1e-12);
        assertEquals(12.0, s.valueAt(12), 1e-12);
        assertEquals(20.0, s.valueAt(29), 1e-12);
    }

    @Test
    public void testInstantValueHoldsBeforeNaN() {
        PointSeries s = new PointSeries(AXIS, new double[] { 4, Double.NaN, 1 },
                PointInterpretation.POINT_INSTANT_VALUE);
        assertEquals(4.0, s.valueAt(5), 0.0);
    }

    @Test
    public void testClip() {
        PointSeries s = new PointSeries(AXIS, new double[] { 1, 2, 3 }, PointInterpretation.POINT_AVERAGE_VALUE);
        assertSame(s, s.clip(new UtcPeriod(0, 30)));
        PointSeries c = s.clip(new UtcPeriod(12, 18));
        assertEquals(new TimeAxis(10, 10, 1), c.timeAxis());
        assertEquals(2.0, c.value(0), 0.0);
        assertEquals(0, s.clip(new UtcPeriod(100, 200)).size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testValueCountMustMatchAxis() {
        new PointSeries(AXIS, new double[2], PointInterpretation.POINT_AVERAGE_VALUE);
    }

    @Test
    public void testValuesReturnsCopy() {
        PointSeries s = PointSeries.constant(AXIS, 7.0, PointInterpretation.POINT_AVERAGE_VALUE);
        s.values()[0] = 0;
        assertEquals(7.0, s.value(0), 0.0);
    }
}
