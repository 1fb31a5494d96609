package com.hydrology.dtss.eval;

import java.util.List;

import org.junit.Test;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.TimeAxis;

import static org.junit.Assert.*;

public class PercentileCalculatorTest {
    private static final TimeAxis AXIS = new TimeAxis(0, 3600, 2);

    private static PointSeries constant(double v) {
        return PointSeries.constant(AXIS, v, PointInterpretation.POINT_AVERAGE_VALUE);
    }

    @Test
    public void testMeanAndMedianOfThreeMembers() {
        List<PointSeries> ensemble = List.of(constant(1), constant(3), constant(2));
        List<PointSeries> r = PercentileCalculator.compute(ensemble, AXIS, List.of(-1, 50));
        assertEquals(2, r.size());
        assertEquals(2.0, r.get(0).value(0), 1e-12);
        assertEquals(2.0, r.get(1).value(1), 1e-12);
    }

    @Test
    public void testOrderFollowsRequest() {
        List<PointSeries> ensemble = List.of(constant(1), constant(2), constant(3));
        List<PointSeries> r = PercentileCalculator.compute(ensemble, AXIS, List.of(100, 0, 25, -1));
        assertEquals(3.0, r.get(0).value(0), 1e-12);
        assertEquals(1.0, r.get(1).value(0), 1e-12);
        assertEquals(1.5, r.get(2).value(0), 1e-12);
        assertEquals(2.0, r.get(3).value(0), 1e-12);
        assertEquals(AXIS, r.get(0).timeAxis());
    }

    @Test
    public void testMembersAreAlignedToOutputAxis() {
        TimeAxis fine = new TimeAxis(0, 1800, 4);
        PointSeries m = new PointSeries(fine, new double[] { 1, 3, 5, 7 }, PointInterpretation.POINT_AVERAGE_VALUE);
        List<PointSeries> r = PercentileCalculator.compute(List.of(m), AXIS, List.of(-1));
        assertEquals(2.0, r.get(0).value(0), 1e-12);
        assertEquals(6.0, r.get(0).value(1), 1e-12);
    }

    @Test
    public void testNaNMembersAreLeftOut() {
        List<PointSeries> ensemble = List.of(constant(Double.NaN), constant(4), constant(2));
        List<PointSeries> r = PercentileCalculator.compute(ensemble, AXIS, List.of(-1, 100));
        assertEquals(3.0, r.get(0).value(0), 1e-12);
        assertEquals(4.0, r.get(1).value(0), 1e-12);

        List<PointSeries> empty = PercentileCalculator.compute(List.of(constant(Double.NaN)), AXIS, List.of(50));
        assertTrue(Double.isNaN(empty.get(0).value(0)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsOutOfRangePercentile() {
        PercentileCalculator.validate(List.of(50, 101));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsBelowMean() {
        PercentileCalculator.validate(List.of(-2));
    }
}
