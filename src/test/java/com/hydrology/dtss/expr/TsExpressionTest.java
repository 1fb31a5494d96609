package com.hydrology.dtss.expr;

import java.util.List;

import org.junit.Test;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.TimeAxis;

import static com.hydrology.dtss.expr.TsExpressions.*;
import static org.junit.Assert.*;

public class TsExpressionTest {
    private static final TimeAxis AXIS = new TimeAxis(0, 3600, 24);

    @Test
    public void testBoundFlagFollowsChildren() {
        TsExpression x = ref("X");
        assertFalse(x.isBound());
        assertFalse(average(x, AXIS).isBound());
        assertFalse(add(x, constant(AXIS, 1.0)).isBound());
        assertTrue(add(constant(AXIS, 2.0), constant(AXIS, 1.0)).isBound());
        assertTrue(periodic(new double[] { 1 }, 3600, 0, AXIS).isBound());
    }

    @Test
    public void testBinaryOpAxisFixedOnceBound() {
        BinaryOpNode unbound = add(ref("X"), constant(AXIS, 1.0));
        assertNull(unbound.timeAxis());

        TimeAxis other = new TimeAxis(0, 1800, 24);
        BinaryOpNode bound = (BinaryOpNode) unbound.withChildren(List.of(constant(other, 2.0), unbound.rhs()));
        assertTrue(bound.isBound());
        assertEquals(new TimeAxis(0, 1800, 24), bound.timeAxis());
    }

    @Test
    public void testWithSameChildrenReturnsSameNode() {
        TsExpression src = constant(AXIS, 1.0);
        TimeShiftNode shift = timeShift(src, 600);
        assertSame(shift, shift.withChildren(List.of(src)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWithChildrenChecksArity() {
        average(constant(AXIS, 1.0), AXIS).withChildren(List.of());
    }

    @Test
    public void testStructuralEquality() {
        assertEquals(mul(ref("A"), 2.0), mul(ref("A"), 2.0));
        assertEquals(mul(ref("A"), 2.0).hashCode(), mul(ref("A"), 2.0).hashCode());
        assertNotEquals(mul(ref("A"), 2.0), mul(ref("B"), 2.0));
        assertNotEquals(convolve(ref("A"), ConvolvePolicy.USE_ZERO, 1, 2),
                convolve(ref("A"), ConvolvePolicy.SKIP, 1, 2));
    }

    @Test
    public void testPeriodicRepeatsInBothDirections() {
        PeriodicNode p = periodic(new double[] { 1, 2, 3 }, 10, 100, AXIS);
        assertEquals(1.0, p.valueAt(100), 0.0);
        assertEquals(3.0, p.valueAt(125), 0.0);
        assertEquals(1.0, p.valueAt(130), 0.0);
        assertEquals(3.0, p.valueAt(95), 0.0);
        assertEquals(2.0, p.valueAt(80), 0.0);
    }

    @Test
    public void testConvolveSkipShortensAxis() {
        TimeAxis ta = new TimeAxis(0, 10, 5);
        assertEquals(ta, convolve(constant(ta, 1), ConvolvePolicy.USE_ZERO, 0.5, 0.5).timeAxis());
        assertEquals(new TimeAxis(20, 10, 3),
                convolve(constant(ta, 1), ConvolvePolicy.SKIP, 0.2, 0.3, 0.5).timeAxis());
    }

    @Test
    public void testResamplingInterpretation() {
        assertEquals(PointInterpretation.POINT_AVERAGE_VALUE, average(ref("X"), AXIS).interpretation());
        assertEquals(PointInterpretation.POINT_INSTANT_VALUE, accumulate(ref("X"), AXIS).interpretation());
    }

    @Test
    public void testDivisionByZeroIsNaN() {
        assertTrue(Double.isNaN(OpCode.DIV.apply(1.0, 0.0)));
        assertEquals(2.0, OpCode.DIV.apply(4.0, 2.0), 0.0);
        assertEquals(OpCode.MAX, OpCode.fromString("max"));
    }

    @Test(expected = IllegalStateException.class)
    public void testVectorSeriesRequiresPointNode() {
        TsVector.of(ref("X")).series(0);
    }

    @Test
    public void testDeepChainsCompareStructurally() {
        TsExpression a = ref("X");
        TsExpression b = ref("X");
        TsExpression c = ref("X");
        for (int i = 0; i < 20_000; i++) {
            a = add(a, 1.0);
            b = add(b, 1.0);
            c = add(c, i == 0 ? 2.0 : 1.0);
        }
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test(timeout = 10_000)
    public void testSharedDiamondsCompareInLinearTime() {
        TsExpression a = constant(AXIS, 1.0);
        TsExpression b = constant(AXIS, 1.0);
        for (int i = 0; i < 64; i++) {
            a = add(a, a);
            b = add(b, b);
        }
        assertEquals(a, b);
        assertNotEquals(a, add(b, 0.0));
    }
}
