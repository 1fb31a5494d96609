package com.hydrology.dtss.io;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.hydrology.dtss.api.CycleException;
import com.hydrology.dtss.api.DecodeException;
import com.hydrology.dtss.expr.BinaryOpNode;
import com.hydrology.dtss.expr.ConvolvePolicy;
import com.hydrology.dtss.expr.NodeKind;
import com.hydrology.dtss.expr.OpCode;
import com.hydrology.dtss.expr.TsExpression;
import com.hydrology.dtss.expr.TsVector;
import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.TimeAxis;

import static com.hydrology.dtss.expr.TsExpressions.*;
import static org.junit.Assert.*;

public class TsCodecTest {
    private static final TimeAxis AXIS = new TimeAxis(1_700_000_000L, 3600, 4);

    private static TsExpression src() {
        return point(new PointSeries(AXIS, new double[] { 1, Double.NaN, 3, 4 },
                PointInterpretation.POINT_INSTANT_VALUE));
    }

    @Test
    public void testEveryVariantRoundTrips() {
        TimeAxis daily = new TimeAxis(AXIS.start(), 86400, 1);
        List<TsExpression> all = List.of(
                src(),
                ref("catchment/1/q"),
                average(src(), daily),
                integral(ref("r"), daily),
                accumulate(src(), AXIS),
                timeShift(src(), -7200),
                periodic(new double[] { 0.5, 1.5 }, 43200, 0, AXIS),
                convolve(src(), ConvolvePolicy.USE_ZERO, 0.2, 0.8),
                convolve(ref("r"), ConvolvePolicy.SKIP, 0.1, 0.2, 0.7),
                add(src(), constant(daily, 2)),
                op(ref("a"), OpCode.MIN, src()),
                new BinaryOpNode(ref("a"), OpCode.SUB, ref("b"), AXIS),
                mul(src(), 3.5),
                div(2.0, ref("b")));
        for (TsExpression e : all) {
            TsExpression back = TsCodec.decodeExpression(TsCodec.encode(e));
            assertEquals(e.kind().toString(), e, back);
            assertEquals(e.isBound(), back.isBound());
            assertEquals(e.timeAxis(), back.timeAxis());
        }
    }

    @Test
    public void testSharingIsPreserved() {
        TsExpression shared = average(ref("X"), AXIS);
        TsVector v = TsVector.of(add(shared, shared), mul(shared, 2.0), shared);

        TsVector back = TsCodec.decode(TsCodec.encode(v));

        assertEquals(v, back);
        BinaryOpNode sum = (BinaryOpNode) back.get(0);
        assertSame(sum.lhs(), sum.rhs());
        assertSame(sum.lhs(), back.get(2));
        assertSame(back.get(2), back.get(1).children().get(0));
    }

    @Test
    public void testSharedNodeWrittenOnce() {
        TsExpression shared = src();
        byte[] once = TsCodec.encode(TsVector.of(add(shared, shared)));
        byte[] twice = TsCodec.encode(TsVector.of(add(src(), src())));
        assertTrue(once.length < twice.length);
    }

    @Test
    public void testEmptyVector() {
        assertEquals(0, TsCodec.decode(TsCodec.encode(TsVector.empty())).size());
    }

    @Test
    public void testCycleIsRejected() {
        // two time shifts pointing at each other
        BinaryWriter w = new BinaryWriter();
        w.writeInt(TsCodec.MAGIC).writeShort(TsCodec.FORMAT_VERSION).writeInt(2);
        w.writeByte(NodeKind.TIME_SHIFT.tag()).writeByte(1).writeLong(0).writeInt(1);
        w.writeByte(NodeKind.TIME_SHIFT.tag()).writeByte(1).writeLong(0).writeInt(0);
        w.writeByte(NodeKind.VECTOR.tag()).writeByte(1).writeInt(1).writeInt(0);
        try {
            TsCodec.decode(w.toByteArray());
            fail("Expected CycleException");
        } catch (CycleException e) {
            assertTrue(e.getMessage().contains("cycle"));
        }
    }

    @Test
    public void testSelfReferenceIsRejected() {
        BinaryWriter w = new BinaryWriter();
        w.writeInt(TsCodec.MAGIC).writeShort(TsCodec.FORMAT_VERSION).writeInt(1);
        w.writeByte(NodeKind.AVERAGE.tag()).writeByte(1).writeAxis(AXIS).writeInt(0);
        w.writeByte(NodeKind.VECTOR.tag()).writeByte(1).writeInt(1).writeInt(0);
        try {
            TsCodec.decode(w.toByteArray());
            fail("Expected CycleException");
        } catch (CycleException e) {
            // expected
        }
    }

    @Test
    public void testBadMagic() {
        byte[] data = TsCodec.encode(src());
        data[0] = 'X';
        try {
            TsCodec.decode(data);
            fail("Expected DecodeException");
        } catch (DecodeException e) {
            assertEquals(0, e.offset());
        }
    }

    @Test
    public void testTruncatedData() {
        byte[] data = TsCodec.encode(TsVector.of(add(src(), ref("x"))));
        for (int len : new int[] { 3, 10, data.length / 2, data.length - 1 }) {
            try {
                TsCodec.decode(Arrays.copyOf(data, len));
                fail("Expected DecodeException for length " + len);
            } catch (DecodeException e) {
                assertTrue(e.offset() <= len);
            }
        }
    }

    @Test(expected = DecodeException.class)
    public void testTrailingBytes() {
        byte[] data = TsCodec.encode(src());
        TsCodec.decode(Arrays.copyOf(data, data.length + 1));
    }

    @Test
    public void testUnknownTag() {
        byte[] data = TsCodec.encode(ref("x"));
        // header is magic(4) + version(2) + count(4)
        data[10] = 99;
        try {
            TsCodec.decode(data);
            fail("Expected DecodeException");
        } catch (DecodeException e) {
            assertEquals(10, e.offset());
            assertTrue(e.getMessage().contains("99"));
        }
    }

    @Test(expected = DecodeException.class)
    public void testFutureNodeVersion() {
        byte[] data = TsCodec.encode(ref("x"));
        data[11] = 2;
        TsCodec.decode(data);
    }

    @Test(expected = DecodeException.class)
    public void testChildIndexOutOfRange() {
        BinaryWriter w = new BinaryWriter();
        w.writeInt(TsCodec.MAGIC).writeShort(TsCodec.FORMAT_VERSION).writeInt(1);
        w.writeByte(NodeKind.TIME_SHIFT.tag()).writeByte(1).writeLong(0).writeInt(5);
        w.writeByte(NodeKind.VECTOR.tag()).writeByte(1).writeInt(1).writeInt(0);
        TsCodec.decode(w.toByteArray());
    }

    @Test(expected = DecodeException.class)
    public void testContradictingBoundFlag() {
        byte[] data = TsCodec.encode(mul(src(), 2.0));
        // the bound flag is the last byte before the VECTOR record (tag, version, count, index)
        int flag = data.length - 1 - 10;
        assertEquals(1, data[flag]);
        data[flag] = 0;
        TsCodec.decode(data);
    }

    @Test
    public void testDeepChainRoundTrips() {
        TsExpression e = ref("X");
        for (int i = 0; i < 20_000; i++)
            e = i % 2 == 0 ? add(e, 1.0) : mul(2.0, e);
        TsExpression decoded = TsCodec.decodeExpression(TsCodec.encode(e));
        assertNotSame(e, decoded);
        assertEquals(e, decoded);
        assertFalse(decoded.isBound());
    }

    @Test
    public void testLongCycleIsRejected() {
        // node i shifts node i + 1, the last one shifts node 0
        int n = 20_000;
        BinaryWriter w = new BinaryWriter();
        w.writeInt(TsCodec.MAGIC).writeShort(TsCodec.FORMAT_VERSION).writeInt(n);
        for (int i = 0; i < n; i++)
            w.writeByte(NodeKind.TIME_SHIFT.tag()).writeByte(1).writeLong(0).writeInt((i + 1) % n);
        w.writeByte(NodeKind.VECTOR.tag()).writeByte(1).writeInt(1).writeInt(0);
        try {
            TsCodec.decode(w.toByteArray());
            fail("Expected CycleException");
        } catch (CycleException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("Node 0 (TIME_SHIFT"));
        }
    }
}
