package com.hydrology.dtss.server;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.hydrology.dtss.api.ErrorKind;
import com.hydrology.dtss.bind.PlaceholderResolver;
import com.hydrology.dtss.expr.TsExpression;
import com.hydrology.dtss.expr.TsVector;
import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.TimeAxis;
import com.hydrology.dtss.time.UtcPeriod;
import com.hydrology.dtss.wire.DtsRequest;
import com.hydrology.dtss.wire.DtsResponse;

import static com.hydrology.dtss.expr.TsExpressions.*;
import static org.junit.Assert.*;

public class RequestProcessorTest {
    private static final TimeAxis AXIS = new TimeAxis(0, 3600, 6);
    private static final UtcPeriod PERIOD = AXIS.totalPeriod();

    @Test
    public void testEvaluateWalksStates() {
        List<ConnectionState> states = new ArrayList<>();
        RequestProcessor p = new RequestProcessor(
                (ids, period) -> List.of(PointSeries.constant(AXIS, 4, PointInterpretation.POINT_AVERAGE_VALUE)));

        RequestProcessor.Outcome o = p.process(DtsRequest.evaluate(TsVector.of(mul(ref("X"), 0.5)), PERIOD),
                states::add);

        assertTrue(o.response().isOk());
        assertEquals(1, o.identifiersResolved());
        assertEquals(1, o.seriesReturned());
        assertEquals(2.0, o.response().vector().series(0).value(5), 0.0);
        assertEquals(List.of(ConnectionState.RESOLVING, ConnectionState.EVALUATING), states);
    }

    @Test
    public void testPercentiles() {
        TsVector ensemble = TsVector.of(constant(AXIS, 1), constant(AXIS, 2), constant(AXIS, 3));
        DtsResponse r = new RequestProcessor(null)
                .process(DtsRequest.percentiles(ensemble, PERIOD, new TimeAxis(0, 7200, 3), List.of(50, -1, 100)))
                .response();
        assertTrue(r.isOk());
        assertEquals(3, r.vector().size());
        assertEquals(2.0, r.vector().series(0).value(0), 1e-12);
        assertEquals(2.0, r.vector().series(1).value(2), 1e-12);
        assertEquals(3.0, r.vector().series(2).value(1), 1e-12);
    }

    @Test
    public void testFailuresBecomeErrorResponses() {
        RequestProcessor noResolver = new RequestProcessor(null);
        assertEquals(ErrorKind.RESOLVER_FAILURE,
                noResolver.process(DtsRequest.evaluate(TsVector.of(ref("X")), PERIOD)).response().errorKind());

        RequestProcessor wrongCount = new RequestProcessor((ids, period) -> List.of());
        assertEquals(ErrorKind.RESOLVER_MISMATCH,
                wrongCount.process(DtsRequest.evaluate(TsVector.of(ref("X")), PERIOD)).response().errorKind());

        DtsResponse badPct = noResolver.process(DtsRequest.percentiles(TsVector.of(constant(AXIS, 1)), PERIOD, AXIS,
                List.of(120))).response();
        assertEquals(ErrorKind.EVALUATION, badPct.errorKind());
        assertTrue(badPct.message().contains("120"));
    }

    @Test
    public void testPlaceholderResolver() {
        DtsResponse r = new RequestProcessor(new PlaceholderResolver())
                .process(DtsRequest.evaluate(TsVector.of(ref("a"), ref("b")), PERIOD)).response();
        assertEquals(0.0, r.vector().series(0).value(0), 0.0);
        assertEquals(1.0, r.vector().series(1).value(0), 0.0);
    }

    @Test
    public void testCloseIsAcknowledged() {
        DtsResponse r = new RequestProcessor(null).process(DtsRequest.close()).response();
        assertTrue(r.isOk());
        assertEquals(0, r.vector().size());
    }

    @Test
    public void testFailedResolverCallStillCountsIdentifiers() {
        RequestProcessor wrongCount = new RequestProcessor((ids, period) -> List.of());
        RequestProcessor.Outcome o = wrongCount.process(
                DtsRequest.evaluate(TsVector.of(add(ref("X"), ref("Y")), ref("X")), PERIOD));
        assertEquals(ErrorKind.RESOLVER_MISMATCH, o.response().errorKind());
        assertEquals(2, o.identifiersResolved());

        // nothing was handed to a resolver
        RequestProcessor.Outcome none = new RequestProcessor(null)
                .process(DtsRequest.evaluate(TsVector.of(ref("X")), PERIOD));
        assertEquals(ErrorKind.RESOLVER_FAILURE, none.response().errorKind());
        assertEquals(0, none.identifiersResolved());
    }

    @Test
    public void testDeepChainIsServed() {
        TsExpression e = ref("X");
        for (int i = 0; i < 20_000; i++)
            e = add(e, 1.0);
        RequestProcessor p = new RequestProcessor(
                (ids, period) -> List.of(PointSeries.constant(AXIS, 4, PointInterpretation.POINT_AVERAGE_VALUE)));
        DtsResponse r = p.process(DtsRequest.evaluate(TsVector.of(e), PERIOD)).response();
        assertTrue(r.message(), r.isOk());
        assertEquals(20_004.0, r.vector().series(0).value(0), 0.0);
    }
}
