package com.hydrology.dtss.server;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import org.junit.After;
import org.junit.Test;

import com.hydrology.dtss.api.ConnectionLimitExceededException;
import com.hydrology.dtss.api.DtsException;
import com.hydrology.dtss.api.DtsTimeoutException;
import com.hydrology.dtss.api.ErrorKind;
import com.hydrology.dtss.api.RemoteEvaluationException;
import com.hydrology.dtss.api.ResolverFailureException;
import com.hydrology.dtss.api.ResolverMismatchException;
import com.hydrology.dtss.api.TsResolver;
import com.hydrology.dtss.client.DtsClient;
import com.hydrology.dtss.expr.NodeKind;
import com.hydrology.dtss.expr.OpCode;
import com.hydrology.dtss.expr.TsExpression;
import com.hydrology.dtss.expr.TsVector;
import com.hydrology.dtss.io.BinaryWriter;
import com.hydrology.dtss.io.TsCodec;
import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.TimeAxis;
import com.hydrology.dtss.time.UtcPeriod;
import com.hydrology.dtss.wire.DtsResponse;
import com.hydrology.dtss.wire.MessageCodec;
import com.hydrology.dtss.wire.MessageType;

import static com.hydrology.dtss.expr.TsExpressions.*;
import static org.junit.Assert.*;

public class DtsServerTest {
    private static final UtcPeriod PERIOD = new UtcPeriod(1_600_000_000L, 1_600_000_000L + 24 * 3600);
    private static final TimeAxis HOURLY = TimeAxis.covering(PERIOD, 3600);

    private final List<DtsServer> servers = new ArrayList<>();
    private final List<DtsClient> clients = new ArrayList<>();
    private final ExecutorService background = Executors.newCachedThreadPool();

    /** Answers every identifier with a constant hourly series of {@code value}. */
    private static TsResolver constantResolver(double value) {
        return (ids, p) -> {
            List<PointSeries> r = new ArrayList<>();
            for (int i = 0; i < ids.size(); i++)
                r.add(PointSeries.constant(TimeAxis.covering(p, 3600), value, PointInterpretation.POINT_AVERAGE_VALUE));
            return r;
        };
    }

    private DtsServer server(TsResolver resolver, int maxConnections) throws Exception {
        DtsServer s = new DtsServer();
        s.setListeningPort(0);
        s.setMaxConnections(maxConnections);
        s.setResolver(resolver);
        s.start();
        servers.add(s);
        return s;
    }

    private DtsClient client(DtsServer s) {
        return client(s, 10_000);
    }

    private DtsClient client(DtsServer s, int timeoutMillis) {
        DtsClient c = new DtsClient("127.0.0.1:" + s.getListeningPort(), timeoutMillis);
        clients.add(c);
        return c;
    }

    private static void waitUntil(BooleanSupplier condition, long millis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + millis;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline)
                fail("Condition not met within " + millis + " ms");
            Thread.sleep(5);
        }
    }

    @After
    public void tearDown() {
        for (DtsClient c : clients)
            c.close(200);
        for (DtsServer s : servers)
            s.stop();
        background.shutdownNow();
    }

    @Test(timeout = 20_000)
    public void testReferenceResolvedEndToEnd() throws Exception {
        DtsServer s = server(constantResolver(5.0), 10);

        TsVector result = client(s).evaluate(TsVector.of(ref("X")), PERIOD);

        assertEquals(1, result.size());
        PointSeries series = result.series(0);
        assertEquals(HOURLY, series.timeAxis());
        for (int i = 0; i < series.size(); i++)
            assertEquals(5.0, series.value(i), 0.0);
    }

    @Test(timeout = 20_000)
    public void testExpressionAndPercentilesOverTheWire() throws Exception {
        DtsServer s = server(constantResolver(2.0), 10);
        DtsClient c = client(s);

        TsVector sum = c.evaluate(TsVector.of(add(ref("A"), constant(HOURLY, 1.0))), PERIOD);
        assertEquals(3.0, sum.series(0).value(0), 0.0);

        TsVector ensemble = TsVector.of(constant(HOURLY, 1), mul(ref("two"), 1.0), constant(HOURLY, 3));
        TimeAxis daily = new TimeAxis(PERIOD.start(), 86400, 1);
        TsVector pct = c.percentiles(ensemble, PERIOD, daily, List.of(90, -1, 50));
        assertEquals(3, pct.size());
        assertEquals(2.8, pct.series(0).value(0), 1e-9);
        assertEquals(2.0, pct.series(1).value(0), 1e-9);
        assertEquals(2.0, pct.series(2).value(0), 1e-9);
        assertEquals(daily, pct.series(0).timeAxis());
    }

    @Test(timeout = 20_000)
    public void testConnectionLimit() throws Exception {
        DtsServer s = server(constantResolver(1.0), 2);
        DtsClient c1 = client(s);
        DtsClient c2 = client(s);
        TsVector v = TsVector.of(constant(HOURLY, 7));
        c1.evaluate(v, PERIOD);
        c2.evaluate(v, PERIOD);
        assertEquals(2, s.activeConnections());

        DtsClient c3 = client(s);
        try {
            c3.evaluate(v, PERIOD);
            fail("Expected ConnectionLimitExceededException");
        } catch (ConnectionLimitExceededException e) {
            assertEquals(ErrorKind.CONNECTION_LIMIT_EXCEEDED, e.kind());
        }
        assertTrue(c3.isClosed());
        assertEquals(1, s.statistics().refusedConnections());

        // existing connections are unaffected
        assertEquals(7.0, c1.evaluate(v, PERIOD).series(0).value(0), 0.0);

        c2.close(1000);
        waitUntil(() -> s.activeConnections() == 1, 5_000);
        assertEquals(7.0, client(s).evaluate(v, PERIOD).series(0).value(0), 0.0);
    }

    @Test(timeout = 30_000)
    public void testResolverNeverEnteredConcurrently() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        TsResolver delegate = constantResolver(1.0);
        DtsServer s = server((ids, p) -> {
            calls.incrementAndGet();
            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
            try {
                Thread.sleep(20);
                return delegate.resolve(ids, p);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            } finally {
                inside.decrementAndGet();
            }
        }, 10);

        List<Future<TsVector>> results = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            DtsClient c = client(s);
            String id = "series-" + i;
            results.add(background.submit(() -> c.evaluate(TsVector.of(add(ref(id), ref(id))), PERIOD)));
        }
        for (Future<TsVector> f : results)
            assertEquals(2.0, f.get(15, TimeUnit.SECONDS).series(0).value(3), 0.0);

        assertEquals(8, calls.get());
        assertEquals(1, maxInside.get());
    }

    @Test(timeout = 20_000)
    public void testBlockedResolverDoesNotBlockOtherConnections() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TsResolver delegate = constantResolver(5.0);
        DtsServer s = server((ids, p) -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return delegate.resolve(ids, p);
        }, 10);

        DtsClient slow = client(s);
        Future<TsVector> pending = background.submit(() -> slow.evaluate(TsVector.of(ref("slow")), PERIOD));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        DtsClient fast = client(s);
        TsVector r = fast.evaluate(TsVector.of(mul(constant(HOURLY, 2), 3.0)), PERIOD);
        assertEquals(6.0, r.series(0).value(0), 0.0);
        assertFalse(pending.isDone());

        release.countDown();
        assertEquals(5.0, pending.get(5, TimeUnit.SECONDS).series(0).value(0), 0.0);
    }

    @Test(timeout = 20_000)
    public void testClientTimeoutAbandonsConnection() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        DtsServer s = server((ids, p) -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return constantResolver(1.0).resolve(ids, p);
        }, 10);

        DtsClient c = client(s, 300);
        try {
            c.evaluate(TsVector.of(ref("X")), PERIOD);
            fail("Expected DtsTimeoutException");
        } catch (DtsTimeoutException e) {
            assertEquals(ErrorKind.TIMEOUT, e.kind());
        } finally {
            release.countDown();
        }
        assertTrue(c.isClosed());
        try {
            c.evaluate(TsVector.of(ref("X")), PERIOD);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            // abandoned, not retried
        }
    }

    @Test(timeout = 20_000)
    public void testRequestErrorKeepsConnectionOpen() throws Exception {
        DtsServer s = server(null, 10);
        DtsClient c = client(s);
        try {
            c.evaluate(TsVector.of(ref("X")), PERIOD);
            fail("Expected RemoteEvaluationException");
        } catch (RemoteEvaluationException e) {
            assertEquals(ErrorKind.RESOLVER_FAILURE, e.kind());
        }
        assertFalse(c.isClosed());
        assertEquals(1.0, c.evaluate(TsVector.of(constant(HOURLY, 1)), PERIOD).series(0).value(0), 0.0);

        s.setResolver((ids, p) -> List.of());
        try {
            c.evaluate(TsVector.of(ref("X")), PERIOD);
            fail("Expected RemoteEvaluationException");
        } catch (RemoteEvaluationException e) {
            assertEquals(ErrorKind.RESOLVER_MISMATCH, e.kind());
        }

        s.stop();
        assertEquals(3, s.statistics().totalRequests());
        assertEquals(2, s.statistics().failedRequests());
        assertEquals(1, s.statistics().failures(ErrorKind.RESOLVER_MISMATCH));
    }

    @Test(timeout = 20_000)
    public void testMalformedFrameFailsConnection() throws Exception {
        DtsServer s = server(null, 10);
        try (Socket raw = new Socket("127.0.0.1", s.getListeningPort())) {
            raw.setSoTimeout(5_000);
            OutputStream out = raw.getOutputStream();
            out.write(42);
            out.flush();
            DataInputStream in = new DataInputStream(raw.getInputStream());
            DtsResponse r = MessageCodec.readResponse(in, 1 << 20);
            assertEquals(ErrorKind.DECODE, r.errorKind());
            assertEquals(-1, in.read());
        }
        waitUntil(() -> s.activeConnections() == 0, 5_000);
        assertTrue(s.isRunning());
    }

    @Test(timeout = 20_000)
    public void testPlaceholderResolutionIsOptIn() throws Exception {
        DtsServer s = server(null, 10);
        DtsClient c = client(s);
        try {
            c.evaluate(TsVector.of(ref("a")), PERIOD);
            fail("Expected RemoteEvaluationException");
        } catch (RemoteEvaluationException e) {
            assertEquals(ErrorKind.RESOLVER_FAILURE, e.kind());
        }

        s.enablePlaceholderResolver();
        TsVector r = c.evaluate(TsVector.of(ref("a"), ref("b"), ref("a")), PERIOD);
        assertEquals(0.0, r.series(0).value(0), 0.0);
        assertEquals(1.0, r.series(1).value(0), 0.0);
        assertEquals(0.0, r.series(2).value(0), 0.0);
    }

    @Test
    public void testFireResolver() throws Exception {
        DtsServer s = new DtsServer();
        try {
            s.fireResolver(List.of("a"), PERIOD);
            fail("Expected ResolverFailureException");
        } catch (ResolverFailureException e) {
            // no resolver configured
        }

        s.setResolver(constantResolver(3.0));
        List<PointSeries> r = s.fireResolver(List.of("a", "b"), PERIOD);
        assertEquals(2, r.size());
        assertEquals(3.0, r.get(1).value(0), 0.0);

        s.setResolver((ids, p) -> List.of());
        try {
            s.fireResolver(List.of("a"), PERIOD);
            fail("Expected ResolverMismatchException");
        } catch (ResolverMismatchException e) {
            assertEquals(1, e.requested());
        }
    }

    @Test(timeout = 20_000)
    public void testStopIsIdempotentAndRestartable() throws Exception {
        DtsServer s = server(constantResolver(1.0), 10);
        assertTrue(s.isRunning());
        s.stop();
        assertFalse(s.isRunning());
        s.stop();
        s.clear();
        assertFalse(s.isRunning());

        s.start();
        assertTrue(s.isRunning());
        assertEquals(1.0, client(s).evaluate(TsVector.of(ref("X")), PERIOD).series(0).value(0), 0.0);
    }

    @Test(timeout = 20_000)
    public void testStopClosesOpenConnections() throws Exception {
        DtsServer s = server(constantResolver(1.0), 10);
        DtsClient c = client(s);
        c.evaluate(TsVector.of(ref("X")), PERIOD);

        s.stop();
        assertEquals(0, s.activeConnections());
        try {
            c.evaluate(TsVector.of(ref("X")), PERIOD);
            fail("Expected DtsException");
        } catch (DtsException e) {
            assertEquals(ErrorKind.CONNECTION, e.kind());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testPortFixedWhileRunning() throws Exception {
        server(null, 1).setListeningPort(0);
    }

    @Test(timeout = 20_000)
    public void testDrive() throws Exception {
        DtsServer s = new DtsServer();
        s.setListeningPort(0);
        servers.add(s);

        assertFalse(s.drive(Duration.ofMillis(100)));
        assertTrue(s.isRunning());
        assertEquals(2.0, client(s).evaluate(TsVector.of(constant(HOURLY, 2)), PERIOD).series(0).value(0), 0.0);

        background.submit(() -> {
            Thread.sleep(100);
            s.stop();
            return null;
        });
        long t0 = System.nanoTime();
        assertTrue(s.drive(Duration.ofSeconds(10)));
        assertTrue(System.nanoTime() - t0 < TimeUnit.SECONDS.toNanos(5));
        assertFalse(s.isRunning());
    }

    @Test(timeout = 20_000)
    public void testCycleReportedToCaller() throws Exception {
        DtsServer s = server(constantResolver(1.0), 10);

        // one BINARY_OP_SCALAR node whose operand is itself
        BinaryWriter w = new BinaryWriter();
        w.writePeriod(PERIOD);
        w.writeInt(TsCodec.MAGIC).writeShort(TsCodec.FORMAT_VERSION).writeInt(1);
        w.writeByte(NodeKind.BINARY_OP_SCALAR.tag()).writeByte(1)
                .writeByte(OpCode.ADD.ordinal()).writeInt(0).writeDouble(1.0).writeBoolean(true);
        w.writeByte(NodeKind.VECTOR.tag()).writeByte(1).writeInt(1).writeInt(0);
        byte[] payload = w.toByteArray();

        try (Socket raw = new Socket("127.0.0.1", s.getListeningPort())) {
            raw.setSoTimeout(5_000);
            DataOutputStream out = new DataOutputStream(raw.getOutputStream());
            out.writeByte(MessageType.EVALUATE.code());
            out.writeInt(payload.length);
            out.write(payload);
            out.flush();

            DataInputStream in = new DataInputStream(raw.getInputStream());
            DtsResponse r = MessageCodec.readResponse(in, 1 << 20);
            assertEquals(ErrorKind.CYCLE, r.errorKind());
            assertTrue(r.message(), r.message().contains("reference cycle"));
            assertEquals(-1, in.read());
        }
        waitUntil(() -> s.activeConnections() == 0, 5_000);
        assertTrue(s.isRunning());

        s.stop();
        assertEquals(1, s.statistics().failures(ErrorKind.CYCLE));
    }

    @Test(timeout = 30_000)
    public void testDeepChainEndToEnd() throws Exception {
        DtsServer s = server(constantResolver(5.0), 10);
        TsExpression e = ref("X");
        for (int i = 0; i < 20_000; i++)
            e = add(e, 1.0);

        TsVector result = client(s).evaluate(TsVector.of(e), PERIOD);

        assertEquals(HOURLY, result.series(0).timeAxis());
        assertEquals(20_005.0, result.series(0).value(0), 0.0);
    }
}
