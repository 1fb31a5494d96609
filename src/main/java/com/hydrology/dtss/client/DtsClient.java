package com.hydrology.dtss.client;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.hydrology.dtss.api.ConnectionLimitExceededException;
import com.hydrology.dtss.api.DtsException;
import com.hydrology.dtss.api.DtsTimeoutException;
import com.hydrology.dtss.api.ErrorKind;
import com.hydrology.dtss.api.RemoteEvaluationException;
import com.hydrology.dtss.expr.TsVector;
import com.hydrology.dtss.time.TimeAxis;
import com.hydrology.dtss.time.UtcPeriod;
import com.hydrology.dtss.wire.DtsRequest;
import com.hydrology.dtss.wire.DtsResponse;
import com.hydrology.dtss.wire.MessageCodec;

/**
 * Blocking request/response client over a single connection.
 *
 * <p>
 * Calls are serialized on this instance and block only the calling thread.
 * The timeout bounds each call as a whole, not each socket read. A call that
 * exceeds it raises {@link DtsTimeoutException} and
 * abandons the connection; it is never retried. Errors reported by the
 * server raise {@link RemoteEvaluationException}, or
 * {@link ConnectionLimitExceededException} when the server refused the
 * connection.
 *
 * <pre>{@code
 * try (DtsClient c = new DtsClient("localhost:20000")) {
 *     TsVector result = c.evaluate(TsVector.of(ref("X")), period);
 * }
 * }</pre>
 */
public class DtsClient implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(DtsClient.class);
    public static final int DEFAULT_TIMEOUT_MILLIS = 10_000;
    private static final int MAX_RESPONSE_BYTES = Integer.MAX_VALUE - 8;

    private final String hostPort;
    private final int timeoutMillis;
    private final Socket socket;
    private final DeadlineInputStream deadline;
    private final DataInputStream in;
    private final DataOutputStream out;
    private boolean closed;

    public DtsClient(String hostPort) {
        this(hostPort, DEFAULT_TIMEOUT_MILLIS);
    }

    /**
     * Connects immediately.
     *
     * @param hostPort      {@code host:port}
     * @param timeoutMillis bound on connecting and on each call
     */
    public DtsClient(String hostPort, int timeoutMillis) {
        if (timeoutMillis <= 0)
            throw new IllegalArgumentException("timeoutMillis must be positive: " + timeoutMillis);
        int colon = hostPort.lastIndexOf(':');
        if (colon <= 0 || colon == hostPort.length() - 1)
            throw new IllegalArgumentException("Expected host:port, got '" + hostPort + "'");
        String host = hostPort.substring(0, colon);
        int port = Integer.parseInt(hostPort.substring(colon + 1));

        this.hostPort = hostPort;
        this.timeoutMillis = timeoutMillis;
        this.socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), timeoutMillis);
            socket.setSoTimeout(timeoutMillis);
            this.deadline = new DeadlineInputStream(socket);
            this.in = new DataInputStream(new BufferedInputStream(deadline));
            this.out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
        } catch (SocketTimeoutException e) {
            closeSocket();
            throw new DtsTimeoutException("Connecting to " + hostPort + " timed out after " + timeoutMillis + " ms", e);
        } catch (IOException e) {
            closeSocket();
            throw new DtsException(ErrorKind.CONNECTION, "Cannot connect to " + hostPort + ": " + e.getMessage(), e);
        }
        log.debug("Connected to {}", hostPort);
    }

    /** Evaluates every expression of {@code vector} over {@code period}. */
    public TsVector evaluate(TsVector vector, UtcPeriod period) {
        return call(DtsRequest.evaluate(vector, period));
    }

    /**
     * Evaluates the ensemble {@code vector}, aligns it to {@code axis} and
     * returns one series per entry of {@code percentiles}, in order. -1 asks
     * for the mean.
     */
    public TsVector percentiles(TsVector vector, UtcPeriod period, TimeAxis axis, List<Integer> percentiles) {
        return call(DtsRequest.percentiles(vector, period, axis, percentiles));
    }

    private synchronized TsVector call(DtsRequest request) {
        if (closed)
            throw new IllegalStateException("Client for " + hostPort + " is closed");
        DtsResponse response = exchange(request);
        if (response.isOk())
            return response.vector();
        if (response.errorKind() == ErrorKind.CONNECTION_LIMIT_EXCEEDED) {
            abandon();
            throw new ConnectionLimitExceededException(response.message());
        }
        if (response.errorKind() == ErrorKind.DECODE)
            abandon();
        throw new RemoteEvaluationException(response.errorKind(), response.message());
    }

    private DtsResponse exchange(DtsRequest request) {
        try {
            deadline.expireAfter(timeoutMillis);
            MessageCodec.writeRequest(out, request);
            return MessageCodec.readResponse(in, MAX_RESPONSE_BYTES);
        } catch (SocketTimeoutException e) {
            abandon();
            throw new DtsTimeoutException(request.type() + " on " + hostPort + " timed out after " + timeoutMillis
                    + " ms", e);
        } catch (DtsException e) {
            abandon();
            throw e;
        } catch (IOException e) {
            abandon();
            throw new DtsException(ErrorKind.CONNECTION, request.type() + " on " + hostPort + " failed: "
                    + e.getMessage(), e);
        }
    }

    /**
     * Asks the server to close the connection, waits up to
     * {@code timeoutMillis} for the acknowledgement, then closes the socket.
     * Idempotent.
     */
    public synchronized void close(int timeoutMillis) {
        if (closed)
            return;
        try {
            deadline.expireAfter(Math.max(1, timeoutMillis));
            MessageCodec.writeRequest(out, DtsRequest.close());
            MessageCodec.readResponse(in, MAX_RESPONSE_BYTES);
        } catch (IOException | DtsException e) {
            log.debug("Close handshake with {} incomplete: {}", hostPort, e.toString());
        } finally {
            abandon();
        }
    }

    @Override
    public void close() {
        close(timeoutMillis);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private void abandon() {
        closed = true;
        closeSocket();
    }

    private void closeSocket() {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket to {}: {}", hostPort, e.toString());
        }
    }

    /**
     * Bounds a whole response by one deadline. Each read gets the time left
     * as its socket timeout, so a response trickling in slowly still times
     * out when the deadline passes.
     */
    private static final class DeadlineInputStream extends FilterInputStream {
        private final Socket socket;
        private long deadlineNanos;

        DeadlineInputStream(Socket socket) throws IOException {
            super(socket.getInputStream());
            this.socket = socket;
        }

        void expireAfter(int millis) {
            deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        }

        private void arm() throws IOException {
            long left = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
            if (left <= 0)
                throw new SocketTimeoutException("Deadline passed");
            socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, left));
        }

        @Override
        public int read() throws IOException {
            arm();
            return super.read();
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            arm();
            return super.read(b, off, len);
        }
    }
}
