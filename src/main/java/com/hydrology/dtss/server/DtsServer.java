package com.hydrology.dtss.server;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.hydrology.dtss.api.ErrorKind;
import com.hydrology.dtss.api.TsResolver;
import com.hydrology.dtss.bind.ExclusiveResolver;
import com.hydrology.dtss.bind.ExpressionBinder;
import com.hydrology.dtss.bind.PlaceholderResolver;
import com.hydrology.dtss.disruptor.RequestJournal;
import com.hydrology.dtss.disruptor.RequestStatistics;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.UtcPeriod;
import com.hydrology.dtss.util.ErrorRateLimiter;
import com.hydrology.dtss.wire.DtsResponse;
import com.hydrology.dtss.wire.MessageCodec;

/**
 * Time-series evaluation server.
 *
 * <p>
 * One acceptor thread admits connections up to {@code maxConnections};
 * each admitted connection is served by its own worker thread. Connections
 * beyond the limit get a {@code CONNECTION_LIMIT_EXCEEDED} error frame and
 * are closed, never queued.
 *
 * <p>
 * All connections share one resolver, entered by at most one request at a
 * time (see {@link ExclusiveResolver}).
 *
 * <pre>{@code
 * DtsServer server = new DtsServer();
 * server.setListeningPort(0);
 * server.setResolver((ids, period) -> lookup(ids, period));
 * int port = server.start();
 * ...
 * server.stop();
 * }</pre>
 */
public class DtsServer {
    private static final Logger log = LogManager.getLogger(DtsServer.class);
    private static final int REFUSAL_DRAIN_MILLIS = 1000;

    private final ServerConfig config;
    private final RequestStatistics statistics = new RequestStatistics();
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final Set<ConnectionHandler> activeHandlers = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicLong connectionIds = new AtomicLong();
    private volatile TsResolver resolver;
    private volatile boolean placeholderResolution;
    private volatile CountDownLatch stopped = new CountDownLatch(0);

    private ServerSocket serverSocket;
    private ExecutorService workers;
    private Thread acceptor;
    private RequestJournal journal;

    public DtsServer() {
        this(new ServerConfig());
    }

    public DtsServer(ServerConfig config) {
        this.config = config.validate();
        this.placeholderResolution = config.isPlaceholderResolution();
    }

    // ---------------------------------------------------------------- configuration

    public synchronized void setListeningPort(int port) {
        if (running.get())
            throw new IllegalStateException("Cannot change the port of a running server");
        if (port < 0 || port > 65535)
            throw new IllegalArgumentException("port out of range: " + port);
        config.setPort(port);
    }

    /** The bound port while running, otherwise the configured one. */
    public synchronized int getListeningPort() {
        ServerSocket ss = serverSocket;
        return running.get() && ss != null ? ss.getLocalPort() : config.getPort();
    }

    /** Takes effect for the next admission decision. */
    public void setMaxConnections(int maxConnections) {
        if (maxConnections <= 0)
            throw new IllegalArgumentException("maxConnections must be positive: " + maxConnections);
        config.setMaxConnections(maxConnections);
    }

    public int getMaxConnections() {
        return config.getMaxConnections();
    }

    public void setResolver(TsResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Test and demonstration mode: when no resolver is set, unbound
     * references are answered by a {@link PlaceholderResolver}.
     */
    public void enablePlaceholderResolver() {
        this.placeholderResolution = true;
    }

    private TsResolver effectiveResolver() {
        TsResolver r = resolver;
        if (r == null && placeholderResolution)
            return new PlaceholderResolver();
        return r;
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Starts listening and serving in the background. Does nothing if
     * already running.
     *
     * @return the bound port
     */
    public synchronized int start() throws IOException {
        if (running.get())
            return serverSocket.getLocalPort();

        ServerSocket ss = new ServerSocket();
        ss.setReuseAddress(true);
        ss.bind(new InetSocketAddress(config.getPort()));
        serverSocket = ss;
        workers = Executors.newCachedThreadPool(namedDaemonThreads("dtss-conn-"));
        journal = new RequestJournal(config.getJournalBufferSize(), statistics);
        journal.start();
        stopped = new CountDownLatch(1);
        running.set(true);

        acceptor = namedDaemonThreads("dtss-acceptor-").newThread(this::acceptLoop);
        acceptor.start();
        log.info("DTS server listening on port {} (max {} connections{})", ss.getLocalPort(),
                config.getMaxConnections(), placeholderResolution ? ", placeholder resolution" : "");
        return ss.getLocalPort();
    }

    private void acceptLoop() {
        ServerSocket ss = serverSocket;
        while (running.get()) {
            Socket socket;
            try {
                socket = ss.accept();
            } catch (SocketException e) {
                if (!running.get())
                    break;
                errLimiter.log("Accept failed: " + e.getMessage(), e);
                continue;
            } catch (IOException e) {
                errLimiter.log("Accept failed: " + e.getMessage(), e);
                continue;
            }
            admit(socket);
        }
        log.debug("Acceptor exiting");
    }

    private void admit(Socket socket) {
        try {
            socket.setTcpNoDelay(true);
            if (activeHandlers.size() >= config.getMaxConnections()) {
                statistics.recordRefused();
                log.info("Refusing connection from {}: {} connections open", socket.getRemoteSocketAddress(),
                        activeHandlers.size());
                workers.execute(() -> refuse(socket));
                return;
            }
            ConnectionHandler handler = new ConnectionHandler(connectionIds.incrementAndGet(), socket,
                    config.getMaxMessageBytes(), () -> new RequestProcessor(effectiveResolver()), journal,
                    activeHandlers::remove);
            activeHandlers.add(handler);
            log.debug("Accepted connection {} from {}", handler.id(), socket.getRemoteSocketAddress());
            try {
                workers.execute(handler);
            } catch (RejectedExecutionException e) {
                activeHandlers.remove(handler);
                handler.close();
            }
        } catch (IOException | RejectedExecutionException e) {
            log.warn("Dropping connection from {}: {}", socket.getRemoteSocketAddress(), e.toString());
            closeQuietly(socket);
        }
    }

    /**
     * Sends the refusal frame, half-closes, and waits briefly for the peer to
     * close its side so the frame is not lost to a reset.
     */
    private void refuse(Socket socket) {
        try (socket) {
            DataOutputStream out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
            MessageCodec.writeResponse(out, DtsResponse.error(ErrorKind.CONNECTION_LIMIT_EXCEEDED,
                    "Connection limit of " + config.getMaxConnections() + " reached"));
            socket.shutdownOutput();
            socket.setSoTimeout(REFUSAL_DRAIN_MILLIS);
            InputStream in = socket.getInputStream();
            byte[] sink = new byte[4096];
            while (in.read(sink) >= 0) {
                // discard until the peer closes
            }
        } catch (IOException e) {
            log.debug("Refused connection ended: {}", e.toString());
        }
    }

    /**
     * Closes the listener and every open connection, then drains the request
     * journal. Idempotent.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false))
            return;
        log.info("Stopping DTS server on port {}", serverSocket.getLocalPort());
        closeQuietly(serverSocket);
        for (ConnectionHandler h : activeHandlers)
            h.close();

        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.getStopTimeoutMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Connections still busy after {} ms, interrupting", config.getStopTimeoutMillis());
                workers.shutdownNow();
            }
            acceptor.join(config.getStopTimeoutMillis());
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        activeHandlers.clear();
        journal.stop(config.getStopTimeoutMillis());
        stopped.countDown();
        log.info("DTS server stopped");
    }

    /** Same as {@link #stop()}. */
    public void clear() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Keeps the server serving for up to {@code duration}, starting it if
     * needed. Returns early if the server is stopped meanwhile.
     *
     * @return true if the server stopped before the duration elapsed
     */
    public boolean drive(Duration duration) throws IOException {
        if (!running.get())
            start();
        try {
            return stopped.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !running.get();
        }
    }

    // ---------------------------------------------------------------- diagnostics

    /**
     * Runs the resolver path alone, under the same exclusive lock and contract
     * checks a request goes through.
     */
    public List<PointSeries> fireResolver(List<String> ids, UtcPeriod period) {
        TsResolver r = effectiveResolver();
        return ExpressionBinder.resolve(List.copyOf(ids), period, r == null ? null : new ExclusiveResolver(r));
    }

    public RequestStatistics statistics() {
        return statistics;
    }

    public int activeConnections() {
        return activeHandlers.size();
    }

    private static void closeQuietly(Closeable c) {
        try {
            c.close();
        } catch (IOException e) {
            log.debug("Close failed: {}", e.toString());
        }
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
