package com.hydrology.dtss.server;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.Socket;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.hydrology.dtss.api.DtsException;
import com.hydrology.dtss.disruptor.RequestJournal;
import com.hydrology.dtss.wire.DtsRequest;
import com.hydrology.dtss.wire.DtsResponse;
import com.hydrology.dtss.wire.MessageCodec;
import com.hydrology.dtss.wire.MessageType;

/**
 * Serves one accepted socket until the peer closes it, sends CLOSE, or a
 * protocol error occurs.
 *
 * <p>
 * Runs on its own worker thread. Reads and writes block on the socket
 * only; the one shared lock a request can wait for is the resolver lock,
 * taken inside {@link RequestProcessor}.
 */
final class ConnectionHandler implements Runnable {
    private static final Logger log = LogManager.getLogger(ConnectionHandler.class);

    private final long id;
    private final Socket socket;
    private final int maxMessageBytes;
    private final Supplier<RequestProcessor> processors;
    private final RequestJournal journal;
    private final Consumer<ConnectionHandler> onClosed;
    private volatile ConnectionState state = ConnectionState.ACCEPTED;
    private volatile boolean closing;

    ConnectionHandler(long id, Socket socket, int maxMessageBytes, Supplier<RequestProcessor> processors,
            RequestJournal journal, Consumer<ConnectionHandler> onClosed) {
        this.id = id;
        this.socket = socket;
        this.maxMessageBytes = maxMessageBytes;
        this.processors = processors;
        this.journal = journal;
        this.onClosed = onClosed;
    }

    long id() {
        return id;
    }

    ConnectionState state() {
        return state;
    }

    @Override
    public void run() {
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
                DataOutputStream out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()))) {
            serve(in, out);
        } catch (IOException e) {
            if (closing || socket.isClosed()) {
                log.debug("Connection {} closed during shutdown", id);
                state = ConnectionState.CLOSED;
            } else {
                log.warn("Connection {} failed in state {}: {}", id, state, e.toString());
                state = ConnectionState.FAILED;
            }
        } catch (RuntimeException e) {
            log.error("Connection {} failed unexpectedly in state {}", id, state, e);
            state = ConnectionState.FAILED;
        } finally {
            closeQuietly();
            onClosed.accept(this);
        }
    }

    private void serve(DataInputStream in, DataOutputStream out) throws IOException {
        while (!closing) {
            state = ConnectionState.READING;
            DtsRequest request;
            long started;
            try {
                request = MessageCodec.readRequest(in, maxMessageBytes);
                started = System.nanoTime();
            } catch (DtsException e) {
                fail(out, e);
                return;
            } catch (EOFException e) {
                throw new IOException("Peer closed the connection mid frame", e);
            }
            if (request == null) {
                log.debug("Connection {} closed by peer", id);
                state = ConnectionState.CLOSED;
                return;
            }

            RequestProcessor.Outcome outcome = processors.get().process(request, s -> state = s);
            DtsResponse response = outcome.response();
            state = ConnectionState.WRITING;
            MessageCodec.writeResponse(out, response);
            journal.publish(id, request.type(), response.errorKind(), outcome.identifiersResolved(),
                    outcome.seriesReturned(), System.nanoTime() - started);

            if (request.type() == MessageType.CLOSE) {
                log.debug("Connection {} closed on request", id);
                state = ConnectionState.CLOSED;
                return;
            }
        }
        state = ConnectionState.CLOSED;
    }

    /**
     * Reports a request that could not be read (malformed frame, or a graph
     * that closes a cycle) to the peer, then gives up on the stream.
     */
    private void fail(DataOutputStream out, DtsException e) {
        state = ConnectionState.FAILED;
        log.warn("Connection {} sent an unreadable request [{}]: {}", id, e.kind(), e.getMessage());
        journal.publish(id, null, e.kind(), 0, 0, 0);
        try {
            MessageCodec.writeResponse(out, DtsResponse.error(e.kind(), e.getMessage()));
        } catch (IOException io) {
            log.debug("Connection {} could not report {} error: {}", id, e.kind(), io.toString());
        }
    }

    /** Closes the socket, interrupting a blocked read. */
    void close() {
        closing = true;
        closeQuietly();
    }

    private void closeQuietly() {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing connection {}: {}", id, e.toString());
        }
    }
}
