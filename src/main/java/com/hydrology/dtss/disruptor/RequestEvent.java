package com.hydrology.dtss.disruptor;

import com.hydrology.dtss.api.ErrorKind;
import com.hydrology.dtss.wire.MessageType;

/**
 * A completed request, as recorded in the {@link RequestJournal} ring buffer.
 *
 * <p>
 * <b>Flyweight:</b> instances are pre-allocated when the ring buffer is
 * built and reused for its whole lifetime. Producers overwrite every field
 * through {@link #set}.
 *
 * <p>
 * <b>Fields:</b>
 * <ul>
 * <li>{@code connectionId}: the server side connection that served the
 * request.</li>
 * <li>{@code type}: request type, null for a refused connection.</li>
 * <li>{@code errorKind}: null on success.</li>
 * <li>{@code identifiersResolved}: size of the single resolver call, 0 if
 * the resolver was not called.</li>
 * <li>{@code seriesReturned}: number of series in an OK response.</li>
 * </ul>
 */
public final class RequestEvent {
    private long connectionId;
    private MessageType type;
    private ErrorKind errorKind;
    private int identifiersResolved;
    private int seriesReturned;
    private long latencyNanos;

    public void set(long connectionId, MessageType type, ErrorKind errorKind, int identifiersResolved,
            int seriesReturned, long latencyNanos) {
        this.connectionId = connectionId;
        this.type = type;
        this.errorKind = errorKind;
        this.identifiersResolved = identifiersResolved;
        this.seriesReturned = seriesReturned;
        this.latencyNanos = latencyNanos;
    }

    public long connectionId() {
        return connectionId;
    }

    public MessageType type() {
        return type;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }

    public boolean isFailure() {
        return errorKind != null;
    }

    public int identifiersResolved() {
        return identifiersResolved;
    }

    public int seriesReturned() {
        return seriesReturned;
    }

    public long latencyNanos() {
        return latencyNanos;
    }

    public void clear() {
        connectionId = 0;
        type = null;
        errorKind = null;
        identifiersResolved = 0;
        seriesReturned = 0;
        latencyNanos = 0;
    }
}
