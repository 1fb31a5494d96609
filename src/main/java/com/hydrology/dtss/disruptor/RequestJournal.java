package com.hydrology.dtss.disruptor;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.hydrology.dtss.api.ErrorKind;
import com.hydrology.dtss.wire.MessageType;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

/**
 * Multi-producer ring buffer of completed requests.
 *
 * <p>
 * Every connection handler publishes into the same ring; a single consumer
 * thread drains it in batches. Publishing claims a slot with
 * {@code tryNext()}, so a full ring drops the record (counted in
 * {@link #droppedCount()}) instead of stalling the request path.
 */
public final class RequestJournal {
    private static final Logger log = LogManager.getLogger(RequestJournal.class);

    private final Disruptor<RequestEvent> disruptor;
    private final AtomicLong dropped = new AtomicLong();
    private volatile RingBuffer<RequestEvent> ringBuffer;

    /**
     * @param bufferSize ring size, must be a power of two
     * @param handler    the single consumer
     */
    public RequestJournal(int bufferSize, EventHandler<RequestEvent> handler) {
        if (Integer.bitCount(bufferSize) != 1)
            throw new IllegalArgumentException("bufferSize must be a power of two: " + bufferSize);
        this.disruptor = new Disruptor<>(
                RequestEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(handler);
    }

    public void start() {
        ringBuffer = disruptor.start();
    }

    public void publish(long connectionId, MessageType type, ErrorKind errorKind, int identifiersResolved,
            int seriesReturned, long latencyNanos) {
        RingBuffer<RequestEvent> rb = ringBuffer;
        if (rb == null) {
            dropped.incrementAndGet();
            return;
        }
        long sequence;
        try {
            sequence = rb.tryNext();
        } catch (InsufficientCapacityException e) {
            if (dropped.incrementAndGet() == 1)
                log.warn("Request journal full, dropping records");
            return;
        }
        try {
            rb.get(sequence).set(connectionId, type, errorKind, identifiersResolved, seriesReturned, latencyNanos);
        } finally {
            rb.publish(sequence);
        }
    }

    public long droppedCount() {
        return dropped.get();
    }

    /** Drains what was published so far, then stops the consumer thread. */
    public void stop(long timeoutMillis) {
        ringBuffer = null;
        try {
            disruptor.shutdown(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Request journal did not drain within {} ms, halting", timeoutMillis);
            disruptor.halt();
        }
    }
}
