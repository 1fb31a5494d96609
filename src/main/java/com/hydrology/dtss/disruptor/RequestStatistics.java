package com.hydrology.dtss.disruptor;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.hydrology.dtss.api.ErrorKind;
import com.hydrology.dtss.util.ErrorRateLimiter;
import com.lmax.disruptor.EventHandler;

/**
 * Aggregates the request journal.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Throughput:</b> total and failed requests, failures per
 * {@link ErrorKind}, refused connections.</li>
 * <li><b>Resolver load:</b> resolver calls and identifiers resolved.</li>
 * <li><b>Latency:</b> min, max and average request latency.</li>
 * </ul>
 *
 * <p>
 * Written by the journal's consumer thread only (refusals are counted
 * directly by the acceptor); readable from any thread.
 */
public final class RequestStatistics implements EventHandler<RequestEvent> {
    private static final Logger log = LogManager.getLogger(RequestStatistics.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final AtomicLongArray failuresByKind = new AtomicLongArray(ErrorKind.values().length);
    private final AtomicLong refused = new AtomicLong();
    private volatile long totalRequests, failedRequests;
    private volatile long resolverCalls, identifiersResolved, seriesReturned;
    private volatile long totalLatencyNanos;
    private volatile long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;

    @Override
    public void onEvent(RequestEvent event, long sequence, boolean endOfBatch) {
        totalRequests++;
        if (event.isFailure()) {
            failedRequests++;
            failuresByKind.incrementAndGet(event.errorKind().ordinal());
            errLimiter.log(String.format("Request %s on connection %d failed with %s", event.type(),
                    event.connectionId(), event.errorKind()), null);
        } else {
            seriesReturned += event.seriesReturned();
        }
        if (event.identifiersResolved() > 0) {
            resolverCalls++;
            identifiersResolved += event.identifiersResolved();
        }
        long latency = event.latencyNanos();
        totalLatencyNanos += latency;
        if (latency < minLatencyNanos)
            minLatencyNanos = latency;
        if (latency > maxLatencyNanos)
            maxLatencyNanos = latency;
        event.clear();
    }

    public void recordRefused() {
        refused.incrementAndGet();
    }

    public long totalRequests() {
        return totalRequests;
    }

    public long failedRequests() {
        return failedRequests;
    }

    public long failures(ErrorKind kind) {
        return failuresByKind.get(kind.ordinal());
    }

    public long refusedConnections() {
        return refused.get();
    }

    public long resolverCalls() {
        return resolverCalls;
    }

    public long identifiersResolved() {
        return identifiersResolved;
    }

    public long seriesReturned() {
        return seriesReturned;
    }

    public double avgLatencyNanos() {
        long n = totalRequests;
        return n > 0 ? (double) totalLatencyNanos / n : 0;
    }

    public double avgLatencyMicros() {
        return avgLatencyNanos() / 1000.0;
    }

    public long minLatencyNanos() {
        long v = minLatencyNanos;
        return v == Long.MAX_VALUE ? 0 : v;
    }

    public long maxLatencyNanos() {
        long v = maxLatencyNanos;
        return v == Long.MIN_VALUE ? 0 : v;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s | %10s | %10s | %10s | %10s%n", "Metric", "Value", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("------------------------------------------------------------------------------------------\n");
        sb.append(String.format("%-20s | %10d | %10.2f | %10.2f | %10.2f%n", "Total Requests", totalRequests,
                avgLatencyMicros(), minLatencyNanos() / 1000.0, maxLatencyNanos() / 1000.0));
        sb.append(String.format("%-20s | %10d%n", "Failed Requests", failedRequests));
        sb.append(String.format("%-20s | %10d%n", "Refused Connections", refused.get()));
        sb.append(String.format("%-20s | %10d%n", "Resolver Calls", resolverCalls));
        sb.append(String.format("%-20s | %10d%n", "Identifiers Resolved", identifiersResolved));
        for (ErrorKind kind : ErrorKind.values()) {
            long n = failuresByKind.get(kind.ordinal());
            if (n > 0)
                sb.append(String.format("  %-18s | %10d%n", kind, n));
        }
        return sb.toString();
    }
}
