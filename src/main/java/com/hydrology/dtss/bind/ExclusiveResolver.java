package com.hydrology.dtss.bind;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import com.hydrology.dtss.api.ResolverFailureException;
import com.hydrology.dtss.api.TsResolver;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.UtcPeriod;

/**
 * Serializes calls into a resolver that owns a single execution context
 * (for example an embedding host runtime).
 *
 * <p>
 * This is the one serialization point of the service. The lock is held for
 * the resolver call only: decoding, evaluation and socket I/O of other
 * connections run in parallel with it. By default all instances share one
 * JVM-wide lock, so at most one resolver call is in flight system wide.
 */
public final class ExclusiveResolver implements TsResolver {
    private static final Lock HOST_LOCK = new ReentrantLock(true);

    private final TsResolver delegate;
    private final Lock lock;

    public ExclusiveResolver(TsResolver delegate) {
        this(delegate, HOST_LOCK);
    }

    public ExclusiveResolver(TsResolver delegate, Lock lock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.lock = Objects.requireNonNull(lock, "lock");
    }

    public TsResolver delegate() {
        return delegate;
    }

    @Override
    public List<PointSeries> resolve(List<String> ids, UtcPeriod period) {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResolverFailureException("Interrupted while waiting for the resolver", e);
        }
        try {
            return delegate.resolve(ids, period);
        } finally {
            lock.unlock();
        }
    }
}
