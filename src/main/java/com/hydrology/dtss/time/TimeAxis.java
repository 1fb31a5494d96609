package com.hydrology.dtss.time;

/**
 * Fixed-step time axis: {@code n} contiguous periods of {@code delta} seconds
 * starting at {@code start}.
 *
 * <p>
 * Immutable. Period {@code i} is {@code [start + i*delta, start + (i+1)*delta)}.
 */
public final class TimeAxis {
    public static final TimeAxis EMPTY = new TimeAxis(0, 1, 0);

    private final long start;
    private final long delta;
    private final int n;

    public TimeAxis(long start, long delta, int n) {
        if (delta <= 0)
            throw new IllegalArgumentException("Time axis delta must be > 0, was " + delta);
        if (n < 0)
            throw new IllegalArgumentException("Time axis size must be >= 0, was " + n);
        this.start = start;
        this.delta = delta;
        this.n = n;
    }

    /** Axis of whole {@code delta} steps covering as much of {@code period} as fits. */
    public static TimeAxis covering(UtcPeriod period, long delta) {
        return new TimeAxis(period.start(), delta, (int) (period.timespan() / delta));
    }

    public long start() {
        return start;
    }

    public long delta() {
        return delta;
    }

    public int size() {
        return n;
    }

    public boolean isEmpty() {
        return n == 0;
    }

    public long end() {
        return start + n * delta;
    }

    public long time(int i) {
        return start + i * delta;
    }

    public UtcPeriod period(int i) {
        long t = time(i);
        return new UtcPeriod(t, t + delta);
    }

    public UtcPeriod totalPeriod() {
        return new UtcPeriod(start, end());
    }

    /** Index of the period containing {@code t}, or -1 if outside the axis. */
    public int indexOf(long t) {
        if (n == 0 || t < start || t >= end())
            return -1;
        return (int) ((t - start) / delta);
    }

    public TimeAxis shift(long dt) {
        return new TimeAxis(start + dt, delta, n);
    }

    public TimeAxis slice(int from, int count) {
        if (from < 0 || count < 0 || from + count > n)
            throw new IllegalArgumentException(
                    "Slice [" + from + ", " + (from + count) + ") outside axis of size " + n);
        return new TimeAxis(time(from), delta, count);
    }

    /**
     * Index of the first period that overlaps {@code p}; equals {@link #size()}
     * when nothing overlaps.
     */
    public int firstOverlapping(UtcPeriod p) {
        if (n == 0 || p.end() <= start || p.start() >= end() || p.timespan() == 0)
            return n;
        if (p.start() <= start)
            return 0;
        return (int) ((p.start() - start) / delta);
    }

    /** Number of periods, from {@link #firstOverlapping}, that overlap {@code p}. */
    public int countOverlapping(UtcPeriod p) {
        int first = firstOverlapping(p);
        if (first == n)
            return 0;
        long e = Math.min(p.end(), end());
        int last = (int) ((e - 1 - start) / delta);
        return last - first + 1;
    }

    /** Sub-axis of the periods that overlap {@code p}. */
    public TimeAxis overlapping(UtcPeriod p) {
        int first = firstOverlapping(p);
        if (first == n)
            return new TimeAxis(start, delta, 0);
        return slice(first, countOverlapping(p));
    }

    /**
     * Result axis for an element-wise operation between two series.
     * Equal axes are kept as they are; otherwise the overlapping span is
     * covered with the finer of the two steps.
     */
    public static TimeAxis combine(TimeAxis a, TimeAxis b) {
        if (a.equals(b))
            return a;
        long dt = Math.min(a.delta, b.delta);
        long s = Math.max(a.start, b.start);
        long e = Math.min(a.end(), b.end());
        if (a.isEmpty() || b.isEmpty() || e <= s)
            return new TimeAxis(s, dt, 0);
        return new TimeAxis(s, dt, (int) ((e - s) / dt));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeAxis other))
            return false;
        return start == other.start && delta == other.delta && n == other.n;
    }

    @Override
    public int hashCode() {
        int h = Long.hashCode(start);
        h = 31 * h + Long.hashCode(delta);
        return 31 * h + n;
    }

    @Override
    public String toString() {
        return "TimeAxis(start=" + start + ", delta=" + delta + ", n=" + n + ")";
    }
}
