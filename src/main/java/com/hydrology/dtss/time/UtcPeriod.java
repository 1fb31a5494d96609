package com.hydrology.dtss.time;

/**
 * Half-open period {@code [start, end)} in seconds since the unix epoch.
 */
public record UtcPeriod(long start, long end) {

    public UtcPeriod {
        if (end < start)
            throw new IllegalArgumentException("Period end " + end + " before start " + start);
    }

    public long timespan() {
        return end - start;
    }

    public boolean contains(long t) {
        return t >= start && t < end;
    }

    public boolean overlaps(UtcPeriod other) {
        return start < other.end && other.start < end;
    }

    public UtcPeriod shift(long dt) {
        return new UtcPeriod(start + dt, end + dt);
    }

    /** Returns the overlap, or an empty period at {@code start} if there is none. */
    public UtcPeriod intersection(UtcPeriod other) {
        long s = Math.max(start, other.start);
        long e = Math.min(end, other.end);
        return e > s ? new UtcPeriod(s, e) : new UtcPeriod(s, s);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
