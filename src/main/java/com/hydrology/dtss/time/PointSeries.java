package com.hydrology.dtss.time;

import java.util.Arrays;

/**
 * A time axis plus one value per period.
 *
 * <p>
 * Immutable. The constructor takes ownership of the value array; callers
 * must not modify it afterwards. {@link #values()} returns a copy.
 */
public final class PointSeries {
    private final TimeAxis axis;
    private final double[] values;
    private final PointInterpretation interpretation;

    public PointSeries(TimeAxis axis, double[] values, PointInterpretation interpretation) {
        if (axis.size() != values.length)
            throw new IllegalArgumentException(
                    "Value count " + values.length + " does not match axis size " + axis.size());
        this.axis = axis;
        this.values = values;
        this.interpretation = interpretation;
    }

    public static PointSeries constant(TimeAxis axis, double value, PointInterpretation interpretation) {
        double[] v = new double[axis.size()];
        Arrays.fill(v, value);
        return new PointSeries(axis, v, interpretation);
    }

    public static PointSeries empty(PointInterpretation interpretation) {
        return new PointSeries(TimeAxis.EMPTY, new double[0], interpretation);
    }

    public TimeAxis timeAxis() {
        return axis;
    }

    public PointInterpretation interpretation() {
        return interpretation;
    }

    public int size() {
        return values.length;
    }

    public double value(int i) {
        return values[i];
    }

    public double[] values() {
        return values.clone();
    }

    /**
     * Value at time {@code t} according to the point interpretation, NaN
     * outside the axis.
     */
    public double valueAt(long t) {
        int i = axis.indexOf(t);
        if (i < 0)
            return Double.NaN;
        double v = values[i];
        if (interpretation == PointInterpretation.POINT_AVERAGE_VALUE || i + 1 >= values.length)
            return v;
        double next = values[i + 1];
        if (Double.isNaN(next))
            return v;
        long t0 = axis.time(i);
        return v + (next - v) * (double) (t - t0) / axis.delta();
    }

    /** The periods of this series that overlap {@code period}. */
    public PointSeries clip(UtcPeriod period) {
        int first = axis.firstOverlapping(period);
        int count = axis.countOverlapping(period);
        if (first == 0 && count == values.length)
            return this;
        if (count == 0)
            return new PointSeries(new TimeAxis(axis.start(), axis.delta(), 0), new double[0], interpretation);
        return new PointSeries(axis.slice(first, count),
                Arrays.copyOfRange(values, first, first + count), interpretation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PointSeries other))
            return false;
        return interpretation == other.interpretation && axis.equals(other.axis)
                && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        int h = axis.hashCode();
        h = 31 * h + interpretation.hashCode();
        return 31 * h + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PointSeries(").append(axis).append(", ")
                .append(interpretation).append(", [");
        int shown = Math.min(values.length, 8);
        for (int i = 0; i < shown; i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(values[i]);
        }
        if (values.length > shown)
            sb.append(", ... (").append(values.length).append(" values)");
        return sb.append("])").toString();
    }
}
