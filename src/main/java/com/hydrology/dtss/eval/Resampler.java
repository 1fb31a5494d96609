package com.hydrology.dtss.eval;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.TimeAxis;
import com.hydrology.dtss.time.UtcPeriod;

/**
 * Re-samples a series onto another time axis.
 *
 * <p>
 * All three transforms integrate the source function over sub-intervals.
 * Stair-case sources ({@link PointInterpretation#POINT_AVERAGE_VALUE}) are
 * integrated piece by piece; instant sources are integrated with the
 * trapezoid rule between neighbouring samples. Source NaNs contribute
 * nothing and do not count as covered time.
 */
public final class Resampler {
    private Resampler() {
        // Utility class
    }

    /** Integral of {@code src} over {@code [a, b)} and the number of seconds it was defined. */
    record Coverage(double integral, long covered) {
    }

    public static PointSeries average(PointSeries src, TimeAxis axis) {
        double[] out = new double[axis.size()];
        for (int i = 0; i < out.length; i++) {
            Coverage c = integrate(src, axis.time(i), axis.time(i) + axis.delta());
            out[i] = c.covered() > 0 ? c.integral() / c.covered() : Double.NaN;
        }
        return new PointSeries(axis, out, PointInterpretation.POINT_AVERAGE_VALUE);
    }

    public static PointSeries integral(PointSeries src, TimeAxis axis) {
        double[] out = new double[axis.size()];
        for (int i = 0; i < out.length; i++) {
            Coverage c = integrate(src, axis.time(i), axis.time(i) + axis.delta());
            out[i] = c.covered() > 0 ? c.integral() : Double.NaN;
        }
        return new PointSeries(axis, out, PointInterpretation.POINT_AVERAGE_VALUE);
    }

    /**
     * Value {@code i} is the integral from {@code axis.start()} to
     * {@code axis.time(i)}, so the first value is 0.
     */
    public static PointSeries accumulate(PointSeries src, TimeAxis axis) {
        double[] out = new double[axis.size()];
        double sum = 0.0;
        for (int i = 0; i < out.length; i++) {
            out[i] = sum;
            Coverage c = integrate(src, axis.time(i), axis.time(i) + axis.delta());
            sum += c.integral();
        }
        return new PointSeries(axis, out, PointInterpretation.POINT_INSTANT_VALUE);
    }

    static Coverage integrate(PointSeries src, long a, long b) {
        TimeAxis ta = src.timeAxis();
        UtcPeriod window = new UtcPeriod(a, b);
        int first = ta.firstOverlapping(window);
        int count = ta.countOverlapping(window);
        boolean instant = src.interpretation() == PointInterpretation.POINT_INSTANT_VALUE;
        double sum = 0.0;
        long covered = 0;
        for (int i = first; i < first + count; i++) {
            double v = src.value(i);
            if (Double.isNaN(v))
                continue;
            long s = ta.time(i);
            long x = Math.max(s, a);
            long y = Math.min(s + ta.delta(), b);
            if (y <= x)
                continue;
            if (instant && i + 1 < src.size() && !Double.isNaN(src.value(i + 1))) {
                double slope = (src.value(i + 1) - v) / ta.delta();
                double fx = v + slope * (x - s);
                double fy = v + slope * (y - s);
                sum += 0.5 * (fx + fy) * (y - x);
            } else {
                sum += v * (y - x);
            }
            covered += y - x;
        }
        return new Coverage(sum, covered);
    }
}
