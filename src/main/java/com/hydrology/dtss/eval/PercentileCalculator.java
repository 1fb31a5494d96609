package com.hydrology.dtss.eval;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.TimeAxis;

/**
 * Per-step statistics across an ensemble of series.
 *
 * <p>
 * Percentile {@code -1} is the arithmetic mean; {@code 0..100} is the
 * percentile with linear interpolation between order statistics (rank
 * {@code p/100 * (n-1)}). NaN members are left out of a step; a step
 * with no defined member is NaN.
 */
public final class PercentileCalculator {
    public static final int MEAN = -1;

    private PercentileCalculator() {
        // Utility class
    }

    public static void validate(List<Integer> percentiles) {
        for (Integer p : percentiles) {
            if (p == null || p < MEAN || p > 100)
                throw new IllegalArgumentException("Percentile must be -1 (mean) or within 0..100, was " + p);
        }
    }

    /**
     * @param ensemble    evaluated members, on any axes
     * @param axis        output axis; every member is averaged onto it first
     * @param percentiles requested statistics, result order follows this list
     */
    public static List<PointSeries> compute(List<PointSeries> ensemble, TimeAxis axis, List<Integer> percentiles) {
        validate(percentiles);
        List<PointSeries> aligned = new ArrayList<>(ensemble.size());
        for (PointSeries member : ensemble)
            aligned.add(Resampler.average(member, axis));

        int steps = axis.size();
        double[][] out = new double[percentiles.size()][steps];
        double[] scratch = new double[aligned.size()];
        for (int t = 0; t < steps; t++) {
            int n = 0;
            for (PointSeries s : aligned) {
                double v = s.value(t);
                if (!Double.isNaN(v))
                    scratch[n++] = v;
            }
            Arrays.sort(scratch, 0, n);
            for (int k = 0; k < percentiles.size(); k++)
                out[k][t] = statistic(scratch, n, percentiles.get(k));
        }

        List<PointSeries> results = new ArrayList<>(percentiles.size());
        for (double[] values : out)
            results.add(new PointSeries(axis, values, PointInterpretation.POINT_AVERAGE_VALUE));
        return results;
    }

    /** Statistic over the first {@code n} entries of {@code sorted}. */
    static double statistic(double[] sorted, int n, int percentile) {
        if (n == 0)
            return Double.NaN;
        if (percentile == MEAN) {
            double sum = 0.0;
            for (int i = 0; i < n; i++)
                sum += sorted[i];
            return sum / n;
        }
        double rank = percentile / 100.0 * (n - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (rank - lo);
    }
}
