package com.hydrology.dtss.eval;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.hydrology.dtss.api.UnboundReferenceException;
import com.hydrology.dtss.expr.AccumulateNode;
import com.hydrology.dtss.expr.AverageNode;
import com.hydrology.dtss.expr.BinaryOpNode;
import com.hydrology.dtss.expr.BinaryOpScalarNode;
import com.hydrology.dtss.expr.ConvolveNode;
import com.hydrology.dtss.expr.ConvolvePolicy;
import com.hydrology.dtss.expr.IntegralNode;
import com.hydrology.dtss.expr.PeriodicNode;
import com.hydrology.dtss.expr.PointNode;
import com.hydrology.dtss.expr.ReferenceNode;
import com.hydrology.dtss.expr.ScalarOpSeriesNode;
import com.hydrology.dtss.expr.TimeShiftNode;
import com.hydrology.dtss.expr.TsExpression;
import com.hydrology.dtss.expr.TsVector;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.TimeAxis;
import com.hydrology.dtss.time.UtcPeriod;

/**
 * Evaluates bound expression graphs into point series.
 *
 * <p>
 * One evaluator serves one request. It memoizes results per node instance
 * and period, so a sub-expression shared by several parents (or several
 * vector elements) is computed once.
 *
 * <p>
 * Every result is clipped to the periods overlapping the requested period.
 * Unary transforms evaluate their source over a derived period: shifted for
 * {@code time_shift}, widened by the kernel support for {@code convolve},
 * and the covering output periods for the re-sampling transforms.
 *
 * <p>
 * Not thread-safe.
 */
public final class TsEvaluator {
    private final Map<TsExpression, Map<UtcPeriod, PointSeries>> cache = new IdentityHashMap<>();
    private int evaluations;

    /** A node wanted over a period. */
    private record Demand(TsExpression node, UtcPeriod period) {
    }

    /**
     * Evaluates {@code node} and whatever it depends on. Dependencies are
     * worked off an explicit stack, children before parents, so graph depth
     * is limited by the heap rather than the calling thread's stack.
     *
     * @throws UnboundReferenceException if a reference is reached
     */
    public PointSeries evaluate(TsExpression node, UtcPeriod period) {
        PointSeries hit = cached(node, period);
        if (hit != null)
            return hit;
        Deque<Demand> pending = new ArrayDeque<>();
        pending.push(new Demand(node, period));
        while (!pending.isEmpty()) {
            Demand d = pending.peek();
            if (cached(d.node(), d.period()) != null) {
                pending.pop();
                continue;
            }
            boolean ready = true;
            List<Demand> inputs = inputs(d.node(), d.period());
            for (int i = inputs.size() - 1; i >= 0; i--) {
                Demand in = inputs.get(i);
                if (cached(in.node(), in.period()) == null) {
                    pending.push(in);
                    ready = false;
                }
            }
            if (ready) {
                pending.pop();
                PointSeries result = compute(d.node(), d.period());
                evaluations++;
                cache.computeIfAbsent(d.node(), k -> new HashMap<>(2)).put(d.period(), result);
            }
        }
        return cached(node, period);
    }

    public List<PointSeries> evaluate(TsVector vector, UtcPeriod period) {
        List<PointSeries> results = new ArrayList<>(vector.size());
        for (TsExpression e : vector)
            results.add(evaluate(e, period));
        return results;
    }

    /** Number of (node, period) pairs actually computed, cache hits excluded. */
    public int evaluationCount() {
        return evaluations;
    }

    private PointSeries cached(TsExpression node, UtcPeriod period) {
        Map<UtcPeriod, PointSeries> byPeriod = cache.get(node);
        return byPeriod == null ? null : byPeriod.get(period);
    }

    /** An input computed before this node; always present when read. */
    private PointSeries input(TsExpression node, UtcPeriod period) {
        PointSeries s = cached(node, period);
        if (s == null)
            throw new IllegalStateException(node.kind() + " input was not evaluated for " + period);
        return s;
    }

    /** The child evaluations {@code node} needs over {@code period}, in evaluation order. */
    private List<Demand> inputs(TsExpression node, UtcPeriod period) {
        return switch (node.kind()) {
            case POINT, REFERENCE, PERIODIC, VECTOR -> List.of();
            case AVERAGE -> List.of(new Demand(((AverageNode) node).source(),
                    node.timeAxis().overlapping(period).totalPeriod()));
            case INTEGRAL -> List.of(new Demand(((IntegralNode) node).source(),
                    node.timeAxis().overlapping(period).totalPeriod()));
            case ACCUMULATE -> {
                AccumulateNode n = (AccumulateNode) node;
                yield List.of(new Demand(n.source(), accumulationAxis(n, period).totalPeriod()));
            }
            case TIME_SHIFT -> {
                TimeShiftNode n = (TimeShiftNode) node;
                yield List.of(new Demand(n.source(), period.shift(-n.dt())));
            }
            case CONVOLVE -> {
                ConvolveNode n = (ConvolveNode) node;
                yield List.of(new Demand(n.source(), convolutionPeriod(n, period)));
            }
            case BINARY_OP -> {
                BinaryOpNode n = (BinaryOpNode) node;
                // without a result axis an operand is unbound; evaluating it reports the reference
                UtcPeriod span = n.timeAxis() == null ? period : n.timeAxis().overlapping(period).totalPeriod();
                yield List.of(new Demand(n.lhs(), span), new Demand(n.rhs(), span));
            }
            case BINARY_OP_SCALAR -> List.of(new Demand(((BinaryOpScalarNode) node).lhs(), period));
            case SCALAR_OP_SERIES -> List.of(new Demand(((ScalarOpSeriesNode) node).rhs(), period));
        };
    }

    private PointSeries compute(TsExpression node, UtcPeriod period) {
        return switch (node.kind()) {
            case POINT -> ((PointNode) node).series().clip(period);
            case REFERENCE -> throw new UnboundReferenceException(((ReferenceNode) node).id());
            case AVERAGE -> {
                AverageNode n = (AverageNode) node;
                TimeAxis out = n.timeAxis().overlapping(period);
                yield Resampler.average(input(n.source(), out.totalPeriod()), out);
            }
            case INTEGRAL -> {
                IntegralNode n = (IntegralNode) node;
                TimeAxis out = n.timeAxis().overlapping(period);
                yield Resampler.integral(input(n.source(), out.totalPeriod()), out);
            }
            case ACCUMULATE -> {
                AccumulateNode n = (AccumulateNode) node;
                TimeAxis upTo = accumulationAxis(n, period);
                yield Resampler.accumulate(input(n.source(), upTo.totalPeriod()), upTo).clip(period);
            }
            case TIME_SHIFT -> {
                TimeShiftNode n = (TimeShiftNode) node;
                PointSeries src = input(n.source(), period.shift(-n.dt()));
                yield new PointSeries(src.timeAxis().shift(n.dt()), src.values(), src.interpretation())
                        .clip(period);
            }
            case PERIODIC -> {
                PeriodicNode n = (PeriodicNode) node;
                TimeAxis out = n.timeAxis().overlapping(period);
                double[] v = new double[out.size()];
                for (int i = 0; i < v.length; i++)
                    v[i] = n.valueAt(out.time(i));
                yield new PointSeries(out, v, n.interpretation());
            }
            case CONVOLVE -> convolve((ConvolveNode) node, period);
            case BINARY_OP -> binaryOp((BinaryOpNode) node, period);
            case BINARY_OP_SCALAR -> {
                BinaryOpScalarNode n = (BinaryOpScalarNode) node;
                PointSeries src = input(n.lhs(), period);
                double[] v = new double[src.size()];
                for (int i = 0; i < v.length; i++)
                    v[i] = n.op().apply(src.value(i), n.rhs());
                yield new PointSeries(src.timeAxis(), v, src.interpretation());
            }
            case SCALAR_OP_SERIES -> {
                ScalarOpSeriesNode n = (ScalarOpSeriesNode) node;
                PointSeries src = input(n.rhs(), period);
                double[] v = new double[src.size()];
                for (int i = 0; i < v.length; i++)
                    v[i] = n.op().apply(n.lhs(), src.value(i));
                yield new PointSeries(src.timeAxis(), v, src.interpretation());
            }
            case VECTOR -> throw new IllegalStateException("Vector tag on an expression node");
        };
    }

    /** The running sum needs the source from the axis start onwards. */
    private static TimeAxis accumulationAxis(AccumulateNode n, UtcPeriod period) {
        TimeAxis axis = n.timeAxis();
        int first = axis.firstOverlapping(period);
        int count = axis.countOverlapping(period);
        return axis.slice(0, first + count);
    }

    /** The requested period extended back by the kernel support. */
    private static UtcPeriod convolutionPeriod(ConvolveNode n, UtcPeriod period) {
        TimeAxis childAxis = n.source().timeAxis();
        if (childAxis == null)
            return period;
        return new UtcPeriod(period.start() - (n.support() - 1) * childAxis.delta(), period.end());
    }

    private PointSeries convolve(ConvolveNode n, UtcPeriod period) {
        if (n.source().timeAxis() == null)
            throw new IllegalStateException("Convolution source has no time axis");
        int taps = n.support();
        PointSeries src = input(n.source(), convolutionPeriod(n, period));
        int size = src.size();
        int from = n.policy() == ConvolvePolicy.SKIP ? Math.min(taps - 1, size) : 0;
        double[] v = new double[size - from];
        for (int i = from; i < size; i++) {
            double sum = 0.0;
            for (int k = 0; k < taps; k++) {
                int j = i - k;
                if (j >= 0)
                    sum += n.weight(k) * src.value(j);
            }
            v[i - from] = sum;
        }
        TimeAxis out = src.timeAxis().slice(from, size - from);
        return new PointSeries(out, v, src.interpretation()).clip(period);
    }

    private PointSeries binaryOp(BinaryOpNode n, UtcPeriod period) {
        TimeAxis axis = n.timeAxis();
        if (axis == null)
            throw new IllegalStateException("Binary operation has no result axis");
        TimeAxis out = axis.overlapping(period);
        UtcPeriod span = out.totalPeriod();
        PointSeries l = input(n.lhs(), span);
        PointSeries r = input(n.rhs(), span);
        double[] v = new double[out.size()];
        for (int i = 0; i < v.length; i++) {
            long t = out.time(i);
            v[i] = n.op().apply(l.valueAt(t), r.valueAt(t));
        }
        return new PointSeries(out, v, n.interpretation());
    }
}
