package com.hydrology.dtss.expr;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.TimeAxis;

/**
 * Static factory helpers for building expression graphs in code.
 *
 * <pre>{@code
 * TsExpression inflow = ref("catchment/42/discharge");
 * TsExpression daily = average(add(inflow, 0.5), dailyAxis);
 * }</pre>
 */
public final class TsExpressions {
    private TsExpressions() {
        // Utility class
    }

    public static PointNode point(PointSeries series) {
        return new PointNode(series);
    }

    public static PointNode point(TimeAxis axis, double... values) {
        return new PointNode(new PointSeries(axis, values.clone(), PointInterpretation.POINT_AVERAGE_VALUE));
    }

    public static PointNode constant(TimeAxis axis, double value) {
        return new PointNode(PointSeries.constant(axis, value, PointInterpretation.POINT_AVERAGE_VALUE));
    }

    public static ReferenceNode ref(String id) {
        return new ReferenceNode(id);
    }

    public static AverageNode average(TsExpression source, TimeAxis axis) {
        return new AverageNode(source, axis);
    }

    public static IntegralNode integral(TsExpression source, TimeAxis axis) {
        return new IntegralNode(source, axis);
    }

    public static AccumulateNode accumulate(TsExpression source, TimeAxis axis) {
        return new AccumulateNode(source, axis);
    }

    public static TimeShiftNode timeShift(TsExpression source, long dt) {
        return new TimeShiftNode(source, dt);
    }

    public static PeriodicNode periodic(double[] profile, long dt, long t0, TimeAxis axis) {
        return new PeriodicNode(profile, dt, t0, axis);
    }

    public static ConvolveNode convolve(TsExpression source, ConvolvePolicy policy, double... weights) {
        return new ConvolveNode(source, weights, policy);
    }

    public static BinaryOpNode op(TsExpression lhs, OpCode op, TsExpression rhs) {
        return new BinaryOpNode(lhs, op, rhs);
    }

    public static BinaryOpNode add(TsExpression lhs, TsExpression rhs) {
        return new BinaryOpNode(lhs, OpCode.ADD, rhs);
    }

    public static BinaryOpScalarNode add(TsExpression lhs, double rhs) {
        return new BinaryOpScalarNode(lhs, OpCode.ADD, rhs);
    }

    public static BinaryOpNode sub(TsExpression lhs, TsExpression rhs) {
        return new BinaryOpNode(lhs, OpCode.SUB, rhs);
    }

    public static BinaryOpNode mul(TsExpression lhs, TsExpression rhs) {
        return new BinaryOpNode(lhs, OpCode.MUL, rhs);
    }

    public static BinaryOpScalarNode mul(TsExpression lhs, double rhs) {
        return new BinaryOpScalarNode(lhs, OpCode.MUL, rhs);
    }

    public static ScalarOpSeriesNode mul(double lhs, TsExpression rhs) {
        return new ScalarOpSeriesNode(lhs, OpCode.MUL, rhs);
    }

    public static BinaryOpNode div(TsExpression lhs, TsExpression rhs) {
        return new BinaryOpNode(lhs, OpCode.DIV, rhs);
    }

    public static BinaryOpScalarNode div(TsExpression lhs, double rhs) {
        return new BinaryOpScalarNode(lhs, OpCode.DIV, rhs);
    }

    public static ScalarOpSeriesNode div(double lhs, TsExpression rhs) {
        return new ScalarOpSeriesNode(lhs, OpCode.DIV, rhs);
    }

    public static BinaryOpNode max(TsExpression lhs, TsExpression rhs) {
        return new BinaryOpNode(lhs, OpCode.MAX, rhs);
    }

    public static BinaryOpNode min(TsExpression lhs, TsExpression rhs) {
        return new BinaryOpNode(lhs, OpCode.MIN, rhs);
    }
}
