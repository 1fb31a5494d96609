package com.hydrology.dtss.expr;

import java.util.List;
import java.util.Objects;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.TimeAxis;

/**
 * Element-wise {@code scalar op series}. The result keeps the series axis.
 */
public final class ScalarOpSeriesNode implements TsExpression {
    private final double lhs;
    private final OpCode op;
    private final TsExpression rhs;
    private final TimeAxis axis;
    private final boolean bound;
    private final int hash;

    public ScalarOpSeriesNode(double lhs, OpCode op, TsExpression rhs) {
        this.lhs = lhs;
        this.op = Objects.requireNonNull(op, "op");
        this.rhs = Nodes.requireChild(rhs, NodeKind.SCALAR_OP_SERIES);
        this.bound = rhs.isBound();
        this.axis = rhs.timeAxis();
        int h = 31 * NodeKind.SCALAR_OP_SERIES.ordinal() + Double.hashCode(lhs);
        h = 31 * h + op.ordinal();
        this.hash = 31 * h + rhs.hashCode();
    }

    public double lhs() {
        return lhs;
    }

    public OpCode op() {
        return op;
    }

    public TsExpression rhs() {
        return rhs;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SCALAR_OP_SERIES;
    }

    @Override
    public List<TsExpression> children() {
        return List.of(rhs);
    }

    @Override
    public boolean isBound() {
        return bound;
    }

    @Override
    public TimeAxis timeAxis() {
        return axis;
    }

    @Override
    public PointInterpretation interpretation() {
        return rhs.interpretation();
    }

    @Override
    public TsExpression withChildren(List<TsExpression> children) {
        Nodes.requireChildCount(children, 1, NodeKind.SCALAR_OP_SERIES);
        TsExpression r = children.get(0);
        return r == rhs ? this : new ScalarOpSeriesNode(lhs, op, r);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScalarOpSeriesNode other) || hash != other.hash)
            return false;
        return Nodes.structurallyEqual(this, other);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "scalar_op_series(" + lhs + ", " + op + ")";
    }
}
