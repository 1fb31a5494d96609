package com.hydrology.dtss.expr;

import java.util.List;
import java.util.Objects;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.TimeAxis;

/**
 * Integral (value times seconds) of the source over each period of the
 * node's axis. Periods where the source is undefined evaluate to NaN.
 */
public final class IntegralNode implements TsExpression {
    private final TsExpression source;
    private final TimeAxis axis;
    private final boolean bound;
    private final int hash;

    public IntegralNode(TsExpression source, TimeAxis axis) {
        this.source = Nodes.requireChild(source, NodeKind.INTEGRAL);
        this.axis = Objects.requireNonNull(axis, "axis");
        this.bound = source.isBound();
        this.hash = 31 * (31 * NodeKind.INTEGRAL.ordinal() + source.hashCode()) + axis.hashCode();
    }

    public TsExpression source() {
        return source;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INTEGRAL;
    }

    @Override
    public List<TsExpression> children() {
        return List.of(source);
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
        return PointInterpretation.POINT_AVERAGE_VALUE;
    }

    @Override
    public TsExpression withChildren(List<TsExpression> children) {
        Nodes.requireChildCount(children, 1, NodeKind.INTEGRAL);
        TsExpression s = children.get(0);
        return s == source ? this : new IntegralNode(s, axis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IntegralNode other) || hash != other.hash)
            return false;
        return Nodes.structurallyEqual(this, other);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "integral(" + axis + ")";
    }
}
