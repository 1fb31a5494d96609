package com.hydrology.dtss.expr;

import java.util.List;
import java.util.Objects;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.TimeAxis;

/**
 * Running integral of the source from the axis start to the start of each
 * period. The first value is always 0.
 */
public final class AccumulateNode implements TsExpression {
    private final TsExpression source;
    private final TimeAxis axis;
    private final boolean bound;
    private final int hash;

    public AccumulateNode(TsExpression source, TimeAxis axis) {
        this.source = Nodes.requireChild(source, NodeKind.ACCUMULATE);
        this.axis = Objects.requireNonNull(axis, "axis");
        this.bound = source.isBound();
        this.hash = 31 * (31 * NodeKind.ACCUMULATE.ordinal() + source.hashCode()) + axis.hashCode();
    }

    public TsExpression source() {
        return source;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ACCUMULATE;
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
        return PointInterpretation.POINT_INSTANT_VALUE;
    }

    @Override
    public TsExpression withChildren(List<TsExpression> children) {
        Nodes.requireChildCount(children, 1, NodeKind.ACCUMULATE);
        TsExpression s = children.get(0);
        return s == source ? this : new AccumulateNode(s, axis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AccumulateNode other) || hash != other.hash)
            return false;
        return Nodes.structurallyEqual(this, other);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "accumulate(" + axis + ")";
    }
}
