package com.hydrology.dtss.expr;

import java.util.List;
import java.util.Objects;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.TimeAxis;

/**
 * True average of the source over each period of the node's axis,
 * ignoring the parts where the source is NaN or undefined.
 */
public final class AverageNode implements TsExpression {
    private final TsExpression source;
    private final TimeAxis axis;
    private final boolean bound;
    private final int hash;

    public AverageNode(TsExpression source, TimeAxis axis) {
        this.source = Nodes.requireChild(source, NodeKind.AVERAGE);
        this.axis = Objects.requireNonNull(axis, "axis");
        this.bound = source.isBound();
        this.hash = 31 * (31 * NodeKind.AVERAGE.ordinal() + source.hashCode()) + axis.hashCode();
    }

    public TsExpression source() {
        return source;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.AVERAGE;
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
        Nodes.requireChildCount(children, 1, NodeKind.AVERAGE);
        TsExpression s = children.get(0);
        return s == source ? this : new AverageNode(s, axis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AverageNode other) || hash != other.hash)
            return false;
        return Nodes.structurallyEqual(this, other);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "average(" + axis + ")";
    }
}
