package com.hydrology.dtss.expr;

import java.util.List;
import java.util.Objects;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.TimeAxis;

/**
 * Element-wise {@code lhs op rhs} between two series.
 *
 * <p>
 * The result axis is fixed when both operands become bound
 * ({@link TimeAxis#combine}) and stored in the node; evaluation uses the
 * stored axis and never re-derives it. While an operand is unbound the axis
 * is null.
 */
public final class BinaryOpNode implements TsExpression {
    private final TsExpression lhs;
    private final OpCode op;
    private final TsExpression rhs;
    private final TimeAxis axis;
    private final boolean bound;
    private final int hash;

    public BinaryOpNode(TsExpression lhs, OpCode op, TsExpression rhs) {
        this(lhs, op, rhs, null);
    }

    /**
     * @param axis stored result axis, or null to derive it from bound operands
     */
    public BinaryOpNode(TsExpression lhs, OpCode op, TsExpression rhs, TimeAxis axis) {
        this.lhs = Nodes.requireChild(lhs, NodeKind.BINARY_OP);
        this.op = Objects.requireNonNull(op, "op");
        this.rhs = Nodes.requireChild(rhs, NodeKind.BINARY_OP);
        this.bound = lhs.isBound() && rhs.isBound();
        if (axis == null && bound)
            axis = TimeAxis.combine(lhs.timeAxis(), rhs.timeAxis());
        this.axis = axis;
        int h = 31 * NodeKind.BINARY_OP.ordinal() + lhs.hashCode();
        h = 31 * h + op.ordinal();
        h = 31 * h + rhs.hashCode();
        this.hash = 31 * h + Objects.hashCode(axis);
    }

    public TsExpression lhs() {
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
        return NodeKind.BINARY_OP;
    }

    @Override
    public List<TsExpression> children() {
        return List.of(lhs, rhs);
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
        if (lhs.interpretation() == PointInterpretation.POINT_AVERAGE_VALUE
                || rhs.interpretation() == PointInterpretation.POINT_AVERAGE_VALUE)
            return PointInterpretation.POINT_AVERAGE_VALUE;
        return PointInterpretation.POINT_INSTANT_VALUE;
    }

    @Override
    public TsExpression withChildren(List<TsExpression> children) {
        Nodes.requireChildCount(children, 2, NodeKind.BINARY_OP);
        TsExpression l = children.get(0);
        TsExpression r = children.get(1);
        if (l == lhs && r == rhs)
            return this;
        return new BinaryOpNode(l, op, r, bound ? axis : null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BinaryOpNode other) || hash != other.hash)
            return false;
        return Nodes.structurallyEqual(this, other);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "binary_op(" + op + ", bound=" + bound + ")";
    }
}
