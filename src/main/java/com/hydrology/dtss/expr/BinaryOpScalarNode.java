package com.hydrology.dtss.expr;

import java.util.List;
import java.util.Objects;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.TimeAxis;

/**
 * Element-wise {@code series op scalar}. The result keeps the series axis.
 */
public final class BinaryOpScalarNode implements TsExpression {
    private final TsExpression lhs;
    private final OpCode op;
    private final double rhs;
    private final TimeAxis axis;
    private final boolean bound;
    private final int hash;

    public BinaryOpScalarNode(TsExpression lhs, OpCode op, double rhs) {
        this.lhs = Nodes.requireChild(lhs, NodeKind.BINARY_OP_SCALAR);
        this.op = Objects.requireNonNull(op, "op");
        this.rhs = rhs;
        this.bound = lhs.isBound();
        this.axis = lhs.timeAxis();
        int h = 31 * NodeKind.BINARY_OP_SCALAR.ordinal() + lhs.hashCode();
        h = 31 * h + op.ordinal();
        this.hash = 31 * h + Double.hashCode(rhs);
    }

    public TsExpression lhs() {
        return lhs;
    }

    public OpCode op() {
        return op;
    }

    public double rhs() {
        return rhs;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY_OP_SCALAR;
    }

    @Override
    public List<TsExpression> children() {
        return List.of(lhs);
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
        return lhs.interpretation();
    }

    @Override
    public TsExpression withChildren(List<TsExpression> children) {
        Nodes.requireChildCount(children, 1, NodeKind.BINARY_OP_SCALAR);
        TsExpression l = children.get(0);
        return l == lhs ? this : new BinaryOpScalarNode(l, op, rhs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BinaryOpScalarNode other) || hash != other.hash)
            return false;
        return Nodes.structurallyEqual(this, other);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "binary_op_scalar(" + op + ", " + rhs + ")";
    }
}
