package com.hydrology.dtss.expr;

import java.util.List;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.TimeAxis;

/**
 * The source moved in time by a signed offset of {@code dt} seconds: the
 * value at {@code t} is the source value at {@code t - dt}.
 */
public final class TimeShiftNode implements TsExpression {
    private final TsExpression source;
    private final long dt;
    private final boolean bound;
    private final int hash;

    public TimeShiftNode(TsExpression source, long dt) {
        this.source = Nodes.requireChild(source, NodeKind.TIME_SHIFT);
        this.dt = dt;
        this.bound = source.isBound();
        this.hash = 31 * (31 * NodeKind.TIME_SHIFT.ordinal() + source.hashCode()) + Long.hashCode(dt);
    }

    public TsExpression source() {
        return source;
    }

    public long dt() {
        return dt;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TIME_SHIFT;
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
        TimeAxis a = source.timeAxis();
        return a == null ? null : a.shift(dt);
    }

    @Override
    public PointInterpretation interpretation() {
        return source.interpretation();
    }

    @Override
    public TsExpression withChildren(List<TsExpression> children) {
        Nodes.requireChildCount(children, 1, NodeKind.TIME_SHIFT);
        TsExpression s = children.get(0);
        return s == source ? this : new TimeShiftNode(s, dt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeShiftNode other) || hash != other.hash)
            return false;
        return Nodes.structurallyEqual(this, other);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "time_shift(" + dt + ")";
    }
}
