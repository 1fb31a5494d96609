package com.hydrology.dtss.expr;

import java.util.List;
import java.util.Objects;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.TimeAxis;

/** Terminal node wrapping concrete samples. Always bound. */
public final class PointNode implements TsExpression {
    private final PointSeries series;

    public PointNode(PointSeries series) {
        this.series = Objects.requireNonNull(series, "series");
    }

    public PointSeries series() {
        return series;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.POINT;
    }

    @Override
    public List<TsExpression> children() {
        return List.of();
    }

    @Override
    public boolean isBound() {
        return true;
    }

    @Override
    public TimeAxis timeAxis() {
        return series.timeAxis();
    }

    @Override
    public PointInterpretation interpretation() {
        return series.interpretation();
    }

    @Override
    public TsExpression withChildren(List<TsExpression> children) {
        Nodes.requireChildCount(children, 0, NodeKind.POINT);
        return this;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PointNode other && series.equals(other.series));
    }

    @Override
    public int hashCode() {
        return series.hashCode();
    }

    @Override
    public String toString() {
        return "point(" + series.timeAxis() + ")";
    }
}
