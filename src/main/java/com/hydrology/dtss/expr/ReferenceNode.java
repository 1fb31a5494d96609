package com.hydrology.dtss.expr;

import java.util.List;
import java.util.Objects;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.TimeAxis;

/**
 * Terminal node naming a series only the server side resolver can produce.
 * Never bound; binding replaces it by a {@link PointNode}.
 */
public final class ReferenceNode implements TsExpression {
    private final String id;

    public ReferenceNode(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String id() {
        return id;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.REFERENCE;
    }

    @Override
    public List<TsExpression> children() {
        return List.of();
    }

    @Override
    public boolean isBound() {
        return false;
    }

    @Override
    public TimeAxis timeAxis() {
        return null;
    }

    @Override
    public PointInterpretation interpretation() {
        return PointInterpretation.POINT_AVERAGE_VALUE;
    }

    @Override
    public TsExpression withChildren(List<TsExpression> children) {
        Nodes.requireChildCount(children, 0, NodeKind.REFERENCE);
        return this;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ReferenceNode other && id.equals(other.id));
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ref(" + id + ")";
    }
}
