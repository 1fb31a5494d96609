package com.hydrology.dtss.expr;

import java.util.List;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.TimeAxis;

/**
 * A node in a time-series expression graph.
 *
 * <p>
 * The variant set is closed: every implementation is an immutable final class
 * in this package identified by {@link #kind()}, and code that dispatches over
 * variants switches on that tag so the compiler checks the switch is
 * exhaustive.
 *
 * <p>
 * Nodes own their parameters and share their children. A child can be
 * referenced by any number of parents (the graph is a DAG), but since children
 * must exist before the parent that holds them, a node can never reach
 * itself.
 */
public interface TsExpression {

    NodeKind kind();

    /** Direct children, in a fixed variant-specific order. */
    List<TsExpression> children();

    /**
     * True when no {@link ReferenceNode} is reachable from this node.
     */
    boolean isBound();

    /**
     * The axis of the series this node evaluates to, or null while it depends
     * on an unbound reference.
     */
    TimeAxis timeAxis();

    /** How the evaluated values are read between samples. */
    PointInterpretation interpretation();

    /**
     * Returns a node of the same variant and parameters over the given
     * children, or {@code this} when they are the same instances.
     *
     * @throws IllegalArgumentException if the child count does not match
     */
    TsExpression withChildren(List<TsExpression> children);
}
