package com.hydrology.dtss.expr;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import com.hydrology.dtss.time.PointSeries;

/**
 * Ordered, immutable sequence of top-level expressions evaluated together.
 *
 * <p>
 * Elements may share sub-expressions; evaluating the vector evaluates every
 * shared node once.
 */
public final class TsVector implements Iterable<TsExpression> {
    private static final TsVector EMPTY = new TsVector(List.of());

    private final List<TsExpression> expressions;

    private TsVector(List<TsExpression> expressions) {
        this.expressions = expressions;
    }

    public static TsVector of(TsExpression... expressions) {
        return new TsVector(List.of(expressions));
    }

    public static TsVector of(List<? extends TsExpression> expressions) {
        return new TsVector(List.copyOf(expressions));
    }

    public static TsVector empty() {
        return EMPTY;
    }

    /** Wraps concrete results as point nodes. */
    public static TsVector ofSeries(List<PointSeries> series) {
        List<TsExpression> nodes = new ArrayList<>(series.size());
        for (PointSeries s : series)
            nodes.add(new PointNode(s));
        return new TsVector(List.copyOf(nodes));
    }

    public int size() {
        return expressions.size();
    }

    public boolean isEmpty() {
        return expressions.isEmpty();
    }

    public TsExpression get(int i) {
        return expressions.get(i);
    }

    public List<TsExpression> expressions() {
        return expressions;
    }

    public boolean isBound() {
        for (TsExpression e : expressions)
            if (!e.isBound())
                return false;
        return true;
    }

    /**
     * Returns the series of element {@code i}.
     *
     * @throws IllegalStateException if the element is not a point node
     */
    public PointSeries series(int i) {
        TsExpression e = expressions.get(i);
        if (e instanceof PointNode p)
            return p.series();
        throw new IllegalStateException("Element " + i + " is " + e.kind() + ", not an evaluated point series");
    }

    @Override
    public Iterator<TsExpression> iterator() {
        return expressions.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof TsVector other && expressions.equals(other.expressions));
    }

    @Override
    public int hashCode() {
        return Objects.hash(expressions);
    }

    @Override
    public String toString() {
        return "TsVector(" + expressions + ")";
    }
}
