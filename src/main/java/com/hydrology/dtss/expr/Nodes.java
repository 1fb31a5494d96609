package com.hydrology.dtss.expr;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Shared checks for node constructors and structural equality. */
final class Nodes {
    private Nodes() {
    }

    static TsExpression requireChild(TsExpression child, NodeKind kind) {
        return Objects.requireNonNull(child, () -> kind + " requires a non-null child");
    }

    static void requireChildCount(List<TsExpression> children, int expected, NodeKind kind) {
        if (children.size() != expected)
            throw new IllegalArgumentException(
                    kind + " takes " + expected + " children, got " + children.size());
    }

    /**
     * Structural equality of two graphs, walked with an explicit stack so the
     * depth of a chain is bounded by the heap, not the thread stack. Pairs
     * already compared are not walked twice, which keeps heavily shared graphs
     * linear.
     */
    static boolean structurallyEqual(TsExpression a, TsExpression b) {
        Deque<TsExpression[]> pending = new ArrayDeque<>();
        Map<TsExpression, TsExpression> compared = new IdentityHashMap<>();
        pending.push(new TsExpression[] { a, b });
        while (!pending.isEmpty()) {
            TsExpression[] pair = pending.pop();
            TsExpression x = pair[0];
            TsExpression y = pair[1];
            if (x == y || compared.get(x) == y)
                continue;
            if (x.kind() != y.kind() || x.hashCode() != y.hashCode() || !sameParameters(x, y))
                return false;
            compared.put(x, y);
            List<TsExpression> xc = x.children();
            List<TsExpression> yc = y.children();
            for (int i = xc.size() - 1; i >= 0; i--)
                pending.push(new TsExpression[] { xc.get(i), yc.get(i) });
        }
        return true;
    }

    /** Compares everything but the children; both nodes have the same kind. */
    private static boolean sameParameters(TsExpression x, TsExpression y) {
        return switch (x.kind()) {
            case POINT -> ((PointNode) x).series().equals(((PointNode) y).series());
            case REFERENCE -> ((ReferenceNode) x).id().equals(((ReferenceNode) y).id());
            case AVERAGE, INTEGRAL, ACCUMULATE -> x.timeAxis().equals(y.timeAxis());
            case TIME_SHIFT -> ((TimeShiftNode) x).dt() == ((TimeShiftNode) y).dt();
            case PERIODIC -> {
                PeriodicNode p = (PeriodicNode) x;
                PeriodicNode q = (PeriodicNode) y;
                yield p.dt() == q.dt() && p.t0() == q.t0() && p.timeAxis().equals(q.timeAxis())
                        && Arrays.equals(p.profile(), q.profile());
            }
            case CONVOLVE -> {
                ConvolveNode p = (ConvolveNode) x;
                ConvolveNode q = (ConvolveNode) y;
                yield p.policy() == q.policy() && Arrays.equals(p.weights(), q.weights());
            }
            case BINARY_OP -> {
                BinaryOpNode p = (BinaryOpNode) x;
                BinaryOpNode q = (BinaryOpNode) y;
                yield p.op() == q.op() && Objects.equals(p.timeAxis(), q.timeAxis());
            }
            case BINARY_OP_SCALAR -> {
                BinaryOpScalarNode p = (BinaryOpScalarNode) x;
                BinaryOpScalarNode q = (BinaryOpScalarNode) y;
                yield p.op() == q.op() && Double.compare(p.rhs(), q.rhs()) == 0;
            }
            case SCALAR_OP_SERIES -> {
                ScalarOpSeriesNode p = (ScalarOpSeriesNode) x;
                ScalarOpSeriesNode q = (ScalarOpSeriesNode) y;
                yield p.op() == q.op() && Double.compare(p.lhs(), q.lhs()) == 0;
            }
            case VECTOR -> false;
        };
    }
}
