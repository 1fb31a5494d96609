package com.hydrology.dtss.util;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.hydrology.dtss.expr.BinaryOpNode;
import com.hydrology.dtss.expr.BinaryOpScalarNode;
import com.hydrology.dtss.expr.ConvolveNode;
import com.hydrology.dtss.expr.PointNode;
import com.hydrology.dtss.expr.ReferenceNode;
import com.hydrology.dtss.expr.ScalarOpSeriesNode;
import com.hydrology.dtss.expr.TimeShiftNode;
import com.hydrology.dtss.expr.TsExpression;
import com.hydrology.dtss.expr.TsVector;

/**
 * Diagnostic rendering of an expression vector as an indented tree.
 *
 * <p>
 * Each distinct node gets a number the first time it is printed. Later
 * occurrences of the same instance print as {@code ^#n} instead of the
 * subtree again, which makes structural sharing visible.
 *
 * <p>
 * Intended for logging and debugging. On the request path, guard calls with
 * a debug level check and bound the output with {@link #explain(TsVector, int)}.
 * Indentation stops growing after {@value #MAX_INDENT} levels.
 */
public final class ExpressionExplain {
    static final int MAX_INDENT = 32;

    private ExpressionExplain() {
    }

    public static String explain(TsVector vector) {
        return explain(vector, Integer.MAX_VALUE);
    }

    /** Like {@link #explain(TsVector)}, printing at most {@code maxNodes} node lines. */
    public static String explain(TsVector vector, int maxNodes) {
        StringBuilder sb = new StringBuilder(512);
        Map<TsExpression, Integer> seen = new IdentityHashMap<>();
        sb.append("Vector (").append(vector.size()).append(" expressions, ")
                .append(vector.isBound() ? "bound" : "unbound").append("):\n");
        int budget = maxNodes;
        for (int i = 0; i < vector.size() && budget >= 0; i++) {
            sb.append("  [").append(i).append("]\n");
            budget = append(sb, vector.get(i), 2, seen, budget);
        }
        if (budget < 0)
            sb.append("  ... truncated after ").append(maxNodes).append(" lines\n");
        return sb.toString();
    }

    public static String explain(TsExpression expression) {
        StringBuilder sb = new StringBuilder(256);
        append(sb, expression, 0, new IdentityHashMap<>(), Integer.MAX_VALUE);
        return sb.toString();
    }

    /** Number of distinct node instances reachable from the vector. */
    public static int distinctNodeCount(TsVector vector) {
        Set<TsExpression> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<TsExpression> pending = new ArrayDeque<>(vector.expressions());
        while (!pending.isEmpty()) {
            TsExpression e = pending.pop();
            if (seen.add(e))
                pending.addAll(e.children());
        }
        return seen.size();
    }

    private record Line(TsExpression node, int depth) {
    }

    /**
     * Pre-order, children left to right, one line per node.
     *
     * @return the line budget left, or -1 if it ran out with nodes unprinted
     */
    private static int append(StringBuilder sb, TsExpression root, int depth, Map<TsExpression, Integer> seen,
            int budget) {
        Deque<Line> pending = new ArrayDeque<>();
        pending.push(new Line(root, depth));
        while (!pending.isEmpty()) {
            if (budget-- <= 0)
                return -1;
            Line line = pending.pop();
            TsExpression e = line.node();
            int d = line.depth();
            sb.append("  ".repeat(Math.min(d, MAX_INDENT)));
            Integer id = seen.get(e);
            if (id != null) {
                sb.append("^#").append(id).append('\n');
                continue;
            }
            id = seen.size();
            seen.put(e, id);
            sb.append('#').append(id).append(' ').append(e.kind()).append(label(e));
            if (e.timeAxis() != null)
                sb.append(' ').append(e.timeAxis());
            sb.append('\n');
            List<TsExpression> children = e.children();
            for (int i = children.size() - 1; i >= 0; i--)
                pending.push(new Line(children.get(i), d + 1));
        }
        return budget;
    }

    private static String label(TsExpression e) {
        if (e instanceof ReferenceNode r)
            return " '" + r.id() + "'";
        if (e instanceof PointNode p)
            return " " + p.series().interpretation();
        if (e instanceof TimeShiftNode t)
            return " dt=" + t.dt();
        if (e instanceof ConvolveNode c)
            return " taps=" + c.support() + " " + c.policy();
        if (e instanceof BinaryOpNode b)
            return " " + b.op();
        if (e instanceof BinaryOpScalarNode b)
            return " " + b.op() + " " + b.rhs();
        if (e instanceof ScalarOpSeriesNode s)
            return " " + s.lhs() + " " + s.op();
        return "";
    }
}
