package com.hydrology.dtss.bind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.hydrology.dtss.api.DtsException;
import com.hydrology.dtss.api.ResolverFailureException;
import com.hydrology.dtss.api.ResolverMismatchException;
import com.hydrology.dtss.api.TsResolver;
import com.hydrology.dtss.expr.PointNode;
import com.hydrology.dtss.expr.ReferenceNode;
import com.hydrology.dtss.expr.TsExpression;
import com.hydrology.dtss.expr.TsVector;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.UtcPeriod;

import lombok.extern.log4j.Log4j2;

/**
 * Resolves the symbolic references of a request.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Walk the graph once, collecting the distinct identifiers of unbound
 * references in first-occurrence order. Bound subtrees are not entered.</li>
 * <li>If any were found, call the resolver exactly once with all of them.</li>
 * <li>Rebuild only the paths leading to references; every untouched node is
 * reused as is, so sharing inside the graph survives binding and the input
 * graph is never modified.</li>
 * </ol>
 */
@Log4j2
public final class ExpressionBinder {
    private ExpressionBinder() {
        // Utility class
    }

    /** Distinct unbound identifiers, in first-occurrence (depth-first, left to right) order. */
    public static Set<String> unboundIdentifiers(TsVector vector) {
        Set<String> ids = new LinkedHashSet<>();
        Set<TsExpression> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<TsExpression> pending = new ArrayDeque<>();
        List<TsExpression> roots = vector.expressions();
        for (int i = roots.size() - 1; i >= 0; i--)
            pending.push(roots.get(i));
        while (!pending.isEmpty()) {
            TsExpression node = pending.pop();
            if (node.isBound() || !visited.add(node))
                continue;
            if (node instanceof ReferenceNode ref) {
                ids.add(ref.id());
                continue;
            }
            List<TsExpression> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--)
                pending.push(children.get(i));
        }
        return ids;
    }

    /**
     * Binds every reference in {@code vector}.
     *
     * @param resolver may be null, which is only acceptable when the vector
     *                 is already bound
     * @return {@code vector} itself when nothing needed binding, otherwise a
     *         new fully bound vector
     * @throws ResolverMismatchException if the resolver breaks its contract
     * @throws ResolverFailureException  if no resolver is available or it
     *                                   fails
     */
    public static TsVector bind(TsVector vector, UtcPeriod period, TsResolver resolver) {
        return bind(vector, unboundIdentifiers(vector), period, resolver);
    }

    /**
     * Same as {@link #bind(TsVector, UtcPeriod, TsResolver)}, for a caller
     * that already holds {@link #unboundIdentifiers(TsVector)} of
     * {@code vector}.
     */
    public static TsVector bind(TsVector vector, Set<String> ids, UtcPeriod period, TsResolver resolver) {
        if (ids.isEmpty())
            return vector;
        if (resolver == null)
            throw new ResolverFailureException(
                    "No resolver configured for " + ids.size() + " unbound references: " + ids);

        List<String> request = List.copyOf(ids);
        log.debug("Resolving {} identifiers for {}", request.size(), period);
        List<PointSeries> results = resolve(request, period, resolver);
        Map<String, PointSeries> byId = new HashMap<>(request.size() * 2);
        for (int i = 0; i < request.size(); i++)
            byId.put(request.get(i), results.get(i));
        return substitute(vector, byId);
    }

    /**
     * Calls the resolver once and checks that it kept its contract: one non
     * null series per requested identifier.
     */
    public static List<PointSeries> resolve(List<String> request, UtcPeriod period, TsResolver resolver) {
        if (resolver == null)
            throw new ResolverFailureException("No resolver configured for " + request.size() + " identifiers");
        List<PointSeries> results;
        try {
            results = resolver.resolve(request, period);
        } catch (DtsException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ResolverFailureException("Resolver failed: " + e.getMessage(), e);
        }
        if (results == null)
            throw new ResolverMismatchException("Resolver returned no result list", request.size(), 0);
        if (results.size() != request.size())
            throw new ResolverMismatchException(request.size(), results.size());
        for (int i = 0; i < results.size(); i++)
            if (results.get(i) == null)
                throw new ResolverMismatchException(
                        "Resolver returned null for '" + request.get(i) + "'", request.size(), results.size());
        return results;
    }

    /**
     * Replaces references found in {@code values} by point nodes. References
     * without a value are left in place.
     */
    public static TsVector substitute(TsVector vector, Map<String, PointSeries> values) {
        Map<TsExpression, TsExpression> rewritten = new IdentityHashMap<>();
        List<TsExpression> roots = new ArrayList<>(vector.size());
        boolean changed = false;
        for (TsExpression e : vector) {
            TsExpression b = substitute(e, values, rewritten);
            changed |= b != e;
            roots.add(b);
        }
        return changed ? TsVector.of(roots) : vector;
    }

    /** Rebuilds the unbound part of the graph below {@code root}, children first. */
    private static TsExpression substitute(TsExpression root, Map<String, PointSeries> values,
            Map<TsExpression, TsExpression> rewritten) {
        if (root.isBound())
            return root;
        Deque<TsExpression> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            TsExpression node = pending.peek();
            if (rewritten.containsKey(node)) {
                pending.pop();
                continue;
            }
            if (node instanceof ReferenceNode ref) {
                pending.pop();
                PointSeries s = values.get(ref.id());
                rewritten.put(node, s != null ? new PointNode(s) : ref);
                continue;
            }
            List<TsExpression> children = node.children();
            boolean ready = true;
            for (int i = children.size() - 1; i >= 0; i--) {
                TsExpression c = children.get(i);
                if (!c.isBound() && !rewritten.containsKey(c)) {
                    pending.push(c);
                    ready = false;
                }
            }
            if (ready) {
                pending.pop();
                List<TsExpression> bound = new ArrayList<>(children.size());
                for (TsExpression c : children)
                    bound.add(c.isBound() ? c : rewritten.get(c));
                rewritten.put(node, node.withChildren(bound));
            }
        }
        return rewritten.get(root);
    }
}
