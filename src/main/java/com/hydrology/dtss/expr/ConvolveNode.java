package com.hydrology.dtss.expr;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.TimeAxis;

/**
 * Unit-hydrograph style convolution of the source with a fixed kernel:
 * {@code out[i] = sum_k weights[k] * source[i - k]}.
 *
 * <p>
 * The {@link ConvolvePolicy} decides what happens with taps that reach
 * before the first source sample.
 */
public final class ConvolveNode implements TsExpression {
    private final TsExpression source;
    private final double[] weights;
    private final ConvolvePolicy policy;
    private final boolean bound;
    private final int hash;

    public ConvolveNode(TsExpression source, double[] weights, ConvolvePolicy policy) {
        this.source = Nodes.requireChild(source, NodeKind.CONVOLVE);
        Objects.requireNonNull(weights, "weights");
        if (weights.length == 0)
            throw new IllegalArgumentException("Convolution kernel must not be empty");
        this.weights = weights.clone();
        this.policy = Objects.requireNonNull(policy, "policy");
        this.bound = source.isBound();
        int h = 31 * NodeKind.CONVOLVE.ordinal() + source.hashCode();
        h = 31 * h + Arrays.hashCode(this.weights);
        this.hash = 31 * h + policy.ordinal();
    }

    public TsExpression source() {
        return source;
    }

    public double[] weights() {
        return weights.clone();
    }

    /** Number of kernel taps. */
    public int support() {
        return weights.length;
    }

    public double weight(int k) {
        return weights[k];
    }

    public ConvolvePolicy policy() {
        return policy;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONVOLVE;
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
        if (a == null || policy == ConvolvePolicy.USE_ZERO)
            return a;
        int skip = weights.length - 1;
        if (a.size() <= skip)
            return new TimeAxis(a.end(), a.delta(), 0);
        return a.slice(skip, a.size() - skip);
    }

    @Override
    public PointInterpretation interpretation() {
        return source.interpretation();
    }

    @Override
    public TsExpression withChildren(List<TsExpression> children) {
        Nodes.requireChildCount(children, 1, NodeKind.CONVOLVE);
        TsExpression s = children.get(0);
        return s == source ? this : new ConvolveNode(s, weights, policy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ConvolveNode other) || hash != other.hash)
            return false;
        return Nodes.structurallyEqual(this, other);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "convolve(" + weights.length + " taps, " + policy + ")";
    }
}
