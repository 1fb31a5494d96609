package com.hydrology.dtss.expr;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.TimeAxis;

/**
 * Terminal generator repeating a fixed profile.
 *
 * <p>
 * Profile entry {@code k} covers {@code [t0 + k*dt, t0 + (k+1)*dt)}, and the
 * profile repeats every {@code profile.length * dt} seconds in both
 * directions. The node evaluates to one value per period of its axis, taken
 * at the period start.
 */
public final class PeriodicNode implements TsExpression {
    private final double[] profile;
    private final long dt;
    private final long t0;
    private final TimeAxis axis;
    private final int hash;

    public PeriodicNode(double[] profile, long dt, long t0, TimeAxis axis) {
        Objects.requireNonNull(profile, "profile");
        if (profile.length == 0)
            throw new IllegalArgumentException("Periodic profile must not be empty");
        if (dt <= 0)
            throw new IllegalArgumentException("Periodic profile step must be > 0, was " + dt);
        this.profile = profile.clone();
        this.dt = dt;
        this.t0 = t0;
        this.axis = Objects.requireNonNull(axis, "axis");
        int h = 31 * NodeKind.PERIODIC.ordinal() + Arrays.hashCode(this.profile);
        h = 31 * h + Long.hashCode(dt);
        h = 31 * h + Long.hashCode(t0);
        this.hash = 31 * h + axis.hashCode();
    }

    public double[] profile() {
        return profile.clone();
    }

    public long dt() {
        return dt;
    }

    public long t0() {
        return t0;
    }

    /** Profile value in effect at time {@code t}. */
    public double valueAt(long t) {
        long k = Math.floorDiv(t - t0, dt);
        return profile[(int) Math.floorMod(k, (long) profile.length)];
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PERIODIC;
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
        return axis;
    }

    @Override
    public PointInterpretation interpretation() {
        return PointInterpretation.POINT_AVERAGE_VALUE;
    }

    @Override
    public TsExpression withChildren(List<TsExpression> children) {
        Nodes.requireChildCount(children, 0, NodeKind.PERIODIC);
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PeriodicNode other) || hash != other.hash)
            return false;
        return dt == other.dt && t0 == other.t0 && axis.equals(other.axis)
                && Arrays.equals(profile, other.profile);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "periodic(" + profile.length + " x " + dt + "s, " + axis + ")";
    }
}
