package com.hydrology.dtss.time;

/**
 * How the values of a series are read between samples.
 */
public enum PointInterpretation {
    /** Each value holds for its whole period (stair case). */
    POINT_AVERAGE_VALUE,
    /** Each value is the instant at its period start; linear in between. */
    POINT_INSTANT_VALUE;

    public static PointInterpretation fromOrdinal(int ordinal) {
        PointInterpretation[] all = values();
        if (ordinal < 0 || ordinal >= all.length)
            throw new IllegalArgumentException("Unknown point interpretation: " + ordinal);
        return all[ordinal];
    }
}
