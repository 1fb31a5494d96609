package com.hydrology.dtss.expr;

/**
 * What a convolution does with kernel taps that fall before the first
 * source sample.
 */
public enum ConvolvePolicy {
    /** Out-of-range samples count as 0.0; output covers the source axis. */
    USE_ZERO,
    /** No padding; output starts {@code weights.length - 1} periods later. */
    SKIP;

    public static ConvolvePolicy fromOrdinal(int ordinal) {
        ConvolvePolicy[] all = values();
        if (ordinal < 0 || ordinal >= all.length)
            throw new IllegalArgumentException("Unknown convolve policy: " + ordinal);
        return all[ordinal];
    }
}
