package com.hydrology.dtss.expr;

/**
 * The closed set of expression node variants.
 *
 * <p>
 * The tag byte identifies the variant in the binary codec and must never be
 * reused. {@code VECTOR} only appears on the wire; in memory a vector is a
 * {@link TsVector}.
 */
public enum NodeKind {
    POINT(1),
    REFERENCE(2),
    AVERAGE(3),
    INTEGRAL(4),
    ACCUMULATE(5),
    TIME_SHIFT(6),
    PERIODIC(7),
    CONVOLVE(8),
    BINARY_OP(9),
    BINARY_OP_SCALAR(10),
    SCALAR_OP_SERIES(11),
    VECTOR(12);

    private final byte tag;

    NodeKind(int tag) {
        this.tag = (byte) tag;
    }

    public byte tag() {
        return tag;
    }

    /** Returns the kind for a wire tag, or null if the tag is unknown. */
    public static NodeKind fromTag(byte tag) {
        for (NodeKind k : values()) {
            if (k.tag == tag)
                return k;
        }
        return null;
    }

    /** Lenient lookup by name, accepting {@code "binary_op"} and {@code "BINARY_OP"}. */
    public static NodeKind fromString(String text) {
        for (NodeKind k : values()) {
            if (k.name().equalsIgnoreCase(text))
                return k;
        }
        throw new IllegalArgumentException("Unknown node kind: " + text);
    }
}
