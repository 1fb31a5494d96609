package com.hydrology.dtss.api;

/**
 * Classification of request failures.
 *
 * <p>
 * The ordinal travels on the wire in ERROR response frames, so new kinds must
 * only ever be appended.
 */
public enum ErrorKind {
    DECODE,
    CYCLE,
    UNBOUND_REFERENCE,
    RESOLVER_MISMATCH,
    RESOLVER_FAILURE,
    CONNECTION_LIMIT_EXCEEDED,
    TIMEOUT,
    EVALUATION,
    INTERNAL,
    CONNECTION;

    public static ErrorKind fromOrdinal(int ordinal) {
        ErrorKind[] all = values();
        if (ordinal < 0 || ordinal >= all.length)
            return INTERNAL;
        return all[ordinal];
    }
}
