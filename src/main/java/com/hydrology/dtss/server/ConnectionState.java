package com.hydrology.dtss.server;

/**
 * Lifecycle of a served connection.
 *
 * <pre>
 * ACCEPTED -> READING -> RESOLVING -> EVALUATING -> WRITING -> READING ...
 *                                                            -> CLOSED
 * any state -> FAILED (protocol or I/O error)
 * </pre>
 */
public enum ConnectionState {
    ACCEPTED,
    READING,
    RESOLVING,
    EVALUATING,
    WRITING,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }
}
