package com.hydrology.dtss.api;

/**
 * Client side view of a failure the server reported in an ERROR frame.
 * {@link #kind()} is the kind the server assigned.
 */
public class RemoteEvaluationException extends DtsException {
    public RemoteEvaluationException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
