package com.hydrology.dtss.api;

/**
 * Root of all failures raised by the time-series service.
 *
 * <p>
 * Every failure terminates exactly one request (or connection). The server
 * converts it to an ERROR frame carrying {@link #kind()} and the message.
 */
public class DtsException extends RuntimeException {
    private final ErrorKind kind;

    public DtsException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DtsException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
