package com.hydrology.dtss.api;

/**
 * Client side wait for a response exceeded its timeout. The connection is
 * abandoned.
 */
public class DtsTimeoutException extends DtsException {
    public DtsTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
