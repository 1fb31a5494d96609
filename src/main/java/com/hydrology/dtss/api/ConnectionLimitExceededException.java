package com.hydrology.dtss.api;

/**
 * The server refused the connection because it already serves its maximum.
 */
public class ConnectionLimitExceededException extends DtsException {
    public ConnectionLimitExceededException(String message) {
        super(ErrorKind.CONNECTION_LIMIT_EXCEEDED, message);
    }
}
