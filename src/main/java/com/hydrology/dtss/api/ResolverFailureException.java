package com.hydrology.dtss.api;

/**
 * The resolver could not be invoked, or threw while resolving.
 */
public class ResolverFailureException extends DtsException {
    public ResolverFailureException(String message) {
        super(ErrorKind.RESOLVER_FAILURE, message);
    }

    public ResolverFailureException(String message, Throwable cause) {
        super(ErrorKind.RESOLVER_FAILURE, message, cause);
    }
}
