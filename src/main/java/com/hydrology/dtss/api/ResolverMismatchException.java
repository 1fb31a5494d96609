package com.hydrology.dtss.api;

/**
 * The resolver answered with a different number of series than requested.
 */
public class ResolverMismatchException extends DtsException {
    private final int requested;
    private final int returned;

    public ResolverMismatchException(int requested, int returned) {
        super(ErrorKind.RESOLVER_MISMATCH,
                "Resolver returned " + returned + " series for " + requested + " identifiers");
        this.requested = requested;
        this.returned = returned;
    }

    public ResolverMismatchException(String message, int requested, int returned) {
        super(ErrorKind.RESOLVER_MISMATCH, message);
        this.requested = requested;
        this.returned = returned;
    }

    public int requested() {
        return requested;
    }

    public int returned() {
        return returned;
    }
}
