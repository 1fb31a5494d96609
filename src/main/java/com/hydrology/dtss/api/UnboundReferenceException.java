package com.hydrology.dtss.api;

/**
 * Evaluation reached a symbolic reference that was never resolved.
 */
public class UnboundReferenceException extends DtsException {
    private final String identifier;

    public UnboundReferenceException(String identifier) {
        super(ErrorKind.UNBOUND_REFERENCE, "Unbound time-series reference: " + identifier);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
