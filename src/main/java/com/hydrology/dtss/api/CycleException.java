package com.hydrology.dtss.api;

/**
 * An expression graph would reference itself, directly or indirectly.
 */
public class CycleException extends DtsException {
    public CycleException(String message) {
        super(ErrorKind.CYCLE, message);
    }
}
