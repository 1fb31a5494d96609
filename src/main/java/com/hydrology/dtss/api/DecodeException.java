package com.hydrology.dtss.api;

/**
 * Malformed wire or snapshot data.
 */
public class DecodeException extends DtsException {
    private final long offset;

    public DecodeException(String message, long offset) {
        super(ErrorKind.DECODE, message + " (at byte " + offset + ")");
        this.offset = offset;
    }

    public DecodeException(String message, long offset, Throwable cause) {
        super(ErrorKind.DECODE, message + " (at byte " + offset + ")", cause);
        this.offset = offset;
    }

    /** Byte offset in the decoded buffer where the problem was found. */
    public long offset() {
        return offset;
    }
}
