package com.hydrology.dtss.wire;

/** Request frame types. The code is the first byte of every request frame. */
public enum MessageType {
    EVALUATE(1),
    PERCENTILES(2),
    CLOSE(3);

    private final byte code;

    MessageType(int code) {
        this.code = (byte) code;
    }

    public byte code() {
        return code;
    }

    /** @return the type for {@code code}, or null if unknown */
    public static MessageType fromCode(int code) {
        for (MessageType t : values())
            if (t.code == code)
                return t;
        return null;
    }
}
