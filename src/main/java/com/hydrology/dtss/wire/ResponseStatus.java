package com.hydrology.dtss.wire;

public enum ResponseStatus {
    OK(0),
    ERROR(1);

    private final byte code;

    ResponseStatus(int code) {
        this.code = (byte) code;
    }

    public byte code() {
        return code;
    }

    public static ResponseStatus fromCode(int code) {
        return switch (code) {
            case 0 -> OK;
            case 1 -> ERROR;
            default -> null;
        };
    }
}
