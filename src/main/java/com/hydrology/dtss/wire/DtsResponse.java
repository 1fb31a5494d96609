package com.hydrology.dtss.wire;

import java.util.Objects;

import com.hydrology.dtss.api.ErrorKind;
import com.hydrology.dtss.expr.TsVector;

/** A response: either a result vector or an error kind with a message. */
public record DtsResponse(ResponseStatus status, TsVector vector, ErrorKind errorKind, String message) {

    public DtsResponse {
        Objects.requireNonNull(status, "status");
        if (status == ResponseStatus.OK)
            Objects.requireNonNull(vector, "vector");
        else
            Objects.requireNonNull(errorKind, "errorKind");
    }

    public static DtsResponse ok(TsVector vector) {
        return new DtsResponse(ResponseStatus.OK, vector, null, null);
    }

    public static DtsResponse error(ErrorKind kind, String message) {
        return new DtsResponse(ResponseStatus.ERROR, null, kind, message != null ? message : kind.name());
    }

    public boolean isOk() {
        return status == ResponseStatus.OK;
    }
}
