package com.hydrology.dtss.wire;

import java.util.List;
import java.util.Objects;

import com.hydrology.dtss.expr.TsVector;
import com.hydrology.dtss.time.TimeAxis;
import com.hydrology.dtss.time.UtcPeriod;

/**
 * A decoded request. {@code outputAxis} and {@code percentiles} are only set
 * for {@link MessageType#PERCENTILES}; a CLOSE request carries nothing.
 */
public record DtsRequest(MessageType type, UtcPeriod period, TsVector vector, TimeAxis outputAxis,
        List<Integer> percentiles) {

    public DtsRequest {
        Objects.requireNonNull(type, "type");
        if (type != MessageType.CLOSE) {
            Objects.requireNonNull(period, "period");
            Objects.requireNonNull(vector, "vector");
        }
        if (type == MessageType.PERCENTILES) {
            Objects.requireNonNull(outputAxis, "outputAxis");
            percentiles = List.copyOf(percentiles);
        }
    }

    public static DtsRequest evaluate(TsVector vector, UtcPeriod period) {
        return new DtsRequest(MessageType.EVALUATE, period, vector, null, null);
    }

    public static DtsRequest percentiles(TsVector vector, UtcPeriod period, TimeAxis outputAxis,
            List<Integer> percentiles) {
        return new DtsRequest(MessageType.PERCENTILES, period, vector, outputAxis, percentiles);
    }

    public static DtsRequest close() {
        return new DtsRequest(MessageType.CLOSE, null, null, null, null);
    }
}
