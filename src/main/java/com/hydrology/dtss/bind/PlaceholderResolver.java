package com.hydrology.dtss.bind;

import java.util.ArrayList;
import java.util.List;

import com.hydrology.dtss.api.TsResolver;
import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.TimeAxis;
import com.hydrology.dtss.time.UtcPeriod;

/**
 * TEST AND DEMONSTRATION ONLY. Answers every request with synthetic data:
 * identifier {@code i} becomes an hourly series over the period with the
 * constant value {@code i}.
 *
 * <p>
 * A server only uses this when placeholder resolution is switched on
 * explicitly; it is never an implicit fallback.
 */
public final class PlaceholderResolver implements TsResolver {
    public static final long STEP = 3600;

    @Override
    public List<PointSeries> resolve(List<String> ids, UtcPeriod period) {
        TimeAxis axis = TimeAxis.covering(period, STEP);
        List<PointSeries> r = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++)
            r.add(PointSeries.constant(axis, i, PointInterpretation.POINT_AVERAGE_VALUE));
        return r;
    }
}
