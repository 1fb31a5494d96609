package com.hydrology.dtss.api;

import java.util.List;

import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.UtcPeriod;

/**
 * Binds symbolic time-series identifiers to concrete series.
 *
 * <p>
 * Implementations typically read from a store or another service and are
 * slow relative to evaluation. They are treated as non-reentrant: the server
 * never calls a resolver from two connections at the same time.
 *
 * <p>
 * Contract: the returned list has exactly one series per identifier, in the
 * same order as {@code ids}. Anything else fails the request with a
 * {@link ResolverMismatchException}.
 */
@FunctionalInterface
public interface TsResolver {

    /**
     * @param ids    distinct identifiers, in first-occurrence order
     * @param period the period the client asked to evaluate
     * @return one series per identifier, same order
     */
    List<PointSeries> resolve(List<String> ids, UtcPeriod period);
}
