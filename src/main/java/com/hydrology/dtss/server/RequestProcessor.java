package com.hydrology.dtss.server;

import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.hydrology.dtss.api.DtsException;
import com.hydrology.dtss.api.ErrorKind;
import com.hydrology.dtss.api.TsResolver;
import com.hydrology.dtss.bind.ExclusiveResolver;
import com.hydrology.dtss.bind.ExpressionBinder;
import com.hydrology.dtss.eval.PercentileCalculator;
import com.hydrology.dtss.eval.TsEvaluator;
import com.hydrology.dtss.expr.TsVector;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.util.ExpressionExplain;
import com.hydrology.dtss.wire.DtsRequest;
import com.hydrology.dtss.wire.DtsResponse;
import com.hydrology.dtss.wire.MessageType;

/**
 * Runs the bind and evaluate pipeline for one request.
 *
 * <p>
 * The resolver is wrapped in an {@link ExclusiveResolver}, so only the
 * resolver call itself is serialized across connections. Every failure is
 * turned into an ERROR response; nothing escapes to the connection handler.
 */
public final class RequestProcessor {
    private static final Logger log = LogManager.getLogger(RequestProcessor.class);
    private static final int EXPLAIN_MAX_NODES = 200;

    private final TsResolver resolver;

    /** @param resolver may be null */
    public RequestProcessor(TsResolver resolver) {
        this.resolver = resolver == null || resolver instanceof ExclusiveResolver ? resolver
                : new ExclusiveResolver(resolver);
    }

    /**
     * What happened while serving a request, for the journal.
     * {@code identifiersResolved} counts the identifiers handed to the
     * resolver, whether or not the call then succeeded.
     */
    public record Outcome(DtsResponse response, int identifiersResolved) {
        public int seriesReturned() {
            return response.isOk() ? response.vector().size() : 0;
        }
    }

    public Outcome process(DtsRequest request) {
        return process(request, s -> {
        });
    }

    /**
     * @param onState notified when the request enters RESOLVING and
     *                EVALUATING
     */
    public Outcome process(DtsRequest request, Consumer<ConnectionState> onState) {
        int resolved = 0;
        try {
            if (request.type() == MessageType.CLOSE)
                return new Outcome(DtsResponse.ok(TsVector.empty()), 0);
            if (request.type() == MessageType.PERCENTILES)
                PercentileCalculator.validate(request.percentiles());

            onState.accept(ConnectionState.RESOLVING);
            Set<String> ids = ExpressionBinder.unboundIdentifiers(request.vector());
            if (!ids.isEmpty() && resolver != null)
                resolved = ids.size();
            TsVector bound = ExpressionBinder.bind(request.vector(), ids, request.period(), resolver);

            onState.accept(ConnectionState.EVALUATING);
            List<PointSeries> series = new TsEvaluator().evaluate(bound, request.period());
            if (request.type() == MessageType.PERCENTILES)
                series = PercentileCalculator.compute(series, request.outputAxis(), request.percentiles());
            return new Outcome(DtsResponse.ok(TsVector.ofSeries(series)), resolved);
        } catch (DtsException e) {
            log.warn("{} request failed [{}]: {}", request.type(), e.kind(), e.getMessage());
            explainFailed(request);
            return new Outcome(DtsResponse.error(e.kind(), e.getMessage()), resolved);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("{} request rejected: {}", request.type(), e.getMessage());
            explainFailed(request);
            return new Outcome(DtsResponse.error(ErrorKind.EVALUATION, e.getMessage()), resolved);
        } catch (RuntimeException e) {
            log.error("{} request failed unexpectedly", request.type(), e);
            explainFailed(request);
            return new Outcome(DtsResponse.error(ErrorKind.INTERNAL, String.valueOf(e)), resolved);
        }
    }

    private static void explainFailed(DtsRequest request) {
        if (log.isDebugEnabled() && request.vector() != null)
            log.debug("Failed {} request over {}:\n{}", request.type(), request.period(),
                    ExpressionExplain.explain(request.vector(), EXPLAIN_MAX_NODES));
    }
}
