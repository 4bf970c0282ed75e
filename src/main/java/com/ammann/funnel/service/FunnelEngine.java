/* (C)2026 */
package com.ammann.funnel.service;

import com.ammann.funnel.dto.FunnelAnalysisDTO;
import com.ammann.funnel.dto.FunnelCorrelationResultDTO;
import com.ammann.funnel.dto.FunnelResultDTO;
import com.ammann.funnel.dto.FunnelTimeToConvertResultDTO;
import com.ammann.funnel.dto.FunnelTrendsResultDTO;
import com.ammann.funnel.enumeration.CorrelationType;
import com.ammann.funnel.enumeration.OrderMode;
import com.ammann.funnel.exception.ComputationException;
import com.ammann.funnel.exception.FunnelException;
import com.ammann.funnel.model.ActorEvents;
import com.ammann.funnel.model.BreakdownValue;
import com.ammann.funnel.model.CorrelationSpec;
import com.ammann.funnel.model.FunnelSpec;
import com.ammann.funnel.source.EventSource;
import com.ammann.funnel.source.EventSourceQuery;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Entry point of the funnel engine.
 *
 * <p>Each computation validates the funnel, pulls the actors from the given {@link EventSource}
 * once, matches them in batches (in parallel on the {@code funnel-executor} unless disabled),
 * merges the per-batch tallies and turns them into result DTOs. With a breakdown configured,
 * results are reported per ranked bucket and all result kinds of one computation share the same
 * ranking.
 */
@ApplicationScoped
public class FunnelEngine {

    private static final Logger LOG = Logger.getLogger(FunnelEngine.class);

    static final int DEFAULT_BATCH_SIZE = 500;

    @ConfigProperty(name = "funnel.engine.batch-size", defaultValue = "500")
    int batchSize = DEFAULT_BATCH_SIZE;

    @ConfigProperty(name = "funnel.engine.parallel", defaultValue = "true")
    boolean parallel = true;

    @Inject MeterRegistry meterRegistry;

    private final FunnelSpecValidator validator;
    private final StepMatcher stepMatcher;
    private final FunnelAggregator aggregator;
    private final TrendBucketizer trendBucketizer;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final BreakdownResolver breakdownResolver;
    private final ExecutorService executor;

    @Inject
    public FunnelEngine(
            FunnelSpecValidator validator,
            StepMatcher stepMatcher,
            FunnelAggregator aggregator,
            TrendBucketizer trendBucketizer,
            CorrelationAnalyzer correlationAnalyzer,
            BreakdownResolver breakdownResolver,
            @Named("funnel-executor") ExecutorService executor) {
        this.validator = validator;
        this.stepMatcher = stepMatcher;
        this.aggregator = aggregator;
        this.trendBucketizer = trendBucketizer;
        this.correlationAnalyzer = correlationAnalyzer;
        this.breakdownResolver = breakdownResolver;
        this.executor = executor;
    }

    /**
     * Computes step conversion counts.
     *
     * @param source event source
     * @param spec   the funnel
     * @return one result, or one per breakdown bucket
     */
    public List<FunnelResultDTO> computeSteps(EventSource source, FunnelSpec spec) {
        return analyze(source, spec, EnumSet.of(ResultKind.STEPS), null, null).steps();
    }

    /**
     * Computes trend cohorts over the funnel's date range and interval.
     */
    public List<FunnelTrendsResultDTO> computeTrends(EventSource source, FunnelSpec spec) {
        return computeTrends(source, spec, null);
    }

    /**
     * Computes trend cohorts, capping the reported actor ids of each period.
     *
     * @param source      event source
     * @param spec        the funnel
     * @param personLimit optional cap on actor ids per period
     * @return trend periods, grouped by breakdown bucket
     */
    public List<FunnelTrendsResultDTO> computeTrends(EventSource source, FunnelSpec spec, Integer personLimit) {
        return analyze(source, spec, EnumSet.of(ResultKind.TRENDS), null, personLimit).trends();
    }

    /**
     * Computes the time-to-convert histogram between the funnel's conversion steps.
     */
    public List<FunnelTimeToConvertResultDTO> computeTimeToConvert(EventSource source, FunnelSpec spec) {
        return analyze(source, spec, EnumSet.of(ResultKind.TIME_TO_CONVERT), null, null).timeToConvert();
    }

    /**
     * Correlates candidate events or properties with conversion.
     */
    public FunnelCorrelationResultDTO computeCorrelation(
            EventSource source, FunnelSpec spec, CorrelationSpec correlation) {
        return analyze(source, spec, EnumSet.of(ResultKind.CORRELATION), correlation, null).correlation();
    }

    /**
     * Produces every result kind from a single pass over the event source.
     *
     * @param source      event source
     * @param spec        the funnel
     * @param correlation optional correlation configuration, null to skip correlation
     * @return combined analysis
     */
    public FunnelAnalysisDTO analyze(EventSource source, FunnelSpec spec, CorrelationSpec correlation) {
        Set<ResultKind> requested = EnumSet.of(ResultKind.STEPS, ResultKind.TRENDS, ResultKind.TIME_TO_CONVERT);
        if (correlation != null) {
            requested.add(ResultKind.CORRELATION);
        }
        return analyze(source, spec, requested, correlation, null);
    }

    /**
     * Selects the actors reaching (positive step) or dropping off at (negative step) a funnel step.
     *
     * @param source         event source
     * @param spec           the funnel
     * @param funnelStep     signed one-based step
     * @param breakdownValue optional resolved breakdown bucket
     * @param limit          optional cap on returned ids
     * @return sorted actor ids
     */
    public List<String> selectActors(
            EventSource source, FunnelSpec spec, int funnelStep, BreakdownValue breakdownValue, Integer limit) {
        validator.validate(spec);
        validator.validateFunnelStep(spec, funnelStep);
        FunnelPass pass = run(source, spec, EnumSet.of(ResultKind.SELECTION), null, "actors");
        return aggregator.selectActors(pass.progresses, spec, funnelStep, breakdownValue, limit);
    }

    private FunnelAnalysisDTO analyze(
            EventSource source,
            FunnelSpec spec,
            Set<ResultKind> requested,
            CorrelationSpec correlation,
            Integer personLimit) {
        validator.validate(spec);
        String viz = describe(requested);
        long start = System.nanoTime();

        FunnelPass pass = run(source, spec, requested, correlation, viz);

        BreakdownRanking ranking = BreakdownRanking.NONE;
        if (spec.hasBreakdown()) {
            BreakdownTallies<?> counted = pass.steps != null ? pass.steps
                    : pass.trends != null ? pass.trends : pass.timeToConvert;
            if (counted != null) {
                ranking = breakdownResolver.rank(counted.actorCounts(), spec);
            }
        }

        List<FunnelResultDTO> steps = pass.steps == null ? null
                : aggregator.stepResults(pass.steps, ranking, spec);
        List<FunnelTrendsResultDTO> trends = pass.trends == null ? null
                : trendBucketizer.trendResults(
                        pass.trends, ranking, spec, spec.interval(), spec.dateRange(), personLimit);
        List<FunnelTimeToConvertResultDTO> timeToConvert = pass.timeToConvert == null ? null
                : aggregator.timeToConvertResults(pass.timeToConvert, ranking, spec);
        FunnelCorrelationResultDTO correlationResult = pass.correlation == null ? null
                : correlationAnalyzer.finish(pass.correlation);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        recordMetrics(viz, pass.actorsProcessed, elapsed);
        LOG.infof("Funnel computation [%s]: %d actors, %d steps, mode=%s, %d ms",
                viz, pass.actorsProcessed, spec.stepCount(), spec.orderMode(), elapsed.toMillis());

        return new FunnelAnalysisDTO(steps, trends, timeToConvert, correlationResult, pass.actorsProcessed);
    }

    /**
     * Pulls the actors from the source and fills the requested tallies, batch by batch.
     */
    FunnelPass run(
            EventSource source, FunnelSpec spec, Set<ResultKind> requested, CorrelationSpec correlation, String viz) {
        boolean everyEvent = spec.orderMode() == OrderMode.STRICT
                || (correlation != null && correlation.type() != CorrelationType.PROPERTIES);
        EventSourceQuery query = EventSourceQuery.forSpec(spec, everyEvent);
        int size = batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;

        FunnelPass result = newPass(spec, requested, correlation);
        List<Future<FunnelPass>> futures = new ArrayList<>();

        try (Stream<ActorEvents> actors = source.stream(query)) {
            Iterator<ActorEvents> iterator = actors.iterator();
            List<ActorEvents> batch = new ArrayList<>(size);
            while (iterator.hasNext()) {
                batch.add(iterator.next());
                if (batch.size() == size) {
                    dispatch(batch, spec, requested, correlation, result, futures);
                    batch = new ArrayList<>(size);
                }
            }
            if (!batch.isEmpty()) {
                dispatch(batch, spec, requested, correlation, result, futures);
            }

            for (Future<FunnelPass> future : futures) {
                result.merge(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new ComputationException("Funnel computation [" + viz + "] was interrupted", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof FunnelException funnelException) {
                throw funnelException;
            }
            throw new ComputationException("Funnel work unit failed: " + e.getCause().getMessage(), e.getCause());
        } catch (RuntimeException e) {
            // inline work units and the source itself fail here, after earlier units were submitted
            futures.forEach(f -> f.cancel(true));
            throw e;
        }

        LOG.debugf("Funnel pass [%s]: %d actors in %d parallel work units",
                viz, result.actorsProcessed, futures.size());
        return result;
    }

    private void dispatch(
            List<ActorEvents> batch,
            FunnelSpec spec,
            Set<ResultKind> requested,
            CorrelationSpec correlation,
            FunnelPass result,
            List<Future<FunnelPass>> futures) {
        if (!parallel || executor == null) {
            result.merge(process(batch, spec, requested, correlation));
            return;
        }
        try {
            futures.add(executor.submit(() -> process(batch, spec, requested, correlation)));
        } catch (RejectedExecutionException e) {
            LOG.warnf("funnel-executor rejected a work unit of %d actors, processing it inline", batch.size());
            result.merge(process(batch, spec, requested, correlation));
        }
    }

    private FunnelPass process(
            List<ActorEvents> batch, FunnelSpec spec, Set<ResultKind> requested, CorrelationSpec correlation) {
        FunnelPass pass = newPass(spec, requested, correlation);
        for (ActorEvents actor : batch) {
            pass.add(stepMatcher.matchActor(actor, spec), actor);
        }
        return pass;
    }

    private FunnelPass newPass(FunnelSpec spec, Set<ResultKind> requested, CorrelationSpec correlation) {
        return new FunnelPass(
                requested.contains(ResultKind.STEPS)
                        ? new BreakdownTallies<>(() -> new FunnelAggregator.StepTally(spec.stepCount()))
                        : null,
                requested.contains(ResultKind.TIME_TO_CONVERT)
                        ? new BreakdownTallies<>(() ->
                                new FunnelAggregator.ConversionTimeTally(spec.fromStep(), spec.toStep()))
                        : null,
                requested.contains(ResultKind.TRENDS)
                        ? trendBucketizer.newTallies(spec, spec.interval(), spec.dateRange())
                        : null,
                requested.contains(ResultKind.CORRELATION) && correlation != null
                        ? correlationAnalyzer.newTally(spec, correlation)
                        : null,
                requested.contains(ResultKind.SELECTION));
    }

    private void recordMetrics(String viz, long actors, Duration elapsed) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("funnel_computations_total")
                .description("Total funnel computations")
                .tag("viz", viz)
                .register(meterRegistry)
                .increment();
        Counter.builder("funnel_actors_processed_total")
                .description("Total actors matched against funnels")
                .register(meterRegistry)
                .increment(actors);
        Timer.builder("funnel_computation_seconds")
                .description("Funnel computation duration")
                .tag("viz", viz)
                .register(meterRegistry)
                .record(elapsed);
    }

    private static String describe(Set<ResultKind> requested) {
        Set<ResultKind> results = EnumSet.copyOf(requested);
        results.remove(ResultKind.CORRELATION);
        if (results.size() > 1) {
            return "analysis";
        }
        if (results.isEmpty()) {
            return "correlation";
        }
        return results.iterator().next().name().toLowerCase(Locale.ROOT);
    }

    /**
     * Result kinds a single pass can fill.
     */
    enum ResultKind {
        STEPS,
        TRENDS,
        TIME_TO_CONVERT,
        CORRELATION,
        SELECTION
    }
}
