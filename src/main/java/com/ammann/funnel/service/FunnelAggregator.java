/* (C)2026 */
package com.ammann.funnel.service;

import com.ammann.funnel.dto.FunnelResultDTO;
import com.ammann.funnel.dto.FunnelStepDTO;
import com.ammann.funnel.dto.FunnelTimeToConvertResultDTO;
import com.ammann.funnel.dto.TimeToConvertBinDTO;
import com.ammann.funnel.enumeration.FunnelStepReference;
import com.ammann.funnel.model.ActorFunnelProgress;
import com.ammann.funnel.model.BreakdownValue;
import com.ammann.funnel.model.FunnelSpec;
import com.ammann.funnel.model.StepDefinition;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Reduces matched actors to step counts, time-to-convert histograms and actor selections.
 *
 * <p>Step {@code i} counts the non-excluded actors that reached at least {@code i + 1} steps,
 * so counts never increase along the funnel. Conversion rates are ratios and fall back to 0
 * when their denominator is 0.
 */
@ApplicationScoped
public class FunnelAggregator {

    private static final Logger LOG = Logger.getLogger(FunnelAggregator.class);

    static final int DEFAULT_MAX_BINS = 90;

    @ConfigProperty(name = "funnel.time-to-convert.max-bins", defaultValue = "90")
    int maxBins = DEFAULT_MAX_BINS;

    private final BreakdownResolver breakdownResolver;
    private final FunnelSpecValidator validator;

    @Inject
    public FunnelAggregator(BreakdownResolver breakdownResolver, FunnelSpecValidator validator) {
        this.breakdownResolver = breakdownResolver;
        this.validator = validator;
    }

    // ==================== Steps ====================

    /**
     * Computes step counts over all actors, ignoring any breakdown.
     *
     * @param progresses matched actors
     * @param spec       the funnel
     * @return step result without breakdown value
     */
    public FunnelResultDTO aggregate(List<ActorFunnelProgress> progresses, FunnelSpec spec) {
        StepTally tally = new StepTally(spec.stepCount());
        progresses.forEach(tally::add);
        return toStepResult(tally, spec, BreakdownValue.NONE);
    }

    /**
     * Computes step counts per resolved breakdown bucket.
     *
     * @param progresses matched actors carrying raw breakdown keys
     * @param spec       the funnel
     * @return one result per bucket in rank order ("other" last)
     */
    public List<FunnelResultDTO> aggregateByBreakdown(List<ActorFunnelProgress> progresses, FunnelSpec spec) {
        BreakdownTallies<StepTally> tallies = new BreakdownTallies<>(() -> new StepTally(spec.stepCount()));
        progresses.forEach(tallies::add);
        return stepResults(tallies, breakdownResolver.rank(tallies.actorCounts(), spec), spec);
    }

    List<FunnelResultDTO> stepResults(
            BreakdownTallies<StepTally> tallies, BreakdownRanking ranking, FunnelSpec spec) {
        List<FunnelResultDTO> results = new ArrayList<>();
        for (Map.Entry<BreakdownValue, StepTally> entry : tallies.fold(ranking).entrySet()) {
            results.add(toStepResult(entry.getValue(), spec, entry.getKey()));
        }
        return results;
    }

    FunnelResultDTO toStepResult(StepTally tally, FunnelSpec spec, BreakdownValue breakdownValue) {
        int stepCount = spec.stepCount();
        long first = tally.counts[0];
        List<FunnelStepDTO> steps = new ArrayList<>(stepCount);

        for (int i = 0; i < stepCount; i++) {
            StepDefinition step = spec.steps().get(i);
            long count = tally.counts[i];
            long previous = i == 0 ? first : tally.counts[i - 1];
            double fromBasis = ratio(count, first);
            double fromPrevious = ratio(count, previous);
            double rate = spec.stepReference() == FunnelStepReference.PREVIOUS ? fromPrevious : fromBasis;

            List<Long> durations = tally.durationsMillis.get(i);
            Double average = i == 0 || durations.isEmpty() ? null : averageSeconds(durations);
            Double median = i == 0 || durations.isEmpty() ? null : medianSeconds(durations);

            steps.add(new FunnelStepDTO(
                    i, step.name(), step.customName(), count, rate, fromBasis, fromPrevious,
                    average, median, step.math()));
        }

        LOG.debugf("Funnel steps%s: counts=%s",
                breakdownValue.isNone() ? "" : " [" + breakdownValue + "]", Arrays.toString(tally.counts));

        return new FunnelResultDTO(steps, labels(breakdownValue), first);
    }

    // ==================== Time to convert ====================

    /**
     * Builds the time-to-convert histogram over all actors, ignoring any breakdown.
     *
     * @param progresses matched actors
     * @param spec       the funnel; {@code fromStep()}/{@code toStep()} select the measured span
     * @return histogram result without breakdown value
     */
    public FunnelTimeToConvertResultDTO timeToConvert(List<ActorFunnelProgress> progresses, FunnelSpec spec) {
        ConversionTimeTally tally = new ConversionTimeTally(spec.fromStep(), spec.toStep());
        progresses.forEach(tally::add);
        return toTimeToConvertResult(tally, spec, BreakdownValue.NONE);
    }

    /**
     * Builds one time-to-convert histogram per resolved breakdown bucket.
     */
    public List<FunnelTimeToConvertResultDTO> timeToConvertByBreakdown(
            List<ActorFunnelProgress> progresses, FunnelSpec spec) {
        BreakdownTallies<ConversionTimeTally> tallies =
                new BreakdownTallies<>(() -> new ConversionTimeTally(spec.fromStep(), spec.toStep()));
        progresses.forEach(tallies::add);
        return timeToConvertResults(tallies, breakdownResolver.rank(tallies.actorCounts(), spec), spec);
    }

    List<FunnelTimeToConvertResultDTO> timeToConvertResults(
            BreakdownTallies<ConversionTimeTally> tallies, BreakdownRanking ranking, FunnelSpec spec) {
        List<FunnelTimeToConvertResultDTO> results = new ArrayList<>();
        for (Map.Entry<BreakdownValue, ConversionTimeTally> entry : tallies.fold(ranking).entrySet()) {
            results.add(toTimeToConvertResult(entry.getValue(), spec, entry.getKey()));
        }
        return results;
    }

    FunnelTimeToConvertResultDTO toTimeToConvertResult(
            ConversionTimeTally tally, FunnelSpec spec, BreakdownValue breakdownValue) {
        List<Long> durations = tally.durationsMillis;
        if (durations.isEmpty()) {
            return new FunnelTimeToConvertResultDTO(null, List.of(), labels(breakdownValue));
        }

        long[] seconds = durations.stream().mapToLong(ms -> ms / 1000).toArray();
        long min = Arrays.stream(seconds).min().orElse(0);
        long max = Arrays.stream(seconds).max().orElse(0);

        int binCount = spec.binCount() != null ? spec.binCount() : autoBinCount(seconds.length);
        long width = Math.max(1L, (long) Math.ceil((max - min) / (double) binCount));

        long[] counts = new long[binCount + 1];
        for (long value : seconds) {
            int index = (int) Math.min((value - min) / width, binCount);
            counts[index]++;
        }

        List<TimeToConvertBinDTO> bins = new ArrayList<>(binCount + 1);
        for (int i = 0; i <= binCount; i++) {
            bins.add(new TimeToConvertBinDTO(min + i * width, counts[i]));
        }

        LOG.debugf("Time to convert: %d conversions, %d bins of %ds starting at %ds",
                seconds.length, binCount, width, min);

        return new FunnelTimeToConvertResultDTO(averageSeconds(durations), bins, labels(breakdownValue));
    }

    /**
     * Automatic bin count: cube root of the sample size, clamped to [1, max-bins].
     */
    int autoBinCount(int sampleSize) {
        int cap = maxBins > 0 ? maxBins : DEFAULT_MAX_BINS;
        int bins = (int) Math.ceil(Math.cbrt(sampleSize));
        return Math.max(1, Math.min(bins, cap));
    }

    // ==================== Actor selection ====================

    /**
     * Selects actors by funnel step.
     *
     * <p>A positive {@code funnelStep} k selects actors that reached at least step k (one-based);
     * a negative one selects actors that dropped off at step |k|, i.e. reached exactly |k| - 1
     * steps. Excluded actors are never selected.
     *
     * @param progresses     matched actors carrying raw breakdown keys
     * @param spec           the funnel
     * @param funnelStep     signed one-based step, never 0
     * @param breakdownValue optional resolved bucket restricting the selection
     * @param limit          optional cap on the number of ids
     * @return sorted actor ids
     */
    public List<String> selectActors(
            List<ActorFunnelProgress> progresses,
            FunnelSpec spec,
            int funnelStep,
            BreakdownValue breakdownValue,
            Integer limit) {
        validator.validateFunnelStep(spec, funnelStep);

        List<ActorFunnelProgress> candidates = progresses;
        if (breakdownValue != null && spec.hasBreakdown()) {
            candidates = breakdownResolver.resolveBreakdowns(progresses, spec)
                    .getOrDefault(breakdownValue, List.of());
        }

        int step = Math.abs(funnelStep);
        List<String> ids = new ArrayList<>();
        for (ActorFunnelProgress progress : candidates) {
            if (progress.excluded()) {
                continue;
            }
            boolean selected = funnelStep > 0
                    ? progress.furthestStep() >= step
                    : progress.furthestStep() == step - 1 && step > 1;
            if (selected) {
                ids.add(progress.actorId());
            }
        }
        Collections.sort(ids);
        if (limit != null && limit >= 0 && ids.size() > limit) {
            ids = new ArrayList<>(ids.subList(0, limit));
        }

        LOG.debugf("Selected %d actors for funnel step %d", ids.size(), funnelStep);
        return ids;
    }

    // ==================== Helpers ====================

    static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }

    static Double averageSeconds(List<Long> millis) {
        return millis.stream().mapToLong(Long::longValue).average().orElse(0.0) / 1000.0;
    }

    static Double medianSeconds(List<Long> millis) {
        List<Long> sorted = new ArrayList<>(millis);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        double median = sorted.size() % 2 == 1
                ? sorted.get(mid)
                : (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
        return median / 1000.0;
    }

    static List<String> labels(BreakdownValue value) {
        return value.isNone() ? null : value.values();
    }

    /**
     * Per-step reach counts and step-to-step durations.
     */
    public static final class StepTally implements Tally<StepTally> {
        final long[] counts;
        final List<List<Long>> durationsMillis;

        StepTally(int stepCount) {
            this.counts = new long[stepCount];
            this.durationsMillis = new ArrayList<>(stepCount);
            for (int i = 0; i < stepCount; i++) {
                durationsMillis.add(new ArrayList<>());
            }
        }

        @Override
        public void add(ActorFunnelProgress progress) {
            if (progress.excluded()) {
                return;
            }
            int reached = Math.min(progress.furthestStep(), counts.length);
            for (int i = 0; i < reached; i++) {
                counts[i]++;
                if (i > 0) {
                    List<Long> stepDurations = durationsMillis.get(i);
                    progress.durationBetween(i - 1, i).ifPresent(d -> stepDurations.add(d.toMillis()));
                }
            }
        }

        @Override
        public void merge(StepTally other) {
            for (int i = 0; i < counts.length; i++) {
                counts[i] += other.counts[i];
                durationsMillis.get(i).addAll(other.durationsMillis.get(i));
            }
        }
    }

    /**
     * Conversion durations between the measured steps of converted actors.
     */
    public static final class ConversionTimeTally implements Tally<ConversionTimeTally> {
        private final int fromStep;
        private final int toStep;
        final List<Long> durationsMillis = new ArrayList<>();

        ConversionTimeTally(int fromStep, int toStep) {
            this.fromStep = fromStep;
            this.toStep = toStep;
        }

        @Override
        public void add(ActorFunnelProgress progress) {
            if (!progress.reached(toStep + 1)) {
                return;
            }
            progress.durationBetween(fromStep, toStep)
                    .ifPresent(d -> durationsMillis.add(d.toMillis()));
        }

        @Override
        public void merge(ConversionTimeTally other) {
            durationsMillis.addAll(other.durationsMillis);
        }
    }
}
