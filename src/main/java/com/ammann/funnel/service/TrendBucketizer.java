/* (C)2026 */
package com.ammann.funnel.service;

import com.ammann.funnel.dto.FunnelTrendsResultDTO;
import com.ammann.funnel.enumeration.TrendInterval;
import com.ammann.funnel.model.ActorFunnelProgress;
import com.ammann.funnel.model.BreakdownValue;
import com.ammann.funnel.model.DateRange;
import com.ammann.funnel.model.FunnelSpec;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.jboss.logging.Logger;

/**
 * Groups actors into calendar periods by the time they entered the funnel.
 *
 * <p>An actor's entry period is the period containing its first step. Every period of the
 * date range is reported, empty ones with zero counts. Within a period an actor has
 * <em>started</em> once it reached the conversion start step and <em>ended</em> once it
 * reached the conversion end step ({@link FunnelSpec#fromStep()} / {@link FunnelSpec#toStep()},
 * first and last step by default). Excluded actors neither start nor end.
 */
@ApplicationScoped
public class TrendBucketizer {

    private static final Logger LOG = Logger.getLogger(TrendBucketizer.class);

    /** Time source deciding whether a period's conversion window has fully elapsed. */
    Clock clock = Clock.systemUTC();

    private final BreakdownResolver breakdownResolver;

    @Inject
    public TrendBucketizer(BreakdownResolver breakdownResolver) {
        this.breakdownResolver = breakdownResolver;
    }

    /**
     * Buckets actors into trend periods, ignoring any breakdown.
     *
     * @param progresses matched actors
     * @param spec       the funnel
     * @param interval   period granularity
     * @param dateRange  reported range; periods are generated from its start to its end inclusive
     * @param limit      optional cap on the reported actor ids per period
     * @return one entry per period in ascending order
     */
    public List<FunnelTrendsResultDTO> bucketize(
            List<ActorFunnelProgress> progresses,
            FunnelSpec spec,
            TrendInterval interval,
            DateRange dateRange,
            Integer limit) {
        ZoneId zone = zoneOf(dateRange);
        TrendTally tally = new TrendTally(spec.fromStep(), spec.toStep(), interval, zone);
        progresses.forEach(tally::add);
        return toTrendResults(tally, spec, interval, dateRange, limit, BreakdownValue.NONE);
    }

    /**
     * Buckets actors per resolved breakdown bucket; periods of each bucket are contiguous.
     */
    public List<FunnelTrendsResultDTO> bucketizeByBreakdown(
            List<ActorFunnelProgress> progresses,
            FunnelSpec spec,
            TrendInterval interval,
            DateRange dateRange,
            Integer limit) {
        BreakdownTallies<TrendTally> tallies = newTallies(spec, interval, dateRange);
        progresses.forEach(tallies::add);
        return trendResults(
                tallies, breakdownResolver.rank(tallies.actorCounts(), spec), spec, interval, dateRange, limit);
    }

    BreakdownTallies<TrendTally> newTallies(FunnelSpec spec, TrendInterval interval, DateRange dateRange) {
        ZoneId zone = zoneOf(dateRange);
        return new BreakdownTallies<>(() -> new TrendTally(spec.fromStep(), spec.toStep(), interval, zone));
    }

    List<FunnelTrendsResultDTO> trendResults(
            BreakdownTallies<TrendTally> tallies,
            BreakdownRanking ranking,
            FunnelSpec spec,
            TrendInterval interval,
            DateRange dateRange,
            Integer limit) {
        List<FunnelTrendsResultDTO> results = new ArrayList<>();
        tallies.fold(ranking).forEach((bucket, tally) ->
                results.addAll(toTrendResults(tally, spec, interval, dateRange, limit, bucket)));
        return results;
    }

    List<FunnelTrendsResultDTO> toTrendResults(
            TrendTally tally,
            FunnelSpec spec,
            TrendInterval interval,
            DateRange dateRange,
            Integer limit,
            BreakdownValue breakdownValue) {
        ZoneId zone = zoneOf(dateRange);
        List<Instant> periods = periods(tally, interval, dateRange, zone);
        Duration window = spec.window().asDuration();
        Instant now = clock.instant();
        List<String> labels = breakdownValue.isNone() ? null : breakdownValue.values();

        List<FunnelTrendsResultDTO> results = new ArrayList<>(periods.size());
        for (Instant period : periods) {
            PeriodCounts counts = tally.periods.getOrDefault(period, PeriodCounts.EMPTY);
            long started = counts.started.size();
            long ended = counts.ended.size();
            double percentEnded = FunnelAggregator.ratio(ended, started);
            double conversionRate = BigDecimal.valueOf(percentEnded * 100.0)
                    .setScale(2, RoundingMode.HALF_UP)
                    .doubleValue();
            boolean periodFinal = !interval.next(period, zone).plus(window).isAfter(now);

            results.add(new FunnelTrendsResultDTO(
                    period, started, ended, percentEnded, conversionRate,
                    capped(counts.started, limit), capped(counts.ended, limit),
                    periodFinal, labels));
        }

        LOG.debugf("Trends: %d %s periods, %d periods with entries",
                Integer.valueOf(results.size()), interval, Integer.valueOf(tally.periods.size()));
        return results;
    }

    /**
     * Period starts from the start of the range to its end, inclusive. Without bounds the
     * observed entry periods delimit the range.
     */
    List<Instant> periods(TrendTally tally, TrendInterval interval, DateRange dateRange, ZoneId zone) {
        Instant from = dateRange != null && dateRange.dateFrom() != null
                ? interval.truncate(dateRange.dateFrom(), zone)
                : tally.periods.keySet().stream().min(Instant::compareTo).orElse(null);
        Instant to = dateRange != null && dateRange.dateTo() != null
                ? interval.truncate(dateRange.dateTo(), zone)
                : tally.periods.keySet().stream().max(Instant::compareTo).orElse(null);

        List<Instant> periods = new ArrayList<>();
        if (from == null || to == null) {
            return periods;
        }
        for (Instant period = from; !period.isAfter(to); period = interval.next(period, zone)) {
            periods.add(period);
        }
        return periods;
    }

    private static List<String> capped(TreeSet<String> ids, Integer limit) {
        List<String> list = new ArrayList<>(ids);
        if (limit != null && limit >= 0 && list.size() > limit) {
            return List.copyOf(list.subList(0, limit));
        }
        return list;
    }

    private static ZoneId zoneOf(DateRange dateRange) {
        return dateRange != null ? dateRange.zone() : ZoneOffset.UTC;
    }

    /**
     * Started and ended actor ids per entry period.
     */
    public static final class TrendTally implements Tally<TrendTally> {
        private final int fromStep;
        private final int toStep;
        private final TrendInterval interval;
        private final ZoneId zone;
        final Map<Instant, PeriodCounts> periods = new HashMap<>();

        TrendTally(int fromStep, int toStep, TrendInterval interval, ZoneId zone) {
            this.fromStep = fromStep;
            this.toStep = toStep;
            this.interval = interval;
            this.zone = zone;
        }

        @Override
        public void add(ActorFunnelProgress progress) {
            if (progress.excluded() || progress.furthestStep() <= fromStep) {
                return;
            }
            Instant entry = progress.stepTime(0).orElse(null);
            if (entry == null) {
                return;
            }
            PeriodCounts counts = periods.computeIfAbsent(interval.truncate(entry, zone), p -> new PeriodCounts());
            counts.started.add(progress.actorId());
            if (progress.furthestStep() > toStep) {
                counts.ended.add(progress.actorId());
            }
        }

        @Override
        public void merge(TrendTally other) {
            other.periods.forEach((period, counts) -> {
                PeriodCounts target = periods.computeIfAbsent(period, p -> new PeriodCounts());
                target.started.addAll(counts.started);
                target.ended.addAll(counts.ended);
            });
        }
    }

    static final class PeriodCounts {
        static final PeriodCounts EMPTY = new PeriodCounts();

        final TreeSet<String> started = new TreeSet<>();
        final TreeSet<String> ended = new TreeSet<>();
    }
}
