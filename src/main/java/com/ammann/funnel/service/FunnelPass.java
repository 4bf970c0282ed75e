/* (C)2026 */
package com.ammann.funnel.service;

import com.ammann.funnel.model.ActorEvents;
import com.ammann.funnel.model.ActorFunnelProgress;
import java.util.ArrayList;
import java.util.List;

/**
 * Partial results of one work unit: the tallies requested for a computation, filled from a
 * batch of actors and merged with the other work units' passes afterwards.
 */
final class FunnelPass {

    final BreakdownTallies<FunnelAggregator.StepTally> steps;
    final BreakdownTallies<FunnelAggregator.ConversionTimeTally> timeToConvert;
    final BreakdownTallies<TrendBucketizer.TrendTally> trends;
    final CorrelationAnalyzer.CorrelationTally correlation;
    final List<ActorFunnelProgress> progresses;
    long actorsProcessed;

    FunnelPass(
            BreakdownTallies<FunnelAggregator.StepTally> steps,
            BreakdownTallies<FunnelAggregator.ConversionTimeTally> timeToConvert,
            BreakdownTallies<TrendBucketizer.TrendTally> trends,
            CorrelationAnalyzer.CorrelationTally correlation,
            boolean keepProgresses) {
        this.steps = steps;
        this.timeToConvert = timeToConvert;
        this.trends = trends;
        this.correlation = correlation;
        this.progresses = keepProgresses ? new ArrayList<>() : null;
    }

    void add(ActorFunnelProgress progress, ActorEvents actor) {
        actorsProcessed++;
        if (steps != null) {
            steps.add(progress);
        }
        if (timeToConvert != null) {
            timeToConvert.add(progress);
        }
        if (trends != null) {
            trends.add(progress);
        }
        if (correlation != null) {
            correlation.add(progress, actor);
        }
        if (progresses != null) {
            progresses.add(progress);
        }
    }

    void merge(FunnelPass other) {
        actorsProcessed += other.actorsProcessed;
        if (steps != null) {
            steps.merge(other.steps);
        }
        if (timeToConvert != null) {
            timeToConvert.merge(other.timeToConvert);
        }
        if (trends != null) {
            trends.merge(other.trends);
        }
        if (correlation != null) {
            correlation.merge(other.correlation);
        }
        if (progresses != null) {
            progresses.addAll(other.progresses);
        }
    }
}
