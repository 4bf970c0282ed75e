/* (C)2026 */
package com.ammann.funnel.model;

import com.ammann.funnel.enumeration.FunnelStepReference;
import com.ammann.funnel.enumeration.OrderMode;
import com.ammann.funnel.enumeration.TrendInterval;
import com.ammann.funnel.enumeration.VizType;
import java.util.ArrayList;
import java.util.List;

/**
 * Declarative funnel definition.
 *
 * <p>Shared read-only by every worker during a computation. Use {@link #builder()} to create
 * instances; unset options fall back to ORDERED matching, a 14 day window referenced from the
 * first step, STEPS visualisation and DAY trend interval.
 *
 * @param steps           ordered funnel steps (at least two)
 * @param orderMode       step ordering discipline
 * @param window          conversion window
 * @param windowReference whether the window is measured from the first or the previous step
 * @param stepReference   whether conversion rates are relative to the first or previous step
 * @param exclusions      exclusion rules
 * @param breakdown       optional breakdown
 * @param dateRange       query date range
 * @param vizType         requested result shape
 * @param interval        trend period granularity
 * @param funnelFromStep  zero-based step conversion is measured from (trends, time to convert)
 * @param funnelToStep    zero-based step conversion is measured to (trends, time to convert)
 * @param binCount        time-to-convert bin count, null for automatic
 */
public record FunnelSpec(
        List<StepDefinition> steps,
        OrderMode orderMode,
        ConversionWindow window,
        FunnelStepReference windowReference,
        FunnelStepReference stepReference,
        List<ExclusionRule> exclusions,
        BreakdownSpec breakdown,
        DateRange dateRange,
        VizType vizType,
        TrendInterval interval,
        Integer funnelFromStep,
        Integer funnelToStep,
        Integer binCount) {

    public FunnelSpec {
        steps = steps == null ? List.of() : List.copyOf(steps);
        exclusions = exclusions == null ? List.of() : List.copyOf(exclusions);
        orderMode = orderMode == null ? OrderMode.ORDERED : orderMode;
        window = window == null ? ConversionWindow.DEFAULT : window;
        windowReference = windowReference == null ? FunnelStepReference.TOTAL : windowReference;
        stepReference = stepReference == null ? FunnelStepReference.TOTAL : stepReference;
        vizType = vizType == null ? VizType.STEPS : vizType;
        interval = interval == null ? TrendInterval.DAY : interval;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int stepCount() {
        return steps.size();
    }

    public boolean hasBreakdown() {
        return breakdown != null && !breakdown.dimensions().isEmpty();
    }

    /**
     * Zero-based step conversion is measured from, defaulting to the first step.
     */
    public int fromStep() {
        return funnelFromStep != null ? funnelFromStep : 0;
    }

    /**
     * Zero-based step conversion is measured to, defaulting to the last step.
     */
    public int toStep() {
        return funnelToStep != null ? funnelToStep : steps.size() - 1;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.steps.addAll(steps);
        builder.exclusions.addAll(exclusions);
        builder.orderMode = orderMode;
        builder.window = window;
        builder.windowReference = windowReference;
        builder.stepReference = stepReference;
        builder.breakdown = breakdown;
        builder.dateRange = dateRange;
        builder.vizType = vizType;
        builder.interval = interval;
        builder.funnelFromStep = funnelFromStep;
        builder.funnelToStep = funnelToStep;
        builder.binCount = binCount;
        return builder;
    }

    /**
     * Fluent builder for {@link FunnelSpec}.
     */
    public static final class Builder {
        private final List<StepDefinition> steps = new ArrayList<>();
        private final List<ExclusionRule> exclusions = new ArrayList<>();
        private OrderMode orderMode;
        private ConversionWindow window;
        private FunnelStepReference windowReference;
        private FunnelStepReference stepReference;
        private BreakdownSpec breakdown;
        private DateRange dateRange;
        private VizType vizType;
        private TrendInterval interval;
        private Integer funnelFromStep;
        private Integer funnelToStep;
        private Integer binCount;

        private Builder() {}

        /**
         * Appends plain event-name steps in order.
         */
        public Builder events(String... eventNames) {
            for (String name : eventNames) {
                steps.add(StepDefinition.of(steps.size(), name));
            }
            return this;
        }

        public Builder step(EventMatcher matcher, PropertyFilterExpr filter) {
            steps.add(StepDefinition.of(steps.size(), matcher, filter));
            return this;
        }

        public Builder step(StepDefinition step) {
            steps.add(step);
            return this;
        }

        public Builder orderMode(OrderMode value) {
            this.orderMode = value;
            return this;
        }

        public Builder window(ConversionWindow value) {
            this.window = value;
            return this;
        }

        public Builder windowReference(FunnelStepReference value) {
            this.windowReference = value;
            return this;
        }

        public Builder stepReference(FunnelStepReference value) {
            this.stepReference = value;
            return this;
        }

        public Builder exclusion(ExclusionRule rule) {
            exclusions.add(rule);
            return this;
        }

        public Builder breakdown(BreakdownSpec value) {
            this.breakdown = value;
            return this;
        }

        public Builder dateRange(DateRange value) {
            this.dateRange = value;
            return this;
        }

        public Builder vizType(VizType value) {
            this.vizType = value;
            return this;
        }

        public Builder interval(TrendInterval value) {
            this.interval = value;
            return this;
        }

        public Builder funnelFromStep(Integer value) {
            this.funnelFromStep = value;
            return this;
        }

        public Builder funnelToStep(Integer value) {
            this.funnelToStep = value;
            return this;
        }

        public Builder binCount(Integer value) {
            this.binCount = value;
            return this;
        }

        public FunnelSpec build() {
            return new FunnelSpec(
                    steps, orderMode, window, windowReference, stepReference, exclusions,
                    breakdown, dateRange, vizType, interval, funnelFromStep, funnelToStep, binCount);
        }
    }
}
