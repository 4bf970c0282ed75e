/* (C)2026 */
package com.ammann.funnel.service;

import com.ammann.funnel.enumeration.BreakdownAttribution;
import com.ammann.funnel.exception.ValidationException;
import com.ammann.funnel.model.BreakdownSpec;
import com.ammann.funnel.model.DateRange;
import com.ammann.funnel.model.ExclusionRule;
import com.ammann.funnel.model.FunnelSpec;
import com.ammann.funnel.model.StepDefinition;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Rejects malformed funnel definitions before any computation starts.
 *
 * <p>Nothing is ever corrected silently: every violated constraint raises a
 * {@link ValidationException} naming the offending parameter.
 */
@ApplicationScoped
public class FunnelSpecValidator {

    private static final Logger LOG = Logger.getLogger(FunnelSpecValidator.class);

    static final int MIN_STEPS = 2;

    /**
     * Validates a funnel definition.
     *
     * @param spec the funnel to check
     * @throws ValidationException on the first violated constraint
     */
    public void validate(FunnelSpec spec) {
        if (spec == null) {
            throw ValidationException.invalidParameter("spec", null, "non-null funnel definition");
        }

        if (spec.stepCount() < MIN_STEPS) {
            throw ValidationException.insufficientData("funnel steps", MIN_STEPS, spec.stepCount());
        }

        for (int i = 0; i < spec.stepCount(); i++) {
            StepDefinition step = spec.steps().get(i);
            if (step == null || step.matcher() == null) {
                throw ValidationException.invalidParameter("steps[" + i + "].matcher", null, "non-null matcher");
            }
            if (step.index() != i) {
                throw ValidationException.invalidParameter(
                        "steps[" + i + "].index", step.index(), "step index " + i);
            }
        }

        if (spec.window().amount() <= 0 || spec.window().unit() == null) {
            throw ValidationException.invalidParameter("window", spec.window(), "a positive amount of a known unit");
        }

        validateExclusions(spec);
        validateBreakdown(spec.breakdown(), spec.stepCount());
        validateConversionRange(spec);

        if (spec.binCount() != null && spec.binCount() < 1) {
            throw ValidationException.invalidParameter("binCount", spec.binCount(), ">= 1");
        }

        DateRange range = spec.dateRange();
        if (range != null && range.dateFrom() != null && range.dateTo() != null
                && range.dateFrom().isAfter(range.dateTo())) {
            throw ValidationException.invalidParameter("dateRange", range, "dateFrom <= dateTo");
        }

        LOG.debugf("Validated funnel: %d steps, mode=%s, window=%s, %d exclusions",
                spec.stepCount(), spec.orderMode(), spec.window(), spec.exclusions().size());
    }

    /**
     * Validates an actor-selection step: positive k means "reached at least step k",
     * negative k means "dropped off at step k", zero is meaningless.
     *
     * @param spec       the funnel
     * @param funnelStep one-based signed step
     */
    public void validateFunnelStep(FunnelSpec spec, int funnelStep) {
        if (funnelStep == 0 || Math.abs(funnelStep) > spec.stepCount()) {
            throw ValidationException.funnelStepOutOfRange(funnelStep, spec.stepCount());
        }
    }

    private void validateExclusions(FunnelSpec spec) {
        for (int i = 0; i < spec.exclusions().size(); i++) {
            ExclusionRule rule = spec.exclusions().get(i);
            String prefix = "exclusions[" + i + "]";
            if (rule.matcher() == null) {
                throw ValidationException.invalidParameter(prefix + ".matcher", null, "non-null matcher");
            }
            if (rule.fromStep() < 0 || rule.toStep() >= spec.stepCount() || rule.fromStep() >= rule.toStep()) {
                throw ValidationException.invalidParameter(
                        prefix + ".steps", rule.fromStep() + ".." + rule.toStep(),
                        "0 <= fromStep < toStep < " + spec.stepCount());
            }

            Set<String> excluded = rule.matcher().referencedEventNames();
            if (excluded == null || rule.filter() != null) {
                continue;
            }
            for (int s = rule.fromStep(); s <= rule.toStep(); s++) {
                StepDefinition step = spec.steps().get(s);
                if (step.propertiesFilter() != null || step.matcher().isAction()) {
                    continue;
                }
                if (excluded.contains(step.matcher().eventName())) {
                    throw ValidationException.invalidParameter(
                            prefix + ".matcher", step.matcher().eventName(),
                            "an event that is not one of the steps it spans");
                }
            }
        }
    }

    private void validateBreakdown(BreakdownSpec breakdown, int stepCount) {
        if (breakdown == null) {
            return;
        }
        if (breakdown.dimensions().size() > BreakdownSpec.MAX_DIMENSIONS) {
            throw ValidationException.invalidParameter(
                    "breakdown.dimensions", breakdown.dimensions().size(),
                    "at most " + BreakdownSpec.MAX_DIMENSIONS + " dimensions");
        }
        for (int i = 0; i < breakdown.dimensions().size(); i++) {
            var dimension = breakdown.dimensions().get(i);
            if (dimension == null || dimension.propertySource() == null || dimension.propertyName() == null) {
                throw ValidationException.invalidParameter(
                        "breakdown.dimensions[" + i + "]", dimension, "a property source and name");
            }
        }
        if (breakdown.limit() != null && breakdown.limit() < 1) {
            throw ValidationException.invalidParameter("breakdown.limit", breakdown.limit(), ">= 1");
        }
        if (breakdown.attribution() == BreakdownAttribution.STEP) {
            Integer step = breakdown.attributionStep();
            if (step == null || step < 0 || step >= stepCount) {
                throw ValidationException.invalidParameter(
                        "breakdown.attributionStep", step, "a step index below " + stepCount);
            }
        }
    }

    private void validateConversionRange(FunnelSpec spec) {
        int from = spec.fromStep();
        int to = spec.toStep();
        if (from < 0 || to >= spec.stepCount() || from >= to) {
            throw ValidationException.invalidParameter(
                    "funnelFromStep/funnelToStep", from + ".." + to,
                    "0 <= from < to < " + spec.stepCount());
        }
    }
}
