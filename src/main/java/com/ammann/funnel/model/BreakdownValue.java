/* (C)2026 */
package com.ammann.funnel.model;

import java.util.Collections;
import java.util.List;

/**
 * Breakdown key: one label per breakdown dimension.
 *
 * <p>Ordered lexically, comparing labels dimension by dimension.
 *
 * @param values labels, one per dimension; empty when no breakdown is configured
 */
public record BreakdownValue(List<String> values) implements Comparable<BreakdownValue> {

    /** Label of the bucket collecting values outside the top N. */
    public static final String OTHER_LABEL = "$$_other";

    /** Label used when the property is missing. */
    public static final String UNDEFINED_LABEL = "$$_undefined";

    /** Key used when no breakdown is configured. */
    public static final BreakdownValue NONE = new BreakdownValue(List.of());

    public BreakdownValue {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static BreakdownValue of(String... values) {
        return new BreakdownValue(List.of(values));
    }

    /**
     * Returns the "other" key for the given number of dimensions.
     */
    public static BreakdownValue other(int dimensions) {
        return new BreakdownValue(Collections.nCopies(dimensions, OTHER_LABEL));
    }

    public boolean isNone() {
        return values.isEmpty();
    }

    public boolean isOther() {
        return !values.isEmpty() && values.stream().allMatch(OTHER_LABEL::equals);
    }

    @Override
    public int compareTo(BreakdownValue other) {
        int shared = Math.min(values.size(), other.values.size());
        for (int i = 0; i < shared; i++) {
            int cmp = values.get(i).compareTo(other.values.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(values.size(), other.values.size());
    }

    @Override
    public String toString() {
        return String.join("::", values);
    }
}
