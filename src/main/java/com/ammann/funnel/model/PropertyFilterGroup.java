/* (C)2026 */
package com.ammann.funnel.model;

import java.util.List;

/**
 * AND / OR combination of property filter expressions. An empty group matches everything.
 *
 * @param matchAll true for AND, false for OR
 * @param filters  child expressions
 */
public record PropertyFilterGroup(boolean matchAll, List<PropertyFilterExpr> filters)
        implements PropertyFilterExpr {

    public PropertyFilterGroup {
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    public static PropertyFilterGroup all(PropertyFilterExpr... filters) {
        return new PropertyFilterGroup(true, List.of(filters));
    }

    public static PropertyFilterGroup any(PropertyFilterExpr... filters) {
        return new PropertyFilterGroup(false, List.of(filters));
    }

    @Override
    public boolean test(Event event, ActorEvents actor) {
        if (filters.isEmpty()) {
            return true;
        }
        if (matchAll) {
            return filters.stream().allMatch(f -> f.test(event, actor));
        }
        return filters.stream().anyMatch(f -> f.test(event, actor));
    }
}
