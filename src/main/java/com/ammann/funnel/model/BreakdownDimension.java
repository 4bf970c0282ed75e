/* (C)2026 */
package com.ammann.funnel.model;

import com.ammann.funnel.enumeration.BreakdownKind;
import com.ammann.funnel.enumeration.PropertySource;

/**
 * One breakdown dimension.
 *
 * @param propertySource where the value is read from
 * @param propertyName   property name
 * @param groupType      group type for GROUP dimensions
 * @param kind           value rendering
 */
public record BreakdownDimension(
        PropertySource propertySource, String propertyName, String groupType, BreakdownKind kind) {

    public BreakdownDimension {
        kind = kind == null ? BreakdownKind.STRING : kind;
    }

    public static BreakdownDimension event(String propertyName) {
        return new BreakdownDimension(PropertySource.EVENT, propertyName, null, BreakdownKind.STRING);
    }

    public static BreakdownDimension actor(String propertyName) {
        return new BreakdownDimension(PropertySource.ACTOR, propertyName, null, BreakdownKind.STRING);
    }

    public static BreakdownDimension group(String groupType, String propertyName) {
        return new BreakdownDimension(PropertySource.GROUP, propertyName, groupType, BreakdownKind.STRING);
    }
}
