/* (C)2026 */
package com.ammann.funnel.enumeration;

/**
 * Value kind of a breakdown dimension, controlling how raw property values are rendered
 * into breakdown labels.
 */
public enum BreakdownKind {
    /** Rendered with {@link String#valueOf(Object)}. */
    STRING,

    /** Integral numbers lose their fractional part, other numbers are kept as decimals. */
    NUMERIC,

    /** Rendered as "true" or "false"; string values are parsed leniently. */
    BOOLEAN
}
