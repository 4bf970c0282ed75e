/* (C)2026 */
package com.ammann.funnel.enumeration;

/**
 * Step ordering discipline applied when matching an actor's events against a funnel.
 *
 * <ul>
 *   <li>STRICT: each step must be the very next event in the actor's stream
 *   <li>ORDERED: steps must occur in order, other events may be interleaved
 *   <li>UNORDERED: steps may occur in any order, progress is the number of distinct steps hit
 * </ul>
 */
public enum OrderMode {
    /** Step i+1 must immediately follow step i. */
    STRICT,

    /** Step i+1 must follow step i, anything may happen in between. */
    ORDERED,

    /** Steps may be satisfied in any order. */
    UNORDERED;

    /**
     * Case-insensitive conversion from string.
     *
     * @param value order mode name ("strict", "ordered", "unordered")
     * @return OrderMode enum value
     * @throws IllegalArgumentException if value is null or unknown
     */
    public static OrderMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("OrderMode value cannot be null");
        }
        for (OrderMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException(
                "Invalid order mode: " + value + ". Must be STRICT, ORDERED or UNORDERED.");
    }
}
