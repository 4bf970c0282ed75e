/* (C)2026 */
package com.ammann.funnel.enumeration;

/**
 * Comparison operators for property filters.
 */
public enum PropertyOperator {
    EXACT,
    IS_NOT,
    ICONTAINS,
    NOT_ICONTAINS,
    REGEX,
    NOT_REGEX,
    GT,
    GTE,
    LT,
    LTE,
    IS_SET,
    IS_NOT_SET;

    /**
     * Returns true when the operator compares numerically.
     */
    public boolean isNumeric() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }
}
