/* (C)2026 */
package com.ammann.funnel.enumeration;

/**
 * Where a property value is read from.
 */
public enum PropertySource {
    /** Properties attached to the event itself. */
    EVENT,

    /** Properties of the actor (person, group or session) the funnel runs over. */
    ACTOR,

    /** Properties of a group the actor belongs to. */
    GROUP
}
