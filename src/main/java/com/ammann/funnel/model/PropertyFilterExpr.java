/* (C)2026 */
package com.ammann.funnel.model;

/**
 * Boolean expression over an event and the actor that performed it.
 */
public interface PropertyFilterExpr {

    /** Filter that accepts everything. */
    PropertyFilterExpr ALWAYS = (event, actor) -> true;

    /**
     * Evaluates the expression.
     *
     * @param event the candidate event
     * @param actor the actor owning the event
     * @return true if the event passes
     */
    boolean test(Event event, ActorEvents actor);
}
