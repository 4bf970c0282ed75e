/* (C)2026 */
package com.ammann.funnel.exception;

import java.time.Instant;

/**
 * Programming error: an event source handed over an actor stream that is not sorted
 * ascending by timestamp.
 */
public class PreconditionViolationException extends FunnelException
{
    public PreconditionViolationException(String message)
    {
        super(message);
    }

    /**
     * Creates the exception for an out-of-order event.
     */
    public static PreconditionViolationException unsortedEvents(
            String actorId, int index, Instant previous, Instant current)
    {
        return new PreconditionViolationException(
                String.format("Events of actor '%s' are not sorted: event %d at %s precedes %s",
                        actorId, index, current, previous));
    }
}
