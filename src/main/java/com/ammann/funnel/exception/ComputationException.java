/* (C)2026 */
package com.ammann.funnel.exception;

/**
 * Failure of a parallel work unit (interruption or an error thrown while matching).
 */
public class ComputationException extends FunnelException
{
    public ComputationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
