/* (C)2026 */
package com.ammann.funnel.exception;

/**
 * Base unchecked exception for all errors raised by the funnel engine.
 *
 * <p>Subclasses represent specific error categories (malformed funnel definitions, violated
 * input preconditions, failed parallel work units). Numeric edge cases never raise.
 */
public class FunnelException extends RuntimeException
{
    public FunnelException(String message, Throwable cause) {
        super(message, cause);
    }

    public FunnelException(String message) {
        super(message);
    }

    public FunnelException(Throwable cause) {
        super(cause);
    }
}
