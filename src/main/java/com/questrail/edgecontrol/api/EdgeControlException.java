package com.questrail.edgecontrol.api;

/**
 * Base type of every failure the engine reports to its callers.
 */
public class EdgeControlException extends RuntimeException
{
    public EdgeControlException(String message) {
        super(message);
    }

    public EdgeControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
