package com.questrail.edgecontrol.api;

/**
 * Thrown synchronously by {@code startProcess} when the rule is missing or
 * disabled.
 */
public final class RuleUnavailableException extends EdgeControlException
{
    public RuleUnavailableException(String message) {
        super(message);
    }
}
