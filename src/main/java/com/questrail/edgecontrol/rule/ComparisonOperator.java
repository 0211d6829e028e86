package com.questrail.edgecontrol.rule;

import java.util.Locale;
import java.util.Optional;

/**
 * Numeric comparison between a sensor value (left) and a threshold (right).
 *
 * <p>Rules are authored outside the engine and may carry operators this
 * version does not know. {@link #parse(String)} maps those to
 * {@link #UNRECOGNIZED}, which never holds, so such a condition fails closed
 * instead of failing to load.</p>
 */
public enum ComparisonOperator {
    GREATER_THAN(">", "greater_than"),
    LESS_THAN("<", "less_than"),
    GREATER_OR_EQUAL(">=", "greater_equal"),
    LESS_OR_EQUAL("<=", "less_equal"),
    EQUAL("==", "equal"),
    NOT_EQUAL("!=", "not_equal"),
    UNRECOGNIZED("?", "unrecognized");

    private final String symbol;
    private final String alias;

    ComparisonOperator(String symbol, String alias) {
        this.symbol = symbol;
        this.alias = alias;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double value, double threshold) {
        switch (this) {
            case GREATER_THAN:
                return value > threshold;
            case LESS_THAN:
                return value < threshold;
            case GREATER_OR_EQUAL:
                return value >= threshold;
            case LESS_OR_EQUAL:
                return value <= threshold;
            case EQUAL:
                return value == threshold;
            case NOT_EQUAL:
                return value != threshold;
            case UNRECOGNIZED:
            default:
                return false;
        }
    }

    /**
     * Accepts both the symbolic form ({@code ">="}) and the named form used by
     * cross-controller triggers ({@code "greater_equal"}).
     */
    public static ComparisonOperator parse(String text) {
        return lookup(text).orElse(UNRECOGNIZED);
    }

    public static Optional<ComparisonOperator> lookup(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (ComparisonOperator op : values()) {
            if (op != UNRECOGNIZED && (op.symbol.equals(normalized) || op.alias.equals(normalized))) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
