package com.questrail.edgecontrol.evaluation;

/**
 * Verdict of the data-quality gate, in the order the gate checks.
 */
public enum DataQuality {
    OK,
    MISSING,
    NON_NUMERIC,
    STALE,
    OUT_OF_RANGE;

    public boolean usable() {
        return this == OK;
    }
}
