package com.questrail.edgecontrol.scheduling;

/**
 * Summary of one evaluation pass.
 *
 * @param skipped   the pass did not run because another one was in flight
 * @param evaluated processes whose evaluation finished, successfully or not
 * @param flips     state flips submitted to arbitration
 * @param failures  evaluations that timed out or failed
 * @param batches   batches executed
 */
public record TickReport(boolean skipped, int evaluated, int flips, int failures, int batches, double durationMs) {

    public static TickReport skippedPass() {
        return new TickReport(true, 0, 0, 0, 0, 0.0);
    }
}
