package com.causaltest.dag.api;

/**
 * Thrown when no set of covariates can block every backdoor path between the
 * treatments and the outcomes, or when the query itself is degenerate (empty or
 * overlapping treatment and outcome sets).
 */
public class NoAdjustmentSetException extends IllegalStateException {

    public NoAdjustmentSetException(String message) {
        super(message);
    }
}
