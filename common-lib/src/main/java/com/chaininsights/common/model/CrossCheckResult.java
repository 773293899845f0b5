package com.chaininsights.common.model;

/**
 * Ground-truth comparison result for one miner in one round.
 *
 * @param elapsedSeconds transport time of the challenge call; {@code 0.0} when no call was made
 */
public record CrossCheckResult(CrossCheckOutcome outcome, double elapsedSeconds, String detail) {

    public static CrossCheckResult pass(double elapsedSeconds) {
        return new CrossCheckResult(CrossCheckOutcome.PASS, elapsedSeconds, "answer accepted");
    }

    public static CrossCheckResult fail(double elapsedSeconds, String detail) {
        return new CrossCheckResult(CrossCheckOutcome.FAIL, elapsedSeconds, detail);
    }

    public static CrossCheckResult indeterminate(String detail) {
        return new CrossCheckResult(CrossCheckOutcome.INDETERMINATE, 0.0, detail);
    }

    public boolean passed() {
        return outcome == CrossCheckOutcome.PASS;
    }
}
