package com.loon.core.engine;

import com.loon.core.assertion.AssertionLedger;

import java.util.List;

/**
 * Outcome of executing one test body.
 *
 * @param status       how the body ended
 * @param successCount assertions that passed before the body ended
 * @param failures     messages of the assertions that failed
 * @param error        the raised error, present only for {@link Status#ERRORED}
 */
public record ExecutionResult(Status status, int successCount, List<String> failures, ErrorRecord error) {

    public enum Status {
        PASSED,
        FAILED,
        ERRORED
    }

    public ExecutionResult {
        failures = List.copyOf(failures);
    }

    /**
     * Classifies a body's outcome: errored when it raised, failed when any
     * assertion failed, passed otherwise (including when nothing was asserted).
     */
    public static ExecutionResult of(AssertionLedger ledger, ErrorRecord error) {
        Status status;
        if (error != null) {
            status = Status.ERRORED;
        } else if (ledger.hasFailures()) {
            status = Status.FAILED;
        } else {
            status = Status.PASSED;
        }
        return new ExecutionResult(status, ledger.successCount(), ledger.failures(), error);
    }

    public boolean passed() {
        return status == Status.PASSED;
    }
}
