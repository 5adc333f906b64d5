package com.loon.core.engine;

/**
 * Totals of a completed run.
 *
 * @param exitCode the first non-zero value returned by a plugin summary hook,
 *                 otherwise the number of failed tests
 */
public record RunResult(int testsPassed, int testsFailed, int assertionsPassed, int assertionsFailed, int exitCode) {

    /**
     * Result of a run that executed nothing: help output, or a run requested
     * while test units are being grouped.
     */
    public static RunResult empty() {
        return new RunResult(0, 0, 0, 0, 0);
    }

    public int testCount() {
        return testsPassed + testsFailed;
    }

    public int assertionCount() {
        return assertionsPassed + assertionsFailed;
    }
}
