package com.loon.core.assertion;

import java.util.ArrayList;
import java.util.List;

/**
 * Assertion outcomes of the test that is currently executing.
 */
public class AssertionLedger {

    private int successCount;
    private final List<String> failures = new ArrayList<>();

    public void recordSuccess() {
        successCount++;
    }

    public void recordFailure(String message) {
        failures.add(message);
    }

    public int successCount() {
        return successCount;
    }

    /**
     * @return a copy of the failure messages in the order they were recorded
     */
    public List<String> failures() {
        return List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public void reset() {
        successCount = 0;
        failures.clear();
    }
}
