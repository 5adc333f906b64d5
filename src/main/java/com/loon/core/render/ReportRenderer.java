package com.loon.core.render;

import com.loon.core.engine.ErrorRecord;
import com.loon.core.suite.SuitePath;

import java.util.List;

/**
 * Receives the events of one run and turns them into a report.
 * <p>
 * Call order: {@link #begin()}, then for every test an optional
 * {@link #suiteEnd}/{@link #suiteBegin} pair when its suite differs from the
 * previous test's, then {@link #testResult}; finally {@link #summary}.
 */
public interface ReportRenderer {

    default void begin() {}

    void suiteBegin(SuitePath path);

    /**
     * @param error the raised error, or null when the body completed
     */
    void testResult(String name, int successCount, List<String> failures, ErrorRecord error);

    default void suiteEnd(SuitePath path) {}

    void summary(int testsPassed, int testsFailed, int assertionsPassed, int assertionsFailed);
}
