package com.loon.core.logging;

import com.loon.core.suite.SuitePath;
import org.slf4j.MDC;

/**
 * Utility for managing Loon-specific MDC keys while a test body runs.
 */
public final class MdcContext {

    static final String SUITE = "loonSuite";
    static final String TEST = "loonTest";

    private MdcContext() {}

    public static void setTest(SuitePath suite, String testName) {
        MDC.put(SUITE, suite.isNamed() ? suite.join(" > ") : "default");
        MDC.put(TEST, testName);
    }

    public static void clear() {
        MDC.remove(SUITE);
        MDC.remove(TEST);
    }
}
