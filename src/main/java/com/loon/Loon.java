package com.loon;

import com.loon.core.assertion.Assertion;
import com.loon.core.assertion.AssertionCheck;
import com.loon.core.assertion.AssertionHelper;
import com.loon.core.assertion.FailureMessage;
import com.loon.core.engine.RunResult;
import com.loon.core.registry.TestBody;
import com.loon.core.registry.TestUnit;
import com.loon.core.session.LoonSession;

import java.util.List;
import java.util.Map;

/**
 * Static entry point for test definitions backed by one process-wide session.
 *
 * <pre>{@code
 * import static com.loon.Loon.*;
 *
 * suite("strings", () -> {
 *     add("upper case", () -> assertEquals("abc".toUpperCase(), "ABC"));
 * });
 * System.exit(run(args).exitCode());
 * }</pre>
 */
@AssertionHelper
public final class Loon {

    private static final LoonSession SESSION = new LoonSession();

    private Loon() {}

    public static LoonSession session() {
        return SESSION;
    }

    // -- Definition -------------------------------------------------------------

    public static void add(String name, TestBody body) {
        SESSION.add(name, body);
    }

    public static void suite(String label, Runnable definitions) {
        SESSION.suite(label, definitions);
    }

    public static void startSuite(String label) {
        SESSION.startSuite(label);
    }

    public static void stopSuite() {
        SESSION.stopSuite();
    }

    public static void stopSuite(String label) {
        SESSION.stopSuite(label);
    }

    public static void grouped(TestUnit... units) {
        SESSION.grouped(units);
    }

    public static void grouped(String... classNames) {
        SESSION.grouped(classNames);
    }

    // -- Running ----------------------------------------------------------------

    public static RunResult run(String... arguments) {
        return SESSION.run(arguments);
    }

    public static RunResult run(List<String> arguments, Map<String, ?> userDefaults) {
        return SESSION.run(arguments, userDefaults);
    }

    public static RunResult run(Map<String, ?> options) {
        return SESSION.run(options);
    }

    // -- Assertions -------------------------------------------------------------

    public static Assertion createAssertion(AssertionCheck check, FailureMessage message) {
        return SESSION.createAssertion(check, message);
    }

    public static void assertEquals(Object got, Object expected) {
        SESSION.assertions().equal(got, expected);
    }

    public static void assertEquals(Object got, Object expected, String message) {
        SESSION.assertions().equal(got, expected, message);
    }

    public static void assertTrue(Object got) {
        SESSION.assertions().isTrue(got);
    }

    public static void assertTrue(Object got, String message) {
        SESSION.assertions().isTrue(got, message);
    }

    public static void assertFalse(Object got) {
        SESSION.assertions().isFalse(got);
    }

    public static void assertFalse(Object got, String message) {
        SESSION.assertions().isFalse(got, message);
    }

    public static void assertTruthy(Object got) {
        SESSION.assertions().truthy(got);
    }

    public static void assertFalsey(Object got) {
        SESSION.assertions().falsey(got);
    }

    public static void assertNull(Object got) {
        SESSION.assertions().isNull(got);
    }

    public static void assertNear(Number got, Number expected) {
        SESSION.assertions().near(got, expected);
    }

    public static void assertNear(Number got, Number expected, Number tolerance) {
        SESSION.assertions().near(got, expected, tolerance);
    }

    public static void assertStringContains(Object got, Object pattern) {
        SESSION.assertions().stringContains(got, pattern);
    }

    public static void assertErrorContains(String pattern, TestBody action) {
        SESSION.assertions().errorContains(pattern, action);
    }
}
