package com.loon.core.assertion;

import com.loon.core.engine.ProtectedCall;
import com.loon.core.format.Palette;
import com.loon.core.format.ValueFormatter;
import com.loon.core.registry.TestBody;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * The built-in assertion family: deep equality, truthiness, numeric tolerance,
 * string matching and expected errors.
 * <p>
 * Every method records exactly one success or failure in the running test's
 * ledger and never throws because of a failed comparison.
 */
@AssertionHelper
public class Assertions {

    public static final double DEFAULT_TOLERANCE = 1e-10;

    private static final int INLINE_COMPARISON_LIMIT = 48;
    private static final int LONG_STRING_LIMIT = 80;

    private final Supplier<Palette> palette;
    private final ValueFormatter formatter;

    private final Assertion equal;
    private final Assertion isTrue;
    private final Assertion isFalse;
    private final Assertion truthy;
    private final Assertion falsey;
    private final Assertion isNull;
    private final Assertion near;
    private final Assertion stringContains;
    private final Assertion errorContains;

    public Assertions(AssertionFactory factory, Supplier<Palette> palette, ValueFormatter formatter) {
        this.palette = palette;
        this.formatter = formatter;

        this.equal = factory.create(args -> Objects.deepEquals(args[0], args[1]), this::equalFailure);
        this.isTrue = truthTest(factory, Boolean.TRUE::equals, "true");
        this.isFalse = truthTest(factory, Boolean.FALSE::equals, "false");
        this.truthy = truthTest(factory, got -> got != null && !Boolean.FALSE.equals(got), "not null|false");
        this.falsey = truthTest(factory, got -> got == null || Boolean.FALSE.equals(got), "null|false");
        this.isNull = truthTest(factory, Objects::isNull, "null");
        this.near = factory.create(args -> nearlyEquals(args[0], args[1], args[2]), this::nearFailure);
        this.stringContains = factory.create(args -> contains(args[0], args[1]), this::containsFailure);
        this.errorContains = factory.create(args -> errorMatches((String) args[0], (CapturedError) args[1]),
                this::errorFailure);
    }

    // -- Equality ---------------------------------------------------------------

    /**
     * Deep equality; arrays are compared element by element.
     */
    public void equal(Object got, Object expected) {
        equal.check(got, expected, null);
    }

    public void equal(Object got, Object expected, String message) {
        equal.check(got, expected, message);
    }

    // -- Truthiness -------------------------------------------------------------

    public void isTrue(Object got) {
        isTrue.check(got, null);
    }

    public void isTrue(Object got, String message) {
        isTrue.check(got, message);
    }

    public void isFalse(Object got) {
        isFalse.check(got, null);
    }

    public void isFalse(Object got, String message) {
        isFalse.check(got, message);
    }

    /**
     * Passes for anything except {@code null} and {@code false}.
     */
    public void truthy(Object got) {
        truthy.check(got, null);
    }

    public void truthy(Object got, String message) {
        truthy.check(got, message);
    }

    /**
     * Passes for {@code null} and {@code false}.
     */
    public void falsey(Object got) {
        falsey.check(got, null);
    }

    public void falsey(Object got, String message) {
        falsey.check(got, message);
    }

    public void isNull(Object got) {
        isNull.check(got, null);
    }

    public void isNull(Object got, String message) {
        isNull.check(got, message);
    }

    // -- Numbers ----------------------------------------------------------------

    public void near(Number got, Number expected) {
        near.check(got, expected, null, null);
    }

    public void near(Number got, Number expected, Number tolerance) {
        near.check(got, expected, tolerance, null);
    }

    public void near(Number got, Number expected, Number tolerance, String message) {
        near.check(got, expected, tolerance, message);
    }

    // -- Strings and errors -----------------------------------------------------

    /**
     * Passes when {@code pattern}, a regular expression, is found in {@code got}.
     */
    public void stringContains(Object got, Object pattern) {
        stringContains.check(got, pattern, null);
    }

    public void stringContains(Object got, Object pattern, String message) {
        stringContains.check(got, pattern, message);
    }

    /**
     * Runs {@code action} once and passes when it throws an error whose message
     * matches {@code pattern}. An empty pattern never matches.
     */
    public void errorContains(String pattern, TestBody action) {
        errorContains.check(pattern, new CapturedError(action));
    }

    // -- Predicates -------------------------------------------------------------

    private Assertion truthTest(AssertionFactory factory, Predicate<Object> test, String expected) {
        return factory.create(args -> test.test(args[0]),
                (location, args) -> preamble(args[1]) + location
                        + "expected: " + palette.get().value(expected)
                        + ", got: " + formatter.format(args[0], palette.get()::fail));
    }

    private static boolean nearlyEquals(Object got, Object expected, Object tolerance) {
        var limit = tolerance != null ? number(tolerance).doubleValue() : DEFAULT_TOLERANCE;
        return Math.abs(number(got).doubleValue() - number(expected).doubleValue()) <= limit;
    }

    private static boolean contains(Object got, Object pattern) {
        if (!(got instanceof String text) || !(pattern instanceof String regex)) {
            return false;
        }
        return Pattern.compile(regex).matcher(text).find();
    }

    private static boolean errorMatches(String pattern, CapturedError captured) {
        if (pattern == null || pattern.isEmpty()) {
            return false;
        }
        var message = captured.message();
        return message != null && Pattern.compile(pattern).matcher(message).find();
    }

    // -- Failure messages -------------------------------------------------------

    private String equalFailure(String location, Object... args) {
        var colors = palette.get();
        var expected = formatter.format(args[1], colors::value);
        var got = formatter.format(args[0], colors::fail);

        String comparison;
        if (expected.contains("\n") || got.contains("\n")) {
            comparison = "\nexpected: %s, got: %s".formatted(expected, got);
        } else if (expected.length() + got.length() < INLINE_COMPARISON_LIMIT) {
            comparison = "expected: %s, got: %s".formatted(expected, got);
        } else {
            comparison = "expected: \n%s.\ngot: \n%s".formatted(expected, got);
        }
        return preamble(args[2]) + location + comparison;
    }

    private String nearFailure(String location, Object... args) {
        var colors = palette.get();
        var tolerance = args[2] != null ? args[2] : DEFAULT_TOLERANCE;
        var outBy = colors.fail(difference(number(args[0]), number(args[1])));
        return preamble(args[3]) + location + "expected: %s to be nearly %s (tolerance of %s, out by %s)".formatted(
                formatter.format(args[0], colors::fail),
                formatter.format(args[1], colors::value),
                formatter.format(tolerance, colors::warn),
                outBy);
    }

    private String containsFailure(String location, Object... args) {
        return containsFailure(location, args[0], args[1], (String) args[2]);
    }

    private String errorFailure(String location, Object... args) {
        var captured = (CapturedError) args[1];
        return containsFailure(location, captured.message(), args[0], "error.contains: no match");
    }

    private String containsFailure(String location, Object got, Object expected, String text) {
        var colors = palette.get();
        if (!(got instanceof String gotText) || !(expected instanceof String expectedText)) {
            var gotShown = formatter.format(got, got instanceof String ? colors::pass : colors::fail);
            var expectedShown = formatter.format(expected, expected instanceof String ? colors::pass : colors::fail);
            return preamble(text != null ? text : "string.contains: type error") + location
                    + "expected two strings, got: %s and: %s".formatted(gotShown, expectedShown);
        }
        var newline1 = expectedText.length() > LONG_STRING_LIMIT || expectedText.contains("\n") ? "\n" : "";
        var newline2 = gotText.length() > LONG_STRING_LIMIT || gotText.contains("\n") ? "\n" : ", ";
        return preamble(text != null ? text : "string.contains: no match") + location
                + "%smatching: %s%sagainst: %s".formatted(
                newline1, formatter.format(expectedText, colors::value),
                newline2, formatter.format(gotText, colors::fail));
    }

    private String preamble(Object text) {
        return text != null ? palette.get().msg(text) + "\n" : "";
    }

    private static Number number(Object value) {
        if (value instanceof Number n) {
            return n;
        }
        throw new IllegalArgumentException("Expected a number but got: " + value);
    }

    private static String difference(Number got, Number expected) {
        try {
            return decimal(expected).subtract(decimal(got)).abs().stripTrailingZeros().toPlainString();
        } catch (NumberFormatException e) {
            // NaN and infinities have no decimal form
            return String.valueOf(Math.abs(expected.doubleValue() - got.doubleValue()));
        }
    }

    private static BigDecimal decimal(Number n) {
        if (n instanceof BigDecimal d) {
            return d;
        }
        if (n instanceof BigInteger i) {
            return new BigDecimal(i);
        }
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return BigDecimal.valueOf(n.longValue());
        }
        return new BigDecimal(n.toString());
    }

    /**
     * Runs an action at most once and remembers how it ended, so the check and
     * the failure message see the same outcome.
     */
    static final class CapturedError {

        private final TestBody action;
        private boolean ran;
        private Throwable error;

        CapturedError(TestBody action) {
            this.action = action;
        }

        String message() {
            if (!ran) {
                ran = true;
                try {
                    action.run();
                } catch (Throwable t) {
                    if (ProtectedCall.isFatal(t)) {
                        throw (Error) t;
                    }
                    error = t;
                }
            }
            if (error == null) {
                return null;
            }
            return error.getMessage() != null ? error.getMessage() : error.toString();
        }
    }
}
