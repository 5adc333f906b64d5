package com.loon.core.assertion;

import com.loon.core.format.Palette;
import com.loon.core.format.ValueFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssertionFactoryTest {

    private AssertionLedger ledger;
    private AssertionFactory factory;

    @BeforeEach
    void setUp() {
        ledger = new AssertionLedger();
        factory = new AssertionFactory(ledger, Palette::uncolored, new ValueFormatter());
    }

    @Test
    @DisplayName("a passing check counts one success")
    void passingCheck() {
        var positive = factory.create(args -> ((Integer) args[0]) > 0);

        positive.check(1);
        positive.check(2);

        assertEquals(2, ledger.successCount());
        assertFalse(ledger.hasFailures());
    }

    @Test
    @DisplayName("a failing check records the message built from the same arguments")
    void failingCheckUsesMessageBuilder() {
        List<Object> seen = new ArrayList<>();
        var caseless = factory.create(
                args -> ((String) args[0]).equalsIgnoreCase((String) args[1]),
                (location, args) -> {
                    seen.addAll(List.of(args));
                    return location + "strings don't match: '" + args[0] + "' vs. '" + args[1] + "'";
                });

        caseless.check("abc", "ABC");
        caseless.check("abc", "xyz"); int line = new Throwable().getStackTrace()[0].getLineNumber();

        assertEquals(1, ledger.successCount());
        assertEquals(List.of("AssertionFactoryTest.java:" + line + ": strings don't match: 'abc' vs. 'xyz'"),
                ledger.failures());
        assertEquals(List.of("abc", "xyz"), seen);
    }

    @Test
    @DisplayName("default message lists the arguments")
    void defaultMessageWithArguments() {
        var never = factory.create(args -> false);

        never.check(1, "a");

        var failure = ledger.failures().get(0);
        assertTrue(failure.matches("AssertionFactoryTest\\.java:\\d+: assertion failed with arguments: 1, \"a\""),
                failure);
    }

    @Test
    @DisplayName("default message without arguments")
    void defaultMessageWithoutArguments() {
        factory.create(args -> false).check();

        assertTrue(ledger.failures().get(0).endsWith(": assertion failed (no arguments)"));
    }

    @Test
    @DisplayName("location skips helper classes and points at their caller")
    void locationSkipsHelpers() {
        var helper = new PositiveHelper(factory.create(args -> false));

        helper.assertPositive(-1); int line = new Throwable().getStackTrace()[0].getLineNumber();

        assertTrue(ledger.failures().get(0).startsWith("AssertionFactoryTest.java:" + line + ": "),
                ledger.failures().get(0));
    }

    @Test
    @DisplayName("colored location highlights file and line")
    void coloredLocation() {
        var colored = new AssertionFactory(ledger, Palette::colored, new ValueFormatter());

        colored.create(args -> false, (location, args) -> location).check();

        var palette = Palette.colored();
        assertTrue(ledger.failures().get(0).startsWith(palette.file("AssertionFactoryTest.java") + ":"));
    }

    @Test
    @DisplayName("rejects a missing check")
    void rejectsNullCheck() {
        assertThrows(IllegalArgumentException.class, () -> factory.create(null));
    }

    @AssertionHelper
    static final class PositiveHelper {
        private final Assertion assertion;

        PositiveHelper(Assertion assertion) {
            this.assertion = assertion;
        }

        void assertPositive(int value) {
            assertion.check(value);
        }
    }
}
