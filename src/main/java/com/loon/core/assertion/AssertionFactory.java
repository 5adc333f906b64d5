package com.loon.core.assertion;

import com.loon.core.format.Palette;
import com.loon.core.format.ValueFormatter;

import java.util.Arrays;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Turns a predicate and a message builder into an {@link Assertion} that writes
 * into the ledger of the running test. Built-in assertions and plugins both
 * create their assertions here.
 */
@AssertionHelper
public class AssertionFactory {

    private final AssertionLedger ledger;
    private final Supplier<Palette> palette;
    private final ValueFormatter formatter;

    public AssertionFactory(AssertionLedger ledger, Supplier<Palette> palette, ValueFormatter formatter) {
        this.ledger = ledger;
        this.palette = palette;
        this.formatter = formatter;
    }

    public Assertion create(AssertionCheck check) {
        return create(check, null);
    }

    /**
     * @param check   the predicate, called with the assertion's arguments
     * @param message builds the failure text; a generic "assertion failed" message when null
     */
    public Assertion create(AssertionCheck check, FailureMessage message) {
        if (check == null) {
            throw new IllegalArgumentException("Assertion check must not be null");
        }
        return new LedgerAssertion(check, message != null ? message : this::defaultMessage);
    }

    String defaultMessage(String location, Object... args) {
        if (args == null || args.length == 0) {
            return location + "assertion failed (no arguments)";
        }
        var rendered = Arrays.stream(args)
                .map(formatter::format)
                .collect(Collectors.joining(", "));
        return location + "assertion failed with arguments: " + rendered;
    }

    @AssertionHelper
    private final class LedgerAssertion implements Assertion {

        private final AssertionCheck check;
        private final FailureMessage message;

        LedgerAssertion(AssertionCheck check, FailureMessage message) {
            this.check = check;
            this.message = message;
        }

        @Override
        public void check(Object... args) {
            if (check.test(args)) {
                ledger.recordSuccess();
            } else {
                var location = SourceLocator.locate(palette.get());
                ledger.recordFailure(message.describe(location, args));
            }
        }
    }
}
