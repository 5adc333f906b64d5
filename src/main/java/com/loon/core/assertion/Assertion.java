package com.loon.core.assertion;

/**
 * A callable assertion produced by {@link AssertionFactory}. Each call records
 * one success or one failure in the ledger of the running test.
 */
@FunctionalInterface
public interface Assertion {
    void check(Object... args);
}
