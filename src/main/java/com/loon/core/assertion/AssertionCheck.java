package com.loon.core.assertion;

/**
 * The predicate behind an assertion. Receives exactly the arguments the
 * assertion was called with.
 */
@FunctionalInterface
public interface AssertionCheck {
    boolean test(Object... args);
}
