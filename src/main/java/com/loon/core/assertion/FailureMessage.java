package com.loon.core.assertion;

/**
 * Builds the text recorded when an {@link AssertionCheck} fails.
 */
@FunctionalInterface
public interface FailureMessage {

    /**
     * @param location source location of the failing call, formatted as {@code File.java:12: }
     * @param args     the arguments the assertion was called with
     */
    String describe(String location, Object... args);
}
