package com.loon.core.registry;

import com.loon.core.session.LoonSession;

/**
 * A group of test definitions, typically one class per area under test.
 * <p>
 * Implementations need a public no-argument constructor when they are loaded
 * by class name through {@link LoonSession#grouped(String...)}. A unit may end
 * with a call to {@code run}; inside {@code grouped} that call only resets the
 * suite stack so the tests accumulate for a single run.
 */
@FunctionalInterface
public interface TestUnit {
    void define(LoonSession session);
}
