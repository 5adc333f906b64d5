package com.loon.core.registry;

/**
 * The code of a single test. Anything it throws fails only this test.
 */
@FunctionalInterface
public interface TestBody {
    void run() throws Exception;
}
