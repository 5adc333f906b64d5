package com.loon.core.registry;

import com.loon.core.suite.SuitePath;

/**
 * A registered test.
 *
 * @param name       display name
 * @param body       the test code
 * @param suitePath  the suite path current when the test was added
 * @param pluginData plugin custom data active when the test was added, may be null
 */
public record TestRecord(String name, TestBody body, SuitePath suitePath, Object pluginData) {}
