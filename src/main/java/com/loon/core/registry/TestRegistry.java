package com.loon.core.registry;

import com.loon.core.suite.SuitePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only list of tests in registration order.
 */
public class TestRegistry {

    private static final Logger log = LoggerFactory.getLogger(TestRegistry.class);

    private final List<TestRecord> records = new ArrayList<>();

    public TestRecord add(String name, TestBody body, SuitePath suitePath, Object pluginData) {
        if (name == null) {
            throw new IllegalArgumentException("Test name must not be null");
        }
        if (body == null) {
            throw new IllegalArgumentException("Test body must not be null for test '" + name + "'");
        }
        var record = new TestRecord(name, body, suitePath, pluginData);
        records.add(record);
        log.debug("Registered test '{}' in suite {}", name, suitePath.labels());
        return record;
    }

    public List<TestRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
    }
}
