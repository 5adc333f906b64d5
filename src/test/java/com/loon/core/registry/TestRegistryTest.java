package com.loon.core.registry;

import com.loon.core.suite.SuitePath;
import com.loon.core.suite.SuiteStack;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TestRegistryTest {

    private final TestRegistry registry = new TestRegistry();

    @Test
    @DisplayName("keeps records in registration order with their suite and plugin data")
    void keepsOrder() {
        var suites = new SuiteStack();
        registry.add("first", () -> {}, suites.current(), null);
        var path = suites.push("suite");
        registry.add("second", () -> {}, suites.current(), "data");
        suites.pop();

        assertEquals(2, registry.size());
        var records = registry.records();
        assertEquals("first", records.get(0).name());
        assertSame(SuitePath.ROOT, records.get(0).suitePath());
        assertNull(records.get(0).pluginData());
        assertEquals(path, records.get(1).suitePath());
        assertEquals("data", records.get(1).pluginData());
    }

    @Test
    @DisplayName("records view is read-only")
    void recordsAreReadOnly() {
        registry.add("t", () -> {}, SuitePath.ROOT, null);
        assertThrows(UnsupportedOperationException.class, () -> registry.records().clear());
    }

    @Test
    @DisplayName("rejects a missing name or body")
    void rejectsNulls() {
        assertThrows(IllegalArgumentException.class, () -> registry.add(null, () -> {}, SuitePath.ROOT, null));
        assertThrows(IllegalArgumentException.class, () -> registry.add("t", null, SuitePath.ROOT, null));
    }

    @Test
    @DisplayName("clear forgets every record")
    void clear() {
        registry.add("t", () -> {}, SuitePath.ROOT, null);
        registry.clear();
        assertEquals(0, registry.size());
    }
}
