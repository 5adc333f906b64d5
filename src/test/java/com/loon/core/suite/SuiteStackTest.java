package com.loon.core.suite;

import com.loon.core.config.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SuiteStackTest {

    private SuiteStack stack;

    @BeforeEach
    void setUp() {
        stack = new SuiteStack();
    }

    @Test
    @DisplayName("starts at the root path")
    void startsAtRoot() {
        assertSame(SuitePath.ROOT, stack.current());
        assertEquals(0, stack.depth());
    }

    @Test
    @DisplayName("push nests labels and pop restores the outer path")
    void pushAndPop() {
        var outer = stack.push("math");
        var inner = stack.push("addition");

        assertEquals(List.of("math", "addition"), inner.labels());
        assertEquals(inner, stack.current());

        stack.pop();
        assertEquals(outer, stack.current());
        stack.pop("math");
        assertSame(SuitePath.ROOT, stack.current());
    }

    @Test
    @DisplayName("paths with identical labels are distinct suites")
    void identicalLabelsAreDistinct() {
        var first = stack.push("same");
        stack.pop();
        var second = stack.push("same");

        assertEquals(first.labels(), second.labels());
        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("a pushed path is not changed by later pushes")
    void pathsAreImmutable() {
        var outer = stack.push("outer");
        stack.push("inner");

        assertEquals(List.of("outer"), outer.labels());
        assertThrows(UnsupportedOperationException.class, () -> outer.labels().add("x"));
    }

    @Test
    @DisplayName("unmatched pop fails even after balanced pairs")
    void unmatchedPopFails() {
        stack.within("a", () -> stack.within("b", () -> {}));
        stack.push("c");
        stack.pop();

        var e = assertThrows(ConfigurationException.class, stack::pop);
        assertTrue(e.getMessage().contains("unmatched suite boundaries"));
    }

    @Test
    @DisplayName("reset returns to root without reusing ids")
    void resetKeepsIdsUnique() {
        var before = stack.push("suite");
        stack.reset();

        assertSame(SuitePath.ROOT, stack.current());
        var after = stack.push("suite");
        assertTrue(after.id() > before.id());
    }

    @Test
    @DisplayName("root and the no-suite marker are never equal to a pushed path")
    void sentinels() {
        var named = stack.push("x");

        assertNotEquals(SuitePath.ROOT, SuitePath.NONE);
        assertNotEquals(SuitePath.ROOT, named);
        assertTrue(named.isNamed());
        assertFalse(SuitePath.ROOT.isNamed());
        assertFalse(SuitePath.NONE.isNamed());
        assertTrue(SuitePath.ROOT.isRoot());
    }
}
