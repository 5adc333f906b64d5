package com.loon.core.engine;

import com.loon.core.assertion.AssertionLedger;
import com.loon.core.format.Palette;
import com.loon.core.plugin.ArgumentCatalog;
import com.loon.core.plugin.PluginRegistry;
import com.loon.core.registry.TestBody;
import com.loon.core.registry.TestRegistry;
import com.loon.core.render.ReportRenderer;
import com.loon.core.suite.SuitePath;
import com.loon.core.suite.SuiteStack;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TestRunnerTest {

    private AssertionLedger ledger;
    private PluginRegistry plugins;
    private TestRunner runner;
    private TestRegistry registry;
    private SuiteStack suites;
    private RecordingRenderer renderer;

    @BeforeEach
    void setUp() {
        ledger = new AssertionLedger();
        var sink = new PrintStream(new ByteArrayOutputStream(), true);
        plugins = new PluginRegistry(() -> ArgumentCatalog.base(name -> null), () -> sink, Palette::uncolored);
        runner = new TestRunner(ledger, plugins);
        registry = new TestRegistry();
        suites = new SuiteStack();
        renderer = new RecordingRenderer();
    }

    private void add(String name, TestBody body) {
        registry.add(name, body, suites.current(), plugins.getCustomData());
    }

    private RunResult run() {
        return runner.run(registry.records(), renderer);
    }

    @Test
    @DisplayName("one result per test, in registration order")
    void resultsInOrder() {
        for (int i = 0; i < 5; i++) {
            add("t" + i, () -> {});
        }

        run();

        assertEquals(List.of("t0", "t1", "t2", "t3", "t4"), renderer.resultNames());
    }

    @Test
    @DisplayName("suite transitions follow the depth rule")
    void suiteTransitions() {
        add("t1", () -> {});
        suites.within("A", () -> {
            add("t2", () -> {});
            suites.within("B", () -> add("t3", () -> {}));
        });
        suites.within("C", () -> add("t4", () -> {}));
        add("t5", () -> {});

        run();

        assertEquals(List.of(
                "begin:", "result:t1",
                "begin:A", "result:t2",
                "begin:A>B", "result:t3",
                "end:A>B", "begin:C", "result:t4",
                "end:C", "begin:", "result:t5",
                "summary:5/0/0/0"), renderer.events);
    }

    @Test
    @DisplayName("re-entering a suite with the same labels begins a new suite")
    void sameLabelsDifferentSuites() {
        suites.within("A", () -> add("t1", () -> {}));
        suites.within("A", () -> add("t2", () -> {}));

        run();

        assertEquals(List.of("begin:A", "result:t1", "end:A", "begin:A", "result:t2", "summary:2/0/0/0"),
                renderer.events);
    }

    @Test
    @DisplayName("totals count tests and assertions, including assertions before an error")
    void totals() {
        add("pass", ledger::recordSuccess);
        add("fail", () -> {
            ledger.recordSuccess();
            ledger.recordFailure("bad");
        });
        add("error", () -> {
            ledger.recordSuccess();
            ledger.recordSuccess();
            throw new IllegalStateException("boom");
        });

        var result = run();

        assertEquals(1, result.testsPassed());
        assertEquals(2, result.testsFailed());
        assertEquals(4, result.assertionsPassed());
        assertEquals(1, result.assertionsFailed());
        assertEquals(2, result.exitCode());
        assertEquals("summary:1/2/4/1", renderer.events.get(renderer.events.size() - 1));
    }

    @Test
    @DisplayName("the ledger starts empty for every test")
    void ledgerResetPerTest() {
        add("first", () -> ledger.recordFailure("one"));
        add("second", ledger::recordSuccess);

        var result = run();

        assertEquals(1, result.testsPassed());
        assertEquals(List.of(List.of("one"), List.of()), renderer.failures);
    }

    @Test
    @DisplayName("each body sees the plugin data active when it was defined")
    void pluginDataPerTest() {
        List<Object> seen = new ArrayList<>();
        plugins.activate("first");
        add("a", () -> seen.add(plugins.getCustomData()));
        plugins.activate("second");
        add("b", () -> seen.add(plugins.getCustomData()));
        plugins.deactivate();
        add("c", () -> seen.add(plugins.getCustomData()));
        plugins.activate("late");

        run();

        assertEquals(java.util.Arrays.asList("first", "second", null), seen);
        assertNull(plugins.getCustomData());
    }

    @Test
    @DisplayName("summary hooks run after the summary and can replace the result")
    void summaryHooks() {
        add("fails", () -> ledger.recordFailure("x"));
        List<String> order = new ArrayList<>();
        plugins.summary("first", () -> {
            order.add("first:" + renderer.events.contains("summary:0/1/0/1"));
            return 0;
        });
        plugins.summary("second", () -> {
            order.add("second");
            return 7;
        });
        plugins.summary("third", () -> {
            order.add("third");
            return 0;
        });

        var result = run();

        assertEquals(List.of("first:true", "second"), order);
        assertEquals(7, result.exitCode());
        assertEquals(1, result.testsFailed());
    }

    @Test
    @DisplayName("an interrupted test does not fail the tests after it")
    void interruptIsContained() {
        try {
            add("interrupted", () -> {
                throw new InterruptedException("stop");
            });
            add("flags itself", () -> Thread.currentThread().interrupt());
            add("sleeps", () -> {
                Thread.sleep(1);
                ledger.recordSuccess();
            });

            var result = run();

            assertEquals(1, result.testsFailed());
            assertEquals(2, result.testsPassed());
            assertEquals(1, result.assertionsPassed());
            assertFalse(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("zero tests still produce a summary")
    void noTests() {
        var result = run();

        assertEquals(List.of("summary:0/0/0/0"), renderer.events);
        assertEquals(0, result.exitCode());
    }

    private static final class RecordingRenderer implements ReportRenderer {
        final List<String> events = new ArrayList<>();
        final List<List<String>> failures = new ArrayList<>();

        @Override
        public void suiteBegin(SuitePath path) {
            events.add("begin:" + path.join(">"));
        }

        @Override
        public void suiteEnd(SuitePath path) {
            events.add("end:" + path.join(">"));
        }

        @Override
        public void testResult(String name, int successCount, List<String> failures, ErrorRecord error) {
            events.add("result:" + name);
            this.failures.add(failures);
        }

        @Override
        public void summary(int testsPassed, int testsFailed, int assertionsPassed, int assertionsFailed) {
            events.add("summary:%d/%d/%d/%d".formatted(testsPassed, testsFailed, assertionsPassed, assertionsFailed));
        }

        List<String> resultNames() {
            return events.stream()
                    .filter(event -> event.startsWith("result:"))
                    .map(event -> event.substring("result:".length()))
                    .toList();
        }
    }
}
