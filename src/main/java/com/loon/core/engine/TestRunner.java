package com.loon.core.engine;

import com.loon.core.assertion.AssertionLedger;
import com.loon.core.logging.MdcContext;
import com.loon.core.plugin.PluginRegistry;
import com.loon.core.registry.TestRecord;
import com.loon.core.render.ReportRenderer;
import com.loon.core.suite.SuitePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Executes registered tests in order and feeds their outcomes to a renderer.
 * <p>
 * Each body runs against a freshly reset ledger with its recorded plugin data
 * active. Suite transitions are detected by path identity: when the next test
 * belongs to a different path, the previous named suite is ended if the new
 * path is no deeper than it, and the new path is begun.
 */
public class TestRunner {

    private static final Logger log = LoggerFactory.getLogger(TestRunner.class);

    private final AssertionLedger ledger;
    private final PluginRegistry plugins;

    public TestRunner(AssertionLedger ledger, PluginRegistry plugins) {
        this.ledger = ledger;
        this.plugins = plugins;
    }

    /**
     * Runs every record, writes the summary, then the plugin summary hooks.
     * Leaves registry and plugin state untouched.
     */
    public RunResult run(List<TestRecord> records, ReportRenderer renderer) {
        log.debug("Running {} test(s) with {}", records.size(), renderer.getClass().getSimpleName());

        int testsPassed = 0;
        int testsFailed = 0;
        int assertionsPassed = 0;
        int assertionsFailed = 0;
        var currentSuite = SuitePath.NONE;

        renderer.begin();
        for (var record : records) {
            var result = execute(record);

            if (!record.suitePath().equals(currentSuite)) {
                if (record.suitePath().depth() <= currentSuite.depth() && currentSuite.isNamed()) {
                    renderer.suiteEnd(currentSuite);
                }
                renderer.suiteBegin(record.suitePath());
                currentSuite = record.suitePath();
            }

            assertionsPassed += result.successCount();
            assertionsFailed += result.failures().size();
            if (result.passed()) {
                testsPassed++;
            } else {
                testsFailed++;
            }
            log.debug("Test '{}' {}", record.name(), result.status());

            renderer.testResult(record.name(), result.successCount(), result.failures(), result.error());
        }
        renderer.summary(testsPassed, testsFailed, assertionsPassed, assertionsFailed);

        var hookResult = plugins.runSummaries();
        var exitCode = hookResult != 0 ? hookResult : testsFailed;
        return new RunResult(testsPassed, testsFailed, assertionsPassed, assertionsFailed, exitCode);
    }

    private ExecutionResult execute(TestRecord record) {
        ledger.reset();
        plugins.activate(record.pluginData());
        MdcContext.setTest(record.suitePath(), record.name());
        try {
            return ProtectedCall.execute(record.body(), ledger);
        } finally {
            MdcContext.clear();
            plugins.deactivate();
            // an interrupt raised by one body must not fail the next
            if (Thread.interrupted()) {
                log.debug("Cleared interrupt left by test '{}'", record.name());
            }
        }
    }
}
