package com.loon.core.session;

import com.loon.core.assertion.Assertion;
import com.loon.core.assertion.AssertionCheck;
import com.loon.core.assertion.AssertionFactory;
import com.loon.core.assertion.AssertionLedger;
import com.loon.core.assertion.Assertions;
import com.loon.core.assertion.FailureMessage;
import com.loon.core.config.ConfigurationException;
import com.loon.core.config.OptionsVerifier;
import com.loon.core.config.RunOptions;
import com.loon.core.engine.RunResult;
import com.loon.core.engine.TestRunner;
import com.loon.core.format.Palette;
import com.loon.core.format.ValueFormatter;
import com.loon.core.plugin.ArgumentCatalog;
import com.loon.core.plugin.PluginRegistry;
import com.loon.core.registry.TestBody;
import com.loon.core.registry.TestRecord;
import com.loon.core.registry.TestRegistry;
import com.loon.core.registry.TestUnit;
import com.loon.core.render.JUnitXmlRenderer;
import com.loon.core.render.OutputFormat;
import com.loon.core.render.ReportRenderer;
import com.loon.core.render.TerminalRenderer;
import com.loon.core.suite.SuitePath;
import com.loon.core.suite.SuiteStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Everything needed to define and run one batch of tests: suites, registered
 * tests, plugins and the built-in assertions.
 * <p>
 * A run always ends with {@link #reset()}, whether it completed, failed on its
 * options or only printed help, so the next batch starts from a clean slate.
 */
public class LoonSession {

    private static final Logger log = LoggerFactory.getLogger(LoonSession.class);

    /** User default key holding the title printed above the help text. */
    public static final String HELP_TITLE = "helpTitle";

    private final Function<String, String> environment;
    private final PrintStream fixedOut;

    private final SuiteStack suites = new SuiteStack();
    private final TestRegistry registry = new TestRegistry();
    private final AssertionLedger ledger = new AssertionLedger();
    private final ValueFormatter formatter = new ValueFormatter();
    private final OptionsVerifier verifier = new OptionsVerifier();
    private final PluginRegistry plugins;
    private final AssertionFactory assertionFactory;
    private final Assertions assertions;
    private final TestRunner runner;

    private Palette palette;
    private boolean grouping;

    public LoonSession() {
        this(System::getenv, null);
    }

    public LoonSession(PrintStream out) {
        this(System::getenv, out);
    }

    /**
     * @param environment environment variable lookup, consulted for {@code NO_COLOR}
     * @param out         report destination; null to use whatever {@code System.out} is when written to
     */
    public LoonSession(Function<String, String> environment, PrintStream out) {
        this.environment = environment;
        this.fixedOut = out;
        this.palette = defaultPalette();

        Supplier<Palette> currentPalette = this::palette;
        this.plugins = new PluginRegistry(() -> ArgumentCatalog.base(environment), this::out, currentPalette);
        this.assertionFactory = new AssertionFactory(ledger, currentPalette, formatter);
        this.assertions = new Assertions(assertionFactory, currentPalette, formatter);
        this.runner = new TestRunner(ledger, plugins);
    }

    // -- Definition -------------------------------------------------------------

    /**
     * Registers a test in the current suite, together with the custom data of
     * the last plugin configuration.
     */
    public TestRecord add(String name, TestBody body) {
        return registry.add(name, body, suites.current(), plugins.getCustomData());
    }

    public SuitePath startSuite(String label) {
        return suites.push(label);
    }

    public SuitePath stopSuite() {
        return suites.pop();
    }

    /**
     * Same as {@link #stopSuite()}; the label only documents which suite is closed.
     */
    public SuitePath stopSuite(String label) {
        return suites.pop(label);
    }

    /**
     * Registers the tests defined by {@code definitions} inside a suite named {@code label}.
     */
    public void suite(String label, Runnable definitions) {
        suites.within(label, definitions);
    }

    /**
     * Defines the tests of several units without running them; a {@code run}
     * made by a unit only returns to the root suite. Call {@code run} afterwards.
     */
    public void grouped(TestUnit... units) {
        var wasGrouping = grouping;
        grouping = true;
        try {
            for (var unit : units) {
                log.debug("Defining tests of {}", unit.getClass().getName());
                unit.define(this);
            }
        } finally {
            grouping = wasGrouping;
        }
    }

    /**
     * Loads units by fully qualified class name, then groups them in that order.
     *
     * @throws ConfigurationException if a class is missing, is not a {@link TestUnit}
     *                                or has no accessible no-argument constructor
     */
    public void grouped(String... classNames) {
        var units = new ArrayList<TestUnit>();
        for (var className : classNames) {
            units.add(loadUnit(className));
        }
        grouped(units.toArray(TestUnit[]::new));
    }

    private static TestUnit loadUnit(String className) {
        try {
            var type = Class.forName(className);
            if (!TestUnit.class.isAssignableFrom(type)) {
                throw new ConfigurationException("'" + className + "' is not a " + TestUnit.class.getSimpleName());
            }
            return (TestUnit) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            log.error("Failed to load test unit {}", className, e);
            throw new ConfigurationException("cannot load test unit '" + className + "': " + e, e);
        }
    }

    // -- Running ----------------------------------------------------------------

    /**
     * Runs with command line style options, e.g. {@code run("--output=junit", "-t")}.
     */
    public RunResult run(String... arguments) {
        return run(Arrays.asList(arguments), Map.of());
    }

    /**
     * @param userDefaults option defaults that win over the harness's own;
     *                     {@value #HELP_TITLE} sets the help title
     */
    public RunResult run(List<String> arguments, Map<String, ?> userDefaults) {
        return execute(() -> verifier.verify(arguments, plugins.catalog(), userDefaults), userDefaults);
    }

    /**
     * Runs with an options map, e.g. {@code run(Map.of("output", "junit"))}.
     */
    public RunResult run(Map<String, ?> options) {
        return run(options, Map.of());
    }

    public RunResult run(Map<String, ?> options, Map<String, ?> userDefaults) {
        return execute(() -> verifier.verify(options, plugins.catalog(), userDefaults), userDefaults);
    }

    private RunResult execute(Supplier<Map<String, Object>> verification, Map<String, ?> userDefaults) {
        if (grouping) {
            suites.reset();
            return RunResult.empty();
        }
        try {
            var options = RunOptions.from(verification.get());
            var out = out();

            if (options.help()) {
                out.print(verifier.describe(plugins.catalog(), helpTitle(userDefaults), options.uncolored()));
                out.flush();
                return RunResult.empty();
            }
            if (suites.depth() > 0) {
                log.warn("Running with {} suite(s) still open", suites.depth());
            }

            palette = options.output() == OutputFormat.JUNIT ? Palette.uncolored() : Palette.of(!options.uncolored());
            var result = runner.run(registry.records(), renderer(options, out));
            log.debug("Run finished: {}", result);
            return result;
        } finally {
            reset();
        }
    }

    private ReportRenderer renderer(RunOptions options, PrintStream out) {
        return switch (options.output()) {
            case TERMINAL -> new TerminalRenderer(out, palette, options.terse());
            case JUNIT -> new JUnitXmlRenderer(out, options.times());
        };
    }

    private static String helpTitle(Map<String, ?> userDefaults) {
        var title = userDefaults != null ? userDefaults.get(HELP_TITLE) : null;
        return title != null ? title.toString() : null;
    }

    /**
     * Forgets every test, suite and plugin registration.
     */
    public void reset() {
        registry.clear();
        suites.reset();
        plugins.reset();
        ledger.reset();
        palette = defaultPalette();
    }

    private Palette defaultPalette() {
        return Palette.of(environment.apply("NO_COLOR") == null);
    }

    // -- Collaborators ----------------------------------------------------------

    public Assertions assertions() {
        return assertions;
    }

    /**
     * Creates an assertion recording into the running test, for plugins and
     * custom assertion families.
     */
    public Assertion createAssertion(AssertionCheck check, FailureMessage message) {
        return assertionFactory.create(check, message);
    }

    public PluginRegistry plugins() {
        return plugins;
    }

    public ValueFormatter formatter() {
        return formatter;
    }

    public Palette palette() {
        return palette;
    }

    public PrintStream out() {
        return fixedOut != null ? fixedOut : System.out;
    }

    public List<TestRecord> tests() {
        return registry.records();
    }

    public SuitePath currentSuite() {
        return suites.current();
    }

    public boolean isGrouping() {
        return grouping;
    }
}
