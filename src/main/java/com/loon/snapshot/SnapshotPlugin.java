package com.loon.snapshot;

import com.loon.core.assertion.Assertion;
import com.loon.core.assertion.AssertionHelper;
import com.loon.core.config.ConfigurationException;
import com.loon.core.config.OptionsVerifier;
import com.loon.core.plugin.ArgumentCatalog;
import com.loon.core.plugin.ArgumentSpec;
import com.loon.core.plugin.PluginRegistration;
import com.loon.core.registry.TestBody;
import com.loon.core.session.LoonSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Approval testing: compares text produced by a test with a snapshot file saved
 * by an earlier run.
 * <p>
 * Snapshots live in {@code <dir>/<name>.snap}. A missing file fails as a new
 * test, different contents fail with a diff. With {@code --update} the run ends
 * by offering to save every new and changed snapshot.
 *
 * <pre>{@code
 * var snapshots = new SnapshotPlugin(session);
 * snapshots.config(List.of(args), Map.of("dir", "src/test/snapshots"));
 * session.add("greeting", () -> snapshots.compare("greeting", greet("world")));
 * session.run(args);
 * }</pre>
 */
@AssertionHelper
public class SnapshotPlugin {

    private static final Logger log = LoggerFactory.getLogger(SnapshotPlugin.class);

    public static final String PLUGIN_NAME = "snapshot";
    static final String DIR = "dir";
    static final String UPDATE = "update";
    static final String SEPARATOR = "==================================================";

    private final LoonSession session;
    private final SnapshotDiff differ;
    private final BufferedReader input;
    private final OptionsVerifier verifier = new OptionsVerifier();

    private final Assertion compare;

    private final Set<String> testNames = new HashSet<>();
    private final List<Snapshot> passed = new ArrayList<>();
    private final List<Snapshot> failed = new ArrayList<>();
    private final List<Snapshot> fresh = new ArrayList<>();
    private Snapshot lastComparison;

    public SnapshotPlugin(LoonSession session) {
        this(session, new SnapshotDiff(), System.in);
    }

    /**
     * @param input answers to the update prompts
     */
    public SnapshotPlugin(LoonSession session, SnapshotDiff differ, InputStream input) {
        this.session = session;
        this.differ = differ;
        this.input = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        this.compare = session.createAssertion(
                args -> compareWithFile((String) args[0], (String) args[1]),
                (location, args) -> failureMessage(location, (String) args[0]));
    }

    // -- Configuration ----------------------------------------------------------

    /**
     * Configures from command line arguments; options that are not the
     * plugin's own are ignored.
     *
     * @param defaults values used when an option is not given, such as {@code dir}
     */
    public void config(List<String> arguments, Map<String, ?> defaults) {
        apply(verifier.verify(arguments, catalog(), defaults, true));
    }

    public void config(Map<String, ?> options) {
        apply(verifier.verify(options, catalog(), Map.of()));
    }

    private void apply(Map<String, Object> options) {
        var dir = options.get(DIR);
        if (dir == null || dir.toString().isBlank()) {
            throw new ConfigurationException("you failed to configure the output directory.\n"
                    + "pass the --dir argument at the terminal, or \"dir\" element in the config.");
        }
        var directory = Path.of(dir.toString());
        var update = Boolean.TRUE.equals(options.get(UPDATE));
        log.debug("Snapshot directory {}, update {}", directory, update);

        var plugins = session.plugins();
        plugins.config(PluginRegistration.builder(PLUGIN_NAME)
                .argument(directoryArgument())
                .argument(updateArgument(), false)
                .customData(directory)
                .build());

        plugins.summary("snapshot: print new tests", this::printNewTests);
        if (update) {
            plugins.summary("snapshot: update", this::runUpdate);
        }
        plugins.summary("snapshot: reset self", () -> {
            reset();
            return 0;
        });
    }

    private static ArgumentCatalog catalog() {
        var catalog = new ArgumentCatalog();
        catalog.offer(directoryArgument());
        catalog.offer(updateArgument());
        catalog.offerDefault(UPDATE, false);
        return catalog;
    }

    private static ArgumentSpec directoryArgument() {
        return ArgumentSpec.text(DIR, "directory holding the snapshot files");
    }

    private static ArgumentSpec updateArgument() {
        return ArgumentSpec.flag(UPDATE, "offer to save new and changed snapshots after the run");
    }

    // -- Assertions -------------------------------------------------------------

    /**
     * Passes when {@code actual} equals the saved snapshot called {@code name}.
     */
    public void compare(String name, Object actual) {
        compare(name, actual, null);
    }

    /**
     * @param transformer applied to {@code actual} before comparing, e.g. to mask machine specific paths
     */
    public void compare(String name, Object actual, UnaryOperator<String> transformer) {
        compare.check(name, transform(String.valueOf(actual), transformer));
    }

    /**
     * Passes when everything {@code body} prints to {@code System.out} equals the
     * saved snapshot called {@code name}.
     */
    public void output(String name, TestBody body) throws Exception {
        output(name, body, null);
    }

    public void output(String name, TestBody body, UnaryOperator<String> transformer) throws Exception {
        compare.check(name, transform(captureOutput(body), transformer));
    }

    private static String captureOutput(TestBody body) throws Exception {
        var original = System.out;
        var buffer = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            body.run();
        } finally {
            System.out.flush();
            System.setOut(original);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static String transform(String actual, UnaryOperator<String> transformer) {
        return transformer != null ? transformer.apply(actual) : actual;
    }

    private boolean compareWithFile(String name, String actual) {
        var directory = session.plugins().customData(Path.class)
                .orElseThrow(() -> new ConfigurationException("no snapshot directory set"));

        if (!testNames.add(directory + " " + name)) {
            lastComparison = new Snapshot(Outcome.DUPLICATE, name, null, actual);
            return false;
        }

        var path = directory.resolve(name + ".snap");

        if (!Files.exists(path)) {
            lastComparison = new Snapshot(Outcome.NEW, name, path, actual);
            fresh.add(lastComparison);
            return false;
        }

        String saved;
        try {
            saved = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read snapshot " + path, e);
        }

        if (saved.equals(actual)) {
            lastComparison = new Snapshot(Outcome.PASSED, name, path, actual);
            passed.add(lastComparison);
            return true;
        }
        lastComparison = new Snapshot(Outcome.FAILED, name, path, actual);
        failed.add(lastComparison);
        return false;
    }

    private String failureMessage(String location, String name) {
        var colors = session.palette();
        return switch (lastComparison.outcome()) {
            case NEW -> location + "new test: '" + name + "'";
            case DUPLICATE -> location + colors.warn("warning") + ": duplicate snapshot name!\n"
                    + "only one of these will run: '" + name + "'";
            default -> location + "\n" + differ.diff(lastComparison.path(), lastComparison.actual());
        };
    }

    // -- Summary hooks ----------------------------------------------------------

    private int printNewTests() {
        if (!fresh.isEmpty()) {
            var colors = session.palette();
            session.out().print("%s: %s tests\n".formatted(colors.fail("new snapshots"), colors.fail(fresh.size())));
        }
        return 0;
    }

    /**
     * Asks whether to save each new and changed snapshot.
     *
     * @return 1 when the user declines, which ends the run with that result
     */
    int runUpdate() {
        var result = update();
        if (result != 0) {
            // later hooks, including the reset, are skipped
            reset();
        }
        return result;
    }

    private int update() {
        var out = session.out();
        var colors = session.palette();
        var yes = colors.pass("Y");
        var no = colors.fail("N");
        var actionRequired = !failed.isEmpty() || !fresh.isEmpty();

        if (actionRequired) {
            out.print("snapshot actions required.\n");
            if (!failed.isEmpty() && !fresh.isEmpty()) {
                out.print("%d %s tests and %d %s tests. proceed? %s/%s "
                        .formatted(fresh.size(), colors.pass("new"), failed.size(), colors.fail("failed"), yes, no));
            } else if (!failed.isEmpty()) {
                out.print("%d %s tests. proceed? %s/%s ".formatted(failed.size(), colors.fail("failed"), yes, no));
            } else {
                out.print("%d %s tests. proceed? %s/%s ".formatted(fresh.size(), colors.pass("new"), yes, no));
            }
            out.flush();

            var answer = readAnswer();
            if (answer == null || answer.matches("(?s).*[nN].*")) {
                out.print("ok then, exiting...\n");
                return 1;
            }
        }

        var beginDivide = colors.msg(">>> begin new snapshot");
        var endDivide = colors.msg("<<< end new snapshot");
        for (var snapshot : fresh) {
            out.print(SEPARATOR + "\n");
            out.print(beginDivide + "\n" + snapshot.actual() + endDivide + "\n");
            out.print("\nnew test: %s.\napprove the snapshot now? %s/%s ".formatted(colors.file(snapshot.name()), yes, no));
            out.flush();
            if (!confirmAndWrite(readAnswer(), snapshot)) {
                return 1;
            }
        }

        for (var snapshot : failed) {
            out.print(SEPARATOR + "\n");
            out.print("%s\n\ntest has changes: %s\naccept changes? %s/%s ".formatted(
                    differ.diff(snapshot.path(), snapshot.actual()), colors.file(snapshot.name()), yes, no));
            out.flush();
            if (!confirmAndWrite(readAnswer(), snapshot)) {
                return 1;
            }
        }

        if (actionRequired) {
            out.print(colors.pass("done") + "! all files up-to-date.\n");
        }
        return 0;
    }

    private boolean confirmAndWrite(String answer, Snapshot snapshot) {
        var out = session.out();
        if (answer == null || !answer.matches("(?s).*[yYnN].*")) {
            out.print("could not understand your response; exiting...\n");
            return false;
        }
        if (answer.matches("(?s).*[nN].*")) {
            out.print("looks like you have work to do; exiting...\n");
            return false;
        }

        try {
            Files.createDirectories(snapshot.path().toAbsolutePath().getParent());
            Files.writeString(snapshot.path(), snapshot.actual(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Could not write snapshot {}", snapshot.path(), e);
            throw new UncheckedIOException("could not open path for writing: " + snapshot.path(), e);
        }
        out.print(session.palette().pass("accepted") + ": " + session.palette().file(snapshot.path()) + "\n");
        return true;
    }

    private String readAnswer() {
        try {
            return input.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read answer", e);
        }
    }

    // -- State ------------------------------------------------------------------

    public List<String> newSnapshots() {
        return fresh.stream().map(Snapshot::name).toList();
    }

    public List<String> changedSnapshots() {
        return failed.stream().map(Snapshot::name).toList();
    }

    public int passedCount() {
        return passed.size();
    }

    void reset() {
        testNames.clear();
        passed.clear();
        failed.clear();
        fresh.clear();
        lastComparison = null;
    }

    enum Outcome {
        PASSED,
        FAILED,
        NEW,
        DUPLICATE
    }

    record Snapshot(Outcome outcome, String name, Path path, String actual) {}
}
