package com.loon.core.render;

import com.loon.core.engine.ErrorRecord;
import com.loon.core.format.Palette;
import com.loon.core.suite.SuitePath;

import java.io.PrintStream;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Human-readable report for an interactive terminal.
 * <p>
 * Passing tests are listed one per line; a failing test is set off by a blank
 * line before and after. In terse mode passing tests are not listed and a
 * suite's header is only printed once one of its tests fails.
 */
public class TerminalRenderer implements ReportRenderer {

    static final String BREADCRUMB_SEPARATOR = " > ";
    static final String DEFAULT_SUITE = "default suite";
    static final String RULE = "--------------------------";

    private static final Pattern LOCATED_MESSAGE = Pattern.compile("([^:]+):(\\d+):(.*)", Pattern.DOTALL);

    private final PrintStream out;
    private final Palette palette;
    private final boolean terse;

    private boolean blankLinePending;
    private SuitePath terseSuite = SuitePath.ROOT;
    private boolean terseSuiteWritten;
    private boolean terseAnyWritten;

    public TerminalRenderer(PrintStream out, Palette palette, boolean terse) {
        this.out = out;
        this.palette = palette;
        this.terse = terse;
    }

    @Override
    public void suiteBegin(SuitePath path) {
        if (terse) {
            terseSuite = path;
            terseSuiteWritten = false;
        } else {
            writeBreadcrumb(path);
        }
    }

    @Override
    public void testResult(String name, int successCount, List<String> failures, ErrorRecord error) {
        blankLineIfPending();

        if (error == null && failures.isEmpty()) {
            if (!terse) {
                var summary = successCount > 0
                        ? palette.pass(successCount) + " pass"
                        : palette.warn("no assertions");
                line(palette.pass("ok") + " " + name + " [" + summary + "]");
            }
            return;
        }

        if (terse && !terseSuiteWritten) {
            writeBreadcrumb(terseSuite);
            terseSuiteWritten = true;
            terseAnyWritten = true;
        }

        var title = palette.fail("not ok") + " " + name;
        if (error != null) {
            line(title);
            writeError(error);
        } else {
            line(title + " [" + palette.fail(failures.size()) + " fail, " + palette.pass(successCount) + " pass]");
            for (int i = 0; i < failures.size(); i++) {
                line("  (" + palette.fail(i + 1) + ") " + indent(failures.get(i)));
            }
        }
        blankLinePending = true;
    }

    @Override
    public void summary(int testsPassed, int testsFailed, int assertionsPassed, int assertionsFailed) {
        if (!terse || terseAnyWritten) {
            line(RULE);
        }

        if (testsFailed > 0) {
            line(palette.pass("pass") + ": " + palette.pass(testsPassed) + " tests, "
                    + palette.pass(assertionsPassed) + " assertions");
            line(palette.fail("fail") + ": " + palette.fail(testsFailed) + " tests, "
                    + palette.fail(assertionsFailed) + " assertions");
        } else {
            line(palette.pass("all tests pass") + ": " + palette.pass(testsPassed));
            line("assertions: " + assertionsPassed);
        }
        out.flush();
    }

    private void writeBreadcrumb(SuitePath path) {
        blankLineIfPending();
        if (path.depth() == 0) {
            line(palette.suite(DEFAULT_SUITE));
        } else {
            var crumbs = path.labels().stream().map(palette::suite).toList();
            line(String.join(BREADCRUMB_SEPARATOR, crumbs));
        }
    }

    private void writeError(ErrorRecord error) {
        var intro = "  (" + palette.fail("ERROR") + ")";
        var message = error.message();
        var located = LOCATED_MESSAGE.matcher(message);

        if (located.find()) {
            line(intro + " " + palette.file(located.group(1)) + ":" + palette.line(located.group(2))
                    + ":" + indent(located.group(3)));
        } else {
            line(intro + " " + indent(message));
        }

        if (error.trace() != null && !error.trace().isEmpty()) {
            line("    " + indent(error.trace()));
        }
    }

    private void blankLineIfPending() {
        if (blankLinePending) {
            line("");
            blankLinePending = false;
        }
    }

    private void line(String text) {
        out.print(text);
        out.print('\n');
    }

    /**
     * Indents continuation lines by two spaces; the first line is left alone.
     */
    static String indent(String text) {
        return text.replace("\n", "\n  ");
    }
}
