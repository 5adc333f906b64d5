package com.loon.core.render;

import com.loon.core.engine.ErrorRecord;
import com.loon.core.suite.SuitePath;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * JUnit-style XML report, as consumed by CI servers.
 * <p>
 * Results are buffered per suite in the order the suites are first seen and
 * written in one go by {@link #summary}; suites without test cases are left out.
 */
public class JUnitXmlRenderer implements ReportRenderer {

    static final String DEFAULT_SUITE = "default";
    static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    private final PrintStream out;
    private final boolean times;
    private final LongSupplier nanoClock;
    private final String runtimeVersion;

    private final Map<Long, SuiteBucket> suites = new LinkedHashMap<>();
    private SuiteBucket current;
    private int successAssertions;
    private int failedAssertions;
    private int erroredTests;
    private long startNanos;

    public JUnitXmlRenderer(PrintStream out, boolean times) {
        this(out, times, System::nanoTime, System.getProperty("java.version"));
    }

    /**
     * @param nanoClock      source of the elapsed time written when {@code times} is set
     * @param runtimeVersion value of the "Java Version" property in every suite
     */
    public JUnitXmlRenderer(PrintStream out, boolean times, LongSupplier nanoClock, String runtimeVersion) {
        this.out = out;
        this.times = times;
        this.nanoClock = nanoClock;
        this.runtimeVersion = runtimeVersion;
    }

    @Override
    public void begin() {
        line(XML_DECLARATION);
        startNanos = nanoClock.getAsLong();
    }

    @Override
    public void suiteBegin(SuitePath path) {
        current = suites.computeIfAbsent(path.id(), id -> new SuiteBucket(path));
    }

    @Override
    public void suiteEnd(SuitePath path) {
        var ended = suites.get(path.id());
        if (ended == null) {
            throw new IllegalStateException("Suite " + path.labels() + " ended without having begun");
        }
        current = ended;
    }

    @Override
    public void testResult(String name, int successCount, List<String> failures, ErrorRecord error) {
        if (current == null) {
            throw new IllegalStateException("Test '" + name + "' reported outside of any suite");
        }
        successAssertions += successCount;
        failedAssertions += failures.size();
        if (error != null) {
            erroredTests++;
        }
        current.cases.add(new CaseResult(name, successCount + failures.size(), failures, error));
    }

    @Override
    public void summary(int testsPassed, int testsFailed, int assertionsPassed, int assertionsFailed) {
        var time = times
                ? " time=\"%s\"".formatted(String.format(Locale.ROOT, "%.3f", (nanoClock.getAsLong() - startNanos) / 1e9))
                : "";
        line("<testsuites tests=\"%d\" failures=\"%d\" errors=\"%d\" assertions=\"%d\" skipped=\"0\"%s>"
                .formatted(testsPassed + testsFailed, testsFailed, erroredTests,
                        assertionsPassed + assertionsFailed, time));

        for (var suite : suites.values()) {
            if (suite.cases.isEmpty()) {
                continue;
            }
            var suiteName = attribute(suite.name());
            line("  <testsuite name=\"%s\">".formatted(suiteName));
            line("    <properties><property name=\"Java Version\" value=\"%s\" /></properties>"
                    .formatted(attribute(runtimeVersion)));
            for (var result : suite.cases) {
                writeCase(result, suiteName);
            }
            line("  </testsuite>");
        }

        line("</testsuites>");
        out.flush();
    }

    private void writeCase(CaseResult result, String suiteName) {
        var opening = "    <testcase name=\"%s\" classname=\"%s\" assertions=\"%d\""
                .formatted(attribute(result.name()), suiteName, result.assertions());

        if (result.error() != null) {
            line(opening + ">");
            line("      <error message=\"%s\">".formatted(attribute(result.error().message())));
            line("        <![CDATA[%s]]>".formatted(cdata(result.error().trace())));
            line("      </error>");
            line("    </testcase>");
        } else if (!result.failures().isEmpty()) {
            line(opening + ">");
            for (var failure : result.failures()) {
                line("      <failure message=\"%s\"></failure>".formatted(attribute(failure)));
            }
            line("    </testcase>");
        } else {
            line(opening + " />");
        }
    }

    private void line(String text) {
        out.print(text);
        out.print('\n');
    }

    /**
     * Escapes text for a double-quoted attribute; newlines become {@code &#10;}
     * so multi-line messages survive attribute normalization.
     */
    static String attribute(String text) {
        if (text == null) {
            return "";
        }
        var escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\n' -> escaped.append("&#10;");
                case '\r' -> escaped.append("&#13;");
                case '\t' -> escaped.append("&#9;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    static String cdata(String text) {
        return text == null ? "" : text.replace("]]>", "]]]]><![CDATA[>");
    }

    private static final class SuiteBucket {
        private final SuitePath path;
        private final List<CaseResult> cases = new ArrayList<>();

        SuiteBucket(SuitePath path) {
            this.path = path;
        }

        String name() {
            return path.depth() == 0 ? DEFAULT_SUITE : path.join(" > ");
        }
    }

    private record CaseResult(String name, int assertions, List<String> failures, ErrorRecord error) {}
}
