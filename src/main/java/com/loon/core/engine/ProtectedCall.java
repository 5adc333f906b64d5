package com.loon.core.engine;

import com.loon.core.assertion.AssertionLedger;
import com.loon.core.registry.TestBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Executes a test body so that nothing it raises escapes, and turns the body's
 * outcome into an {@link ExecutionResult}.
 */
public final class ProtectedCall {

    private static final Logger log = LoggerFactory.getLogger(ProtectedCall.class);

    private ProtectedCall() {}

    /**
     * Runs {@code body}; assertions it makes must already be wired to {@code ledger}.
     * An {@link InterruptedException} is reported like any other error and the
     * interrupt is not re-asserted; the caller owns the thread between bodies.
     */
    public static ExecutionResult execute(TestBody body, AssertionLedger ledger) {
        ErrorRecord error = null;
        try {
            body.run();
        } catch (Throwable t) {
            if (isFatal(t)) {
                throw (Error) t;
            }
            log.debug("Test body raised {}", t.toString());
            error = describe(t);
        }
        return ExecutionResult.of(ledger, error);
    }

    /**
     * Errors the JVM cannot recover from. A stack overflow only loses the test
     * that caused it.
     */
    public static boolean isFatal(Throwable t) {
        return t instanceof VirtualMachineError && !(t instanceof StackOverflowError);
    }

    static ErrorRecord describe(Throwable t) {
        var frames = t.getStackTrace();
        var message = frames.length > 0
                ? location(frames[0]) + ": " + t
                : t.toString();
        var trace = new StringBuilder();
        appendFrames(trace, t);
        appendCauses(trace, t);
        return new ErrorRecord(message, trace.toString());
    }

    private static String location(StackTraceElement frame) {
        var file = frame.getFileName() != null ? frame.getFileName() : frame.getClassName();
        return frame.getLineNumber() >= 0 ? file + ":" + frame.getLineNumber() : file;
    }

    private static void appendCauses(StringBuilder trace, Throwable t) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.add(t);
        for (var cause = t.getCause(); cause != null && seen.add(cause); cause = cause.getCause()) {
            newline(trace).append("Caused by: ").append(cause);
            appendFrames(trace, cause);
        }
    }

    // Frames from this class downward belong to the harness, not the test.
    private static void appendFrames(StringBuilder trace, Throwable t) {
        for (var frame : t.getStackTrace()) {
            if (frame.getClassName().equals(ProtectedCall.class.getName())) {
                break;
            }
            newline(trace).append("at ").append(frame);
        }
    }

    private static StringBuilder newline(StringBuilder trace) {
        return trace.isEmpty() ? trace : trace.append('\n');
    }
}
