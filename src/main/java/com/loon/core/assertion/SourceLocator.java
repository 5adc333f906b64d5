package com.loon.core.assertion;

import com.loon.core.format.Palette;

import java.lang.StackWalker.Option;
import java.lang.StackWalker.StackFrame;
import java.util.Optional;

/**
 * Finds the test code that called a failing assertion.
 */
@AssertionHelper
final class SourceLocator {

    private static final StackWalker WALKER = StackWalker.getInstance(Option.RETAIN_CLASS_REFERENCE);

    private SourceLocator() {}

    /**
     * @return {@code File.java:line: } for the first frame outside {@link AssertionHelper} classes
     */
    static String locate(Palette palette) {
        return callerFrame()
                .map(frame -> palette.file(fileName(frame)) + ":" + palette.line(frame.getLineNumber()) + ": ")
                .orElse(palette.file("unknown") + ": ");
    }

    private static Optional<StackFrame> callerFrame() {
        return WALKER.walk(frames -> frames
                .filter(frame -> !frame.getDeclaringClass().isAnnotationPresent(AssertionHelper.class))
                .findFirst());
    }

    private static String fileName(StackFrame frame) {
        var file = frame.getFileName();
        return file != null ? file : frame.getClassName();
    }
}
