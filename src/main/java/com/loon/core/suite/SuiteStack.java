package com.loon.core.suite;

import com.loon.core.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * Tracks the nesting of named suites while tests are being registered.
 * <p>
 * Paths are allocated from a monotonically increasing id sequence and are never
 * mutated, so a test record may hold on to the path that was current when it
 * was added.
 */
public class SuiteStack {

    private static final Logger log = LoggerFactory.getLogger(SuiteStack.class);

    private final Deque<SuitePath> stack = new ArrayDeque<>();
    private long nextId = 1;

    /**
     * Enters a suite nested in the current one.
     *
     * @param label the suite name
     * @return the new current path
     */
    public SuitePath push(String label) {
        var labels = new ArrayList<>(current().labels());
        labels.add(label);
        var path = new SuitePath(nextId++, labels);
        stack.push(path);
        log.debug("Entered suite {} (id {})", labels, path.id());
        return path;
    }

    /**
     * Leaves the innermost suite.
     *
     * @throws ConfigurationException if no suite is open
     */
    public SuitePath pop() {
        if (stack.isEmpty()) {
            throw new ConfigurationException("unmatched suite boundaries: stopSuite() called with no open suite");
        }
        var left = stack.pop();
        log.debug("Left suite {}", left.labels());
        return left;
    }

    /**
     * Same as {@link #pop()}; the label is only there so call sites read symmetrically.
     */
    public SuitePath pop(String label) {
        return pop();
    }

    /**
     * Runs {@code definitions} inside a suite named {@code label}.
     */
    public void within(String label, Runnable definitions) {
        push(label);
        definitions.run();
        pop();
    }

    public SuitePath current() {
        return stack.isEmpty() ? SuitePath.ROOT : stack.peek();
    }

    public int depth() {
        return stack.size();
    }

    /**
     * Returns to the root suite. The id sequence keeps counting so paths handed
     * out before the reset never collide with later ones.
     */
    public void reset() {
        stack.clear();
    }
}
