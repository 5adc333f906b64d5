package com.loon.core.suite;

import java.util.List;

/**
 * Ordered labels of the suites enclosing a test at registration time.
 * <p>
 * Every push onto the {@link SuiteStack} allocates a new path with a fresh id,
 * so two paths with identical labels are still different suites. Equality is
 * id equality.
 */
public record SuitePath(long id, List<String> labels) {

    /** Tests registered outside any named suite. */
    public static final SuitePath ROOT = new SuitePath(0, List.of());

    /** Marker for "no suite seen yet" during a run; never attached to a test. */
    public static final SuitePath NONE = new SuitePath(-1, List.of());

    public SuitePath {
        labels = List.copyOf(labels);
    }

    public int depth() {
        return labels.size();
    }

    public boolean isRoot() {
        return id == ROOT.id;
    }

    /**
     * True for paths created by a suite push, false for {@link #ROOT} and {@link #NONE}.
     */
    public boolean isNamed() {
        return id > 0;
    }

    public String join(String separator) {
        return String.join(separator, labels);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SuitePath other && other.id == id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }
}
