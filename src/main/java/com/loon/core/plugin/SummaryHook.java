package com.loon.core.plugin;

/**
 * Runs after the report summary has been written.
 * <p>
 * Hooks are expected to reset the plugin's own state as their last action.
 */
@FunctionalInterface
public interface SummaryHook {

    /**
     * @return 0 to let the remaining hooks run; any other value stops the hook
     *         chain and becomes the result of the run
     */
    int summarize();
}
