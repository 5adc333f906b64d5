package com.loon.core.config;

import com.loon.core.plugin.ArgumentCatalog;
import com.loon.core.render.OutputFormat;

import java.util.Map;

/**
 * The harness's own options for one run, read from a verified options map.
 * Plugin options stay in {@link #all()}.
 */
public record RunOptions(OutputFormat output, boolean uncolored, boolean terse, boolean times, boolean help,
                         Map<String, Object> all) {

    public static RunOptions from(Map<String, Object> options) {
        return new RunOptions(
                OutputFormat.fromOptionValue(String.valueOf(options.get(ArgumentCatalog.OUTPUT))),
                flag(options, ArgumentCatalog.UNCOLORED),
                flag(options, ArgumentCatalog.TERSE),
                flag(options, ArgumentCatalog.TIMES),
                flag(options, ArgumentCatalog.HELP),
                Map.copyOf(options));
    }

    private static boolean flag(Map<String, Object> options, String name) {
        var value = options.get(name);
        return value instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(value));
    }
}
