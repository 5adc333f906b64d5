package com.loon.core.plugin;

import com.loon.core.render.OutputFormat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * The options a run accepts: the harness's own plus those contributed by
 * plugins, with their defaults and single-letter abbreviations.
 */
public class ArgumentCatalog {

    public static final String OUTPUT = "output";
    public static final String UNCOLORED = "uncolored";
    public static final String TERSE = "terse";
    public static final String TIMES = "times";
    public static final String HELP = "help";

    private final Map<String, ArgumentSpec> arguments = new LinkedHashMap<>();
    private final Map<String, Object> defaults = new LinkedHashMap<>();
    private final Map<String, String> abbreviations = new LinkedHashMap<>();

    /**
     * The harness's own options.
     *
     * @param environment environment variable lookup; {@code NO_COLOR} turns colors off by default
     */
    public static ArgumentCatalog base(Function<String, String> environment) {
        var catalog = new ArgumentCatalog();
        catalog.offer(ArgumentSpec.choice(OUTPUT, "choose the output format", OutputFormat.optionValues()));
        catalog.offer(ArgumentSpec.flag(UNCOLORED, "disable colors"));
        catalog.offer(ArgumentSpec.flag(TERSE, "don't print passing tests"));
        catalog.offer(ArgumentSpec.flag(TIMES, "record times in junit output"));
        catalog.offer(ArgumentSpec.flag(HELP, "print this message"));

        catalog.defaults.put(UNCOLORED, environment.apply("NO_COLOR") != null);
        catalog.defaults.put(TIMES, true);
        catalog.defaults.put(HELP, false);
        catalog.defaults.put(OUTPUT, OutputFormat.TERMINAL.optionValue());

        catalog.offerAbbreviation("c", UNCOLORED);
        catalog.offerAbbreviation("t", TERSE);
        catalog.offerAbbreviation("h", HELP);
        catalog.offerAbbreviation("o", OUTPUT);
        return catalog;
    }

    /**
     * Adds an option unless one with the same name exists.
     *
     * @return false if the name was already taken; the existing option is kept
     */
    public boolean offer(ArgumentSpec spec) {
        return arguments.putIfAbsent(spec.name(), spec) == null;
    }

    public void offerDefault(String name, Object value) {
        defaults.put(name, value);
    }

    /**
     * Maps {@code -abbreviation} to {@code --name} unless the abbreviation is taken.
     *
     * @return the option that already owns the abbreviation, or null if it was free
     */
    public String offerAbbreviation(String abbreviation, String name) {
        return abbreviations.putIfAbsent(abbreviation, name);
    }

    public boolean contains(String name) {
        return arguments.containsKey(name);
    }

    public Map<String, ArgumentSpec> arguments() {
        return Collections.unmodifiableMap(arguments);
    }

    public Map<String, Object> defaults() {
        return Collections.unmodifiableMap(defaults);
    }

    public Map<String, String> abbreviations() {
        return Collections.unmodifiableMap(abbreviations);
    }
}
