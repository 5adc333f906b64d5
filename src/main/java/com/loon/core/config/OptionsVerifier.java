package com.loon.core.config;

import com.loon.core.plugin.ArgumentCatalog;
import com.loon.core.plugin.ArgumentSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns run options, given as a command line or as a map, into a validated
 * options map for a given {@link ArgumentCatalog}.
 * <p>
 * The catalog is translated into a picocli {@link CommandSpec} on every call,
 * since plugins extend it between runs.
 */
public class OptionsVerifier {

    private static final Logger log = LoggerFactory.getLogger(OptionsVerifier.class);

    static final String COMMAND_NAME = "loon";

    /**
     * Parses a command line such as {@code --output=junit -t --times false}.
     *
     * @param arguments          the raw arguments
     * @param userDefaults       defaults that win over the catalog's own, may be null
     * @param ignoreUnrecognized skip unknown options instead of failing
     * @throws ConfigurationException for unknown options, malformed or unconvertible values
     *                                and values outside an option's permitted set
     */
    public Map<String, Object> verify(List<String> arguments, ArgumentCatalog catalog,
                                      Map<String, ?> userDefaults, boolean ignoreUnrecognized) {
        for (var argument : arguments) {
            checkWellFormed(argument);
        }

        var spec = commandSpec(catalog, null);
        spec.parser().unmatchedArgumentsAllowed(ignoreUnrecognized);
        var commandLine = new CommandLine(spec);
        CommandLine.ParseResult parsed;
        try {
            parsed = commandLine.parseArgs(arguments.toArray(String[]::new));
        } catch (CommandLine.UnmatchedArgumentException e) {
            var suggestions = e.getSuggestions();
            var message = suggestions.isEmpty()
                    ? e.getMessage()
                    : e.getMessage() + "\ndid you mean: " + String.join(", ", suggestions) + "?";
            throw new ConfigurationException(message, e);
        } catch (CommandLine.ParameterException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        if (!parsed.unmatched().isEmpty()) {
            log.debug("Ignoring unrecognized arguments {}", parsed.unmatched());
        }

        var options = new LinkedHashMap<String, Object>();
        for (var option : spec.options()) {
            if (parsed.hasMatchedOption(option)) {
                options.put(nameOf(option), option.getValue());
            }
        }
        return complete(options, catalog, userDefaults);
    }

    public Map<String, Object> verify(List<String> arguments, ArgumentCatalog catalog, Map<String, ?> userDefaults) {
        return verify(arguments, catalog, userDefaults, false);
    }

    /**
     * Validates an options map such as {@code {output=junit, terse=true}}; values
     * go through the same conversion as command line values.
     */
    public Map<String, Object> verify(Map<String, ?> table, ArgumentCatalog catalog, Map<String, ?> userDefaults) {
        var arguments = new ArrayList<String>();
        if (table != null) {
            table.forEach((name, value) -> {
                if (value != null) {
                    arguments.add("--" + name + "=" + value);
                }
            });
        }
        return verify(arguments, catalog, userDefaults, false);
    }

    /**
     * Usage text listing every option in the catalog with its default.
     */
    public String describe(ArgumentCatalog catalog, String helpTitle, boolean uncolored) {
        var spec = commandSpec(catalog, helpTitle);
        var ansi = uncolored ? CommandLine.Help.Ansi.OFF : CommandLine.Help.Ansi.ON;
        return new CommandLine(spec).getUsageMessage(ansi);
    }

    private Map<String, Object> complete(Map<String, Object> options, ArgumentCatalog catalog, Map<String, ?> userDefaults) {
        if (userDefaults != null) {
            userDefaults.forEach((name, value) -> {
                if (value != null && catalog.contains(name)) {
                    options.putIfAbsent(name, value);
                }
            });
        }
        catalog.defaults().forEach((name, value) -> {
            if (catalog.contains(name)) {
                options.putIfAbsent(name, value);
            }
        });

        for (var entry : options.entrySet()) {
            var spec = catalog.arguments().get(entry.getKey());
            if (spec.kind() == ArgumentSpec.Kind.CHOICE && !spec.choices().contains(String.valueOf(entry.getValue()))) {
                throw new ConfigurationException("config element '%s' should be one of: %s.\ngot: \"%s\""
                        .formatted(entry.getKey(), String.join(", ", spec.choices()), entry.getValue()));
            }
        }
        return options;
    }

    private static void checkWellFormed(String argument) {
        if (!argument.startsWith("-") || !argument.contains("=")) {
            return;
        }
        var nameAndValue = argument.replaceFirst("^-+", "");
        var separator = nameAndValue.indexOf('=');
        if (separator <= 0 || separator == nameAndValue.length() - 1) {
            throw new ConfigurationException("malformed argument with '=' syntax: '" + argument + "'");
        }
    }

    private static CommandSpec commandSpec(ArgumentCatalog catalog, String helpTitle) {
        var spec = CommandSpec.create().name(COMMAND_NAME);
        spec.parser()
                .overwrittenOptionsAllowed(true)
                .expandAtFiles(false);
        if (helpTitle != null && !helpTitle.isBlank()) {
            spec.usageMessage().header(helpTitle);
        }

        for (var argument : catalog.arguments().values()) {
            var names = new ArrayList<String>();
            names.add("--" + argument.name());
            catalog.abbreviations().forEach((abbreviation, fullName) -> {
                if (fullName.equals(argument.name())) {
                    names.add("-" + abbreviation);
                }
            });

            var option = OptionSpec.builder(names.toArray(String[]::new))
                    .type(argument.valueType())
                    .description(describe(argument, catalog.defaults().get(argument.name())));
            if (argument.kind() == ArgumentSpec.Kind.FLAG) {
                option.arity("0..1").paramLabel("true|false");
            } else {
                option.arity("1").paramLabel(argument.kind() == ArgumentSpec.Kind.CHOICE
                        ? String.join("|", argument.choices())
                        : "<" + argument.name() + ">");
            }
            spec.addOption(option.build());
        }
        return spec;
    }

    private static String describe(ArgumentSpec argument, Object defaultValue) {
        return defaultValue == null
                ? argument.description()
                : argument.description() + " (default: " + defaultValue + ")";
    }

    private static String nameOf(OptionSpec option) {
        return option.longestName().replaceFirst("^-+", "");
    }
}
