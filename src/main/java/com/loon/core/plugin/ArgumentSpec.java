package com.loon.core.plugin;

import java.util.List;

/**
 * Describes one run option: its name, the values it accepts and its help text.
 *
 * @param name        option name, given on the command line as {@code --name}
 * @param kind        what sort of value the option takes
 * @param choices     permitted values for {@link Kind#CHOICE}, empty otherwise
 * @param description one-line help text
 */
public record ArgumentSpec(String name, Kind kind, List<String> choices, String description) {

    public enum Kind {
        /** {@code true}/{@code false}; a bare {@code --name} means {@code true}. */
        FLAG,
        /** One of a fixed set of strings. */
        CHOICE,
        /** Any string. */
        TEXT,
        /** Any number. */
        NUMBER
    }

    public ArgumentSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Argument name must not be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Argument kind must not be null for '" + name + "'");
        }
        choices = choices == null ? List.of() : List.copyOf(choices);
        if (kind == Kind.CHOICE && choices.isEmpty()) {
            throw new IllegalArgumentException("Choice argument '" + name + "' needs at least one permitted value");
        }
        description = description == null ? "" : description;
    }

    public static ArgumentSpec flag(String name, String description) {
        return new ArgumentSpec(name, Kind.FLAG, List.of(), description);
    }

    public static ArgumentSpec choice(String name, String description, List<String> choices) {
        return new ArgumentSpec(name, Kind.CHOICE, choices, description);
    }

    public static ArgumentSpec text(String name, String description) {
        return new ArgumentSpec(name, Kind.TEXT, List.of(), description);
    }

    public static ArgumentSpec number(String name, String description) {
        return new ArgumentSpec(name, Kind.NUMBER, List.of(), description);
    }

    /**
     * The Java type option values are converted to.
     */
    public Class<?> valueType() {
        return switch (kind) {
            case FLAG -> Boolean.class;
            case NUMBER -> Double.class;
            case CHOICE, TEXT -> String.class;
        };
    }
}
