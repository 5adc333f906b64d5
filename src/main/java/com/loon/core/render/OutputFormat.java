package com.loon.core.render;

import com.loon.core.config.ConfigurationException;

import java.util.Arrays;
import java.util.List;

/**
 * Report formats selectable with the {@code output} option.
 */
public enum OutputFormat {
    TERMINAL("terminal"),
    JUNIT("junit");

    private final String optionValue;

    OutputFormat(String optionValue) {
        this.optionValue = optionValue;
    }

    public String optionValue() {
        return optionValue;
    }

    public static List<String> optionValues() {
        return Arrays.stream(values()).map(OutputFormat::optionValue).toList();
    }

    public static OutputFormat fromOptionValue(String value) {
        for (var format : values()) {
            if (format.optionValue.equals(value)) {
                return format;
            }
        }
        throw new ConfigurationException("Unknown output format '" + value + "'. Valid formats: "
                + String.join(", ", optionValues()));
    }
}
