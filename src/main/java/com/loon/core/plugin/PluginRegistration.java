package com.loon.core.plugin;

import com.loon.core.config.ConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a plugin hands to {@link PluginRegistry#config}.
 *
 * @param pluginName    identifies the plugin; repeated registrations under one name only update the custom data
 * @param arguments     run options the plugin understands
 * @param defaults      default values for those options
 * @param abbreviations single-letter abbreviations, abbreviation to option name
 * @param customData    attached to every test added after this registration, may be null
 */
public record PluginRegistration(String pluginName,
                                 List<ArgumentSpec> arguments,
                                 Map<String, Object> defaults,
                                 Map<String, String> abbreviations,
                                 Object customData) {

    public PluginRegistration {
        if (pluginName == null || pluginName.isBlank()) {
            throw new ConfigurationException("your plugin config must supply a 'pluginName'");
        }
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        defaults = defaults == null ? Map.of() : Map.copyOf(defaults);
        abbreviations = abbreviations == null ? Map.of() : Map.copyOf(abbreviations);
    }

    public static Builder builder(String pluginName) {
        return new Builder(pluginName);
    }

    public static class Builder {
        private final String pluginName;
        private final List<ArgumentSpec> arguments = new ArrayList<>();
        private final Map<String, Object> defaults = new LinkedHashMap<>();
        private final Map<String, String> abbreviations = new LinkedHashMap<>();
        private Object customData;

        private Builder(String pluginName) {
            this.pluginName = pluginName;
        }

        public Builder argument(ArgumentSpec spec) {
            arguments.add(spec);
            return this;
        }

        public Builder argument(ArgumentSpec spec, Object defaultValue) {
            arguments.add(spec);
            defaults.put(spec.name(), defaultValue);
            return this;
        }

        public Builder abbreviation(String abbreviation, String name) {
            abbreviations.put(abbreviation, name);
            return this;
        }

        public Builder customData(Object customData) {
            this.customData = customData;
            return this;
        }

        public PluginRegistration build() {
            return new PluginRegistration(pluginName, arguments, defaults, abbreviations, customData);
        }
    }
}
