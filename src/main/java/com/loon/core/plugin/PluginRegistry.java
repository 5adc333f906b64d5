package com.loon.core.plugin;

import com.loon.core.config.ConfigurationException;
import com.loon.core.format.Palette;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Shared state that plugins hook into: the merged option catalog, the custom
 * data slot read by plugin assertions and the ordered post-run summary hooks.
 * <p>
 * Plugins may call {@link #config} any number of times; only the first call
 * per plugin name merges options, every call replaces the custom data.
 */
public class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    private final Supplier<ArgumentCatalog> baseCatalog;
    private final Supplier<PrintStream> out;
    private final Supplier<Palette> palette;

    private ArgumentCatalog catalog;
    private final Set<String> configuredPlugins = new HashSet<>();
    private final Map<String, SummaryHook> summaries = new LinkedHashMap<>();
    private Object customData;

    /**
     * @param baseCatalog creates the harness's own options; called again on every reset
     * @param out         where collision warnings are printed
     * @param palette     colors for those warnings
     */
    public PluginRegistry(Supplier<ArgumentCatalog> baseCatalog, Supplier<PrintStream> out, Supplier<Palette> palette) {
        this.baseCatalog = baseCatalog;
        this.out = out;
        this.palette = palette;
        this.catalog = baseCatalog.get();
    }

    /**
     * Registers a plugin, or re-registers it with new custom data.
     */
    public void config(PluginRegistration registration) {
        if (registration == null) {
            throw new ConfigurationException("your plugin config must supply a 'pluginName'");
        }
        var pluginName = registration.pluginName();

        customData = registration.customData();

        if (!configuredPlugins.add(pluginName)) {
            return;
        }
        log.debug("Configuring plugin '{}' with {} argument(s)", pluginName, registration.arguments().size());

        var warning = palette.get().warn("warning");
        for (var spec : registration.arguments()) {
            if (!catalog.offer(spec)) {
                log.debug("Plugin '{}' argument --{} clashes with an existing option", pluginName, spec.name());
                out.get().print("%s: \"%s\" plugin arg \"--%s\" clashes with existing, disabling.\n"
                        .formatted(warning, pluginName, spec.name()));
                continue;
            }
            var defaultValue = registration.defaults().get(spec.name());
            if (defaultValue != null) {
                catalog.offerDefault(spec.name(), defaultValue);
            }
        }
        registration.abbreviations().forEach((abbreviation, fullName) -> {
            var existing = catalog.offerAbbreviation(abbreviation, fullName);
            if (existing != null) {
                log.debug("Plugin '{}' abbreviation -{} is already taken by --{}", pluginName, abbreviation, existing);
                out.get().print(("%s: \"%s\" plugin arg \"-%s\" (abbreviates \"--%s\")\n"
                        + "clashes with existing abbreviation for \"--%s\".\n")
                        .formatted(warning, pluginName, abbreviation, fullName, existing));
            }
        });
    }

    /**
     * The custom data of the running test's plugin, or of the last
     * {@link #config} call while tests are being defined.
     */
    public Object getCustomData() {
        return customData;
    }

    public <T> Optional<T> customData(Class<T> type) {
        return type.isInstance(customData) ? Optional.of(type.cast(customData)) : Optional.empty();
    }

    /**
     * Exposes a test's recorded custom data while its body runs.
     */
    public void activate(Object data) {
        customData = data;
    }

    public void deactivate() {
        customData = null;
    }

    /**
     * Adds a hook run after the report summary. A second hook under the same
     * name is ignored.
     */
    public void summary(String name, SummaryHook hook) {
        if (summaries.putIfAbsent(name, hook) == null) {
            log.debug("Registered summary hook '{}'", name);
        }
    }

    /**
     * Runs the hooks in registration order.
     *
     * @return the first non-zero hook result, or 0 when every hook returned 0
     */
    public int runSummaries() {
        for (var entry : List.copyOf(summaries.entrySet())) {
            var result = entry.getValue().summarize();
            if (result != 0) {
                log.debug("Summary hook '{}' ended the run with {}", entry.getKey(), result);
                return result;
            }
        }
        return 0;
    }

    public List<String> summaryNames() {
        return new ArrayList<>(summaries.keySet());
    }

    public boolean isConfigured(String pluginName) {
        return configuredPlugins.contains(pluginName);
    }

    public ArgumentCatalog catalog() {
        return catalog;
    }

    public void reset() {
        catalog = baseCatalog.get();
        configuredPlugins.clear();
        summaries.clear();
        customData = null;
    }
}
