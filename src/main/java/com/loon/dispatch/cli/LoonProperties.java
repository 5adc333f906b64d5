package com.loon.dispatch.cli;

import com.loon.core.plugin.ArgumentCatalog;
import com.loon.core.session.LoonSession;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Run option defaults for the CLI, e.g. {@code loon.output=junit} in
 * {@code application.yml}. Unset properties fall back to the harness defaults;
 * command line options win over both.
 */
@Component
@ConfigurationProperties(prefix = "loon")
public class LoonProperties {

    private String output;
    private Boolean uncolored;
    private Boolean terse;
    private Boolean times;
    private String helpTitle;

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public Boolean getUncolored() {
        return uncolored;
    }

    public void setUncolored(Boolean uncolored) {
        this.uncolored = uncolored;
    }

    public Boolean getTerse() {
        return terse;
    }

    public void setTerse(Boolean terse) {
        this.terse = terse;
    }

    public Boolean getTimes() {
        return times;
    }

    public void setTimes(Boolean times) {
        this.times = times;
    }

    public String getHelpTitle() {
        return helpTitle;
    }

    public void setHelpTitle(String helpTitle) {
        this.helpTitle = helpTitle;
    }

    /**
     * The properties that are set, keyed by run option name.
     */
    public Map<String, Object> userDefaults() {
        var defaults = new LinkedHashMap<String, Object>();
        putIfSet(defaults, ArgumentCatalog.OUTPUT, output);
        putIfSet(defaults, ArgumentCatalog.UNCOLORED, uncolored);
        putIfSet(defaults, ArgumentCatalog.TERSE, terse);
        putIfSet(defaults, ArgumentCatalog.TIMES, times);
        putIfSet(defaults, LoonSession.HELP_TITLE, helpTitle);
        return defaults;
    }

    private static void putIfSet(Map<String, Object> defaults, String name, Object value) {
        if (value != null) {
            defaults.put(name, value);
        }
    }
}
