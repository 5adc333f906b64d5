package com.loon.dispatch.cli;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoonPropertiesTest {

    @Test
    void unsetPropertiesAreLeftToTheHarness() {
        assertTrue(new LoonProperties().userDefaults().isEmpty());
    }

    @Test
    void setPropertiesAreKeyedByOptionName() {
        var properties = new LoonProperties();
        properties.setOutput("junit");
        properties.setTimes(false);
        properties.setHelpTitle("nightly");

        assertEquals(Map.of("output", "junit", "times", false, "helpTitle", "nightly"), properties.userDefaults());
    }
}
