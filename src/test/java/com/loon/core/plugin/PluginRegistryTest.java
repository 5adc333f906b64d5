package com.loon.core.plugin;

import com.loon.core.config.ConfigurationException;
import com.loon.core.format.Palette;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PluginRegistryTest {

    private ByteArrayOutputStream buffer;
    private PluginRegistry registry;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        var out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        registry = new PluginRegistry(() -> ArgumentCatalog.base(name -> null), () -> out, Palette::uncolored);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("config")
    class Config {

        @Test
        @DisplayName("merges arguments, defaults and abbreviations")
        void merges() {
            registry.config(PluginRegistration.builder("snapshot")
                    .argument(ArgumentSpec.text("dir", "snapshot directory"))
                    .argument(ArgumentSpec.flag("update", "update snapshots"), false)
                    .abbreviation("u", "update")
                    .build());

            var catalog = registry.catalog();
            assertTrue(catalog.contains("dir"));
            assertEquals(false, catalog.defaults().get("update"));
            assertEquals("update", catalog.abbreviations().get("u"));
            assertTrue(registry.isConfigured("snapshot"));
            assertEquals("", output());
        }

        @Test
        @DisplayName("a clashing argument is disabled with a warning")
        void argumentClash() {
            registry.config(PluginRegistration.builder("rogue")
                    .argument(ArgumentSpec.choice("output", "hijack output", List.of("html")), "html")
                    .build());

            assertEquals(ArgumentSpec.Kind.CHOICE, registry.catalog().arguments().get("output").kind());
            assertEquals(List.of("terminal", "junit"), registry.catalog().arguments().get("output").choices());
            assertEquals("terminal", registry.catalog().defaults().get("output"));
            assertEquals("warning: \"rogue\" plugin arg \"--output\" clashes with existing, disabling.\n", output());
        }

        @Test
        @DisplayName("a clashing abbreviation keeps the first claimant")
        void abbreviationClash() {
            registry.config(PluginRegistration.builder("tidy")
                    .argument(ArgumentSpec.flag("tidy", "tidy up"))
                    .abbreviation("t", "tidy")
                    .build());

            assertEquals("terse", registry.catalog().abbreviations().get("t"));
            assertEquals("warning: \"tidy\" plugin arg \"-t\" (abbreviates \"--tidy\")\n"
                    + "clashes with existing abbreviation for \"--terse\".\n", output());
        }

        @Test
        @DisplayName("re-configuring only replaces the custom data")
        void idempotent() {
            var first = PluginRegistration.builder("p")
                    .argument(ArgumentSpec.flag("extra", "extra"))
                    .customData("one")
                    .build();
            registry.config(first);
            registry.config(PluginRegistration.builder("p")
                    .argument(ArgumentSpec.flag("extra", "extra"))
                    .customData("two")
                    .build());

            assertEquals("two", registry.getCustomData());
            assertEquals("", output());
        }

        @Test
        @DisplayName("a plugin name is required")
        void nameRequired() {
            assertThrows(ConfigurationException.class, () -> PluginRegistration.builder(" ").build());
            assertThrows(ConfigurationException.class, () -> registry.config(null));
        }
    }

    @Nested
    @DisplayName("summary hooks")
    class Summaries {

        @Test
        @DisplayName("a name registered twice runs once")
        void deduplicated() {
            var calls = new ArrayList<String>();
            registry.summary("print", () -> {
                calls.add("first");
                return 0;
            });
            registry.summary("print", () -> {
                calls.add("second");
                return 0;
            });

            assertEquals(0, registry.runSummaries());
            assertEquals(List.of("first"), calls);
        }

        @Test
        @DisplayName("the first non-zero result stops the chain")
        void shortCircuit() {
            var calls = new ArrayList<String>();
            registry.summary("a", () -> {
                calls.add("a");
                return 0;
            });
            registry.summary("b", () -> {
                calls.add("b");
                return 3;
            });
            registry.summary("c", () -> {
                calls.add("c");
                return 0;
            });

            assertEquals(3, registry.runSummaries());
            assertEquals(List.of("a", "b"), calls);
            assertEquals(List.of("a", "b", "c"), registry.summaryNames());
        }
    }

    @Test
    @DisplayName("custom data can be read with its type")
    void typedCustomData() {
        registry.activate(42);

        assertEquals(42, registry.customData(Integer.class).orElseThrow());
        assertTrue(registry.customData(String.class).isEmpty());
    }

    @Test
    @DisplayName("reset restores the base catalog and forgets plugins")
    void reset() {
        registry.config(PluginRegistration.builder("p")
                .argument(ArgumentSpec.flag("extra", "extra"))
                .customData("data")
                .build());
        registry.summary("s", () -> 0);

        registry.reset();

        assertFalse(registry.catalog().contains("extra"));
        assertTrue(registry.catalog().contains("output"));
        assertFalse(registry.isConfigured("p"));
        assertTrue(registry.summaryNames().isEmpty());
        assertNull(registry.getCustomData());
    }
}
