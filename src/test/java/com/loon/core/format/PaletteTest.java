package com.loon.core.format;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PaletteTest {

    @Test
    void uncoloredOnlyStringifies() {
        var palette = Palette.uncolored();

        assertFalse(palette.isEnabled());
        assertEquals("3", palette.fail(3));
        assertEquals("ok", palette.pass("ok"));
    }

    @Test
    void coloredWrapsInAnsiStyles() {
        var text = Palette.colored().pass("ok");

        assertTrue(text.startsWith("\u001B["), text);
        assertTrue(text.contains("ok"), text);
        assertTrue(text.endsWith("\u001B[0m"), text);
    }

    @Test
    void ofPicksByFlag() {
        assertSame(Palette.colored(), Palette.of(true));
        assertSame(Palette.uncolored(), Palette.of(false));
    }
}
