package com.loon.core.format;

import picocli.CommandLine.Help.Ansi.IStyle;
import picocli.CommandLine.Help.Ansi.Style;

/**
 * Decorates report text by semantic role.
 * <p>
 * The colored palette wraps text in picocli ANSI styles; the uncolored palette
 * only stringifies.
 */
public final class Palette {

    private static final Palette COLORED = new Palette(true);
    private static final Palette UNCOLORED = new Palette(false);

    private static final IStyle[] FAIL = {Style.fg_red};
    private static final IStyle[] PASS = {Style.fg_green};
    private static final IStyle[] FILE = {Style.fg_cyan};
    private static final IStyle[] LINE = {Style.fg_cyan};
    private static final IStyle[] SUITE = {Style.fg_blue};
    private static final IStyle[] MSG = {Style.fg("214")};
    private static final IStyle[] WARN = {Style.fg_yellow};
    private static final IStyle[] VALUE = {Style.fg_magenta};

    private final boolean enabled;

    private Palette(boolean enabled) {
        this.enabled = enabled;
    }

    public static Palette colored() {
        return COLORED;
    }

    public static Palette uncolored() {
        return UNCOLORED;
    }

    public static Palette of(boolean colored) {
        return colored ? COLORED : UNCOLORED;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String fail(Object text) {
        return paint(FAIL, text);
    }

    public String pass(Object text) {
        return paint(PASS, text);
    }

    public String file(Object text) {
        return paint(FILE, text);
    }

    public String line(Object text) {
        return paint(LINE, text);
    }

    public String suite(Object text) {
        return paint(SUITE, text);
    }

    public String msg(Object text) {
        return paint(MSG, text);
    }

    public String warn(Object text) {
        return paint(WARN, text);
    }

    public String value(Object text) {
        return paint(VALUE, text);
    }

    private String paint(IStyle[] styles, Object text) {
        var plain = String.valueOf(text);
        if (!enabled) {
            return plain;
        }
        return Style.on(styles) + plain + Style.reset.on();
    }
}
