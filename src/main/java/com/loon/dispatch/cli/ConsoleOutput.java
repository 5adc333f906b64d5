package com.loon.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored messages the CLI prints outside of a test report.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) error:|@ ")
                + message);
    }
}
