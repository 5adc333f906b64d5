package com.loon.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and hands them to {@link LoonCommand}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final LoonCommand loonCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(LoonCommand loonCommand, IFactory factory) {
        this.loonCommand = loonCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(loonCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
