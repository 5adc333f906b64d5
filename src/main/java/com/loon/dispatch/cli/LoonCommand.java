package com.loon.dispatch.cli;

import com.loon.core.config.ConfigurationException;
import com.loon.core.session.LoonSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Unmatched;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: loon -u com.example.MathTests [harness options]
 * <p>
 * Defines the tests of every unit, runs them once and exits with the run
 * result. Everything other than the unit and version options is passed to the
 * run, so {@code -h} lists the harness and plugin options.
 */
@Command(
        name = "loon",
        version = "Loon 0.1.0",
        description = "Runs the tests defined by one or more test units"
)
@Component
public class LoonCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LoonCommand.class);

    /** Exit code for an invalid setup, distinct from a failed-test count of 1. */
    static final int CONFIGURATION_ERROR = 2;

    @Option(names = {"-u", "--unit"}, paramLabel = "CLASS",
            description = "Fully qualified name of a TestUnit class; repeat for several units")
    private List<String> units = new ArrayList<>();

    @Option(names = {"-V", "--version"}, versionHelp = true, description = "Print version information and exit")
    private boolean versionRequested;

    @Unmatched
    private List<String> runArguments = new ArrayList<>();

    private final LoonSession session;
    private final LoonProperties properties;

    public LoonCommand(LoonSession session, LoonProperties properties) {
        this.session = session;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        log.debug("Units {}, run arguments {}", units, runArguments);
        try {
            session.grouped(units.toArray(String[]::new));
            return session.run(runArguments, properties.userDefaults()).exitCode();
        } catch (ConfigurationException e) {
            // grouping can fail before the run that would have reset the session
            session.reset();
            ConsoleOutput.error(e.getMessage());
            return CONFIGURATION_ERROR;
        }
    }
}
