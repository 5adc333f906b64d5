package com.loon.snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Shows how a new result differs from a saved snapshot.
 *
 * <p>Shells out to {@code git diff --no-index} via {@link ProcessBuilder}, so
 * any machine with git installed gets the familiar colored unified diff.
 */
public class SnapshotDiff {

    private static final Logger log = LoggerFactory.getLogger(SnapshotDiff.class);

    /**
     * @param snapshot the saved snapshot file
     * @param actual   the text produced by the current run
     * @return the diff output; empty when the contents are identical
     */
    public String diff(Path snapshot, String actual) {
        Path actualFile = null;
        try {
            actualFile = Files.createTempFile("loon-snapshot-", ".snap");
            Files.writeString(actualFile, actual, StandardCharsets.UTF_8);
            return runDiff(List.of("git", "diff", "--no-index", "--",
                    snapshot.toString(), actualFile.toString()));
        } catch (IOException e) {
            log.error("Could not diff snapshot {}", snapshot, e);
            throw new RuntimeException("Could not diff snapshot " + snapshot, e);
        } finally {
            deleteQuietly(actualFile);
        }
    }

    String runDiff(List<String> command) throws IOException {
        log.debug("Running (capture): {}", command);
        try {
            // stderr shares the pipe so a chatty git cannot block waitFor()
            var process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .start();

            String output;
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            // --no-index exits with 1 when the files differ
            int exitCode = process.waitFor();
            if (exitCode > 1) {
                log.warn("git diff exited with code {}: {}", exitCode, command);
            }
            return output;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while running git diff", e);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temporary file {}", file, e);
        }
    }
}
