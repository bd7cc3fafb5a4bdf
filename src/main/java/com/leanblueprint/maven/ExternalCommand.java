package com.leanblueprint.maven;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs an external tool synchronously, feeding it text on stdin and returning its stdout.
 * Stderr is collected and passed on to the console of the build; a non-zero exit
 * status is an error whose message ends with the last lines of stderr.
 */
public final class ExternalCommand {

    static final int STDERR_TAIL_LINES = 20;

    public static String run(List<String> command, Path workingDir, String input) throws IOException {
        Path stdin = Files.createTempFile("blueprint-stdin", ".txt");
        Path stderr = Files.createTempFile("blueprint-stderr", ".txt");
        try {
            Files.writeString(stdin, input == null ? "" : input);
            ProcessBuilder pb = new ProcessBuilder(command);
            if (workingDir != null) {
                pb.directory(workingDir.toFile());
            }
            pb.redirectInput(stdin.toFile());
            pb.redirectError(stderr.toFile());

            Process process = pb.start();
            String output;
            try (InputStream stdout = process.getInputStream()) {
                output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            String errors = new String(Files.readAllBytes(stderr), StandardCharsets.UTF_8);
            if (exitCode != 0) {
                String message = "Command " + String.join(" ", command) + " exited with code " + exitCode;
                String tail = tail(errors);
                throw new IOException(tail.isEmpty() ? message : message + ":\n" + tail);
            }
            System.err.print(errors);
            return output;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while running " + String.join(" ", command), e);
        } finally {
            Files.deleteIfExists(stdin);
            Files.deleteIfExists(stderr);
        }
    }

    static String tail(String text) {
        List<String> lines = text.strip().lines().collect(Collectors.toList());
        if (lines.size() > STDERR_TAIL_LINES) {
            lines = lines.subList(lines.size() - STDERR_TAIL_LINES, lines.size());
        }
        return String.join("\n", lines);
    }

    private ExternalCommand() {
    }
}
