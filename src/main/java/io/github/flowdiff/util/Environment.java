package io.github.flowdiff.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs external programs with a bounded wait.
 */
public final class Environment {
    private static final Logger logger = LogManager.getLogger(Environment.class);

    private Environment() {
    }

    /**
     * Runs {@code command} in {@code workingDir} and returns its combined stdout and stderr.
     *
     * @throws SubprocessException if the command fails to start, times out, or exits non-zero
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public static String runCommand(List<String> command, Path workingDir, int timeoutSeconds)
            throws SubprocessException, InterruptedException {
        var display = String.join(" ", command);
        logger.debug("Running `{}` in `{}`", display, workingDir);

        var pb = new ProcessBuilder(command);
        pb.directory(workingDir.toFile());
        pb.redirectInput(ProcessBuilder.Redirect.from(new File(isWindows() ? "NUL" : "/dev/null")));
        pb.environment().put("GIT_TERMINAL_PROMPT", "0");

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new StartupException("unable to start `%s` in %s (%s)".formatted(display, workingDir, e.getMessage()), "");
        }

        // drain both pipes while waiting
        CompletableFuture<String> stdoutFuture = CompletableFuture.supplyAsync(() -> readStream(process.getInputStream()));
        CompletableFuture<String> stderrFuture = CompletableFuture.supplyAsync(() -> readStream(process.getErrorStream()));

        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                var output = formatOutput(stdoutFuture.join(), stderrFuture.join());
                throw new TimeoutException("`%s` did not complete within %d seconds".formatted(display, timeoutSeconds), output);
            }
        } catch (InterruptedException ie) {
            process.destroyForcibly();
            logger.warn("`{}` interrupted", display);
            throw ie;
        }

        var output = formatOutput(stdoutFuture.join(), stderrFuture.join());
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new FailureException("`%s` exited with code %d".formatted(display, exitCode), output);
        }
        return output;
    }

    private static String readStream(InputStream in) {
        var lines = new ArrayList<String>();
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            logger.error("Error reading process stream", e);
        }
        return String.join("\n", lines);
    }

    private static String formatOutput(String stdout, String stderr) {
        stdout = stdout.trim();
        stderr = stderr.trim();
        if (stdout.isEmpty()) {
            return stderr;
        }
        if (stderr.isEmpty()) {
            return stdout;
        }
        return "stdout:\n" + stdout + "\n\nstderr:\n" + stderr;
    }

    /**
     * True if {@code program} can be started, judged by running it with {@code --version}.
     */
    public static boolean isAvailable(String program) {
        try {
            runCommand(List.of(program, "--version"), Path.of(System.getProperty("java.io.tmpdir")), 10);
            return true;
        } catch (SubprocessException e) {
            logger.debug("{} is not available: {}", program, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase(Locale.ENGLISH).contains("win");
    }

    /**
     * Base exception for subprocess errors. {@link #getOutput()} holds whatever the process printed.
     */
    public abstract static class SubprocessException extends IOException {
        private final String output;

        protected SubprocessException(String message, String output) {
            super(message);
            this.output = output == null ? "" : output;
        }

        public String getOutput() {
            return output;
        }
    }

    public static class StartupException extends SubprocessException {
        public StartupException(String message, String output) {
            super(message, output);
        }
    }

    public static class TimeoutException extends SubprocessException {
        public TimeoutException(String message, String output) {
            super(message, output);
        }
    }

    public static class FailureException extends SubprocessException {
        public FailureException(String message, String output) {
            super(message, output);
        }
    }
}
