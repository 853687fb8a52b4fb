package com.vulnconsole.runtime.docker;

import com.vulnconsole.runtime.RuntimeUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the docker compose CLI as a child process.
 * <p>
 * The command prefix is configurable. When left empty it is detected on first use:
 * the {@code docker compose} plugin is preferred and the standalone
 * {@code docker-compose} binary is the fallback.
 */
public class ComposeCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ComposeCommandRunner.class);

    private static final int DETECT_TIMEOUT_SECONDS = 15;

    /** Exit status and combined stdout/stderr of one invocation. */
    public record CommandResult(int exitCode, String output) {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }

    private final String configuredCommand;
    private final int timeoutSeconds;
    private volatile List<String> commandPrefix;

    public ComposeCommandRunner(String configuredCommand, int timeoutSeconds) {
        this.configuredCommand = configuredCommand;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Runs {@code <compose> -f <composeFile> <args...>} inside {@code workingDir}.
     *
     * @throws RuntimeUnavailableException if no compose CLI can be started
     */
    public CommandResult compose(Path workingDir, Path composeFile, String... args) {
        var command = new ArrayList<>(commandPrefix());
        command.add("-f");
        command.add(composeFile.toString());
        command.addAll(Arrays.asList(args));
        return run(command, workingDir, timeoutSeconds);
    }

    List<String> commandPrefix() {
        List<String> prefix = commandPrefix;
        if (prefix == null) {
            synchronized (this) {
                if (commandPrefix == null) {
                    commandPrefix = detect();
                }
                prefix = commandPrefix;
            }
        }
        return prefix;
    }

    private List<String> detect() {
        if (configuredCommand != null && !configuredCommand.isBlank()) {
            return List.of(configuredCommand.trim().split("\\s+"));
        }
        for (List<String> candidate : List.of(List.of("docker", "compose"), List.of("docker-compose"))) {
            var probe = new ArrayList<>(candidate);
            probe.add("version");
            try {
                if (run(probe, null, DETECT_TIMEOUT_SECONDS).succeeded()) {
                    log.info("Using compose command: {}", String.join(" ", candidate));
                    return candidate;
                }
            } catch (RuntimeUnavailableException e) {
                log.debug("Compose candidate '{}' not usable: {}", String.join(" ", candidate), e.getMessage());
            }
        }
        throw new RuntimeUnavailableException("Neither 'docker compose' nor 'docker-compose' is available");
    }

    CommandResult run(List<String> command, Path workingDir, int timeout) {
        log.debug("Running: {}", String.join(" ", command));
        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
            if (workingDir != null) {
                pb.directory(workingDir.toFile());
            }
            process = pb.start();
        } catch (IOException e) {
            throw new RuntimeUnavailableException("Cannot run " + command.get(0) + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(timeout, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return new CommandResult(-1, "Timed out after " + timeout + "s: " + String.join(" ", command));
            }
            return new CommandResult(process.exitValue(), output.get(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return new CommandResult(-1, "Interrupted: " + String.join(" ", command));
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Could not collect output of {}: {}", command.get(0), e.getMessage());
            return new CommandResult(process.exitValue(), "");
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "";
        }
    }
}
