package com.vulnconsole.dispatch.cli;

import com.vulnconsole.core.model.EnvironmentDescriptor;
import com.vulnconsole.core.model.EnvironmentStatus;
import com.vulnconsole.core.operations.OperationResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the vulnconsole CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(red) VULNCONSOLE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [VULNCONSOLE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void progress(String line) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|faint " + escape(line) + "|@"));
    }

    /** One table row: status, id, ports, images and exploit markers. */
    public static void environment(EnvironmentDescriptor env) {
        String status = switch (env.status()) {
            case RUNNING -> "@|fg(green) running|@";
            case STOPPED -> "@|fg(white) stopped|@";
            default -> "@|faint unknown|@";
        };
        Integer port = env.primaryPort();
        String flags = (env.hasImages() ? "I" : "-") + (env.hasExploit() ? "E" : "-")
                + (env.parseError() ? "!" : " ");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-18s %s  %-45s %s",
                status, flags, escape(env.id()),
                port != null && env.status() == EnvironmentStatus.RUNNING ? "http://localhost:" + port : "")));
    }

    public static void operationResult(OperationResult result) {
        String label = result.operation() + " " + result.environmentId();
        switch (result.kind()) {
            case SUCCESS -> success(label + " succeeded");
            case ACCEPTED -> info(label + " started");
            case PORT_CONFLICT -> {
                error(label + ": port conflict: " + result.message());
                for (String container : result.conflicting()) {
                    System.out.println("    - " + container);
                }
            }
            case BUSY -> warn(label + ": " + result.message());
            default -> error(label + " failed: " + result.message());
        }
    }

    private static String escape(String text) {
        // picocli markup uses @| and |@
        return text == null ? "" : text.replace("@|", "@ |").replace("|@", "| @");
    }
}
