package com.conductor.dispatch.cli;

import com.conductor.core.events.MonitorEvent;
import com.conductor.core.model.LifecycleResult;
import com.conductor.core.model.PublishedPort;
import com.conductor.core.model.ServiceState;
import com.conductor.core.model.ServiceStatus;
import picocli.CommandLine;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output for the CLI.
 */
public class ConsoleOutput {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CONDUCTOR v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CONDUCTOR]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Prints a lifecycle result.
     *
     * @return the process exit code for it
     */
    public static int result(LifecycleResult result) {
        switch (result.outcome()) {
            case SUCCEEDED -> success(result.serviceId() + ": " + result.detail());
            case DEGRADED -> warn(result.serviceId() + ": " + result.detail());
            case FAILED -> error(result.serviceId() + ": " + result.detail());
        }
        return result.isSuccess() ? 0 : 1;
    }

    public static void status(ServiceStatus status) {
        String color = switch (status.state()) {
            case RUNNING -> "fg(green)";
            case EXITED -> "fg(yellow)";
            case NOT_FOUND, ERROR -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %-20s @|%s %-10s|@ %-10s %s",
                status.id(), color, status.state().wireName(), status.health().wireName(), details(status))));
    }

    public static void event(MonitorEvent event) {
        String time = LocalTime.ofInstant(event.timestamp(), ZoneId.systemDefault()).format(TIME);
        String prefix = switch (event.type()) {
            case SERVICE_HEALTHY -> "@|fg(green) [HEALTHY]|@";
            case SERVICE_UNHEALTHY -> "@|fg(yellow) [UNHEALTHY]|@";
            case SERVICE_RESTARTED -> "@|fg(cyan) [RESTARTED]|@";
            case SERVICE_RESTART_FAILED -> "@|fg(red),bold [RESTART FAILED]|@";
            case DEPENDENCY_CASCADE -> "@|fg(magenta),bold [CASCADE]|@";
        };
        String detail = switch (event.type()) {
            case SERVICE_RESTARTED -> " (attempt " + event.attempt() + ")";
            case SERVICE_RESTART_FAILED -> " after " + event.payload().get("attempts") + " attempts";
            case DEPENDENCY_CASCADE -> " affects " + String.join(", ", event.affectedServices());
            default -> "";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                time + " " + prefix + " " + event.serviceId() + detail));
    }

    private static String details(ServiceStatus status) {
        var parts = new StringBuilder();
        if (!status.publishedPorts().isEmpty()) {
            parts.append("ports ").append(status.publishedPorts().stream()
                    .map(ConsoleOutput::formatPort)
                    .collect(Collectors.joining(", ")));
        }
        if (status.state() == ServiceState.EXITED && status.exitCode() != null) {
            if (parts.length() > 0) parts.append("  ");
            parts.append("exit code ").append(status.exitCode());
        }
        if (status.error() != null) {
            if (parts.length() > 0) parts.append("  ");
            parts.append(status.error());
        }
        return parts.toString();
    }

    private static String formatPort(PublishedPort port) {
        return port.publishedPort() + "->" + port.targetPort() + "/" + port.protocol();
    }
}
