package com.switchboard.dispatch.cli;

import com.switchboard.core.events.SwitchboardEvent;
import com.switchboard.core.model.Task;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Switchboard CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SWITCHBOARD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SWITCHBOARD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warning(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void task(int index, Task task) {
        String status = switch (task.status()) {
            case COMPLETED -> "@|fg(green) COMPLETED|@";
            case FAILED -> "@|fg(red) FAILED|@";
            case RUNNING -> "@|fg(yellow) RUNNING|@";
            case PENDING -> "@|fg(white) PENDING|@";
        };
        String worker = task.assignedWorker() != null ? task.assignedWorker() : "-";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + (index + 1) + ". " + status + " [" + worker + "] " + task.description()));
        if (task.error() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "     @|fg(red) " + task.error().kind() + "|@ " + task.error().message()));
        }
    }

    public static void event(SwitchboardEvent event) {
        String prefix = switch (event.eventType()) {
            case "task.started", "task.completed" -> "@|fg(blue) [TASK]|@";
            case "task.failed" -> "@|fg(red) [TASK]|@";
            case "plan.cycle_fallback" -> "@|bold,fg(yellow) [CYCLE]|@";
            case "worker.delegated" -> "@|fg(magenta) [DELEGATE]|@";
            case "tool.handler.connect_failed", "tool.handler.disabled" -> "@|fg(yellow),bold [TOOLS]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        Object message = event.payload().get("message");
        String data = message != null ? message.toString() : event.eventType() + " " + nullToEmpty(event.subject());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
