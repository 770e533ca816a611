package com.branchwork.dispatch.cli;

import com.branchwork.core.coordinator.EpicProgress;
import com.branchwork.core.coordinator.SubIssueStatus;
import com.branchwork.core.events.OrchestrationEvent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Branchwork CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) BRANCHWORK v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [BRANCHWORK]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(String agentId, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [AGENT " + agentId + "]|@ " + message));
    }

    /**
     * One line per sub-task lifecycle event; other event types are ignored.
     */
    public static void subTaskEvent(OrchestrationEvent event) {
        Object elapsed = event.payload().get("elapsedMs");
        String line = switch (event.eventType()) {
            case "subtask.started" -> "@|fg(cyan) >|@ " + event.subTaskId() + " started on "
                    + event.payload().get("branch");
            case "subtask.completed" -> "@|fg(green) +|@ " + event.subTaskId() + " completed in " + elapsed + "ms";
            case "subtask.failed" -> "@|fg(red) x|@ " + event.subTaskId() + " " + event.payload().get("outcome")
                    + " after " + elapsed + "ms: " + event.payload().get("error");
            default -> null;
        };
        if (line != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
        }
    }

    public static void subTaskResult(String subTaskId, SubIssueStatus status, String detail) {
        String color = status == SubIssueStatus.COMPLETED ? "fg(green)" : "fg(red)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + status + "|@ " + subTaskId + (detail == null ? "" : " (" + detail + ")")));
    }

    public static void progress(EpicProgress progress) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Epic " + progress.epicId() + "|@"));
        int completed = progress.count(SubIssueStatus.COMPLETED);
        int failed = progress.count(SubIssueStatus.FAILED);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Sub-tasks: @|fg(green) " + completed + " completed|@" +
                (failed > 0 ? ", @|fg(red) " + failed + " failed|@" : "") +
                " of " + progress.total()));
        System.out.printf("  Completion: %.0f%%%n", progress.completionRatio() * 100);
        progress.failures().forEach((subTaskId, message) ->
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "    @|fg(red) -|@ " + subTaskId + ": " + message)));
    }
}
