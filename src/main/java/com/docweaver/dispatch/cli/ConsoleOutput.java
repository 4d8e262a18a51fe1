package com.docweaver.dispatch.cli;

import com.docweaver.core.events.PipelineEvent;
import com.docweaver.core.model.PipelineTask;
import com.docweaver.core.model.StageState;
import com.docweaver.core.model.StageStatus;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Docweaver CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) DOCWEAVER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DOCWEAVER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void event(PipelineEvent event) {
        String prefix = switch (event.eventType()) {
            case PipelineEvent.TASK_CREATED, PipelineEvent.TASK_STARTED -> "@|fg(cyan) [TASK]|@";
            case PipelineEvent.STAGE_STARTED -> "@|fg(blue) [STAGE]|@";
            case PipelineEvent.STAGE_COMPLETED -> "@|fg(green) [STAGE]|@";
            case PipelineEvent.STAGE_FAILED -> "@|fg(red) [STAGE]|@";
            case PipelineEvent.STAGE_SKIPPED -> "@|fg(yellow) [STAGE]|@";
            case PipelineEvent.TASK_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            case PipelineEvent.TASK_FAILED -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        var sb = new StringBuilder(prefix).append(' ');
        if (event.stageName() != null) {
            sb.append(event.stageName()).append(' ');
        }
        sb.append(event.status())
                .append(String.format(Locale.ROOT, " (%.0f%%)", event.progress() * 100));
        Object message = event.payload().get("message");
        if (message != null) {
            sb.append(" ").append(message);
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(sb.toString()));
    }

    public static void taskSummary(PipelineTask task) {
        System.out.println();
        System.out.println("TASK " + task.id());
        System.out.println("Topic: " + task.topic());
        System.out.println("Template: " + task.config().templateKind().name().toLowerCase(Locale.ROOT));
        System.out.printf(Locale.ROOT, "Progress: %.0f%%%n", task.progress() * 100);
        System.out.println();
        System.out.printf("  %-10s %-10s %-6s %s%n", "STAGE", "STATUS", "UNITS", "DETAIL");
        System.out.println("  " + "-".repeat(48));
        task.stages().forEach((name, state) ->
                System.out.printf("  %-10s %-10s %-6d %s%n", name, state.status(), state.units().size(),
                        detail(state)));
    }

    public static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String detail(StageState state) {
        if (state.status() == StageStatus.SKIPPED && state.skipReason() != null) {
            return state.skipReason();
        }
        if (state.error() != null) {
            return state.error().summary();
        }
        if (!state.failedUnits().isEmpty()) {
            return "failed units: " + String.join(", ", state.failedUnits());
        }
        return "-";
    }
}
