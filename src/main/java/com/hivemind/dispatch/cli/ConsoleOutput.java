package com.hivemind.dispatch.cli;

import com.hivemind.core.model.Agent;
import com.hivemind.core.model.Capability;
import com.hivemind.core.model.OrchestrationMetrics;
import picocli.CommandLine;

import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for Hivemind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HIVEMIND v0.1.0|@"));
        rule();
    }

    public static void rule() {
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HIVEMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agentRow(Agent agent) {
        String status = switch (agent.status()) {
            case IDLE -> "@|fg(green) " + pad(agent.status().wireName()) + "|@";
            case BUSY -> "@|fg(yellow) " + pad(agent.status().wireName()) + "|@";
            case OVERLOADED, OFFLINE -> "@|fg(red) " + pad(agent.status().wireName()) + "|@";
            case MAINTENANCE -> "@|fg(magenta) " + pad(agent.status().wireName()) + "|@";
        };
        String capabilities = agent.capabilities().stream()
                .map(ConsoleOutput::formatCapability)
                .collect(Collectors.joining(", "));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %-16s %-22s %s %d/%-3d sr=%.2f eff=%.2f  %s",
                agent.id(), agent.name(), status, agent.currentTasks().size(), agent.maxConcurrentTasks(),
                agent.performance().successRate(), agent.performance().efficiency(), capabilities)));
    }

    public static void event(String eventName, String data) {
        String prefix = switch (eventName) {
            case "task_submitted" -> "@|fg(cyan) [SUBMIT]|@";
            case "task_assigned", "task_started" -> "@|fg(blue) [TASK]|@";
            case "task_completed" -> "@|fg(green) [DONE]|@";
            case "task_failed" -> "@|fg(red) [FAIL]|@";
            case "agent_spawned" -> "@|fg(magenta),bold [SPAWN]|@";
            default -> "@|fg(white) [" + eventName + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    public static void metrics(OrchestrationMetrics m) {
        rule();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Orchestration Metrics|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: " + m.totalTasks() + " total, @|fg(green) " + m.completedTasks() + " completed|@, @|fg(red) "
                + m.failedTasks() + " failed|@, " + m.queueLength() + " queued"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Average task time: " + formatDuration(Math.round(m.averageTaskTime()))));
        System.out.println(String.format("  Load: %.2f  Utilization: %.2f  Network efficiency: %.2f",
                m.systemLoad(), m.agentUtilization(), m.networkEfficiency()));
    }

    private static String formatCapability(Capability capability) {
        return String.format("%s:%.2f", capability.type().wireName(), capability.level());
    }

    private static String pad(String value) {
        return String.format("%-11s", value);
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
