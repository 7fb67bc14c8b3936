package com.roundabout.dispatch.cli;

import com.roundabout.core.agent.ChildTermination;
import com.roundabout.core.agent.TerminationSummary;
import com.roundabout.core.governor.SystemMetrics;
import com.roundabout.core.model.ResourceUsage;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Roundabout CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ROUNDABOUT v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ROUNDABOUT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(String role, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [AGENT " + role + "]|@ " + message));
    }

    public static void governor(boolean approved, String message) {
        if (approved) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green),bold [GOVERNOR APPROVED]|@ " + message));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red),bold [GOVERNOR DENIED]|@ " + message));
        }
    }

    public static void usage(String label, ResourceUsage usage) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %s: llm=%d compute=%d storage=%d time=%s",
                label, usage.llmCalls(), usage.computeUnits(), usage.storageBytes(),
                formatDuration(usage.executionTimeMs()))));
    }

    public static void systemMetrics(SystemMetrics m) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Governor|@"));
        String breaker = switch (m.circuitBreakerInfo().status()) {
            case CLOSED -> "@|fg(green) CLOSED|@";
            case HALF_OPEN -> "@|fg(yellow) HALF_OPEN|@";
            case OPEN -> "@|fg(red) OPEN|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  Circuit breaker: " + breaker
                + String.format(" (error rate %.2f, cost spike %.2f)",
                m.circuitBreakerInfo().errorRate(), m.circuitBreakerInfo().costSpike())));
        System.out.println("  Tempo: " + m.systemTempo().label());
        System.out.println("  Active agents: " + m.activeAgents());
        usage("Total usage", m.totalResourceUsage());
        if (!m.pausedHierarchies().isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) Paused hierarchies:|@ " + String.join(", ", m.pausedHierarchies())));
        }
        if (!m.errorHistory().isEmpty()) {
            System.out.println("  Recent errors: " + m.errorHistory().size());
        }
    }

    public static void termination(TerminationSummary summary) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) [TERMINATED]|@ " + summary.agentId() + ", "
                        + summary.descendantCount() + " descendant" + (summary.descendantCount() != 1 ? "s" : "")));
        for (ChildTermination child : summary.children()) {
            if (child instanceof ChildTermination.Err err) {
                error("  " + err.report().childId() + ": " + err.error());
            } else {
                success("  " + child.report().childId() + " " + child.report().status());
            }
        }
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "agent.created", "agent.child.created" -> "@|fg(cyan) [AGENT]|@";
            case "agent.phase.changed" -> "@|fg(blue) [PHASE]|@";
            case "governor.approval.granted" -> "@|fg(green),bold [APPROVED]|@";
            case "governor.approval.denied" -> "@|fg(red),bold [DENIED]|@";
            case "governor.breaker.open", "governor.breaker.half_open", "governor.breaker.closed",
                 "governor.tempo.changed" -> "@|bold,fg(yellow) [GOVERNOR]|@";
            case "governor.hierarchy.paused", "governor.hierarchy.resumed" -> "@|fg(red) [HIERARCHY]|@";
            case "agent.terminated" -> "@|fg(magenta) [TERMINATED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
