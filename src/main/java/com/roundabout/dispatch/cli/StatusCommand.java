package com.roundabout.dispatch.cli;

import com.roundabout.core.agent.AgentFactory;
import com.roundabout.core.events.AgentEvent;
import com.roundabout.core.events.EventBus;
import com.roundabout.core.governor.ResourceGovernor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: roundabout status
 * <p>
 * Displays the governor's system metrics, the active root agents and the
 * most recent agent events.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show governor status")
@Component
public class StatusCommand implements Runnable {

    @Option(names = {"--events", "-n"}, description = "Recent events to show", defaultValue = "20")
    private int events;

    private final ResourceGovernor governor;
    private final AgentFactory agentFactory;
    private final EventBus eventBus;

    public StatusCommand(ResourceGovernor governor, AgentFactory agentFactory, EventBus eventBus) {
        this.governor = governor;
        this.agentFactory = agentFactory;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.systemMetrics(governor.getSystemMetrics());

        var agents = agentFactory.listActiveAgents();
        System.out.println();
        if (agents.isEmpty()) {
            ConsoleOutput.info("No active root agents.");
        } else {
            System.out.printf("  %-38s %-12s %-10s %s%n", "AGENT", "ROLE", "PHASE", "CHILDREN");
            System.out.println("  " + "-".repeat(70));
            for (var agent : agents) {
                var status = agent.getStatus();
                System.out.printf("  %-38s %-12s %-10s %d%n",
                        status.id(), agent.getRole(), status.phase(), status.childCount());
            }
        }

        List<AgentEvent> recent = eventBus.recentEvents(events);
        if (!recent.isEmpty()) {
            System.out.println();
            ConsoleOutput.info("Recent events (" + recent.size() + "):");
            for (AgentEvent event : recent) {
                ConsoleOutput.watchEvent(event.eventType(),
                        (event.agentId() != null ? event.agentId() + " " : "") + event.detail());
            }
        }
    }
}
