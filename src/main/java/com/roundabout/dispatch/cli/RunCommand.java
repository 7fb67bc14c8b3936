package com.roundabout.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.roundabout.core.RoundaboutException;
import com.roundabout.core.agent.AgentFactory;
import com.roundabout.core.agent.CognitiveAgent;
import com.roundabout.core.agent.TerminationSummary;
import com.roundabout.core.governor.ApprovalDeniedException;
import com.roundabout.core.governor.ResourceGovernor;
import com.roundabout.core.model.AgentResponse;
import com.roundabout.core.model.AgentRole;
import com.roundabout.core.model.ConfigurationProfile;
import com.roundabout.core.model.UserInput;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI command: roundabout run "&lt;input&gt;"...
 * <p>
 * Creates a root agent, feeds it each input through the loop, optionally
 * asks it to clone children, then terminates the hierarchy and prints the
 * governor's view of what was spent.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a root agent over one or more inputs")
@Component
public class RunCommand implements Runnable {

    @Parameters(arity = "0..*", description = "Inputs to process, in order")
    private List<String> inputs = new ArrayList<>();

    @Option(names = {"--role", "-r"}, description = "Agent role: ${COMPLETION-CANDIDATES}", defaultValue = "CONSCIOUS")
    private AgentRole role;

    @Option(names = {"--goal", "-g"}, description = "Top-level goal", defaultValue = "Process user input")
    private String goal;

    @Option(names = {"--task", "-t"}, description = "Root task definition", defaultValue = "Handle user request")
    private String task;

    @Option(names = {"--user", "-u"}, description = "Owning user (default: ${DEFAULT-VALUE})", defaultValue = "default-user")
    private String user;

    @Option(names = {"--model"}, description = "Model the agent prefers", defaultValue = "")
    private String model;

    @Option(names = {"--clones", "-c"}, description = "Children to clone after processing", defaultValue = "0")
    private int clones;

    @Option(names = {"--json"}, description = "Print the result as JSON")
    private boolean json;

    private final AgentFactory agentFactory;
    private final ResourceGovernor governor;
    private final Clock clock;

    public RunCommand(AgentFactory agentFactory, ResourceGovernor governor, Clock clock) {
        this.agentFactory = agentFactory;
        this.governor = governor;
        this.clock = clock;
    }

    @Override
    public void run() {
        if (!json) {
            ConsoleOutput.printBanner();
        }

        ConfigurationProfile profile = ConfigurationProfile.of(model.isBlank() ? null : model, "user:" + user);
        CognitiveAgent agent = agentFactory.createAgent(profile, role, goal, task);
        if (!json) {
            ConsoleOutput.info("Created " + role + " agent " + agent.getId());
        }

        List<Map<String, Object>> responses = new ArrayList<>();
        for (String text : inputs) {
            try {
                AgentResponse response = agent.processInput(UserInput.chat(text, clock.instant()));
                responses.add(Map.of("input", text, "response", response.text(), "phase", agent.getPhase().name()));
                if (!json) {
                    ConsoleOutput.agent(role.name(), response.text());
                }
            } catch (RoundaboutException e) {
                responses.add(Map.of("input", text, "error", e.getMessage(), "phase", agent.getPhase().name()));
                if (!json) {
                    ConsoleOutput.error(e.getMessage());
                }
                if (agent.isHalted()) {
                    break;
                }
            }
        }

        List<Map<String, Object>> cloneResults = new ArrayList<>();
        for (int i = 1; i <= clones; i++) {
            String childTask = task + " (part " + i + ")";
            try {
                CognitiveAgent child = agent.clone(profile, childTask);
                cloneResults.add(Map.of("task", childTask, "childId", child.getId()));
                if (!json) {
                    ConsoleOutput.governor(true, "clone " + i + " -> " + child.getId());
                }
            } catch (ApprovalDeniedException e) {
                cloneResults.add(Map.of("task", childTask, "denied", String.valueOf(e.getDenialReason()),
                        "reason", e.getMessage()));
                if (!json) {
                    ConsoleOutput.governor(false, "clone " + i + ": " + e.getMessage());
                }
            } catch (RoundaboutException e) {
                cloneResults.add(Map.of("task", childTask, "error", e.getMessage()));
                if (!json) {
                    ConsoleOutput.error("clone " + i + ": " + e.getMessage());
                }
            }
        }

        var usage = agent.getUsage();
        List<TerminationSummary> summaries = agentFactory.terminateAll();

        if (json) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("agentId", agent.getId());
            result.put("role", role.name());
            result.put("responses", responses);
            result.put("clones", cloneResults);
            result.put("usage", usage);
            result.put("terminated", summaries);
            result.put("system", governor.getSystemMetrics());
            System.out.println(toJson(result));
            return;
        }

        ConsoleOutput.usage("Agent usage", usage);
        summaries.forEach(ConsoleOutput::termination);
        ConsoleOutput.systemMetrics(governor.getSystemMetrics());
    }

    static String toJson(Object value) {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RoundaboutException("Failed to render JSON output", e);
        }
    }
}
