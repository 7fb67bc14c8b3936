package com.roundabout.core.agent;

import com.roundabout.core.governor.ApprovalRequest;
import com.roundabout.core.governor.ApprovalResponse;
import com.roundabout.core.governor.OperationType;
import com.roundabout.core.llm.ChatRequest;
import com.roundabout.core.llm.ModelCatalog;
import com.roundabout.core.model.ContextThread;
import com.roundabout.core.model.ResourceUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Model-backed closure for coordinators. Asks the governor for an
 * {@code llm_call}, then asks the model whether coordination can complete.
 * Denial, provider errors and timeouts fall back to the local heuristic.
 */
class CoordinatorEmergence implements EmergenceStrategy {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorEmergence.class);

    static final long COMPUTE_UNITS = 10;
    static final ModelCatalog.ProviderHint HINT = new ModelCatalog.ProviderHint(
            ModelCatalog.Speed.ULTRA_FAST, ModelCatalog.Cost.FREE, ModelCatalog.Capability.CHAT);

    private static final Pattern SUCCESS_PREFIX = Pattern.compile("^SUCCESS:\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern FAILURE_PREFIX = Pattern.compile("^FAILURE:\\s*", Pattern.CASE_INSENSITIVE);

    @Override
    public EmergenceResult attemptClosure(CognitiveAgent agent) {
        agent.consume(ResourceUsage.computeUnits(COMPUTE_UNITS));
        AgentServices services = agent.services();
        ContextThread thread = agent.getContextThread();
        AgentProperties.Coordinator settings = services.properties().getCoordinator();

        ApprovalResponse approval = services.governor().requestApproval(new ApprovalRequest(
                OperationType.LLM_CALL, agent.getId(), ResourceUsage.llmCalls(1), thread,
                Map.of(ApprovalRequest.PARAM_MAX_TOKENS, settings.getMaxTokens())));
        if (!approval.approved()) {
            log.info("Model call not approved ({}), using local heuristic", approval.reason());
            services.metrics().recordModelFallback("denied");
            return HeuristicEmergence.COORDINATOR_FALLBACK.decide(agent);
        }

        ChatRequest request = new ChatRequest(systemPrompt(thread),
                "Please coordinate the following task: " + thread.taskDefinition(),
                settings.getMaxTokens(), settings.getTemperature(), chooseModel(thread));
        Future<String> call = services.agentExecutor().submit(() -> services.llmService().chat(request));
        String content;
        try {
            content = call.get(services.properties().getModelCallTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Model call timed out after {}, using local heuristic",
                    services.properties().getModelCallTimeout());
            services.metrics().recordModelFallback("timeout");
            return HeuristicEmergence.COORDINATOR_FALLBACK.decide(agent);
        } catch (ExecutionException e) {
            log.warn("Model call failed: {}, using local heuristic", e.getCause().getMessage());
            services.metrics().recordModelFallback("provider_error");
            return HeuristicEmergence.COORDINATOR_FALLBACK.decide(agent);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            services.metrics().recordModelFallback("interrupted");
            return HeuristicEmergence.COORDINATOR_FALLBACK.decide(agent);
        }

        agent.consume(ResourceUsage.llmCalls(1));
        if (content.toUpperCase().startsWith("SUCCESS")) {
            return EmergenceResult.success(SUCCESS_PREFIX.matcher(content).replaceFirst(""));
        }
        return EmergenceResult.failure(FAILURE_PREFIX.matcher(content).replaceFirst(""));
    }

    static String systemPrompt(ContextThread thread) {
        return """
                You are a Coordinator cognitive agent. Your task is to coordinate and manage sub-tasks effectively.
                Current context: %s
                Goal: %s

                Analyze the current situation and determine if coordination tasks can be completed successfully.
                Respond with either "SUCCESS: [brief explanation]" or "FAILURE: [brief explanation]"
                """.formatted(thread.taskDefinition(), thread.topLevelGoal());
    }

    /**
     * The profile's model when it names one, otherwise the catalog's best match for {@link #HINT}.
     */
    static String chooseModel(ContextThread thread) {
        String configured = thread.configurationProfile().llmModel();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return ModelCatalog.bestMatch(HINT).map(ModelCatalog.ModelInfo::id).orElse(null);
    }
}
