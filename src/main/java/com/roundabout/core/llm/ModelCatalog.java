package com.roundabout.core.llm;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Models reachable through the OpenAI-compatible chat endpoint, and the
 * provider-hint matching agents use to pick one.
 */
public final class ModelCatalog {

    public enum Speed { SLOW, MEDIUM, FAST, ULTRA_FAST }

    public enum Cost { FREE, LOW, MEDIUM, HIGH }

    public enum Capability { CHAT, COMPLETION, EMBEDDING, VISION, FUNCTION_CALLING }

    public record ModelInfo(
            String id,
            String name,
            String provider,
            Speed speed,
            double inputPricePer1M,
            double outputPricePer1M,
            Set<Capability> capabilities,
            String description
    ) {
        public boolean isFree() {
            return inputPricePer1M == 0.0 && outputPricePer1M == 0.0;
        }

        public String priceDisplay() {
            return isFree() ? "free" : String.format("$%.2f / $%.2f per 1M tokens", inputPricePer1M, outputPricePer1M);
        }
    }

    /**
     * Selection criteria; null fields are not constrained.
     */
    public record ProviderHint(Speed speed, Cost cost, Capability capability) {
    }

    public static final List<ModelInfo> MODELS = List.of(
            new ModelInfo("llama3.2", "Llama 3.2 (local)", "ollama", Speed.ULTRA_FAST,
                    0.0, 0.0, Set.of(Capability.CHAT, Capability.COMPLETION),
                    "Local model served through an OpenAI-compatible endpoint"),
            new ModelInfo("gpt-4o-mini", "GPT-4o Mini", "openai", Speed.FAST,
                    0.15, 0.60, Set.of(Capability.CHAT, Capability.COMPLETION, Capability.VISION,
                    Capability.FUNCTION_CALLING),
                    "Fast and affordable"),
            new ModelInfo("gpt-4o", "GPT-4o", "openai", Speed.MEDIUM,
                    2.50, 10.00, Set.of(Capability.CHAT, Capability.COMPLETION, Capability.VISION,
                    Capability.FUNCTION_CALLING),
                    "Best overall value"),
            new ModelInfo("text-embedding-3-small", "Text Embedding 3 Small", "openai", Speed.ULTRA_FAST,
                    0.02, 0.0, Set.of(Capability.EMBEDDING),
                    "Embeddings only")
    );

    private ModelCatalog() {}

    public static Optional<ModelInfo> findModel(String modelId) {
        return MODELS.stream().filter(m -> m.id().equals(modelId)).findFirst();
    }

    /**
     * Best model for the hint: filters by capability and (for {@link Cost#FREE})
     * by price, then prefers the speed closest to the requested one. Ties keep
     * catalog order.
     */
    public static Optional<ModelInfo> bestMatch(ProviderHint hint) {
        var candidates = MODELS.stream()
                .filter(m -> hint.capability() == null || m.capabilities().contains(hint.capability()))
                .filter(m -> hint.cost() != Cost.FREE || m.isFree());
        if (hint.speed() != null) {
            int target = hint.speed().ordinal();
            candidates = candidates.sorted(Comparator.comparingInt(m -> Math.abs(m.speed().ordinal() - target)));
        }
        return candidates.findFirst();
    }
}
