package com.roundabout.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelCatalogTest {

    @Test
    @DisplayName("free ultra-fast chat picks the local model")
    void freeFastChat() {
        var hint = new ModelCatalog.ProviderHint(ModelCatalog.Speed.ULTRA_FAST, ModelCatalog.Cost.FREE,
                ModelCatalog.Capability.CHAT);

        assertEquals("llama3.2", ModelCatalog.bestMatch(hint).orElseThrow().id());
    }

    @Test
    @DisplayName("speed preference picks the closest paid model")
    void closestSpeed() {
        var hint = new ModelCatalog.ProviderHint(ModelCatalog.Speed.MEDIUM, ModelCatalog.Cost.HIGH,
                ModelCatalog.Capability.VISION);

        assertEquals("gpt-4o", ModelCatalog.bestMatch(hint).orElseThrow().id());
    }

    @Test
    @DisplayName("no model matches an impossible hint")
    void noMatch() {
        var hint = new ModelCatalog.ProviderHint(null, ModelCatalog.Cost.FREE, ModelCatalog.Capability.VISION);

        assertTrue(ModelCatalog.bestMatch(hint).isEmpty());
    }

    @Test
    @DisplayName("findModel looks up by id and formats prices")
    void findModel() {
        var mini = ModelCatalog.findModel("gpt-4o-mini").orElseThrow();

        assertFalse(mini.isFree());
        assertTrue(mini.priceDisplay().endsWith("per 1M tokens"));
        assertEquals("free", ModelCatalog.findModel("llama3.2").orElseThrow().priceDisplay());
        assertTrue(ModelCatalog.findModel("unknown").isEmpty());
    }
}
