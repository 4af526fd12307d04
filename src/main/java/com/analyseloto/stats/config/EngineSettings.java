package com.analyseloto.stats.config;

import com.analyseloto.stats.enums.MatchMode;
import lombok.Builder;
import lombok.Value;

/**
 * Réglages du moteur (seuils, scoring, validation). Alimentés par {@link EngineConfig}.
 */
@Value
@Builder
public class EngineSettings {
    // Nombre minimal de tirages par calcul
    @Builder.Default int minDrawsTrend = 3;
    @Builder.Default int minDrawsCombination = 20;
    @Builder.Default int minDrawsCorrelation = 3;

    // Recherche de combinaisons
    @Builder.Default int candidatesPerPosition = 5;
    @Builder.Default int dueCombinationLimit = 20;

    // Validation
    @Builder.Default double confidenceLevel = 0.95;
    @Builder.Default MatchMode matchMode = MatchMode.STRAIGHT;
    @Builder.Default int parallelFolds = 1;
    @Builder.Default long maxBaselineEnumeration = 1_000_000L;

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }
}
