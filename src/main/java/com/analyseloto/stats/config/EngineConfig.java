package com.analyseloto.stats.config;

import com.analyseloto.stats.dto.ScoringWeights;
import com.analyseloto.stats.enums.MatchMode;
import com.analyseloto.stats.model.GameFormat;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    // Format du jeu (par défaut : Pick 3)
    @Value("${stats.engine.format.positions:3}")
    private int positions;
    @Value("${stats.engine.format.min:0}")
    private int minValue;
    @Value("${stats.engine.format.max:9}")
    private int maxValue;
    // Plages par position ("0-9,0-9,1-26"), prioritaires sur positions/min/max
    @Value("${stats.engine.format.ranges:}")
    private String ranges;

    @Value("${stats.engine.min-draws.trend:3}")
    private int minDrawsTrend;
    @Value("${stats.engine.min-draws.combination:20}")
    private int minDrawsCombination;
    @Value("${stats.engine.min-draws.correlation:3}")
    private int minDrawsCorrelation;

    @Value("${stats.engine.weights.due:0.30}")
    private double weightDue;
    @Value("${stats.engine.weights.parity:0.10}")
    private double weightParity;
    @Value("${stats.engine.weights.hot-cold:0.20}")
    private double weightHotCold;
    @Value("${stats.engine.weights.transition:0.25}")
    private double weightTransition;
    @Value("${stats.engine.weights.correlation:0.15}")
    private double weightCorrelation;

    @Value("${stats.engine.scoring.candidates-per-position:5}")
    private int candidatesPerPosition;
    @Value("${stats.engine.scoring.due-combination-limit:20}")
    private int dueCombinationLimit;

    @Value("${stats.engine.validation.confidence-level:0.95}")
    private double confidenceLevel;
    @Value("${stats.engine.validation.match-mode:STRAIGHT}")
    private MatchMode matchMode;
    @Value("${stats.engine.validation.parallel-folds:1}")
    private int parallelFolds;
    @Value("${stats.engine.validation.max-baseline-enumeration:1000000}")
    private long maxBaselineEnumeration;

    @Bean
    public GameFormat gameFormat() {
        if (ranges != null && !ranges.isBlank()) {
            return GameFormat.parse(ranges);
        }
        return GameFormat.uniform(positions, minValue, maxValue);
    }

    @Bean
    public ScoringWeights scoringWeights() {
        // Validation immédiate : un paramétrage négatif ou nul empêche le démarrage
        return new ScoringWeights(weightDue, weightParity, weightHotCold, weightTransition, weightCorrelation).normalized();
    }

    @Bean
    public EngineSettings engineSettings() {
        return EngineSettings.builder()
                .minDrawsTrend(minDrawsTrend)
                .minDrawsCombination(minDrawsCombination)
                .minDrawsCorrelation(minDrawsCorrelation)
                .candidatesPerPosition(candidatesPerPosition)
                .dueCombinationLimit(dueCombinationLimit)
                .confidenceLevel(confidenceLevel)
                .matchMode(matchMode)
                .parallelFolds(parallelFolds)
                .maxBaselineEnumeration(maxBaselineEnumeration)
                .build();
    }
}
