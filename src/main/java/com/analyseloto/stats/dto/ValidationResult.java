package com.analyseloto.stats.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ValidationResult {
    private boolean valid;
    private double accuracy;
    private double confidence;
    private String error;
    private long totalComparisons;
    private long correctComparisons;
    private double baselineRate;
    private HitRateBreakdown hitRates;
    private ConfidenceInterval confidenceInterval;
    private SignificanceResult significance;
    private Map<Integer, SignificanceResult> hitRateSignificance;

    /**
     * Résultat "invalide" contrôlé : aucune exception, tous les détails à zéro.
     */
    public static ValidationResult invalid(String error, int fullMatch, double confidenceLevel) {
        return ValidationResult.builder()
                .valid(false)
                .error(error)
                .hitRates(new HitRateBreakdown(Collections.emptyMap(), Collections.emptyMap(), fullMatch))
                .confidenceInterval(ConfidenceInterval.empty(confidenceLevel))
                .significance(SignificanceResult.notSignificant(0.0, 0.0))
                .hitRateSignificance(Collections.emptyMap())
                .build();
    }

    public double getPValue() {
        return significance == null ? 1.0 : significance.getPValue();
    }

    public boolean isSignificant() {
        return significance != null && significance.isSignificant();
    }
}
