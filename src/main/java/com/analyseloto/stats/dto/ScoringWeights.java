package com.analyseloto.stats.dto;

import lombok.Value;

/**
 * Pondérations du score composite. Normalisées à 1 avant usage.
 */
@Value
public class ScoringWeights {
    private static final double EPSILON = 1e-9;

    double due;
    double parity;
    double hotCold;
    double transition;
    double correlation;

    public static ScoringWeights defaults() {
        return new ScoringWeights(0.30, 0.10, 0.20, 0.25, 0.15);
    }

    public double sum() {
        return due + parity + hotCold + transition + correlation;
    }

    /**
     * Renvoie un jeu de poids dont la somme vaut 1.
     * @throws IllegalArgumentException si un poids est négatif ou si la somme est nulle
     */
    public ScoringWeights normalized() {
        if (due < 0 || parity < 0 || hotCold < 0 || transition < 0 || correlation < 0) {
            throw new IllegalArgumentException("Les poids de scoring doivent être positifs : " + this);
        }
        double total = sum();
        if (total <= EPSILON) {
            throw new IllegalArgumentException("La somme des poids de scoring doit être strictement positive");
        }
        if (Math.abs(total - 1.0) <= EPSILON) return this;
        return new ScoringWeights(due / total, parity / total, hotCold / total, transition / total, correlation / total);
    }
}
