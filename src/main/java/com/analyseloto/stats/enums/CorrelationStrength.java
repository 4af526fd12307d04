package com.analyseloto.stats.enums;

import lombok.Getter;

@Getter
public enum CorrelationStrength {
    WEAK(0.0),
    MODERATE(0.3),
    STRONG(0.7);

    // Borne basse (incluse) sur |r|
    private final double lowerBound;

    CorrelationStrength(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public static CorrelationStrength fromCoefficient(double coefficient) {
        double abs = Math.abs(coefficient);
        if (abs >= STRONG.lowerBound) return STRONG;
        if (abs >= MODERATE.lowerBound) return MODERATE;
        return WEAK;
    }
}
