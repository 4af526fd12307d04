package com.analyseloto.stats.enums;

/**
 * Tendance des écarts récents d'une valeur.
 * INCREASING = les écarts s'allongent (la valeur sort moins souvent).
 */
public enum Trend {
    INCREASING,
    DECREASING,
    STABLE
}
