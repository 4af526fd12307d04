package com.analyseloto.stats.enums;

import lombok.Getter;

/**
 * Type de calcul mis en cache. Sert de préfixe aux clés et de catégorie dans les statistiques.
 */
@Getter
public enum ComputationKind {
    POSITION_STATS("position-stats"),
    POSITION_SUMMARY("position-summary"),
    TRANSITIONS("transitions"),
    CORRELATION("correlation"),
    COMBINATION_SCORE("combination-score"),
    VALUE_RANKING("value-ranking"),
    TOP_COMBINATIONS("top-combinations"),
    DUE_COMBINATIONS("due-combinations");

    private final String prefix;

    ComputationKind(String prefix) {
        this.prefix = prefix;
    }
}
