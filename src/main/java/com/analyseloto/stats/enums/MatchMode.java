package com.analyseloto.stats.enums;

/**
 * Manière de compter les correspondances entre une prédiction et un tirage réel.
 */
public enum MatchMode {
    /** Ordre exact : la valeur doit être à la même position. */
    STRAIGHT,
    /** Ordre indifférent : intersection des multi-ensembles de valeurs. */
    BOX
}
