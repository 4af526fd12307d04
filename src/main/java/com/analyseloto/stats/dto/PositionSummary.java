package com.analyseloto.stats.dto;

import lombok.Builder;
import lombok.Value;

import java.io.Serial;
import java.io.Serializable;

/**
 * Résumé statistique d'une position (distribution des écarts toutes valeurs confondues).
 */
@Value
@Builder
public class PositionSummary implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    int position;
    int totalDraws;
    int uniqueValues;
    int mostFrequentValue;
    int leastFrequentValue;
    double averageSkip;
    double medianSkip;
    int modeSkip;
    int maxSkip;
    int minSkip;
    double standardDeviation;
    double variance;
    int range;
}
