package com.analyseloto.stats.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CrossValidationReport {
    private int k;
    private List<FoldResult> perFold;
    private double meanAccuracy;
    private double stdDevAccuracy;
    private int bestFoldIndex;   // -1 si aucun pli valide
    private int worstFoldIndex;  // -1 si aucun pli valide
    private int validFolds;
    private double overallConfidence;
    private ConfidenceInterval meanAccuracyInterval;
    private SignificanceResult accuracySignificance;
    private TemporalStability temporalStability;
    private List<String> recommendations;
}
