package com.analyseloto.stats.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class TransitionPrediction {
    private int position;
    private int fromValue;
    private int toValue;
    private int count;
    private double probability;
    private int lastSeenIndex;
    private int skipCount;
    private double skipAdjustedProbability;
}
