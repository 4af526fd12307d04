package com.analyseloto.stats.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class SignificanceResult {
    private double pValue;
    private boolean significant;
    private double observedRate;
    private double expectedRate;
    private double statistic;

    public static SignificanceResult notSignificant(double observedRate, double expectedRate) {
        return new SignificanceResult(1.0, false, observedRate, expectedRate, 0.0);
    }
}
