package com.analyseloto.stats.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class TemporalStability {
    private double autocorrelation; // lag 1
    private double trendPValue;     // Mann-Kendall, bilatéral
    private double volatility;      // écart quadratique moyen des différences successives

    public static TemporalStability undetermined() {
        return new TemporalStability(0.0, 1.0, 0.0);
    }
}
