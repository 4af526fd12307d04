package com.analyseloto.stats.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ConfidenceInterval {
    private double lower;
    private double mean;
    private double upper;
    private double level;

    public static ConfidenceInterval empty(double level) {
        return new ConfidenceInterval(0.0, 0.0, 0.0, level);
    }
}
