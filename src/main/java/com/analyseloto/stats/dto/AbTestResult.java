package com.analyseloto.stats.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class AbTestResult {
    private String winner; // null si la différence n'est pas significative
    private double confidence;
    private ValidationResult resultA;
    private ValidationResult resultB;
    private double pValue;
    private boolean significant;
}
