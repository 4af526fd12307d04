package com.analyseloto.stats.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class FoldResult {
    private int foldIndex;
    private int testStart;   // inclus
    private int testEnd;     // exclu
    private int trainSize;
    private ValidationResult validation;

    public int getTestSize() {
        return testEnd - testStart;
    }

    public boolean isValid() {
        return validation != null && validation.isValid();
    }

    public double getAccuracy() {
        return validation == null ? 0.0 : validation.getAccuracy();
    }
}
