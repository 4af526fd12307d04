package com.analyseloto.stats.dto;

import com.analyseloto.stats.enums.CorrelationStrength;
import lombok.Value;

import java.io.Serial;
import java.io.Serializable;

@Value
public class Correlation implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    int positionA;   // toujours < positionB
    int positionB;
    double coefficient;
    CorrelationStrength strength;
    double significance; // 1 - p-value bilatérale, 0 si indéfini
    int sampleSize;

    public static Correlation undefined(int positionA, int positionB, int sampleSize) {
        return new Correlation(positionA, positionB, 0.0, CorrelationStrength.WEAK, 0.0, sampleSize);
    }
}
