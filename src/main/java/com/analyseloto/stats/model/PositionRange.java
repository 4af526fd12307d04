package com.analyseloto.stats.model;

import lombok.Value;

/**
 * Plage fermée [min, max] des valeurs possibles pour une position.
 */
@Value
public class PositionRange {
    int min;
    int max;

    public PositionRange(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("Plage invalide : [" + min + ", " + max + "]");
        }
        this.min = min;
        this.max = max;
    }

    public int size() {
        return max - min + 1;
    }

    public boolean contains(int value) {
        return value >= min && value <= max;
    }
}
