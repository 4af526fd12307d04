package com.analyseloto.stats.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Comptes et taux par palier de correspondances : clé k = "au moins k bonnes valeurs".
 * Le palier {@code fullMatch} correspond à la combinaison complète.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class HitRateBreakdown {
    private Map<Integer, Long> counts;
    private Map<Integer, Double> rates;
    private int fullMatch;

    public double rate(int atLeast) {
        return rates == null ? 0.0 : rates.getOrDefault(atLeast, 0.0);
    }

    public double fullMatchRate() {
        return rate(fullMatch);
    }
}
