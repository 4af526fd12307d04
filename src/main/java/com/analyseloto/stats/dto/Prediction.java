package com.analyseloto.stats.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Une combinaison prédite, avec le nombre de correspondances attendu pour la compter "juste".
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Prediction {
    private List<Integer> combination;
    private double confidence;
    private int expectedHits;
}
