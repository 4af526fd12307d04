package com.analyseloto.stats.service;

import com.analyseloto.stats.dto.Prediction;
import com.analyseloto.stats.model.DrawSnapshot;

import java.util.List;

/**
 * Stratégie de prédiction évaluée par la validation croisée.
 */
@FunctionalInterface
public interface PredictionFunction {

    /**
     * @param training tirages d'entraînement (ordre chronologique, même format que l'historique)
     * @param testSize nombre de tirages du pli de test
     * @return combinaisons prédites
     * @throws Exception toute erreur rend le pli invalide sans interrompre la validation
     */
    List<Prediction> predict(DrawSnapshot training, int testSize) throws Exception;
}
