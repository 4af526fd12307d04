package com.analyseloto.stats.service;

import com.analyseloto.stats.config.EngineSettings;
import com.analyseloto.stats.dto.ConfidenceInterval;
import com.analyseloto.stats.dto.HitRateBreakdown;
import com.analyseloto.stats.dto.Prediction;
import com.analyseloto.stats.dto.SignificanceResult;
import com.analyseloto.stats.dto.ValidationResult;
import com.analyseloto.stats.enums.MatchMode;
import com.analyseloto.stats.model.Draw;
import com.analyseloto.stats.model.GameFormat;
import com.analyseloto.stats.service.calcul.StatisticsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Confrontation de prédictions à des tirages réels : précision, paliers de correspondances,
 * intervalle de Wilson et significativité contre le hasard.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationService {

    private final StatisticsCalculator calculator;
    private final EngineSettings settings;

    /**
     * Chaque prédiction est comparée à chaque tirage réel.
     * Une comparaison est "juste" quand le nombre de correspondances atteint {@code expectedHits}.
     * @param predictions combinaisons prédites
     * @param actualDraws tirages réels
     * @param format format du jeu (arité, plages)
     * @return résultat invalide (sans exception) si l'une des deux listes est vide
     */
    public ValidationResult validatePredictions(List<Prediction> predictions, List<Draw> actualDraws, GameFormat format) {
        int fullMatch = format.getPositions();
        double level = settings.getConfidenceLevel();

        if (predictions == null || predictions.isEmpty()) {
            return ValidationResult.invalid("Aucune prédiction à valider", fullMatch, level);
        }
        if (actualDraws == null || actualDraws.isEmpty()) {
            return ValidationResult.invalid("Aucun tirage réel pour la validation", fullMatch, level);
        }

        long total = 0;
        long correct = 0;
        long[] atLeast = new long[fullMatch + 1];
        double baselineSum = 0.0;
        double[] bucketBaselineSum = new double[fullMatch + 1];
        Map<String, Double> baselineMemo = new HashMap<>();

        for (Prediction prediction : predictions) {
            List<Integer> combination = prediction.getCombination();
            format.validate(combination);

            double baseline = baseline(format, combination, prediction.getExpectedHits(), baselineMemo);
            double[] bucketBaselines = new double[fullMatch + 1];
            for (int k = 1; k <= fullMatch; k++) bucketBaselines[k] = baseline(format, combination, k, baselineMemo);

            for (Draw actual : actualDraws) {
                int matches = calculator.countMatches(combination, actual.getValues(), settings.getMatchMode());
                total++;
                if (matches >= prediction.getExpectedHits()) correct++;
                for (int k = 1; k <= Math.min(matches, fullMatch); k++) atLeast[k]++;

                baselineSum += baseline;
                for (int k = 1; k <= fullMatch; k++) bucketBaselineSum[k] += bucketBaselines[k];
            }
        }

        double accuracy = (double) correct / total;
        double baselineRate = baselineSum / total;

        Map<Integer, Long> counts = new TreeMap<>();
        Map<Integer, Double> rates = new TreeMap<>();
        Map<Integer, SignificanceResult> bucketSignificance = new TreeMap<>();
        for (int k = 1; k <= fullMatch; k++) {
            counts.put(k, atLeast[k]);
            rates.put(k, (double) atLeast[k] / total);
            bucketSignificance.put(k, calculator.chiSquareSignificance(atLeast[k], total, bucketBaselineSum[k] / total));
        }

        ConfidenceInterval interval = calculator.wilson(correct, total, level);
        SignificanceResult significance = calculator.binomialSignificance(correct, total, baselineRate);

        return ValidationResult.builder()
                .valid(true)
                .accuracy(accuracy)
                .confidence(confidence(accuracy, total, significance.isSignificant()))
                .totalComparisons(total)
                .correctComparisons(correct)
                .baselineRate(baselineRate)
                .hitRates(new HitRateBreakdown(counts, rates, fullMatch))
                .confidenceInterval(interval)
                .significance(significance)
                .hitRateSignificance(bucketSignificance)
                .build();
    }

    /**
     * Confiance = précision, modulée par le volume de comparaisons et par la significativité.
     */
    double confidence(double accuracy, long total, boolean significant) {
        double sampleFactor = Math.min(total / 1000.0, 1.0);
        double significanceFactor = significant ? 1.0 : 0.5;
        double volumeFactor = Math.max(0.1, Math.min(1.0, total / 100.0));
        return accuracy * sampleFactor * significanceFactor * volumeFactor;
    }

    private double baseline(GameFormat format, List<Integer> combination, int atLeast, Map<String, Double> memo) {
        // En mode STRAIGHT la baseline ne dépend pas des valeurs prédites
        String key = settings.getMatchMode() == MatchMode.BOX
                ? "B" + atLeast + combination.stream().sorted().toList()
                : "S" + atLeast;
        return memo.computeIfAbsent(key, k -> calculator.randomBaseline(
                format, combination, atLeast, settings.getMatchMode(), settings.getMaxBaselineEnumeration()));
    }
}
