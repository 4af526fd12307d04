package com.analyseloto.stats.service;

import com.analyseloto.stats.config.EngineSettings;
import com.analyseloto.stats.dto.AbTestResult;
import com.analyseloto.stats.dto.ConfidenceInterval;
import com.analyseloto.stats.dto.CrossValidationReport;
import com.analyseloto.stats.dto.FoldResult;
import com.analyseloto.stats.dto.Prediction;
import com.analyseloto.stats.dto.SignificanceResult;
import com.analyseloto.stats.dto.TemporalStability;
import com.analyseloto.stats.dto.ValidationResult;
import com.analyseloto.stats.exception.InsufficientDataException;
import com.analyseloto.stats.model.Draw;
import com.analyseloto.stats.model.DrawSnapshot;
import com.analyseloto.stats.model.GameFormat;
import com.analyseloto.stats.service.calcul.StatisticsCalculator;
import com.analyseloto.stats.util.Constantes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Validation croisée k-plis d'une fonction de prédiction et A/B test entre deux prédicteurs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestService {

    private static final double UNSTABLE_STD_DEV = 0.10;
    private static final double STRONG_AUTOCORRELATION = 0.5;
    private static final double HIGH_VOLATILITY = 0.20;

    private final ValidationService validationService;
    private final StatisticsCalculator calculator;
    private final EngineSettings settings;

    public CrossValidationReport crossValidate(PredictionFunction predictFn, int k, DrawSnapshot snapshot) {
        return crossValidate(predictFn, k, snapshot, CancellationSignal.NONE, FoldProgressListener.NONE);
    }

    /**
     * Validation croisée sur k plis contigus. Le dernier pli absorbe le reste de la division.
     * @param predictFn fonction évaluée, entraînée sur les tirages hors pli
     * @param k nombre de plis (au moins 2)
     * @param snapshot historique complet
     * @param cancellation consulté entre deux plis
     * @param listener notifié après chaque pli
     * @return rapport agrégé, les plis en échec y figurent comme invalides
     * @throws InsufficientDataException moins de 2k tirages
     * @throws CancellationException annulation demandée
     */
    public CrossValidationReport crossValidate(PredictionFunction predictFn, int k, DrawSnapshot snapshot,
                                              CancellationSignal cancellation, FoldProgressListener listener) {
        if (k < 2) {
            throw new IllegalArgumentException("La validation croisée exige au moins 2 plis (reçu " + k + ")");
        }
        int n = snapshot.size();
        if (n < 2 * k) {
            throw new InsufficientDataException(n, 2 * k,
                    "Pas assez de tirages pour " + k + " plis : " + n + " disponibles, " + (2 * k) + " requis");
        }

        log.info("🧪 Démarrage de la validation croisée : {} plis sur {} tirages", k, n);
        long start = System.currentTimeMillis();

        int foldSize = n / k;
        List<FoldResult> folds = settings.getParallelFolds() > 1
                ? runParallel(predictFn, k, foldSize, snapshot, cancellation, listener)
                : runSequential(predictFn, k, foldSize, snapshot, cancellation, listener);

        CrossValidationReport report = aggregate(k, folds);
        log.info("✅ Validation croisée terminée en {} ms. Précision moyenne : {} ({} plis valides sur {})",
                System.currentTimeMillis() - start, String.format("%.4f", report.getMeanAccuracy()), report.getValidFolds(), k);
        return report;
    }

    private List<FoldResult> runSequential(PredictionFunction predictFn, int k, int foldSize, DrawSnapshot snapshot,
                                           CancellationSignal cancellation, FoldProgressListener listener) {
        List<FoldResult> folds = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            checkCancelled(cancellation, i);
            FoldResult fold = runFold(predictFn, i, k, foldSize, snapshot);
            folds.add(fold);
            notifyProgress(listener, fold, i + 1, k);
        }
        return folds;
    }

    private List<FoldResult> runParallel(PredictionFunction predictFn, int k, int foldSize, DrawSnapshot snapshot,
                                         CancellationSignal cancellation, FoldProgressListener listener) {
        int nThreads = Math.min(settings.getParallelFolds(), k);
        ExecutorService executor = Executors.newFixedThreadPool(nThreads);
        List<Future<FoldResult>> futures = new ArrayList<>(k);
        try {
            for (int i = 0; i < k; i++) {
                final int foldIndex = i;
                futures.add(executor.submit(() -> {
                    checkCancelled(cancellation, foldIndex);
                    return runFold(predictFn, foldIndex, k, foldSize, snapshot);
                }));
            }

            // Assemblage dans l'ordre des plis
            List<FoldResult> folds = new ArrayList<>(k);
            for (int i = 0; i < k; i++) {
                FoldResult fold = await(futures.get(i));
                folds.add(fold);
                notifyProgress(listener, fold, i + 1, k);
            }
            return folds;
        } catch (CancellationException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        } finally {
            executor.shutdown();
        }
    }

    private FoldResult await(Future<FoldResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Validation croisée interrompue");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CancellationException) throw (CancellationException) e.getCause();
            throw new IllegalStateException("Échec inattendu d'un pli", e.getCause());
        }
    }

    private FoldResult runFold(PredictionFunction predictFn, int foldIndex, int k, int foldSize, DrawSnapshot snapshot) {
        int n = snapshot.size();
        int testStart = foldIndex * foldSize;
        int testEnd = foldIndex == k - 1 ? n : testStart + foldSize;

        List<Draw> draws = snapshot.getDraws();
        List<Draw> training = new ArrayList<>(n - (testEnd - testStart));
        training.addAll(draws.subList(0, testStart));
        training.addAll(draws.subList(testEnd, n));
        List<Draw> test = draws.subList(testStart, testEnd);

        ValidationResult validation = evaluate(predictFn, snapshot.withDraws(training), test, snapshot.getFormat(),
                "pli " + foldIndex);
        return new FoldResult(foldIndex, testStart, testEnd, training.size(), validation);
    }

    /**
     * Entraîne puis valide un prédicteur. Toute erreur de la fonction est isolée dans un résultat invalide.
     */
    private ValidationResult evaluate(PredictionFunction predictFn, DrawSnapshot training, List<Draw> test,
                                      GameFormat format, String label) {
        try {
            List<Prediction> predictions = predictFn.predict(training, test.size());
            return validationService.validatePredictions(predictions, test, format);
        } catch (Exception e) {
            log.error("❌ Échec de la prédiction ({}) : {}", label, e.getMessage());
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ValidationResult.invalid(message, format.getPositions(), settings.getConfidenceLevel());
        }
    }

    private void checkCancelled(CancellationSignal cancellation, int foldIndex) {
        if (cancellation.isCancelled()) {
            log.warn("🛑 Validation croisée annulée avant le pli {}", foldIndex);
            throw new CancellationException("Validation croisée annulée avant le pli " + foldIndex);
        }
    }

    private void notifyProgress(FoldProgressListener listener, FoldResult fold, int completed, int total) {
        try {
            listener.onFoldCompleted(fold, completed, total);
        } catch (RuntimeException e) {
            log.error("Erreur du suivi de progression (pli {}) : {}", fold.getFoldIndex(), e.getMessage());
        }
    }

    // --- Agrégation ---

    private CrossValidationReport aggregate(int k, List<FoldResult> folds) {
        double[] accuracies = folds.stream().mapToDouble(FoldResult::getAccuracy).toArray();
        double mean = 0.0;
        for (double a : accuracies) mean += a;
        mean /= accuracies.length;
        double squares = 0.0;
        for (double a : accuracies) squares += (a - mean) * (a - mean);
        double stdDev = Math.sqrt(squares / accuracies.length);

        int best = -1;
        int worst = -1;
        List<FoldResult> valid = new ArrayList<>();
        for (FoldResult f : folds) {
            if (!f.isValid()) continue;
            valid.add(f);
            // Inégalités strictes : à égalité le plus petit index l'emporte
            if (best < 0 || f.getAccuracy() > folds.get(best).getAccuracy()) best = f.getFoldIndex();
            if (worst < 0 || f.getAccuracy() < folds.get(worst).getAccuracy()) worst = f.getFoldIndex();
        }

        double overallConfidence = valid.stream().mapToDouble(f -> f.getValidation().getConfidence()).average().orElse(0.0);
        double meanBaseline = valid.stream().mapToDouble(f -> f.getValidation().getBaselineRate()).average().orElse(0.0);
        double[] validAccuracies = valid.stream().mapToDouble(FoldResult::getAccuracy).toArray();

        SignificanceResult accuracySignificance = valid.size() >= Constantes.MIN_FOLDS_ACCURACY_TEST
                ? calculator.tTest(validAccuracies, meanBaseline)
                : SignificanceResult.notSignificant(mean, meanBaseline);
        ConfidenceInterval interval = calculator.meanInterval(accuracies, settings.getConfidenceLevel());
        TemporalStability stability = calculator.temporalStability(accuracies);

        return CrossValidationReport.builder()
                .k(k)
                .perFold(List.copyOf(folds))
                .meanAccuracy(mean)
                .stdDevAccuracy(stdDev)
                .bestFoldIndex(best)
                .worstFoldIndex(worst)
                .validFolds(valid.size())
                .overallConfidence(overallConfidence)
                .meanAccuracyInterval(interval)
                .accuracySignificance(accuracySignificance)
                .temporalStability(stability)
                .recommendations(recommendations(k, valid.size(), mean, stdDev, meanBaseline, accuracySignificance, stability))
                .build();
    }

    List<String> recommendations(int k, int validFolds, double mean, double stdDev, double baseline,
                                 SignificanceResult significance, TemporalStability stability) {
        List<String> advice = new ArrayList<>();
        if (validFolds == 0) {
            advice.add("Aucun pli valide : résultats inexploitables, vérifier la fonction de prédiction");
            return advice;
        }
        if (validFolds < k) {
            advice.add((k - validFolds) + " pli(s) en échec : vérifier la robustesse de la fonction de prédiction");
        }
        if (mean < baseline) {
            advice.add("Précision inférieure au hasard : revoir la stratégie");
        } else if (significance.isSignificant()) {
            advice.add("Gain significatif par rapport au hasard (p = " + String.format("%.4f", significance.getPValue()) + ")");
        } else {
            advice.add("Aucun gain significatif par rapport au hasard : augmenter l'historique ou revoir la stratégie");
        }
        if (stdDev > UNSTABLE_STD_DEV) {
            advice.add("Précision instable d'un pli à l'autre (écart-type > 10 %)");
        }
        if (Math.abs(stability.getAutocorrelation()) > STRONG_AUTOCORRELATION) {
            advice.add("Forte autocorrélation entre plis : dépendance temporelle probable");
        }
        if (stability.getTrendPValue() < Constantes.SIGNIFICANCE_THRESHOLD) {
            advice.add("Tendance significative de la précision dans le temps : le modèle dérive");
        }
        if (stability.getVolatility() > HIGH_VOLATILITY) {
            advice.add("Volatilité élevée de la précision entre plis successifs");
        }
        return advice;
    }

    // --- A/B test ---

    /**
     * Compare deux prédicteurs entraînés sur les tirages hors période de test.
     * @return vainqueur uniquement si la différence de précision est significative (p < 0.05)
     */
    public AbTestResult performABTest(NamedPredictor a, NamedPredictor b, List<Draw> testDraws, DrawSnapshot snapshot) {
        Set<Draw> excluded = new HashSet<>(testDraws);
        List<Draw> training = snapshot.getDraws().stream().filter(d -> !excluded.contains(d)).toList();
        DrawSnapshot trainingSnapshot = snapshot.withDraws(training);
        List<Draw> test = DrawSnapshot.of(snapshot.getFormat(), testDraws).getDraws();

        log.info("⚖️ A/B test {} vs {} : {} tirages d'entraînement, {} de test", a.getName(), b.getName(), training.size(), test.size());
        ValidationResult resultA = evaluate(a.getFunction(), trainingSnapshot, test, snapshot.getFormat(), a.getName());
        ValidationResult resultB = evaluate(b.getFunction(), trainingSnapshot, test, snapshot.getFormat(), b.getName());

        if (!resultA.isValid() || !resultB.isValid()) {
            log.warn("A/B test sans vainqueur : au moins un prédicteur est invalide");
            return new AbTestResult(null, 0.0, resultA, resultB, 1.0, false);
        }

        double pValue = calculator.twoProportionPValue(
                resultA.getAccuracy(), resultA.getTotalComparisons(),
                resultB.getAccuracy(), resultB.getTotalComparisons());
        boolean significant = pValue < Constantes.SIGNIFICANCE_THRESHOLD;
        String winner = null;
        if (significant) {
            winner = resultA.getAccuracy() > resultB.getAccuracy() ? a.getName() : b.getName();
        }
        return new AbTestResult(winner, significant ? 1 - pValue : 0.0, resultA, resultB, pValue, significant);
    }
}
