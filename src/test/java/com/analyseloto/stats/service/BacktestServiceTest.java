package com.analyseloto.stats.service;

import com.analyseloto.stats.DrawFixtures;
import com.analyseloto.stats.config.EngineSettings;
import com.analyseloto.stats.dto.AbTestResult;
import com.analyseloto.stats.dto.CrossValidationReport;
import com.analyseloto.stats.dto.FoldResult;
import com.analyseloto.stats.dto.Prediction;
import com.analyseloto.stats.exception.InsufficientDataException;
import com.analyseloto.stats.model.Draw;
import com.analyseloto.stats.model.DrawSnapshot;
import com.analyseloto.stats.service.calcul.StatisticsCalculator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BacktestServiceTest {

    // Prédit toujours la même combinaison, juste dès 1 bonne position
    private static final PredictionFunction CONSTANT = (training, testSize) ->
            List.of(new Prediction(List.of(1, 2, 3), 0.5, 1));

    private static BacktestService newBacktestService(EngineSettings settings) {
        StatisticsCalculator calculator = new StatisticsCalculator();
        return new BacktestService(new ValidationService(calculator, settings), calculator, settings);
    }

    private final BacktestService backtestService = newBacktestService(EngineSettings.defaults());

    @Test
    @DisplayName("✅ k=5 sur 30 tirages : 5 plis contigus de 6 tirages")
    void testDecoupageEnPlis() {
        // GIVEN
        DrawSnapshot snapshot = DrawFixtures.randomSnapshot(DrawFixtures.PICK3, 30, 9L);

        // WHEN
        CrossValidationReport report = backtestService.crossValidate(CONSTANT, 5, snapshot);

        // THEN
        assertThat(report.getK()).isEqualTo(5);
        assertThat(report.getPerFold()).hasSize(5);
        for (int i = 0; i < 5; i++) {
            FoldResult fold = report.getPerFold().get(i);
            assertThat(fold.getFoldIndex()).isEqualTo(i);
            assertThat(fold.getTestStart()).isEqualTo(i * 6);
            assertThat(fold.getTestSize()).isEqualTo(6);
            assertThat(fold.getTrainSize()).isEqualTo(24);
        }
        assertThat(report.getValidFolds()).isEqualTo(5);
        assertThat(report.getRecommendations()).isNotEmpty();
    }

    @Test
    @DisplayName("✅ Le dernier pli absorbe le reste de la division")
    void testDernierPliAbsorbeLeReste() {
        DrawSnapshot snapshot = DrawFixtures.randomSnapshot(DrawFixtures.PICK3, 32, 9L);

        CrossValidationReport report = backtestService.crossValidate(CONSTANT, 5, snapshot);

        assertThat(report.getPerFold()).extracting(FoldResult::getTestSize).containsExactly(6, 6, 6, 6, 8);
    }

    @Test
    @DisplayName("✅ Un pli en échec est invalide mais n'interrompt pas la validation")
    void testPliEnEchecIsole() {
        // GIVEN : la fonction échoue quand le premier pli est mis de côté
        DrawSnapshot snapshot = DrawFixtures.randomSnapshot(DrawFixtures.PICK3, 30, 9L);
        Draw first = snapshot.get(0);
        PredictionFunction fragile = (training, testSize) -> {
            if (!training.get(0).equals(first)) throw new IllegalStateException("modèle non entraînable");
            return CONSTANT.predict(training, testSize);
        };

        // WHEN
        CrossValidationReport report = backtestService.crossValidate(fragile, 5, snapshot);

        // THEN
        FoldResult failed = report.getPerFold().get(0);
        assertThat(failed.isValid()).isFalse();
        assertThat(failed.getAccuracy()).isZero();
        assertThat(failed.getValidation().getError()).contains("modèle non entraînable");
        assertThat(report.getValidFolds()).isEqualTo(4);
        assertThat(report.getBestFoldIndex()).isNotZero();
        assertThat(report.getWorstFoldIndex()).isNotZero();
    }

    @Test
    @DisplayName("✅ Aucun pli valide : meilleur et pire pli à -1")
    void testAucunPliValide() {
        DrawSnapshot snapshot = DrawFixtures.randomSnapshot(DrawFixtures.PICK3, 20, 9L);
        PredictionFunction broken = (training, testSize) -> {
            throw new Exception("indisponible");
        };

        CrossValidationReport report = backtestService.crossValidate(broken, 4, snapshot);

        assertThat(report.getValidFolds()).isZero();
        assertThat(report.getBestFoldIndex()).isEqualTo(-1);
        assertThat(report.getWorstFoldIndex()).isEqualTo(-1);
        assertThat(report.getMeanAccuracy()).isZero();
        assertThat(report.getOverallConfidence()).isZero();
    }

    @Test
    @DisplayName("❌ Moins de 2k tirages ou k < 2")
    void testDonneesInsuffisantes() {
        DrawSnapshot snapshot = DrawFixtures.randomSnapshot(DrawFixtures.PICK3, 9, 9L);

        assertThatThrownBy(() -> backtestService.crossValidate(CONSTANT, 5, snapshot))
                .isInstanceOfSatisfying(InsufficientDataException.class, e -> assertThat(e.getRequired()).isEqualTo(10));
        assertThatThrownBy(() -> backtestService.crossValidate(CONSTANT, 1, snapshot))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("✅ Progression notifiée après chaque pli, annulation entre deux plis")
    void testProgressionEtAnnulation() {
        DrawSnapshot snapshot = DrawFixtures.randomSnapshot(DrawFixtures.PICK3, 30, 9L);
        List<Integer> completed = new ArrayList<>();
        AtomicInteger calls = new AtomicInteger();
        PredictionFunction counting = (training, testSize) -> {
            calls.incrementAndGet();
            return CONSTANT.predict(training, testSize);
        };

        // Annulation demandée après le 2e pli
        assertThatThrownBy(() -> backtestService.crossValidate(counting, 5, snapshot,
                () -> completed.size() >= 2,
                (fold, done, total) -> completed.add(done)))
                .isInstanceOf(CancellationException.class);

        assertThat(completed).containsExactly(1, 2);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("✅ Plis en parallèle : même rapport qu'en séquentiel")
    void testPlisParalleles() {
        DrawSnapshot snapshot = DrawFixtures.randomSnapshot(DrawFixtures.PICK3, 50, 21L);
        BacktestService parallel = newBacktestService(EngineSettings.builder().parallelFolds(3).build());

        CrossValidationReport sequentialReport = backtestService.crossValidate(CONSTANT, 5, snapshot);
        CrossValidationReport parallelReport = parallel.crossValidate(CONSTANT, 5, snapshot);

        assertThat(parallelReport.getPerFold()).extracting(FoldResult::getAccuracy)
                .containsExactlyElementsOf(sequentialReport.getPerFold().stream().map(FoldResult::getAccuracy).toList());
        assertThat(parallelReport.getBestFoldIndex()).isEqualTo(sequentialReport.getBestFoldIndex());
        assertThat(parallelReport.getWorstFoldIndex()).isEqualTo(sequentialReport.getWorstFoldIndex());
    }

    @Test
    @DisplayName("✅ Agrégats : écart-type de population, stabilité temporelle à partir de 5 plis")
    void testAgregats() {
        DrawSnapshot snapshot = DrawFixtures.randomSnapshot(DrawFixtures.PICK3, 60, 4L);

        CrossValidationReport report = backtestService.crossValidate(CONSTANT, 6, snapshot);

        double mean = report.getPerFold().stream().mapToDouble(FoldResult::getAccuracy).average().orElse(0);
        double variance = report.getPerFold().stream()
                .mapToDouble(f -> Math.pow(f.getAccuracy() - mean, 2)).average().orElse(0);
        assertThat(report.getMeanAccuracy()).isCloseTo(mean, within(1e-12));
        assertThat(report.getStdDevAccuracy()).isCloseTo(Math.sqrt(variance), within(1e-12));
        assertThat(report.getTemporalStability()).isNotNull();
        assertThat(report.getMeanAccuracyInterval().getLower()).isLessThanOrEqualTo(mean);
    }

    // --- A/B test ---

    private static DrawSnapshot abSnapshot() {
        // 20 tirages d'entraînement sans 1, 2, 3 puis 20 tirages de test tous égaux à [1,2,3]
        int[][] rows = new int[40][];
        for (int i = 0; i < 20; i++) rows[i] = new int[]{4 + i % 5, 5, 6};
        for (int i = 20; i < 40; i++) rows[i] = new int[]{1, 2, 3};
        return DrawFixtures.snapshot(DrawFixtures.PICK3, rows);
    }

    @Test
    @DisplayName("✅ A/B test : le prédicteur nettement meilleur gagne")
    void testAbTestAvecVainqueur() {
        DrawSnapshot snapshot = abSnapshot();
        List<Draw> testDraws = snapshot.getDraws().subList(20, 40);
        NamedPredictor good = new NamedPredictor("bon", (training, testSize) -> List.of(new Prediction(List.of(1, 2, 3), 0.9, 3)));
        NamedPredictor bad = new NamedPredictor("mauvais", (training, testSize) -> List.of(new Prediction(List.of(7, 8, 9), 0.9, 3)));

        AbTestResult result = backtestService.performABTest(good, bad, testDraws, snapshot);

        assertThat(result.getWinner()).isEqualTo("bon");
        assertThat(result.isSignificant()).isTrue();
        assertThat(result.getConfidence()).isEqualTo(1.0);
        assertThat(result.getResultA().getAccuracy()).isEqualTo(1.0);
        assertThat(result.getResultB().getAccuracy()).isZero();
    }

    @Test
    @DisplayName("✅ A/B test : prédicteurs équivalents => pas de vainqueur, confiance nulle")
    void testAbTestSansVainqueur() {
        DrawSnapshot snapshot = abSnapshot();
        List<Draw> testDraws = snapshot.getDraws().subList(20, 40);
        NamedPredictor a = new NamedPredictor("a", CONSTANT);
        NamedPredictor b = new NamedPredictor("b", CONSTANT);

        AbTestResult result = backtestService.performABTest(a, b, testDraws, snapshot);

        assertThat(result.getWinner()).isNull();
        assertThat(result.getConfidence()).isZero();
        assertThat(result.isSignificant()).isFalse();
    }

    @Test
    @DisplayName("✅ A/B test : un prédicteur en échec => pas de vainqueur")
    void testAbTestPredicteurEnEchec() {
        DrawSnapshot snapshot = abSnapshot();
        List<Draw> testDraws = snapshot.getDraws().subList(20, 40);
        AtomicInteger trainingSize = new AtomicInteger();
        NamedPredictor observer = new NamedPredictor("a", (training, testSize) -> {
            trainingSize.set(training.size());
            return CONSTANT.predict(training, testSize);
        });
        NamedPredictor failing = new NamedPredictor("b", (training, testSize) -> {
            throw new IllegalStateException("panne");
        });

        AbTestResult result = backtestService.performABTest(observer, failing, testDraws, snapshot);

        assertThat(result.getWinner()).isNull();
        assertThat(result.getResultB().isValid()).isFalse();
        assertThat(trainingSize.get()).as("les tirages de test sont exclus de l'entraînement").isEqualTo(20);
    }
}
