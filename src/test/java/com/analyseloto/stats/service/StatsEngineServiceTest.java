package com.analyseloto.stats.service;

import com.analyseloto.stats.DrawFixtures;
import com.analyseloto.stats.cache.ResultCache;
import com.analyseloto.stats.config.EngineSettings;
import com.analyseloto.stats.dto.CacheStats;
import com.analyseloto.stats.dto.CandidateScore;
import com.analyseloto.stats.dto.PositionStat;
import com.analyseloto.stats.dto.ScoringWeights;
import com.analyseloto.stats.dto.TransitionPrediction;
import com.analyseloto.stats.model.Draw;
import com.analyseloto.stats.repository.DrawFilter;
import com.analyseloto.stats.repository.SequenceStore;
import com.analyseloto.stats.service.calcul.StatisticsCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StatsEngineServiceTest {
    // On simule le stockage des tirages
    @Mock
    private SequenceStore sequenceStore;

    private ResultCache resultCache;
    private StatsEngineService statsEngineService;

    @BeforeEach
    void setUp() {
        EngineSettings settings = EngineSettings.defaults();
        StatisticsCalculator calculator = new StatisticsCalculator();
        resultCache = DrawFixtures.newCache();

        PositionAnalyzerService analyzer = new PositionAnalyzerService(resultCache, settings);
        TransitionService transitions = new TransitionService(resultCache);
        CorrelationService correlations = new CorrelationService(resultCache, calculator, settings);
        ScoringService scoring = new ScoringService(analyzer, transitions, correlations, resultCache, settings);
        BacktestService backtest = new BacktestService(new ValidationService(calculator, settings), calculator, settings);

        statsEngineService = new StatsEngineService(sequenceStore, DrawFixtures.PICK3, ScoringWeights.defaults(), settings,
                analyzer, transitions, correlations, scoring, backtest, resultCache);
    }

    @Test
    @DisplayName("✅ Statistiques de position calculées depuis le stockage puis servies par le cache")
    void testStatsPositionEtCache() {
        // GIVEN
        List<Draw> draws = DrawFixtures.randomDraws(DrawFixtures.PICK3, 60, 8L);
        when(sequenceStore.getDraws()).thenReturn(draws);

        // WHEN
        Map<Integer, PositionStat> first = statsEngineService.getPositionStats(0);
        Map<Integer, PositionStat> second = statsEngineService.getPositionStats(0);

        // THEN
        assertThat(first).hasSize(10);
        assertThat(second).isSameAs(first);
        CacheStats stats = statsEngineService.getCacheStats();
        assertThat(stats.getHits()).isEqualTo(1);
        assertThat(stats.getKindDistribution()).containsKey("position-stats");
    }

    @Test
    @DisplayName("✅ Score d'une combinaison avec les poids configurés")
    void testScoreCombinaison() {
        when(sequenceStore.getDraws()).thenReturn(DrawFixtures.randomDraws(DrawFixtures.PICK3, 60, 8L));

        CandidateScore score = statsEngineService.scoreCombination(List.of(3, 6, 9));

        assertThat(score.isInsufficientData()).isFalse();
        assertThat(score.getCombination()).containsExactly(3, 6, 9);
    }

    @Test
    @DisplayName("✅ Historique vide : pas de prédiction de transition, pas de préchauffage")
    void testHistoriqueVide() {
        when(sequenceStore.getDraws()).thenReturn(List.of());

        List<TransitionPrediction> predictions = statsEngineService.predictNext(0, 3);
        boolean warmedUp = statsEngineService.warmUp();

        assertThat(predictions).isEmpty();
        assertThat(warmedUp).isFalse();
    }

    @Test
    @DisplayName("✅ Préchauffage : statistiques, transitions et corrélations mises en cache")
    void testPrechauffage() {
        when(sequenceStore.getDraws()).thenReturn(DrawFixtures.randomDraws(DrawFixtures.PICK3, 40, 3L));

        boolean warmedUp = statsEngineService.warmUp();

        assertThat(warmedUp).isTrue();
        // 3 stats de position + 3 tables de transition + 3 corrélations
        assertThat(statsEngineService.getCacheStats().getSize()).isEqualTo(9);

        statsEngineService.clearCache();
        assertThat(statsEngineService.getCacheStats().getSize()).isZero();
    }

    @Test
    @DisplayName("✅ Le filtre est transmis au stockage")
    void testSnapshotFiltre() {
        DrawFilter filter = DrawFilter.builder().dayOfWeek(DayOfWeek.MONDAY).build();
        when(sequenceStore.getDraws(filter)).thenReturn(List.of());

        assertThat(statsEngineService.snapshot(filter).isEmpty()).isTrue();
        verify(sequenceStore).getDraws(filter);
    }

    @Test
    @DisplayName("✅ Combinaisons en retard : limite configurée respectée")
    void testCombinaisonsEnRetard() {
        when(sequenceStore.getDraws()).thenReturn(DrawFixtures.randomDraws(DrawFixtures.PICK3, 80, 12L));

        List<CandidateScore> due = statsEngineService.getDueCombinations();
        List<CandidateScore> top = statsEngineService.getTopCombinations(5);

        assertThat(due).hasSizeLessThanOrEqualTo(20);
        assertThat(top).hasSize(5);
        assertThat(statsEngineService.getCorrelations()).hasSize(3);
    }
}
