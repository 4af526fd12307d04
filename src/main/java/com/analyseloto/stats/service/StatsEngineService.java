package com.analyseloto.stats.service;

import com.analyseloto.stats.cache.ResultCache;
import com.analyseloto.stats.config.EngineSettings;
import com.analyseloto.stats.dto.AbTestResult;
import com.analyseloto.stats.dto.CacheStats;
import com.analyseloto.stats.dto.CandidateScore;
import com.analyseloto.stats.dto.Correlation;
import com.analyseloto.stats.dto.CrossValidationReport;
import com.analyseloto.stats.dto.OptimizationResult;
import com.analyseloto.stats.dto.PositionStat;
import com.analyseloto.stats.dto.PositionSummary;
import com.analyseloto.stats.dto.ScoringWeights;
import com.analyseloto.stats.dto.Transition;
import com.analyseloto.stats.dto.TransitionPrediction;
import com.analyseloto.stats.model.Draw;
import com.analyseloto.stats.model.DrawSnapshot;
import com.analyseloto.stats.model.GameFormat;
import com.analyseloto.stats.repository.DrawFilter;
import com.analyseloto.stats.repository.SequenceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Point d'entrée du moteur : construit le snapshot à partir du stockage et délègue aux services de calcul.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatsEngineService {

    private final SequenceStore sequenceStore;
    private final GameFormat gameFormat;
    private final ScoringWeights scoringWeights;
    private final EngineSettings settings;
    private final PositionAnalyzerService positionAnalyzer;
    private final TransitionService transitionService;
    private final CorrelationService correlationService;
    private final ScoringService scoringService;
    private final BacktestService backtestService;
    private final ResultCache resultCache;

    // --- SNAPSHOT ---

    public DrawSnapshot snapshot() {
        return DrawSnapshot.of(gameFormat, sequenceStore.getDraws());
    }

    public DrawSnapshot snapshot(DrawFilter filter) {
        return DrawSnapshot.of(gameFormat, sequenceStore.getDraws(filter));
    }

    // --- STATISTIQUES ---

    public Map<Integer, PositionStat> getPositionStats(int position) {
        return positionAnalyzer.analyzePosition(position, snapshot());
    }

    public PositionSummary getPositionSummary(int position) {
        return positionAnalyzer.summarizePosition(position, snapshot());
    }

    public Map<Integer, List<Transition>> getTransitions(int position) {
        return transitionService.buildTransitions(position, snapshot());
    }

    /**
     * Prédictions de transition depuis la valeur du dernier tirage.
     */
    public List<TransitionPrediction> predictNext(int position, int topK) {
        DrawSnapshot snapshot = snapshot();
        Draw last = snapshot.lastDraw();
        if (last == null) return List.of();
        return transitionService.predictNext(position, last.valueAt(position), topK, snapshot);
    }

    public List<Correlation> getCorrelations() {
        return correlationService.correlateAll(snapshot());
    }

    // --- SCORING ---

    public CandidateScore scoreCombination(List<Integer> combination) {
        return scoreCombination(combination, scoringWeights);
    }

    public CandidateScore scoreCombination(List<Integer> combination, ScoringWeights weights) {
        return scoringService.scoreCombination(combination, snapshot(), weights);
    }

    public List<CandidateScore> getTopCombinations(int limit) {
        return scoringService.topCombinations(limit, snapshot(), scoringWeights);
    }

    public List<CandidateScore> getDueCombinations() {
        return scoringService.dueCombinations(settings.getDueCombinationLimit(), snapshot(), scoringWeights);
    }

    // --- VALIDATION ---

    public CrossValidationReport crossValidate(PredictionFunction predictFn, int k) {
        return backtestService.crossValidate(predictFn, k, snapshot());
    }

    public CrossValidationReport crossValidate(PredictionFunction predictFn, int k,
                                              CancellationSignal cancellation, FoldProgressListener listener) {
        return backtestService.crossValidate(predictFn, k, snapshot(), cancellation, listener);
    }

    public AbTestResult performABTest(NamedPredictor a, NamedPredictor b, List<Draw> testDraws) {
        return backtestService.performABTest(a, b, testDraws, snapshot());
    }

    // --- CACHE ---

    public CacheStats getCacheStats() {
        return resultCache.stats();
    }

    public void clearCache() {
        resultCache.clear();
        log.info("🗑️ Cache de résultats vidé");
    }

    public OptimizationResult optimizeCache() {
        return resultCache.optimize();
    }

    /**
     * Précalcule les statistiques de chaque position et la matrice de corrélation.
     * @return false si aucun tirage n'est disponible
     */
    public boolean warmUp() {
        DrawSnapshot snapshot = snapshot();
        if (snapshot.isEmpty()) return false;
        for (int p = 0; p < gameFormat.getPositions(); p++) {
            positionAnalyzer.analyzePosition(p, snapshot);
            transitionService.buildTransitions(p, snapshot);
        }
        correlationService.correlateAll(snapshot);
        return true;
    }
}
