package com.analyseloto.stats.service;

import com.analyseloto.stats.cache.ResultCache;
import com.analyseloto.stats.config.EngineSettings;
import com.analyseloto.stats.dto.CandidateRanking;
import com.analyseloto.stats.dto.CandidateScore;
import com.analyseloto.stats.dto.Correlation;
import com.analyseloto.stats.dto.PositionStat;
import com.analyseloto.stats.dto.ScoringWeights;
import com.analyseloto.stats.enums.ComputationKind;
import com.analyseloto.stats.exception.InvalidCombinationFormatException;
import com.analyseloto.stats.model.Draw;
import com.analyseloto.stats.model.DrawSnapshot;
import com.analyseloto.stats.model.GameFormat;
import com.analyseloto.stats.model.PositionRange;
import com.analyseloto.stats.util.Constantes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;

/**
 * Score composite des valeurs et des combinaisons :
 * retard (due), parité, chaud/froid, transition et corrélation, pondérés par {@link ScoringWeights}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoringService {

    static final Comparator<List<Integer>> LEXICOGRAPHIC = (a, b) -> {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = Integer.compare(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    };

    // Meilleur total d'abord, puis ordre lexicographique de la combinaison
    static final Comparator<CandidateScore> BY_TOTAL = Comparator
            .comparingDouble(CandidateScore::getTotal).reversed()
            .thenComparing(CandidateScore::getCombination, LEXICOGRAPHIC);

    private final PositionAnalyzerService positionAnalyzer;
    private final TransitionService transitionService;
    private final CorrelationService correlationService;
    private final ResultCache resultCache;
    private final EngineSettings settings;

    /**
     * Score d'une combinaison complète
     * @param combination une valeur par position
     * @param snapshot historique chronologique
     * @param weights pondérations (normalisées si leur somme ne vaut pas 1)
     * @return score déterministe pour (combinaison, snapshot, poids)
     * @throws InvalidCombinationFormatException arité ou valeur hors plage
     * @throws IllegalArgumentException poids négatifs ou tous nuls
     */
    public CandidateScore scoreCombination(List<Integer> combination, DrawSnapshot snapshot, ScoringWeights weights) {
        snapshot.getFormat().validate(combination);
        ScoringWeights w = weights.normalized();
        List<Integer> key = List.copyOf(combination);

        if (snapshot.size() < settings.getMinDrawsCombination()) {
            return CandidateScore.neutral(key, null);
        }
        return resultCache.getOrCompute(
                resultCache.key(ComputationKind.COMBINATION_SCORE, snapshot.getFingerprint(), key, w),
                CandidateScore.class,
                () -> computeCombinationScore(key, snapshot, w));
    }

    private CandidateScore computeCombinationScore(List<Integer> combination, DrawSnapshot snapshot, ScoringWeights w) {
        int n = combination.size();
        Draw last = snapshot.lastDraw();

        double due = 0.0;
        double hotCold = 0.0;
        double transition = 0.0;
        int matchingSignals = 0;

        // 1. Composantes par position
        for (int p = 0; p < n; p++) {
            int value = combination.get(p);
            PositionStat stat = positionAnalyzer.analyzePosition(p, snapshot).get(value);

            double d = dueComponent(stat, snapshot.size());
            double hc = hotColdComponent(stat);
            double tr = transitionService.transitionProbability(p, last.valueAt(p), value, snapshot);

            due += d;
            hotCold += hc;
            transition += tr;
            if (d > 0) matchingSignals++;
            if (hc > 0) matchingSignals++;
            if (tr > 0) matchingSignals++;
        }
        due /= n;
        hotCold /= n;
        transition /= n;

        // 2. Parité
        double parity = parityComponent(combination);
        if (parity >= Constantes.NEUTRAL_COMPONENT) matchingSignals++;

        // 3. Corrélations entre paires de positions
        double correlation = Constantes.NEUTRAL_COMPONENT;
        int pairs = n * (n - 1) / 2;
        if (pairs > 0) {
            double sum = 0.0;
            for (int a = 0; a < n; a++) {
                for (int b = a + 1; b < n; b++) {
                    double c = pairComponent(a, b, combination, snapshot);
                    sum += c;
                    if (c > Constantes.NEUTRAL_COMPONENT) matchingSignals++;
                }
            }
            correlation = sum / pairs;
        }

        // 4. Agrégation pondérée
        double total = due * w.getDue()
                + parity * w.getParity()
                + hotCold * w.getHotCold()
                + transition * w.getTransition()
                + correlation * w.getCorrelation();

        int possibleSignals = 3 * n + 1 + pairs;
        return CandidateScore.builder()
                .combination(combination)
                .dueComponent(due)
                .parityComponent(parity)
                .hotColdComponent(hotCold)
                .transitionComponent(transition)
                .correlationComponent(correlation)
                .total(total)
                .confidence(Math.min(1.0, (double) matchingSignals / possibleSignals))
                .insufficientData(false)
                .build();
    }

    /**
     * Score d'une valeur seule : seules les composantes due / chaud-froid / transition comptent,
     * leurs poids sont renormalisés entre eux.
     */
    public CandidateScore scoreValue(int position, int value, DrawSnapshot snapshot, ScoringWeights weights) {
        GameFormat format = snapshot.getFormat();
        format.checkPosition(position);
        if (!format.range(position).contains(value)) {
            throw new InvalidCombinationFormatException("Valeur " + value + " hors plage pour la position " + position);
        }
        ScoringWeights w = weights.normalized();
        if (snapshot.size() < settings.getMinDrawsCombination()) {
            return CandidateScore.neutral(List.of(value), position);
        }
        return computeValueScore(position, value, snapshot, w);
    }

    private CandidateScore computeValueScore(int position, int value, DrawSnapshot snapshot, ScoringWeights w) {
        PositionStat stat = positionAnalyzer.analyzePosition(position, snapshot).get(value);
        double due = dueComponent(stat, snapshot.size());
        double hotCold = hotColdComponent(stat);
        double transition = transitionService.transitionProbability(
                position, snapshot.lastDraw().valueAt(position), value, snapshot);

        double wDue = w.getDue();
        double wHotCold = w.getHotCold();
        double wTransition = w.getTransition();
        double sub = wDue + wHotCold + wTransition;
        if (sub <= 0) {
            // Poids uniquement sur parité / corrélation : répartition égale
            wDue = wHotCold = wTransition = 1.0 / 3;
            sub = 1.0;
        }
        double total = (due * wDue + hotCold * wHotCold + transition * wTransition) / sub;
        int matching = (due > 0 ? 1 : 0) + (hotCold > 0 ? 1 : 0) + (transition > 0 ? 1 : 0);

        return CandidateScore.builder()
                .combination(List.of(value))
                .position(position)
                .dueComponent(due)
                .hotColdComponent(hotCold)
                .transitionComponent(transition)
                .total(total)
                .confidence(matching / 3.0)
                .insufficientData(false)
                .build();
    }

    /**
     * Toutes les valeurs d'une position, de la mieux notée à la moins bien notée (égalité : plus petite valeur).
     */
    public List<CandidateScore> rankValues(int position, DrawSnapshot snapshot, ScoringWeights weights) {
        snapshot.getFormat().checkPosition(position);
        ScoringWeights w = weights.normalized();
        return resultCache.getOrCompute(
                resultCache.key(ComputationKind.VALUE_RANKING, snapshot.getFingerprint(), position, w),
                CandidateRanking.class,
                () -> {
                    PositionRange range = snapshot.getFormat().range(position);
                    List<CandidateScore> ranking = new ArrayList<>(range.size());
                    for (int v = range.getMin(); v <= range.getMax(); v++) {
                        ranking.add(scoreValue(position, v, snapshot, w));
                    }
                    ranking.sort(BY_TOTAL);
                    return new CandidateRanking(Collections.unmodifiableList(ranking));
                }).getScores();
    }

    // --- Recherche de combinaisons ---

    /**
     * Meilleures combinaisons issues du produit cartésien des meilleures valeurs de chaque position.
     * @return liste vide si l'historique est trop court pour scorer
     */
    public List<CandidateScore> topCombinations(int limit, DrawSnapshot snapshot, ScoringWeights weights) {
        checkLimit(limit);
        ScoringWeights w = weights.normalized();
        if (snapshot.size() < settings.getMinDrawsCombination()) return List.of();

        return resultCache.getOrCompute(
                resultCache.key(ComputationKind.TOP_COMBINATIONS, snapshot.getFingerprint(), limit,
                        settings.getCandidatesPerPosition(), w),
                CandidateRanking.class,
                () -> {
                    List<List<Integer>> candidates = new ArrayList<>();
                    for (int p = 0; p < snapshot.getFormat().getPositions(); p++) {
                        candidates.add(rankValues(p, snapshot, w).stream()
                                .limit(settings.getCandidatesPerPosition())
                                .map(s -> s.getCombination().get(0))
                                .toList());
                    }
                    return new CandidateRanking(searchCombinations(candidates, limit, snapshot, w));
                }).getScores();
    }

    /**
     * Combinaisons construites uniquement à partir des valeurs "dues" (retard actuel > écart moyen).
     * @return liste vide si une position n'a aucune valeur due
     */
    public List<CandidateScore> dueCombinations(int limit, DrawSnapshot snapshot, ScoringWeights weights) {
        checkLimit(limit);
        ScoringWeights w = weights.normalized();
        if (snapshot.size() < settings.getMinDrawsCombination()) return List.of();

        return resultCache.getOrCompute(
                resultCache.key(ComputationKind.DUE_COMBINATIONS, snapshot.getFingerprint(), limit,
                        settings.getCandidatesPerPosition(), w),
                CandidateRanking.class,
                () -> {
                    List<List<Integer>> candidates = new ArrayList<>();
                    for (int p = 0; p < snapshot.getFormat().getPositions(); p++) {
                        List<Integer> due = dueValues(p, snapshot);
                        if (due.isEmpty()) {
                            log.info("Aucune valeur en retard sur la position {}", p);
                            return new CandidateRanking(List.of());
                        }
                        candidates.add(due);
                    }
                    return new CandidateRanking(searchCombinations(candidates, limit, snapshot, w));
                }).getScores();
    }

    private List<Integer> dueValues(int position, DrawSnapshot snapshot) {
        int n = snapshot.size();
        return positionAnalyzer.analyzePosition(position, snapshot).values().stream()
                .filter(PositionStat::isDue)
                .sorted(Comparator.comparingDouble((PositionStat s) -> dueComponent(s, n)).reversed()
                        .thenComparingInt(PositionStat::getValue))
                .limit(settings.getCandidatesPerPosition())
                .map(PositionStat::getValue)
                .toList();
    }

    private List<CandidateScore> searchCombinations(List<List<Integer>> candidates, int limit,
                                                    DrawSnapshot snapshot, ScoringWeights w) {
        List<CandidateScore> scored = new ArrayList<>();
        cartesian(candidates, 0, new ArrayList<>(), combination -> scored.add(scoreCombination(combination, snapshot, w)));
        scored.sort(BY_TOTAL);
        return Collections.unmodifiableList(new ArrayList<>(scored.subList(0, Math.min(limit, scored.size()))));
    }

    private void cartesian(List<List<Integer>> candidates, int depth, List<Integer> current,
                           Consumer<List<Integer>> sink) {
        if (depth == candidates.size()) {
            sink.accept(List.copyOf(current));
            return;
        }
        for (Integer v : candidates.get(depth)) {
            current.add(v);
            cartesian(candidates, depth + 1, current, sink);
            current.remove(current.size() - 1);
        }
    }

    private static void checkLimit(int limit) {
        if (limit < 1) throw new IllegalArgumentException("La limite doit être >= 1 (reçu " + limit + ")");
    }

    // --- Moteurs de Calcul ---

    /**
     * Retard relatif : (écart actuel - écart moyen) / écart moyen, borné à [0, 1].
     * Une valeur jamais sortie vaut 1.
     */
    double dueComponent(PositionStat stat, int totalDraws) {
        if (stat.getTotalAppearances() == 0) return totalDraws > 0 ? 1.0 : 0.0;
        double average = stat.getAverageGap();
        if (average <= 0) return 0.0;
        double ratio = (stat.getCurrentGap() - average) / average;
        return Math.max(0.0, Math.min(1.0, ratio));
    }

    double hotColdComponent(PositionStat stat) {
        if (stat.isHot()) return Constantes.HOT_CREDIT;
        if (stat.isCold() && stat.isDue()) return Constantes.COLD_DUE_CREDIT;
        return 0.0;
    }

    /**
     * 1 pour un équilibre parfait pairs / impairs, 0 quand toutes les valeurs ont la même parité (N pair).
     */
    double parityComponent(List<Integer> combination) {
        int n = combination.size();
        long evens = combination.stream().filter(v -> Math.floorMod(v, 2) == 0).count();
        return 1.0 - Math.abs(2.0 * evens - n) / n;
    }

    /**
     * (1 + r·s·d) / 2 : d vaut +1 si les deux valeurs sont du même côté de la moyenne de leur position,
     * -1 sinon, 0 si l'une est exactement sur la moyenne.
     */
    private double pairComponent(int a, int b, List<Integer> combination, DrawSnapshot snapshot) {
        Correlation corr = correlationService.correlate(a, b, snapshot);
        double da = Math.signum(combination.get(a) - correlationService.positionMean(a, snapshot));
        double db = Math.signum(combination.get(b) - correlationService.positionMean(b, snapshot));
        return (1.0 + corr.getCoefficient() * corr.getSignificance() * da * db) / 2.0;
    }
}
