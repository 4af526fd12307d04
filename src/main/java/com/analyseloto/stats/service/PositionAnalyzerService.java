package com.analyseloto.stats.service;

import com.analyseloto.stats.cache.ResultCache;
import com.analyseloto.stats.config.EngineSettings;
import com.analyseloto.stats.dto.PositionStat;
import com.analyseloto.stats.dto.PositionStatTable;
import com.analyseloto.stats.dto.PositionSummary;
import com.analyseloto.stats.enums.ComputationKind;
import com.analyseloto.stats.enums.Trend;
import com.analyseloto.stats.model.DrawSnapshot;
import com.analyseloto.stats.model.PositionRange;
import com.analyseloto.stats.util.Constantes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Écarts (skips) par position et par valeur : retard actuel, écart moyen/min/max,
 * classement chaud/froid et tendance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionAnalyzerService {

    private final ResultCache resultCache;
    private final EngineSettings settings;

    /**
     * Statistiques de chaque valeur possible de la position
     * @param position index de la position (0..N-1)
     * @param snapshot historique chronologique
     * @return map valeur -> statistiques, triée par valeur
     */
    public Map<Integer, PositionStat> analyzePosition(int position, DrawSnapshot snapshot) {
        snapshot.getFormat().checkPosition(position);
        return resultCache.getOrCompute(
                resultCache.key(ComputationKind.POSITION_STATS, snapshot.getFingerprint(), position),
                PositionStatTable.class,
                () -> new PositionStatTable(Collections.unmodifiableMap(computePositionStats(position, snapshot))))
                .getStats();
    }

    private Map<Integer, PositionStat> computePositionStats(int position, DrawSnapshot snapshot) {
        int totalDraws = snapshot.size();
        int[] sequence = snapshot.valuesAt(position);
        PositionRange range = snapshot.getFormat().range(position);

        // Indices d'apparition par valeur, ordre chronologique
        Map<Integer, List<Integer>> occurrences = new TreeMap<>();
        for (int v = range.getMin(); v <= range.getMax(); v++) occurrences.put(v, new ArrayList<>());
        for (int i = 0; i < sequence.length; i++) occurrences.get(sequence[i]).add(i);

        int hotThreshold = Math.max(Constantes.HOT_MIN_GAP, (int) Math.floor(Constantes.HOT_RATIO * totalDraws));
        int coldThreshold = Math.max(Constantes.COLD_MIN_GAP, (int) Math.floor(Constantes.COLD_RATIO * totalDraws));

        Map<Integer, PositionStat> result = new TreeMap<>();
        occurrences.forEach((value, indices) -> result.put(value, indices.isEmpty()
                ? neverSeen(position, value, totalDraws)
                : buildStat(position, value, indices, snapshot, hotThreshold, coldThreshold)));
        return result;
    }

    private PositionStat neverSeen(int position, int value, int totalDraws) {
        return PositionStat.builder()
                .position(position)
                .value(value)
                .totalAppearances(0)
                .currentGap(totalDraws)
                .averageGap(totalDraws)
                .maxGap(totalDraws)
                .minGap(totalDraws)
                .lastSeenIndex(-1)
                .skipHistory(List.of(totalDraws))
                .hot(false)
                .cold(totalDraws > 0)
                .trend(Trend.STABLE)
                .build();
    }

    private PositionStat buildStat(int position, int value, List<Integer> indices, DrawSnapshot snapshot,
                                   int hotThreshold, int coldThreshold) {
        int totalDraws = snapshot.size();
        List<Integer> gaps = new ArrayList<>();
        for (int i = 1; i < indices.size(); i++) gaps.add(indices.get(i) - indices.get(i - 1));

        int lastIndex = indices.get(indices.size() - 1);
        int currentGap = totalDraws - 1 - lastIndex;
        if (currentGap > 0) gaps.add(currentGap);

        double averageGap = gaps.isEmpty() ? totalDraws : gaps.stream().mapToInt(Integer::intValue).average().orElse(totalDraws);
        int maxGap = gaps.isEmpty() ? totalDraws : Collections.max(gaps);
        int minGap = gaps.isEmpty() ? totalDraws : Collections.min(gaps);

        boolean hot = currentGap <= hotThreshold;
        return PositionStat.builder()
                .position(position)
                .value(value)
                .totalAppearances(indices.size())
                .currentGap(currentGap)
                .averageGap(averageGap)
                .maxGap(maxGap)
                .minGap(minGap)
                .lastSeenIndex(lastIndex)
                .lastSeenDate(snapshot.get(lastIndex).getDate())
                .skipHistory(List.copyOf(gaps))
                .hot(hot)
                // Jamais chaud et froid à la fois
                .cold(!hot && currentGap >= coldThreshold)
                .trend(totalDraws < settings.getMinDrawsTrend() ? Trend.STABLE : trendOf(gaps))
                .build();
    }

    /**
     * Moyenne des 3 derniers écarts contre les 3 précédents, seuil de variation de 20 %.
     */
    Trend trendOf(List<Integer> gaps) {
        int window = Constantes.TREND_WINDOW;
        if (gaps.size() < 2 * window) return Trend.STABLE;

        double recent = mean(gaps.subList(gaps.size() - window, gaps.size()));
        double older = mean(gaps.subList(gaps.size() - 2 * window, gaps.size() - window));
        if (older <= 0) return Trend.STABLE;

        double change = (recent - older) / older;
        if (change >= Constantes.TREND_CHANGE_RATIO) return Trend.INCREASING;
        if (change <= -Constantes.TREND_CHANGE_RATIO) return Trend.DECREASING;
        return Trend.STABLE;
    }

    private static double mean(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).average().orElse(0.0);
    }

    /**
     * Résumé de la position : valeurs distinctes, plus/moins fréquentes et distribution
     * des écarts toutes valeurs confondues.
     */
    public PositionSummary summarizePosition(int position, DrawSnapshot snapshot) {
        snapshot.getFormat().checkPosition(position);
        return resultCache.getOrCompute(
                resultCache.key(ComputationKind.POSITION_SUMMARY, snapshot.getFingerprint(), position),
                PositionSummary.class,
                () -> computeSummary(position, snapshot));
    }

    private PositionSummary computeSummary(int position, DrawSnapshot snapshot) {
        Map<Integer, PositionStat> stats = analyzePosition(position, snapshot);

        DescriptiveStatistics skips = new DescriptiveStatistics();
        int uniqueValues = 0;
        int mostFrequent = -1;
        int leastFrequent = -1;
        int maxAppearances = Integer.MIN_VALUE;
        int minAppearances = Integer.MAX_VALUE;

        for (PositionStat s : stats.values()) {
            if (s.getTotalAppearances() == 0) continue;
            uniqueValues++;
            s.getSkipHistory().forEach(skips::addValue);
            // Égalité : la plus petite valeur gagne (parcours trié)
            if (s.getTotalAppearances() > maxAppearances) {
                maxAppearances = s.getTotalAppearances();
                mostFrequent = s.getValue();
            }
            if (s.getTotalAppearances() < minAppearances) {
                minAppearances = s.getTotalAppearances();
                leastFrequent = s.getValue();
            }
        }

        if (skips.getN() == 0) {
            return PositionSummary.builder()
                    .position(position)
                    .totalDraws(snapshot.size())
                    .uniqueValues(uniqueValues)
                    .mostFrequentValue(mostFrequent)
                    .leastFrequentValue(leastFrequent)
                    .build();
        }

        double[] values = skips.getValues();
        double[] modes = StatUtils.mode(values);
        int min = (int) skips.getMin();
        int max = (int) skips.getMax();
        return PositionSummary.builder()
                .position(position)
                .totalDraws(snapshot.size())
                .uniqueValues(uniqueValues)
                .mostFrequentValue(mostFrequent)
                .leastFrequentValue(leastFrequent)
                .averageSkip(skips.getMean())
                .medianSkip(skips.getPercentile(50))
                .modeSkip((int) modes[0])
                .maxSkip(max)
                .minSkip(min)
                .standardDeviation(Math.sqrt(skips.getPopulationVariance()))
                .variance(skips.getPopulationVariance())
                .range(max - min)
                .build();
    }
}
