package com.analyseloto.stats.service;

import com.analyseloto.stats.cache.ResultCache;
import com.analyseloto.stats.dto.Transition;
import com.analyseloto.stats.dto.TransitionPrediction;
import com.analyseloto.stats.dto.TransitionTable;
import com.analyseloto.stats.enums.ComputationKind;
import com.analyseloto.stats.model.DrawSnapshot;
import com.analyseloto.stats.util.Constantes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Modèle de transition d'ordre 1 par position (valeur au tirage t -> valeur au tirage t+1).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransitionService {

    // Probabilité décroissante, puis transition la plus récente, puis plus petite valeur d'arrivée
    static final Comparator<Transition> RANKING = Comparator
            .comparingDouble(Transition::getProbability).reversed()
            .thenComparing(Comparator.comparingInt(Transition::getLastSeenIndex).reversed())
            .thenComparingInt(Transition::getToValue);

    private final ResultCache resultCache;

    /**
     * Table de transitions d'une position
     * @param position index de la position
     * @param snapshot historique chronologique
     * @return valeur de départ -> transitions triées (probabilités sommant à 1)
     */
    public Map<Integer, List<Transition>> buildTransitions(int position, DrawSnapshot snapshot) {
        snapshot.getFormat().checkPosition(position);
        return resultCache.getOrCompute(
                resultCache.key(ComputationKind.TRANSITIONS, snapshot.getFingerprint(), position),
                TransitionTable.class,
                () -> new TransitionTable(Collections.unmodifiableMap(computeTransitions(position, snapshot))))
                .getByFromValue();
    }

    private Map<Integer, List<Transition>> computeTransitions(int position, DrawSnapshot snapshot) {
        int[] sequence = snapshot.valuesAt(position);

        // from -> (to -> [count, lastSeenIndex])
        Map<Integer, Map<Integer, int[]>> counts = new TreeMap<>();
        for (int i = 1; i < sequence.length; i++) {
            int[] cell = counts.computeIfAbsent(sequence[i - 1], k -> new TreeMap<>())
                    .computeIfAbsent(sequence[i], k -> new int[2]);
            cell[0]++;
            cell[1] = i;
        }

        Map<Integer, List<Transition>> table = new TreeMap<>();
        counts.forEach((from, targets) -> {
            int total = targets.values().stream().mapToInt(c -> c[0]).sum();
            List<Transition> bucket = new ArrayList<>(targets.size());
            targets.forEach((to, cell) ->
                    bucket.add(new Transition(position, from, to, cell[0], (double) cell[0] / total, cell[1])));
            bucket.sort(RANKING);
            table.put(from, Collections.unmodifiableList(bucket));
        });
        return table;
    }

    /**
     * Probabilité brute P(to | from) pour la position, 0 si la transition n'a jamais été observée.
     */
    public double transitionProbability(int position, int from, int to, DrawSnapshot snapshot) {
        List<Transition> bucket = buildTransitions(position, snapshot).get(from);
        if (bucket == null) return 0.0;
        for (Transition t : bucket) {
            if (t.getToValue() == to) return t.getProbability();
        }
        return 0.0;
    }

    /**
     * Valeurs suivantes les plus probables, pondérées par la persistance de l'état courant
     * @param position index de la position
     * @param currentValue valeur de départ
     * @param topK nombre maximum de résultats (au moins 1)
     * @param snapshot historique chronologique
     * @return au plus topK prédictions, vide si aucune transition connue depuis currentValue
     */
    public List<TransitionPrediction> predictNext(int position, int currentValue, int topK, DrawSnapshot snapshot) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK doit être >= 1 (reçu " + topK + ")");
        }
        List<Transition> bucket = buildTransitions(position, snapshot).get(currentValue);
        if (bucket == null || bucket.isEmpty()) return List.of();

        int skipCount = currentSkipCount(position, currentValue, snapshot);
        double factor = Math.max(Constantes.SKIP_PENALTY_FLOOR, 1 - skipCount * Constantes.SKIP_PENALTY_STEP);

        List<TransitionPrediction> predictions = new ArrayList<>(Math.min(topK, bucket.size()));
        for (Transition t : bucket.subList(0, Math.min(topK, bucket.size()))) {
            predictions.add(new TransitionPrediction(t.getPosition(), t.getFromValue(), t.getToValue(), t.getCount(),
                    t.getProbability(), t.getLastSeenIndex(), skipCount, t.getProbability() * factor));
        }
        return predictions;
    }

    /**
     * Nombre de tirages consécutifs, avant le dernier, ayant porté la même valeur à cette position.
     * Vaut 0 si {@code currentValue} n'est pas la valeur du dernier tirage.
     */
    public int currentSkipCount(int position, int currentValue, DrawSnapshot snapshot) {
        if (snapshot.isEmpty()) return 0;
        int[] sequence = snapshot.valuesAt(position);
        int last = sequence.length - 1;
        if (sequence[last] != currentValue) return 0;

        int count = 0;
        for (int i = last - 1; i >= 0 && sequence[i] == currentValue; i--) count++;
        return count;
    }
}
