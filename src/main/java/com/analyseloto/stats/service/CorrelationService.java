package com.analyseloto.stats.service;

import com.analyseloto.stats.cache.ResultCache;
import com.analyseloto.stats.config.EngineSettings;
import com.analyseloto.stats.dto.Correlation;
import com.analyseloto.stats.enums.ComputationKind;
import com.analyseloto.stats.enums.CorrelationStrength;
import com.analyseloto.stats.model.DrawSnapshot;
import com.analyseloto.stats.service.calcul.StatisticsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Corrélation de Pearson entre les séquences de deux positions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorrelationService {

    private final ResultCache resultCache;
    private final StatisticsCalculator calculator;
    private final EngineSettings settings;

    /**
     * Corrélation entre deux positions distinctes. Symétrique : (a, b) et (b, a) donnent le même résultat.
     * @return coefficient 0 / WEAK / significativité 0 si le calcul n'est pas défini
     */
    public Correlation correlate(int positionA, int positionB, DrawSnapshot snapshot) {
        snapshot.getFormat().checkPosition(positionA);
        snapshot.getFormat().checkPosition(positionB);
        if (positionA == positionB) {
            throw new IllegalArgumentException("Corrélation d'une position avec elle-même : " + positionA);
        }
        int a = Math.min(positionA, positionB);
        int b = Math.max(positionA, positionB);
        return resultCache.getOrCompute(
                resultCache.key(ComputationKind.CORRELATION, snapshot.getFingerprint(), a, b),
                Correlation.class,
                () -> computeCorrelation(a, b, snapshot));
    }

    private Correlation computeCorrelation(int a, int b, DrawSnapshot snapshot) {
        int n = snapshot.size();
        if (n < Math.max(2, settings.getMinDrawsCorrelation())) {
            return Correlation.undefined(a, b, n);
        }

        double[] x = toDoubles(snapshot.valuesAt(a));
        double[] y = toDoubles(snapshot.valuesAt(b));
        double r = new PearsonsCorrelation().correlation(x, y);
        // Variance nulle sur une des positions
        if (Double.isNaN(r)) {
            log.debug("Corrélation indéfinie entre les positions {} et {} (variance nulle)", a, b);
            return Correlation.undefined(a, b, n);
        }

        return new Correlation(a, b, r, CorrelationStrength.fromCoefficient(r),
                calculator.correlationSignificance(r, n), n);
    }

    /**
     * Matrice complète des corrélations (a < b), dans l'ordre lexicographique des paires.
     */
    public List<Correlation> correlateAll(DrawSnapshot snapshot) {
        int positions = snapshot.getFormat().getPositions();
        List<Correlation> result = new ArrayList<>(positions * (positions - 1) / 2);
        for (int a = 0; a < positions; a++) {
            for (int b = a + 1; b < positions; b++) {
                result.add(correlate(a, b, snapshot));
            }
        }
        return result;
    }

    /**
     * Moyenne des valeurs prises par une position sur le snapshot.
     */
    double positionMean(int position, DrawSnapshot snapshot) {
        int[] values = snapshot.valuesAt(position);
        if (values.length == 0) return 0.0;
        long sum = 0;
        for (int v : values) sum += v;
        return (double) sum / values.length;
    }

    private static double[] toDoubles(int[] values) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) result[i] = values[i];
        return result;
    }
}
