package com.analyseloto.stats.service.calcul;

import com.analyseloto.stats.dto.ConfidenceInterval;
import com.analyseloto.stats.dto.SignificanceResult;
import com.analyseloto.stats.dto.TemporalStability;
import com.analyseloto.stats.enums.MatchMode;
import com.analyseloto.stats.model.GameFormat;
import com.analyseloto.stats.model.PositionRange;
import com.analyseloto.stats.util.Constantes;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.inference.AlternativeHypothesis;
import org.apache.commons.math3.stat.inference.BinomialTest;
import org.apache.commons.math3.stat.inference.TTest;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Briques statistiques du moteur de validation (intervalles, tests, baseline aléatoire).
 * Sans état : chaque méthode est une fonction pure de ses arguments.
 */
@Slf4j
@Service
public class StatisticsCalculator {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    // --- CORRESPONDANCES ---

    /**
     * Nombre de valeurs communes entre une prédiction et un tirage réel
     * @param predicted combinaison prédite
     * @param actual valeurs tirées
     * @param mode STRAIGHT (même position) ou BOX (ordre indifférent)
     * @return nombre de correspondances
     */
    public int countMatches(List<Integer> predicted, List<Integer> actual, MatchMode mode) {
        if (mode == MatchMode.BOX) {
            Map<Integer, Integer> remaining = new HashMap<>();
            for (Integer v : actual) remaining.merge(v, 1, Integer::sum);
            int matches = 0;
            for (Integer v : predicted) {
                Integer left = remaining.get(v);
                if (left != null && left > 0) {
                    remaining.put(v, left - 1);
                    matches++;
                }
            }
            return matches;
        }
        int matches = 0;
        int n = Math.min(predicted.size(), actual.size());
        for (int i = 0; i < n; i++) {
            if (predicted.get(i).equals(actual.get(i))) matches++;
        }
        return matches;
    }

    // --- BASELINE ALÉATOIRE ---

    /**
     * Probabilité qu'un tirage uniforme corresponde à la combinaison sur au moins {@code atLeast} valeurs.
     */
    public double randomBaseline(GameFormat format, List<Integer> combination, int atLeast, MatchMode mode, long maxEnumeration) {
        int n = format.getPositions();
        if (atLeast <= 0) return 1.0;
        if (atLeast > n) return 0.0;

        if (mode == MatchMode.BOX) {
            long space = spaceSizeOrMax(format);
            if (space <= maxEnumeration) {
                return enumerateBoxBaseline(format, combination, atLeast, space);
            }
            log.warn("⚠️ Espace de {} combinaisons trop grand pour l'énumération BOX, repli sur la baseline positionnelle", space);
        }
        return straightBaseline(format, atLeast);
    }

    /**
     * Loi de Poisson-binomiale : la position i correspond avec probabilité 1 / taille(plage i).
     */
    private double straightBaseline(GameFormat format, int atLeast) {
        int n = format.getPositions();
        double[] exactly = new double[n + 1];
        exactly[0] = 1.0;
        for (int i = 0; i < n; i++) {
            double p = 1.0 / format.range(i).size();
            for (int k = i + 1; k >= 1; k--) {
                exactly[k] = exactly[k] * (1 - p) + exactly[k - 1] * p;
            }
            exactly[0] *= (1 - p);
        }
        double tail = 0.0;
        for (int k = atLeast; k <= n; k++) tail += exactly[k];
        return Math.min(1.0, tail);
    }

    private double enumerateBoxBaseline(GameFormat format, List<Integer> combination, int atLeast, long space) {
        int n = format.getPositions();
        int[] current = new int[n];
        for (int i = 0; i < n; i++) current[i] = format.range(i).getMin();

        Map<Integer, Integer> target = new HashMap<>();
        for (Integer v : combination) target.merge(v, 1, Integer::sum);

        long hits = 0;
        Map<Integer, Integer> seen = new HashMap<>();
        for (long c = 0; c < space; c++) {
            seen.clear();
            int matches = 0;
            for (int v : current) {
                int used = seen.merge(v, 1, Integer::sum);
                if (used <= target.getOrDefault(v, 0)) matches++;
            }
            if (matches >= atLeast) hits++;

            // Compteur à base mixte
            for (int i = n - 1; i >= 0; i--) {
                PositionRange r = format.range(i);
                if (current[i] < r.getMax()) {
                    current[i]++;
                    break;
                }
                current[i] = r.getMin();
            }
        }
        return (double) hits / space;
    }

    private long spaceSizeOrMax(GameFormat format) {
        try {
            return format.combinationSpaceSize();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    // --- INTERVALLES ---

    /**
     * Intervalle de Wilson pour une proportion
     * @param successes nombre de succès
     * @param trials nombre d'essais
     * @param level niveau de confiance (ex : 0.95)
     * @return intervalle borné à [0, 1], vide si aucun essai
     */
    public ConfidenceInterval wilson(long successes, long trials, double level) {
        if (trials <= 0) return ConfidenceInterval.empty(level);
        double z = zFor(level);
        double p = (double) successes / trials;
        double z2 = z * z;
        double denominator = 1 + z2 / trials;
        double center = (p + z2 / (2.0 * trials)) / denominator;
        double margin = z * Math.sqrt(p * (1 - p) / trials + z2 / (4.0 * trials * trials)) / denominator;
        // Bornes encadrant toujours p, y compris aux extrêmes 0 et 1
        double lower = Math.max(0.0, Math.min(p, center - margin));
        double upper = Math.min(1.0, Math.max(p, center + margin));
        return new ConfidenceInterval(lower, p, upper, level);
    }

    /**
     * Intervalle de Student autour de la moyenne d'échantillons bornés dans [0, 1].
     */
    public ConfidenceInterval meanInterval(double[] values, double level) {
        if (values.length == 0) return ConfidenceInterval.empty(level);
        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        double mean = stats.getMean();
        if (values.length < 2) return new ConfidenceInterval(mean, mean, mean, level);
        double t = new TDistribution(values.length - 1.0).inverseCumulativeProbability(1 - (1 - level) / 2);
        double margin = t * stats.getStandardDeviation() / Math.sqrt(values.length);
        return new ConfidenceInterval(Math.max(0.0, mean - margin), mean, Math.min(1.0, mean + margin), level);
    }

    private double zFor(double level) {
        return STANDARD_NORMAL.inverseCumulativeProbability(1 - (1 - level) / 2);
    }

    // --- TESTS ---

    /**
     * Test binomial exact bilatéral du nombre de succès contre le taux attendu.
     */
    public SignificanceResult binomialSignificance(long successes, long trials, double expectedRate) {
        double observed = trials > 0 ? (double) successes / trials : 0.0;
        if (trials <= 0 || expectedRate <= 0.0 || expectedRate >= 1.0) {
            return SignificanceResult.notSignificant(observed, expectedRate);
        }
        double pValue = new BinomialTest().binomialTest(
                Math.toIntExact(trials), Math.toIntExact(successes), expectedRate, AlternativeHypothesis.TWO_SIDED);
        double z = (observed - expectedRate) / Math.sqrt(expectedRate * (1 - expectedRate) / trials);
        return new SignificanceResult(pValue, pValue < Constantes.SIGNIFICANCE_THRESHOLD, observed, expectedRate, z);
    }

    /**
     * Khi-deux à 1 degré de liberté (succès / échecs) contre le taux attendu.
     */
    public SignificanceResult chiSquareSignificance(long successes, long trials, double expectedRate) {
        double observed = trials > 0 ? (double) successes / trials : 0.0;
        double expectedHits = trials * expectedRate;
        double expectedMisses = trials - expectedHits;
        if (trials <= 0 || expectedHits <= 0.0 || expectedMisses <= 0.0) {
            return SignificanceResult.notSignificant(observed, expectedRate);
        }
        double misses = trials - successes;
        double chi2 = Math.pow(successes - expectedHits, 2) / expectedHits
                + Math.pow(misses - expectedMisses, 2) / expectedMisses;
        double pValue = 1.0 - new ChiSquaredDistribution(1).cumulativeProbability(chi2);
        return new SignificanceResult(pValue, pValue < Constantes.SIGNIFICANCE_THRESHOLD, observed, expectedRate, chi2);
    }

    /**
     * Test de Student à un échantillon (bilatéral) contre une moyenne de référence.
     */
    public SignificanceResult tTest(double[] samples, double reference) {
        DescriptiveStatistics stats = new DescriptiveStatistics(samples);
        double mean = samples.length > 0 ? stats.getMean() : 0.0;
        if (samples.length < 2 || stats.getStandardDeviation() == 0.0) {
            return SignificanceResult.notSignificant(mean, reference);
        }
        TTest test = new TTest();
        double pValue = test.tTest(reference, samples);
        double t = test.t(reference, samples);
        return new SignificanceResult(pValue, pValue < Constantes.SIGNIFICANCE_THRESHOLD, mean, reference, t);
    }

    /**
     * Significativité d'un coefficient de Pearson : 1 - p-value bilatérale du test t à n-2 degrés de liberté.
     * @return 0 quand le test n'est pas défini
     */
    public double correlationSignificance(double r, int sampleSize) {
        if (sampleSize < 3 || Double.isNaN(r)) return 0.0;
        double abs = Math.abs(r);
        if (abs >= 1.0) return 1.0;
        double t = abs * Math.sqrt((sampleSize - 2) / (1 - r * r));
        double pValue = 2 * (1 - new TDistribution(sampleSize - 2.0).cumulativeProbability(t));
        return Math.max(0.0, Math.min(1.0, 1 - pValue));
    }

    /**
     * Test z bilatéral de différence de deux proportions (erreur standard non poolée).
     * @return p-value
     */
    public double twoProportionPValue(double p1, long n1, double p2, long n2) {
        if (n1 <= 0 || n2 <= 0) return 1.0;
        double se = Math.sqrt(p1 * (1 - p1) / n1 + p2 * (1 - p2) / n2);
        if (se == 0.0) return p1 == p2 ? 1.0 : 0.0;
        double z = (p1 - p2) / se;
        return 2 * (1 - STANDARD_NORMAL.cumulativeProbability(Math.abs(z)));
    }

    // --- STABILITÉ TEMPORELLE ---

    public TemporalStability temporalStability(double[] series) {
        if (series.length < Constantes.MIN_FOLDS_TEMPORAL_STABILITY) return TemporalStability.undetermined();
        return new TemporalStability(lag1Autocorrelation(series), mannKendallPValue(series), volatility(series));
    }

    public double lag1Autocorrelation(double[] x) {
        if (x.length < 2) return 0.0;
        double mean = new DescriptiveStatistics(x).getMean();
        double num = 0.0;
        double den = 0.0;
        for (int i = 0; i < x.length; i++) {
            double d = x[i] - mean;
            den += d * d;
            if (i < x.length - 1) num += d * (x[i + 1] - mean);
        }
        return den == 0.0 ? 0.0 : num / den;
    }

    /**
     * Test de tendance de Mann-Kendall (approximation normale, correction de continuité).
     * @return p-value bilatérale, 1 si aucune tendance mesurable
     */
    public double mannKendallPValue(double[] x) {
        int n = x.length;
        if (n < 3) return 1.0;
        long s = 0;
        for (int i = 0; i < n - 1; i++) {
            for (int j = i + 1; j < n; j++) {
                s += (long) Math.signum(x[j] - x[i]);
            }
        }
        if (s == 0) return 1.0;
        double variance = n * (n - 1.0) * (2.0 * n + 5) / 18.0;
        double z = (s - Math.signum(s)) / Math.sqrt(variance);
        return 2 * (1 - STANDARD_NORMAL.cumulativeProbability(Math.abs(z)));
    }

    /**
     * Racine de la moyenne des carrés des différences successives.
     */
    public double volatility(double[] x) {
        if (x.length < 2) return 0.0;
        double sum = 0.0;
        for (int i = 1; i < x.length; i++) {
            double d = x[i] - x[i - 1];
            sum += d * d;
        }
        return Math.sqrt(sum / (x.length - 1));
    }
}
