package com.analyseloto.stats.util;

public class Constantes {
    // Classification chaud / froid (seuils dérivés de la taille du snapshot)
    public static final int HOT_MIN_GAP = 3;
    public static final double HOT_RATIO = 0.10;
    public static final int COLD_MIN_GAP = 5;
    public static final double COLD_RATIO = 0.20;

    // Tendance : 3 derniers écarts contre les 3 précédents
    public static final int TREND_WINDOW = 3;
    public static final double TREND_CHANGE_RATIO = 0.20;

    // Ajustement "skip" des transitions
    public static final double SKIP_PENALTY_STEP = 0.1;
    public static final double SKIP_PENALTY_FLOOR = 0.1;

    // Scoring
    public static final double HOT_CREDIT = 1.0;
    public static final double COLD_DUE_CREDIT = 0.3;
    public static final double NEUTRAL_COMPONENT = 0.5;

    // Validation
    public static final double SIGNIFICANCE_THRESHOLD = 0.05;
    public static final int MIN_FOLDS_TEMPORAL_STABILITY = 5;
    public static final int MIN_FOLDS_ACCURACY_TEST = 3;

    // Clés de cache
    public static final String CACHE_KEY_SEPARATOR = ":";
}
