package com.analyseloto.stats.service;

import com.analyseloto.stats.DrawFixtures;
import com.analyseloto.stats.config.EngineSettings;
import com.analyseloto.stats.dto.Correlation;
import com.analyseloto.stats.enums.CorrelationStrength;
import com.analyseloto.stats.model.DrawSnapshot;
import com.analyseloto.stats.service.calcul.StatisticsCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CorrelationServiceTest {

    private CorrelationService correlationService;

    @BeforeEach
    void setUp() {
        correlationService = new CorrelationService(DrawFixtures.newCache(), new StatisticsCalculator(), EngineSettings.defaults());
    }

    @Test
    @DisplayName("✅ Positions identiques : corrélation forte et significative")
    void testCorrelationParfaite() {
        // GIVEN : position 1 = position 0, position 2 = 9 - position 0
        DrawSnapshot snapshot = DrawFixtures.snapshot(DrawFixtures.PICK3,
                new int[]{1, 1, 8}, new int[]{4, 4, 5}, new int[]{2, 2, 7}, new int[]{7, 7, 2},
                new int[]{5, 5, 4}, new int[]{0, 0, 9}, new int[]{9, 9, 0}, new int[]{3, 3, 6});

        // WHEN
        Correlation direct = correlationService.correlate(0, 1, snapshot);
        Correlation inverse = correlationService.correlate(0, 2, snapshot);

        // THEN
        assertThat(direct.getCoefficient()).isCloseTo(1.0, within(1e-9));
        assertThat(direct.getStrength()).isEqualTo(CorrelationStrength.STRONG);
        assertThat(direct.getSignificance()).isCloseTo(1.0, within(1e-9));
        assertThat(direct.getSampleSize()).isEqualTo(8);
        assertThat(inverse.getCoefficient()).isCloseTo(-1.0, within(1e-9));
        assertThat(inverse.getStrength()).isEqualTo(CorrelationStrength.STRONG);
    }

    @Test
    @DisplayName("✅ Symétrie : (a, b) et (b, a) renvoient le même résultat, a < b")
    void testSymetrie() {
        DrawSnapshot snapshot = DrawFixtures.randomSnapshot(DrawFixtures.PICK3, 100, 3L);

        Correlation ab = correlationService.correlate(0, 2, snapshot);
        Correlation ba = correlationService.correlate(2, 0, snapshot);

        assertThat(ba).isEqualTo(ab);
        assertThat(ab.getPositionA()).isZero();
        assertThat(ab.getPositionB()).isEqualTo(2);
        assertThat(ab.getCoefficient()).isBetween(-1.0, 1.0);
        assertThat(ab.getSignificance()).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("✅ Variance nulle ou trop peu de tirages : corrélation indéfinie, faible, non significative")
    void testCasIndefinis() {
        DrawSnapshot constant = DrawFixtures.snapshot(DrawFixtures.PICK3,
                new int[]{1, 3, 0}, new int[]{1, 5, 1}, new int[]{1, 2, 2}, new int[]{1, 8, 3});
        DrawSnapshot tooShort = DrawFixtures.snapshot(DrawFixtures.PICK3, new int[]{1, 3, 0}, new int[]{2, 5, 1});

        Correlation zeroVariance = correlationService.correlate(0, 1, constant);
        Correlation shortHistory = correlationService.correlate(1, 2, tooShort);

        assertThat(zeroVariance.getCoefficient()).isZero();
        assertThat(zeroVariance.getStrength()).isEqualTo(CorrelationStrength.WEAK);
        assertThat(zeroVariance.getSignificance()).isZero();
        assertThat(shortHistory.getCoefficient()).isZero();
        assertThat(shortHistory.getSampleSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("✅ Matrice complète : une corrélation par paire, dans l'ordre")
    void testMatriceComplete() {
        DrawSnapshot snapshot = DrawFixtures.randomSnapshot(DrawFixtures.PICK3, 50, 11L);

        List<Correlation> all = correlationService.correlateAll(snapshot);

        assertThat(all).hasSize(3);
        assertThat(all).extracting(c -> c.getPositionA() + "-" + c.getPositionB()).containsExactly("0-1", "0-2", "1-2");
    }

    @Test
    @DisplayName("❌ Une position ne se corrèle pas avec elle-même")
    void testMemePosition() {
        DrawSnapshot snapshot = DrawFixtures.randomSnapshot(DrawFixtures.PICK3, 10, 1L);

        assertThatThrownBy(() -> correlationService.correlate(1, 1, snapshot))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
