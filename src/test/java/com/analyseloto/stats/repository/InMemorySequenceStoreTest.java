package com.analyseloto.stats.repository;

import com.analyseloto.stats.model.Draw;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySequenceStoreTest {

    private final InMemorySequenceStore store = new InMemorySequenceStore();

    @Test
    @DisplayName("✅ Les tirages sont restitués dans l'ordre chronologique")
    void testOrdreChronologique() {
        // GIVEN : ajout dans le désordre
        store.addAll(List.of(
                Draw.of(LocalDate.of(2024, 3, 3), 1, 2, 3),
                Draw.of(LocalDate.of(2024, 3, 1), 4, 5, 6),
                Draw.of(LocalDate.of(2024, 3, 2), 7, 8, 9)));

        // WHEN
        List<Draw> draws = store.getDraws();

        // THEN
        assertThat(draws).extracting(Draw::getDate).isSorted();
        assertThat(store.count()).isEqualTo(3);
        assertThat(store.existsByDate(LocalDate.of(2024, 3, 2))).isTrue();
    }

    @Test
    @DisplayName("✅ Filtre par période (bornes incluses) et par jour de la semaine")
    void testFiltres() {
        // Du lundi 01/01/2024 au dimanche 14/01/2024
        for (int i = 0; i < 14; i++) {
            store.add(Draw.of(LocalDate.of(2024, 1, 1).plusDays(i), i % 10, 0, 0));
        }

        List<Draw> range = store.getDraws(DrawFilter.builder()
                .from(LocalDate.of(2024, 1, 3))
                .to(LocalDate.of(2024, 1, 5))
                .build());
        List<Draw> mondays = store.getDraws(DrawFilter.builder().dayOfWeek(DayOfWeek.MONDAY).build());

        assertThat(range).hasSize(3);
        assertThat(mondays).extracting(Draw::getDate)
                .containsExactly(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 8));
    }

    @Test
    @DisplayName("✅ Remplacement complet de l'historique")
    void testRemplacement() {
        store.add(Draw.of(LocalDate.of(2024, 1, 1), 1, 1, 1));
        store.replaceAll(List.of(Draw.of(LocalDate.of(2025, 1, 1), 2, 2, 2)));

        assertThat(store.getDraws()).singleElement().extracting(Draw::getDate).isEqualTo(LocalDate.of(2025, 1, 1));
    }
}
