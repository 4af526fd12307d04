package com.analyseloto.stats.model;

import com.analyseloto.stats.exception.InvalidCombinationFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameFormatTest {

    @Test
    @DisplayName("✅ Format lu depuis la configuration : une plage par position")
    void testLecturePlagesParPosition() {
        // WHEN
        GameFormat format = GameFormat.parse("1-49, 1-49,1-10");

        // THEN
        assertThat(format.getPositions()).isEqualTo(3);
        assertThat(format.range(0)).isEqualTo(new PositionRange(1, 49));
        assertThat(format.range(2)).isEqualTo(new PositionRange(1, 10));
        assertThat(format.describe()).isEqualTo("[1-49],[1-49],[1-10]");
        assertThat(format.combinationSpaceSize()).isEqualTo(49L * 49 * 10);
    }

    @Test
    @DisplayName("✅ Plages différentes : la validation se fait position par position")
    void testValidationPlagesDifferentes() {
        GameFormat format = GameFormat.parse("0-9,1-26");

        format.validate(List.of(0, 26));
        assertThatThrownBy(() -> format.validate(List.of(0, 0)))
                .isInstanceOf(InvalidCombinationFormatException.class);
        assertThatThrownBy(() -> format.validate(List.of(10, 5)))
                .isInstanceOf(InvalidCombinationFormatException.class);
    }

    @Test
    @DisplayName("❌ Définition illisible ou plage inversée : refus explicite")
    void testDefinitionInvalide() {
        assertThatThrownBy(() -> GameFormat.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GameFormat.parse("0-9,abc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GameFormat.parse("9-0")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("✅ Format uniforme et format lu équivalents")
    void testUniformeEquivalent() {
        assertThat(GameFormat.parse("0-9,0-9,0-9")).isEqualTo(GameFormat.uniform(3, 0, 9));
    }
}
