package com.analyseloto.stats.dto;

import com.analyseloto.stats.enums.Trend;
import lombok.Builder;
import lombok.Value;

import java.io.Serial;
import java.io.Serializable;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class PositionStat implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    int position;
    int value;
    int totalAppearances;
    int currentGap;     // Tirages depuis la dernière sortie (0 = sortie au dernier tirage)
    double averageGap;
    int maxGap;
    int minGap;
    int lastSeenIndex;  // -1 si jamais sortie
    LocalDate lastSeenDate;
    List<Integer> skipHistory;
    boolean hot;
    boolean cold;
    Trend trend;

    /**
     * Une valeur est "due" quand son écart actuel dépasse son écart moyen.
     */
    public boolean isDue() {
        return totalAppearances == 0 ? currentGap > 0 : currentGap > averageGap;
    }
}
