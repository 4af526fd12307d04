package com.analyseloto.stats.repository;

import com.analyseloto.stats.model.Draw;
import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Filtre de tirages : période (bornes incluses) et jour de la semaine. Tout critère null est ignoré.
 */
@Value
@Builder
public class DrawFilter {
    LocalDate from;
    LocalDate to;
    DayOfWeek dayOfWeek;

    public static DrawFilter none() {
        return DrawFilter.builder().build();
    }

    public boolean matches(Draw draw) {
        LocalDate d = draw.getDate();
        if (from != null && d.isBefore(from)) return false;
        if (to != null && d.isAfter(to)) return false;
        return dayOfWeek == null || d.getDayOfWeek() == dayOfWeek;
    }
}
