package com.analyseloto.stats.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * Un tirage : une date et un tuple ordonné de valeurs, une par position.
 * Immuable une fois créé.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Draw {

    private final LocalDate date;
    private final List<Integer> values;

    public Draw(LocalDate date, List<Integer> values) {
        if (date == null) throw new IllegalArgumentException("Un tirage doit être daté");
        if (values == null || values.isEmpty()) throw new IllegalArgumentException("Un tirage doit contenir des valeurs");
        this.date = date;
        this.values = List.copyOf(values);
    }

    public static Draw of(LocalDate date, Integer... values) {
        return new Draw(date, Arrays.asList(values));
    }

    public int valueAt(int position) {
        return values.get(position);
    }

    public int size() {
        return values.size();
    }
}
