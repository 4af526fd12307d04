package com.analyseloto.stats.dto;

import lombok.Value;

import java.io.Serial;
import java.io.Serializable;
import java.util.Map;

/**
 * Statistiques de toutes les valeurs d'une position, telles que mises en cache.
 */
@Value
public class PositionStatTable implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    Map<Integer, PositionStat> stats; // valeur -> statistiques, triée par valeur
}
