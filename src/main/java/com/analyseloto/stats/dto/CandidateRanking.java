package com.analyseloto.stats.dto;

import lombok.Value;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * Liste ordonnée de scores (valeurs d'une position ou combinaisons).
 */
@Value
public class CandidateRanking implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    List<CandidateScore> scores;
}
