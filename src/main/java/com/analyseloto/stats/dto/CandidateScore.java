package com.analyseloto.stats.dto;

import lombok.Builder;
import lombok.Value;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

@Value
@Builder
public class CandidateScore implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    List<Integer> combination;
    Integer position; // Renseigné uniquement pour le score d'une valeur seule
    double dueComponent;
    double parityComponent;
    double hotColdComponent;
    double transitionComponent;
    double correlationComponent;
    double total;
    double confidence;
    boolean insufficientData;

    public static CandidateScore neutral(List<Integer> combination, Integer position) {
        return CandidateScore.builder()
                .combination(combination)
                .position(position)
                .insufficientData(true)
                .build();
    }
}
