package com.analyseloto.stats.dto;

import lombok.Value;

import java.io.Serial;
import java.io.Serializable;

@Value
public class Transition implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    int position;
    int fromValue;
    int toValue;
    int count;
    double probability;
    int lastSeenIndex; // Index (dans le snapshot) du tirage d'arrivée le plus récent
}
