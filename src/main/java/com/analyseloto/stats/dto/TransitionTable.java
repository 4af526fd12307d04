package com.analyseloto.stats.dto;

import lombok.Value;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;
import java.util.Map;

@Value
public class TransitionTable implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    Map<Integer, List<Transition>> byFromValue;
}
