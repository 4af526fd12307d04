package com.analyseloto.stats.service;

import lombok.Value;

@Value
public class NamedPredictor {
    String name;
    PredictionFunction function;
}
