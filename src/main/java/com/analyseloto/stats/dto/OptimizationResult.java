package com.analyseloto.stats.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class OptimizationResult {
    private int removed;
    private int kept;
    private long memoryFreed;
}
