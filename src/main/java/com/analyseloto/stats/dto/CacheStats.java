package com.analyseloto.stats.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CacheStats {
    private int size;
    private int maxSize;
    private long memoryUsage;
    private long maxMemory;
    private double memoryUsagePercent;
    private double hitRate;
    private long hits;
    private long misses;
    private long evictions;
    private long rejected;
    private long totalAccesses;
    private double averageAgeMillis;
    private Map<String, Long> kindDistribution;
}
