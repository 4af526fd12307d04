package com.analyseloto.stats.cache;

import com.analyseloto.stats.enums.ComputationKind;
import lombok.Getter;

/**
 * Entrée du cache. Les champs d'accès sont mutables : l'entrée doit être retirée de l'index
 * de récence avant d'être touchée, puis réinsérée.
 */
@Getter
class CacheEntry {
    private final String key;
    private final ComputationKind kind;
    private final Object value;
    private final long insertedAt;
    private final long estimatedSizeBytes;
    private final long sequence;
    private long lastAccessedAt;
    private long accessCount;
    // Numéro d'ordre du dernier accès (insertion incluse), départage les horodatages égaux
    private long accessSequence;

    CacheEntry(String key, ComputationKind kind, Object value, long insertedAt, long estimatedSizeBytes, long sequence) {
        this.key = key;
        this.kind = kind;
        this.value = value;
        this.insertedAt = insertedAt;
        this.lastAccessedAt = insertedAt;
        this.estimatedSizeBytes = estimatedSizeBytes;
        this.sequence = sequence;
        this.accessSequence = sequence;
    }

    void touch(long now, long accessSequence) {
        this.lastAccessedAt = now;
        this.accessSequence = accessSequence;
        this.accessCount++;
    }
}
