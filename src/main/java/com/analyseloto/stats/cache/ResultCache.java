package com.analyseloto.stats.cache;

import com.analyseloto.stats.dto.CacheStats;
import com.analyseloto.stats.dto.OptimizationResult;
import com.analyseloto.stats.enums.ComputationKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Cache de résultats borné en nombre d'entrées, en mémoire estimée et en durée de vie.
 * <ul>
 *     <li>Éviction mémoire : on retire les entrées les moins récemment lues (à égalité, les plus
 *     anciennement insérées) jusqu'à pouvoir loger la nouvelle entrée.</li>
 *     <li>Éviction en nombre : une seule entrée LRU retirée quand le plafond est atteint.</li>
 *     <li>TTL vérifié paresseusement à la lecture.</li>
 * </ul>
 * Toutes les mutations passent par le moniteur de l'instance (un seul écrivain à la fois).
 * Aucune méthode ne propage d'exception à l'appelant.
 */
@Slf4j
public class ResultCache {

    private static final long FALLBACK_SIZE_BYTES = 1024L;

    private static final Comparator<CacheEntry> RECENCY_ORDER = Comparator
            .comparingLong(CacheEntry::getLastAccessedAt)
            .thenComparingLong(CacheEntry::getAccessSequence);

    private final CacheSettings settings;
    private final Ticker ticker;
    private final ObjectMapper mapper;

    private final Map<String, CacheEntry> entries = new HashMap<>();
    // Index de récence : premier élément = prochaine victime
    // (le moins récemment lu, à égalité le plus anciennement inséré)
    private final NavigableSet<CacheEntry> recency = new TreeSet<>(RECENCY_ORDER);

    private long currentMemory;
    private long sequence;
    private long hits;
    private long misses;
    private long evictions;
    private long rejected;

    public ResultCache(CacheSettings settings, Ticker ticker, ObjectMapper mapper) {
        if (settings.getMaxEntries() < 1 || settings.getMaxMemoryBytes() < 1) {
            throw new IllegalArgumentException("Le cache doit accepter au moins une entrée et un octet");
        }
        this.settings = settings;
        this.ticker = ticker;
        this.mapper = mapper;
    }

    // --- CLÉS & TAILLES ---

    public CacheKey key(ComputationKind kind, Object... parameters) {
        try {
            return new CacheKey(kind, mapper.writeValueAsString(Arrays.asList(parameters)));
        } catch (JsonProcessingException e) {
            log.warn("Paramètres non sérialisables pour {} : {}", kind, e.getOriginalMessage());
            return new CacheKey(kind, Arrays.deepToString(parameters));
        }
    }

    /**
     * Estimation grossière : 2 octets par caractère de la forme JSON.
     */
    long estimateSize(Object value) {
        try {
            return mapper.writeValueAsString(value).length() * 2L;
        } catch (JsonProcessingException e) {
            log.warn("Taille non estimable ({}), valeur par défaut {} octets", e.getOriginalMessage(), FALLBACK_SIZE_BYTES);
            return FALLBACK_SIZE_BYTES;
        }
    }

    // --- ÉCRITURE ---

    public synchronized void set(CacheKey key, Object value) {
        if (value == null) return;
        String id = key.asString();
        long size = estimateSize(value);

        CacheEntry existing = entries.get(id);
        if (existing != null) remove(existing);

        if (size > settings.getMaxMemoryBytes()) {
            rejected++;
            log.warn("⚠️ Résultat {} trop volumineux pour le cache ({} octets > budget {})", id, size, settings.getMaxMemoryBytes());
            return;
        }

        if (currentMemory + size > settings.getMaxMemoryBytes()) {
            evictForMemory(size);
        }
        if (entries.size() >= settings.getMaxEntries()) {
            evictLeastRecentlyUsed();
        }

        CacheEntry entry = new CacheEntry(id, key.getKind(), value, ticker.read(), size, sequence++);
        entries.put(id, entry);
        recency.add(entry);
        currentMemory += size;
    }

    private void evictForMemory(long requiredSize) {
        int evicted = 0;
        while (!recency.isEmpty() && currentMemory + requiredSize > settings.getMaxMemoryBytes()) {
            remove(recency.first());
            evicted++;
        }
        evictions += evicted;
        log.debug("Pression mémoire : {} entrée(s) évincée(s), mémoire = {}/{}", evicted, currentMemory, settings.getMaxMemoryBytes());
    }

    private void evictLeastRecentlyUsed() {
        if (recency.isEmpty()) return;
        remove(recency.first());
        evictions++;
    }

    private void remove(CacheEntry entry) {
        recency.remove(entry);
        entries.remove(entry.getKey());
        currentMemory -= entry.getEstimatedSizeBytes();
    }

    // --- LECTURE ---

    /**
     * Lecture typée. Une entrée d'un autre type que celui demandé compte comme un échec.
     */
    public synchronized <T> Optional<T> get(CacheKey key, Class<T> type) {
        CacheEntry entry = entries.get(key.asString());
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        long now = ticker.read();
        if (isExpired(entry, now)) {
            remove(entry);
            misses++;
            return Optional.empty();
        }
        if (!type.isInstance(entry.getValue())) {
            log.warn("Type inattendu pour {} : {} au lieu de {}", key, entry.getValue().getClass().getSimpleName(), type.getSimpleName());
            misses++;
            return Optional.empty();
        }
        recency.remove(entry);
        entry.touch(now, sequence++);
        recency.add(entry);
        hits++;
        return Optional.of(type.cast(entry.getValue()));
    }

    public synchronized boolean has(CacheKey key) {
        CacheEntry entry = entries.get(key.asString());
        if (entry == null) return false;
        if (isExpired(entry, ticker.read())) {
            remove(entry);
            return false;
        }
        return true;
    }

    /**
     * Lecture, ou calcul puis mémorisation en cas d'absence. Le calcul se fait hors verrou.
     */
    public <T> T getOrCompute(CacheKey key, Class<T> type, Supplier<? extends T> loader) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) return cached.get();
        T computed = loader.get();
        set(key, computed);
        return computed;
    }

    private boolean isExpired(CacheEntry entry, long now) {
        return now - entry.getInsertedAt() > settings.getTtl().toNanos();
    }

    // --- MAINTENANCE ---

    public synchronized int clearExpired() {
        long now = ticker.read();
        List<CacheEntry> expired = new ArrayList<>();
        for (CacheEntry e : entries.values()) {
            if (isExpired(e, now)) expired.add(e);
        }
        expired.forEach(this::remove);
        return expired.size();
    }

    /**
     * Retire les entrées expirées, les grosses entrées non lues depuis {@code staleAfter}
     * et les entrées lues au plus une fois, inactives depuis {@code idleAfter}.
     */
    public synchronized OptimizationResult optimize() {
        long now = ticker.read();
        long staleNanos = settings.getStaleAfter().toNanos();
        long idleNanos = settings.getIdleAfter().toNanos();

        List<CacheEntry> toRemove = new ArrayList<>();
        for (CacheEntry e : entries.values()) {
            long idle = now - e.getLastAccessedAt();
            boolean largeAndStale = e.getEstimatedSizeBytes() > settings.getLargeEntryBytes() && idle > staleNanos;
            boolean rarelyUsed = e.getAccessCount() <= 1 && idle > idleNanos;
            if (isExpired(e, now) || largeAndStale || rarelyUsed) toRemove.add(e);
        }

        long freed = 0;
        for (CacheEntry e : toRemove) {
            freed += e.getEstimatedSizeBytes();
            remove(e);
        }
        return new OptimizationResult(toRemove.size(), entries.size(), freed);
    }

    public synchronized void clear() {
        entries.clear();
        recency.clear();
        currentMemory = 0;
    }

    // --- STATISTIQUES ---

    public synchronized CacheStats stats() {
        long now = ticker.read();
        long totalAge = 0;
        long totalAccesses = 0;
        Map<String, Long> distribution = new TreeMap<>();
        for (CacheEntry e : entries.values()) {
            totalAge += now - e.getInsertedAt();
            totalAccesses += e.getAccessCount();
            distribution.merge(e.getKind().getPrefix(), 1L, Long::sum);
        }
        long lookups = hits + misses;

        return CacheStats.builder()
                .size(entries.size())
                .maxSize(settings.getMaxEntries())
                .memoryUsage(currentMemory)
                .maxMemory(settings.getMaxMemoryBytes())
                .memoryUsagePercent(currentMemory * 100.0 / settings.getMaxMemoryBytes())
                .hitRate(lookups > 0 ? (double) hits / lookups : 0.0)
                .hits(hits)
                .misses(misses)
                .evictions(evictions)
                .rejected(rejected)
                .totalAccesses(totalAccesses)
                .averageAgeMillis(entries.isEmpty() ? 0.0 : totalAge / (double) entries.size() / 1_000_000.0)
                .kindDistribution(distribution)
                .build();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long memoryUsage() {
        return currentMemory;
    }
}
