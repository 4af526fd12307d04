package com.analyseloto.stats.config;

import com.analyseloto.stats.cache.CacheSettings;
import com.analyseloto.stats.cache.ResultCache;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Slf4j
@Configuration
public class CacheConfig {

    @Value("${stats.engine.cache.max-entries:500}")
    private int maxEntries;

    @Value("${stats.engine.cache.max-memory-bytes:52428800}")
    private long maxMemoryBytes;

    @Value("${stats.engine.cache.ttl:PT1H}")
    private Duration ttl;

    @Value("${stats.engine.cache.large-entry-bytes:10000}")
    private long largeEntryBytes;

    @Value("${stats.engine.cache.stale-after:PT1H}")
    private Duration staleAfter;

    @Value("${stats.engine.cache.idle-after:PT24H}")
    private Duration idleAfter;

    /**
     * Mapper dédié aux clés et à l'estimation de taille : propriétés et clés de map triées,
     * pour qu'un même paramétrage produise toujours la même clé.
     */
    public static ObjectMapper cacheObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule()) // Gestion des dates Java 8
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .build();
    }

    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    public ResultCache resultCache(Ticker cacheTicker) {
        CacheSettings settings = CacheSettings.builder()
                .maxEntries(maxEntries)
                .maxMemoryBytes(maxMemoryBytes)
                .ttl(ttl)
                .largeEntryBytes(largeEntryBytes)
                .staleAfter(staleAfter)
                .idleAfter(idleAfter)
                .build();
        log.info("Cache de résultats : {} entrées max, {} octets max, TTL {}", maxEntries, maxMemoryBytes, ttl);
        return new ResultCache(settings, cacheTicker, cacheObjectMapper());
    }
}
