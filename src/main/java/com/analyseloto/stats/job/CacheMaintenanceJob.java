package com.analyseloto.stats.job;

import com.analyseloto.stats.cache.ResultCache;
import com.analyseloto.stats.dto.OptimizationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class CacheMaintenanceJob {

    private final ResultCache resultCache;

    @Scheduled(fixedDelayString = "${stats.engine.cache.maintenance-interval-ms:600000}",
            initialDelayString = "${stats.engine.cache.maintenance-interval-ms:600000}")
    public void entretenirCache() {
        log.info("🧹 Lancement de l'entretien du cache de résultats...");

        int expired = resultCache.clearExpired();
        OptimizationResult optimization = resultCache.optimize();

        log.info("✅ Entretien terminé. {} entrée(s) expirée(s), {} optimisée(s), {} octets libérés, {} conservée(s).",
                expired, optimization.getRemoved(), optimization.getMemoryFreed(), optimization.getKept());
    }
}
