package com.analyseloto.stats.config;

import com.analyseloto.stats.service.StatsEngineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
@Slf4j
@RequiredArgsConstructor
public class AppStartupRunner {
    private final StatsEngineService statsEngineService;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        // Le préchauffage du cache est délégué à un thread séparé
        CompletableFuture.runAsync(() -> {
            log.info("🔥 [WARMUP] Préchauffage du cache de résultats...");
            try {
                if (statsEngineService.warmUp()) {
                    log.info("✅ [WARMUP] Terminé : {} entrées en cache", statsEngineService.getCacheStats().getSize());
                } else {
                    log.info("[WARMUP] Aucun tirage disponible, préchauffage ignoré");
                }
            } catch (RuntimeException e) {
                log.error("❌ [WARMUP] Échec du préchauffage : {}", e.getMessage());
            }
        });
    }
}
