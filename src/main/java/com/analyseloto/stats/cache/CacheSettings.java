package com.analyseloto.stats.cache;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class CacheSettings {
    @Builder.Default int maxEntries = 500;
    @Builder.Default long maxMemoryBytes = 50L * 1024 * 1024;
    @Builder.Default Duration ttl = Duration.ofHours(1);
    // optimize() : grosses entrées non lues depuis staleAfter
    @Builder.Default long largeEntryBytes = 10_000L;
    @Builder.Default Duration staleAfter = Duration.ofHours(1);
    // optimize() : entrées lues au plus une fois et inactives depuis idleAfter
    @Builder.Default Duration idleAfter = Duration.ofHours(24);
}
