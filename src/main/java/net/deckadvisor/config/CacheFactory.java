package net.deckadvisor.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory for creating Caffeine caches with consistent configuration.
 * Centralizes cache creation for the catalog cache and the batch session registry.
 */
@Component
@Slf4j
public class CacheFactory {

    /**
     * Create a cache whose entries expire a fixed time after they are written.
     */
    public <K, V> Cache<K, V> createCache(String name, int maxSize, Duration ttl) {
        log.debug("Creating cache '{}' (max {} entries, expire {} after write)", name, maxSize, ttl);
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
    }

    /**
     * Create a cache whose entries expire once they have gone unused for {@code idle}.
     */
    public <K, V> Cache<K, V> createIdleExpiringCache(String name, int maxSize, Duration idle) {
        log.debug("Creating cache '{}' (max {} entries, expire {} after access)", name, maxSize, idle);
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterAccess(idle)
            .recordStats()
            .build();
    }
}
