package net.deckadvisor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.catalog.CatalogCache;
import net.deckadvisor.catalog.CatalogClient;
import net.deckadvisor.catalog.CatalogRequestMonitor;
import net.deckadvisor.catalog.LocalCatalogClient;
import net.deckadvisor.catalog.ResilientCatalogClient;
import net.deckadvisor.catalog.ScryfallCatalogClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Assembles the catalog client the engine talks to:
 * provider client, wrapped in the catalog cache, wrapped in the failure-absorbing decorator.
 */
@Configuration
@Slf4j
public class CatalogConfig {

    @Bean
    public CatalogClient catalogClient(CatalogProperties properties,
                                       CacheFactory cacheFactory,
                                       CatalogRequestMonitor monitor,
                                       WebClient.Builder webClientBuilder,
                                       RateLimiter scryfallRateLimiter,
                                       ResourceLoader resourceLoader,
                                       ObjectMapper objectMapper) {
        CatalogClient provider = switch (properties.getProvider()) {
            case SCRYFALL -> new ScryfallCatalogClient(webClientBuilder, properties, scryfallRateLimiter, monitor);
            case LOCAL -> LocalCatalogClient.fromResource(resourceLoader.getResource(properties.getLocalPath()), objectMapper);
        };
        log.info("Card catalog provider: {} (card TTL {}, search TTL {})",
            properties.getProvider(), properties.getCardTtl(), properties.getSearchTtl());
        return ResilientCatalogClient.wrap(new CatalogCache(provider, cacheFactory, properties, monitor), monitor);
    }
}
