package net.deckadvisor.catalog;

import com.github.benmanes.caffeine.cache.Cache;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.config.CacheFactory;
import net.deckadvisor.config.CatalogProperties;
import net.deckadvisor.model.Card;
import net.deckadvisor.util.ExternalApiLogger;

/**
 * Memoizing decorator over a catalog client.
 *
 * <p>Card lookups, including "not found" answers, are kept for the card TTL (30 days by default);
 * search results for the search TTL (1 day). Transport failures propagate and are never cached.</p>
 */
@Slf4j
public class CatalogCache implements CatalogClient {

    private static final String CACHE_NAME = "CatalogCache";

    private final CatalogClient delegate;
    private final Cache<String, Optional<Card>> cards;
    private final Cache<String, List<Card>> searches;
    private final CatalogRequestMonitor monitor;

    public CatalogCache(CatalogClient delegate,
                        CacheFactory cacheFactory,
                        CatalogProperties properties,
                        CatalogRequestMonitor monitor) {
        this.delegate = delegate;
        this.cards = cacheFactory.createCache("catalogCards", properties.getCardCacheSize(), properties.getCardTtl());
        this.searches = cacheFactory.createCache("catalogSearches", properties.getSearchCacheSize(), properties.getSearchTtl());
        this.monitor = monitor;
    }

    @Override
    public Optional<Card> lookupByName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        Optional<Card> cached = cards.getIfPresent(key);
        if (cached != null) {
            monitor.recordCacheHit();
            ExternalApiLogger.logCacheHit(log, CACHE_NAME, "lookup", name);
            return cached;
        }
        monitor.recordCacheMiss();
        Optional<Card> resolved = delegate.lookupByName(name);
        cards.put(key, resolved);
        return resolved;
    }

    @Override
    public List<Card> search(CatalogQuery query, int limit) {
        if (query == null || limit <= 0) {
            return List.of();
        }
        String key = query.toScryfallQuery() + "#" + limit;
        List<Card> cached = searches.getIfPresent(key);
        if (cached != null) {
            monitor.recordCacheHit();
            ExternalApiLogger.logCacheHit(log, CACHE_NAME, "search", key);
            return cached;
        }
        monitor.recordCacheMiss();
        List<Card> results = List.copyOf(delegate.search(query, limit));
        searches.put(key, results);
        results.forEach(card -> cards.put(card.name().toLowerCase(Locale.ROOT), Optional.of(card)));
        return results;
    }

    public long estimatedSize() {
        return cards.estimatedSize() + searches.estimatedSize();
    }

    public void invalidateAll() {
        cards.invalidateAll();
        searches.invalidateAll();
    }
}
