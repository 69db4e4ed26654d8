package net.deckadvisor.service;

import com.github.benmanes.caffeine.cache.Cache;
import net.deckadvisor.config.CacheFactory;
import net.deckadvisor.config.RecommendationProperties;
import net.deckadvisor.model.Deck;
import org.springframework.stereotype.Component;

/**
 * Server-held batch states keyed by client session id. Idle sessions expire.
 */
@Component
public class BatchSessionRegistry {

    private final Cache<String, BatchState> sessions;

    public BatchSessionRegistry(CacheFactory cacheFactory, RecommendationProperties properties) {
        RecommendationProperties.Batch batch = properties.getBatch();
        this.sessions = cacheFactory.createIdleExpiringCache("batchSessions", batch.getMaxSessions(), batch.getSessionIdleTimeout());
    }

    /**
     * Existing state for the session, or a new one bound to {@code deck}.
     */
    public BatchState stateFor(String sessionId, Deck deck) {
        return sessions.get(requireId(sessionId), id -> BatchState.forDeck(deck));
    }

    public void remove(String sessionId) {
        sessions.invalidate(requireId(sessionId));
    }

    private static String requireId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Batch session id must not be blank");
        }
        return sessionId.trim();
    }
}
