package net.deckadvisor.controller;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.controller.dto.BatchResponse;
import net.deckadvisor.controller.dto.DeckAnalysisResponse;
import net.deckadvisor.controller.dto.DeckRequest;
import net.deckadvisor.controller.dto.RecommendationRequest;
import net.deckadvisor.model.ArchetypeClassification;
import net.deckadvisor.model.Deck;
import net.deckadvisor.model.DeckProfile;
import net.deckadvisor.model.Recommendation;
import net.deckadvisor.service.BatchSessionRegistry;
import net.deckadvisor.service.BatchState;
import net.deckadvisor.service.RecommendationEngine;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * JSON surface over the recommendation engine.
 *
 * <p>Batch endpoints identify the caller's session through the {@value #SESSION_HEADER} header;
 * the server keeps one batch state per session.</p>
 */
@RestController
@RequestMapping(value = "/api/decks", produces = MediaType.APPLICATION_JSON_VALUE)
@Slf4j
public class DeckRecommendationController {

    public static final String SESSION_HEADER = "X-Batch-Session";

    private final RecommendationEngine engine;
    private final BatchSessionRegistry sessionRegistry;

    public DeckRecommendationController(RecommendationEngine engine, BatchSessionRegistry sessionRegistry) {
        this.engine = engine;
        this.sessionRegistry = sessionRegistry;
    }

    /**
     * Profile, archetype and improvement advice for a deck.
     */
    @PostMapping("/analyze")
    public DeckAnalysisResponse analyze(@RequestBody DeckRequest request) {
        Deck deck = requireDeck(request);
        DeckProfile profile = engine.analyze(deck);
        ArchetypeClassification classification = engine.classify(profile);
        return DeckAnalysisResponse.from(profile, classification,
            engine.suggestImprovements(profile, classification));
    }

    /**
     * One-shot ranked recommendations.
     */
    @PostMapping("/recommendations")
    public List<Recommendation> recommend(@RequestBody RecommendationRequest request) {
        Deck deck = requireDeck(request.deck());
        return engine.recommend(deck, request.toCollection(), request.countOrDefault(), request.format());
    }

    /**
     * Next slice of recommendations for the session, never repeating earlier ones.
     */
    @PostMapping("/recommendations/batch")
    public BatchResponse recommendBatch(@RequestHeader(SESSION_HEADER) String sessionId,
                                        @RequestBody RecommendationRequest request) {
        Deck deck = requireDeck(request.deck());
        BatchState state = sessionRegistry.stateFor(sessionId, deck);
        List<Recommendation> slice = engine.recommendBatch(state, deck, request.toCollection(),
            request.countOrDefault(), request.format());
        log.debug("Batch session {} returned {} recommendations (status {})", sessionId, slice.size(), state.getStatus());
        return BatchResponse.of(slice, state);
    }

    /**
     * Discards the session's batch state; the next batch request starts over.
     */
    @DeleteMapping("/recommendations/batch")
    public ResponseEntity<Void> resetBatch(@RequestHeader(SESSION_HEADER) String sessionId) {
        sessionRegistry.remove(sessionId);
        return ResponseEntity.noContent().build();
    }

    private static Deck requireDeck(DeckRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request must contain a deck");
        }
        return request.toDeck();
    }
}
