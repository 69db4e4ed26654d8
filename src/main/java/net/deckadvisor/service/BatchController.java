package net.deckadvisor.service;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.config.RecommendationProperties;
import net.deckadvisor.exception.InvalidBatchStateException;
import net.deckadvisor.model.CardCollection;
import net.deckadvisor.model.Deck;
import net.deckadvisor.model.Recommendation;
import net.deckadvisor.util.ValidationUtils;
import org.springframework.stereotype.Component;

/**
 * Hands out recommendations a few at a time without repeating any.
 *
 * <p>Each request regenerates the ranked list for a cumulative target of
 * {@code returned + increment}, drops names already returned, and returns at most
 * {@code increment} new items. A request that yields none, or fewer than the exhaustion
 * ratio of the increment, moves the state to {@link BatchStatus#EXHAUSTED}; later requests
 * return an empty list until the state is reset.</p>
 */
@Component
@Slf4j
public class BatchController {

    private final RecommendationPipeline pipeline;
    private final double exhaustionRatio;

    public BatchController(RecommendationPipeline pipeline, RecommendationProperties properties) {
        this.pipeline = pipeline;
        this.exhaustionRatio = properties.getBatch().getExhaustionRatio();
    }

    public List<Recommendation> request(BatchState state, Deck deck, CardCollection collection,
                                        int increment, String format) {
        ValidationUtils.requirePositive(increment, "increment");
        synchronized (state) {
            String fingerprint = deck.fingerprint();
            if (state.getDeckFingerprint() == null) {
                state.bind(fingerprint);
            } else if (!state.getDeckFingerprint().equals(fingerprint)) {
                throw new InvalidBatchStateException(state.getDeckFingerprint(), fingerprint);
            }
            if (state.isExhausted()) {
                return List.of();
            }

            int target = state.getReturnedCount() + increment;
            List<Recommendation> fresh = new ArrayList<>(increment);
            for (Recommendation recommendation : pipeline.run(deck, collection, target, format)) {
                if (fresh.size() >= increment) {
                    break;
                }
                if (!state.hasReturned(recommendation.name())) {
                    fresh.add(recommendation);
                }
            }
            fresh.forEach(recommendation -> state.recordReturned(recommendation.name()));
            state.addRequested(increment);

            if (fresh.isEmpty() || fresh.size() < increment * exhaustionRatio) {
                state.markExhausted();
                log.info("Batch for deck '{}' exhausted after {} recommendations", deck.getName(), state.getReturnedCount());
            }
            return List.copyOf(fresh);
        }
    }

    /**
     * Clears returned names, rebinds the state to {@code deck} and makes it active again.
     */
    public void reset(BatchState state, Deck deck) {
        synchronized (state) {
            state.reset(deck == null ? null : deck.fingerprint());
        }
    }
}
