package net.deckadvisor.service;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.catalog.CatalogClient;
import net.deckadvisor.catalog.ResilientCatalogClient;
import net.deckadvisor.config.RecommendationProperties;
import net.deckadvisor.model.ArchetypeClassification;
import net.deckadvisor.model.CardCollection;
import net.deckadvisor.model.Deck;
import net.deckadvisor.model.DeckImprovement;
import net.deckadvisor.model.DeckProfile;
import net.deckadvisor.model.Recommendation;
import net.deckadvisor.service.generator.ArchetypeFitGenerator;
import net.deckadvisor.service.generator.CurveGapGenerator;
import net.deckadvisor.service.generator.FormatStaplesGenerator;
import net.deckadvisor.service.generator.SynergyGenerator;
import net.deckadvisor.util.ValidationUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Public entry points of the recommendation engine.
 *
 * <p>Calls block on catalog I/O. Callers with a responsiveness requirement use
 * {@link #recommendAsync}, which runs the same work on the bounded elastic scheduler.</p>
 */
@Service
@Slf4j
public class RecommendationEngine {

    private final RecommendationPipeline pipeline;
    private final BatchController batchController;
    private final DeckImprovementAdvisor improvementAdvisor;

    public RecommendationEngine(RecommendationPipeline pipeline,
                                BatchController batchController,
                                DeckImprovementAdvisor improvementAdvisor) {
        this.pipeline = pipeline;
        this.batchController = batchController;
        this.improvementAdvisor = improvementAdvisor;
    }

    /**
     * Wires a complete engine around a catalog client without a Spring context.
     */
    public static RecommendationEngine create(CatalogClient catalogClient, RecommendationProperties properties) {
        CatalogClient catalog = ResilientCatalogClient.wrap(catalogClient);
        KeywordExtractor keywordExtractor = new KeywordExtractor();
        RecommendationPipeline pipeline = new RecommendationPipeline(
            new DeckAnalyzer(catalog, keywordExtractor),
            new ArchetypeClassifier(properties),
            List.of(
                new FormatStaplesGenerator(catalog, keywordExtractor, properties),
                new ArchetypeFitGenerator(catalog, keywordExtractor, properties),
                new SynergyGenerator(catalog, keywordExtractor, properties),
                new CurveGapGenerator(catalog, keywordExtractor, properties)),
            new RecommendationRanker(),
            new OwnershipAnnotator(properties));
        return new RecommendationEngine(pipeline, new BatchController(pipeline, properties),
            new DeckImprovementAdvisor(properties));
    }

    public DeckProfile analyze(Deck deck) {
        return pipeline.analyze(deck);
    }

    public ArchetypeClassification classify(DeckProfile profile) {
        return pipeline.classify(profile);
    }

    /**
     * General advice on deck size, curve, colours and focus. An empty deck is advised to grow.
     */
    public List<DeckImprovement> suggestImprovements(Deck deck) {
        if (deck == null) {
            throw new IllegalArgumentException("Deck must not be null");
        }
        DeckProfile profile = analyze(deck);
        return suggestImprovements(profile, classify(profile));
    }

    public List<DeckImprovement> suggestImprovements(DeckProfile profile, ArchetypeClassification classification) {
        return improvementAdvisor.suggest(profile, classification);
    }

    /**
     * One-shot recommendations.
     *
     * @param deck deck to improve; an empty mainboard yields an empty list
     * @param collection owned cards, or null when unknown
     * @param count maximum number of recommendations, positive
     * @param format target format; null uses the deck's format
     * @return at most {@code count} ranked recommendations
     */
    public List<Recommendation> recommend(Deck deck, CardCollection collection, int count, String format) {
        ValidationUtils.requirePositive(count, "count");
        String targetFormat = resolveFormat(deck, format);
        if (deck == null || deck.isEmpty()) {
            return List.of();
        }
        List<Recommendation> ranked = pipeline.run(deck, collection, count, targetFormat);
        return ranked.size() <= count ? ranked : List.copyOf(ranked.subList(0, count));
    }

    /**
     * Runs {@link #recommend} on the bounded elastic scheduler.
     */
    public Mono<List<Recommendation>> recommendAsync(Deck deck, CardCollection collection, int count, String format) {
        return Mono.fromCallable(() -> recommend(deck, collection, count, format))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnError(e -> log.warn("Async recommendation for '{}' failed: {}",
                deck == null ? null : deck.getName(), e.getMessage()));
    }

    /**
     * Next slice of recommendations not returned before for this state.
     *
     * @throws net.deckadvisor.exception.InvalidBatchStateException when the state belongs to another deck
     */
    public List<Recommendation> recommendBatch(BatchState state, Deck deck, CardCollection collection,
                                               int increment, String format) {
        if (state == null || deck == null) {
            throw new IllegalArgumentException("Batch requests need a state and a deck");
        }
        return batchController.request(state, deck, collection, increment, resolveFormat(deck, format));
    }

    public void resetBatch(BatchState state, Deck deck) {
        batchController.reset(state, deck);
    }

    private static String resolveFormat(Deck deck, String format) {
        if (format == null) {
            return deck == null ? Deck.DEFAULT_FORMAT : deck.getFormat();
        }
        if (format.isBlank()) {
            throw new IllegalArgumentException("Format must not be blank");
        }
        return format.trim();
    }
}
