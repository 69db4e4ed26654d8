package net.deckadvisor.service;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.model.ArchetypeClassification;
import net.deckadvisor.model.CardCollection;
import net.deckadvisor.model.Deck;
import net.deckadvisor.model.DeckProfile;
import net.deckadvisor.model.GeneratorKind;
import net.deckadvisor.model.Recommendation;
import net.deckadvisor.service.generator.CandidateGenerator;
import net.deckadvisor.service.generator.GenerationContext;
import org.springframework.stereotype.Component;

/**
 * One full recommendation pass: analyze, classify, generate, rank, annotate.
 * Holds no per-call state, so a single instance serves concurrent callers.
 */
@Component
@Slf4j
public class RecommendationPipeline {

    private final DeckAnalyzer deckAnalyzer;
    private final ArchetypeClassifier archetypeClassifier;
    private final List<CandidateGenerator> generators;
    private final RecommendationRanker ranker;
    private final OwnershipAnnotator ownershipAnnotator;

    public RecommendationPipeline(DeckAnalyzer deckAnalyzer,
                                  ArchetypeClassifier archetypeClassifier,
                                  List<CandidateGenerator> generators,
                                  RecommendationRanker ranker,
                                  OwnershipAnnotator ownershipAnnotator) {
        this.deckAnalyzer = deckAnalyzer;
        this.archetypeClassifier = archetypeClassifier;
        this.generators = generators.stream()
            .sorted(Comparator.comparing(CandidateGenerator::kind))
            .toList();
        for (int i = 1; i < this.generators.size(); i++) {
            if (this.generators.get(i).kind() == this.generators.get(i - 1).kind()) {
                throw new IllegalStateException("More than one candidate generator registered for "
                    + this.generators.get(i).kind());
            }
        }
        this.ranker = ranker;
        this.ownershipAnnotator = ownershipAnnotator;
    }

    public DeckProfile analyze(Deck deck) {
        return deckAnalyzer.analyze(deck);
    }

    public ArchetypeClassification classify(DeckProfile profile) {
        return archetypeClassifier.classify(profile);
    }

    /**
     * Runs every generator sized for {@code targetCount} and returns the full ranked, annotated list.
     * Callers slice the result.
     */
    public List<Recommendation> run(Deck deck, CardCollection collection, int targetCount, String format) {
        DeckProfile profile = deckAnalyzer.analyze(deck);
        if (profile.isEmpty()) {
            return List.of();
        }
        ArchetypeClassification classification = archetypeClassifier.classify(profile);
        GenerationContext context = new GenerationContext(
            profile,
            classification,
            archetypeClassifier.template(classification.archetype()).orElse(null),
            deck.mainboardNames(),
            profile.colorIdentity(),
            format,
            targetCount);

        Map<GeneratorKind, List<Recommendation>> candidates = new EnumMap<>(GeneratorKind.class);
        for (CandidateGenerator generator : generators) {
            candidates.put(generator.kind(), generator.generate(context));
        }
        List<Recommendation> ranked = ranker.rank(candidates);
        log.info("Recommendation pass for '{}' ({} in {}): {} ranked candidates from {}",
            deck.getName(), classification.archetype(), format, ranked.size(), summarize(candidates));
        return ownershipAnnotator.annotate(ranked, collection);
    }

    private static Map<GeneratorKind, Integer> summarize(Map<GeneratorKind, List<Recommendation>> candidates) {
        Map<GeneratorKind, Integer> counts = new EnumMap<>(GeneratorKind.class);
        candidates.forEach((kind, list) -> counts.put(kind, list.size()));
        return counts;
    }
}
