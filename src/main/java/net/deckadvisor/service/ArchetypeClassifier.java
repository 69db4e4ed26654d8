package net.deckadvisor.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.config.RecommendationProperties;
import net.deckadvisor.exception.ArchetypeConfigurationException;
import net.deckadvisor.model.ArchetypeClassification;
import net.deckadvisor.model.ArchetypeTemplate;
import net.deckadvisor.model.DeckFeature;
import net.deckadvisor.model.DeckProfile;
import net.deckadvisor.util.ScoreUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Scores a deck profile against each archetype template.
 *
 * <p>A template's score is the sum of
 * <ol>
 *   <li>the share of cards inside its mana value range, times 0.3;</li>
 *   <li>0.2 when the deck's creature ratio satisfies its bound;</li>
 *   <li>{@code min(0.4, matchedKeywordWeight / totalCards * 2)};</li>
 *   <li>0.15 for each expected feature the deck shows.</li>
 * </ol>
 * The highest score wins, ties going to the earlier template. A best score under the threshold
 * reports the fallback archetype. Templates naming a keyword tag the extractor does not know are
 * rejected at construction.</p>
 */
@Component
@Slf4j
public class ArchetypeClassifier {

    private static final Set<String> KNOWN_TAGS = Set.copyOf(KeywordExtractor.knownTags());

    private final List<ArchetypeTemplate> templates;
    private final RecommendationProperties.Classifier settings;

    @Autowired
    public ArchetypeClassifier(RecommendationProperties properties) {
        this(ArchetypeTemplates.defaults(), properties);
    }

    public ArchetypeClassifier(List<ArchetypeTemplate> templates, RecommendationProperties properties) {
        if (templates == null || templates.isEmpty()) {
            throw new ArchetypeConfigurationException("<none>", "at least one archetype template is required");
        }
        Map<String, ArchetypeTemplate> unique = new LinkedHashMap<>();
        for (ArchetypeTemplate template : templates) {
            if (unique.putIfAbsent(template.name(), template) != null) {
                throw new ArchetypeConfigurationException(template.name(), "declared more than once");
            }
            for (String keyword : template.keywords()) {
                if (!KNOWN_TAGS.contains(keyword)) {
                    throw new ArchetypeConfigurationException(template.name(), "unknown keyword tag '" + keyword + "'");
                }
            }
        }
        this.templates = List.copyOf(templates);
        this.settings = properties.getClassifier();
    }

    public ArchetypeClassification classify(DeckProfile profile) {
        Map<String, Double> scores = new LinkedHashMap<>();
        String best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (ArchetypeTemplate template : templates) {
            double score = profile == null || profile.isEmpty() ? 0d : score(template, profile);
            scores.put(template.name(), score);
            if (score > bestScore) {
                best = template.name();
                bestScore = score;
            }
        }
        String label = bestScore < settings.getThreshold() ? settings.getFallbackArchetype() : best;
        log.debug("Classified deck as '{}' (best raw '{}' at {}): {}", label, best, bestScore, scores);
        return new ArchetypeClassification(label, scores);
    }

    public Optional<ArchetypeTemplate> template(String archetype) {
        return templates.stream().filter(template -> template.name().equals(archetype)).findFirst();
    }

    public List<ArchetypeTemplate> getTemplates() {
        return templates;
    }

    double score(ArchetypeTemplate template, DeckProfile profile) {
        double total = profile.totalCards();
        double score = 0d;

        if (template.manaValueRange() != null) {
            int inRange = profile.manaValues().entrySet().stream()
                .filter(entry -> template.manaValueRange().contains(entry.getKey()))
                .mapToInt(Map.Entry::getValue)
                .sum();
            score += ScoreUtils.ratio(inRange, total) * settings.getManaValueWeight();
        }

        if (template.creatureRatioBound() != null
                && template.creatureRatioBound().isSatisfiedBy(profile.creatureRatio())) {
            score += settings.getCreatureBoundBonus();
        }

        int matchedWeight = template.keywords().stream().mapToInt(profile::keywordCount).sum();
        score += Math.min(settings.getKeywordCap(), ScoreUtils.ratio(matchedWeight, total) * settings.getKeywordMultiplier());

        for (DeckFeature feature : template.features()) {
            if (profile.keywordCount(feature.getKeywordTag()) > 0) {
                score += settings.getFeatureBonus();
            }
        }
        return ScoreUtils.round(score);
    }
}
