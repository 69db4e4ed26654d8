package net.deckadvisor.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Tuned constants of the recommendation engine. The defaults are hand-picked heuristics;
 * every value can be overridden under {@code deckadvisor.recommendation}.
 */
@Component
@ConfigurationProperties(prefix = "deckadvisor.recommendation")
@Getter
@Setter
public class RecommendationProperties {

    /**
     * Requested count at which generators run with their base limits. Larger requests scale the limits up.
     */
    private int referenceCount = 25;

    /**
     * Catalog search size as a multiple of a generator's limit, leaving room for dedupe and filtering.
     */
    private int searchMultiplier = 2;

    /**
     * Confidence added when the user already owns the card.
     */
    private double ownedBonus = 0.1;

    private Classifier classifier = new Classifier();
    private Staples staples = new Staples();
    private ArchetypeFit archetypeFit = new ArchetypeFit();
    private Synergy synergy = new Synergy();
    private CurveGap curveGap = new CurveGap();
    private Batch batch = new Batch();
    private Improvements improvements = new Improvements();

    /**
     * Defaults without Spring binding, for standalone engine construction.
     */
    public static RecommendationProperties defaults() {
        RecommendationProperties properties = new RecommendationProperties();
        properties.validate();
        return properties;
    }

    @Getter
    @Setter
    public static class Classifier {
        /** Best scores below this fall back to {@link #fallbackArchetype}. */
        private double threshold = 0.3;
        private String fallbackArchetype = "midrange";
        private double manaValueWeight = 0.3;
        private double creatureBoundBonus = 0.2;
        private double keywordCap = 0.4;
        private double keywordMultiplier = 2.0;
        private double featureBonus = 0.15;
    }

    @Getter
    @Setter
    public static class Staples {
        private int limit = 8;
        private int maxManaValue = 6;
        private double baseConfidence = 0.6;
        private double legalBonus = 0.2;
        private double rareBonus = 0.1;
        private double uncommonBonus = 0.05;
        /** Candidates scoring below this are dropped. */
        private double minConfidence = 0.5;
        private double synergyScore = 0.6;
        private double metaScore = 0.8;
        private double deckFitScore = 0.7;
    }

    @Getter
    @Setter
    public static class ArchetypeFit {
        private int limit = 6;
        /** Template keywords used in the catalog query, most characteristic first. */
        private int queryKeywords = 3;
        private double keywordMatchWeight = 0.1;
        private double keywordCap = 0.4;
        private double rangeBonus = 0.3;
        private double creatureBonus = 0.2;
        /** Candidates fitting worse than this are dropped. */
        private double minFit = 0.4;
        private double baseConfidence = 0.6;
        private double fitWeight = 0.3;
        private double metaScore = 0.7;
        private double deckFitScore = 0.9;
    }

    @Getter
    @Setter
    public static class Synergy {
        private int limit = 6;
        private int tribalThreshold = 2;
        private int mechanicThreshold = 3;
        private int maxThemes = 2;
        private double baseConfidence = 0.7;
        private double strengthWeight = 0.2;
        /** Theme strength at which the synergy score saturates. */
        private double strengthScale = 10.0;
        private double metaScore = 0.6;
        private double deckFitScore = 0.9;
    }

    @Getter
    @Setter
    public static class CurveGap {
        private int limit = 5;
        /** A slot is a gap when its share is below this fraction of the ideal share. */
        private double gapThreshold = 0.6;
        private int maxGaps = 2;
        private double baseConfidence = 0.6;
        private double synergyScore = 0.5;
        private double metaScore = 0.6;
        private double deckFitScore = 0.8;
        /** Ideal share of mainboard cards per mana value; lands count toward the total. */
        private Map<Integer, Double> idealDistribution = defaultIdealDistribution();

        private static Map<Integer, Double> defaultIdealDistribution() {
            Map<Integer, Double> ideal = new LinkedHashMap<>();
            ideal.put(1, 0.20);
            ideal.put(2, 0.30);
            ideal.put(3, 0.25);
            ideal.put(4, 0.15);
            ideal.put(5, 0.10);
            return ideal;
        }
    }

    @Getter
    @Setter
    public static class Batch {
        /** A request returning fewer than this share of the increment exhausts the batch. */
        private double exhaustionRatio = 0.5;
        private Duration sessionIdleTimeout = Duration.ofMinutes(30);
        private int maxSessions = 10_000;
    }

    @Getter
    @Setter
    public static class Improvements {
        private int minDeckSize = 60;
        /** Mana values up to this one count as early game. */
        private int earlyGameMaxManaValue = 2;
        private double minEarlyGameShare = 0.3;
        /** Mana values from this one up count as late game. */
        private int lateGameMinManaValue = 5;
        private double maxLateGameShare = 0.2;
        private int maxColors = 3;
        /** A best archetype score below this marks the deck as unfocused. */
        private double focusThreshold = 0.5;
    }

    @PostConstruct
    void validate() {
        Assert.isTrue(referenceCount > 0, "deckadvisor.recommendation.reference-count must be positive");
        Assert.isTrue(searchMultiplier > 0, "deckadvisor.recommendation.search-multiplier must be positive");
        assertUnit(ownedBonus, "owned-bonus");
        assertUnit(classifier.threshold, "classifier.threshold");
        Assert.hasText(classifier.fallbackArchetype, "deckadvisor.recommendation.classifier.fallback-archetype must be set");
        Assert.isTrue(staples.limit > 0 && archetypeFit.limit > 0 && synergy.limit > 0 && curveGap.limit > 0,
                "deckadvisor.recommendation generator limits must be positive");
        Assert.isTrue(archetypeFit.queryKeywords > 0, "deckadvisor.recommendation.archetype-fit.query-keywords must be positive");
        Assert.isTrue(synergy.maxThemes > 0, "deckadvisor.recommendation.synergy.max-themes must be positive");
        Assert.isTrue(synergy.strengthScale > 0, "deckadvisor.recommendation.synergy.strength-scale must be positive");
        Assert.isTrue(curveGap.maxGaps > 0, "deckadvisor.recommendation.curve-gap.max-gaps must be positive");
        Assert.notEmpty(curveGap.idealDistribution, "deckadvisor.recommendation.curve-gap.ideal-distribution must not be empty");
        curveGap.idealDistribution.forEach((manaValue, share) -> {
            Assert.isTrue(manaValue != null && manaValue >= 0, "curve-gap.ideal-distribution keys must be non-negative");
            Assert.isTrue(share != null && share > 0 && share <= 1, "curve-gap.ideal-distribution shares must lie in (0, 1]");
        });
        assertUnit(batch.exhaustionRatio, "batch.exhaustion-ratio");
        Assert.isTrue(batch.maxSessions > 0, "deckadvisor.recommendation.batch.max-sessions must be positive");
        Assert.isTrue(improvements.minDeckSize > 0, "deckadvisor.recommendation.improvements.min-deck-size must be positive");
        Assert.isTrue(improvements.earlyGameMaxManaValue < improvements.lateGameMinManaValue,
                "deckadvisor.recommendation.improvements early game must end before late game starts");
        assertUnit(improvements.minEarlyGameShare, "improvements.min-early-game-share");
        assertUnit(improvements.maxLateGameShare, "improvements.max-late-game-share");
        assertUnit(improvements.focusThreshold, "improvements.focus-threshold");
    }

    private static void assertUnit(double value, String name) {
        Assert.isTrue(value >= 0 && value <= 1, "deckadvisor.recommendation." + name + " must lie in [0, 1]");
    }
}
