package net.deckadvisor.model;

import java.util.Optional;

/**
 * Constraint on the share of creatures in a deck.
 *
 * @param kind which side of the interval is enforced
 * @param lower lower bound, used by {@link Kind#MIN} and {@link Kind#RANGE}
 * @param upper upper bound, used by {@link Kind#MAX} and {@link Kind#RANGE}
 */
public record CreatureRatioBound(Kind kind, double lower, double upper) {

    public enum Kind {
        MIN,
        MAX,
        RANGE
    }

    public static CreatureRatioBound atLeast(double lower) {
        return new CreatureRatioBound(Kind.MIN, lower, 1d);
    }

    public static CreatureRatioBound atMost(double upper) {
        return new CreatureRatioBound(Kind.MAX, 0d, upper);
    }

    public static CreatureRatioBound between(double lower, double upper) {
        return new CreatureRatioBound(Kind.RANGE, lower, upper);
    }

    public boolean isSatisfiedBy(double creatureRatio) {
        return switch (kind) {
            case MIN -> creatureRatio >= lower;
            case MAX -> creatureRatio <= upper;
            case RANGE -> creatureRatio >= lower && creatureRatio <= upper;
        };
    }

    /**
     * Whether a single card fits this bound by being a creature ({@code true}) or not ({@code false}).
     * A two-sided range expresses no preference.
     */
    public Optional<Boolean> prefersCreatures() {
        return switch (kind) {
            case MIN -> Optional.of(Boolean.TRUE);
            case MAX -> Optional.of(Boolean.FALSE);
            case RANGE -> Optional.empty();
        };
    }
}
