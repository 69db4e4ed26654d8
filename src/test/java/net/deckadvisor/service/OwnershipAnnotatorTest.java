package net.deckadvisor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import net.deckadvisor.config.RecommendationProperties;
import net.deckadvisor.model.CardCollection;
import net.deckadvisor.model.OwnershipStatus;
import net.deckadvisor.model.Recommendation;
import org.junit.jupiter.api.Test;

class OwnershipAnnotatorTest {

    private final OwnershipAnnotator annotator = new OwnershipAnnotator(RecommendationProperties.defaults());

    private static Recommendation recommendation(String name, String rarity, double confidence) {
        return Recommendation.builder()
            .name(name)
            .rarity(rarity)
            .confidence(confidence)
            .reasons(List.of("Popular standard staple"))
            .build();
    }

    @Test
    void should_MarkOwnedAndBoostConfidence() {
        CardCollection collection = new CardCollection().addCard("Lightning Bolt", 3).addCard("Lightning Bolt", 1, true);

        Recommendation annotated = annotator.annotate(List.of(recommendation("Lightning Bolt", "common", 0.8)), collection).get(0);

        assertThat(annotated.ownership()).isEqualTo(OwnershipStatus.OWNED);
        assertThat(annotated.confidence()).isCloseTo(0.9, within(1e-9));
        assertThat(annotated.reasons()).containsExactly("Popular standard staple", "Already in your collection (4)");
    }

    @Test
    void should_ClampBoostedConfidence() {
        CardCollection collection = new CardCollection().addCard("Sheoldred, the Apocalypse", 1);

        Recommendation annotated = annotator.annotate(
            List.of(recommendation("Sheoldred, the Apocalypse", "mythic", 0.95)), collection).get(0);

        assertThat(annotated.confidence()).isEqualTo(1.0);
    }

    @Test
    void should_MarkCraftByRarity_When_NotOwned() {
        CardCollection collection = new CardCollection().addCard("Shock", 4);

        List<Recommendation> annotated = annotator.annotate(List.of(
            recommendation("Sheoldred, the Apocalypse", "mythic", 0.8),
            recommendation("Counterspell", "uncommon", 0.7),
            recommendation("Oddity", "special", 0.6)), collection);

        assertThat(annotated).extracting(Recommendation::ownership).containsExactly(
            OwnershipStatus.CRAFT_MYTHIC, OwnershipStatus.CRAFT_UNCOMMON, OwnershipStatus.UNKNOWN);
        assertThat(annotated).extracting(Recommendation::confidence).containsExactly(0.8, 0.7, 0.6);
    }

    @Test
    void should_MarkUnknown_When_CollectionAbsent() {
        List<Recommendation> annotated = annotator.annotate(List.of(recommendation("Shock", "common", 0.7)), null);

        assertThat(annotated.get(0).ownership()).isEqualTo(OwnershipStatus.UNKNOWN);
        assertThat(annotated.get(0).confidence()).isEqualTo(0.7);
    }

    @Test
    void should_LeaveCollectionUntouched() {
        CardCollection collection = new CardCollection().addCard("Shock", 2);

        annotator.annotate(List.of(recommendation("Shock", "common", 0.7)), collection);

        assertThat(collection.quantityOf("Shock")).isEqualTo(2);
        assertThat(collection.uniqueCards()).isEqualTo(1);
    }
}
