package net.deckadvisor.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecommendationTest {

    @Test
    void should_ClampScoresIntoUnitInterval() {
        Recommendation recommendation = Recommendation.builder()
            .name("Shock")
            .confidence(1.3)
            .synergyScore(-0.2)
            .metaScore(Double.NaN)
            .deckFitScore(0.5)
            .build();

        assertThat(recommendation.confidence()).isEqualTo(1.0);
        assertThat(recommendation.synergyScore()).isZero();
        assertThat(recommendation.metaScore()).isZero();
        assertThat(recommendation.deckFitScore()).isEqualTo(0.5);
        assertThat(recommendation.toBuilder().confidence(7).build().confidence()).isEqualTo(1.0);
    }

    @Test
    void should_DefaultOwnershipAndCollections() {
        Recommendation recommendation = Recommendation.builder().name("Shock").build();

        assertThat(recommendation.ownership()).isEqualTo(OwnershipStatus.UNKNOWN);
        assertThat(recommendation.reasons()).isEmpty();
        assertThat(recommendation.keywords()).isEmpty();
    }

    @Test
    void should_CopyReasons_When_Built() {
        List<String> reasons = new ArrayList<>(List.of("Cheap burn"));
        Recommendation recommendation = Recommendation.builder().name("Shock").reasons(reasons).build();
        reasons.add("mutated");

        assertThat(recommendation.reasons()).containsExactly("Cheap burn");
    }

    @Test
    void should_MapRarityToCraftStatus() {
        assertThat(OwnershipStatus.craftFor("mythic")).isEqualTo(OwnershipStatus.CRAFT_MYTHIC);
        assertThat(OwnershipStatus.craftFor("Mythic Rare")).isEqualTo(OwnershipStatus.CRAFT_MYTHIC);
        assertThat(OwnershipStatus.craftFor("u")).isEqualTo(OwnershipStatus.CRAFT_UNCOMMON);
        assertThat(OwnershipStatus.craftFor("special")).isEqualTo(OwnershipStatus.UNKNOWN);
        assertThat(OwnershipStatus.craftFor(null)).isEqualTo(OwnershipStatus.UNKNOWN);
    }
}
