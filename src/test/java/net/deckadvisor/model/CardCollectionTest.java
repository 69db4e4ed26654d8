package net.deckadvisor.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class CardCollectionTest {

    @Test
    void should_TrackRegularAndFoilCopiesSeparately() {
        CardCollection collection = new CardCollection()
            .addCard("Lightning Bolt", 3)
            .addCard("Lightning Bolt", 1, true);

        CollectionEntry entry = collection.find("Lightning Bolt").orElseThrow();
        assertThat(entry.regular()).isEqualTo(3);
        assertThat(entry.foil()).isEqualTo(1);
        assertThat(collection.quantityOf("Lightning Bolt")).isEqualTo(4);
        assertThat(collection.uniqueCards()).isEqualTo(1);
        assertThat(collection.totalCards()).isEqualTo(4);
    }

    @Test
    void should_FindCaseInsensitively_When_NoExactMatch() {
        CardCollection collection = new CardCollection().addCard("Lightning Bolt", 2);

        assertThat(collection.quantityOf("lightning bolt")).isEqualTo(2);
        assertThat(collection.quantityOf("Shock")).isZero();
        assertThat(collection.find(null)).isEmpty();
    }

    @Test
    void should_IgnoreZeroCopies_So_CaseInsensitiveMatchStillWins() {
        CardCollection collection = new CardCollection()
            .addCard("lightning bolt", 3)
            .addCard("Lightning Bolt", 0);

        assertThat(collection.uniqueCards()).isEqualTo(1);
        assertThat(collection.quantityOf("Lightning Bolt")).isEqualTo(3);
        assertThat(collection.find("Lightning Bolt")).map(CollectionEntry::name).contains("lightning bolt");
    }

    @Test
    void should_FloorAtZeroAndDropEntry_When_RemovingTooMany() {
        CardCollection collection = new CardCollection()
            .addCard("Shock", 2)
            .addCard("Shock", 1, true);

        assertThat(collection.removeCard("Shock", 5, false)).isTrue();
        assertThat(collection.find("Shock").orElseThrow().regular()).isZero();
        assertThat(collection.quantityOf("Shock")).isEqualTo(1);

        collection.removeCard("Shock", 1, true);
        assertThat(collection.find("Shock")).isEmpty();
        assertThat(collection.removeCard("Shock", 1, true)).isFalse();
    }

    @Test
    void should_RejectInvalidInput() {
        CardCollection collection = new CardCollection();

        assertThatThrownBy(() -> collection.addCard(" ", 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> collection.addCard("Shock", -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
