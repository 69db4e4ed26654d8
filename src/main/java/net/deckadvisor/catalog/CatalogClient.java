package net.deckadvisor.catalog;

import java.util.List;
import java.util.Optional;
import net.deckadvisor.model.Card;

/**
 * Source of canonical card metadata.
 *
 * <p>Implementations never raise for "not found": a missing card is an empty {@link Optional}
 * and a search without hits is an empty list. Transport problems surface as
 * {@link net.deckadvisor.exception.CatalogTransportException}.</p>
 */
public interface CatalogClient {

    /**
     * Resolves a card by name.
     *
     * @param name card name, matched exactly first and loosely second where the source supports it
     * @return the card, or empty when the catalog does not know it
     */
    Optional<Card> lookupByName(String name);

    /**
     * Searches the catalog.
     *
     * @param query filter to apply
     * @param limit maximum number of cards to return
     * @return matching cards in the source's relevance order, at most {@code limit}
     */
    List<Card> search(CatalogQuery query, int limit);
}
