package net.deckadvisor.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.model.Card;
import org.springframework.core.io.Resource;

/**
 * In-memory catalog over a fixed card list, evaluated with {@link CatalogQuery#matches(Card)}.
 * Search results keep the list's order, so the client is fully deterministic.
 *
 * <p>The JSON source may be either an array of Scryfall card objects or a Scryfall list object
 * with a {@code data} array.</p>
 */
@Slf4j
public class LocalCatalogClient implements CatalogClient {

    private final List<Card> cards;
    private final Map<String, Card> byName = new LinkedHashMap<>();
    private final Map<String, Card> byLowerName = new LinkedHashMap<>();

    public LocalCatalogClient(Collection<Card> cards) {
        this.cards = List.copyOf(cards);
        for (Card card : this.cards) {
            byName.putIfAbsent(card.name(), card);
            byLowerName.putIfAbsent(card.name().toLowerCase(Locale.ROOT), card);
        }
    }

    public static LocalCatalogClient of(Card... cards) {
        return new LocalCatalogClient(List.of(cards));
    }

    /**
     * Loads a card list. Fails fast when the resource is missing or unreadable.
     */
    public static LocalCatalogClient fromResource(Resource resource, ObjectMapper objectMapper) {
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            JsonNode items = root != null && root.isObject() ? root.get("data") : root;
            if (items == null || !items.isArray()) {
                throw new IllegalStateException("Catalog file " + resource.getDescription()
                    + " must contain a JSON array of cards");
            }
            List<Card> loaded = new ArrayList<>(items.size());
            for (JsonNode item : items) {
                ScryfallCardMapper.map(item).ifPresent(loaded::add);
            }
            log.info("Loaded {} cards into the local catalog from {}", loaded.size(), resource.getDescription());
            return new LocalCatalogClient(loaded);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read catalog file " + resource.getDescription(), e);
        }
    }

    @Override
    public Optional<Card> lookupByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        Card exact = byName.get(trimmed);
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(byLowerName.get(trimmed.toLowerCase(Locale.ROOT)));
    }

    @Override
    public List<Card> search(CatalogQuery query, int limit) {
        if (query == null || limit <= 0) {
            return List.of();
        }
        return cards.stream()
            .filter(query::matches)
            .limit(limit)
            .toList();
    }

    public int size() {
        return cards.size();
    }
}
