package net.deckadvisor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The user's owned cards keyed by exact name, split into regular and foil copies.
 */
public class CardCollection {

    private final Map<String, CollectionEntry> entries = new LinkedHashMap<>();

    public CardCollection addCard(String name, int quantity) {
        return addCard(name, quantity, false);
    }

    /**
     * Adds copies to the entry for {@code name}. Adding zero copies leaves the collection unchanged,
     * so every stored entry owns at least one copy.
     */
    public CardCollection addCard(String name, int quantity, boolean foil) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Card name must not be blank");
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity must not be negative: " + quantity);
        }
        if (quantity == 0) {
            return this;
        }
        String key = name.trim();
        CollectionEntry current = entries.getOrDefault(key, new CollectionEntry(key, 0, 0));
        entries.put(key, foil
            ? new CollectionEntry(key, current.regular(), current.foil() + quantity)
            : new CollectionEntry(key, current.regular() + quantity, current.foil()));
        return this;
    }

    /**
     * Removes copies, flooring at zero. The entry is dropped when no copies remain.
     *
     * @return true when the card was present
     */
    public boolean removeCard(String name, int quantity, boolean foil) {
        CollectionEntry current = entries.get(name);
        if (current == null) {
            return false;
        }
        CollectionEntry updated = foil
            ? new CollectionEntry(name, current.regular(), current.foil() - quantity)
            : new CollectionEntry(name, current.regular() - quantity, current.foil());
        if (updated.total() == 0) {
            entries.remove(name);
        } else {
            entries.put(name, updated);
        }
        return true;
    }

    /**
     * Exact lookup first, then a case-insensitive scan.
     */
    public Optional<CollectionEntry> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        CollectionEntry exact = entries.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return entries.values().stream()
            .filter(entry -> entry.name().toLowerCase(Locale.ROOT).equals(lower))
            .findFirst();
    }

    public int quantityOf(String name) {
        return find(name).map(CollectionEntry::total).orElse(0);
    }

    public int totalCards() {
        return entries.values().stream().mapToInt(CollectionEntry::total).sum();
    }

    public int uniqueCards() {
        return entries.size();
    }

    public Map<String, CollectionEntry> getEntries() {
        return Collections.unmodifiableMap(entries);
    }
}
