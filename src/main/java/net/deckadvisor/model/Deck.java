package net.deckadvisor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import net.deckadvisor.util.HashUtils;
import net.deckadvisor.util.ValidationUtils;

/**
 * Ordered deck list holding at most one entry per (card name, sideboard flag).
 * Adding a card that is already listed merges the quantities.
 */
public class Deck {

    public static final String DEFAULT_FORMAT = "standard";

    private final String name;
    private final String format;
    private final List<DeckEntry> entries = new ArrayList<>();

    public Deck(String name) {
        this(name, DEFAULT_FORMAT);
    }

    public Deck(String name, String format) {
        this.name = ValidationUtils.textOrDefault(name, "Untitled Deck");
        this.format = ValidationUtils.textOrDefault(format, DEFAULT_FORMAT).toLowerCase(Locale.ROOT);
    }

    public String getName() {
        return name;
    }

    public String getFormat() {
        return format;
    }

    public Deck addCard(Card card, int quantity) {
        return addCard(card, quantity, false);
    }

    /**
     * Adds copies of a card, merging with an existing entry for the same name and board.
     */
    public Deck addCard(Card card, int quantity, boolean sideboard) {
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity must not be negative: " + quantity);
        }
        int index = indexOf(card.name(), sideboard);
        if (index >= 0) {
            DeckEntry existing = entries.get(index);
            entries.set(index, existing.withQuantity(existing.quantity() + quantity));
        } else {
            entries.add(new DeckEntry(card, quantity, sideboard));
        }
        return this;
    }

    /**
     * Removes copies of a card; the entry disappears once its quantity reaches zero.
     *
     * @return true when an entry was found
     */
    public boolean removeCard(String cardName, int quantity, boolean sideboard) {
        int index = indexOf(cardName, sideboard);
        if (index < 0) {
            return false;
        }
        DeckEntry existing = entries.get(index);
        int remaining = existing.quantity() - quantity;
        if (remaining <= 0) {
            entries.remove(index);
        } else {
            entries.set(index, existing.withQuantity(remaining));
        }
        return true;
    }

    public List<DeckEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<DeckEntry> mainboard() {
        return entries.stream().filter(entry -> !entry.sideboard()).toList();
    }

    public List<DeckEntry> sideboard() {
        return entries.stream().filter(DeckEntry::sideboard).toList();
    }

    public int totalCards(boolean includeSideboard) {
        return entries.stream()
            .filter(entry -> includeSideboard || !entry.sideboard())
            .mapToInt(DeckEntry::quantity)
            .sum();
    }

    public boolean isEmpty() {
        return mainboard().isEmpty();
    }

    /**
     * Lower-cased names of every mainboard card, in deck order.
     */
    public Set<String> mainboardNames() {
        return mainboard().stream()
            .map(entry -> entry.name().toLowerCase(Locale.ROOT))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Stable hash of the format and the mainboard (name, quantity) pairs, independent of entry order.
     */
    public String fingerprint() {
        String contents = mainboard().stream()
            .map(entry -> entry.name().toLowerCase(Locale.ROOT) + "|" + entry.quantity())
            .sorted()
            .collect(Collectors.joining("\n"));
        return HashUtils.sha256Hex(format + "\n" + contents);
    }

    private int indexOf(String cardName, boolean sideboard) {
        for (int i = 0; i < entries.size(); i++) {
            DeckEntry entry = entries.get(i);
            if (entry.sideboard() == sideboard && entry.name().equals(cardName)) {
                return i;
            }
        }
        return -1;
    }
}
