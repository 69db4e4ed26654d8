package net.deckadvisor.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Colour symbol helpers. Colours are single upper-case letters kept in WUBRG order.
 */
public final class ManaColors {

    public static final List<String> WUBRG = List.of("W", "U", "B", "R", "G");

    private ManaColors() {
    }

    /**
     * Upper-cases, drops unknown symbols and duplicates, and sorts into WUBRG order.
     */
    public static List<String> normalize(Collection<String> colors) {
        if (colors == null || colors.isEmpty()) {
            return List.of();
        }
        List<String> normalized = new ArrayList<>(WUBRG.size());
        for (String symbol : WUBRG) {
            for (String color : colors) {
                if (color != null && symbol.equals(color.trim().toUpperCase(Locale.ROOT))) {
                    normalized.add(symbol);
                    break;
                }
            }
        }
        return List.copyOf(normalized);
    }

    /**
     * True when every colour of the card is part of the deck's colours. Colourless cards always fit.
     */
    public static boolean fitsIdentity(Collection<String> cardColors, Collection<String> deckColors) {
        if (cardColors == null || cardColors.isEmpty()) {
            return true;
        }
        List<String> deck = normalize(deckColors);
        return deck.containsAll(normalize(cardColors));
    }

    /**
     * Concatenated symbols, e.g. {@code "UR"}; {@code "C"} for colourless.
     */
    public static String symbols(Collection<String> colors) {
        List<String> normalized = normalize(colors);
        return normalized.isEmpty() ? "C" : String.join("", normalized);
    }
}
