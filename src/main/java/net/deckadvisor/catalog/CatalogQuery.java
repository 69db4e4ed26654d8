package net.deckadvisor.catalog;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Builder;
import net.deckadvisor.model.Card;
import net.deckadvisor.model.Rarity;
import net.deckadvisor.util.ManaColors;

/**
 * Catalog search filter. Renders to Scryfall search syntax and can also be evaluated in memory,
 * so remote and local catalogs apply the same semantics.
 *
 * <p>{@code typeTerms} and {@code oracleTerms} form one any-of text clause: a card matches when
 * its type line contains any type term or its rules text contains any oracle term.</p>
 *
 * @param format format the card must be legal in, or null
 * @param colorIdentity colours the card must fit within, or null for no colour constraint
 * @param minManaValue inclusive lower bound, or null
 * @param maxManaValue inclusive upper bound, or null
 * @param oracleTerms rules-text phrases
 * @param typeTerms type-line words
 * @param rarities accepted rarities, empty for any
 * @param excludeBasicLands whether basic lands are filtered out
 */
@Builder(toBuilder = true)
public record CatalogQuery(
    String format,
    List<String> colorIdentity,
    Double minManaValue,
    Double maxManaValue,
    List<String> oracleTerms,
    List<String> typeTerms,
    Set<Rarity> rarities,
    boolean excludeBasicLands
) {
    public CatalogQuery {
        format = format == null || format.isBlank() ? null : format.trim().toLowerCase(Locale.ROOT);
        colorIdentity = colorIdentity == null ? null : ManaColors.normalize(colorIdentity);
        oracleTerms = lowerCased(oracleTerms);
        typeTerms = lowerCased(typeTerms);
        rarities = rarities == null || rarities.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(rarities));
        if (minManaValue != null && maxManaValue != null && minManaValue > maxManaValue) {
            throw new IllegalArgumentException("Mana value bounds are inverted: " + minManaValue + " > " + maxManaValue);
        }
    }

    /**
     * Renders the query in Scryfall search syntax, e.g.
     * {@code legal:modern id<=UR mv>=1 mv<=3 (o:"haste" OR o:"trample") -t:basic (r:r OR r:m)}.
     */
    public String toScryfallQuery() {
        List<String> clauses = new ArrayList<>();
        if (format != null) {
            clauses.add("legal:" + format);
        }
        if (colorIdentity != null) {
            clauses.add(colorIdentity.isEmpty() ? "id:c" : "id<=" + ManaColors.symbols(colorIdentity));
        }
        if (minManaValue != null && minManaValue.equals(maxManaValue)) {
            clauses.add("mv=" + formatNumber(minManaValue));
        } else {
            if (minManaValue != null) {
                clauses.add("mv>=" + formatNumber(minManaValue));
            }
            if (maxManaValue != null) {
                clauses.add("mv<=" + formatNumber(maxManaValue));
            }
        }
        List<String> textClauses = new ArrayList<>();
        typeTerms.forEach(term -> textClauses.add(term.contains(" ") ? "t:\"" + term + "\"" : "t:" + term));
        oracleTerms.forEach(term -> textClauses.add("o:\"" + term + "\""));
        if (!textClauses.isEmpty()) {
            clauses.add(group(textClauses));
        }
        if (excludeBasicLands) {
            clauses.add("-t:basic");
        }
        if (!rarities.isEmpty()) {
            clauses.add(group(EnumSet.copyOf(rarities).stream()
                .map(rarity -> "r:" + rarity.getValue().charAt(0))
                .toList()));
        }
        return String.join(" ", clauses);
    }

    /**
     * Evaluates the query against a card. A card without legality data counts as legal.
     */
    public boolean matches(Card card) {
        if (card == null) {
            return false;
        }
        if (format != null && !card.isLegalIn(format)) {
            return false;
        }
        if (colorIdentity != null && !ManaColors.fitsIdentity(card.colors(), colorIdentity)) {
            return false;
        }
        if (minManaValue != null && card.manaValue() < minManaValue) {
            return false;
        }
        if (maxManaValue != null && card.manaValue() > maxManaValue) {
            return false;
        }
        if (excludeBasicLands && card.isBasicLand()) {
            return false;
        }
        if (!rarities.isEmpty() && !Rarity.parse(card.rarity()).map(rarities::contains).orElse(false)) {
            return false;
        }
        return matchesText(card);
    }

    private boolean matchesText(Card card) {
        if (typeTerms.isEmpty() && oracleTerms.isEmpty()) {
            return true;
        }
        String typeLine = card.typeLine().toLowerCase(Locale.ROOT);
        String oracle = card.oracleText().toLowerCase(Locale.ROOT);
        return typeTerms.stream().anyMatch(typeLine::contains)
            || oracleTerms.stream().anyMatch(oracle::contains);
    }

    private static String group(List<String> alternatives) {
        if (alternatives.size() == 1) {
            return alternatives.get(0);
        }
        return alternatives.stream().collect(Collectors.joining(" OR ", "(", ")"));
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }

    private static List<String> lowerCased(List<String> terms) {
        if (terms == null) {
            return List.of();
        }
        return terms.stream()
            .filter(term -> term != null && !term.isBlank())
            .map(term -> term.trim().toLowerCase(Locale.ROOT))
            .distinct()
            .toList();
    }
}
