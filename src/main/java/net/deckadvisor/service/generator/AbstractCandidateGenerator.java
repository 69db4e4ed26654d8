package net.deckadvisor.service.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import net.deckadvisor.catalog.CatalogClient;
import net.deckadvisor.catalog.CatalogQuery;
import net.deckadvisor.catalog.ResilientCatalogClient;
import net.deckadvisor.config.RecommendationProperties;
import net.deckadvisor.model.Card;
import net.deckadvisor.model.Recommendation;
import net.deckadvisor.service.KeywordExtractor;
import net.deckadvisor.util.ManaColors;

/**
 * Catalog access, filtering and recommendation scaffolding shared by the generators.
 */
public abstract class AbstractCandidateGenerator implements CandidateGenerator {

    protected final CatalogClient catalogClient;
    protected final KeywordExtractor keywordExtractor;
    protected final RecommendationProperties properties;

    protected AbstractCandidateGenerator(CatalogClient catalogClient,
                                         KeywordExtractor keywordExtractor,
                                         RecommendationProperties properties) {
        this.catalogClient = ResilientCatalogClient.wrap(catalogClient);
        this.keywordExtractor = keywordExtractor;
        this.properties = properties;
    }

    @Override
    public final List<Recommendation> generate(GenerationContext context) {
        if (context == null || context.profile() == null || context.profile().isEmpty()) {
            return List.of();
        }
        return doGenerate(context);
    }

    protected abstract List<Recommendation> doGenerate(GenerationContext context);

    /**
     * Scales a base limit up for requests larger than the reference count.
     */
    protected int scaledLimit(int baseLimit, GenerationContext context) {
        double factor = Math.max(1d, (double) context.targetCount() / properties.getReferenceCount());
        return (int) Math.ceil(baseLimit * factor);
    }

    /**
     * Searches the catalog and keeps cards that are not in the deck, not yet seen by this
     * generator and within the deck's colours.
     *
     * @param seen lower-cased names already used by this generator; updated with accepted cards
     */
    protected List<Card> findCandidates(CatalogQuery query, int limit, GenerationContext context, Set<String> seen) {
        List<Card> accepted = new ArrayList<>();
        for (Card card : catalogClient.search(query, limit * properties.getSearchMultiplier())) {
            if (context.isInDeck(card.name())
                    || !ManaColors.fitsIdentity(card.colors(), context.deckColors())
                    || !seen.add(card.name().toLowerCase(Locale.ROOT))) {
                continue;
            }
            accepted.add(card);
        }
        return accepted;
    }

    /**
     * Base query: format legality, deck colours, basic lands excluded.
     */
    protected CatalogQuery.CatalogQueryBuilder baseQuery(GenerationContext context) {
        return CatalogQuery.builder()
            .format(context.format())
            .colorIdentity(context.deckColors())
            .excludeBasicLands(true);
    }

    /**
     * Copies catalog fields onto a recommendation builder. Scores and reasons are left to the caller.
     */
    protected Recommendation.RecommendationBuilder recommendationFor(Card card) {
        return Recommendation.builder()
            .name(card.name())
            .manaCost(card.manaCost())
            .typeLine(card.typeLine())
            .rarity(card.rarity())
            .manaValue(card.manaValue())
            .legalities(card.legalities())
            .keywords(keywordExtractor.extract(card.oracleText()))
            .oracleText(card.oracleText())
            .powerToughness(card.powerToughness())
            .source(kind());
    }

    protected static String formatManaValue(double manaValue) {
        return manaValue == Math.rint(manaValue) ? Long.toString((long) manaValue) : Double.toString(manaValue);
    }
}
