package net.deckadvisor.service.generator;

import java.util.List;
import net.deckadvisor.model.GeneratorKind;
import net.deckadvisor.model.Recommendation;

/**
 * One candidate generation strategy.
 *
 * <p>Implementations never suggest a card already in the deck, leave ownership unknown,
 * and return an empty list rather than raising when the catalog cannot answer.</p>
 */
public interface CandidateGenerator {

    GeneratorKind kind();

    List<Recommendation> generate(GenerationContext context);
}
