package net.deckadvisor.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Fixed keyword table shared by the deck analyzer and every candidate generator.
 *
 * <p>Each tag is detected by one or more whole-word phrases in rules text, case-insensitively.
 * Tags are returned in table order.</p>
 */
@Component
public class KeywordExtractor {

    private static final Map<String, List<String>> KEYWORD_PHRASES = buildTable();

    private static final Map<String, Pattern> KEYWORD_PATTERNS = compile(KEYWORD_PHRASES);

    private final Map<String, Pattern> termPatterns = new ConcurrentHashMap<>();

    private static Map<String, List<String>> buildTable() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("haste", List.of("haste"));
        table.put("flying", List.of("flying"));
        table.put("trample", List.of("trample"));
        table.put("lifelink", List.of("lifelink"));
        table.put("deathtouch", List.of("deathtouch"));
        table.put("vigilance", List.of("vigilance"));
        table.put("first strike", List.of("first strike"));
        table.put("double strike", List.of("double strike"));
        table.put("hexproof", List.of("hexproof"));
        table.put("ward", List.of("ward"));
        table.put("menace", List.of("menace"));
        table.put("prowess", List.of("prowess"));
        table.put("reach", List.of("reach"));
        table.put("indestructible", List.of("indestructible"));
        table.put("flash", List.of("flash"));
        table.put("flashback", List.of("flashback"));
        table.put("lifegain", List.of("gain life", "gains life", "you gain"));
        table.put("card draw", List.of("draw a card", "draws a card", "draw two cards", "draw three cards"));
        table.put("removal", List.of("destroy target", "exile target"));
        table.put("counter", List.of("counter target"));
        table.put("sacrifice", List.of("sacrifice"));
        table.put("graveyard", List.of("graveyard"));
        table.put("artifact", List.of("artifact", "artifacts"));
        table.put("enters", List.of("enters"));
        table.put("burn", List.of("damage to any target", "damage to target", "damage to each opponent"));
        table.put("board wipe", List.of("destroy all", "exile all"));
        table.put("tutor", List.of("search your library"));
        // Literal reminder wording only; ability shapes such as "{T}:" or "Whenever" are not inferred.
        table.put("activated ability", List.of("activated ability", "activated abilities"));
        table.put("triggered ability", List.of("triggered ability", "triggered abilities"));
        return table;
    }

    private static Map<String, Pattern> compile(Map<String, List<String>> table) {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        table.forEach((tag, phrases) -> patterns.put(tag, Pattern.compile(
            phrases.stream().map(Pattern::quote).collect(Collectors.joining("|", "\\b(?:", ")\\b")),
            Pattern.CASE_INSENSITIVE)));
        return patterns;
    }

    /**
     * Every tag the table knows, in table order.
     */
    public static List<String> knownTags() {
        return List.copyOf(KEYWORD_PHRASES.keySet());
    }

    /**
     * Tags present in the text, in table order. Empty for null or blank text.
     */
    public List<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> found = new ArrayList<>();
        KEYWORD_PATTERNS.forEach((tag, pattern) -> {
            if (pattern.matcher(text).find()) {
                found.add(tag);
            }
        });
        return found;
    }

    /**
     * Whether the text contains any of the terms at the start of a word, so {@code "elf"} also
     * finds {@code "Elf Warrior"} and {@code "artifact"} finds {@code "artifacts"}.
     */
    public boolean matchesAny(String text, List<String> terms) {
        if (text == null || text.isEmpty() || terms == null) {
            return false;
        }
        for (String term : terms) {
            Pattern pattern = termPatterns.computeIfAbsent(term,
                t -> Pattern.compile("\\b" + Pattern.quote(t), Pattern.CASE_INSENSITIVE));
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
