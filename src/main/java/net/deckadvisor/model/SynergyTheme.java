package net.deckadvisor.model;

import java.util.List;

/**
 * A tribal or mechanical pattern detected by matching terms in type lines and rules text.
 *
 * @param name theme label
 * @param kind tribal themes match creature types, mechanic themes match rules text
 * @param terms lower-case phrases; the first is the canonical search term
 */
public record SynergyTheme(String name, Kind kind, List<String> terms) {

    public enum Kind {
        TRIBAL,
        MECHANIC
    }

    public SynergyTheme {
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("Synergy theme " + name + " needs at least one term");
        }
        terms = List.copyOf(terms);
    }

    public static SynergyTheme tribal(String name, String... terms) {
        return new SynergyTheme(name, Kind.TRIBAL, List.of(terms));
    }

    public static SynergyTheme mechanic(String name, String... terms) {
        return new SynergyTheme(name, Kind.MECHANIC, List.of(terms));
    }
}
