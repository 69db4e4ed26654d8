package net.deckadvisor.controller.dto;

/**
 * Owned copies of one card.
 */
public record CollectionCardRequest(String name, Integer regular, Integer foil) {
}
