package net.deckadvisor.service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import net.deckadvisor.model.Deck;

/**
 * Per-session progress of incremental recommendation retrieval.
 *
 * <p>Callers own the instance but only {@link BatchController} mutates it. A state is bound to the
 * fingerprint of one deck; using it with another deck is rejected until it is reset.</p>
 */
public class BatchState {

    private final Set<String> returnedNames = new LinkedHashSet<>();
    private BatchStatus status = BatchStatus.ACTIVE;
    private int requestedSoFar;
    private String deckFingerprint;

    public BatchState() {
    }

    public static BatchState forDeck(Deck deck) {
        BatchState state = new BatchState();
        state.deckFingerprint = deck.fingerprint();
        return state;
    }

    public synchronized BatchStatus getStatus() {
        return status;
    }

    public synchronized boolean isExhausted() {
        return status == BatchStatus.EXHAUSTED;
    }

    public synchronized int getRequestedSoFar() {
        return requestedSoFar;
    }

    public synchronized int getReturnedCount() {
        return returnedNames.size();
    }

    /**
     * Lower-cased names handed out so far, in the order they were returned.
     */
    public synchronized Set<String> getReturnedNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(returnedNames));
    }

    public synchronized String getDeckFingerprint() {
        return deckFingerprint;
    }

    synchronized boolean hasReturned(String name) {
        return returnedNames.contains(name.toLowerCase(Locale.ROOT));
    }

    synchronized void recordReturned(String name) {
        returnedNames.add(name.toLowerCase(Locale.ROOT));
    }

    synchronized void addRequested(int count) {
        requestedSoFar += count;
    }

    synchronized void markExhausted() {
        status = BatchStatus.EXHAUSTED;
    }

    synchronized void bind(String fingerprint) {
        deckFingerprint = fingerprint;
    }

    synchronized void reset(String fingerprint) {
        returnedNames.clear();
        requestedSoFar = 0;
        status = BatchStatus.ACTIVE;
        deckFingerprint = fingerprint;
    }
}
