package net.deckadvisor.exception;

/**
 * A batch state was presented for a deck other than the one it was bound to.
 * RETRYABLE: No (caller must reset the state for the new deck)
 */
public class InvalidBatchStateException extends RuntimeException {
    private final String expectedFingerprint;
    private final String actualFingerprint;

    public InvalidBatchStateException(String expectedFingerprint, String actualFingerprint) {
        super("Batch state is bound to deck " + abbreviate(expectedFingerprint)
            + " but was used with deck " + abbreviate(actualFingerprint));
        this.expectedFingerprint = expectedFingerprint;
        this.actualFingerprint = actualFingerprint;
    }

    public String getExpectedFingerprint() {
        return expectedFingerprint;
    }

    public String getActualFingerprint() {
        return actualFingerprint;
    }

    private static String abbreviate(String fingerprint) {
        if (fingerprint == null) {
            return "<none>";
        }
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }
}
