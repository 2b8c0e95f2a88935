package nl.bartlouwers.fracktal;

/**
 * Thrown when the fingerprint recomputed from a decoded codex differs from the
 * one stored at encode time.
 */
public class IntegrityException extends FracktalException {

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String actual;

    public IntegrityException(String expected, String actual) {
        super("Fingerprint mismatch: stored " + expected + " but recomputed " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    /** Fingerprint stored in the codex. */
    public String expected() {
        return expected;
    }

    /** Fingerprint recomputed from the decoded symbol stream. */
    public String actual() {
        return actual;
    }
}
