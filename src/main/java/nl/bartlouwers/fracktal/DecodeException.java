package nl.bartlouwers.fracktal;

/**
 * Thrown when a codex cannot be decoded: a reference token has no dictionary
 * entry, or the chunk table and symbol stream disagree. The codex must be
 * treated as corrupted; no partial output is produced.
 */
public class DecodeException extends FracktalException {

    private static final long serialVersionUID = 1L;

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
