package nl.bartlouwers.fracktal;

/**
 * Base class for failures reported by the codec.
 */
public class FracktalException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FracktalException(String message) {
        super(message);
    }

    public FracktalException(String message, Throwable cause) {
        super(message, cause);
    }
}
