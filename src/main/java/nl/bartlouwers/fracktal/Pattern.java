package nl.bartlouwers.fracktal;

import java.util.List;

/**
 * A dictionary entry: a literal run of symbols registered under a reference token.
 *
 * @param token Reference token, e.g. {@code P_000}
 * @param symbols The symbols the token stands for
 * @param positions Start indices in the original symbol stream where the token was substituted
 */
public record Pattern(String token, List<String> symbols, List<Integer> positions) {

    public Pattern {
        if (token == null || symbols == null || positions == null) {
            throw new IllegalArgumentException("Pattern fields cannot be null");
        }
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("Pattern " + token + " has no symbols");
        }
        symbols = List.copyOf(symbols);
        positions = List.copyOf(positions);
    }

    public int length() {
        return symbols.size();
    }

    /** Number of times the token appears in the rewritten stream. */
    public int occurrences() {
        return positions.size();
    }

    /** Stream tokens removed by substituting this pattern. */
    public int tokensSaved() {
        return occurrences() * (length() - 1);
    }

    /** Tokens saved net of the dictionary entry itself. May be negative. */
    public int netSavings() {
        return occurrences() * length() - length() - occurrences();
    }
}
