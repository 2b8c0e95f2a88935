package nl.bartlouwers.fracktal;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Derives the order-sensitive content fingerprint of a symbol stream.
 * <p>
 * Each symbol is collapsed by hashing its textual form a fixed number of times;
 * the fingerprint is the SHA-256 of all symbol ids followed by all collapsed
 * hashes, in stream order. The fingerprint carries no reconstruction
 * information and is only ever compared, never used to repair.
 */
public class FractalFingerprinter {

    private final int depth;

    public FractalFingerprinter(int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be positive: " + depth);
        }
        this.depth = depth;
    }

    /**
     * Hash a symbol's textual form {@code depth} times.
     *
     * @param symbol Symbol such as {@code S_0042}
     * @param depth Number of rounds, at least 1
     * @return 64 character hex SHA-256
     */
    public static String collapse(String symbol, int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be positive: " + depth);
        }
        String h = symbol;
        for (int i = 0; i < depth; i++) {
            h = Digests.sha256Hex(h);
        }
        return h;
    }

    public String collapse(String symbol) {
        return collapse(symbol, depth);
    }

    /**
     * Collapsed hash of every symbol, in order. Symbols are independent, so the
     * work is spread over the common pool.
     */
    public List<String> collapseAll(List<String> symbols) {
        return symbols.parallelStream()
            .map(this::collapse)
            .collect(Collectors.toList());
    }

    /**
     * Fingerprint over symbols and their collapsed hashes.
     *
     * @param symbols Symbol stream
     * @param collapsed Collapsed hash per symbol, same order
     * @return 64 character hex SHA-256
     */
    public static String fingerprint(List<String> symbols, List<String> collapsed) {
        if (symbols.size() != collapsed.size()) {
            throw new IllegalArgumentException(
                "Got " + symbols.size() + " symbols but " + collapsed.size() + " hashes");
        }
        StringBuilder combined = new StringBuilder(symbols.size() * 70);
        symbols.forEach(combined::append);
        collapsed.forEach(combined::append);
        return Digests.sha256Hex(combined.toString());
    }

    /** Collapse then fingerprint. */
    public String fingerprint(List<String> symbols) {
        return fingerprint(symbols, collapseAll(symbols));
    }

    public int depth() {
        return depth;
    }
}
