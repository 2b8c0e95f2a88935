package nl.bartlouwers.fracktal;

/**
 * Outcome of pattern substitution over one symbol stream.
 *
 * @param originalSymbolCount Symbols before substitution
 * @param rewrittenTokenCount Tokens after substitution
 * @param dictionarySymbolCount Symbols held by all dictionary entries together
 * @param patternCount Number of dictionary entries
 */
public record CompressionStats(
    int originalSymbolCount,
    int rewrittenTokenCount,
    int dictionarySymbolCount,
    int patternCount
) {

    public CompressionStats {
        if (rewrittenTokenCount > originalSymbolCount) {
            throw new IllegalArgumentException("Rewritten stream (" + rewrittenTokenCount
                + ") longer than original (" + originalSymbolCount + ")");
        }
    }

    static CompressionStats identity(int symbolCount) {
        return new CompressionStats(symbolCount, symbolCount, 0, 0);
    }

    public int symbolsSaved() {
        return originalSymbolCount - rewrittenTokenCount;
    }

    /** Original symbols per rewritten token; 1.0 when nothing was substituted. */
    public double overallCompressionRatio() {
        if (rewrittenTokenCount == 0) {
            return 1.0;
        }
        return (double) originalSymbolCount / rewrittenTokenCount;
    }

    /** Like {@link #overallCompressionRatio()} but charging the dictionary as well. */
    public double storageRatio() {
        int stored = rewrittenTokenCount + dictionarySymbolCount;
        if (stored == 0) {
            return 1.0;
        }
        return (double) originalSymbolCount / stored;
    }
}
