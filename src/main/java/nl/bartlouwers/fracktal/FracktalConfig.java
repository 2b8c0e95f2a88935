package nl.bartlouwers.fracktal;

import java.util.Properties;

/**
 * Codec parameters. Pure values: nothing here reads the environment.
 *
 * @param symbolRange Size of the symbol id space; chunk hashes are reduced modulo this value
 * @param hashDepth Number of SHA-256 rounds applied to each symbol for the fingerprint
 * @param minPatternLength Shortest symbol sub-sequence eligible as a pattern
 * @param minOccurrences Fewest occurrences a pattern needs to be considered
 * @param minSavingsThreshold Estimated savings a pattern must exceed to be accepted
 * @param maxPatternLength Longest symbol sub-sequence eligible as a pattern
 * @param maxPatterns Upper bound on dictionary entries
 * @param searchBudget Upper bound on window-symbol visits spent searching for patterns
 */
public record FracktalConfig(
    int symbolRange,
    int hashDepth,
    int minPatternLength,
    int minOccurrences,
    int minSavingsThreshold,
    int maxPatternLength,
    int maxPatterns,
    long searchBudget
) {

    /** Width of every chunk, in units. Not configurable. */
    public static final int CHUNK_WIDTH = 2;

    public static final int DEFAULT_SYMBOL_RANGE = 10_000;
    public static final int DEFAULT_HASH_DEPTH = 4;
    public static final int DEFAULT_MIN_PATTERN_LENGTH = 4;
    public static final int DEFAULT_MIN_OCCURRENCES = 3;
    public static final int DEFAULT_MIN_SAVINGS_THRESHOLD = 0;
    public static final int DEFAULT_MAX_PATTERN_LENGTH = 20;
    public static final int DEFAULT_MAX_PATTERNS = 10;
    public static final long DEFAULT_SEARCH_BUDGET = 5_000_000L;

    private static final String PREFIX = "fracktal.";

    public FracktalConfig {
        if (symbolRange < 1) {
            throw new IllegalArgumentException("symbolRange must be positive: " + symbolRange);
        }
        if (hashDepth < 1) {
            throw new IllegalArgumentException("hashDepth must be positive: " + hashDepth);
        }
        if (minPatternLength < 2) {
            throw new IllegalArgumentException("minPatternLength must be at least 2: " + minPatternLength);
        }
        if (minOccurrences < 2) {
            throw new IllegalArgumentException("minOccurrences must be at least 2: " + minOccurrences);
        }
        if (minSavingsThreshold < 0) {
            throw new IllegalArgumentException("minSavingsThreshold cannot be negative: " + minSavingsThreshold);
        }
        if (maxPatternLength < minPatternLength) {
            throw new IllegalArgumentException(
                "maxPatternLength (" + maxPatternLength + ") < minPatternLength (" + minPatternLength + ")");
        }
        if (maxPatterns < 0) {
            throw new IllegalArgumentException("maxPatterns cannot be negative: " + maxPatterns);
        }
        if (searchBudget < 1) {
            throw new IllegalArgumentException("searchBudget must be positive: " + searchBudget);
        }
    }

    public static FracktalConfig defaults() {
        return new FracktalConfig(
            DEFAULT_SYMBOL_RANGE,
            DEFAULT_HASH_DEPTH,
            DEFAULT_MIN_PATTERN_LENGTH,
            DEFAULT_MIN_OCCURRENCES,
            DEFAULT_MIN_SAVINGS_THRESHOLD,
            DEFAULT_MAX_PATTERN_LENGTH,
            DEFAULT_MAX_PATTERNS,
            DEFAULT_SEARCH_BUDGET);
    }

    /**
     * Read a configuration from {@code fracktal.*} keys. Missing keys take their defaults.
     *
     * @param props Properties to read, e.g. loaded by the caller from a file
     * @return The configuration
     * @throws IllegalArgumentException if a value is not a number or out of range
     */
    public static FracktalConfig fromProperties(Properties props) {
        if (props == null) {
            throw new IllegalArgumentException("Properties cannot be null");
        }
        return new FracktalConfig(
            intValue(props, "symbolRange", DEFAULT_SYMBOL_RANGE),
            intValue(props, "hashDepth", DEFAULT_HASH_DEPTH),
            intValue(props, "minPatternLength", DEFAULT_MIN_PATTERN_LENGTH),
            intValue(props, "minOccurrences", DEFAULT_MIN_OCCURRENCES),
            intValue(props, "minSavingsThreshold", DEFAULT_MIN_SAVINGS_THRESHOLD),
            intValue(props, "maxPatternLength", DEFAULT_MAX_PATTERN_LENGTH),
            intValue(props, "maxPatterns", DEFAULT_MAX_PATTERNS),
            longValue(props, "searchBudget", DEFAULT_SEARCH_BUDGET));
    }

    private static int intValue(Properties props, String name, int defaultValue) {
        long value = longValue(props, name, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(PREFIX + name + " out of int range: " + value);
        }
        return (int) value;
    }

    private static long longValue(Properties props, String name, long defaultValue) {
        String raw = props.getProperty(PREFIX + name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number for " + PREFIX + name + ": " + raw, e);
        }
    }

    public FracktalConfig withSymbolRange(int symbolRange) {
        return new FracktalConfig(symbolRange, hashDepth, minPatternLength, minOccurrences,
            minSavingsThreshold, maxPatternLength, maxPatterns, searchBudget);
    }

    public FracktalConfig withHashDepth(int hashDepth) {
        return new FracktalConfig(symbolRange, hashDepth, minPatternLength, minOccurrences,
            minSavingsThreshold, maxPatternLength, maxPatterns, searchBudget);
    }

    public FracktalConfig withMinPatternLength(int minPatternLength) {
        return new FracktalConfig(symbolRange, hashDepth, minPatternLength, minOccurrences,
            minSavingsThreshold, Math.max(maxPatternLength, minPatternLength), maxPatterns, searchBudget);
    }

    public FracktalConfig withMinOccurrences(int minOccurrences) {
        return new FracktalConfig(symbolRange, hashDepth, minPatternLength, minOccurrences,
            minSavingsThreshold, maxPatternLength, maxPatterns, searchBudget);
    }

    public FracktalConfig withMinSavingsThreshold(int minSavingsThreshold) {
        return new FracktalConfig(symbolRange, hashDepth, minPatternLength, minOccurrences,
            minSavingsThreshold, maxPatternLength, maxPatterns, searchBudget);
    }

    public FracktalConfig withMaxPatternLength(int maxPatternLength) {
        return new FracktalConfig(symbolRange, hashDepth, minPatternLength, minOccurrences,
            minSavingsThreshold, maxPatternLength, maxPatterns, searchBudget);
    }

    public FracktalConfig withMaxPatterns(int maxPatterns) {
        return new FracktalConfig(symbolRange, hashDepth, minPatternLength, minOccurrences,
            minSavingsThreshold, maxPatternLength, maxPatterns, searchBudget);
    }

    public FracktalConfig withSearchBudget(long searchBudget) {
        return new FracktalConfig(symbolRange, hashDepth, minPatternLength, minOccurrences,
            minSavingsThreshold, maxPatternLength, maxPatterns, searchBudget);
    }
}
