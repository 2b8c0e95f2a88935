package nl.bartlouwers.fracktal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds repeated runs in a symbol stream and rewrites them as reference tokens
 * plus a dictionary.
 * <p>
 * Candidate lengths are tried longest first. Occurrence search for every
 * admitted length runs in parallel over the read-only stream; acceptance is a
 * single sequential pass in a fixed order, so identical streams always produce
 * identical dictionaries and rewritten streams.
 */
public class PatternCompressor {

    private static final Logger logger = LoggerFactory.getLogger(PatternCompressor.class);

    /** Prefix of a reference token's textual form. */
    public static final String REFERENCE_PREFIX = "P_";

    // longest first, then best estimated savings, then earliest first occurrence
    private static final Comparator<Candidate> ACCEPTANCE_ORDER =
        Comparator.comparingInt(Candidate::length).reversed()
            .thenComparing(Comparator.comparingInt(Candidate::estimatedSavings).reversed())
            .thenComparingInt(Candidate::firstPosition);

    private final int minPatternLength;
    private final int maxPatternLength;
    private final int minOccurrences;
    private final int minSavingsThreshold;
    private final int maxPatterns;
    private final long searchBudget;

    public PatternCompressor(FracktalConfig config) {
        this.minPatternLength = config.minPatternLength();
        this.maxPatternLength = config.maxPatternLength();
        this.minOccurrences = config.minOccurrences();
        this.minSavingsThreshold = config.minSavingsThreshold();
        this.maxPatterns = config.maxPatterns();
        this.searchBudget = config.searchBudget();
    }

    /**
     * Result of {@link #compress(List)}.
     *
     * @param rewritten Symbols and reference tokens
     * @param dictionary Patterns by token, in acceptance order
     * @param stats Counts and ratios
     */
    public record Compression(List<String> rewritten, Map<String, Pattern> dictionary, CompressionStats stats) {

        public Compression {
            rewritten = List.copyOf(rewritten);
            dictionary = Collections.unmodifiableMap(new LinkedHashMap<>(dictionary));
        }
    }

    /** A repeated run found during search, before acceptance. */
    private record Candidate(List<String> symbols, int[] positions) {

        int length() {
            return symbols.size();
        }

        int firstPosition() {
            return positions[0];
        }

        int estimatedSavings() {
            return savings(positions.length, symbols.size());
        }
    }

    /**
     * Substitute repeated runs in {@code symbols}. The rewritten stream is
     * never longer than the input.
     *
     * @param symbols Symbol stream to compress
     * @return Rewritten stream, dictionary and statistics
     */
    public Compression compress(List<String> symbols) {
        if (symbols == null) {
            throw new IllegalArgumentException("Symbols cannot be null");
        }
        int n = symbols.size();
        List<Integer> lengths = admittedLengths(n);
        if (lengths.isEmpty() || maxPatterns == 0) {
            return new Compression(symbols, Map.of(), CompressionStats.identity(n));
        }

        List<Candidate> candidates = lengths.parallelStream()
            .flatMap(length -> findCandidates(symbols, length).stream())
            .sorted(ACCEPTANCE_ORDER)
            .collect(Collectors.toList());

        boolean[] consumed = new boolean[n];
        String[] tokenAt = new String[n];
        Map<String, Pattern> dictionary = new LinkedHashMap<>();

        for (Candidate candidate : candidates) {
            if (dictionary.size() >= maxPatterns) {
                break;
            }
            int length = candidate.length();
            List<Integer> free = new ArrayList<>();
            for (int p : candidate.positions()) {
                if (isFree(consumed, p, length)) {
                    free.add(p);
                }
            }
            if (free.size() < minOccurrences || !worthIt(savings(free.size(), length))) {
                continue;
            }

            // free occurrences may overlap each other; substitute left to right
            List<Integer> taken = new ArrayList<>();
            int next = 0;
            for (int p : free) {
                if (p >= next) {
                    taken.add(p);
                    next = p + length;
                }
            }

            String token = referenceToken(dictionary.size());
            for (int p : taken) {
                for (int i = p; i < p + length; i++) {
                    consumed[i] = true;
                }
                tokenAt[p] = token;
            }
            dictionary.put(token, new Pattern(token, candidate.symbols(), taken));
        }

        List<String> rewritten = new ArrayList<>(n);
        int dictionarySymbols = 0;
        for (int i = 0; i < n; ) {
            String token = tokenAt[i];
            if (token == null) {
                rewritten.add(symbols.get(i));
                i++;
            } else {
                rewritten.add(token);
                i += dictionary.get(token).length();
            }
        }
        for (Pattern pattern : dictionary.values()) {
            dictionarySymbols += pattern.length();
        }

        CompressionStats stats = new CompressionStats(n, rewritten.size(), dictionarySymbols, dictionary.size());
        logger.debug("Compressed {} symbols to {} tokens with {} patterns from {} candidates",
            n, rewritten.size(), dictionary.size(), candidates.size());
        return new Compression(rewritten, dictionary, stats);
    }

    /**
     * Expand every reference token using the dictionary. Patterns hold only
     * plain symbols, so one pass suffices.
     *
     * @throws DecodeException if a token is unknown or malformed
     */
    public static List<String> expand(List<String> rewritten, Map<String, Pattern> dictionary) {
        List<String> expanded = new ArrayList<>(rewritten.size());
        for (String token : rewritten) {
            if (isReference(token)) {
                Pattern pattern = dictionary.get(token);
                if (pattern == null) {
                    throw new DecodeException("Reference " + token + " has no dictionary entry");
                }
                expanded.addAll(pattern.symbols());
            } else if (SymbolExtractor.isSymbol(token)) {
                expanded.add(token);
            } else {
                throw new DecodeException("Unrecognized token in rewritten stream: " + token);
            }
        }
        return expanded;
    }

    public static boolean isReference(String token) {
        return token.startsWith(REFERENCE_PREFIX);
    }

    static String referenceToken(int index) {
        return String.format(Locale.ROOT, "%s%03d", REFERENCE_PREFIX, index);
    }

    /**
     * Candidate lengths, longest first, whose scanning cost fits the search budget.
     */
    List<Integer> admittedLengths(int n) {
        // a run of length L can start at most n - L + 1 times
        int longest = Math.min(maxPatternLength, n - minOccurrences + 1);
        List<Integer> lengths = new ArrayList<>();
        long spent = 0;
        for (int length = longest; length >= minPatternLength; length--) {
            long cost = (long) (n - length + 1) * length;
            if (spent + cost > searchBudget) {
                logger.debug("Skipping pattern length {}: search budget {} exhausted", length, searchBudget);
                continue;
            }
            spent += cost;
            lengths.add(length);
        }
        return lengths;
    }

    private List<Candidate> findCandidates(List<String> symbols, int length) {
        Map<List<String>, List<Integer>> positions = new LinkedHashMap<>();
        for (int i = 0; i + length <= symbols.size(); i++) {
            positions.computeIfAbsent(symbols.subList(i, i + length), k -> new ArrayList<>()).add(i);
        }
        List<Candidate> found = new ArrayList<>();
        for (Map.Entry<List<String>, List<Integer>> e : positions.entrySet()) {
            List<Integer> starts = e.getValue();
            if (starts.size() < minOccurrences || !worthIt(savings(starts.size(), length))) {
                continue;
            }
            int[] array = starts.stream().mapToInt(Integer::intValue).toArray();
            found.add(new Candidate(List.copyOf(e.getKey()), array));
        }
        return found;
    }

    private boolean worthIt(int savings) {
        return savings > 0 && savings > minSavingsThreshold;
    }

    // one dictionary entry of `length` symbols plus one reference token per occurrence
    private static int savings(int occurrences, int length) {
        return occurrences * length - length - occurrences;
    }

    private static boolean isFree(boolean[] consumed, int start, int length) {
        for (int i = start; i < start + length; i++) {
            if (consumed[i]) {
                return false;
            }
        }
        return true;
    }
}
