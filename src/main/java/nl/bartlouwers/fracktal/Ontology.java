package nl.bartlouwers.fracktal;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Positional links of a symbol stream plus the occurrence list of each distinct
 * symbol id.
 *
 * @param links One entry per stream position
 * @param occurrences Indices per symbol id, ids in order of first appearance
 */
public record Ontology(List<Link> links, Map<String, List<Integer>> occurrences) {

    /** No predecessor, used at index 0. */
    public static final int NONE = -1;

    /**
     * @param symbol Symbol at this position
     * @param predecessor Index of the previous position, or {@link #NONE}
     */
    public record Link(String symbol, int predecessor) {

        public boolean isRoot() {
            return predecessor == NONE;
        }
    }

    public Ontology {
        links = List.copyOf(links);
        Map<String, List<Integer>> copy = new LinkedHashMap<>();
        occurrences.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        occurrences = Collections.unmodifiableMap(copy);
    }

    public Set<String> distinctSymbols() {
        return occurrences.keySet();
    }

    /** Indices at which {@code symbol} occurs, empty if it never does. */
    public List<Integer> occurrences(String symbol) {
        return occurrences.getOrDefault(symbol, List.of());
    }

    /**
     * Jaccard index of the distinct symbol ids of two ontologies. Positions are
     * ignored. Two empty ontologies are identical.
     */
    public double similarity(Ontology other) {
        Set<String> mine = distinctSymbols();
        Set<String> theirs = other.distinctSymbols();
        if (mine.isEmpty() && theirs.isEmpty()) {
            return 1.0;
        }
        Set<String> union = new HashSet<>(mine);
        union.addAll(theirs);
        int shared = 0;
        for (String symbol : mine) {
            if (theirs.contains(symbol)) {
                shared++;
            }
        }
        return (double) shared / union.size();
    }
}
