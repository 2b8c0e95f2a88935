package nl.bartlouwers.fracktal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the descriptive link structure of a symbol stream. The result plays no
 * part in decoding.
 */
public class OntologyLinker {

    /**
     * Link every symbol to the index before it and group indices per symbol id.
     *
     * @param symbols Symbol stream
     * @return Read-only ontology
     */
    public Ontology link(List<String> symbols) {
        if (symbols == null) {
            throw new IllegalArgumentException("Symbols cannot be null");
        }
        List<Ontology.Link> links = new ArrayList<>(symbols.size());
        Map<String, List<Integer>> occurrences = new LinkedHashMap<>();
        for (int i = 0; i < symbols.size(); i++) {
            String symbol = symbols.get(i);
            links.add(new Ontology.Link(symbol, i - 1));
            occurrences.computeIfAbsent(symbol, k -> new ArrayList<>()).add(i);
        }
        return new Ontology(links, occurrences);
    }
}
