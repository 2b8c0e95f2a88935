package nl.bartlouwers.fracktal;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

class OntologyLinkerTest {

    private final OntologyLinker linker = new OntologyLinker();

    @Test
    void testLinksPointToPreviousIndex() {
        Ontology ontology = linker.link(List.of("S_0001", "S_0002", "S_0001"));

        assertEquals(3, ontology.links().size());
        assertTrue(ontology.links().get(0).isRoot());
        assertEquals(Ontology.NONE, ontology.links().get(0).predecessor());
        assertEquals(0, ontology.links().get(1).predecessor());
        assertEquals(1, ontology.links().get(2).predecessor());
        assertEquals("S_0001", ontology.links().get(2).symbol());
    }

    @Test
    void testOccurrencesGroupedPerSymbol() {
        Ontology ontology = linker.link(List.of("S_0003", "S_0001", "S_0003", "S_0003"));

        assertEquals(List.of("S_0003", "S_0001"), List.copyOf(ontology.distinctSymbols()));
        assertEquals(List.of(0, 2, 3), ontology.occurrences("S_0003"));
        assertEquals(List.of(1), ontology.occurrences("S_0001"));
        assertEquals(List.of(), ontology.occurrences("S_9999"));
    }

    @Test
    void testEmptyStream() {
        Ontology ontology = linker.link(List.of());

        assertTrue(ontology.links().isEmpty());
        assertEquals(1.0, ontology.similarity(linker.link(List.of())));
    }

    @Test
    void testSimilarityIgnoresPositions() {
        Ontology a = linker.link(List.of("S_0001", "S_0002", "S_0003"));
        Ontology b = linker.link(List.of("S_0003", "S_0001", "S_0002", "S_0002"));
        Ontology c = linker.link(List.of("S_0003", "S_0004"));

        assertEquals(1.0, a.similarity(b));
        assertEquals(0.25, a.similarity(c));
        assertEquals(c.similarity(a), a.similarity(c));
        assertEquals(0.0, a.similarity(linker.link(List.of())));
    }

    @Test
    void testSimilarityOfEncodedTexts() {
        Fracktal fracktal = new FracktalImpl();
        Ontology first = linker.link(fracktal.encode("the cat sat on the mat").symbols());
        Ontology same = linker.link(fracktal.encode("on the mat the cat sat").symbols());
        Ontology other = linker.link(fracktal.encode("1234567890").symbols());

        assertTrue(first.similarity(same) > first.similarity(other));
    }
}
