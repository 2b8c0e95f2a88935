package nl.bartlouwers.fracktal;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

class SymbolExtractorTest {

    private final SymbolExtractor extractor = new SymbolExtractor(FracktalConfig.DEFAULT_SYMBOL_RANGE);

    @Test
    void testChunksOverlapByOneUnit() {
        SymbolExtractor.Extraction extraction = extractor.extract("abcd");

        assertEquals(List.of("ab", "bc", "cd"), extraction.chunks());
        assertEquals(3, extraction.symbols().size());
    }

    @Test
    void testShortInputYieldsNothing() {
        assertTrue(extractor.extract("").chunks().isEmpty());
        assertTrue(extractor.extract("").symbols().isEmpty());
        assertTrue(extractor.extract("a").chunks().isEmpty());
        assertTrue(extractor.extract("a").symbols().isEmpty());
    }

    @Test
    void testKnownSymbols() {
        assertEquals("S_1729", extractor.symbolOf("ab"));
        assertEquals("S_8025", extractor.symbolOf("ba"));
        assertEquals(List.of("S_7127", "S_5028", "S_7421", "S_2541"), extractor.extract("hello").symbols());
    }

    @Test
    void testSameChunkSameSymbol() {
        List<String> symbols = extractor.extract("abab").symbols();

        assertEquals(symbols.get(0), symbols.get(2));
    }

    @Test
    void testSymbolsStayInRange() {
        SymbolExtractor small = new SymbolExtractor(7);
        for (String chunk : List.of("ab", "zz", "\u0000\u0000", "\uFFFF\uFFFF", "世界")) {
            int id = small.symbolId(chunk);
            assertTrue(id >= 0 && id < 7, chunk + " -> " + id);
        }
    }

    @Test
    void testDistinctChunksMayCollide() {
        assertEquals(extractor.symbolOf("bl"), extractor.symbolOf("eb"));
        assertEquals("S_7330", extractor.symbolOf("bl"));
    }

    @Test
    void testSymbolFormat() {
        assertEquals("S_0000", SymbolExtractor.format(0));
        assertEquals("S_0042", SymbolExtractor.format(42));
        assertEquals("S_12345", SymbolExtractor.format(12345));
    }

    @Test
    void testInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> new SymbolExtractor(0));
        assertThrows(IllegalArgumentException.class, () -> extractor.extract(null));
    }
}
