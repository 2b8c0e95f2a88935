package nl.bartlouwers.fracktal;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits input into overlapping two-unit chunks and derives a bounded symbol id
 * per chunk. Distinct chunks may share a symbol; nothing downstream relies on
 * symbols being unique.
 */
public class SymbolExtractor {

    /** Prefix of a symbol's textual form. */
    public static final String SYMBOL_PREFIX = "S_";

    private final int symbolRange;

    public SymbolExtractor(int symbolRange) {
        if (symbolRange < 1) {
            throw new IllegalArgumentException("symbolRange must be positive: " + symbolRange);
        }
        this.symbolRange = symbolRange;
    }

    /**
     * Chunks and symbols of an input, index aligned.
     *
     * @param chunks Chunk {@code i} is units {@code [i, i+1]} of the input
     * @param symbols Symbol {@code i} is derived from chunk {@code i}
     */
    public record Extraction(List<String> chunks, List<String> symbols) {

        public Extraction {
            chunks = List.copyOf(chunks);
            symbols = List.copyOf(symbols);
        }
    }

    /**
     * Slide the chunk window over the input. Input shorter than the window
     * yields empty sequences.
     *
     * @param input Text to split
     * @return Chunks and their symbols
     */
    public Extraction extract(String input) {
        if (input == null) {
            throw new IllegalArgumentException("Input cannot be null");
        }
        int count = Math.max(input.length() - FracktalConfig.CHUNK_WIDTH + 1, 0);
        List<String> chunks = new ArrayList<>(count);
        List<String> symbols = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String chunk = input.substring(i, i + FracktalConfig.CHUNK_WIDTH);
            chunks.add(chunk);
            symbols.add(symbolOf(chunk));
        }
        return new Extraction(chunks, symbols);
    }

    /**
     * Symbol for a single chunk, e.g. {@code S_0042}.
     */
    public String symbolOf(String chunk) {
        return format(symbolId(chunk));
    }

    /**
     * Numeric symbol id of a chunk: the leading 64 bits of SHA-256 over the
     * chunk's UTF-16BE bytes, unsigned, modulo the symbol range.
     */
    public int symbolId(String chunk) {
        byte[] digest = Digests.sha256(chunk.getBytes(StandardCharsets.UTF_16BE));
        long high = 0;
        for (int i = 0; i < Long.BYTES; i++) {
            high = (high << 8) | (digest[i] & 0xFF);
        }
        return (int) Long.remainderUnsigned(high, symbolRange);
    }

    public int symbolRange() {
        return symbolRange;
    }

    static String format(int id) {
        return String.format(Locale.ROOT, "%s%04d", SYMBOL_PREFIX, id);
    }

    static boolean isSymbol(String token) {
        return token.startsWith(SYMBOL_PREFIX);
    }
}
