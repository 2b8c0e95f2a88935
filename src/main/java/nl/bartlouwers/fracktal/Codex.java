package nl.bartlouwers.fracktal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents the result of FRACKTAL encoding: everything needed to reconstruct
 * the input and to check its fingerprint. Instances are immutable.
 * <p>
 * Chunks, not symbols, are authoritative for reconstruction. Consistency
 * between the parts is checked when decoding, not here, so that a damaged
 * codex can still be represented and rejected with a {@link DecodeException}.
 *
 * @param chunks Overlapping two-unit windows of the input, in order
 * @param symbols Symbol per chunk, before pattern substitution
 * @param rewritten Symbol stream after pattern substitution
 * @param dictionary Patterns by reference token
 * @param fingerprint Content fingerprint over {@code symbols}
 * @param stats Pattern substitution statistics
 * @param residue The input itself when it is shorter than one chunk, otherwise empty
 * @param symbolRange Symbol range the codex was encoded with
 * @param hashDepth Hash depth the fingerprint was computed with
 */
public record Codex(
    List<String> chunks,
    List<String> symbols,
    List<String> rewritten,
    Map<String, Pattern> dictionary,
    String fingerprint,
    CompressionStats stats,
    String residue,
    int symbolRange,
    int hashDepth
) {

    public Codex {
        if (chunks == null || symbols == null || rewritten == null || dictionary == null
                || fingerprint == null || stats == null || residue == null) {
            throw new IllegalArgumentException("Codex fields cannot be null");
        }
        chunks = List.copyOf(chunks);
        symbols = List.copyOf(symbols);
        rewritten = List.copyOf(rewritten);
        dictionary = Collections.unmodifiableMap(new LinkedHashMap<>(dictionary));
    }

    /** True when the input was shorter than one chunk. */
    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public int symbolCount() {
        return symbols.size();
    }

    /** Length, in units, of the encoded input. */
    public int inputLength() {
        return chunks.isEmpty() ? residue.length() : chunks.size() + FracktalConfig.CHUNK_WIDTH - 1;
    }
}
