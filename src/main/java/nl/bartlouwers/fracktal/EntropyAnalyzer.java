package nl.bartlouwers.fracktal;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Measures how much character-level entropy survives each stage of encoding.
 */
public class EntropyAnalyzer {

    private final Fracktal fracktal;

    public EntropyAnalyzer(Fracktal fracktal) {
        if (fracktal == null) {
            throw new IllegalArgumentException("Fracktal cannot be null");
        }
        this.fracktal = fracktal;
    }

    /**
     * Shannon entropies, in bits per character.
     *
     * @param original Entropy of the decoded input
     * @param symbolic Entropy of the concatenated symbol stream
     * @param fractal Entropy of the concatenated collapsed hashes
     * @param preservation {@code symbolic / original}, 1.0 when the input has no entropy
     */
    public record EntropyReport(double original, double symbolic, double fractal, double preservation) {
    }

    /**
     * Decode the codex and compare entropies of input, symbols and hashes.
     *
     * @throws DecodeException if the codex cannot be decoded
     */
    public EntropyReport analyze(Codex codex) {
        String input = fracktal.decode(codex);
        List<String> hashes = new FractalFingerprinter(codex.hashDepth()).collapseAll(codex.symbols());

        double original = shannon(input);
        double symbolic = shannon(String.join("", codex.symbols()));
        double fractal = shannon(String.join("", hashes));
        double preservation = original > 0 ? symbolic / original : 1.0;
        return new EntropyReport(original, symbolic, fractal, preservation);
    }

    /** Shannon entropy of the characters of {@code text}; 0 for empty text. */
    public static double shannon(String text) {
        if (text.isEmpty()) {
            return 0.0;
        }
        Map<Character, Integer> freq = new HashMap<>();
        for (int i = 0; i < text.length(); i++) {
            freq.merge(text.charAt(i), 1, Integer::sum);
        }
        double entropy = 0.0;
        double length = text.length();
        for (int count : freq.values()) {
            double p = count / length;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }
}
