package nl.bartlouwers.fracktal;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation of the Fracktal interface.
 * <p>
 * Holds only configuration, so a single instance may be shared between threads.
 */
public class FracktalImpl implements Fracktal {

    private static final Logger logger = LoggerFactory.getLogger(FracktalImpl.class);

    private final FracktalConfig config;
    private final SymbolExtractor extractor;
    private final PatternCompressor compressor;
    private final FractalFingerprinter fingerprinter;

    public FracktalImpl() {
        this(FracktalConfig.defaults());
    }

    public FracktalImpl(FracktalConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        this.config = config;
        this.extractor = new SymbolExtractor(config.symbolRange());
        this.compressor = new PatternCompressor(config);
        this.fingerprinter = new FractalFingerprinter(config.hashDepth());
    }

    /**
     * Encode text: extract symbols, substitute patterns, then fingerprint.
     *
     * @param input Text to encode
     * @return Codex containing everything needed to decode
     */
    @Override
    public Codex encode(String input) {
        if (input == null) {
            throw new IllegalArgumentException("Input cannot be null");
        }

        SymbolExtractor.Extraction extraction = extractor.extract(input);
        PatternCompressor.Compression compression = compressor.compress(extraction.symbols());
        String fingerprint = fingerprinter.fingerprint(extraction.symbols());

        // too short for a single chunk: keep the input itself so it still round-trips
        String residue = extraction.chunks().isEmpty() ? input : "";

        logger.debug("Encoded {} units into {} symbols, {} tokens, fingerprint {}",
            input.length(), extraction.symbols().size(), compression.rewritten().size(), fingerprint);

        return new Codex(
            extraction.chunks(),
            extraction.symbols(),
            compression.rewritten(),
            compression.dictionary(),
            fingerprint,
            compression.stats(),
            residue,
            config.symbolRange(),
            config.hashDepth());
    }

    @Override
    public Codex encode(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Input data cannot be null");
        }
        // ISO-8859-1 maps each byte to exactly one char and back
        return encode(new String(data, StandardCharsets.ISO_8859_1));
    }

    @Override
    public List<Codex> encodeAll(List<String> inputs) {
        if (inputs == null) {
            throw new IllegalArgumentException("Inputs cannot be null");
        }
        return inputs.parallelStream()
            .map(this::encode)
            .collect(Collectors.toList());
    }

    @Override
    public String decode(Codex codex) {
        if (codex == null) {
            throw new IllegalArgumentException("Codex cannot be null");
        }
        List<String> chunks = codex.chunks();
        if (chunks.isEmpty()) {
            if (!codex.symbols().isEmpty() || !codex.rewritten().isEmpty()) {
                throw corrupted("Codex has no chunks but " + codex.symbols().size() + " symbols and "
                    + codex.rewritten().size() + " tokens");
            }
            if (codex.residue().length() >= FracktalConfig.CHUNK_WIDTH) {
                throw corrupted("Residue of length " + codex.residue().length() + " in a codex without chunks");
            }
            return codex.residue();
        }

        if (!codex.residue().isEmpty()) {
            throw corrupted("Codex has both chunks and a residue");
        }

        List<String> expanded;
        try {
            expanded = PatternCompressor.expand(codex.rewritten(), codex.dictionary());
        } catch (DecodeException e) {
            logger.warn("Rejecting corrupted codex {}: {}", codex.fingerprint(), e.getMessage());
            throw e;
        }
        if (expanded.size() != chunks.size() || codex.symbols().size() != chunks.size()) {
            throw corrupted("Inconsistent codex: " + chunks.size() + " chunks, " + codex.symbols().size()
                + " symbols, " + expanded.size() + " expanded symbols");
        }
        if (!expanded.equals(codex.symbols())) {
            throw corrupted("Rewritten stream does not expand to the symbol stream");
        }

        // take the first chunk whole, then the last unit of every following chunk
        StringBuilder output = new StringBuilder(codex.inputLength());
        String previous = null;
        for (int i = 0; i < chunks.size(); i++) {
            String chunk = chunks.get(i);
            if (chunk == null || chunk.length() != FracktalConfig.CHUNK_WIDTH) {
                throw corrupted("Chunk " + i + " is not " + FracktalConfig.CHUNK_WIDTH + " units wide");
            }
            if (previous == null) {
                output.append(chunk);
            } else if (previous.charAt(1) != chunk.charAt(0)) {
                throw corrupted("Chunk " + i + " does not overlap chunk " + (i - 1));
            } else {
                output.append(chunk.charAt(1));
            }
            previous = chunk;
        }
        return output.toString();
    }

    @Override
    public byte[] decodeBytes(Codex codex) {
        String text = decode(codex);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) > 0xFF) {
                throw corrupted("Unit at " + i + " is not a byte: U+" + Integer.toHexString(text.charAt(i)));
            }
        }
        return text.getBytes(StandardCharsets.ISO_8859_1);
    }

    @Override
    public String decodeVerified(Codex codex) {
        String output = decode(codex);

        // re-derive the symbols from what was decoded, with the codex's own parameters
        SymbolExtractor rederive = new SymbolExtractor(codex.symbolRange());
        List<String> symbols = rederive.extract(output).symbols();
        String recomputed = new FractalFingerprinter(codex.hashDepth()).fingerprint(symbols);

        if (!recomputed.equals(codex.fingerprint())) {
            logger.warn("Fingerprint mismatch on decode: stored {} recomputed {}", codex.fingerprint(), recomputed);
            throw new IntegrityException(codex.fingerprint(), recomputed);
        }
        return output;
    }

    @Override
    public String fingerprint(Codex codex) {
        if (codex == null) {
            throw new IllegalArgumentException("Codex cannot be null");
        }
        return codex.fingerprint();
    }

    public FracktalConfig config() {
        return config;
    }

    private static DecodeException corrupted(String message) {
        logger.warn("Rejecting corrupted codex: {}", message);
        return new DecodeException(message);
    }
}
