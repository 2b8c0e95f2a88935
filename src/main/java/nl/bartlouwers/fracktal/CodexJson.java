package nl.bartlouwers.fracktal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON form of a {@link Codex}, for callers that store or ship codices.
 * <p>
 * Works on strings rather than bytes: chunks may hold half of a surrogate pair,
 * which has no UTF-8 encoding of its own.
 */
public final class CodexJson {

    /** Format version written into every document. */
    public static final int VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CodexJson() {
    }

    public static String write(Codex codex) {
        if (codex == null) {
            throw new IllegalArgumentException("Codex cannot be null");
        }
        ObjectNode root = MAPPER.createObjectNode();
        root.put("version", VERSION);
        root.put("symbolRange", codex.symbolRange());
        root.put("hashDepth", codex.hashDepth());
        root.put("fingerprint", codex.fingerprint());
        root.put("residue", codex.residue());
        putStrings(root.putArray("chunks"), codex.chunks());
        putStrings(root.putArray("symbols"), codex.symbols());
        putStrings(root.putArray("rewritten"), codex.rewritten());

        ArrayNode dictionary = root.putArray("dictionary");
        for (Pattern pattern : codex.dictionary().values()) {
            ObjectNode entry = dictionary.addObject();
            entry.put("token", pattern.token());
            putStrings(entry.putArray("symbols"), pattern.symbols());
            ArrayNode positions = entry.putArray("positions");
            pattern.positions().forEach(positions::add);
        }

        CompressionStats stats = codex.stats();
        ObjectNode statsNode = root.putObject("stats");
        statsNode.put("originalSymbolCount", stats.originalSymbolCount());
        statsNode.put("rewrittenTokenCount", stats.rewrittenTokenCount());
        statsNode.put("dictionarySymbolCount", stats.dictionarySymbolCount());
        statsNode.put("patternCount", stats.patternCount());

        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new FracktalException("Cannot serialize codex " + codex.fingerprint(), e);
        }
    }

    /**
     * Parse a codex. Only the structure is checked here; {@link Fracktal#decode(Codex)}
     * checks that the parts agree with each other.
     *
     * @throws DecodeException if the document is not a well formed codex
     */
    public static Codex read(String json) {
        if (json == null) {
            throw new IllegalArgumentException("JSON cannot be null");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Malformed codex JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DecodeException("Codex JSON must be an object");
        }
        int version = requireInt(root, "version");
        if (version != VERSION) {
            throw new DecodeException("Unsupported codex version " + version);
        }

        Map<String, Pattern> dictionary = new LinkedHashMap<>();
        for (JsonNode entry : requireArray(root, "dictionary")) {
            String token = requireText(entry, "token");
            List<Integer> positions = new ArrayList<>();
            for (JsonNode p : requireArray(entry, "positions")) {
                if (!p.isInt()) {
                    throw new DecodeException("Non-integer position in pattern " + token);
                }
                positions.add(p.intValue());
            }
            try {
                dictionary.put(token, new Pattern(token, strings(entry, "symbols"), positions));
            } catch (IllegalArgumentException e) {
                throw new DecodeException("Invalid pattern " + token + ": " + e.getMessage(), e);
            }
        }

        JsonNode statsNode = root.get("stats");
        if (statsNode == null || !statsNode.isObject()) {
            throw new DecodeException("Missing object field 'stats'");
        }
        try {
            CompressionStats stats = new CompressionStats(
                requireInt(statsNode, "originalSymbolCount"),
                requireInt(statsNode, "rewrittenTokenCount"),
                requireInt(statsNode, "dictionarySymbolCount"),
                requireInt(statsNode, "patternCount"));

            return new Codex(
                strings(root, "chunks"),
                strings(root, "symbols"),
                strings(root, "rewritten"),
                dictionary,
                requireText(root, "fingerprint"),
                stats,
                requireText(root, "residue"),
                requireInt(root, "symbolRange"),
                requireInt(root, "hashDepth"));
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Invalid codex: " + e.getMessage(), e);
        }
    }

    private static void putStrings(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }

    private static List<String> strings(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : requireArray(node, field)) {
            if (!item.isTextual()) {
                throw new DecodeException("Non-string element in '" + field + "'");
            }
            values.add(item.textValue());
        }
        return values;
    }

    private static JsonNode requireArray(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            throw new DecodeException("Missing array field '" + field + "'");
        }
        return value;
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new DecodeException("Missing string field '" + field + "'");
        }
        return value.textValue();
    }

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isInt()) {
            throw new DecodeException("Missing integer field '" + field + "'");
        }
        return value.intValue();
    }
}
