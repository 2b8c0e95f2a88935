package nl.bartlouwers.fracktal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Benchmark test suite for FRACKTAL on a generated corpus of agent-memory style text.
 * Reports symbol stream reduction and verifies round-trip correctness.
 */
class FracktalBenchmarkTest {

    private Fracktal fracktal;

    @BeforeEach
    void setUp() {
        fracktal = new FracktalImpl();
    }

    private static Map<String, String> corpus() {
        Map<String, String> corpus = new LinkedHashMap<>();
        Random random = new Random(7);

        StringBuilder log = new StringBuilder();
        for (int i = 0; i < 400; i++) {
            log.append("2024-05-01T12:00:").append(String.format("%02d", i % 60))
                .append(" INFO  agent.memory - stored event id=").append(random.nextInt(1000))
                .append(" kind=observation\n");
        }
        corpus.put("agent.log", log.toString());

        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < 300; i++) {
            json.append("{\"role\":\"user\",\"content\":\"remember item ").append(i)
                .append("\",\"tags\":[\"memory\",\"note\"]},");
        }
        corpus.put("messages.json", json.append("]").toString());

        corpus.put("prose.txt", "It was the best of times, it was the worst of times, "
            + "it was the age of wisdom, it was the age of foolishness. ".repeat(40));

        StringBuilder noise = new StringBuilder();
        for (int i = 0; i < 5000; i++) {
            noise.append((char) ('!' + random.nextInt(90)));
        }
        corpus.put("noise.bin", noise.toString());

        return corpus;
    }

    @Test
    void testGeneratedCorpusCompression() {
        System.out.println("\n=== FRACKTAL Symbol Reduction Report ===\n");
        System.out.printf("%-16s %10s %10s %8s %9s %8s%n",
            "File", "Symbols", "Tokens", "Patterns", "Ratio", "Storage");
        System.out.println("-----------------------------------------------------------------");

        AtomicLong totalSymbols = new AtomicLong(0);
        AtomicLong totalTokens = new AtomicLong(0);
        AtomicInteger fileCount = new AtomicInteger(0);

        corpus().forEach((name, text) -> {
            Codex encoded = fracktal.encode(text);

            // Decompress and verify it matches the original
            assertEquals(text, fracktal.decode(encoded), "Round-trip failed for: " + name);
            assertEquals(text, fracktal.decodeVerified(encoded), "Verified decode failed for: " + name);

            CompressionStats stats = encoded.stats();
            assertTrue(stats.overallCompressionRatio() >= 1.0, name);

            System.out.printf("%-16s %,10d %,10d %8d %8.2fx %7.2fx%n",
                name,
                stats.originalSymbolCount(),
                stats.rewrittenTokenCount(),
                stats.patternCount(),
                stats.overallCompressionRatio(),
                stats.storageRatio());

            totalSymbols.addAndGet(stats.originalSymbolCount());
            totalTokens.addAndGet(stats.rewrittenTokenCount());
            fileCount.incrementAndGet();
        });

        System.out.println("-----------------------------------------------------------------");
        System.out.printf("%-16s %,10d %,10d %8s %8.2fx%n",
            "TOTAL", totalSymbols.get(), totalTokens.get(), "",
            (double) totalSymbols.get() / totalTokens.get());
        System.out.printf("%nProcessed %d files%n%n", fileCount.get());

        assertEquals(4, fileCount.get());
        assertTrue(totalTokens.get() < totalSymbols.get(), "Overall the corpus should shrink");
    }
}
