package com.entity.intelligence.artifact;

import com.entity.intelligence.api.CompilationResult;
import com.entity.intelligence.api.EngineOptions;
import com.entity.intelligence.api.IntelligenceEngine;
import com.entity.intelligence.core.model.Entity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static com.entity.intelligence.EntityFixtures.corpus;
import static com.entity.intelligence.EntityFixtures.movie;
import static org.junit.jupiter.api.Assertions.*;

class JsonArtifactWriterTest {

    private final JsonArtifactWriter writer = new JsonArtifactWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    private IntelligenceEngine engine;
    private CompilationResult result;

    @BeforeEach
    void setUp() {
        Entity kappa = movie(1).title("Kappa").genres("Horror", "Thriller").company(420, "Marvel Studios").build();
        Entity sigma = movie(2).title("Sigma").genres("Horror", "Thriller").company(420, "Marvel Studios").build();
        engine = IntelligenceEngine.builder()
                .options(EngineOptions.builder().referenceYear(2024).build())
                .build();
        result = engine.compile(corpus(kappa, sigma));
    }

    private static List<String> fileNames(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(path -> path.getFileName().toString()).sorted().toList();
        }
    }

    @Test
    @DisplayName("Should write the four artifacts as JSON")
    void testWrite(@TempDir Path dir) throws IOException {
        List<Path> written = writer.write(result, dir.resolve("out"));

        assertEquals(List.of("corpus.json", "graph.json", "search-index.json", "recommendations.json"),
                written.stream().map(path -> path.getFileName().toString()).toList());

        JsonNode graph = mapper.readTree(dir.resolve("out/graph.json").toFile());
        assertTrue(graph.path("movie:1").path("direct").isArray());
        assertEquals("movie:2", graph.path("movie:1").path("direct").get(0).path("id").asText());

        JsonNode index = mapper.readTree(dir.resolve("out/search-index.json").toFile());
        List<String> keys = new ArrayList<>();
        index.fieldNames().forEachRemaining(keys::add);
        assertEquals(List.of("categoryMap", "contextMap", "intentMap", "termMap"), keys);
        assertEquals("movie:1", index.path("termMap").path("kappa").get(0).asText());

        JsonNode recommendations = mapper.readTree(dir.resolve("out/recommendations.json").toFile());
        assertTrue(recommendations.path("movie:1").has("quick"));
        assertTrue(recommendations.path("movie:1").has("deep"));
    }

    @Test
    @DisplayName("Rewriting an unchanged build should produce identical bytes and no temporary files")
    void testDeterministic(@TempDir Path dir) throws IOException {
        writer.write(result, dir);
        List<byte[]> first = new ArrayList<>();
        for (String name : fileNames(dir)) {
            first.add(Files.readAllBytes(dir.resolve(name)));
        }

        CompilationResult again = engine.compile(result.corpus());
        writer.write(again, dir);

        List<String> names = fileNames(dir);
        assertEquals(List.of("corpus.json", "graph.json", "recommendations.json", "search-index.json"), names);
        for (int i = 0; i < names.size(); i++) {
            assertArrayEquals(first.get(i), Files.readAllBytes(dir.resolve(names.get(i))), names.get(i));
        }
    }

    @Test
    @DisplayName("A relative directory should be resolved and written through siblings of the targets")
    void testRelativeDirectory(@TempDir Path dir) throws IOException {
        Path relative = Path.of("").toAbsolutePath().relativize(dir.resolve("rel"));
        assertFalse(relative.isAbsolute());

        List<Path> written = writer.write(result, relative);

        for (Path path : written) {
            assertTrue(path.isAbsolute(), path.toString());
            assertEquals(dir.resolve("rel"), path.getParent());
        }
        assertEquals(List.of("corpus.json", "graph.json", "recommendations.json", "search-index.json"),
                fileNames(dir.resolve("rel")));
    }

    @Test
    @DisplayName("A directory that cannot be created should fail the write")
    void testUnwritableDirectory(@TempDir Path dir) throws IOException {
        Path blocker = Files.writeString(dir.resolve("blocker"), "x");

        assertThrows(UncheckedIOException.class, () -> writer.write(result, blocker));
        assertEquals("json", writer.getFormat());
    }
}
