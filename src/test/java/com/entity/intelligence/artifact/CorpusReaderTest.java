package com.entity.intelligence.artifact;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.core.model.EntityKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CorpusReaderTest {

    private static final String CORPUS = """
            {
              "movie:603": {"id": 603, "title": "The Matrix", "genres": [{"id": 28, "name": "Action"}],
                            "vote_average": 8.2},
              "person:6384": {"id": 6384, "name": "Keanu Reeves", "popularity": 42.1}
            }
            """;

    private final CorpusReader reader = new CorpusReader();

    @Test
    @DisplayName("Should read every record keyed by entity id")
    void testRead() {
        EntityCorpus corpus = reader.read(new StringReader(CORPUS));

        assertEquals(List.of("movie:603", "person:6384"), List.copyOf(corpus.ids()));
        Entity matrix = corpus.get("movie:603").orElseThrow();
        assertEquals(EntityKind.MOVIE, matrix.getKind());
        assertEquals("The Matrix", matrix.getDisplayName());
        assertEquals(List.of(Map.of("id", 28, "name", "Action")), matrix.get("genres").orElseThrow());
        assertEquals(8.2, matrix.get("vote_average").orElseThrow());
    }

    @Test
    @DisplayName("Should read from files and streams")
    void testReadSources(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("corpus.json");
        Files.writeString(file, CORPUS, StandardCharsets.UTF_8);

        assertEquals(2, reader.read(file).size());
        assertEquals(2, reader.read(new ByteArrayInputStream(CORPUS.getBytes(StandardCharsets.UTF_8))).size());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"movie:1\": ",
            "[{\"movie:1\": {}}]",
            "{\"movie:1\": [1, 2]}",
            "{\"film:1\": {\"title\": \"x\"}}",
            "{\"movie:abc\": {\"title\": \"x\"}}",
    })
    @DisplayName("Malformed documents should be rejected")
    void testMalformed(String json) {
        assertThrows(CorpusFormatException.class, () -> reader.read(new StringReader(json)));
    }

    @Test
    @DisplayName("Empty object should give an empty corpus")
    void testEmpty() {
        assertEquals(0, reader.read(new StringReader("{}")).size());
    }
}
