package com.entity.intelligence.artifact;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads a corpus document: one JSON object mapping entity ids to attribute records.
 *
 * <pre>
 * {
 *   "movie:603": {"id": 603, "title": "The Matrix", "genres": [{"id": 28, "name": "Action"}]},
 *   "person:6384": {"id": 6384, "name": "Keanu Reeves", "popularity": 42.1}
 * }
 * </pre>
 *
 * <p>A root that is not an object, a record that is not an object, or an id that is not
 * of the form {@code kind:numeric-id} raises {@link CorpusFormatException}. Unknown or
 * oddly typed attributes are kept as read.</p>
 */
public class CorpusReader {
    private static final Logger log = LoggerFactory.getLogger(CorpusReader.class);
    private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public CorpusReader() {
        this(new ObjectMapper());
    }

    public CorpusReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EntityCorpus read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read corpus " + path, e);
        }
    }

    public EntityCorpus read(InputStream input) {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    public EntityCorpus read(Reader reader) {
        JsonNode root;
        try {
            root = objectMapper.readTree(reader);
        } catch (JsonProcessingException e) {
            throw new CorpusFormatException("Corpus is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read corpus", e);
        }
        if (root == null || !root.isObject()) {
            throw new CorpusFormatException("Corpus root must be a JSON object of id to record");
        }

        EntityCorpus.Builder builder = EntityCorpus.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String id = field.getKey();
            if (!field.getValue().isObject()) {
                throw new CorpusFormatException("Record of " + id + " must be a JSON object");
            }
            Map<String, Object> attributes = objectMapper.convertValue(field.getValue(), RECORD);
            try {
                builder.add(Entity.of(id, attributes));
            } catch (IllegalArgumentException e) {
                throw new CorpusFormatException("Invalid entity " + id + ": " + e.getMessage(), e);
            }
        }
        EntityCorpus corpus = builder.build();
        log.info("corpus.read entities={}", corpus.size());
        return corpus;
    }
}
