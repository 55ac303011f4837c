package com.entity.intelligence.artifact;

import com.entity.intelligence.api.CompilationResult;
import com.entity.intelligence.core.model.Entity;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes build artifacts as indented JSON with map keys sorted, so that an unchanged
 * build produces byte-identical files.
 *
 * <p>Files written: {@code corpus.json}, {@code graph.json}, {@code search-index.json} and
 * {@code recommendations.json}. Each file is written to a temporary sibling first and then
 * moved over the target. A failure leaves the previously published file in place. A relative
 * directory is resolved against the working directory and returned paths are absolute.</p>
 */
public class JsonArtifactWriter implements ArtifactWriter {
    private static final Logger log = LoggerFactory.getLogger(JsonArtifactWriter.class);

    private final ObjectMapper objectMapper;

    public JsonArtifactWriter() {
        this(new ObjectMapper());
    }

    public JsonArtifactWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public List<Path> write(CompilationResult result, Path dir) {
        Path directory = dir.toAbsolutePath().normalize();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create artifact directory " + directory, e);
        }

        Map<String, Object> corpus = new TreeMap<>();
        for (Entity entity : result.corpus().entities()) {
            corpus.put(entity.getId(), entity.toRecord());
        }
        Map<String, Object> recommendations = new TreeMap<>();
        result.recommendations().forEach((id, set) -> recommendations.put(id, set.toRecord()));

        Map<String, Object> artifacts = new LinkedHashMap<>();
        artifacts.put(CORPUS, corpus);
        artifacts.put(GRAPH, result.graph().toRecord());
        artifacts.put(SEARCH_INDEX, result.searchIndex().toRecord());
        artifacts.put(RECOMMENDATIONS, recommendations);

        List<Path> written = new ArrayList<>();
        artifacts.forEach((name, content) -> written.add(writeAtomically(directory.resolve(name + ".json"), content)));
        log.info("artifact.written buildId={} directory={} files={}", result.buildId(), directory, written.size());
        return written;
    }

    /**
     * Writes next to the target so the final move stays on one file system.
     */
    Path writeAtomically(Path file, Object content) {
        Path target = file.toAbsolutePath();
        Path temp = null;
        try {
            temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("artifact.move.nonatomic target={}", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("artifact.published file={}", target);
            return target;
        } catch (IOException e) {
            UncheckedIOException failure = new UncheckedIOException("Failed to write artifact " + target, e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    @Override
    public String getFormat() {
        return "json";
    }
}
