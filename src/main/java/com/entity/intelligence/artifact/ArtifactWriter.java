package com.entity.intelligence.artifact;

import com.entity.intelligence.api.CompilationResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Publishes the artifacts of a build for consumers.
 * Each artifact is published whole; readers never observe a partially written one.
 */
public interface ArtifactWriter {

    String CORPUS = "corpus";
    String GRAPH = "graph";
    String SEARCH_INDEX = "search-index";
    String RECOMMENDATIONS = "recommendations";

    /**
     * Writes every artifact of the build into a directory, creating it if needed.
     *
     * @param result    the build to publish
     * @param directory target directory
     * @return the published files, in write order
     */
    List<Path> write(CompilationResult result, Path directory);

    /**
     * Returns the format produced by this writer (e.g., "json").
     */
    String getFormat();
}
