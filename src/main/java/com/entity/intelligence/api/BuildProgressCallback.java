package com.entity.intelligence.api;

/**
 * Callback interface for tracking progress of a build.
 */
@FunctionalInterface
public interface BuildProgressCallback {

    /**
     * Called to report progress.
     *
     * @param phase     the running phase, e.g. {@code analyze}
     * @param processed the number of items processed so far in this phase
     * @param total     the total number of items in this phase
     */
    void onProgress(String phase, long processed, long total);

    /**
     * A no-op progress callback.
     */
    BuildProgressCallback NOOP = (phase, processed, total) -> {};
}
