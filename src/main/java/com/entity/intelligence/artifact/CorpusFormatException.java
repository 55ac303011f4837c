package com.entity.intelligence.artifact;

/**
 * Thrown when a corpus document cannot be read or does not have the expected shape.
 */
public class CorpusFormatException extends RuntimeException {

    public CorpusFormatException(String message) {
        super(message);
    }

    public CorpusFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
