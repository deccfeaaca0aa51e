package org.zerotouch.training.sources;

/**
 * Thrown when a source document is well-formed but lacks a construct the parser requires,
 * e.g. a BPMN file without a top-level {@code process} element.
 */
public class SourceParseException extends RuntimeException {
    private final String sourcePath;

    public SourceParseException(String message, String sourcePath) {
        super(message);
        this.sourcePath = sourcePath;
    }

    public String getSourcePath() {
        return sourcePath;
    }
}
