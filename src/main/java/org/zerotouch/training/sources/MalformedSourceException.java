package org.zerotouch.training.sources;

/**
 * Thrown when a source document cannot be read at all: XML or YAML syntax errors and I/O failures.
 * The underlying library exception is kept as the cause.
 */
public class MalformedSourceException extends RuntimeException {
    private final String sourcePath;

    public MalformedSourceException(String message, String sourcePath, Throwable cause) {
        super(message, cause);
        this.sourcePath = sourcePath;
    }

    public String getSourcePath() {
        return sourcePath;
    }
}
