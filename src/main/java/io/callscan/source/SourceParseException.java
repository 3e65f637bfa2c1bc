package io.callscan.source;

import java.nio.file.Path;

/**
 * A Go source file could not be read or contains syntax errors.
 * Recoverable: the file is skipped and indexing continues.
 */
public class SourceParseException extends Exception {

    private final Path file;
    private final String reason;

    public SourceParseException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
        this.reason = message;
    }

    public SourceParseException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
        this.reason = message;
    }

    public Path getFile() {
        return file;
    }

    /**
     * The message without the file prefix.
     */
    public String getReason() {
        return reason;
    }
}
