package io.callscan.source;

import java.nio.file.Path;

/**
 * The body of an indexed function could not be found again when its file was re-parsed.
 * Recoverable: the function gets no call sites.
 */
public class FunctionReparseException extends SourceParseException {

    private final String function;

    public FunctionReparseException(Path file, String function, String message) {
        super(file, message);
        this.function = function;
    }

    public FunctionReparseException(Path file, String function, String message, Throwable cause) {
        super(file, message, cause);
        this.function = function;
    }

    public String getFunction() {
        return function;
    }

    @Override
    public String getMessage() {
        return getFile() + " (" + function + "): " + getReason();
    }
}
