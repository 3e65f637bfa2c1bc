package io.callscan.model;

import java.nio.file.Path;

/**
 * A recoverable problem: a file or function that was skipped, or a registry collision.
 *
 * @param file     File concerned
 * @param function Identity of the function concerned, empty for file-level warnings
 * @param message  Human-readable cause
 */
public record ScanWarning(Path file, String function, String message) {

    public ScanWarning {
        function = function != null ? function : "";
    }

    public static ScanWarning forFile(Path file, String message) {
        return new ScanWarning(file, "", message);
    }

    public boolean isFileLevel() {
        return function.isEmpty();
    }

    @Override
    public String toString() {
        return isFileLevel() ? file + ": " + message : file + " (" + function + "): " + message;
    }
}
