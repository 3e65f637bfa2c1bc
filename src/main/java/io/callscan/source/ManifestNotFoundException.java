package io.callscan.source;

import java.io.IOException;

/**
 * No go.mod declaring a module path was found at or above the project root.
 */
public class ManifestNotFoundException extends IOException {

    public ManifestNotFoundException(String message) {
        super(message);
    }

    public ManifestNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
