package io.callscan.coverage;

import java.io.IOException;

/**
 * A coverage profile could not be opened or read.
 */
public class CoverageProfileException extends IOException {

    public CoverageProfileException(String message, Throwable cause) {
        super(message, cause);
    }
}
