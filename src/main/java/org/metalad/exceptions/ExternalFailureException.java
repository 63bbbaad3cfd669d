package org.metalad.exceptions;

import java.io.IOException;

/**
 * Custom exception class for failures of an external extractor process (start failure, non-zero
 * exit code or timeout).
 */
public class ExternalFailureException extends IOException {

    private final int exitCode;

    public ExternalFailureException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public ExternalFailureException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    /**
     * @return Exit code of the process, or -1 when the process did not exit by itself
     */
    public int getExitCode() {
        return exitCode;
    }
}
