package org.metalad.exceptions;

import java.io.FileNotFoundException;

/**
 * Custom exception class for a (dataset id, dataset version) pair without a sealed version index.
 */
public class VersionIndexNotFoundException extends FileNotFoundException {
    public VersionIndexNotFoundException(String message) {
        super(message);
    }

}
