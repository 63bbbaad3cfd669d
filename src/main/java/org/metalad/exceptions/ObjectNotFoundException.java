package org.metalad.exceptions;

import java.io.FileNotFoundException;

/**
 * Custom exception class for an ObjectRef that has no blob in the object store.
 */
public class ObjectNotFoundException extends FileNotFoundException {
    public ObjectNotFoundException(String message) {
        super(message);
    }

}
