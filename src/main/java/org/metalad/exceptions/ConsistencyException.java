package org.metalad.exceptions;

import java.io.IOException;

/**
 * An exception thrown when stored state contradicts itself, ex. a digest whose existing blob has
 * different content, or an index entry that references a blob which does not exist. It is never
 * retried or repaired.
 */
public class ConsistencyException extends IOException {

    private final String objectRef;

    public ConsistencyException(String message, String objectRef) {
        super(message);
        this.objectRef = objectRef;
    }

    public String getObjectRef() {
        return objectRef;
    }
}
