package org.metalad.exceptions;

import java.util.Collection;
import java.util.List;

/**
 * An exception thrown when a metadata record is missing required keys, carries unknown keys or
 * has keys that do not fit its type.
 */
public class MetadataKeyException extends IllegalArgumentException {

    private final List<String> keys;

    public MetadataKeyException(String message, Collection<String> keys) {
        super(message + ": " + keys);
        this.keys = List.copyOf(keys);
    }

    public MetadataKeyException(String message) {
        super(message);
        this.keys = List.of();
    }

    public List<String> getKeys() {
        return keys;
    }
}
