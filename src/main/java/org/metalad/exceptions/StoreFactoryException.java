package org.metalad.exceptions;

import java.io.IOException;

/**
 * An exception that encapsulates errors from the ObjectStore factory
 */
public class StoreFactoryException extends IOException {
    public StoreFactoryException(String message) {
        super(message);
    }

}
