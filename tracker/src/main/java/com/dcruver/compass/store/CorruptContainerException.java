package com.dcruver.compass.store;

/**
 * The bytes of a container file are not a well-formed JSON array of objects.
 */
public class CorruptContainerException extends Exception {

    public CorruptContainerException(String message) {
        super(message);
    }

    public CorruptContainerException(String message, Throwable cause) {
        super(message, cause);
    }
}
