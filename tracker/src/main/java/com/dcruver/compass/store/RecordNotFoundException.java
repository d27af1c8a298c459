package com.dcruver.compass.store;

import lombok.Getter;

/**
 * No record with the requested identity exists in the collection.
 */
@Getter
public class RecordNotFoundException extends RuntimeException {
    private final String kind;
    private final String id;

    public RecordNotFoundException(String kind, String id) {
        super(capitalize(kind) + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
