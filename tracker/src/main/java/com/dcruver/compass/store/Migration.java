package com.dcruver.compass.store;

import lombok.Value;

/**
 * Outcome of normalizing one raw record.
 */
@Value
public class Migration<T> {
    T record;

    /** Legacy inline solution text pulled out of the record, or null. */
    String extractedSolution;

    /** Whether the migrator removed or rewrote something the stored record had. */
    boolean changed;

    public static <T> Migration<T> of(T record, boolean changed) {
        return new Migration<>(record, null, changed);
    }
}
