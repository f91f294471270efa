package com.securehealth.codec;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * One declared attribute of a stored record: its document key, how to read its storable form
 * from the entity, and how to apply a decoded value back.
 */
record FieldMapping<T>(String name, Function<T, Object> reader, BiConsumer<T, Object> writer) {

    static <T> FieldMapping<T> of(String name, Function<T, Object> reader, BiConsumer<T, Object> writer) {
        return new FieldMapping<>(name, reader, writer);
    }
}
