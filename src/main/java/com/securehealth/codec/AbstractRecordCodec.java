package com.securehealth.codec;

import com.securehealth.crypto.EncryptedValue;
import com.securehealth.crypto.FieldEncryptionEngine;
import com.securehealth.exception.DecryptionFailureException;
import org.bson.Document;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks the declared fields of a record in order. Fields classified in the encrypted field
 * schema are encrypted on the way out and decrypted on the way in; every other field and
 * {@code _id} pass through unchanged. Null values are not written.
 */
public abstract class AbstractRecordCodec<T> implements RecordCodec<T> {
    public static final String ID_FIELD = "_id";

    private final FieldEncryptionEngine encryptionEngine;

    protected AbstractRecordCodec(FieldEncryptionEngine encryptionEngine) {
        this.encryptionEngine = encryptionEngine;
    }

    protected abstract List<FieldMapping<T>> fields();

    protected abstract T newInstance();

    protected abstract String idOf(T entity);

    protected abstract void applyId(T entity, String id);

    @Override
    public Document toStorage(T entity) {
        Document stored = new Document();
        String id = idOf(entity);
        if (id != null) {
            stored.put(ID_FIELD, id);
        }
        for (FieldMapping<T> field : fields()) {
            Object value = field.reader().apply(entity);
            if (value == null) {
                continue;
            }
            if (this.encryptionEngine.isEncrypted(documentType(), field.name())) {
                stored.put(field.name(), this.encryptionEngine.encrypt(documentType(), field.name(), value).toBson());
            } else {
                stored.put(field.name(), value);
            }
        }
        return stored;
    }

    @Override
    public T fromStorage(Document stored) {
        T entity = newInstance();
        String id = stored.get(ID_FIELD) != null ? String.valueOf(stored.get(ID_FIELD)) : null;
        applyId(entity, id);
        for (FieldMapping<T> field : fields()) {
            Object raw = stored.get(field.name());
            Object value = raw;
            if (raw != null && this.encryptionEngine.isEncrypted(documentType(), field.name())) {
                value = decryptField(id, field.name(), raw);
            }
            try {
                field.writer().accept(entity, value);
            } catch (ClassCastException | IllegalArgumentException e) {
                throw new DecryptionFailureException(id, field.name(),
                        "Record " + id + ": field " + field.name() + " decoded to an unexpected shape", e);
            }
        }
        return entity;
    }

    private Object decryptField(String id, String fieldName, Object raw) {
        try {
            return this.encryptionEngine.decrypt(documentType(), fieldName, EncryptedValue.fromBson(fieldName, raw));
        } catch (DecryptionFailureException e) {
            throw e.forRecord(id);
        }
    }

    protected static String asString(Object value) {
        return value == null ? null : (String) value;
    }

    protected static List<String> asStringList(Object value) {
        if (value == null) {
            return new ArrayList<>();
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            result.add((String) item);
        }
        return result;
    }

    protected static LocalDate asLocalDate(Object value) {
        if (value == null || value instanceof LocalDate) {
            return (LocalDate) value;
        }
        return ((Date) value).toInstant().atZone(ZoneOffset.UTC).toLocalDate();
    }

    protected static Instant asInstant(Object value) {
        if (value == null || value instanceof Instant) {
            return (Instant) value;
        }
        return ((Date) value).toInstant();
    }

    protected static Date toDate(Instant instant) {
        return instant == null ? null : Date.from(instant);
    }

    protected static Map<String, Object> asMap(Object value) {
        if (value == null) {
            return null;
        }
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((key, item) -> result.put(String.valueOf(key), item));
        return result;
    }
}
