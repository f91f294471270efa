package com.securehealth.crypto;

import com.securehealth.exception.DecryptionFailureException;
import org.bson.BsonBinarySubType;
import org.bson.Document;
import org.bson.types.Binary;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Ciphertext of one field value as it is stored.
 *
 * <p>DETERMINISTIC and RANDOM values are stored as BSON binary subtype 6. RANGE values are
 * stored as {@code {ord: <16-byte order token>, ct: <binary subtype 6>}} so the order token
 * can be indexed and compared by the server.
 */
public final class EncryptedValue {
    public static final String ORDER_TOKEN_FIELD = "ord";
    public static final String CIPHERTEXT_FIELD = "ct";
    static final byte ENCRYPTED_SUBTYPE = BsonBinarySubType.ENCRYPTED.getValue();

    private final byte[] ciphertext;
    private final byte[] orderToken;

    public EncryptedValue(byte[] ciphertext, byte[] orderToken) {
        this.ciphertext = ciphertext.clone();
        this.orderToken = orderToken != null ? orderToken.clone() : null;
    }

    public static EncryptedValue of(byte[] ciphertext) {
        return new EncryptedValue(ciphertext, null);
    }

    public byte[] getCiphertext() {
        return this.ciphertext.clone();
    }

    public byte[] getOrderToken() {
        return this.orderToken != null ? this.orderToken.clone() : null;
    }

    public boolean hasOrderToken() {
        return this.orderToken != null;
    }

    /**
     * Value to place in the stored document.
     */
    public Object toBson() {
        Binary ct = new Binary(ENCRYPTED_SUBTYPE, this.ciphertext);
        if (this.orderToken == null) {
            return ct;
        }
        return new Document(ORDER_TOKEN_FIELD, new Binary(BsonBinarySubType.BINARY, this.orderToken))
                .append(CIPHERTEXT_FIELD, ct);
    }

    /**
     * Parses a stored value. Anything that is not one of the two stored shapes is corrupt.
     */
    public static EncryptedValue fromBson(String fieldName, Object stored) {
        if (stored instanceof Binary binary) {
            return EncryptedValue.of(binary.getData());
        }
        if (stored instanceof Document document) {
            Object ct = document.get(CIPHERTEXT_FIELD);
            byte[] token = bytesOf(document.get(ORDER_TOKEN_FIELD));
            if (ct instanceof Binary binary && token != null) {
                return new EncryptedValue(binary.getData(), token);
            }
        }
        throw new DecryptionFailureException(fieldName, "Stored value of " + fieldName + " is not an encrypted payload");
    }

    private static byte[] bytesOf(Object value) {
        if (value instanceof Binary binary) {
            return binary.getData();
        }
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        return null;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof EncryptedValue that)) {
            return false;
        }
        return Arrays.equals(this.ciphertext, that.ciphertext) && Arrays.equals(this.orderToken, that.orderToken);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(this.ciphertext) + Arrays.hashCode(this.orderToken);
    }

    @Override
    public String toString() {
        return "EncryptedValue[tag=" + (this.ciphertext.length > 0 ? HexFormat.of().toHexDigits(this.ciphertext[0]) : "none")
                + ", length=" + this.ciphertext.length + (this.orderToken != null ? ", ordered" : "") + "]";
    }
}
