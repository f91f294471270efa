package com.securehealth.crypto;

import java.util.Optional;

/**
 * Cryptographic treatment of a field, fixed when the schema is designed. The tag is the first
 * byte of every ciphertext so a stored value always states how it was produced.
 */
public enum EncryptionClass {
    /** Same plaintext, same ciphertext. Supports equality search. */
    DETERMINISTIC((byte) 0x01),
    /** Ciphertext carries an order token. Supports range search. */
    RANGE((byte) 0x02),
    /** Fresh nonce per call. No query capability. */
    RANDOM((byte) 0x03);

    private final byte tag;

    EncryptionClass(byte tag) {
        this.tag = tag;
    }

    public byte getTag() {
        return this.tag;
    }

    public static Optional<EncryptionClass> fromTag(byte tag) {
        for (EncryptionClass value : values()) {
            if (value.tag == tag) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
