package com.securehealth.crypto;

import com.mongodb.MongoClientSettings;
import com.securehealth.crypto.keyvault.KeyHandle;
import com.securehealth.crypto.keyvault.KeyVaultClient;
import com.securehealth.exception.DecryptionFailureException;
import com.securehealth.exception.SchemaMismatchException;
import org.bson.BsonBinaryReader;
import org.bson.BsonBinaryWriter;
import org.bson.BSONException;
import org.bson.Document;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.DocumentCodec;
import org.bson.codecs.EncoderContext;
import org.bson.codecs.configuration.CodecConfigurationException;
import org.bson.io.BasicOutputBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Date;
import java.util.UUID;

/**
 * Field-level authenticated encryption with three query classes.
 *
 * <p>Ciphertext layout: {@code tag(1) || keyId(16) || nonce(12) || AES-256-GCM(ciphertext || tag(16))}.
 * The associated data binds the tag, the key id and {@code documentType.fieldName}, so a blob
 * copied into another field fails authentication.
 *
 * <ul>
 *   <li>DETERMINISTIC: nonce = HMAC-SHA256(nonceKey, aad || plaintext)[0..12]</li>
 *   <li>RANDOM: nonce from {@link SecureRandom}</li>
 *   <li>RANGE: random nonce, plus a 16-byte order token {@code a * (x - MIN) + r} where the
 *       scale {@code a} is derived per field from the data key and {@code 0 <= r < a}</li>
 * </ul>
 *
 * <p>Plaintext is serialized as the BSON document {@code {v: value}} before encryption.
 */
@Service
public class FieldEncryptionEngine {
    private static final Logger log = LoggerFactory.getLogger(FieldEncryptionEngine.class);

    private static final String AES_GCM_ALGORITHM = "AES/GCM/NoPadding";
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int KEY_ID_LENGTH = 16;
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final int HEADER_LENGTH = 1 + KEY_ID_LENGTH + GCM_IV_LENGTH;
    private static final int MIN_BLOB_LENGTH = HEADER_LENGTH + GCM_TAG_LENGTH / 8;
    static final int ORDER_TOKEN_LENGTH = 16;
    private static final BigInteger SIGN_OFFSET = BigInteger.ONE.shiftLeft(63);
    private static final BigInteger MIN_SCALE = BigInteger.ONE.shiftLeft(40);
    private static final String VALUE_KEY = "v";

    private final EncryptedFieldSchema schema;
    private final KeyVaultClient keyVaultClient;
    private final String keyAltName;
    private final DocumentCodec documentCodec = new DocumentCodec(MongoClientSettings.getDefaultCodecRegistry());
    private final SecureRandom random = new SecureRandom();

    public FieldEncryptionEngine(EncryptedFieldSchema schema, KeyVaultClient keyVaultClient,
                                 @Value("${securehealth.encryption.key-alt-name:hipaa_encryption_key}") String keyAltName) {
        this.schema = schema;
        this.keyVaultClient = keyVaultClient;
        this.keyAltName = keyAltName;
    }

    public EncryptionClass classOf(String documentType, String fieldName) {
        return this.schema.classify(documentType, fieldName)
                .orElseThrow(() -> new IllegalArgumentException("Field " + documentType + "." + fieldName + " is not classified for encryption"));
    }

    public boolean isEncrypted(String documentType, String fieldName) {
        return this.schema.isEncrypted(documentType, fieldName);
    }

    public EncryptedValue encrypt(String documentType, String fieldName, Object value) {
        EncryptionClass encryptionClass = classOf(documentType, fieldName);
        KeyHandle key = this.keyVaultClient.getOrCreateDataKey(this.keyAltName);
        byte[] plaintext = serialize(value);
        byte[] aad = associatedData(encryptionClass, key.keyIdBytes(), documentType, fieldName);
        byte[] nonce = encryptionClass == EncryptionClass.DETERMINISTIC
                ? deterministicNonce(key, aad, plaintext)
                : randomNonce();
        byte[] blob = seal(encryptionClass, key, nonce, aad, plaintext);
        if (encryptionClass == EncryptionClass.RANGE) {
            return new EncryptedValue(blob, orderToken(key, documentType, fieldName, value));
        }
        return EncryptedValue.of(blob);
    }

    public Object decrypt(String documentType, String fieldName, EncryptedValue value) {
        EncryptionClass expected = classOf(documentType, fieldName);
        byte[] blob = value.getCiphertext();
        if (blob.length < MIN_BLOB_LENGTH) {
            throw new DecryptionFailureException(fieldName, "Ciphertext of " + fieldName + " is truncated");
        }
        EncryptionClass actual = EncryptionClass.fromTag(blob[0])
                .orElseThrow(() -> new DecryptionFailureException(fieldName, "Ciphertext of " + fieldName + " has an unknown algorithm tag"));
        if (actual != expected) {
            throw new SchemaMismatchException("Field " + documentType + "." + fieldName + " is " + expected
                    + " but the stored value was written as " + actual);
        }
        UUID keyId = KeyHandle.fromBytes(blob, 1);
        KeyHandle key = this.keyVaultClient.getDataKey(keyId)
                .orElseThrow(() -> new DecryptionFailureException(fieldName, "Ciphertext of " + fieldName + " references an unknown data key"));
        byte[] aad = associatedData(actual, key.keyIdBytes(), documentType, fieldName);
        return deserialize(fieldName, open(fieldName, key, blob, aad));
    }

    /**
     * Ciphertext to match a DETERMINISTIC field against with an equality query.
     */
    public EncryptedValue equalityToken(String documentType, String fieldName, Object value) {
        if (classOf(documentType, fieldName) != EncryptionClass.DETERMINISTIC) {
            throw new IllegalArgumentException("Field " + documentType + "." + fieldName + " does not support equality search");
        }
        return encrypt(documentType, fieldName, value);
    }

    /**
     * Inclusive order token bounds covering every value in {@code [lower, upper]} of a RANGE
     * field. Either bound may be null for an open end.
     */
    public RangeBounds rangeBounds(String documentType, String fieldName, Object lower, Object upper) {
        if (classOf(documentType, fieldName) != EncryptionClass.RANGE) {
            throw new IllegalArgumentException("Field " + documentType + "." + fieldName + " does not support range search");
        }
        KeyHandle key = this.keyVaultClient.getOrCreateDataKey(this.keyAltName);
        BigInteger scale = scale(key, documentType, fieldName);
        byte[] lowToken = lower != null
                ? toToken(scale.multiply(shifted(lower)))
                : new byte[ORDER_TOKEN_LENGTH];
        byte[] highToken;
        if (upper != null) {
            highToken = toToken(scale.multiply(shifted(upper)).add(scale).subtract(BigInteger.ONE));
        } else {
            highToken = new byte[ORDER_TOKEN_LENGTH];
            Arrays.fill(highToken, (byte) 0xFF);
        }
        return new RangeBounds(lowToken, highToken);
    }

    private byte[] seal(EncryptionClass encryptionClass, KeyHandle key, byte[] nonce, byte[] aad, byte[] plaintext) {
        try {
            Cipher cipher = Cipher.getInstance(AES_GCM_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key.encryptionKey(), new GCMParameterSpec(GCM_TAG_LENGTH, nonce));
            cipher.updateAAD(aad);
            byte[] ciphertext = cipher.doFinal(plaintext);
            return ByteBuffer.allocate(HEADER_LENGTH + ciphertext.length)
                    .put(encryptionClass.getTag())
                    .put(key.keyIdBytes())
                    .put(nonce)
                    .put(ciphertext)
                    .array();
        } catch (GeneralSecurityException e) {
            log.error("AES-256-GCM encryption failed: {}", e.getMessage());
            throw new IllegalStateException("Field encryption failed", e);
        }
    }

    private static byte[] open(String fieldName, KeyHandle key, byte[] blob, byte[] aad) {
        try {
            Cipher cipher = Cipher.getInstance(AES_GCM_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key.encryptionKey(),
                    new GCMParameterSpec(GCM_TAG_LENGTH, blob, 1 + KEY_ID_LENGTH, GCM_IV_LENGTH));
            cipher.updateAAD(aad);
            return cipher.doFinal(blob, HEADER_LENGTH, blob.length - HEADER_LENGTH);
        } catch (AEADBadTagException e) {
            throw new DecryptionFailureException(fieldName, "Ciphertext of " + fieldName + " failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionFailureException(fieldName, "Ciphertext of " + fieldName + " could not be decrypted", e);
        }
    }

    private static byte[] associatedData(EncryptionClass encryptionClass, byte[] keyId, String documentType, String fieldName) {
        byte[] path = (documentType + "." + fieldName).getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(1 + keyId.length + path.length)
                .put(encryptionClass.getTag())
                .put(keyId)
                .put(path)
                .array();
    }

    private static byte[] deterministicNonce(KeyHandle key, byte[] aad, byte[] plaintext) {
        Mac mac = hmac(key);
        mac.update(aad);
        return Arrays.copyOf(mac.doFinal(plaintext), GCM_IV_LENGTH);
    }

    private byte[] randomNonce() {
        byte[] nonce = new byte[GCM_IV_LENGTH];
        this.random.nextBytes(nonce);
        return nonce;
    }

    private byte[] orderToken(KeyHandle key, String documentType, String fieldName, Object value) {
        BigInteger scale = scale(key, documentType, fieldName);
        BigInteger noise = new BigInteger(scale.bitLength() + 8, this.random).mod(scale);
        return toToken(scale.multiply(shifted(value)).add(noise));
    }

    /**
     * Per-field scale in [2^40, 2^41), so distinct values never share a token interval.
     */
    private static BigInteger scale(KeyHandle key, String documentType, String fieldName) {
        Mac mac = hmac(key);
        byte[] digest = mac.doFinal(("order-scale:" + documentType + "." + fieldName).getBytes(StandardCharsets.UTF_8));
        BigInteger derived = new BigInteger(1, Arrays.copyOf(digest, 5));
        return MIN_SCALE.add(derived);
    }

    private static BigInteger shifted(Object value) {
        return BigInteger.valueOf(orderedForm(value)).add(SIGN_OFFSET);
    }

    static long orderedForm(Object value) {
        if (value instanceof LocalDate date) {
            return date.toEpochDay();
        }
        if (value instanceof Date date) {
            return date.getTime();
        }
        if (value instanceof Instant instant) {
            return instant.toEpochMilli();
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw new IllegalArgumentException("Value of type " + (value == null ? "null" : value.getClass().getSimpleName())
                + " has no ordered form");
    }

    private static byte[] toToken(BigInteger value) {
        byte[] raw = value.toByteArray();
        byte[] token = new byte[ORDER_TOKEN_LENGTH];
        int length = Math.min(raw.length, ORDER_TOKEN_LENGTH);
        System.arraycopy(raw, raw.length - length, token, ORDER_TOKEN_LENGTH - length, length);
        return token;
    }

    private static Mac hmac(KeyHandle key) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key.nonceKey());
            return mac;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private byte[] serialize(Object value) {
        BasicOutputBuffer buffer = new BasicOutputBuffer();
        try (BsonBinaryWriter writer = new BsonBinaryWriter(buffer)) {
            this.documentCodec.encode(writer, new Document(VALUE_KEY, value), EncoderContext.builder().build());
        } catch (CodecConfigurationException e) {
            throw new IllegalArgumentException("Unsupported field value type: " + value.getClass().getSimpleName(), e);
        }
        return buffer.toByteArray();
    }

    private Object deserialize(String fieldName, byte[] plaintext) {
        try (BsonBinaryReader reader = new BsonBinaryReader(ByteBuffer.wrap(plaintext))) {
            Document document = this.documentCodec.decode(reader, DecoderContext.builder().build());
            return document.get(VALUE_KEY);
        } catch (BSONException e) {
            throw new DecryptionFailureException(fieldName, "Plaintext of " + fieldName + " is not a valid payload", e);
        }
    }

    /**
     * Inclusive order token bounds for a range query.
     */
    public record RangeBounds(byte[] lower, byte[] upper) {
    }
}
