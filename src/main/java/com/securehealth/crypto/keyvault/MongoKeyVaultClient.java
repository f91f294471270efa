package com.securehealth.crypto.keyvault;

import com.github.benmanes.caffeine.cache.Cache;
import com.securehealth.audit.AuditEntry;
import com.securehealth.audit.AuditLogWriter;
import com.securehealth.exception.AuditWriteFailureException;
import com.securehealth.exception.KeyCorruptException;
import com.securehealth.exception.KeyVaultUnavailableException;
import com.securehealth.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Key vault stored in a MongoDB collection.
 *
 * <p>Creation is idempotent under concurrency: the vault collection carries a unique index on
 * {@code keyAltNames}, so when two callers race to create the same key the loser's insert
 * fails with a duplicate key error, and it re-reads and adopts the winner's key.
 *
 * <p>Unwrapped keys are cached by alt name and by id. Vault reads are retried a bounded number
 * of times before surfacing {@link KeyVaultUnavailableException}.
 */
public class MongoKeyVaultClient implements KeyVaultClient {
    private static final Logger log = LoggerFactory.getLogger(MongoKeyVaultClient.class);
    private static final String ALT_PREFIX = "alt:";
    private static final String ID_PREFIX = "id:";

    private final MongoTemplate vaultTemplate;
    private final String collection;
    private final MasterKeyProvider masterKeyProvider;
    private final Cache<String, KeyHandle> dataKeyCache;
    private final AuditLogWriter auditLogWriter;
    private final int maxAttempts;
    private final long initialBackoffMs;
    private final SecureRandom random = new SecureRandom();

    public MongoKeyVaultClient(MongoTemplate vaultTemplate, String collection, MasterKeyProvider masterKeyProvider,
                               Cache<String, KeyHandle> dataKeyCache, AuditLogWriter auditLogWriter,
                               int maxAttempts, long initialBackoffMs) {
        this.vaultTemplate = vaultTemplate;
        this.collection = collection;
        this.masterKeyProvider = masterKeyProvider;
        this.dataKeyCache = dataKeyCache;
        this.auditLogWriter = auditLogWriter;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = Math.max(0L, initialBackoffMs);
    }

    /**
     * Creates the unique alt name index if it is missing.
     */
    public void ensureIndexes() {
        withRetry("index creation", () -> this.vaultTemplate.indexOps(this.collection)
                .ensureIndex(new Index().on("keyAltNames", Sort.Direction.ASC).unique().sparse()));
        log.info("Key vault ready: collection={}", this.collection);
    }

    @Override
    public KeyHandle getOrCreateDataKey(String keyAltName) {
        if (keyAltName == null || keyAltName.isBlank()) {
            throw new IllegalArgumentException("Key alt name is blank");
        }
        KeyHandle cached = this.dataKeyCache.getIfPresent(ALT_PREFIX + keyAltName);
        if (cached != null) {
            return cached;
        }
        DataKeyDocument existing = findByAltName(keyAltName);
        KeyHandle handle = existing != null ? unwrap(existing, keyAltName) : create(keyAltName);
        remember(handle);
        return handle;
    }

    @Override
    public Optional<KeyHandle> getDataKey(UUID keyId) {
        KeyHandle cached = this.dataKeyCache.getIfPresent(ID_PREFIX + keyId);
        if (cached != null) {
            return Optional.of(cached);
        }
        DataKeyDocument document = withRetry("key lookup",
                () -> this.vaultTemplate.findById(keyId, DataKeyDocument.class, this.collection));
        if (document == null) {
            log.warn("Data key {} referenced by ciphertext is not in the vault", keyId);
            return Optional.empty();
        }
        String altName = document.getKeyAltNames().isEmpty() ? null : document.getKeyAltNames().get(0);
        KeyHandle handle = unwrap(document, altName);
        remember(handle);
        return Optional.of(handle);
    }

    private KeyHandle create(String keyAltName) {
        byte[] material = new byte[KeyHandle.MATERIAL_LENGTH];
        this.random.nextBytes(material);
        UUID keyId = UUID.randomUUID();
        DataKeyDocument document = DataKeyDocument.create(keyId, keyAltName, this.masterKeyProvider.wrap(material), this.masterKeyProvider);
        try {
            withRetry("key insert", () -> this.vaultTemplate.insert(document, this.collection));
        } catch (DuplicateKeyException e) {
            Arrays.fill(material, (byte) 0);
            log.info("Data key '{}' was created concurrently, adopting the stored key", LogSanitizer.sanitize(keyAltName));
            DataKeyDocument winner = findByAltName(keyAltName);
            if (winner == null) {
                throw new KeyVaultUnavailableException("Data key '" + keyAltName + "' conflicted on insert but cannot be read back", e);
            }
            return unwrap(winner, keyAltName);
        }
        KeyHandle handle = new KeyHandle(keyId, keyAltName, material);
        Arrays.fill(material, (byte) 0);
        log.warn("PRIVILEGED: created data key '{}' id={} under {} master key",
                LogSanitizer.sanitize(keyAltName), keyId, this.masterKeyProvider.providerName());
        try {
            this.auditLogWriter.append(AuditEntry.create(AuditEntry.EventType.KEY_CREATED, "CREATE_DATA_KEY")
                    .withSystemActor("key-vault")
                    .withDetail("keyAltName", keyAltName)
                    .withDetail("keyId", keyId.toString())
                    .withDetail("masterKeyProvider", this.masterKeyProvider.providerName()));
        } catch (AuditWriteFailureException e) {
            discard(keyId, keyAltName, e);
            throw e;
        }
        return handle;
    }

    /**
     * Removes a key whose creation could not be audited, so no unaudited key is ever served.
     */
    private void discard(UUID keyId, String keyAltName, AuditWriteFailureException cause) {
        Query byId = new Query(Criteria.where("_id").is(keyId));
        try {
            withRetry("key removal", () -> this.vaultTemplate.remove(byId, DataKeyDocument.class, this.collection));
            log.error("Data key '{}' id={} removed: its creation could not be audited",
                    LogSanitizer.sanitize(keyAltName), keyId);
        } catch (KeyVaultUnavailableException e) {
            cause.addSuppressed(e);
            log.error("CRITICAL: unaudited data key '{}' id={} could not be removed",
                    LogSanitizer.sanitize(keyAltName), keyId);
        }
    }

    private DataKeyDocument findByAltName(String keyAltName) {
        Query query = new Query(Criteria.where("keyAltNames").is(keyAltName));
        return withRetry("key lookup", () -> this.vaultTemplate.findOne(query, DataKeyDocument.class, this.collection));
    }

    private KeyHandle unwrap(DataKeyDocument document, String keyAltName) {
        if (document.getId() == null || document.getKeyMaterial() == null) {
            throw new KeyCorruptException("Data key document for '" + keyAltName + "' is incomplete");
        }
        byte[] material = this.masterKeyProvider.unwrap(document.getKeyMaterial());
        try {
            return new KeyHandle(document.getId(), keyAltName, material);
        } finally {
            Arrays.fill(material, (byte) 0);
        }
    }

    private void remember(KeyHandle handle) {
        if (handle.keyAltName() != null) {
            this.dataKeyCache.put(ALT_PREFIX + handle.keyAltName(), handle);
        }
        this.dataKeyCache.put(ID_PREFIX + handle.keyId(), handle);
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        long backoff = this.initialBackoffMs;
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= this.maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
                lastError = e;
                log.warn("Key vault {} attempt {}/{} failed: {}", operation, attempt, this.maxAttempts,
                        LogSanitizer.sanitize(e.getMessage()));
                if (attempt < this.maxAttempts) {
                    pause(backoff);
                    backoff *= 2;
                }
            }
        }
        throw new KeyVaultUnavailableException("Key vault " + operation + " failed after " + this.maxAttempts + " attempts", lastError);
    }

    private static void pause(long millis) {
        if (millis <= 0L) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KeyVaultUnavailableException("Interrupted while waiting for the key vault", e);
        }
    }
}
