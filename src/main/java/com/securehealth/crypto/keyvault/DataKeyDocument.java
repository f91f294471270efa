package com.securehealth.crypto.keyvault;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Key vault entry. Shape follows the MongoDB client-side encryption key vault layout.
 */
@Document(collection = "__keyVault")
public class DataKeyDocument {
    public static final int STATUS_ACTIVE = 0;

    @Id
    private UUID id;
    private List<String> keyAltNames = new ArrayList<>();
    private byte[] keyMaterial;
    private Map<String, String> masterKey = new LinkedHashMap<>();
    private Instant creationDate;
    private Instant updateDate;
    private int status;

    public DataKeyDocument() {
    }

    public static DataKeyDocument create(UUID id, String keyAltName, byte[] wrappedMaterial, MasterKeyProvider provider) {
        DataKeyDocument document = new DataKeyDocument();
        Instant now = Instant.now();
        document.id = id;
        document.keyAltNames = new ArrayList<>(List.of(keyAltName));
        document.keyMaterial = wrappedMaterial;
        document.masterKey.put("provider", provider.providerName());
        document.masterKey.put("key", provider.masterKeyId());
        document.creationDate = now;
        document.updateDate = now;
        document.status = STATUS_ACTIVE;
        return document;
    }

    public UUID getId() {
        return this.id;
    }

    public List<String> getKeyAltNames() {
        return this.keyAltNames;
    }

    public byte[] getKeyMaterial() {
        return this.keyMaterial;
    }

    public Map<String, String> getMasterKey() {
        return this.masterKey;
    }

    public Instant getCreationDate() {
        return this.creationDate;
    }

    public Instant getUpdateDate() {
        return this.updateDate;
    }

    public int getStatus() {
        return this.status;
    }
}
