package com.securehealth.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.mongodb.client.MongoClient;
import com.securehealth.audit.AuditLogWriter;
import com.securehealth.crypto.keyvault.KeyHandle;
import com.securehealth.crypto.keyvault.KeyMaterialLoader;
import com.securehealth.crypto.keyvault.KeyVaultClient;
import com.securehealth.crypto.keyvault.KmsMasterKeyProvider;
import com.securehealth.crypto.keyvault.LocalMasterKeyProvider;
import com.securehealth.crypto.keyvault.MasterKeyProvider;
import com.securehealth.crypto.keyvault.MongoKeyVaultClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.KmsClientBuilder;

import java.net.URI;
import java.time.Duration;

@Configuration
public class KeyVaultConfig {
    private static final Logger log = LoggerFactory.getLogger(KeyVaultConfig.class);

    @Bean
    @ConditionalOnProperty(name = "securehealth.kms.enabled", havingValue = "true")
    public KmsClient kmsClient(@Value("${securehealth.kms.region:}") String region,
                               @Value("${securehealth.kms.endpoint:}") String endpoint) {
        KmsClientBuilder builder = KmsClient.builder();
        if (region != null && !region.isBlank()) {
            builder.region(Region.of(region));
        }
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }
        log.info("KMS client initialized.");
        return builder.build();
    }

    @Bean
    public KeyMaterialLoader keyMaterialLoader(ObjectProvider<KmsClient> kmsClient) {
        return new KeyMaterialLoader(kmsClient.getIfAvailable());
    }

    @Bean
    public MasterKeyProvider masterKeyProvider(KeyMaterialLoader keyMaterialLoader,
                                               ObjectProvider<KmsClient> kmsClient,
                                               @Value("${securehealth.encryption.master-key.provider:local}") String provider,
                                               @Value("${securehealth.encryption.master-key.value:}") String configuredKey,
                                               @Value("${securehealth.encryption.master-key.file:}") String keyFile,
                                               @Value("${securehealth.encryption.master-key.generate-if-missing:false}") boolean generateIfMissing,
                                               @Value("${securehealth.kms.key-arn:}") String keyArn) {
        if ("aws".equalsIgnoreCase(provider)) {
            KmsClient client = kmsClient.getIfAvailable();
            if (client == null) {
                throw new IllegalStateException("Master key provider 'aws' requires securehealth.kms.enabled=true");
            }
            return new KmsMasterKeyProvider(client, keyArn);
        }
        if (!"local".equalsIgnoreCase(provider)) {
            throw new IllegalStateException("Unknown master key provider: " + provider);
        }
        return new LocalMasterKeyProvider(keyMaterialLoader.loadLocalMasterKey(configuredKey, keyFile, generateIfMissing));
    }

    @Bean
    public Cache<String, KeyHandle> dataKeyCache(@Value("${securehealth.encryption.key-cache.max-size:64}") long maxSize,
                                                 @Value("${securehealth.encryption.key-cache.ttl-minutes:60}") long ttlMinutes) {
        return Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(Duration.ofMinutes(ttlMinutes))
                .build();
    }

    @Bean
    public KeyVaultClient keyVaultClient(MongoClient mongoClient,
                                         MasterKeyProvider masterKeyProvider,
                                         Cache<String, KeyHandle> dataKeyCache,
                                         AuditLogWriter auditLogWriter,
                                         @Value("${securehealth.encryption.key-vault-namespace:encryption.__keyVault}") String namespace,
                                         @Value("${securehealth.encryption.key-vault.max-attempts:3}") int maxAttempts,
                                         @Value("${securehealth.encryption.key-vault.initial-backoff-ms:100}") long initialBackoffMs) {
        int dot = namespace.indexOf('.');
        if (dot <= 0 || dot == namespace.length() - 1) {
            throw new IllegalStateException("Key vault namespace must be <database>.<collection>: " + namespace);
        }
        MongoTemplate vaultTemplate = new MongoTemplate(mongoClient, namespace.substring(0, dot));
        MongoKeyVaultClient client = new MongoKeyVaultClient(vaultTemplate, namespace.substring(dot + 1),
                masterKeyProvider, dataKeyCache, auditLogWriter, maxAttempts, initialBackoffMs);
        client.ensureIndexes();
        return client;
    }
}
