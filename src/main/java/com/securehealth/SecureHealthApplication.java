package com.securehealth;

import com.securehealth.crypto.keyvault.KeyMaterialLoader;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Environment;

import java.util.Arrays;

@SpringBootApplication
public class SecureHealthApplication {
    private static final Logger log = LoggerFactory.getLogger(SecureHealthApplication.class);
    private final Environment environment;
    private final KeyMaterialLoader keyMaterialLoader;

    public SecureHealthApplication(Environment environment, KeyMaterialLoader keyMaterialLoader) {
        this.environment = environment;
        this.keyMaterialLoader = keyMaterialLoader;
    }

    public static void main(String[] args) {
        SpringApplication.run(SecureHealthApplication.class, args);
    }

    @PostConstruct
    public void validateSecurityConfiguration() {
        boolean isDevProfile = Arrays.stream(this.environment.getActiveProfiles()).anyMatch("dev"::equalsIgnoreCase);
        String provider = this.environment.getProperty("securehealth.encryption.master-key.provider", "local");
        boolean generateAllowed = Boolean.parseBoolean(
                this.environment.getProperty("securehealth.encryption.master-key.generate-if-missing", "false"));

        if ((generateAllowed || this.keyMaterialLoader.isGenerated()) && !isDevProfile) {
            log.error("=================================================================");
            log.error("  CRITICAL SECURITY ERROR: GENERATED MASTER KEY OUTSIDE DEV PROFILE");
            log.error("=================================================================");
            log.error("  A generated master key is lost with the process or key file, and");
            log.error("  every record encrypted under it becomes unreadable.");
            log.error("");
            log.error("  To fix:");
            log.error("    - Set securehealth.encryption.master-key.value or .file");
            log.error("    - Or set securehealth.encryption.master-key.provider=aws");
            log.error("    - And set securehealth.encryption.master-key.generate-if-missing=false");
            log.error("=================================================================");
            throw new SecurityException("Generated master keys are only allowed in the dev profile.");
        }
        if (this.keyMaterialLoader.isGenerated()) {
            log.warn("=================================================================");
            log.warn("  WARNING: DEV MODE MASTER KEY");
            log.warn("  Records written now are bound to a throwaway key.");
            log.warn("=================================================================");
        } else {
            log.info("Security configuration validated:");
            log.info("  Master key provider: {}", provider);
            log.info("  Key vault namespace: {}",
                    this.environment.getProperty("securehealth.encryption.key-vault-namespace", "encryption.__keyVault"));
        }
    }
}
