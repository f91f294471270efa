package com.securehealth.config;

import com.securehealth.crypto.EncryptedFieldSchema;
import com.securehealth.policy.DefaultPolicyRules;
import com.securehealth.policy.PolicyRuleTable;
import com.securehealth.projection.DefaultVisibilityRules;
import com.securehealth.projection.FieldVisibilityTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Static tables: field classification, policy rules and field visibility.
 */
@Configuration
public class PhiCoreConfig {

    @Bean
    public EncryptedFieldSchema encryptedFieldSchema() {
        return EncryptedFieldSchema.defaultSchema();
    }

    @Bean
    public PolicyRuleTable policyRuleTable() {
        return DefaultPolicyRules.create();
    }

    @Bean
    public FieldVisibilityTable fieldVisibilityTable() {
        return DefaultVisibilityRules.create();
    }
}
