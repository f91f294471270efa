package com.securehealth.policy;

import com.securehealth.model.EntityType;
import com.securehealth.model.Role;

import static com.securehealth.policy.Action.CLINICAL_DECISION_SUPPORT;
import static com.securehealth.policy.Action.CREATE;
import static com.securehealth.policy.Action.DELETE;
import static com.securehealth.policy.Action.DIAGNOSTIC_CRITERIA;
import static com.securehealth.policy.Action.DRUG_INTERACTIONS;
import static com.securehealth.policy.Action.EDIT;
import static com.securehealth.policy.Action.EDIT_INSURANCE;
import static com.securehealth.policy.Action.EDIT_SENSITIVE_SUBSET;
import static com.securehealth.policy.Action.IMPORT;
import static com.securehealth.policy.Action.SEARCH;
import static com.securehealth.policy.Action.TREATMENT_GUIDELINES;
import static com.securehealth.policy.Action.VIEW;
import static com.securehealth.policy.Action.VIEW_AGGREGATE_STATS;
import static com.securehealth.policy.Action.VIEW_OWN_RECORD_ONLY;
import static com.securehealth.policy.Action.VIEW_SENSITIVE_SUBSET;

/**
 * Production rule table.
 *
 * <p>Administrators manage accounts, insurance and the knowledge base but are explicitly denied
 * clinical content; the deny holds even when the same principal also carries a clinical role.
 */
public final class DefaultPolicyRules {

    private DefaultPolicyRules() {
    }

    public static PolicyRuleTable create() {
        return PolicyRuleTable.builder()
                // patient records
                .allow(EntityType.PATIENT, Role.CLINICIAN,
                        VIEW, VIEW_SENSITIVE_SUBSET, CREATE, EDIT, EDIT_SENSITIVE_SUBSET, EDIT_INSURANCE, DELETE, SEARCH,
                        IMPORT, VIEW_AGGREGATE_STATS)
                .allow(EntityType.PATIENT, Role.CARE_SUPPORT,
                        VIEW, VIEW_SENSITIVE_SUBSET, CREATE, EDIT, SEARCH)
                .allow(EntityType.PATIENT, Role.FRONT_DESK,
                        VIEW, CREATE, EDIT_INSURANCE, SEARCH)
                .allow(EntityType.PATIENT, Role.ADMINISTRATOR,
                        VIEW, EDIT_INSURANCE, SEARCH, VIEW_AGGREGATE_STATS)
                .deny(EntityType.PATIENT, Role.ADMINISTRATOR,
                        VIEW_SENSITIVE_SUBSET, EDIT_SENSITIVE_SUBSET, CREATE, EDIT, DELETE, IMPORT)
                .allow(EntityType.PATIENT, Role.PATIENT_SELF,
                        VIEW_OWN_RECORD_ONLY)
                // knowledge base
                .allow(EntityType.MEDICAL_KNOWLEDGE, Role.CLINICIAN,
                        VIEW, SEARCH, CREATE, EDIT, VIEW_AGGREGATE_STATS,
                        CLINICAL_DECISION_SUPPORT, DRUG_INTERACTIONS, TREATMENT_GUIDELINES, DIAGNOSTIC_CRITERIA)
                .allow(EntityType.MEDICAL_KNOWLEDGE, Role.CARE_SUPPORT,
                        VIEW, DRUG_INTERACTIONS)
                .allow(EntityType.MEDICAL_KNOWLEDGE, Role.ADMINISTRATOR,
                        SEARCH, CREATE, EDIT, DELETE, IMPORT, VIEW_AGGREGATE_STATS)
                .deny(EntityType.MEDICAL_KNOWLEDGE, Role.ADMINISTRATOR,
                        CLINICAL_DECISION_SUPPORT, DRUG_INTERACTIONS, TREATMENT_GUIDELINES, DIAGNOSTIC_CRITERIA)
                // audit trail
                .allow(EntityType.AUDIT_LOG, Role.ADMINISTRATOR,
                        VIEW, SEARCH, VIEW_AGGREGATE_STATS)
                .build();
    }
}
