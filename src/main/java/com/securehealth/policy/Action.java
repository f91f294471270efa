package com.securehealth.policy;

/**
 * Operations a principal may request on a governed entity type.
 */
public enum Action {
    VIEW(false),
    VIEW_SENSITIVE_SUBSET(true),
    CREATE(false),
    EDIT(true),
    EDIT_SENSITIVE_SUBSET(true),
    EDIT_INSURANCE(true),
    DELETE(true),
    SEARCH(false),
    IMPORT(false),
    VIEW_AGGREGATE_STATS(false),
    VIEW_OWN_RECORD_ONLY(true),
    CLINICAL_DECISION_SUPPORT(false),
    DRUG_INTERACTIONS(false),
    TREATMENT_GUIDELINES(false),
    DIAGNOSTIC_CRITERIA(false);

    private final boolean requiresTarget;

    Action(boolean requiresTarget) {
        this.requiresTarget = requiresTarget;
    }

    /**
     * Whether the action is only meaningful against one concrete record.
     */
    public boolean requiresTarget() {
        return this.requiresTarget;
    }
}
