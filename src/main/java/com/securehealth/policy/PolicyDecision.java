package com.securehealth.policy;

import com.securehealth.model.Role;

import java.util.Set;

/**
 * Result of evaluating one (principal, entity type, action, target) request.
 */
public record PolicyDecision(
        Decision decision,
        Detail detail,
        String reason,
        Set<Role> matchedRoles
) {
    public enum Decision {
        GRANT,
        DENY,
        ABSTAIN
    }

    /**
     * Why the decision came out the way it did. Recorded verbatim in the audit trail.
     */
    public enum Detail {
        GRANTED,
        UNAUTHENTICATED,
        MISSING_SUBJECT,
        EXPLICIT_DENY,
        OWNERSHIP_MISMATCH,
        NO_APPLICABLE_RULE
    }

    public PolicyDecision {
        matchedRoles = matchedRoles == null ? Set.of() : Set.copyOf(matchedRoles);
    }

    public static PolicyDecision grant(Set<Role> matchedRoles, String reason) {
        return new PolicyDecision(Decision.GRANT, Detail.GRANTED, reason, matchedRoles);
    }

    public static PolicyDecision deny(Detail detail, Set<Role> matchedRoles, String reason) {
        return new PolicyDecision(Decision.DENY, detail, reason, matchedRoles);
    }

    public static PolicyDecision abstain(String reason) {
        return new PolicyDecision(Decision.ABSTAIN, Detail.NO_APPLICABLE_RULE, reason, Set.of());
    }

    public boolean isGranted() {
        return decision == Decision.GRANT;
    }

    public boolean isDenied() {
        return decision == Decision.DENY;
    }

    public boolean isAbstain() {
        return decision == Decision.ABSTAIN;
    }
}
