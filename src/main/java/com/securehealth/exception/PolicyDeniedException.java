package com.securehealth.exception;

import com.securehealth.policy.PolicyDecision;

/**
 * Raised by {@code enforce} paths when evaluation did not grant. A deny is an expected
 * outcome of evaluation; this exception only carries it across the service boundary.
 */
public class PolicyDeniedException extends PhiCoreException {
    private final transient PolicyDecision decision;

    public PolicyDeniedException(PolicyDecision decision) {
        super(ErrorKind.POLICY_DENY, "Access denied: " + decision.reason());
        this.decision = decision;
    }

    public PolicyDecision getDecision() {
        return this.decision;
    }
}
