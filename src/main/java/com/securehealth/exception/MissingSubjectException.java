package com.securehealth.exception;

import com.securehealth.policy.PolicyDecision;

public class MissingSubjectException extends PhiCoreException {
    private final transient PolicyDecision decision;

    public MissingSubjectException(PolicyDecision decision) {
        super(ErrorKind.MISSING_SUBJECT, decision.reason());
        this.decision = decision;
    }

    public PolicyDecision getDecision() {
        return this.decision;
    }
}
