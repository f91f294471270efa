package com.securehealth.policy;

public enum RuleEffect {
    ALLOW,
    DENY
}
