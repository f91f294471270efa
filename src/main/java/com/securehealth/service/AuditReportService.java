package com.securehealth.service;

import com.securehealth.audit.AuditEntry;
import com.securehealth.audit.AuditLogWriter;
import com.securehealth.audit.AuditQuery;
import com.securehealth.audit.AuditStats;
import com.securehealth.model.EntityType;
import com.securehealth.model.Principal;
import com.securehealth.policy.Action;
import com.securehealth.policy.PolicyEvaluator;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read access to the audit trail. Reading it is itself a governed, audited action.
 */
@Service
public class AuditReportService {
    private final PolicyEvaluator policyEvaluator;
    private final AuditLogWriter auditLogWriter;

    public AuditReportService(PolicyEvaluator policyEvaluator, AuditLogWriter auditLogWriter) {
        this.policyEvaluator = policyEvaluator;
        this.auditLogWriter = auditLogWriter;
    }

    public List<AuditEntry> recentEntries(Principal principal, AuditQuery query) {
        this.policyEvaluator.enforce(principal, EntityType.AUDIT_LOG, Action.VIEW);
        return this.auditLogWriter.query(query);
    }

    public AuditStats stats(Principal principal) {
        this.policyEvaluator.enforce(principal, EntityType.AUDIT_LOG, Action.VIEW_AGGREGATE_STATS);
        return this.auditLogWriter.stats();
    }
}
