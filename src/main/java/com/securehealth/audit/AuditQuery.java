package com.securehealth.audit;

import java.time.Instant;

/**
 * Filter for reading the audit trail. Null fields do not constrain the result.
 */
public record AuditQuery(
        Instant since,
        Instant until,
        String action,
        String entityType,
        AuditEntry.Decision decision,
        int limit
) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 500;

    public AuditQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
    }

    public static AuditQuery recent(int limit) {
        return new AuditQuery(null, null, null, null, null, limit);
    }
}
