package com.securehealth.audit;

import java.time.Instant;
import java.util.List;

/**
 * Append-only sink for audit entries plus its read surface.
 */
public interface AuditLogWriter {

    /**
     * Persists the entry. Throws {@link com.securehealth.exception.AuditWriteFailureException}
     * when the entry could not be written; callers must not proceed in that case.
     */
    void append(AuditEntry entry);

    /**
     * Matching entries, newest first, at most {@link AuditQuery#MAX_LIMIT}.
     */
    List<AuditEntry> query(AuditQuery query);

    long count();

    long countSince(Instant since);

    AuditStats stats();
}
