package com.securehealth.audit;

/**
 * Counts over the audit trail. The grant/deny split covers the last 24 hours.
 */
public record AuditStats(long total, long last24Hours, long grantsLast24Hours, long deniesLast24Hours) {
}
