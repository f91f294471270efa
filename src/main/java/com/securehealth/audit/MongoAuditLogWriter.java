package com.securehealth.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.securehealth.exception.AuditWriteFailureException;
import com.securehealth.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit trail backed by the {@code audit_log} collection.
 *
 * Writes use insert only, so an existing entry can never be overwritten. Entries carry their
 * id from construction, so a retry after a lost acknowledgement cannot duplicate a row. A
 * write that still fails after the configured attempts raises
 * {@link AuditWriteFailureException}; there is no fail-open mode. Every persisted entry is also emitted as one JSON line on the
 * {@code PHI_AUDIT} logger.
 */
@Service
public class MongoAuditLogWriter implements AuditLogWriter {
    private static final Logger log = LoggerFactory.getLogger(MongoAuditLogWriter.class);
    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("PHI_AUDIT");
    static final String COLLECTION = "audit_log";

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    @Value("${securehealth.audit.max-attempts:3}")
    private int maxAttempts;

    @Value("${securehealth.audit.initial-backoff-ms:50}")
    private long initialBackoffMs;

    public MongoAuditLogWriter(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = mongoTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(AuditEntry entry) {
        int attempts = Math.max(1, this.maxAttempts);
        long backoff = Math.max(0L, this.initialBackoffMs);
        DataAccessException lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                this.mongoTemplate.insert(entry, COLLECTION);
                log.debug("Audit entry persisted: {} {} {}", entry.getEventType(), entry.getAction(), entry.getDecision());
                mirror(entry);
                return;
            } catch (DuplicateKeyException e) {
                // an earlier attempt committed before its acknowledgement was lost
                log.info("Audit entry {} already persisted on attempt {}/{}", entry.getId(), attempt, attempts);
                mirror(entry);
                return;
            } catch (DataAccessException e) {
                lastError = e;
                log.warn("Audit write attempt {}/{} failed: {}", attempt, attempts, LogSanitizer.sanitize(e.getMessage()));
                if (attempt < attempts) {
                    sleep(backoff);
                    backoff *= 2;
                }
            }
        }
        log.error("CRITICAL: Audit entry could not be persisted, failing operation closed: {} {}",
                entry.getEventType(), entry.getAction());
        throw new AuditWriteFailureException("Audit write failed after " + attempts + " attempts", lastError);
    }

    @Override
    public List<AuditEntry> query(AuditQuery auditQuery) {
        List<Criteria> criteria = new ArrayList<>();
        if (auditQuery.since() != null || auditQuery.until() != null) {
            Criteria timestamp = Criteria.where("timestamp");
            if (auditQuery.since() != null) {
                timestamp = timestamp.gte(auditQuery.since());
            }
            if (auditQuery.until() != null) {
                timestamp = timestamp.lte(auditQuery.until());
            }
            criteria.add(timestamp);
        }
        if (auditQuery.action() != null) {
            criteria.add(Criteria.where("action").is(auditQuery.action()));
        }
        if (auditQuery.entityType() != null) {
            criteria.add(Criteria.where("entityType").is(auditQuery.entityType()));
        }
        if (auditQuery.decision() != null) {
            criteria.add(Criteria.where("decision").is(auditQuery.decision()));
        }
        Query query = new Query();
        if (!criteria.isEmpty()) {
            query.addCriteria(new Criteria().andOperator(criteria.toArray(new Criteria[0])));
        }
        query.with(Sort.by(Sort.Direction.DESC, "timestamp")).limit(auditQuery.limit());
        return this.mongoTemplate.find(query, AuditEntry.class, COLLECTION);
    }

    @Override
    public long count() {
        return this.mongoTemplate.count(new Query(), AuditEntry.class, COLLECTION);
    }

    @Override
    public long countSince(Instant since) {
        return this.mongoTemplate.count(new Query(Criteria.where("timestamp").gte(since)), AuditEntry.class, COLLECTION);
    }

    @Override
    public AuditStats stats() {
        Instant since = Instant.now().minus(Duration.ofHours(24));
        long grants = this.mongoTemplate.count(new Query(Criteria.where("timestamp").gte(since)
                .and("decision").is(AuditEntry.Decision.GRANT)), AuditEntry.class, COLLECTION);
        long denies = this.mongoTemplate.count(new Query(Criteria.where("timestamp").gte(since)
                .and("decision").is(AuditEntry.Decision.DENY)), AuditEntry.class, COLLECTION);
        return new AuditStats(count(), countSince(since), grants, denies);
    }

    private void mirror(AuditEntry entry) {
        try {
            String json = this.objectMapper.writeValueAsString(toStructuredLog(entry));
            if (entry.getDecision() == AuditEntry.Decision.DENY) {
                AUDIT_LOG.warn(json);
            } else {
                AUDIT_LOG.info(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.warn("Audit {} - actor={}, action={}, entity={}/{}, decision={}, outcome={}",
                    entry.getEventType(),
                    LogSanitizer.sanitize(entry.getActorId()),
                    entry.getAction(),
                    entry.getEntityType(),
                    LogSanitizer.sanitize(entry.getEntityId()),
                    entry.getDecision(),
                    entry.getOutcome());
        }
    }

    static Map<String, Object> toStructuredLog(AuditEntry entry) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("timestamp", String.valueOf(entry.getTimestamp()));
        line.put("eventType", entry.getEventType());
        line.put("actorId", entry.getActorId());
        line.put("actorRoles", entry.getActorRoles());
        line.put("action", entry.getAction());
        line.put("entityType", entry.getEntityType());
        line.put("entityId", entry.getEntityId());
        line.put("decision", entry.getDecision());
        line.put("outcome", entry.getOutcome());
        if (!entry.getDetails().isEmpty()) {
            line.put("details", entry.getDetails());
        }
        return line;
    }

    private static void sleep(long millis) {
        if (millis <= 0L) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuditWriteFailureException("Interrupted while retrying audit write", e);
        }
    }
}
