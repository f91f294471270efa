package com.securehealth.audit;

import com.securehealth.model.EntityType;
import com.securehealth.model.Principal;
import com.securehealth.model.Role;
import com.securehealth.policy.Action;
import com.securehealth.policy.PolicyDecision;
import org.bson.types.ObjectId;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One immutable row of the audit trail. Only ever inserted; there is no update path.
 */
@Document(collection = "audit_log")
public class AuditEntry {
    @Id
    private String id;
    @Indexed
    private Instant timestamp;
    @Indexed
    private EventType eventType;
    @Indexed
    private String actorId;
    private String actorName;
    private List<String> actorRoles = new ArrayList<>();
    @Indexed
    private String action;
    @Indexed
    private String entityType;
    private String entityId;
    @Indexed
    private Decision decision;
    private String outcome;
    private Map<String, Object> details = new LinkedHashMap<>();

    public enum EventType {
        POLICY_DECISION,
        DATA_CREATE,
        DATA_UPDATE,
        DATA_DELETE,
        DATA_READ,
        KEY_CREATED
    }

    public enum Decision {
        GRANT,
        DENY
    }

    /**
     * The id is assigned here, not by the database, so a retried insert of the same entry
     * collides with the first one instead of adding a second row.
     */
    public AuditEntry() {
        this.id = new ObjectId().toHexString();
        this.timestamp = Instant.now();
    }

    public static AuditEntry create(EventType eventType, String action) {
        AuditEntry entry = new AuditEntry();
        entry.eventType = eventType;
        entry.action = action;
        entry.decision = Decision.GRANT;
        entry.outcome = "SUCCESS";
        return entry;
    }

    /**
     * Entry for one policy evaluation. ABSTAIN is recorded as a deny; the detail keeps the
     * distinction.
     */
    public static AuditEntry policyDecision(Principal principal, EntityType entityType, Action action,
                                            String entityId, PolicyDecision policyDecision) {
        AuditEntry entry = create(EventType.POLICY_DECISION, action.name())
                .withActor(principal)
                .withEntity(entityType, entityId);
        entry.decision = policyDecision.isGranted() ? Decision.GRANT : Decision.DENY;
        entry.outcome = policyDecision.detail().name();
        entry.details.put("decision", policyDecision.decision().name());
        entry.details.put("reason", policyDecision.reason());
        if (!policyDecision.matchedRoles().isEmpty()) {
            entry.details.put("matchedRoles", policyDecision.matchedRoles().stream().map(Role::name).sorted().toList());
        }
        return entry;
    }

    public AuditEntry withActor(Principal principal) {
        if (principal != null) {
            this.actorId = principal.auditId();
            this.actorName = principal.username();
            this.actorRoles = principal.roles().stream().map(Role::name).sorted().toList();
        }
        return this;
    }

    /**
     * Actor for operations the core performs on its own behalf, such as key creation.
     */
    public AuditEntry withSystemActor(String component) {
        this.actorId = "SYSTEM";
        this.actorName = component;
        this.actorRoles = List.of();
        return this;
    }

    public AuditEntry withEntity(EntityType entityType, String entityId) {
        this.entityType = entityType != null ? entityType.name() : null;
        this.entityId = entityId;
        return this;
    }

    public AuditEntry withDetail(String key, Object value) {
        this.details.put(key, value);
        return this;
    }

    public String getId() {
        return this.id;
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }

    public EventType getEventType() {
        return this.eventType;
    }

    public String getActorId() {
        return this.actorId;
    }

    public String getActorName() {
        return this.actorName;
    }

    public List<String> getActorRoles() {
        return Collections.unmodifiableList(this.actorRoles);
    }

    public String getAction() {
        return this.action;
    }

    public String getEntityType() {
        return this.entityType;
    }

    public String getEntityId() {
        return this.entityId;
    }

    public Decision getDecision() {
        return this.decision;
    }

    public String getOutcome() {
        return this.outcome;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(this.details);
    }
}
