package com.securehealth.service;

import com.securehealth.audit.AuditEntry;
import com.securehealth.audit.AuditLogWriter;
import com.securehealth.codec.MedicalKnowledgeRecordCodec;
import com.securehealth.exception.RecordNotFoundException;
import com.securehealth.model.EntityType;
import com.securehealth.model.MedicalKnowledge;
import com.securehealth.model.Principal;
import com.securehealth.policy.Action;
import com.securehealth.policy.PolicyEvaluator;
import com.securehealth.policy.PolicyTarget;
import com.securehealth.projection.ProjectedView;
import com.securehealth.projection.RoleProjection;
import com.securehealth.store.DocumentStore;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class MedicalKnowledgeService {
    private static final Logger log = LoggerFactory.getLogger(MedicalKnowledgeService.class);
    static final String COLLECTION = "medical_knowledge";

    // Knowledge-base actions and the field each one looks terms up in.
    private static final Map<Action, String> REFERENCE_FIELDS = new EnumMap<>(Map.of(
            Action.CLINICAL_DECISION_SUPPORT, "relatedConditions",
            Action.TREATMENT_GUIDELINES, "relatedConditions",
            Action.DIAGNOSTIC_CRITERIA, "relatedConditions",
            Action.DRUG_INTERACTIONS, "relatedMedications"
    ));

    private final PolicyEvaluator policyEvaluator;
    private final DocumentStore documentStore;
    private final MedicalKnowledgeRecordCodec codec;
    private final RoleProjection roleProjection;
    private final AuditLogWriter auditLogWriter;

    @Value("${securehealth.records.max-page-size:100}")
    private int maxPageSize;

    public MedicalKnowledgeService(PolicyEvaluator policyEvaluator, DocumentStore documentStore,
                                   MedicalKnowledgeRecordCodec codec, RoleProjection roleProjection,
                                   AuditLogWriter auditLogWriter) {
        this.policyEvaluator = policyEvaluator;
        this.documentStore = documentStore;
        this.codec = codec;
        this.roleProjection = roleProjection;
        this.auditLogWriter = auditLogWriter;
    }

    public ProjectedView view(Principal principal, String entryId) {
        this.policyEvaluator.enforce(principal, EntityType.MEDICAL_KNOWLEDGE, Action.VIEW, PolicyTarget.of(entryId));
        return this.roleProjection.project(load(entryId), principal.roles());
    }

    /**
     * Active entries carrying the tag, the specialty, or both when both are given.
     */
    public List<ProjectedView> search(Principal principal, String tag, String specialty, int limit) {
        if (tag == null && specialty == null) {
            throw new IllegalArgumentException("A tag or a specialty is required");
        }
        this.policyEvaluator.enforce(principal, EntityType.MEDICAL_KNOWLEDGE, Action.SEARCH);
        List<Document> stored = tag != null
                ? this.documentStore.findByField(COLLECTION, "tags", tag, pageSize(limit))
                : this.documentStore.findByField(COLLECTION, "specialties", specialty, pageSize(limit));
        List<ProjectedView> views = new ArrayList<>();
        for (Document document : stored) {
            MedicalKnowledge entry = this.codec.fromStorage(document);
            if (entry.isActive() && (specialty == null || entry.getSpecialties().contains(specialty))) {
                views.add(this.roleProjection.project(entry, principal.roles()));
            }
        }
        return views;
    }

    /**
     * Reference lookup for one of the knowledge-base actions, e.g. interactions for a medication
     * or guidelines for a condition.
     */
    public List<ProjectedView> clinicalReference(Principal principal, Action action, String term, int limit) {
        String field = REFERENCE_FIELDS.get(action);
        if (field == null) {
            throw new IllegalArgumentException(action + " is not a knowledge-base reference action");
        }
        this.policyEvaluator.enforce(principal, EntityType.MEDICAL_KNOWLEDGE, action);
        List<ProjectedView> views = new ArrayList<>();
        for (Document document : this.documentStore.findByField(COLLECTION, field, term, pageSize(limit))) {
            MedicalKnowledge entry = this.codec.fromStorage(document);
            if (entry.isActive()) {
                views.add(this.roleProjection.project(entry, principal.roles()));
            }
        }
        return views;
    }

    public ProjectedView create(Principal principal, MedicalKnowledge entry) {
        this.policyEvaluator.enforce(principal, EntityType.MEDICAL_KNOWLEDGE, Action.CREATE);
        prepareNew(principal, entry);
        this.documentStore.insert(COLLECTION, this.codec.toStorage(entry));
        this.auditLogWriter.append(AuditEntry.create(AuditEntry.EventType.DATA_CREATE, Action.CREATE.name())
                .withActor(principal)
                .withEntity(EntityType.MEDICAL_KNOWLEDGE, entry.getId()));
        return this.roleProjection.project(entry, principal.roles());
    }

    /**
     * Replaces the editable content of an entry. Identity and provenance are kept.
     */
    public ProjectedView edit(Principal principal, String entryId, MedicalKnowledge changes) {
        this.policyEvaluator.enforce(principal, EntityType.MEDICAL_KNOWLEDGE, Action.EDIT, PolicyTarget.of(entryId));
        MedicalKnowledge existing = load(entryId);
        changes.setId(existing.getId());
        changes.setCreatedAt(existing.getCreatedAt());
        changes.setCreatedBy(existing.getCreatedBy());
        changes.setUpdatedAt(Instant.now());
        this.documentStore.replace(COLLECTION, this.codec.toStorage(changes));
        this.auditLogWriter.append(AuditEntry.create(AuditEntry.EventType.DATA_UPDATE, Action.EDIT.name())
                .withActor(principal)
                .withEntity(EntityType.MEDICAL_KNOWLEDGE, entryId));
        return this.roleProjection.project(changes, principal.roles());
    }

    public void delete(Principal principal, String entryId) {
        this.policyEvaluator.enforce(principal, EntityType.MEDICAL_KNOWLEDGE, Action.DELETE, PolicyTarget.of(entryId));
        if (!this.documentStore.deleteById(COLLECTION, entryId)) {
            throw new RecordNotFoundException("Knowledge entry " + entryId + " not found");
        }
        this.auditLogWriter.append(AuditEntry.create(AuditEntry.EventType.DATA_DELETE, Action.DELETE.name())
                .withActor(principal)
                .withEntity(EntityType.MEDICAL_KNOWLEDGE, entryId));
    }

    /**
     * Bulk load. Entries missing a title or content are skipped and counted.
     *
     * @return number of entries imported
     */
    public int importEntries(Principal principal, List<MedicalKnowledge> entries) {
        this.policyEvaluator.enforce(principal, EntityType.MEDICAL_KNOWLEDGE, Action.IMPORT);
        int imported = 0;
        int skipped = 0;
        for (MedicalKnowledge entry : entries) {
            if (isBlank(entry.getTitle()) || isBlank(entry.getContent())) {
                skipped++;
                continue;
            }
            prepareNew(principal, entry);
            this.documentStore.insert(COLLECTION, this.codec.toStorage(entry));
            imported++;
        }
        this.auditLogWriter.append(AuditEntry.create(AuditEntry.EventType.DATA_CREATE, Action.IMPORT.name())
                .withActor(principal)
                .withEntity(EntityType.MEDICAL_KNOWLEDGE, null)
                .withDetail("imported", imported)
                .withDetail("skipped", skipped));
        log.info("Imported {} knowledge entries ({} skipped) for {}", imported, skipped, principal.auditId());
        return imported;
    }

    private void prepareNew(Principal principal, MedicalKnowledge entry) {
        if (entry.getId() == null) {
            entry.setId(new ObjectId().toHexString());
        }
        Instant now = Instant.now();
        entry.setCreatedAt(now);
        entry.setUpdatedAt(now);
        entry.setCreatedBy(principal.auditId());
    }

    private MedicalKnowledge load(String entryId) {
        return this.documentStore.findById(COLLECTION, entryId)
                .map(this.codec::fromStorage)
                .orElseThrow(() -> new RecordNotFoundException("Knowledge entry " + entryId + " not found"));
    }

    private int pageSize(int limit) {
        return limit <= 0 ? this.maxPageSize : Math.min(limit, this.maxPageSize);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
