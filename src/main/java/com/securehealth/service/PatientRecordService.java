package com.securehealth.service;

import com.securehealth.audit.AuditEntry;
import com.securehealth.audit.AuditLogWriter;
import com.securehealth.codec.PatientRecordCodec;
import com.securehealth.crypto.EncryptedFieldSchema;
import com.securehealth.crypto.FieldEncryptionEngine;
import com.securehealth.exception.RecordNotFoundException;
import com.securehealth.model.ClinicalNote;
import com.securehealth.model.EntityType;
import com.securehealth.model.Patient;
import com.securehealth.model.Principal;
import com.securehealth.policy.Action;
import com.securehealth.policy.PolicyEvaluator;
import com.securehealth.policy.PolicyTarget;
import com.securehealth.projection.ProjectedView;
import com.securehealth.projection.RoleProjection;
import com.securehealth.store.DocumentStore;
import com.securehealth.util.LogSanitizer;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Patient record operations. Each call is authorized by the policy evaluator first, then goes
 * through the record codec, is shaped by role projection, and leaves a data audit entry.
 */
@Service
public class PatientRecordService {
    private static final Logger log = LoggerFactory.getLogger(PatientRecordService.class);
    static final String COLLECTION = "patients";

    private final PolicyEvaluator policyEvaluator;
    private final DocumentStore documentStore;
    private final PatientRecordCodec codec;
    private final FieldEncryptionEngine encryptionEngine;
    private final RoleProjection roleProjection;
    private final AuditLogWriter auditLogWriter;

    @Value("${securehealth.records.max-page-size:100}")
    private int maxPageSize;

    public PatientRecordService(PolicyEvaluator policyEvaluator, DocumentStore documentStore, PatientRecordCodec codec,
                                FieldEncryptionEngine encryptionEngine, RoleProjection roleProjection,
                                AuditLogWriter auditLogWriter) {
        this.policyEvaluator = policyEvaluator;
        this.documentStore = documentStore;
        this.codec = codec;
        this.encryptionEngine = encryptionEngine;
        this.roleProjection = roleProjection;
        this.auditLogWriter = auditLogWriter;
    }

    /**
     * One patient record, shaped by the caller's roles alone: clinicians see the clinical fields,
     * the front desk sees the basic profile and insurance.
     */
    public ProjectedView view(Principal principal, String patientId) {
        this.policyEvaluator.enforce(principal, EntityType.PATIENT, Action.VIEW, PolicyTarget.patient(patientId));
        Patient patient = load(patientId);
        auditRead(principal, patientId, Action.VIEW, 1);
        return this.roleProjection.project(patient, principal.roles());
    }

    /**
     * Same projection as {@link #view}, but only for callers granted the sensitive subset of the
     * record. A refusal is audited as such.
     */
    public ProjectedView viewSensitive(Principal principal, String patientId) {
        this.policyEvaluator.enforce(principal, EntityType.PATIENT, Action.VIEW_SENSITIVE_SUBSET, PolicyTarget.patient(patientId));
        Patient patient = load(patientId);
        auditRead(principal, patientId, Action.VIEW_SENSITIVE_SUBSET, 1);
        return this.roleProjection.project(patient, principal.roles());
    }

    /**
     * A patient-self caller reading their own record.
     */
    public ProjectedView viewOwnRecord(Principal principal, String patientId) {
        PolicyTarget target = patientId != null ? PolicyTarget.patient(patientId) : null;
        this.policyEvaluator.enforce(principal, EntityType.PATIENT, Action.VIEW_OWN_RECORD_ONLY, target);
        Patient patient = load(patientId);
        auditRead(principal, patientId, Action.VIEW_OWN_RECORD_ONLY, 1);
        return this.roleProjection.project(patient, principal.roles());
    }

    public ProjectedView create(Principal principal, Patient draft) {
        this.policyEvaluator.enforce(principal, EntityType.PATIENT, Action.CREATE);
        prepareNew(draft);
        this.documentStore.insert(COLLECTION, this.codec.toStorage(draft));
        this.auditLogWriter.append(AuditEntry.create(AuditEntry.EventType.DATA_CREATE, Action.CREATE.name())
                .withActor(principal)
                .withEntity(EntityType.PATIENT, draft.getId()));
        log.info("Patient record {} created by {}", draft.getId(), principal.auditId());
        return this.roleProjection.project(draft, principal.roles());
    }

    public ProjectedView update(Principal principal, String patientId, PatientDemographics changes) {
        this.policyEvaluator.enforce(principal, EntityType.PATIENT, Action.EDIT, PolicyTarget.patient(patientId));
        Patient patient = load(patientId);
        List<String> changed = new ArrayList<>();
        if (changes.firstName() != null) {
            patient.setFirstName(changes.firstName());
            changed.add("firstName");
        }
        if (changes.lastName() != null) {
            patient.setLastName(changes.lastName());
            changed.add("lastName");
        }
        if (changes.email() != null) {
            patient.setEmail(changes.email());
            changed.add("email");
        }
        if (changes.phoneNumber() != null) {
            patient.setPhoneNumber(changes.phoneNumber());
            changed.add("phoneNumber");
        }
        if (changes.birthDate() != null) {
            patient.setBirthDate(changes.birthDate());
            changed.add("birthDate");
        }
        save(principal, patient, Action.EDIT, changed);
        return this.roleProjection.project(patient, principal.roles());
    }

    /**
     * Replaces the insurance details. Governed separately from the basic profile.
     */
    public ProjectedView updateInsurance(Principal principal, String patientId, Map<String, Object> insuranceDetails) {
        if (insuranceDetails == null) {
            throw new IllegalArgumentException("Insurance details are required");
        }
        this.policyEvaluator.enforce(principal, EntityType.PATIENT, Action.EDIT_INSURANCE, PolicyTarget.patient(patientId));
        Patient patient = load(patientId);
        patient.setInsuranceDetails(insuranceDetails);
        save(principal, patient, Action.EDIT_INSURANCE, List.of("insuranceDetails"));
        return this.roleProjection.project(patient, principal.roles());
    }

    public ProjectedView updateClinical(Principal principal, String patientId, ClinicalUpdate changes) {
        this.policyEvaluator.enforce(principal, EntityType.PATIENT, Action.EDIT_SENSITIVE_SUBSET, PolicyTarget.patient(patientId));
        Patient patient = load(patientId);
        List<String> changed = new ArrayList<>();
        if (changes.ssn() != null) {
            patient.setSsn(changes.ssn());
            changed.add("ssn");
        }
        if (changes.diagnosis() != null) {
            patient.setDiagnosis(changes.diagnosis());
            changed.add("diagnosis");
        }
        if (changes.medications() != null) {
            patient.setMedications(changes.medications());
            changed.add("medications");
        }
        if (changes.note() != null && !changes.note().isBlank()) {
            patient.addNote(new ClinicalNote(changes.note(), principal.userId(), principal.username(), Instant.now()));
            changed.add("notes");
            changed.add("notesHistory");
        }
        save(principal, patient, Action.EDIT_SENSITIVE_SUBSET, changed);
        return this.roleProjection.project(patient, principal.roles());
    }

    public void delete(Principal principal, String patientId) {
        this.policyEvaluator.enforce(principal, EntityType.PATIENT, Action.DELETE, PolicyTarget.patient(patientId));
        if (!this.documentStore.deleteById(COLLECTION, patientId)) {
            throw new RecordNotFoundException("Patient " + patientId + " not found");
        }
        this.auditLogWriter.append(AuditEntry.create(AuditEntry.EventType.DATA_DELETE, Action.DELETE.name())
                .withActor(principal)
                .withEntity(EntityType.PATIENT, patientId));
        log.warn("Patient record {} deleted by {}", patientId, principal.auditId());
    }

    /**
     * Bulk load. Records missing a first name, last name or email are skipped, as are records
     * whose email matches a stored patient. One audit entry covers the whole batch.
     */
    public PatientImportResult importPatients(Principal principal, List<Patient> records) {
        this.policyEvaluator.enforce(principal, EntityType.PATIENT, Action.IMPORT);
        int imported = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            Patient record = records.get(i);
            if (isBlank(record.getFirstName()) || isBlank(record.getLastName()) || isBlank(record.getEmail())) {
                skipped++;
                errors.add("Record " + (i + 1) + ": missing first name, last name or email");
                continue;
            }
            if (emailExists(record.getEmail())) {
                skipped++;
                continue;
            }
            prepareNew(record);
            this.documentStore.insert(COLLECTION, this.codec.toStorage(record));
            imported++;
        }
        this.auditLogWriter.append(AuditEntry.create(AuditEntry.EventType.DATA_CREATE, Action.IMPORT.name())
                .withActor(principal)
                .withEntity(EntityType.PATIENT, null)
                .withDetail("total", records.size())
                .withDetail("imported", imported)
                .withDetail("skipped", skipped));
        log.info("Imported {} patient record(s) ({} skipped) for {}", imported, skipped, principal.auditId());
        return new PatientImportResult(records.size(), imported, skipped, errors);
    }

    /**
     * Equality search over the deterministically encrypted last name.
     */
    public List<ProjectedView> findByLastName(Principal principal, String lastName) {
        this.policyEvaluator.enforce(principal, EntityType.PATIENT, Action.SEARCH);
        Object token = this.encryptionEngine.equalityToken(EncryptedFieldSchema.PATIENT, "lastName", lastName).toBson();
        List<Document> stored = this.documentStore.findByField(COLLECTION, "lastName", token, this.maxPageSize);
        log.debug("Last name search {} matched {} record(s)", LogSanitizer.valueSummary(lastName), stored.size());
        return decodeAll(principal, stored, Action.SEARCH);
    }

    /**
     * Range search over the order tokens of the encrypted birth date, inclusive on both ends.
     * Either bound may be null.
     */
    public List<ProjectedView> findByBirthDateRange(Principal principal, LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("Range start is after range end");
        }
        this.policyEvaluator.enforce(principal, EntityType.PATIENT, Action.SEARCH);
        FieldEncryptionEngine.RangeBounds bounds = this.encryptionEngine.rangeBounds(EncryptedFieldSchema.PATIENT, "birthDate", from, to);
        List<Document> stored = this.documentStore.findByRangeToken(COLLECTION, "birthDate", bounds.lower(), bounds.upper(), this.maxPageSize);
        return decodeAll(principal, stored, Action.SEARCH);
    }

    public List<ProjectedView> list(Principal principal, int limit) {
        this.policyEvaluator.enforce(principal, EntityType.PATIENT, Action.VIEW);
        int pageSize = limit <= 0 ? this.maxPageSize : Math.min(limit, this.maxPageSize);
        return decodeAll(principal, this.documentStore.findAll(COLLECTION, pageSize), Action.VIEW);
    }

    private List<ProjectedView> decodeAll(Principal principal, List<Document> stored, Action action) {
        List<ProjectedView> views = new ArrayList<>(stored.size());
        for (Document document : stored) {
            Patient patient = this.codec.fromStorage(document);
            views.add(this.roleProjection.project(patient, principal.roles()));
        }
        auditRead(principal, null, action, views.size());
        return views;
    }

    private boolean emailExists(String email) {
        Object token = this.encryptionEngine.equalityToken(EncryptedFieldSchema.PATIENT, "email", email).toBson();
        return !this.documentStore.findByField(COLLECTION, "email", token, 1).isEmpty();
    }

    private static void prepareNew(Patient patient) {
        if (patient.getId() == null) {
            patient.setId(new ObjectId().toHexString());
        }
        Instant now = Instant.now();
        patient.setCreatedAt(now);
        patient.setUpdatedAt(now);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private Patient load(String patientId) {
        return this.documentStore.findById(COLLECTION, patientId)
                .map(this.codec::fromStorage)
                .orElseThrow(() -> new RecordNotFoundException("Patient " + patientId + " not found"));
    }

    private void save(Principal principal, Patient patient, Action action, List<String> changed) {
        patient.setUpdatedAt(Instant.now());
        this.documentStore.replace(COLLECTION, this.codec.toStorage(patient));
        this.auditLogWriter.append(AuditEntry.create(AuditEntry.EventType.DATA_UPDATE, action.name())
                .withActor(principal)
                .withEntity(EntityType.PATIENT, patient.getId())
                .withDetail("changedFields", changed));
        log.info("Patient record {} updated by {} ({} field(s))", patient.getId(), principal.auditId(), changed.size());
    }

    private void auditRead(Principal principal, String patientId, Action action, int count) {
        this.auditLogWriter.append(AuditEntry.create(AuditEntry.EventType.DATA_READ, action.name())
                .withActor(principal)
                .withEntity(EntityType.PATIENT, patientId)
                .withDetail("recordCount", count));
    }
}
