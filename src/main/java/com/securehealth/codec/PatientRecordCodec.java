package com.securehealth.codec;

import com.securehealth.crypto.FieldEncryptionEngine;
import com.securehealth.model.ClinicalNote;
import com.securehealth.model.EntityType;
import com.securehealth.model.Patient;
import org.bson.Document;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class PatientRecordCodec extends AbstractRecordCodec<Patient> {
    private static final List<FieldMapping<Patient>> FIELDS = List.of(
            FieldMapping.of("firstName", Patient::getFirstName, (p, v) -> p.setFirstName(asString(v))),
            FieldMapping.of("lastName", Patient::getLastName, (p, v) -> p.setLastName(asString(v))),
            FieldMapping.of("email", Patient::getEmail, (p, v) -> p.setEmail(asString(v))),
            FieldMapping.of("phoneNumber", Patient::getPhoneNumber, (p, v) -> p.setPhoneNumber(asString(v))),
            FieldMapping.of("birthDate", Patient::getBirthDate, (p, v) -> p.setBirthDate(asLocalDate(v))),
            FieldMapping.of("ssn", Patient::getSsn, (p, v) -> p.setSsn(asString(v))),
            FieldMapping.of("diagnosis", Patient::getDiagnosis, (p, v) -> p.setDiagnosis(asStringList(v))),
            FieldMapping.of("medications", Patient::getMedications, (p, v) -> p.setMedications(asStringList(v))),
            FieldMapping.of("insuranceDetails", p -> p.getInsuranceDetails() != null ? new Document(p.getInsuranceDetails()) : null,
                    (p, v) -> p.setInsuranceDetails(asMap(v))),
            FieldMapping.of("notes", Patient::getNotes, (p, v) -> p.setNotes(asString(v))),
            FieldMapping.of("notesHistory", PatientRecordCodec::notesToStorage, (p, v) -> p.setNotesHistory(notesFromStorage(v))),
            FieldMapping.of("createdAt", p -> toDate(p.getCreatedAt()), (p, v) -> p.setCreatedAt(asInstant(v))),
            FieldMapping.of("updatedAt", p -> toDate(p.getUpdatedAt()), (p, v) -> p.setUpdatedAt(asInstant(v))),
            FieldMapping.of("primaryDoctorId", Patient::getPrimaryDoctorId, (p, v) -> p.setPrimaryDoctorId(asString(v))),
            FieldMapping.of("ownerUserId", Patient::getOwnerUserId, (p, v) -> p.setOwnerUserId(asString(v)))
    );

    public PatientRecordCodec(FieldEncryptionEngine encryptionEngine) {
        super(encryptionEngine);
    }

    @Override
    public String documentType() {
        return EntityType.PATIENT.getDocumentType();
    }

    @Override
    protected List<FieldMapping<Patient>> fields() {
        return FIELDS;
    }

    @Override
    protected Patient newInstance() {
        Patient patient = new Patient();
        patient.setCreatedAt(null);
        return patient;
    }

    @Override
    protected String idOf(Patient entity) {
        return entity.getId();
    }

    @Override
    protected void applyId(Patient entity, String id) {
        entity.setId(id);
    }

    private static List<Document> notesToStorage(Patient patient) {
        List<Document> notes = new ArrayList<>();
        for (ClinicalNote note : patient.getNotesHistory()) {
            notes.add(new Document("content", note.content())
                    .append("authorId", note.authorId())
                    .append("authorName", note.authorName())
                    .append("createdAt", toDate(note.createdAt())));
        }
        return notes;
    }

    private static List<ClinicalNote> notesFromStorage(Object value) {
        List<ClinicalNote> notes = new ArrayList<>();
        if (value == null) {
            return notes;
        }
        for (Object item : (List<?>) value) {
            Document note = (Document) item;
            notes.add(new ClinicalNote(
                    note.getString("content"),
                    note.getString("authorId"),
                    note.getString("authorName"),
                    asInstant(note.get("createdAt"))));
        }
        return notes;
    }
}
