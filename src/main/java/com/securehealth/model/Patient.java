package com.securehealth.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Patient aggregate in plaintext form. Instances only exist in memory; persistence always goes
 * through {@link com.securehealth.codec.PatientRecordCodec}.
 */
public class Patient implements ProjectableEntity {
    private String id;
    private String firstName;
    private String lastName;
    private String email;
    private String phoneNumber;
    private LocalDate birthDate;
    private String ssn;
    private List<String> diagnosis = new ArrayList<>();
    private List<String> medications = new ArrayList<>();
    private Map<String, Object> insuranceDetails;
    private String notes;
    private List<ClinicalNote> notesHistory = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;
    private String primaryDoctorId;
    private String ownerUserId;

    public Patient() {
        this.createdAt = Instant.now();
    }

    public String getId() {
        return this.id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getFirstName() {
        return this.firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return this.lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getEmail() {
        return this.email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPhoneNumber() {
        return this.phoneNumber;
    }

    public void setPhoneNumber(String phoneNumber) {
        this.phoneNumber = phoneNumber;
    }

    public LocalDate getBirthDate() {
        return this.birthDate;
    }

    public void setBirthDate(LocalDate birthDate) {
        this.birthDate = birthDate;
    }

    public String getSsn() {
        return this.ssn;
    }

    public void setSsn(String ssn) {
        this.ssn = ssn;
    }

    public List<String> getDiagnosis() {
        return this.diagnosis;
    }

    public void setDiagnosis(List<String> diagnosis) {
        this.diagnosis = diagnosis != null ? new ArrayList<>(diagnosis) : new ArrayList<>();
    }

    public List<String> getMedications() {
        return this.medications;
    }

    public void setMedications(List<String> medications) {
        this.medications = medications != null ? new ArrayList<>(medications) : new ArrayList<>();
    }

    public Map<String, Object> getInsuranceDetails() {
        return this.insuranceDetails;
    }

    public void setInsuranceDetails(Map<String, Object> insuranceDetails) {
        this.insuranceDetails = insuranceDetails != null ? new LinkedHashMap<>(insuranceDetails) : null;
    }

    public String getNotes() {
        return this.notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public List<ClinicalNote> getNotesHistory() {
        return this.notesHistory;
    }

    public void setNotesHistory(List<ClinicalNote> notesHistory) {
        this.notesHistory = notesHistory != null ? new ArrayList<>(notesHistory) : new ArrayList<>();
    }

    public void addNote(ClinicalNote note) {
        this.notesHistory.add(note);
        this.notes = note.content();
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return this.updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public String getPrimaryDoctorId() {
        return this.primaryDoctorId;
    }

    public void setPrimaryDoctorId(String primaryDoctorId) {
        this.primaryDoctorId = primaryDoctorId;
    }

    public String getOwnerUserId() {
        return this.ownerUserId;
    }

    public void setOwnerUserId(String ownerUserId) {
        this.ownerUserId = ownerUserId;
    }

    @Override
    public EntityType entityType() {
        return EntityType.PATIENT;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("id", this.id);
        attributes.put("firstName", this.firstName);
        attributes.put("lastName", this.lastName);
        attributes.put("email", this.email);
        attributes.put("phoneNumber", this.phoneNumber);
        attributes.put("birthDate", this.birthDate);
        attributes.put("ssn", this.ssn);
        attributes.put("diagnosis", this.diagnosis);
        attributes.put("medications", this.medications);
        attributes.put("insuranceDetails", this.insuranceDetails);
        attributes.put("notes", this.notes);
        attributes.put("notesHistory", this.notesHistory);
        attributes.put("createdAt", this.createdAt);
        attributes.put("updatedAt", this.updatedAt);
        attributes.put("primaryDoctorId", this.primaryDoctorId);
        return attributes;
    }
}
