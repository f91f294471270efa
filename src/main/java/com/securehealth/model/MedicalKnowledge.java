package com.securehealth.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Clinical reference entry. Contains no patient data, so none of its fields are classified for
 * encryption; it still flows through the record codec and the policy evaluator.
 */
public class MedicalKnowledge implements ProjectableEntity {
    private String id;
    private String title;
    private String content;
    private String summary;
    private List<String> tags = new ArrayList<>();
    private List<String> specialties = new ArrayList<>();
    private String source;
    private String sourceUrl;
    private int confidenceLevel = 5;
    private int evidenceLevel = 3;
    private List<String> relatedConditions = new ArrayList<>();
    private List<String> relatedMedications = new ArrayList<>();
    private List<String> relatedProcedures = new ArrayList<>();
    private boolean requiresReview;
    private boolean active = true;
    private Instant createdAt;
    private Instant updatedAt;
    private String createdBy;

    public MedicalKnowledge() {
        this.createdAt = Instant.now();
    }

    public String getId() {
        return this.id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return this.title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getContent() {
        return this.content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getSummary() {
        return this.summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public List<String> getTags() {
        return this.tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    public List<String> getSpecialties() {
        return this.specialties;
    }

    public void setSpecialties(List<String> specialties) {
        this.specialties = specialties != null ? new ArrayList<>(specialties) : new ArrayList<>();
    }

    public String getSource() {
        return this.source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getSourceUrl() {
        return this.sourceUrl;
    }

    public void setSourceUrl(String sourceUrl) {
        this.sourceUrl = sourceUrl;
    }

    public int getConfidenceLevel() {
        return this.confidenceLevel;
    }

    public void setConfidenceLevel(int confidenceLevel) {
        if (confidenceLevel < 1 || confidenceLevel > 10) {
            throw new IllegalArgumentException("Confidence level must be between 1 and 10");
        }
        this.confidenceLevel = confidenceLevel;
    }

    public int getEvidenceLevel() {
        return this.evidenceLevel;
    }

    public void setEvidenceLevel(int evidenceLevel) {
        if (evidenceLevel < 1 || evidenceLevel > 5) {
            throw new IllegalArgumentException("Evidence level must be between 1 and 5");
        }
        this.evidenceLevel = evidenceLevel;
    }

    public List<String> getRelatedConditions() {
        return this.relatedConditions;
    }

    public void setRelatedConditions(List<String> relatedConditions) {
        this.relatedConditions = relatedConditions != null ? new ArrayList<>(relatedConditions) : new ArrayList<>();
    }

    public List<String> getRelatedMedications() {
        return this.relatedMedications;
    }

    public void setRelatedMedications(List<String> relatedMedications) {
        this.relatedMedications = relatedMedications != null ? new ArrayList<>(relatedMedications) : new ArrayList<>();
    }

    public List<String> getRelatedProcedures() {
        return this.relatedProcedures;
    }

    public void setRelatedProcedures(List<String> relatedProcedures) {
        this.relatedProcedures = relatedProcedures != null ? new ArrayList<>(relatedProcedures) : new ArrayList<>();
    }

    public boolean isRequiresReview() {
        return this.requiresReview;
    }

    public void setRequiresReview(boolean requiresReview) {
        this.requiresReview = requiresReview;
    }

    public boolean isActive() {
        return this.active;
    }

    public void setActive(boolean active) {
        this.active = active;
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

    public String getCreatedBy() {
        return this.createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    @Override
    public EntityType entityType() {
        return EntityType.MEDICAL_KNOWLEDGE;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("id", this.id);
        attributes.put("title", this.title);
        attributes.put("content", this.content);
        attributes.put("summary", this.summary);
        attributes.put("tags", this.tags);
        attributes.put("specialties", this.specialties);
        attributes.put("source", this.source);
        attributes.put("sourceUrl", this.sourceUrl);
        attributes.put("confidenceLevel", this.confidenceLevel);
        attributes.put("evidenceLevel", this.evidenceLevel);
        attributes.put("relatedConditions", this.relatedConditions);
        attributes.put("relatedMedications", this.relatedMedications);
        attributes.put("relatedProcedures", this.relatedProcedures);
        attributes.put("requiresReview", this.requiresReview);
        attributes.put("active", this.active);
        attributes.put("createdAt", this.createdAt);
        attributes.put("updatedAt", this.updatedAt);
        attributes.put("createdBy", this.createdBy);
        return attributes;
    }
}
