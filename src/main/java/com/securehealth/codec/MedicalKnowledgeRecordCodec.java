package com.securehealth.codec;

import com.securehealth.crypto.FieldEncryptionEngine;
import com.securehealth.model.EntityType;
import com.securehealth.model.MedicalKnowledge;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Knowledge entries carry no classified fields, so every attribute passes through as stored.
 */
@Component
public class MedicalKnowledgeRecordCodec extends AbstractRecordCodec<MedicalKnowledge> {
    private static final List<FieldMapping<MedicalKnowledge>> FIELDS = List.of(
            FieldMapping.of("title", MedicalKnowledge::getTitle, (k, v) -> k.setTitle(asString(v))),
            FieldMapping.of("content", MedicalKnowledge::getContent, (k, v) -> k.setContent(asString(v))),
            FieldMapping.of("summary", MedicalKnowledge::getSummary, (k, v) -> k.setSummary(asString(v))),
            FieldMapping.of("tags", MedicalKnowledge::getTags, (k, v) -> k.setTags(asStringList(v))),
            FieldMapping.of("specialties", MedicalKnowledge::getSpecialties, (k, v) -> k.setSpecialties(asStringList(v))),
            FieldMapping.of("source", MedicalKnowledge::getSource, (k, v) -> k.setSource(asString(v))),
            FieldMapping.of("sourceUrl", MedicalKnowledge::getSourceUrl, (k, v) -> k.setSourceUrl(asString(v))),
            FieldMapping.of("confidenceLevel", MedicalKnowledge::getConfidenceLevel,
                    (k, v) -> k.setConfidenceLevel(v != null ? ((Number) v).intValue() : 5)),
            FieldMapping.of("evidenceLevel", MedicalKnowledge::getEvidenceLevel,
                    (k, v) -> k.setEvidenceLevel(v != null ? ((Number) v).intValue() : 3)),
            FieldMapping.of("relatedConditions", MedicalKnowledge::getRelatedConditions, (k, v) -> k.setRelatedConditions(asStringList(v))),
            FieldMapping.of("relatedMedications", MedicalKnowledge::getRelatedMedications, (k, v) -> k.setRelatedMedications(asStringList(v))),
            FieldMapping.of("relatedProcedures", MedicalKnowledge::getRelatedProcedures, (k, v) -> k.setRelatedProcedures(asStringList(v))),
            FieldMapping.of("requiresReview", MedicalKnowledge::isRequiresReview, (k, v) -> k.setRequiresReview(Boolean.TRUE.equals(v))),
            FieldMapping.of("active", MedicalKnowledge::isActive, (k, v) -> k.setActive(v == null || Boolean.TRUE.equals(v))),
            FieldMapping.of("createdAt", k -> toDate(k.getCreatedAt()), (k, v) -> k.setCreatedAt(asInstant(v))),
            FieldMapping.of("updatedAt", k -> toDate(k.getUpdatedAt()), (k, v) -> k.setUpdatedAt(asInstant(v))),
            FieldMapping.of("createdBy", MedicalKnowledge::getCreatedBy, (k, v) -> k.setCreatedBy(asString(v)))
    );

    public MedicalKnowledgeRecordCodec(FieldEncryptionEngine encryptionEngine) {
        super(encryptionEngine);
    }

    @Override
    public String documentType() {
        return EntityType.MEDICAL_KNOWLEDGE.getDocumentType();
    }

    @Override
    protected List<FieldMapping<MedicalKnowledge>> fields() {
        return FIELDS;
    }

    @Override
    protected MedicalKnowledge newInstance() {
        MedicalKnowledge knowledge = new MedicalKnowledge();
        knowledge.setCreatedAt(null);
        return knowledge;
    }

    @Override
    protected String idOf(MedicalKnowledge entity) {
        return entity.getId();
    }

    @Override
    protected void applyId(MedicalKnowledge entity, String id) {
        entity.setId(id);
    }
}
