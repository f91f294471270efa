package com.securehealth.policy;

/**
 * The concrete record an action is aimed at.
 *
 * @param entityId record id
 * @param ownerId  patient record id that owns the target, compared against a patient-self
 *                 principal's linked record
 */
public record PolicyTarget(String entityId, String ownerId) {

    public static PolicyTarget of(String entityId) {
        return new PolicyTarget(entityId, null);
    }

    /**
     * Target for a patient record, which is owned by itself.
     */
    public static PolicyTarget patient(String patientId) {
        return new PolicyTarget(patientId, patientId);
    }
}
