package com.securehealth.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Caller identity as resolved by the authentication layer. The core only authorizes; it never
 * inspects names or emails to decide what a principal may do.
 *
 * @param userId          stable account id
 * @param username        display/login name, used for audit only
 * @param roles           resolved role set, empty for an unauthenticated caller
 * @param linkedPatientId patient record id owned by a patient-self account, or null
 */
public record Principal(String userId, String username, Set<Role> roles, String linkedPatientId) {

    public Principal {
        roles = roles == null || roles.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(roles));
    }

    public static Principal anonymous() {
        return new Principal(null, "ANONYMOUS", Set.of(), null);
    }

    public static Principal staff(String userId, String username, Role... roles) {
        return new Principal(userId, username, roles.length == 0 ? Set.of() : EnumSet.of(roles[0], roles), null);
    }

    public static Principal patientSelf(String userId, String username, String linkedPatientId) {
        return new Principal(userId, username, Set.of(Role.PATIENT_SELF), linkedPatientId);
    }

    public boolean isAuthenticated() {
        return !this.roles.isEmpty();
    }

    public String auditId() {
        return this.userId != null ? this.userId : "ANONYMOUS";
    }
}
