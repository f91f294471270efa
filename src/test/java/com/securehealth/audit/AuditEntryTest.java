package com.securehealth.audit;

import com.securehealth.model.EntityType;
import com.securehealth.model.Principal;
import com.securehealth.model.Role;
import com.securehealth.policy.Action;
import com.securehealth.policy.PolicyDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditEntryTest {

    @Test
    @DisplayName("Should record a policy grant with sorted matched roles")
    void shouldRecordGrant() {
        Principal principal = Principal.staff("u-1", "dr.smith", Role.CLINICIAN, Role.CARE_SUPPORT);
        PolicyDecision decision = PolicyDecision.grant(Set.of(Role.CLINICIAN, Role.CARE_SUPPORT), "Allowed");

        AuditEntry entry = AuditEntry.policyDecision(principal, EntityType.PATIENT, Action.VIEW, "p-1", decision);

        assertThat(entry.getEventType()).isEqualTo(AuditEntry.EventType.POLICY_DECISION);
        assertThat(entry.getDecision()).isEqualTo(AuditEntry.Decision.GRANT);
        assertThat(entry.getOutcome()).isEqualTo("GRANTED");
        assertThat(entry.getEntityType()).isEqualTo("PATIENT");
        assertThat(entry.getTimestamp()).isNotNull();
        assertThat(entry.getDetails()).containsEntry("matchedRoles", List.of("CARE_SUPPORT", "CLINICIAN"));
    }

    @Test
    @DisplayName("Should carry a distinct id before it is persisted")
    void shouldAssignIdOnConstruction() {
        AuditEntry first = AuditEntry.create(AuditEntry.EventType.DATA_READ, "VIEW");
        AuditEntry second = AuditEntry.create(AuditEntry.EventType.DATA_READ, "VIEW");

        assertThat(first.getId()).isNotBlank();
        assertThat(first.getId()).isNotEqualTo(second.getId());
    }

    @Test
    @DisplayName("Should expose read-only details")
    void shouldBeReadOnly() {
        AuditEntry entry = AuditEntry.create(AuditEntry.EventType.DATA_READ, "VIEW").withDetail("recordCount", 1);

        assertThatThrownBy(() -> entry.getDetails().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
