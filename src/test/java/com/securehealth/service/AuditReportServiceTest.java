package com.securehealth.service;

import com.securehealth.audit.AuditEntry;
import com.securehealth.audit.AuditQuery;
import com.securehealth.audit.AuditStats;
import com.securehealth.exception.PolicyDeniedException;
import com.securehealth.model.Principal;
import com.securehealth.model.Role;
import com.securehealth.support.PhiCoreFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditReportServiceTest {

    private static final Principal ADMIN = Principal.staff("u-admin", "admin", Role.ADMINISTRATOR);
    private static final Principal DOCTOR = Principal.staff("u-doc", "dr.smith", Role.CLINICIAN);

    private final PhiCoreFixture fixture = new PhiCoreFixture();

    @Test
    @DisplayName("Should show administrators the trail, including their own read")
    void shouldShowAuditTrail() {
        fixture.patients.create(DOCTOR, PhiCoreFixture.samplePatient());

        List<AuditEntry> entries = fixture.auditReports.recentEntries(ADMIN, AuditQuery.recent(10));

        assertThat(entries).extracting(AuditEntry::getAction).contains("CREATE", "VIEW");
        assertThat(entries).extracting(AuditEntry::getActorId).contains("u-doc", "u-admin");
    }

    @Test
    @DisplayName("Should refuse the trail to clinicians and audit the refusal")
    void shouldDenyClinician() {
        assertThatThrownBy(() -> fixture.auditReports.recentEntries(DOCTOR, AuditQuery.recent(10)))
                .isInstanceOf(PolicyDeniedException.class);
        assertThat(fixture.auditLog.entries()).singleElement()
                .satisfies(entry -> assertThat(entry.getEntityType()).isEqualTo("AUDIT_LOG"));
    }

    @Test
    @DisplayName("Should count grants and denies")
    void shouldReportStats() {
        fixture.auditLog.clear();
        assertThatThrownBy(() -> fixture.patients.delete(ADMIN, "p-1")).isInstanceOf(PolicyDeniedException.class);

        AuditStats stats = fixture.auditReports.stats(ADMIN);

        assertThat(stats.deniesLast24Hours()).isEqualTo(1);
        assertThat(stats.grantsLast24Hours()).isEqualTo(1);
        assertThat(stats.total()).isEqualTo(2);
    }
}
