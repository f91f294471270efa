package com.securehealth.service;

import com.securehealth.audit.AuditEntry;
import com.securehealth.exception.AuditWriteFailureException;
import com.securehealth.exception.MissingSubjectException;
import com.securehealth.exception.PolicyDeniedException;
import com.securehealth.exception.RecordNotFoundException;
import com.securehealth.model.Patient;
import com.securehealth.model.Principal;
import com.securehealth.model.Role;
import com.securehealth.projection.ProjectedView;
import com.securehealth.support.PhiCoreFixture;
import org.bson.Document;
import org.bson.types.Binary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatientRecordServiceTest {

    private static final Principal DOCTOR = Principal.staff("u-doc", "dr.smith", Role.CLINICIAN);
    private static final Principal NURSE = Principal.staff("u-nurse", "nurse.jones", Role.CARE_SUPPORT);
    private static final Principal RECEPTIONIST = Principal.staff("u-desk", "front.desk", Role.FRONT_DESK);
    private static final Principal ADMIN = Principal.staff("u-admin", "admin", Role.ADMINISTRATOR);

    private PhiCoreFixture fixture;
    private PatientRecordService service;
    private String patientId;

    @BeforeEach
    void setUp() {
        this.fixture = new PhiCoreFixture();
        this.service = this.fixture.patients;
        this.patientId = (String) this.service.create(DOCTOR, PhiCoreFixture.samplePatient()).get("id");
        this.fixture.auditLog.clear();
    }

    private List<AuditEntry> policyEntries() {
        return fixture.auditLog.entriesOfType(AuditEntry.EventType.POLICY_DECISION);
    }

    @Nested
    @DisplayName("create()")
    class CreateTest {

        @Test
        @DisplayName("Should store classified fields only as ciphertext")
        void shouldEncryptAtRest() {
            Document stored = fixture.store.raw("patients", patientId);

            assertThat(stored.get("lastName")).isInstanceOf(Binary.class);
            assertThat(stored.get("ssn")).isInstanceOf(Binary.class);
            assertThat(stored.get("primaryDoctorId")).isEqualTo("doctor-1");
        }

        @Test
        @DisplayName("Should refuse creation by an administrator without storing anything")
        void shouldDenyAdminCreate() {
            assertThatThrownBy(() -> service.create(ADMIN, PhiCoreFixture.samplePatient()))
                    .isInstanceOf(PolicyDeniedException.class);
            assertThat(fixture.store.size("patients")).isEqualTo(1);
        }

        @Test
        @DisplayName("Should not write when the audit trail is down")
        void shouldFailClosedWithoutAudit() {
            fixture.auditLog.setUnavailable(true);

            assertThatThrownBy(() -> service.create(DOCTOR, PhiCoreFixture.samplePatient()))
                    .isInstanceOf(AuditWriteFailureException.class);
            assertThat(fixture.store.size("patients")).isEqualTo(1);
        }

        @Test
        @DisplayName("Should audit the creation")
        void shouldAuditCreate() {
            ProjectedView created = service.create(NURSE, PhiCoreFixture.samplePatient());

            List<AuditEntry> creates = fixture.auditLog.entriesOfType(AuditEntry.EventType.DATA_CREATE);
            assertThat(creates).hasSize(1);
            assertThat(creates.get(0).getEntityId()).isEqualTo(created.get("id"));
            assertThat(creates.get(0).getActorId()).isEqualTo("u-nurse");
        }
    }

    @Nested
    @DisplayName("view() / viewSensitive()")
    class ViewTest {

        @Test
        @DisplayName("Should show the clinician the surname and diagnosis through the regular view")
        void shouldShowClinicianDiagnosisOnView() {
            ProjectedView view = service.view(DOCTOR, patientId);

            assertThat(view.get("lastName")).isEqualTo("Smith");
            assertThat(view.get("diagnosis")).isEqualTo(List.of("Hypertension"));
            assertThat(view.get("medications")).isEqualTo(List.of("Lisinopril 10mg"));
        }

        @Test
        @DisplayName("Should show the clinician the full sensitive record")
        void shouldShowClinicianEverything() {
            ProjectedView view = service.viewSensitive(DOCTOR, patientId);

            assertThat(view.get("lastName")).isEqualTo("Smith");
            assertThat(view.get("diagnosis")).isEqualTo(List.of("Hypertension"));
            assertThat(view.get("ssn")).isEqualTo("123-45-6789");
        }

        @Test
        @DisplayName("Should show the front desk the basic view without diagnosis")
        void shouldShowFrontDeskBasics() {
            ProjectedView view = service.view(RECEPTIONIST, patientId);

            assertThat(view.get("lastName")).isEqualTo("Smith");
            assertThat(view.has("diagnosis")).isFalse();
            assertThat(view.has("ssn")).isFalse();
            assertThat(view.has("insuranceDetails")).isTrue();
        }

        @Test
        @DisplayName("Should deny the front desk the sensitive subset with one deny audit entry")
        void shouldDenyFrontDeskSensitive() {
            assertThatThrownBy(() -> service.viewSensitive(RECEPTIONIST, patientId))
                    .isInstanceOf(PolicyDeniedException.class);

            assertThat(fixture.auditLog.entries()).hasSize(1);
            AuditEntry entry = fixture.auditLog.entries().get(0);
            assertThat(entry.getDecision()).isEqualTo(AuditEntry.Decision.DENY);
            assertThat(entry.getAction()).isEqualTo("VIEW_SENSITIVE_SUBSET");
            assertThat(entry.getEntityId()).isEqualTo(patientId);
        }

        @Test
        @DisplayName("Should mask the SSN for care support")
        void shouldMaskForCareSupport() {
            ProjectedView view = service.viewSensitive(NURSE, patientId);

            assertThat(view.get("ssn")).isEqualTo("***-**-6789");
            assertThat(view.get("medications")).isEqualTo(List.of("Lisinopril 10mg"));
        }

        @Test
        @DisplayName("Should audit a grant and a read for a successful view")
        void shouldAuditRead() {
            service.view(NURSE, patientId);

            assertThat(policyEntries()).hasSize(1);
            List<AuditEntry> reads = fixture.auditLog.entriesOfType(AuditEntry.EventType.DATA_READ);
            assertThat(reads).hasSize(1);
            assertThat(reads.get(0).getDetails()).containsEntry("recordCount", 1);
        }

        @Test
        @DisplayName("Should report a missing record")
        void shouldReportMissing() {
            assertThatThrownBy(() -> service.view(DOCTOR, "does-not-exist"))
                    .isInstanceOf(RecordNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("viewOwnRecord()")
    class ViewOwnRecordTest {

        @Test
        @DisplayName("Should let a patient read their own record with the SSN masked")
        void shouldShowOwnRecord() {
            Principal self = Principal.patientSelf("u-pat", "john", patientId);

            ProjectedView view = service.viewOwnRecord(self, patientId);

            assertThat(view.get("diagnosis")).isEqualTo(List.of("Hypertension"));
            assertThat(view.get("ssn")).isEqualTo("***-**-6789");
            assertThat(view.has("notes")).isFalse();
        }

        @Test
        @DisplayName("Should refuse another patient's record")
        void shouldRefuseOtherRecord() {
            Principal other = Principal.patientSelf("u-other", "jane", "p-other");

            assertThatThrownBy(() -> service.viewOwnRecord(other, patientId))
                    .isInstanceOf(PolicyDeniedException.class);
        }

        @Test
        @DisplayName("Should refuse a request without a record id")
        void shouldRequireRecordId() {
            Principal self = Principal.patientSelf("u-pat", "john", patientId);

            assertThatThrownBy(() -> service.viewOwnRecord(self, null))
                    .isInstanceOf(MissingSubjectException.class);
        }
    }

    @Nested
    @DisplayName("update() / updateClinical() / delete()")
    class MutationTest {

        @Test
        @DisplayName("Should update demographics and keep clinical data")
        void shouldUpdateDemographics() {
            service.update(NURSE, patientId,
                    new PatientDemographics(null, "Smythe", null, null, null));

            ProjectedView view = service.viewSensitive(DOCTOR, patientId);
            assertThat(view.get("lastName")).isEqualTo("Smythe");
            assertThat(view.get("diagnosis")).isEqualTo(List.of("Hypertension"));
        }

        @Test
        @DisplayName("Should let the front desk and clinicians edit insurance")
        void shouldUpdateInsurance() {
            service.updateInsurance(RECEPTIONIST, patientId, Map.of("provider", "Beta Mutual", "policyNumber", "BM-42"));
            ProjectedView view = service.updateInsurance(DOCTOR, patientId,
                    Map.of("provider", "Beta Mutual", "policyNumber", "BM-43"));

            assertThat(view.get("insuranceDetails")).isEqualTo(Map.of("provider", "Beta Mutual", "policyNumber", "BM-43"));
            List<AuditEntry> updates = fixture.auditLog.entriesOfType(AuditEntry.EventType.DATA_UPDATE);
            assertThat(updates).extracting(AuditEntry::getAction).containsExactly("EDIT_INSURANCE", "EDIT_INSURANCE");
            assertThat(updates.get(0).getDetails()).containsEntry("changedFields", List.of("insuranceDetails"));
        }

        @Test
        @DisplayName("Should refuse insurance edits from care support")
        void shouldRefuseNurseInsuranceEdit() {
            assertThatThrownBy(() -> service.updateInsurance(NURSE, patientId, Map.of("provider", "Beta Mutual")))
                    .isInstanceOf(PolicyDeniedException.class);

            Patient stored = fixture.patientCodec.fromStorage(fixture.store.raw("patients", patientId));
            assertThat(stored.getInsuranceDetails()).containsEntry("provider", "Acme Health");
        }

        @Test
        @DisplayName("Should append a clinical note to the history")
        void shouldAppendNote() {
            service.updateClinical(DOCTOR, patientId, new ClinicalUpdate(null, null, null, "Blood pressure stable"));
            service.updateClinical(DOCTOR, patientId, new ClinicalUpdate(null, List.of("Hypertension", "Type 2 diabetes"),
                    null, "Started metformin"));

            Patient stored = fixture.patientCodec.fromStorage(fixture.store.raw("patients", patientId));
            assertThat(stored.getNotes()).isEqualTo("Started metformin");
            assertThat(stored.getNotesHistory()).hasSize(2);
            assertThat(stored.getNotesHistory().get(0).authorId()).isEqualTo("u-doc");
            assertThat(stored.getDiagnosis()).containsExactly("Hypertension", "Type 2 diabetes");
        }

        @Test
        @DisplayName("Should refuse clinical edits from care support")
        void shouldRefuseNurseClinicalEdit() {
            assertThatThrownBy(() -> service.updateClinical(NURSE, patientId, new ClinicalUpdate("000-00-0000", null, null, null)))
                    .isInstanceOf(PolicyDeniedException.class);
        }

        @Test
        @DisplayName("Should delete for clinicians only")
        void shouldDelete() {
            assertThatThrownBy(() -> service.delete(ADMIN, patientId)).isInstanceOf(PolicyDeniedException.class);

            service.delete(DOCTOR, patientId);

            assertThat(fixture.store.size("patients")).isZero();
            assertThat(fixture.auditLog.entriesOfType(AuditEntry.EventType.DATA_DELETE)).hasSize(1);
            assertThatThrownBy(() -> service.delete(DOCTOR, patientId)).isInstanceOf(RecordNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("importPatients()")
    class ImportTest {

        private Patient record(String firstName, String lastName, String email) {
            Patient patient = PhiCoreFixture.samplePatient();
            patient.setFirstName(firstName);
            patient.setLastName(lastName);
            patient.setEmail(email);
            return patient;
        }

        @Test
        @DisplayName("Should encrypt imported records and skip incomplete ones and known emails")
        void shouldImportPatients() {
            PatientImportResult result = service.importPatients(DOCTOR, List.of(
                    record("Ada", "Lovelace", "ada@example.com"),
                    record("Grace", null, "grace@example.com"),
                    record("John", "Smith", "john.smith@example.com"),
                    record("Alan", "Turing", "alan@example.com")));

            assertThat(result.total()).isEqualTo(4);
            assertThat(result.imported()).isEqualTo(2);
            assertThat(result.skipped()).isEqualTo(2);
            assertThat(result.errors()).containsExactly("Record 2: missing first name, last name or email");
            assertThat(fixture.store.size("patients")).isEqualTo(3);
            List<ProjectedView> found = service.findByLastName(DOCTOR, "Lovelace");
            assertThat(found).hasSize(1);
            Document stored = fixture.store.raw("patients", (String) found.get(0).get("id"));
            assertThat(stored.get("email")).isInstanceOf(Binary.class);
            assertThat(stored.get("diagnosis")).isInstanceOf(Binary.class);
        }

        @Test
        @DisplayName("Should write one audit entry for the whole batch")
        void shouldAuditOnce() {
            service.importPatients(DOCTOR, List.of(
                    record("Ada", "Lovelace", "ada@example.com"),
                    record("Alan", "Turing", "alan@example.com")));

            List<AuditEntry> creates = fixture.auditLog.entriesOfType(AuditEntry.EventType.DATA_CREATE);
            assertThat(creates).hasSize(1);
            assertThat(creates.get(0).getAction()).isEqualTo("IMPORT");
            assertThat(creates.get(0).getDetails()).containsEntry("imported", 2).containsEntry("skipped", 0);
        }

        @Test
        @DisplayName("Should allow import for clinicians only")
        void shouldRestrictToClinicians() {
            for (Principal caller : List.of(NURSE, RECEPTIONIST, ADMIN)) {
                assertThatThrownBy(() -> service.importPatients(caller, List.of(record("Ada", "Lovelace", "ada@example.com"))))
                        .isInstanceOf(PolicyDeniedException.class);
            }
            assertThat(fixture.store.size("patients")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("search")
    class SearchTest {

        @BeforeEach
        void addPatients() {
            Patient other = PhiCoreFixture.samplePatient();
            other.setLastName("Jones");
            other.setBirthDate(LocalDate.of(1992, 7, 4));
            service.create(DOCTOR, other);
            Patient smithJunior = PhiCoreFixture.samplePatient();
            smithJunior.setFirstName("Jack");
            smithJunior.setBirthDate(LocalDate.of(2010, 3, 3));
            service.create(DOCTOR, smithJunior);
            fixture.auditLog.clear();
        }

        @Test
        @DisplayName("Should find patients by exact last name")
        void shouldFindByLastName() {
            List<ProjectedView> found = service.findByLastName(RECEPTIONIST, "Smith");

            assertThat(found).extracting(v -> v.get("firstName")).containsExactlyInAnyOrder("John", "Jack");
            assertThat(found).allSatisfy(v -> assertThat(v.has("diagnosis")).isFalse());
            assertThat(service.findByLastName(RECEPTIONIST, "smith")).isEmpty();
        }

        @Test
        @DisplayName("Should find patients by birth date range, inclusive")
        void shouldFindByBirthDateRange() {
            List<ProjectedView> eighties = service.findByBirthDateRange(DOCTOR,
                    LocalDate.of(1980, 1, 15), LocalDate.of(1992, 7, 4));
            List<ProjectedView> openEnded = service.findByBirthDateRange(DOCTOR, LocalDate.of(2000, 1, 1), null);

            assertThat(eighties).extracting(v -> v.get("lastName")).containsExactly("Smith", "Jones");
            assertThat(openEnded).extracting(v -> v.get("firstName")).containsExactly("Jack");
        }

        @Test
        @DisplayName("Should reject an inverted range")
        void shouldRejectInvertedRange() {
            assertThatThrownBy(() -> service.findByBirthDateRange(DOCTOR, LocalDate.of(2000, 1, 1), LocalDate.of(1990, 1, 1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should deny search to patients")
        void shouldDenyPatientSearch() {
            assertThatThrownBy(() -> service.findByLastName(Principal.patientSelf("u-pat", "john", patientId), "Smith"))
                    .isInstanceOf(PolicyDeniedException.class);
        }

        @Test
        @DisplayName("Should list records up to the limit")
        void shouldList() {
            assertThat(service.list(NURSE, 2)).hasSize(2);
            assertThat(service.list(NURSE, 0)).hasSize(3);
        }
    }
}
