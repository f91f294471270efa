package com.securehealth.projection;

import com.securehealth.model.EntityType;
import com.securehealth.model.MedicalKnowledge;
import com.securehealth.model.Patient;
import com.securehealth.model.Role;
import com.securehealth.support.PhiCoreFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoleProjectionTest {

    private final RoleProjection projection = new RoleProjection(DefaultVisibilityRules.create());

    private static Patient patient() {
        Patient patient = PhiCoreFixture.samplePatient();
        patient.setId("p-1");
        return patient;
    }

    @Nested
    @DisplayName("project()")
    class ProjectTest {

        @Test
        @DisplayName("Should show clinicians the whole record")
        void shouldShowClinicianEverything() {
            ProjectedView view = projection.project(patient(), Set.of(Role.CLINICIAN));

            assertThat(view.get("ssn")).isEqualTo("123-45-6789");
            assertThat(view.get("diagnosis")).isEqualTo(List.of("Hypertension"));
            assertThat(view.has("primaryDoctorId")).isTrue();
        }

        @Test
        @DisplayName("Should omit clinical fields and the SSN for front desk")
        void shouldShapeFrontDeskView() {
            ProjectedView view = projection.project(patient(), Set.of(Role.FRONT_DESK));

            assertThat(view.get("lastName")).isEqualTo("Smith");
            assertThat(view.has("diagnosis")).isFalse();
            assertThat(view.has("medications")).isFalse();
            assertThat(view.has("notes")).isFalse();
            assertThat(view.has("ssn")).isFalse();
            assertThat(view.has("insuranceDetails")).isTrue();
        }

        @Test
        @DisplayName("Should never include a field the roles do not mention")
        void shouldOmitUnmentionedFields() {
            ProjectedView view = projection.project(patient(), Set.of(Role.FRONT_DESK));

            assertThat(view.has("primaryDoctorId")).isFalse();
            assertThat(view.has("ownerUserId")).isFalse();
        }

        @Test
        @DisplayName("Should give the most open visibility across roles")
        void shouldCombineRoles() {
            ProjectedView view = projection.project(patient(), EnumSet.of(Role.FRONT_DESK, Role.CARE_SUPPORT));

            assertThat(view.get("diagnosis")).isEqualTo(List.of("Hypertension"));
            assertThat(view.get("ssn")).isEqualTo("***-**-6789");
            assertThat(view.has("insuranceDetails")).isTrue();
        }

        @Test
        @DisplayName("Should let an administrator forbid override clinician visibility")
        void shouldApplyForbidAcrossRoles() {
            ProjectedView view = projection.project(patient(), EnumSet.of(Role.ADMINISTRATOR, Role.CLINICIAN));

            assertThat(view.has("ssn")).isFalse();
            assertThat(view.has("diagnosis")).isFalse();
            assertThat(view.has("primaryDoctorId")).isTrue();
            assertThat(view.get("lastName")).isEqualTo("Smith");
        }

        @Test
        @DisplayName("Should return nothing for an empty role set")
        void shouldProjectNothingWithoutRoles() {
            assertThat(projection.project(patient(), Set.of()).fieldNames()).isEmpty();
        }

        @Test
        @DisplayName("Should follow the declared field order")
        void shouldKeepDeclaredOrder() {
            ProjectedView view = projection.project(patient(), Set.of(Role.CLINICIAN));

            assertThat(view.fieldNames()).containsSubsequence("id", "firstName", "lastName", "email", "ssn", "diagnosis");
            assertThat(projection.project(patient(), Set.of(Role.CLINICIAN)).getFields()).isEqualTo(view.getFields());
        }

        @Test
        @DisplayName("Should not let a view change the entity's collections")
        void shouldDetachCollections() {
            Patient patient = patient();

            ProjectedView view = projection.project(patient, Set.of(Role.CLINICIAN));

            @SuppressWarnings("unchecked")
            List<String> diagnosis = (List<String>) view.get("diagnosis");
            @SuppressWarnings("unchecked")
            Map<String, Object> insurance = (Map<String, Object>) view.get("insuranceDetails");
            assertThatThrownBy(() -> diagnosis.add("Asthma")).isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> insurance.put("provider", "Other")).isInstanceOf(UnsupportedOperationException.class);
            patient.getDiagnosis().add("Asthma");
            assertThat(diagnosis).containsExactly("Hypertension");
            assertThat(patient.getInsuranceDetails()).containsEntry("provider", "Acme Health");
        }

        @Test
        @DisplayName("Should keep a masked null as null")
        void shouldKeepNullMasked() {
            Patient patient = patient();
            patient.setSsn(null);

            ProjectedView view = projection.project(patient, Set.of(Role.CARE_SUPPORT));

            assertThat(view.has("ssn")).isTrue();
            assertThat(view.get("ssn")).isNull();
        }

        @Test
        @DisplayName("Should show knowledge entries to staff")
        void shouldShowKnowledge() {
            MedicalKnowledge entry = new MedicalKnowledge();
            entry.setTitle("Asthma");

            assertThat(projection.project(entry, Set.of(Role.CARE_SUPPORT)).get("title")).isEqualTo("Asthma");
            assertThat(projection.project(entry, Set.of(Role.FRONT_DESK)).fieldNames()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Masker")
    class MaskerTest {

        @Test
        @DisplayName("Should keep only the last digits of identifiers")
        void shouldMaskIdentifiers() {
            assertThat(Masker.SSN.mask("123-45-6789")).isEqualTo("***-**-6789");
            assertThat(Masker.PHONE.mask("(555) 123-4567")).isEqualTo("***-***-4567");
            assertThat(Masker.SSN.mask("12")).isEqualTo("***-**-****");
        }

        @Test
        @DisplayName("Should keep the first letter and the domain of an email")
        void shouldMaskEmail() {
            assertThat(Masker.EMAIL.mask("john.smith@example.com")).isEqualTo("j***@example.com");
            assertThat(Masker.EMAIL.mask("not-an-email")).isEqualTo(Masker.OPAQUE);
        }

        @Test
        @DisplayName("Should use the opaque mask for unconfigured fields")
        void shouldDefaultToOpaque() {
            FieldVisibilityTable table = DefaultVisibilityRules.create();

            assertThat(table.maskerFor(EntityType.PATIENT, "diagnosis").mask(List.of("x"))).isEqualTo(Masker.OPAQUE);
        }

        @Test
        @DisplayName("Should never return the plaintext as its mask")
        void shouldNotRevealPlaintext() {
            FieldVisibilityTable table = FieldVisibilityTable.builder()
                    .masked(EntityType.PATIENT, Role.FRONT_DESK, "notes")
                    .build();
            Patient patient = new Patient();
            patient.setNotes(Masker.OPAQUE);

            Object masked = new RoleProjection(table).project(patient, Set.of(Role.FRONT_DESK)).get("notes");

            assertThat(masked).isNotEqualTo(Masker.OPAQUE);
        }
    }
}
