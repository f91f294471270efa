package com.securehealth.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.securehealth.exception.AuditWriteFailureException;
import com.securehealth.model.EntityType;
import com.securehealth.model.Principal;
import com.securehealth.model.Role;
import com.securehealth.policy.Action;
import com.securehealth.policy.PolicyDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MongoAuditLogWriterTest {

    private MongoTemplate mongoTemplate;
    private MongoAuditLogWriter writer;

    @BeforeEach
    void setUp() {
        this.mongoTemplate = mock(MongoTemplate.class);
        this.writer = new MongoAuditLogWriter(this.mongoTemplate, new ObjectMapper());
        ReflectionTestUtils.setField(this.writer, "maxAttempts", 3);
        ReflectionTestUtils.setField(this.writer, "initialBackoffMs", 0L);
    }

    private static AuditEntry denyEntry() {
        Principal desk = Principal.staff("u-desk", "front.desk", Role.FRONT_DESK);
        return AuditEntry.policyDecision(desk, EntityType.PATIENT, Action.VIEW_SENSITIVE_SUBSET, "p-1",
                PolicyDecision.abstain("No rule"));
    }

    @Nested
    @DisplayName("append()")
    class AppendTest {

        @Test
        @DisplayName("Should insert into the audit collection and never save")
        void shouldInsertOnly() {
            AuditEntry entry = denyEntry();

            writer.append(entry);

            verify(mongoTemplate).insert(entry, "audit_log");
            verify(mongoTemplate, never()).save(any(), anyString());
        }

        @Test
        @DisplayName("Should retry a transient failure")
        void shouldRetry() {
            AuditEntry entry = denyEntry();
            when(mongoTemplate.insert(entry, "audit_log"))
                    .thenThrow(new DataAccessResourceFailureException("timeout"))
                    .thenReturn(entry);

            writer.append(entry);

            verify(mongoTemplate, times(2)).insert(entry, "audit_log");
        }

        @Test
        @DisplayName("Should treat a duplicate id on retry as the earlier attempt having committed")
        void shouldNotDuplicateAfterLostAcknowledgement() {
            AuditEntry entry = denyEntry();
            String id = entry.getId();
            when(mongoTemplate.insert(entry, "audit_log"))
                    .thenThrow(new DataAccessResourceFailureException("socket timeout"))
                    .thenThrow(new DuplicateKeyException("E11000 duplicate key error collection: audit_log"));

            writer.append(entry);

            verify(mongoTemplate, times(2)).insert(entry, "audit_log");
            assertThat(entry.getId()).isEqualTo(id);
        }

        @Test
        @DisplayName("Should fail closed after the configured attempts")
        void shouldFailClosed() {
            AuditEntry entry = denyEntry();
            when(mongoTemplate.insert(any(AuditEntry.class), eq("audit_log")))
                    .thenThrow(new DataAccessResourceFailureException("no primary"));

            assertThatThrownBy(() -> writer.append(entry))
                    .isInstanceOf(AuditWriteFailureException.class)
                    .hasCauseInstanceOf(DataAccessResourceFailureException.class);
            verify(mongoTemplate, times(3)).insert(entry, "audit_log");
        }
    }

    @Nested
    @DisplayName("query()")
    class QueryTest {

        @Test
        @DisplayName("Should cap the page size and sort newest first")
        void shouldCapLimit() {
            writer.query(new AuditQuery(null, null, "VIEW", "PATIENT", null, 10_000));

            ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
            verify(mongoTemplate).find(captor.capture(), eq(AuditEntry.class), eq("audit_log"));
            Query query = captor.getValue();
            assertThat(query.getLimit()).isEqualTo(AuditQuery.MAX_LIMIT);
            assertThat(query.getSortObject().get("timestamp")).isEqualTo(-1);
            assertThat(query.getQueryObject().toJson()).contains("VIEW").contains("PATIENT");
        }

        @Test
        @DisplayName("Should apply the default limit for non-positive values")
        void shouldDefaultLimit() {
            assertThat(AuditQuery.recent(0).limit()).isEqualTo(AuditQuery.DEFAULT_LIMIT);
            assertThat(AuditQuery.recent(-5).limit()).isEqualTo(AuditQuery.DEFAULT_LIMIT);
        }
    }

    @Nested
    @DisplayName("stats()")
    class StatsTest {

        @Test
        @DisplayName("Should combine totals from the audit collection")
        void shouldCountEntries() {
            when(mongoTemplate.count(any(Query.class), eq(AuditEntry.class), eq("audit_log"))).thenReturn(4L);

            AuditStats stats = writer.stats();

            assertThat(stats.total()).isEqualTo(4L);
            assertThat(stats.deniesLast24Hours()).isEqualTo(4L);
        }
    }

    @Nested
    @DisplayName("toStructuredLog()")
    class StructuredLogTest {

        @Test
        @DisplayName("Should carry the decision fields and no actor name")
        void shouldBuildLogLine() {
            Map<String, Object> line = MongoAuditLogWriter.toStructuredLog(denyEntry());

            assertThat(line).containsEntry("actorId", "u-desk")
                    .containsEntry("action", "VIEW_SENSITIVE_SUBSET")
                    .containsEntry("entityId", "p-1")
                    .containsEntry("decision", AuditEntry.Decision.DENY)
                    .containsEntry("outcome", "NO_APPLICABLE_RULE")
                    .containsEntry("actorRoles", List.of("FRONT_DESK"))
                    .doesNotContainKey("actorName");
            assertThat(Set.copyOf(line.keySet())).contains("details");
        }
    }
}
