package com.powerguard.core.history;

import com.powerguard.core.model.ExecutionResult;
import com.powerguard.core.model.ExecutionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcOutcomeRecorderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private DriverManagerDataSource dataSource;
    private JdbcOutcomeRecorder recorder;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = new DriverManagerDataSource("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        recorder = new JdbcOutcomeRecorder(dataSource, Clock.fixed(NOW, ZoneOffset.UTC));
        recorder.createTables();
    }

    @Test
    @DisplayName("recorded outcomes are read back newest first")
    void roundTrip() {
        var completed = Instant.parse("2026-03-01T10:15:29Z");
        recorder.record("B1", new ExecutionResult("a", ExecutionStatus.SUCCESS, "standby bucket set", completed));
        recorder.record("B1", new ExecutionResult("b", ExecutionStatus.FAILED, "capability unavailable", completed));

        List<OutcomeEntry> entries = recorder.recent(10);

        assertEquals(2, entries.size());
        OutcomeEntry newest = entries.get(0);
        assertEquals("b", newest.result().actionableId());
        assertEquals(ExecutionStatus.FAILED, newest.result().status());
        assertEquals("capability unavailable", newest.result().detail());
        assertEquals(completed, newest.result().completedAt());
        assertEquals(NOW, newest.recordedAt());
        assertEquals("B1", newest.batchId());
        assertTrue(newest.sequence() > entries.get(1).sequence());
    }

    @Test
    @DisplayName("the generated id is returned as the sequence")
    void sequenceFromIdentity() {
        OutcomeEntry first = recorder.record("B1", ExecutionResult.success("a", "ok"));
        OutcomeEntry second = recorder.record(ExecutionResult.success("b", "ok"));

        assertTrue(first.sequence() > 0);
        assertEquals(first.sequence() + 1, second.sequence());
        assertNull(recorder.recent(1).get(0).batchId());
    }

    @Test
    @DisplayName("overlong details are truncated rather than rejected")
    void truncatesDetail() {
        recorder.record("B1", ExecutionResult.failed("a", "x".repeat(5000)));

        String stored = recorder.recent(1).get(0).result().detail();
        assertEquals(2000, stored.length());
        assertTrue(stored.endsWith("..."));
    }

    @Test
    @DisplayName("the limit caps the number of rows")
    void limit() {
        for (int i = 0; i < 5; i++) {
            recorder.record("B1", ExecutionResult.success("a" + i, "ok"));
        }

        assertEquals(3, recorder.recent(3).size());
        assertTrue(recorder.recent(0).isEmpty());
    }

    @Test
    @DisplayName("createTables is idempotent")
    void createTablesTwice() throws SQLException {
        recorder.record("B1", ExecutionResult.success("a", "ok"));

        recorder.createTables();

        assertEquals(1, recorder.recent(10).size());
    }

    @Test
    @DisplayName("a write to a missing table raises OutcomeRecordingException")
    void writeFailure() {
        var unprepared = new DriverManagerDataSource("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        var broken = new JdbcOutcomeRecorder(unprepared);

        assertThrows(OutcomeRecordingException.class, () -> broken.record("B1", ExecutionResult.success("a", "ok")));
        assertTrue(broken.recent(10).isEmpty());
    }
}
