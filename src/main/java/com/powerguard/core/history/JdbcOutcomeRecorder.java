package com.powerguard.core.history;

import com.powerguard.core.model.ExecutionResult;
import com.powerguard.core.model.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link OutcomeRecorder} backed by a JDBC table. Only ever INSERTs and SELECTs.
 * <p>
 * The table {@code actionable_outcomes} is created by {@link #createTables()}. The DDL
 * sticks to SQL both PostgreSQL and H2 accept.
 */
public class JdbcOutcomeRecorder implements OutcomeRecorder {

    private static final Logger log = LoggerFactory.getLogger(JdbcOutcomeRecorder.class);

    static final String TABLE_NAME = "actionable_outcomes";

    private static final int MAX_DETAIL_LENGTH = 2000;

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id            BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                batch_id      VARCHAR(64),
                actionable_id VARCHAR(255) NOT NULL,
                status        VARCHAR(16) NOT NULL,
                detail        VARCHAR(2000),
                completed_at  TIMESTAMP NOT NULL,
                recorded_at   TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (batch_id, actionable_id, status, detail, completed_at, recorded_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_RECENT_SQL = """
            SELECT id, batch_id, actionable_id, status, detail, completed_at, recorded_at
            FROM %s
            ORDER BY recorded_at DESC, id DESC
            FETCH FIRST ? ROWS ONLY
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcOutcomeRecorder(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public JdbcOutcomeRecorder(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = clock;
    }

    /**
     * Creates the outcome table if it does not already exist. Called once at startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Outcome table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public OutcomeEntry record(String batchId, ExecutionResult result) {
        Instant recordedAt = clock.instant();
        String detail = truncate(result.detail());
        Instant completedAt = result.completedAt() != null ? result.completedAt() : recordedAt;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, batchId);
            stmt.setString(2, result.actionableId());
            stmt.setString(3, result.status().name());
            stmt.setString(4, detail);
            stmt.setTimestamp(5, Timestamp.from(completedAt));
            stmt.setTimestamp(6, Timestamp.from(recordedAt));
            stmt.executeUpdate();

            long sequence = 0;
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (keys.next()) {
                    sequence = keys.getLong(1);
                }
            }
            log.debug("Recorded outcome {} for actionable '{}' ({})", sequence, result.actionableId(), result.status());
            return new OutcomeEntry(sequence, batchId, result, recordedAt);
        } catch (SQLException e) {
            throw new OutcomeRecordingException(
                    "Failed to record outcome for actionable '%s'".formatted(result.actionableId()), e);
        }
    }

    @Override
    public List<OutcomeEntry> recent(int limit) {
        List<OutcomeEntry> entries = new ArrayList<>();
        if (limit <= 0) {
            return entries;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT_SQL)) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read recent outcomes", e);
        }
        return entries;
    }

    private static OutcomeEntry fromResultSet(ResultSet rs) throws SQLException {
        var result = new ExecutionResult(
                rs.getString("actionable_id"),
                ExecutionStatus.valueOf(rs.getString("status")),
                rs.getString("detail"),
                rs.getTimestamp("completed_at").toInstant());
        return new OutcomeEntry(
                rs.getLong("id"),
                rs.getString("batch_id"),
                result,
                rs.getTimestamp("recorded_at").toInstant());
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= MAX_DETAIL_LENGTH) {
            return detail;
        }
        return detail.substring(0, MAX_DETAIL_LENGTH - 3) + "...";
    }
}
