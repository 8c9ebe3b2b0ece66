package foldrun.coordinator.sink;

import foldrun.coordinator.model.JobCompletion;
import foldrun.coordinator.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

/**
 * JDBC implementation of PersistenceSink (table {@code fold_results}).
 */
public class JdbcPersistenceSink implements PersistenceSink {

    private static final Logger log = LoggerFactory.getLogger(JdbcPersistenceSink.class);

    static final String SUCCEEDED = "succeeded";

    private final Database db;

    public JdbcPersistenceSink(Database db) {
        this.db = db;
    }

    @Override
    public void upsert(JobCompletion completion) {
        String update = """
                    UPDATE fold_results
                    SET status = ?, sequence = ?, protocol = ?, engine = ?, artifact_content = ?,
                        energy = ?, completed_at = ?, updated_at = ?
                    WHERE job_id = ?
                """;
        String insert = """
                    INSERT INTO fold_results
                        (status, sequence, protocol, engine, artifact_content, energy, completed_at, updated_at, job_id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(update)) {
                    bind(ps, completion);
                    updated = ps.executeUpdate();
                }
                if (updated == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insert)) {
                        bind(ps, completion);
                        ps.executeUpdate();
                    }
                }
                conn.commit();
                log.debug("Mirrored result of job {} (energy {})", completion.jobId(), completion.energy());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new PersistenceSinkException("Failed to mirror result of job " + completion.jobId(), e);
        }
    }

    private static void bind(PreparedStatement ps, JobCompletion c) throws SQLException {
        ps.setString(1, SUCCEEDED);
        ps.setString(2, c.input().sequence());
        ps.setString(3, c.input().params().protocol().wireName());
        ps.setString(4, c.engine());
        ps.setString(5, c.artifactContent());
        if (c.energy() != null) {
            ps.setDouble(6, c.energy());
        } else {
            ps.setNull(6, Types.DOUBLE);
        }
        ps.setTimestamp(7, Timestamp.from(c.completedAt() != null ? c.completedAt() : Instant.now()));
        ps.setTimestamp(8, Timestamp.from(Instant.now()));
        ps.setString(9, c.jobId());
    }

    @Override
    public boolean isHealthy() {
        return db.isHealthy();
    }
}
